package my.MhtBuilder.errors;

/*
 * Target path has no file name extension (or otherwise cannot be used as a file name)
 */
public class InvalidFileNameException extends MhtException
{
    private static final long serialVersionUID = 1L;

    private final String path;
    private final String allowedExtensions;

    public InvalidFileNameException(String path, String allowedExtensions)
    {
        this("Invalid file name " + path + ", expected one of " + allowedExtensions, path, allowedExtensions);
    }

    protected InvalidFileNameException(String msg, String path, String allowedExtensions)
    {
        super(msg);
        this.path = path;
        this.allowedExtensions = allowedExtensions;
    }

    public String getPath()
    {
        return path;
    }

    /*
     * Semicolon-separated, e.g. ".htm;.html"
     */
    public String getAllowedExtensions()
    {
        return allowedExtensions;
    }
}
