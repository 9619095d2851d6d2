package my.MhtBuilder.errors;

/*
 * Target path has an extension outside of the allowed list
 */
public class InvalidExtensionException extends InvalidFileNameException
{
    private static final long serialVersionUID = 1L;

    private final String extension;

    public InvalidExtensionException(String path, String extension, String allowedExtensions)
    {
        super("Invalid extension " + extension + " in " + path + ", expected one of " + allowedExtensions,
                path, allowedExtensions);
        this.extension = extension;
    }

    public String getExtension()
    {
        return extension;
    }
}
