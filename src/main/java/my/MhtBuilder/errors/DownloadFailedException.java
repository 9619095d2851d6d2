package my.MhtBuilder.errors;

/*
 * Root resource could not be fetched
 */
public class DownloadFailedException extends MhtException
{
    private static final long serialVersionUID = 1L;

    private final String url;

    public DownloadFailedException(String url, Throwable cause)
    {
        super("Unable to download " + url + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
        this.url = url;
    }

    public String getUrl()
    {
        return url;
    }
}
