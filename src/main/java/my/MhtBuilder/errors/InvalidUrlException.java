package my.MhtBuilder.errors;

/*
 * URL is not a well-formed absolute URI
 */
public class InvalidUrlException extends MhtException
{
    private static final long serialVersionUID = 1L;

    private final String url;

    public InvalidUrlException(String url)
    {
        super("Invalid URL: " + url);
        this.url = url;
    }

    public InvalidUrlException(String url, Throwable cause)
    {
        super("Invalid URL: " + url, cause);
        this.url = url;
    }

    public String getUrl()
    {
        return url;
    }
}
