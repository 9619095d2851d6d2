package my.MhtBuilder.errors;

/*
 * HTML-only (or HTML/CSS-only) operation invoked on a resource of another type
 */
public class NotHtmlOperationException extends MhtException
{
    private static final long serialVersionUID = 1L;

    private final String url;
    private final String contentType;

    public NotHtmlOperationException(String operation, String url, String contentType)
    {
        super(operation + " is not applicable to " + url + " of type " + contentType);
        this.url = url;
        this.contentType = contentType;
    }

    public String getUrl()
    {
        return url;
    }

    public String getContentType()
    {
        return contentType;
    }
}
