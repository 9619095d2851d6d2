package my.MhtBuilder.runtime.http;

public class TransportException extends Exception
{
    private static final long serialVersionUID = 1L;

    public static final int NO_STATUS = -1;

    private final String url;
    private final int statusCode;

    public TransportException(String url, int statusCode, String reason)
    {
        super("HTTP status " + statusCode + (reason != null ? " " + reason : "") + " for " + url);
        this.url = url;
        this.statusCode = statusCode;
    }

    public TransportException(String url, Throwable cause)
    {
        super("Unable to fetch " + url + ": " + cause.getLocalizedMessage(), cause);
        this.url = url;
        this.statusCode = NO_STATUS;
    }

    public String getUrl()
    {
        return url;
    }

    public int getStatusCode()
    {
        return statusCode;
    }

    public boolean isNotModified()
    {
        return statusCode == 304;
    }

    public boolean isNetworkError()
    {
        return statusCode == NO_STATUS && NetErrors.isNetworkException(getCause());
    }
}
