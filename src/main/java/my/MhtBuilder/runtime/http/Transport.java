package my.MhtBuilder.runtime.http;

/**
 * Source of resource bytes for the crawler.
 */
public interface Transport
{
    /**
     * Fetch resource at {@code url}.
     *
     * @param url
     *            absolute http(s) URL
     * @param ifModifiedSince
     *            value for the If-Modified-Since request header, or null
     * @return fetched bytes with their metadata, decompressed
     * @throws TransportException
     *             on network failure, non-2xx status, or 304 when {@code ifModifiedSince} was passed
     */
    FetchResult fetch(String url, String ifModifiedSince) throws TransportException;

    default FetchResult fetch(String url) throws TransportException
    {
        return fetch(url, null);
    }
}
