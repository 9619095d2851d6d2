package my.MhtBuilder.runtime.http;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/*
 * Serves canned resources by URL and counts requests
 */
public class FakeTransport implements Transport
{
    private final Map<String, FetchResult> resources = new HashMap<>();
    private final Map<String, Integer> counts = new HashMap<>();
    private final Map<String, String> conditions = new HashMap<>();
    private final Map<String, String> dates = new HashMap<>();

    public FakeTransport add(String url, String contentType, byte[] body)
    {
        return add(url, contentType, body, null);
    }

    public FakeTransport add(String url, String contentType, byte[] body, String contentLocation)
    {
        resources.put(url, new FetchResult(body, contentType, contentLocation, CharsetDetector.detect(contentType, body)));
        return this;
    }

    public FakeTransport addHtml(String url, String html)
    {
        return add(url, "text/html; charset=utf-8", html.getBytes(StandardCharsets.UTF_8));
    }

    public FakeTransport addCss(String url, String css)
    {
        return add(url, "text/css", css.getBytes(StandardCharsets.US_ASCII));
    }

    /*
     * Answer 304 to conditional requests for @url made with @lastModified
     */
    public FakeTransport notModifiedSince(String url, String lastModified)
    {
        dates.put(url, lastModified);
        return this;
    }

    @Override
    public FetchResult fetch(String url, String ifModifiedSince) throws TransportException
    {
        counts.merge(url, 1, Integer::sum);

        if (ifModifiedSince != null)
        {
            conditions.put(url, ifModifiedSince);
            if (ifModifiedSince.equals(dates.get(url)))
                throw new TransportException(url, 304, "Not Modified");
        }

        FetchResult r = resources.get(url);
        if (r == null)
            throw new TransportException(url, 404, "Not Found");

        return r;
    }

    public int fetchCount(String url)
    {
        return counts.getOrDefault(url, 0);
    }

    public String ifModifiedSince(String url)
    {
        return conditions.get(url);
    }

    public int totalFetches()
    {
        int total = 0;
        for (int n : counts.values())
            total += n;
        return total;
    }
}
