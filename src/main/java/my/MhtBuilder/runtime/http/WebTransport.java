package my.MhtBuilder.runtime.http;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.Charset;
import java.util.List;

import org.apache.commons.io.IOUtils;
import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.client.CookieStore;
import org.apache.http.client.CredentialsProvider;
import org.apache.http.client.config.CookieSpecs;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.protocol.HttpClientContext;
import org.apache.http.client.utils.URIUtils;
import org.apache.http.impl.client.BasicCookieStore;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.DefaultHttpRequestRetryHandler;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.client.LaxRedirectStrategy;
import org.apache.http.impl.conn.DefaultProxyRoutePlanner;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.brotli.dec.BrotliInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.airlift.compress.zstd.ZstdInputStream;

import my.MhtBuilder.Config;
import my.MhtBuilder.runtime.file.FileTypeDetector;

// GZIP and deflate: decoded by Apache HttpClient itself
// br and zstd: decoded here

/**
 * {@link Transport} over Apache HttpClient 4.
 */
public class WebTransport implements Transport, Closeable
{
    private static final Logger logger = LoggerFactory.getLogger(WebTransport.class);

    private final PoolingHttpClientConnectionManager connManager;
    private final CloseableHttpClient httpClient;
    private final CookieStore cookieStore;

    private static class Response
    {
        public int code;
        public String reason;
        public byte[] binaryBody;
        /* final URL after redirects */
        public String finalUrl;
        public String contentType;
        public Header[] headers;

        public String getHeader(String name)
        {
            if (headers != null)
            {
                for (Header h : headers)
                {
                    if (h.getName().equalsIgnoreCase(name))
                        return h.getValue();
                }
            }

            return null;
        }
    }

    /*
     * Settings are taken from Config
     */
    public WebTransport() throws Exception
    {
        cookieStore = Config.KeepCookies ? new BasicCookieStore() : null;

        connManager = new PoolingHttpClientConnectionManager();
        connManager.setMaxTotal(10);
        connManager.setDefaultMaxPerRoute(2);

        RequestConfig requestConfig = RequestConfig.custom()
                .setCookieSpec(Config.KeepCookies ? CookieSpecs.STANDARD : CookieSpecs.IGNORE_COOKIES)
                .setConnectTimeout(Config.WebConnectTimeout) // Time to establish TCP connection
                .setSocketTimeout(Config.WebSocketTimeout) // Time waiting for data read on the socket after connection established
                .setConnectionRequestTimeout(0) // Time to get connection from pool (infinite)
                .setCircularRedirectsAllowed(true)
                .setMaxRedirects(Config.WebMaxRedirects)
                .build();

        HttpClientBuilder hcb = HttpClients.custom()
                .setConnectionManager(connManager)
                .setDefaultRequestConfig(requestConfig)
                .setRetryHandler(new DefaultHttpRequestRetryHandler(Config.WebMaxRetries, true)) // Retry on IOException
                .setRedirectStrategy(new LaxRedirectStrategy());

        if (cookieStore != null)
            hcb = hcb.setDefaultCookieStore(cookieStore);

        CredentialsProvider credentials = new BasicCredentialsProvider();
        boolean hasCredentials = false;

        if (Config.Proxy != null)
        {
            URL url = new URL(Config.Proxy);
            HttpHost proxy = new HttpHost(url.getHost(), url.getPort(), url.getProtocol());
            hcb = hcb.setRoutePlanner(new DefaultProxyRoutePlanner(proxy));

            if (Config.ProxyUser != null)
            {
                credentials.setCredentials(new AuthScope(proxy.getHostName(), proxy.getPort()),
                        new UsernamePasswordCredentials(Config.ProxyUser, Config.ProxyPassword));
                hasCredentials = true;
            }
        }

        if (Config.AuthUser != null)
        {
            credentials.setCredentials(AuthScope.ANY, new UsernamePasswordCredentials(Config.AuthUser, Config.AuthPassword));
            hasCredentials = true;
        }

        if (hasCredentials)
            hcb = hcb.setDefaultCredentialsProvider(credentials);

        httpClient = hcb.build();
    }

    @Override
    public void close() throws IOException
    {
        httpClient.close();
        connManager.shutdown();
    }

    /* ============================================================================== */

    @Override
    public FetchResult fetch(String url, String ifModifiedSince) throws TransportException
    {
        Response r = get(url, ifModifiedSince);

        if (r.code == 304)
            throw new TransportException(url, r.code, r.reason);

        if (r.code < 200 || r.code > 299)
            throw new TransportException(url, r.code, r.reason);

        String contentType = r.contentType;
        if (contentType == null || contentType.trim().isEmpty())
        {
            contentType = FileTypeDetector.mimeTypeFromActualFileContent(r.binaryBody);
            logger.debug("No Content-Type for {}, detected {}", url, contentType);
        }

        Charset charset = CharsetDetector.detect(contentType, r.binaryBody);

        return new FetchResult(r.binaryBody, contentType, contentLocation(url, r), charset);
    }

    /*
     * Content-Location header resolved against the final URL, or the final URL itself if there was a redirect
     */
    private String contentLocation(String url, Response r)
    {
        String location = r.getHeader("Content-Location");

        try
        {
            if (location != null && !location.trim().isEmpty())
                return new URI(r.finalUrl != null ? r.finalUrl : url).resolve(location.trim()).toString();
        }
        catch (URISyntaxException | IllegalArgumentException ex)
        {
            logger.warn("Ignoring malformed Content-Location {} for {}", location, url);
        }

        if (r.finalUrl != null && !r.finalUrl.equals(url))
            return r.finalUrl;

        return null;
    }

    private Response get(String url, String ifModifiedSince) throws TransportException
    {
        final int maxpasses = Config.WebMaxRetries;

        for (int pass = 1;; pass++)
        {
            try
            {
                return get_retry(url, ifModifiedSince);
            }
            catch (Exception ex)
            {
                if (pass <= maxpasses && NetErrors.isRetriable(ex))
                {
                    logger.debug("Retrying {} after {}", url, NetErrors.describe(ex));
                    retryDelay(pass);
                    continue;
                }

                throw new TransportException(url, ex);
            }
        }
    }

    private static void retryDelay(int pass)
    {
        try
        {
            Thread.sleep(500 + 1000 * (pass + 1));
        }
        catch (InterruptedException ex)
        {
            Thread.currentThread().interrupt();
        }
    }

    private Response get_retry(String url, String ifModifiedSince) throws Exception
    {
        Response r = new Response();

        HttpGet request = new HttpGet(url);
        request.setHeader("User-Agent", Config.UserAgent);
        request.setHeader("Accept", Config.UserAgentAccept);
        request.setHeader("Accept-Encoding", Config.UserAgentAcceptEncoding);
        if (ifModifiedSince != null)
            request.setHeader("If-Modified-Since", ifModifiedSince);

        HttpClientContext context = HttpClientContext.create();

        logger.debug("GET {}", url);

        try (CloseableHttpResponse response = httpClient.execute(request, context))
        {
            r.code = response.getStatusLine().getStatusCode();
            r.reason = response.getStatusLine().getReasonPhrase();
            r.finalUrl = finalUrl(request, context);
            if (response.containsHeader("Content-Type"))
                r.contentType = response.getFirstHeader("Content-Type").getValue();
            r.headers = response.getAllHeaders();

            HttpEntity entity = response.getEntity();
            if (entity != null)
            {
                try (InputStream entityStream = entity.getContent())
                {
                    r.binaryBody = IOUtils.toByteArray(entityStream);
                }
                decompress(r);
            }
        }

        return r;
    }

    private static String finalUrl(HttpGet request, HttpClientContext context) throws URISyntaxException
    {
        HttpHost target = context.getTargetHost();
        List<URI> redirects = context.getRedirectLocations();

        URI finalUrl;
        if (redirects != null && !redirects.isEmpty())
            finalUrl = URIUtils.resolve(request.getURI(), target, redirects);
        else
            finalUrl = request.getURI();

        return finalUrl.toString();
    }

    /* ============================================================================== */

    private static void decompress(Response r) throws IOException
    {
        if (r == null || r.binaryBody == null || r.binaryBody.length == 0)
            return;

        String encoding = r.getHeader("Content-Encoding");
        if (encoding == null)
            return;

        encoding = encoding.trim().toLowerCase();

        InputStream decodedStream = null;
        switch (encoding)
        {
        case "br":
            decodedStream = new BrotliInputStream(new ByteArrayInputStream(r.binaryBody));
            break;

        case "zstd":
            decodedStream = new ZstdInputStream(new ByteArrayInputStream(r.binaryBody));
            break;

        default:
            // gzip and deflate are already handled by Apache
            return;
        }

        try (InputStream in = decodedStream)
        {
            r.binaryBody = IOUtils.toByteArray(in);
        }
    }
}
