package my.MhtBuilder.runtime.url;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import my.MhtBuilder.errors.InvalidUrlException;

/**
 * Canonical form of resource URLs and their root and folder components.
 *
 * <p>
 * For "http://www.site.com/dir/page.html" the root is "http://www.site.com" and the folder is
 * "http://www.site.com/dir". Both never carry a trailing slash.
 */
public class UrlResolver
{
    /* trailing "#jump" after the last path segment */
    private static final Pattern FRAGMENT = Pattern.compile("/[^/]*?(#[^/?.]+$)");

    private static final Pattern ROOT = Pattern.compile("https?://[^/'\"]+", Pattern.CASE_INSENSITIVE);

    public static class Decomposed
    {
        public final String root;
        public final String folder;

        public Decomposed(String root, String folder)
        {
            this.root = root;
            this.folder = folder;
        }
    }

    public static String resolve(String raw) throws InvalidUrlException
    {
        return resolve(raw, true);
    }

    /*
     * With @validate == false the URL is taken as is.
     * Server-reported content locations are already canonical.
     */
    public static String resolve(String raw, boolean validate) throws InvalidUrlException
    {
        if (!validate)
            return raw;

        if (raw == null)
            throw new InvalidUrlException(raw);

        String url = canonical(raw.trim());
        return stripFragment(url);
    }

    public static String stripFragment(String url)
    {
        if (url.indexOf('#') == -1)
            return url;

        Matcher m = FRAGMENT.matcher(url);
        if (m.find())
            url = url.substring(0, m.start(1));

        return url;
    }

    private static String canonical(String raw) throws InvalidUrlException
    {
        URI uri;

        try
        {
            uri = new URI(raw);
        }
        catch (URISyntaxException ex)
        {
            throw new InvalidUrlException(raw, ex);
        }

        if (!uri.isAbsolute() || uri.isOpaque() || uri.getRawAuthority() == null)
            throw new InvalidUrlException(raw);

        uri = uri.normalize();

        String path = uri.getRawPath();
        if (path == null || path.isEmpty())
        {
            StringBuilder sb = new StringBuilder();
            sb.append(uri.getScheme()).append("://").append(uri.getRawAuthority()).append("/");
            if (uri.getRawQuery() != null)
                sb.append("?").append(uri.getRawQuery());
            if (uri.getRawFragment() != null)
                sb.append("#").append(uri.getRawFragment());
            return sb.toString();
        }

        return uri.toString();
    }

    public static Decomposed decompose(String url)
    {
        String root = urlRoot(url);
        return new Decomposed(root, urlFolder(url, root));
    }

    /*
     * Scheme and host, e.g. "https://www.site.com"
     */
    public static String urlRoot(String url)
    {
        if (url == null)
            return "";

        Matcher m = ROOT.matcher(url);
        if (m.find())
            return m.group();
        else
            return "";
    }

    private static String urlFolder(String url, String root)
    {
        int k = url.lastIndexOf('/');
        if (k > 7)
            return url.substring(0, k);
        else
            return root;
    }
}
