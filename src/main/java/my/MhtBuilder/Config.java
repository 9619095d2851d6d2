package my.MhtBuilder;

import java.nio.charset.Charset;

public class Config
{
    /******************************/
    /** USER-SETTABLE PARAMETERS **/
    /******************************/

    /* Browser identification sent with every request */
    public static String UserAgent = "Mozilla/4.0 (compatible; MSIE 6.0; Windows NT 5.1; SV1)";
    public static String UserAgentAccept = "text/html, application/xhtml+xml, */*";
    public static final String UserAgentAcceptEncoding = "gzip, deflate, br, zstd";

    /* Web timeouts */
    public static int WebConnectTimeout = 1 * 60 * 1000;
    public static int WebSocketTimeout = 1 * 60 * 1000;
    public static final int WebMaxRedirects = 20;
    public static final int WebMaxRetries = 3;

    /* Proxy server, e.g. "http://proxy.xxx.com:8080" */
    public static String Proxy = null;
    public static String ProxyUser = null;
    public static String ProxyPassword = null;

    /* Credentials for sites that require basic authentication */
    public static String AuthUser = null;
    public static String AuthPassword = null;

    /* Keep cookies between requests of the same build */
    public static boolean KeepCookies = false;

    /* Encoding assumed for text resources that declare none */
    public static String DefaultEncoding = "windows-1252";

    /* Identification of the archive producer in the X-MimeOLE header */
    public static String GeneratorName = "my.MhtBuilder.Builder";
    public static String GeneratorVersion = "1.0";

    /* Maximum length of an HTML title used for subject lines and file names */
    public static final int MaxTitleLength = 50;

    /* MIME type of a finished archive */
    public static final String MhtContentType = "message/rfc822";

    /***************************/
    /** END OF USER-SETTABLE **/
    /***************************/

    public static final String SystemPropertyPrefix = "mhtbuilder.";

    /*
     * Apply overrides passed as -Dmhtbuilder.<name>=<value>
     */
    public static void init() throws Exception
    {
        UserAgent = property("useragent", UserAgent);
        Proxy = property("proxy", Proxy);
        ProxyUser = property("proxy.user", ProxyUser);
        ProxyPassword = property("proxy.password", ProxyPassword);
        AuthUser = property("auth.user", AuthUser);
        AuthPassword = property("auth.password", AuthPassword);
        DefaultEncoding = property("encoding", DefaultEncoding);
        WebConnectTimeout = Integer.parseInt(property("timeout", "" + WebConnectTimeout));
        WebSocketTimeout = WebConnectTimeout;
        KeepCookies = Boolean.parseBoolean(property("cookies", "" + KeepCookies));

        if (Proxy != null && Proxy.trim().isEmpty())
            Proxy = null;

        if (!Charset.isSupported(DefaultEncoding))
            throw new Exception("Unsupported default encoding " + DefaultEncoding);
    }

    public static Charset defaultCharset()
    {
        return Charset.forName(DefaultEncoding);
    }

    private static String property(String name, String dflt)
    {
        String value = System.getProperty(SystemPropertyPrefix + name);
        return value != null ? value : dflt;
    }
}
