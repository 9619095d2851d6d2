package my.MhtBuilder.runtime.http;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import my.MhtBuilder.Config;

/**
 * Text encoding of a fetched resource: Content-Type header first, then a {@code <meta>} declaration in the body,
 * then {@link Config#DefaultEncoding}.
 */
public class CharsetDetector
{
    private static final Pattern CHARSET = Pattern.compile("charset=[\"']?([^;\"'/>\\s]+)", Pattern.CASE_INSENSITIVE);

    /* only the head of a document is scanned for <meta> */
    private static final int MAX_META_SCAN = 16 * 1024;

    public static Charset detect(String contentType, byte[] body)
    {
        Charset cs = fromContentType(contentType);

        if (cs == null && body != null && body.length != 0)
            cs = fromMeta(body);

        if (cs == null)
            cs = Config.defaultCharset();

        return cs;
    }

    /*
     * "text/html; charset=windows-1251" => windows-1251
     */
    public static Charset fromContentType(String contentType)
    {
        if (contentType == null)
            return null;

        Matcher m = CHARSET.matcher(contentType);
        if (m.find())
            return forName(m.group(1));
        else
            return null;
    }

    /*
     * <meta charset="utf-8"> or <meta http-equiv="Content-Type" content="text/html; charset=utf-8">
     */
    public static Charset fromMeta(byte[] body)
    {
        int len = Math.min(body.length, MAX_META_SCAN);
        String head = new String(body, 0, len, StandardCharsets.US_ASCII);

        Document doc = Jsoup.parse(head);

        for (Element meta : doc.select("meta[charset]"))
        {
            Charset cs = forName(meta.attr("charset"));
            if (cs != null)
                return cs;
        }

        for (Element meta : doc.select("meta[http-equiv][content]"))
        {
            if (!meta.attr("http-equiv").equalsIgnoreCase("content-type"))
                continue;

            Charset cs = fromContentType(meta.attr("content"));
            if (cs != null)
                return cs;
        }

        return null;
    }

    private static Charset forName(String name)
    {
        if (name == null)
            return null;

        name = name.trim().toLowerCase(Locale.ROOT);

        switch (name)
        {
        case "win-1251":
        case "cp-1251":
            name = "windows-1251";
            break;

        case "":
            return null;
        }

        try
        {
            if (Charset.isSupported(name))
                return Charset.forName(name);
        }
        catch (IllegalCharsetNameException ex)
        {
            return null;
        }

        return null;
    }
}
