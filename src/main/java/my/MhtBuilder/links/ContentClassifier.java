package my.MhtBuilder.links;

import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

/*
 * Classifies a resource by its Content-Type header value
 */
public class ContentClassifier
{
    public static final String DEFAULT_EXTENSION = ".htm";

    /*
     * Anything that does not declare itself as text is binary.
     * Missing content type is treated as text.
     */
    public static boolean isBinary(String contentType)
    {
        if (StringUtils.isEmpty(contentType))
            return false;
        return !StringUtils.containsIgnoreCase(contentType, "text");
    }

    public static boolean isHtml(String contentType)
    {
        return StringUtils.containsIgnoreCase(contentType, "text/html");
    }

    public static boolean isCss(String contentType)
    {
        return StringUtils.containsIgnoreCase(contentType, "text/css");
    }

    /*
     * "text/html; charset=utf-8" => "text/html"
     */
    public static String mediaType(String contentType)
    {
        if (contentType == null)
            return "";

        int k = 0;
        while (k < contentType.length() && contentType.charAt(k) != ' ' && contentType.charAt(k) != ';')
            k++;

        return contentType.substring(0, k).toLowerCase(Locale.ROOT);
    }

    /*
     * File extension (with leading dot) for a downloaded resource
     */
    public static String extensionFor(String contentType)
    {
        switch (mediaType(contentType))
        {
        case "text/html":
            return ".htm";

        case "image/gif":
            return ".gif";

        case "image/jpeg":
            return ".jpg";

        case "text/javascript":
        case "application/x-javascript":
            return ".js";

        case "image/x-png":
            return ".png";

        case "text/css":
            return ".css";

        case "text/plain":
            return ".txt";

        default:
            return DEFAULT_EXTENSION;
        }
    }
}
