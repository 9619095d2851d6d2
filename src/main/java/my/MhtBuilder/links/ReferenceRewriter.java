package my.MhtBuilder.links;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.text.StringEscapeUtils;

import my.MhtBuilder.Config;
import my.MhtBuilder.runtime.Util;

/**
 * Pattern-based rewriting of references inside HTML and CSS text.
 *
 * <p>
 * Before the crawl, relative references are made absolute against the resource's root and folder:
 *
 * <pre>
 *     href="myfolder/mypage.htm"   =>   href="http://mywebsite/myfolder/mypage.htm"
 *     url(/img/a.gif)              =>   url(http://mywebsite/img/a.gif)
 * </pre>
 *
 * After the crawl, absolute references to downloaded resources are redirected to local files:
 *
 * <pre>
 *     src="http://mywebsite/myfolder/myimage.gif"   =>   src="mypage_files/myimage.gif"
 * </pre>
 */
public class ReferenceRewriter
{
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE;

    /* href="/x", src='/x', background=/x */
    private static final String ATTR_PATTERN = "(?<attrib>\\shref|\\ssrc|\\sbackground)\\s*?=\\s*?" +
            "(?<delim1>[\"'\\\\]{0,2})(?!\\s*\\+|#|https?:|ftp:|mailto:|javascript:|data:)" +
            "/(?<url>[^\"'>\\\\]+)(?<delim2>[\"'\\\\]{0,2})";

    /* @import url(/x), background-image: url("/x"), background: url(/x) */
    private static final String CSS_PATTERN = "(?<attrib>@import\\s|\\S+-image:|background:)\\s*?(url)*['\"(]{1,2}" +
            "(?!http|data:)\\s*/(?<url>[^\"')]+)['\")]{1,2}";

    private static final Pattern ATTR_ROOT_RELATIVE = Pattern.compile(ATTR_PATTERN, FLAGS);
    private static final Pattern ATTR_PATH_RELATIVE = Pattern.compile(ATTR_PATTERN.replace("/", ""), FLAGS);
    private static final Pattern CSS_ROOT_RELATIVE = Pattern.compile(CSS_PATTERN, FLAGS);
    private static final Pattern CSS_PATH_RELATIVE = Pattern.compile(CSS_PATTERN.replace("/", ""), FLAGS);

    /*
     * Reference shapes, group 1 is the delimited key and group 2 the bare URL
     */
    private static final Pattern SRC_ATTRIBUTE = Pattern.compile(
            "(?:\\ssrc|\\sbackground)\\s*=\\s*(?:('([^']+)')|(\"([^\"]+)\")|(([^ \\n\\r\\f]+)))", FLAGS);
    private static final Pattern CSS_REFERENCE = Pattern
            .compile("(?:@import\\s|\\S+-image:|background:)\\s*?(?:url)*\\s*?([\"'(]{1,2}([^\"')]+)[\"')]{1,2})", FLAGS);
    private static final Pattern LINK_HREF = Pattern.compile("<link[^>]+?href\\s*=\\s*((?:'|\")*([^'\">]+)(?:'|\")*)", FLAGS);
    private static final Pattern FRAME_SRC = Pattern.compile("<i*frame[^>]+?src\\s*=\\s*(['\"]{0,1}([^'\"\\\\>]+)['\"]{0,1})",
            FLAGS);

    private static final Pattern ABSOLUTE_HTTP = Pattern.compile("^https?://\\w+", Pattern.CASE_INSENSITIVE);

    private static final Pattern BASE_HREF = Pattern.compile("<base[^>]+?href=['\"]{0,1}([^'\">]+)['\"]{0,1}",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern BASE_TAG = Pattern.compile("<base[^>]*?>", Pattern.CASE_INSENSITIVE);

    private static final Pattern TITLE = Pattern.compile("<title[^>]*?>([^<]+)</title>", Pattern.CASE_INSENSITIVE);

    private static final Pattern ANY_TAG = Pattern
            .compile("<\\w+(\\s+[A-Za-z0-9_\\-]+\\s*=\\s*(\"([^\"]*)\"|'([^']*)'))*\\s*(/)*>|<[^>]+>");

    /* ====================================================================================== */

    public static String toAbsolute(String content, String root, String folder)
    {
        String qroot = Matcher.quoteReplacement(root);
        String qfolder = Matcher.quoteReplacement(folder);

        // href="/anything" => href="http://www.web.com/anything"
        content = ATTR_ROOT_RELATIVE.matcher(content).replaceAll("${attrib}=${delim1}" + qroot + "/${url}${delim2}");

        // href="anything" => href="http://www.web.com/folder/anything"
        content = ATTR_PATH_RELATIVE.matcher(content).replaceAll("${attrib}=${delim1}" + qfolder + "/${url}${delim2}");

        // @import(/anything) => @import url(http://www.web.com/anything)
        content = CSS_ROOT_RELATIVE.matcher(content).replaceAll("${attrib} url(" + qroot + "/${url})");

        // @import(anything) => @import url(http://www.web.com/folder/anything)
        content = CSS_PATH_RELATIVE.matcher(content).replaceAll("${attrib} url(" + qfolder + "/${url})");

        return content;
    }

    /*
     * Absolute http(s) references in the content, as delimited text => bare URL.
     * Keys include the original quotes or parentheses so that local rewriting
     * replaces exactly the referencing text.
     */
    public static Map<String, String> extractReferences(String content)
    {
        Map<String, String> refs = new LinkedHashMap<>();

        addAttributeMatches(content, refs);
        addMatches(content, CSS_REFERENCE, refs);
        addMatches(content, LINK_HREF, refs);
        addMatches(content, FRAME_SRC, refs);

        return refs;
    }

    /*
     * src='x' or src="x" or src=x
     */
    private static void addAttributeMatches(String content, Map<String, String> refs)
    {
        Matcher m = SRC_ATTRIBUTE.matcher(content);
        while (m.find())
        {
            for (int group = 1; group <= 5; group += 2)
            {
                if (m.group(group) != null)
                {
                    addMatch(m.group(group), m.group(group + 1), refs);
                    break;
                }
            }
        }
    }

    private static void addMatches(String content, Pattern p, Map<String, String> refs)
    {
        Matcher m = p.matcher(content);
        while (m.find())
            addMatch(m.group(1), m.group(2), refs);
    }

    private static void addMatch(String key, String value, Map<String, String> refs)
    {
        if (key == null || value == null || refs.containsKey(key))
            return;

        if (ABSOLUTE_HTTP.matcher(value).find())
            refs.put(key, value);
    }

    /*
     * Redirect references to resources present in @graph to their local files.
     * A resource found by @referrer itself sits in "<referrer>_files/".
     */
    public static String toLocal(String content, Map<String, String> references, ResourceGraph graph,
            ResourceNode referrer)
    {
        for (Map.Entry<String, String> e : references.entrySet())
        {
            String delimitedUrl = e.getKey();
            ResourceNode node = graph.get(e.getValue());
            if (node == null || !node.isFetched())
                continue;

            String newPath = referrer.relativePathTo(node);
            content = content.replace(delimitedUrl, redelimit(delimitedUrl, newPath));
        }

        return content;
    }

    /*
     * "'http://x.com/a.gif'" + "p_files/a.gif" => "'p_files/a.gif'"
     */
    private static String redelimit(String delimited, String value)
    {
        int start = 0;
        while (start < delimited.length() && "\"'(".indexOf(delimited.charAt(start)) >= 0)
            start++;

        int end = delimited.length();
        while (end > start && "\"')".indexOf(delimited.charAt(end - 1)) >= 0)
            end--;

        return delimited.substring(0, start) + value + delimited.substring(end);
    }

    /* ====================================================================================== */

    public static class BaseTag
    {
        /* folder override without trailing slash, or null if there is no <base href> */
        public final String folder;

        /* content with all <base> tags removed */
        public final String content;

        public BaseTag(String folder, String content)
        {
            this.folder = folder;
            this.content = content;
        }
    }

    public static BaseTag applyBase(String html)
    {
        String folder = null;

        Matcher m = BASE_HREF.matcher(html);
        if (m.find())
        {
            folder = m.group(1);
            if (folder.endsWith("/"))
                folder = folder.substring(0, folder.length() - 1);
            if (folder.isEmpty())
                folder = null;
        }

        return new BaseTag(folder, BASE_TAG.matcher(html).replaceAll(""));
    }

    /*
     * Prepend "mark of the web" so that a locally opened copy is placed in the Internet zone
     */
    public static String addWebMark(String html, String url)
    {
        if (url == null)
            return html;

        return String.format("<!-- saved from url=(%04d)%s --> ", url.length(), url) + Util.CRLF + html;
    }

    /*
     * Remove all <tag ...> ... </tag> blocks
     */
    public static String stripTag(String tag, String html)
    {
        Pattern p = Pattern.compile(String.format("<%s[^>]*?>[\\w\\W]*?</%s>", tag, tag), FLAGS);
        return p.matcher(html).replaceAll("");
    }

    /*
     * Text of the first <title> tag, cut to Config.MaxTitleLength
     */
    public static String htmlTitle(String html)
    {
        Matcher m = TITLE.matcher(html);
        if (!m.find())
            return "";

        return Util.truncate(m.group(1), Config.MaxTitleLength);
    }

    public static String toPlainText(String html, boolean removeWhitespace)
    {
        html = stripTag("script", html);
        html = stripTag("style", html);
        html = ANY_TAG.matcher(html).replaceAll(" ");
        html = StringEscapeUtils.unescapeHtml4(html);

        if (removeWhitespace)
        {
            html = html.replaceAll("[\\n\\r\\f\\t]", " ");
            html = html.replaceAll(" {2,}", " ");
        }

        return html;
    }
}
