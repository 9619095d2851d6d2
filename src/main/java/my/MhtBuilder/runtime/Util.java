package my.MhtBuilder.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class Util
{
    public static final String CRLF = "\r\n";

    /*
     * "dir/page.html" => "html"
     * "dir/page" => null
     */
    public static String getFileExtension(String path)
    {
        if (path == null || path.isEmpty())
            return null;

        path = path.replace('\\', '/');

        int lastSlash = path.lastIndexOf('/');
        String fileName = (lastSlash >= 0) ? path.substring(lastSlash + 1) : path;

        int lastDot = fileName.lastIndexOf('.');
        if (lastDot <= 0 || lastDot == fileName.length() - 1)
            return null;

        return fileName.substring(lastDot + 1);
    }

    /*
     * "page.html" => "page"
     * "page" => "page"
     */
    public static String stripFileExtension(String fileName)
    {
        if (fileName == null)
            return null;

        int lastDot = fileName.lastIndexOf('.');
        if (lastDot < 0)
            return fileName;

        return fileName.substring(0, lastDot);
    }

    public static String truncate(String s, int max)
    {
        if (s != null && s.length() > max)
            s = s.substring(0, max);
        return s;
    }

    /*
     * ".htm;.html" => [".htm", ".html"]
     */
    public static List<String> asList(String s, String sep)
    {
        if (s == null || s.length() == 0)
            return new ArrayList<String>();
        return Arrays.asList(s.split(sep));
    }

    public static void out(String s)
    {
        System.out.println(s);
        System.out.flush();
    }

    public static void err(String s)
    {
        System.out.flush();
        System.err.println(s);
        System.err.flush();
    }
}
