package my.MhtBuilder.runtime.file;

import java.util.regex.Pattern;

/*
 * Make a usable file name out of a page title or URL segment
 */
public class SafeFileName
{
    // Common filename-invalid characters on Windows and also problematic in Linux
    private static final String ILLEGAL_CHARS = "*?<>\\/:\"|";

    private static final Pattern MULTIPLE_SPACES = Pattern.compile("\\s{2,}");

    /*
     * Remove illegal characters, trim, collapse runs of whitespace into one space
     */
    public static String sanitize(String seed)
    {
        if (seed == null)
            return "";

        StringBuilder sb = new StringBuilder();

        for (int i = 0; i < seed.length(); i++)
        {
            char ch = seed.charAt(i);
            if (ILLEGAL_CHARS.indexOf(ch) < 0)
                sb.append(ch);
        }

        String result = sb.toString().trim();
        return MULTIPLE_SPACES.matcher(result).replaceAll(" ");
    }

    /*
     * Directory part of a path ends with a separator
     */
    public static boolean isDirectoryPath(String path)
    {
        return path.endsWith("/") || path.endsWith("\\") || path.endsWith(java.io.File.separator);
    }

    /*
     * "dir/name.ext" => "name.ext", "dir/" => ""
     */
    public static String fileName(String path)
    {
        int k = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return path.substring(k + 1);
    }

    /*
     * "dir/name.ext" => "dir/", "name.ext" => ""
     */
    public static String folder(String path)
    {
        int k = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return path.substring(0, k + 1);
    }

    /*
     * Join folder and file name with a single separator
     */
    public static String combine(String folder, String name)
    {
        if (folder == null || folder.isEmpty())
            return name;
        if (isDirectoryPath(folder))
            return folder + name;
        return folder + "/" + name;
    }

    /*
     * Replace (or append) the extension, @ext including the leading dot
     */
    public static String changeExtension(String path, String ext)
    {
        String name = fileName(path);
        int dot = name.lastIndexOf('.');
        if (dot > 0)
            name = name.substring(0, dot);
        return folder(path) + name + ext;
    }
}
