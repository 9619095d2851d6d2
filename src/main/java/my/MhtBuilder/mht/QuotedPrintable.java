package my.MhtBuilder.mht;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;

import my.MhtBuilder.runtime.Util;

/**
 * Quoted-printable transfer encoding of part bodies (RFC 1521, section 5.1).
 *
 * <p>
 * "=" and characters above 126 are written as "=HH". Characters up to 255 use their own code, characters above 255
 * are written byte by byte in the part's charset. Lines are broken with a soft break ("=" + CRLF) once they reach
 * {@link #MAX_LINE_LENGTH} characters, preferably right after the last space.
 */
public class QuotedPrintable
{
    public static final int MAX_LINE_LENGTH = 73;

    private static final String SOFT_BREAK = "=" + Util.CRLF;

    public static String encode(String s, Charset charset)
    {
        if (s == null || s.isEmpty())
            return "";

        StringBuilder sb = new StringBuilder();

        int lineLength = 0;
        /* position just after the last space in the current line, or -1 */
        int lastSpace = -1;

        for (int i = 0; i < s.length();)
        {
            int c = s.codePointAt(i);
            i += Character.charCount(c);

            if (c == '=' || c > 126)
            {
                if (c <= 255)
                {
                    appendEscaped(sb, c);
                    lineLength += 3;
                }
                else
                {
                    for (byte b : new String(Character.toChars(c)).getBytes(charset))
                    {
                        appendEscaped(sb, b & 0xFF);
                        lineLength += 3;
                    }
                }
            }
            else
            {
                sb.append((char) c);

                if (c == '\n')
                {
                    lineLength = 0;
                    lastSpace = -1;
                    continue;
                }

                lineLength++;
                if (c == ' ')
                    lastSpace = sb.length();
            }

            if (lineLength >= MAX_LINE_LENGTH)
            {
                if (lastSpace == -1)
                {
                    sb.append(SOFT_BREAK);
                    lineLength = 0;
                }
                else
                {
                    sb.insert(lastSpace, SOFT_BREAK);
                    lineLength = sb.length() - lastSpace - SOFT_BREAK.length();
                }

                lastSpace = -1;
            }
        }

        // trailing whitespace must be escaped
        if (sb.charAt(sb.length() - 1) == ' ')
        {
            sb.setLength(sb.length() - 1);
            sb.append("=20");
        }

        return sb.toString();
    }

    private static void appendEscaped(StringBuilder sb, int value)
    {
        sb.append(String.format("=%02X", value));
    }

    /*
     * Inverse of encode() for text whose characters above 126 all came from @charset bytes
     */
    public static String decode(String s, Charset charset)
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        for (int i = 0; i < s.length(); i++)
        {
            char c = s.charAt(i);

            if (c != '=')
            {
                out.write((byte) c);
                continue;
            }

            if (s.startsWith(Util.CRLF, i + 1))
            {
                i += 2;
            }
            else if (i + 1 < s.length() && s.charAt(i + 1) == '\n')
            {
                i += 1;
            }
            else if (i + 2 < s.length())
            {
                out.write(Integer.parseInt(s.substring(i + 1, i + 3), 16));
                i += 2;
            }
            else
            {
                throw new IllegalArgumentException("Truncated escape sequence at position " + i);
            }
        }

        return new String(out.toByteArray(), charset);
    }
}
