package my.MhtBuilder.runtime.file;

import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;

// <html>... => text/html
// \x89PNG... => image/png
// unknown bytes => null

public class FileTypeDetector
{
    private final static String MIME_OCTET_STREAM = MediaType.OCTET_STREAM.toString();

    private static final Tika tika = new Tika();

    /*
     * Content type sniffed from the bytes, for servers that send no Content-Type header
     */
    public static String mimeTypeFromActualFileContent(byte[] fileBytes)
    {
        if (fileBytes == null || fileBytes.length == 0)
            return null;

        String detectedMimeType = tika.detect(fileBytes);
        if (detectedMimeType != null && !detectedMimeType.equalsIgnoreCase(MIME_OCTET_STREAM))
            return detectedMimeType;

        if (isAsciiText(fileBytes))
            return "text/plain";

        return null;
    }

    public static boolean isAsciiText(byte[] d)
    {
        if (d == null)
            return false;

        for (byte b : d)
        {
            int value = b & 0xFF;
            if (value >= 0x20 && value <= 0x7E || value == 0x09 || value == 0x0A || value == 0x0D)
                continue; // valid
            return false; // invalid byte
        }

        return true;
    }
}
