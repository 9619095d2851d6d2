package my.MhtBuilder.runtime.http;

import java.nio.charset.Charset;

import my.MhtBuilder.links.ContentClassifier;

public class FetchResult
{
    public final byte[] bytes;

    /* raw Content-Type header value, may be null */
    public final String contentType;

    /* server-reported canonical URL (Content-Location), or null */
    public final String contentLocation;

    /* charset from header or meta tag, or the default one */
    public final Charset detectedEncoding;

    public final boolean binaryHint;

    public FetchResult(byte[] bytes, String contentType, String contentLocation, Charset detectedEncoding)
    {
        this.bytes = bytes != null ? bytes : new byte[0];
        this.contentType = contentType;
        this.contentLocation = contentLocation;
        this.detectedEncoding = detectedEncoding;
        this.binaryHint = ContentClassifier.isBinary(contentType);
    }
}
