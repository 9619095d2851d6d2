package my.MhtBuilder.links;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class ContentClassifierTest
{
    @Test
    public void binaryUnlessText()
    {
        assertTrue(ContentClassifier.isBinary("image/png"));
        assertTrue(ContentClassifier.isBinary("application/octet-stream"));
        assertFalse(ContentClassifier.isBinary("text/css"));
        assertFalse(ContentClassifier.isBinary("TEXT/HTML; charset=UTF-8"));
        assertFalse(ContentClassifier.isBinary(null));
        assertFalse(ContentClassifier.isBinary(""));
    }

    @Test
    public void htmlAndCss()
    {
        assertTrue(ContentClassifier.isHtml("Text/Html; charset=windows-1251"));
        assertFalse(ContentClassifier.isHtml("text/css"));
        assertTrue(ContentClassifier.isCss("text/css"));
        assertFalse(ContentClassifier.isCss(null));
    }

    @Test
    public void extensionTable()
    {
        assertEquals(".htm", ContentClassifier.extensionFor("text/html; charset=utf-8"));
        assertEquals(".gif", ContentClassifier.extensionFor("image/gif"));
        assertEquals(".jpg", ContentClassifier.extensionFor("image/jpeg"));
        assertEquals(".js", ContentClassifier.extensionFor("application/x-javascript"));
        assertEquals(".js", ContentClassifier.extensionFor("text/javascript"));
        assertEquals(".png", ContentClassifier.extensionFor("image/x-png"));
        assertEquals(".css", ContentClassifier.extensionFor("text/css"));
        assertEquals(".txt", ContentClassifier.extensionFor("text/plain"));
        assertEquals(".htm", ContentClassifier.extensionFor("application/pdf"));
        assertEquals(".htm", ContentClassifier.extensionFor(null));
    }

    @Test
    public void mediaTypeStripsParameters()
    {
        assertEquals("text/html", ContentClassifier.mediaType("Text/HTML; charset=utf-8"));
        assertEquals("image/gif", ContentClassifier.mediaType("image/gif"));
    }
}
