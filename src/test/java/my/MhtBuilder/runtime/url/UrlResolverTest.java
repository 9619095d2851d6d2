package my.MhtBuilder.runtime.url;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import my.MhtBuilder.errors.InvalidUrlException;

public class UrlResolverTest
{
    @Test
    public void bareHostGetsRootPath() throws Exception
    {
        assertEquals("http://example.com/", UrlResolver.resolve("http://example.com"));
        assertEquals("http://example.com/?q=1", UrlResolver.resolve("http://example.com?q=1"));
    }

    @Test
    public void trimsAndDropsTrailingFragment() throws Exception
    {
        assertEquals("http://example.com/a/b.html", UrlResolver.resolve("  http://example.com/a/b.html#top "));
        assertEquals("http://x.com/p.htm?q=1", UrlResolver.stripFragment("http://x.com/p.htm?q=1#x"));

        // fragment containing a dot is kept
        assertEquals("http://x.com/a#b.c", UrlResolver.stripFragment("http://x.com/a#b.c"));
    }

    @Test
    public void normalizesDotSegments() throws Exception
    {
        assertEquals("https://x.com/b.htm", UrlResolver.resolve("https://x.com/a/../b.htm"));
    }

    @Test
    public void rejectsMalformedUrls()
    {
        assertThrows(InvalidUrlException.class, () -> UrlResolver.resolve("not a url"));
        assertThrows(InvalidUrlException.class, () -> UrlResolver.resolve("relative/page.htm"));
        assertThrows(InvalidUrlException.class, () -> UrlResolver.resolve("mailto:someone@example.com"));
        assertThrows(InvalidUrlException.class, () -> UrlResolver.resolve(null));

        InvalidUrlException ex = assertThrows(InvalidUrlException.class, () -> UrlResolver.resolve("::"));
        assertEquals("::", ex.getUrl());
    }

    @Test
    public void unvalidatedUrlIsTakenAsIs() throws Exception
    {
        assertEquals("http://x.com/default.htm#a", UrlResolver.resolve("http://x.com/default.htm#a", false));
    }

    @Test
    public void decomposesHttpAndHttps()
    {
        UrlResolver.Decomposed d = UrlResolver.decompose("https://www.site.com/dir/page.html");
        assertEquals("https://www.site.com", d.root);
        assertEquals("https://www.site.com/dir", d.folder);

        d = UrlResolver.decompose("http://example.com/");
        assertEquals("http://example.com", d.root);
        assertEquals("http://example.com", d.folder);

        d = UrlResolver.decompose("http://example.com/a/b/c.css");
        assertEquals("http://example.com/a/b", d.folder);
    }

    @Test
    public void rootOfNonHttpUrlIsEmpty()
    {
        assertEquals("", UrlResolver.urlRoot("ftp://files.com/a.zip"));
        assertEquals("", UrlResolver.urlRoot(null));
    }
}
