package my.MhtBuilder.links;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.junit.jupiter.api.Test;

public class ReferenceRewriterTest
{
    private static final String ROOT = "http://x.com";
    private static final String FOLDER = "http://x.com/dir";

    @Test
    public void rootRelativeReferencesUseSiteRoot()
    {
        assertEquals("<img src=\"http://x.com/a.png\">", ReferenceRewriter.toAbsolute("<img src=\"/a.png\">", ROOT, FOLDER));
        assertEquals("<body background='http://x.com/bg.gif'>",
                ReferenceRewriter.toAbsolute("<body background='/bg.gif'>", ROOT, FOLDER));
    }

    @Test
    public void pathRelativeReferencesUseFolder()
    {
        assertEquals("<a href=\"http://x.com/dir/page2.htm\">",
                ReferenceRewriter.toAbsolute("<a href=\"page2.htm\">", ROOT, FOLDER));
        assertEquals("<img src=http://x.com/dir/img/a.gif>", ReferenceRewriter.toAbsolute("<img src=img/a.gif>", ROOT, FOLDER));
    }

    @Test
    public void leavesNonRelativeReferencesAlone()
    {
        String html = "<a href=\"#top\"></a>" +
                "<a href=\"mailto:a@b.com\"></a>" +
                "<a href=\"javascript:go()\"></a>" +
                "<img src=\"data:image/png;base64,AAAA\">" +
                "<a href=\"https://y.com/\"></a>" +
                "<a href=\"http://y.com/z.htm\"></a>";

        assertEquals(html, ReferenceRewriter.toAbsolute(html, ROOT, FOLDER));
    }

    @Test
    public void cssReferencesAreMadeAbsolute()
    {
        assertEquals("div { background-image: url(http://x.com/b.png); }",
                ReferenceRewriter.toAbsolute("div { background-image: url(/b.png); }", ROOT, FOLDER));
        assertEquals("div { background-image: url(http://x.com/dir/b.png); }",
                ReferenceRewriter.toAbsolute("div { background-image: url(b.png); }", ROOT, FOLDER));
        assertEquals("div { background-image: url(http://z.com/b.png); }",
                ReferenceRewriter.toAbsolute("div { background-image: url(http://z.com/b.png); }", ROOT, FOLDER));
    }

    @Test
    public void extractsAbsoluteReferencesKeyedByDelimitedText()
    {
        String html = "<html><head>" +
                "<link rel=\"stylesheet\" href=\"http://x.com/s.css\">" +
                "<style>div { background-image: url(http://x.com/b.png); }</style>" +
                "</head><body>" +
                "<img src=\"http://x.com/a.png\">" +
                "<img src='http://x.com/a.png'>" +
                "<img src=\"http://x.com/a.png\">" +
                "<img src=\"/relative.png\">" +
                "<a href=\"http://x.com/page.htm\">link</a>" +
                "</body></html>";

        Map<String, String> refs = ReferenceRewriter.extractReferences(html);

        assertEquals(4, refs.size());
        assertEquals("http://x.com/a.png", refs.get("\"http://x.com/a.png\""));
        assertEquals("http://x.com/a.png", refs.get("'http://x.com/a.png'"));
        assertEquals("http://x.com/s.css", refs.get("\"http://x.com/s.css\""));
        assertEquals("http://x.com/b.png", refs.get("(http://x.com/b.png)"));
        assertFalse(refs.containsValue("http://x.com/page.htm"));
    }

    @Test
    public void extractsFrameSources()
    {
        Map<String, String> refs = ReferenceRewriter.extractReferences("<iframe width=10 src=\"https://x.com/f.htm\"></iframe>");
        assertEquals(1, refs.size());
        assertEquals("https://x.com/f.htm", refs.values().iterator().next());
    }

    @Test
    public void baseHrefOverridesFolderAndIsRemoved()
    {
        ReferenceRewriter.BaseTag base = ReferenceRewriter
                .applyBase("<head><base href=\"http://cdn.com/assets/\"></head><body></body>");
        assertEquals("http://cdn.com/assets", base.folder);
        assertEquals("<head></head><body></body>", base.content);

        base = ReferenceRewriter.applyBase("<head></head>");
        assertNull(base.folder);
        assertEquals("<head></head>", base.content);
    }

    @Test
    public void webMarkCarriesUrlLength()
    {
        assertEquals("<!-- saved from url=(0013)http://x.com/ --> \r\n<html>",
                ReferenceRewriter.addWebMark("<html>", "http://x.com/"));
        assertEquals("<html>", ReferenceRewriter.addWebMark("<html>", null));
    }

    @Test
    public void stripsTagBlocks()
    {
        String html = "<p>a</p><SCRIPT type=\"text/javascript\">\nvar x = '<b>';\n</SCRIPT><p>b</p><script>y()</script>";
        assertEquals("<p>a</p><p>b</p>", ReferenceRewriter.stripTag("script", html));
    }

    @Test
    public void titleIsTruncated()
    {
        assertEquals("Hello", ReferenceRewriter.htmlTitle("<head><title>Hello</title></head>"));
        assertEquals("", ReferenceRewriter.htmlTitle("<head></head>"));

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 60; i++)
            sb.append((char) ('a' + i % 26));
        String title = ReferenceRewriter.htmlTitle("<title>" + sb + "</title>");
        assertEquals(50, title.length());
        assertEquals(sb.substring(0, 50), title);
    }

    @Test
    public void plainTextDropsMarkupScriptsAndStyles()
    {
        String html = "<html><head><style>p { color: red; }</style><script>alert(1)</script></head>\n" +
                "<body><p class=\"x\">Fish &amp; Chips</p>\n\n<p>caf&eacute;</p></body></html>";

        String text = ReferenceRewriter.toPlainText(html, true);
        assertTrue(text.contains("Fish & Chips"));
        assertTrue(text.contains("café"));
        assertFalse(text.contains("<p"));
        assertFalse(text.contains("alert"));
        assertFalse(text.contains("color"));
        assertFalse(text.contains("\n"));
        assertFalse(text.contains("  "));

        assertTrue(ReferenceRewriter.toPlainText(html, false).contains("\n"));
    }
}
