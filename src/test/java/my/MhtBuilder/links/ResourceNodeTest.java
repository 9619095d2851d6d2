package my.MhtBuilder.links;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import my.MhtBuilder.errors.NotHtmlOperationException;
import my.MhtBuilder.runtime.file.LocalFileStore;
import my.MhtBuilder.runtime.http.FakeTransport;
import my.MhtBuilder.runtime.http.TransportException;

public class ResourceNodeTest
{
    private final FakeTransport transport = new FakeTransport();
    private final LocalFileStore fileStore = new LocalFileStore();
    private final ResourceNode.Options options = new ResourceNode.Options();

    private ResourceNode node(String url) throws Exception
    {
        return new ResourceNode(url, FileStorage.MEMORY, transport, fileStore, options);
    }

    @Test
    public void contentLocationReplacesRequestedUrl() throws Exception
    {
        transport.add("http://x.com/", "text/html", "<html></html>".getBytes(StandardCharsets.US_ASCII),
                "http://x.com/default.htm");

        ResourceNode n = node("http://x.com");
        n.fetch();

        assertTrue(n.isFetched());
        assertEquals("http://x.com", n.getOriginalUrl());
        assertEquals("http://x.com/", n.getRequestedUrl());
        assertEquals("http://x.com/default.htm", n.getResolvedUrl());
        assertEquals("default.htm", n.getDownloadFilename());
    }

    @Test
    public void htmlIsMarkedAndMadeAbsolute() throws Exception
    {
        transport.addHtml("http://x.com/dir/p.htm", "<html><body><img src=\"i.png\"><img src=\"/j.png\"></body></html>");

        ResourceNode n = node("http://x.com/dir/p.htm");
        n.fetch();

        String text = n.toString();
        assertTrue(text.startsWith("<!-- saved from url=(0022)http://x.com/dir/p.htm --> \r\n"));
        assertTrue(text.contains("src=\"http://x.com/dir/i.png\""));
        assertTrue(text.contains("src=\"http://x.com/j.png\""));
        assertEquals(StandardCharsets.UTF_8, n.getTextEncoding());
    }

    @Test
    public void baseTagChangesFolder() throws Exception
    {
        transport.addHtml("http://x.com/p.htm",
                "<html><head><base href=\"http://cdn.com/assets/\"></head><body><img src=\"i.png\"></body></html>");

        options.addWebMark = false;
        ResourceNode n = node("http://x.com/p.htm");
        n.fetch();

        assertEquals("<html><head></head><body><img src=\"http://cdn.com/assets/i.png\"></body></html>", n.toString());
        assertEquals("http://cdn.com/assets", n.getUrlFolder());
    }

    @Test
    public void scriptsAndIframesCanBeStripped() throws Exception
    {
        transport.addHtml("http://x.com/p.htm",
                "<body><script>x()</script><iframe src=\"http://x.com/f.htm\"></iframe><p>kept</p></body>");

        options.addWebMark = false;
        options.stripScripts = true;
        options.stripIframes = true;
        ResourceNode n = node("http://x.com/p.htm");
        n.fetch();

        assertEquals("<body><p>kept</p></body>", n.toString());
    }

    @Test
    public void forcedEncodingWins() throws Exception
    {
        Charset cp1251 = Charset.forName("windows-1251");
        transport.addHtml("http://x.com/p.htm", "<html></html>");

        options.forcedEncoding = cp1251;
        ResourceNode n = node("http://x.com/p.htm");
        n.fetch();

        assertEquals(cp1251, n.getTextEncoding());
    }

    @Test
    public void failedFetchIsRecordedAndNotRetried() throws Exception
    {
        ResourceNode n = node("http://x.com/missing.png");
        n.fetch();
        n.fetch();

        assertEquals(DownloadState.FAILED, n.getState());
        assertFalse(n.isFetched());
        assertTrue(n.getFailure() instanceof TransportException);
        assertEquals(404, ((TransportException) n.getFailure()).getStatusCode());
        assertNull(n.getBytes());
        assertEquals(1, transport.fetchCount("http://x.com/missing.png"));
    }

    @Test
    public void queryMakesDistinctFileNames() throws Exception
    {
        transport.add("http://x.com/img/pic.php?id=1", "image/gif", new byte[] { 1 });
        transport.add("http://x.com/img/pic.php?id=2", "image/gif", new byte[] { 2 });

        ResourceNode n1 = node("http://x.com/img/pic.php?id=1");
        ResourceNode n2 = node("http://x.com/img/pic.php?id=2");
        n1.fetch();
        n2.fetch();

        assertEquals("pic_" + "?id=1".hashCode() + ".gif", n1.getDownloadFilename());
        assertNotEquals(n1.getDownloadFilename(), n2.getDownloadFilename());
    }

    @Test
    public void untitledPagesWithQueryGetDistinctFileNames() throws Exception
    {
        transport.addHtml("http://x.com/page?id=1", "<html><body>one</body></html>");
        transport.addHtml("http://x.com/page?id=2", "<html><body>two</body></html>");

        ResourceNode n1 = node("http://x.com/page?id=1");
        ResourceNode n2 = node("http://x.com/page?id=2");
        n1.fetch();
        n2.fetch();

        assertEquals("page_" + "?id=1".hashCode() + ".htm", n1.getDownloadFilename());
        assertEquals("page_" + "?id=2".hashCode() + ".htm", n2.getDownloadFilename());
        assertNotEquals(n1.getDownloadFilename(), n2.getDownloadFilename());
    }

    @Test
    public void fileNameFromLastSegment() throws Exception
    {
        transport.add("http://x.com/img/logo.gif", "image/gif", new byte[] { 1, 2, 3 });

        ResourceNode n = node("http://x.com/img/logo.gif");
        n.fetch();

        assertTrue(n.isBinary());
        assertEquals("logo.gif", n.getDownloadFilename());
        assertEquals(".gif", n.getDownloadExtension());

        n.setDownloadFolder("out/page_files");
        assertEquals("out/page_files/logo.gif", n.getDownloadPath());
    }

    @Test
    public void titleNamesTheFileInADirectory() throws Exception
    {
        transport.addHtml("http://x.com/", "<html><head><title>My: Page?</title></head></html>");

        ResourceNode n = node("http://x.com/");
        n.fetch();
        n.setUseHtmlTitleAsFilename(true);
        n.setDownloadPath("out/");

        assertEquals("out/My Page.htm", n.getDownloadPath());
        assertEquals("out/My Page_files", n.getExternalFilesFolder());

        n.setDownloadPath("out/index.html");
        assertEquals("out/index.html", n.getDownloadPath());
        assertEquals("out/index_files", n.getExternalFilesFolder());
    }

    @Test
    public void htmlOnlyOperationsRejectOtherTypes() throws Exception
    {
        transport.add("http://x.com/a.png", "image/png", new byte[] { 1 });

        ResourceNode n = node("http://x.com/a.png");
        n.fetch();

        NotHtmlOperationException ex = assertThrows(NotHtmlOperationException.class, () -> n.getHtmlTitle());
        assertEquals("image/png", ex.getContentType());
        assertThrows(NotHtmlOperationException.class, () -> n.convertReferencesToLocal(null));
        assertTrue(n.extractReferences().isEmpty());
    }

    @Test
    public void loadedHtmlWithoutUrlStaysRelative() throws Exception
    {
        ResourceNode n = node(null);
        n.loadContent("<html><body><img src=\"i.png\"><img src=\"http://x.com/a.png\"></body></html>");

        assertTrue(n.isFetched());
        assertNull(n.getResolvedUrl());
        assertTrue(n.toString().contains("src=\"i.png\""));
        assertEquals(1, n.extractReferences().size());
    }

    @Test
    public void diskStorageSavesOnFetch(@TempDir Path dir) throws Exception
    {
        transport.add("http://x.com/a.png", "image/png", new byte[] { 7, 8, 9 });

        ResourceNode n = new ResourceNode("http://x.com/a.png", FileStorage.DISK_PERMANENT, transport, fileStore, options);
        n.setDownloadFolder(dir.toString());
        n.fetch();

        assertTrue(n.isFetched());
        assertTrue(Files.exists(dir.resolve("a.png")));
        assertEquals(3, Files.size(dir.resolve("a.png")));
    }

    @Test
    public void savesPlainText(@TempDir Path dir) throws Exception
    {
        transport.addHtml("http://x.com/p.htm", "<html><body><p>Hello &amp; bye</p></body></html>");

        ResourceNode n = node("http://x.com/p.htm");
        n.fetch();

        Path txt = dir.resolve("p.txt");
        n.saveAsText(txt.toString());

        String text = new String(Files.readAllBytes(txt), StandardCharsets.UTF_8);
        assertTrue(text.contains("Hello & bye"));
        assertFalse(text.contains("<p>"));
    }
}
