package my.MhtBuilder.links;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import my.MhtBuilder.Config;
import my.MhtBuilder.errors.InvalidUrlException;
import my.MhtBuilder.errors.NotHtmlOperationException;
import my.MhtBuilder.runtime.Util;
import my.MhtBuilder.runtime.file.FileStore;
import my.MhtBuilder.runtime.file.SafeFileName;
import my.MhtBuilder.runtime.http.FetchResult;
import my.MhtBuilder.runtime.http.NetErrors;
import my.MhtBuilder.runtime.http.Transport;
import my.MhtBuilder.runtime.http.TransportException;
import my.MhtBuilder.runtime.url.UrlResolver;

/**
 * One web resource: the page itself or a file it references.
 *
 * <p>
 * A node is fetched at most once. HTML and CSS content has its relative references made absolute right after the
 * fetch, so that references can be extracted and matched against other nodes by URL.
 */
public class ResourceNode
{
    private static final Logger logger = LoggerFactory.getLogger(ResourceNode.class);

    private static final Pattern FILENAME_FROM_URL = Pattern.compile("/([^/?]+)[^/]*$");

    /*
     * Content processing settings shared by all nodes of one build
     */
    public static class Options
    {
        /* prepend "<!-- saved from url=... -->" to HTML */
        public boolean addWebMark = true;

        public boolean stripScripts = false;
        public boolean stripIframes = false;

        /* if set, overrides the encoding of every text resource */
        public Charset forcedEncoding = null;
    }

    private final Transport transport;
    private final FileStore fileStore;
    private final Options options;

    private final String originalUrl;
    private String requestedUrl;
    private String resolvedUrl;
    private String urlRoot = "";
    private String urlFolder = "";

    private String contentType;
    private boolean binary;
    private byte[] bytes;
    private Charset textEncoding;

    private DownloadState state = DownloadState.NOT_FETCHED;
    private Exception failure;

    private FileStorage storage;
    private String downloadFolder = "";
    private String downloadFilename;
    private String downloadExtension;
    private boolean useHtmlTitleAsFilename = false;
    private String ifModifiedSince;

    private boolean appended = false;

    /*
     * @url may be null for a page supplied as HTML text
     */
    public ResourceNode(String url, FileStorage storage, Transport transport, FileStore fileStore, Options options)
            throws InvalidUrlException
    {
        this.transport = transport;
        this.fileStore = fileStore;
        this.options = options;
        this.storage = storage;
        this.originalUrl = url;

        if (url != null && !url.isEmpty())
        {
            setUrl(url, true);
            requestedUrl = resolvedUrl;
        }
    }

    private void setUrl(String url, boolean validate) throws InvalidUrlException
    {
        resolvedUrl = UrlResolver.resolve(url, validate);
        UrlResolver.Decomposed d = UrlResolver.decompose(resolvedUrl);
        urlRoot = d.root;
        urlFolder = d.folder;
    }

    /* ============================================================================== */

    /*
     * Download the resource unless already done or attempted.
     * Failure is recorded in the node, not thrown.
     */
    public void fetch()
    {
        if (state != DownloadState.NOT_FETCHED)
            return;

        if (transport == null || resolvedUrl == null)
        {
            fail(new IllegalStateException("No URL to fetch"));
            return;
        }

        try
        {
            FetchResult r = transport.fetch(resolvedUrl, ifModifiedSince);

            // server's idea of the URL wins, e.g. http://site.com/ => http://site.com/default.htm
            if (StringUtils.isNotBlank(r.contentLocation))
                setUrl(r.contentLocation, false);

            contentType = r.contentType;
            binary = r.binaryHint;
            bytes = r.bytes;

            if (!binary)
            {
                if (options.forcedEncoding != null)
                    textEncoding = options.forcedEncoding;
                else if (r.detectedEncoding != null)
                    textEncoding = r.detectedEncoding;
                else
                    textEncoding = Config.defaultCharset();
            }

            if (isHtml())
                setText(processHtml(getText()));
            else if (isCss())
                setText(ReferenceRewriter.toAbsolute(getText(), urlRoot, urlFolder));

            if (storage.onDisk())
                save();

            state = DownloadState.FETCHED;
            logger.debug("Fetched {} ({}, {} bytes)", resolvedUrl, contentType, bytes.length);
        }
        catch (TransportException | InvalidUrlException | IOException ex)
        {
            fail(ex);
        }
    }

    private void fail(Exception ex)
    {
        state = DownloadState.FAILED;
        failure = ex;
        bytes = null;
        logger.warn("Unable to download {}: {}", resolvedUrl != null ? resolvedUrl : originalUrl, NetErrors.describe(ex));
    }

    /*
     * Use caller-supplied HTML as the fetched content
     */
    public void loadContent(String html)
    {
        if (state != DownloadState.NOT_FETCHED || html == null || html.isEmpty())
            return;

        contentType = "text/html";
        binary = false;
        textEncoding = options.forcedEncoding != null ? options.forcedEncoding : Config.defaultCharset();
        bytes = html.getBytes(textEncoding);
        setText(processHtml(html));
        state = DownloadState.FETCHED;
    }

    private String processHtml(String html)
    {
        if (options.addWebMark)
            html = ReferenceRewriter.addWebMark(html, resolvedUrl);

        if (options.stripScripts)
            html = ReferenceRewriter.stripTag("script", html);

        if (options.stripIframes)
            html = ReferenceRewriter.stripTag("iframe", html);

        // <base href> replaces the folder derived from the URL
        ReferenceRewriter.BaseTag base = ReferenceRewriter.applyBase(html);
        if (base.folder != null)
            urlFolder = base.folder;
        html = base.content;

        if (resolvedUrl == null)
            return html;

        return ReferenceRewriter.toAbsolute(html, urlRoot, urlFolder);
    }

    /* ============================================================================== */

    /*
     * Absolute http(s) references made by this resource, delimited text => URL
     */
    public Map<String, String> extractReferences()
    {
        if (bytes == null || binary || !(isHtml() || isCss()))
            return Collections.emptyMap();

        return ReferenceRewriter.extractReferences(getText());
    }

    /*
     * Point references to downloaded resources at their local copies
     */
    public void convertReferencesToLocal(ResourceGraph graph) throws NotHtmlOperationException
    {
        if (!isHtml() && !isCss())
            throw new NotHtmlOperationException("Converting references", resolvedUrl, contentType);

        if (bytes == null)
            return;

        Map<String, String> references = extractReferences();
        if (references.isEmpty())
            return;

        setText(ReferenceRewriter.toLocal(getText(), references, graph, this));
    }

    /*
     * Save with references pointing at local copies, keeping the fetched content unchanged
     */
    public void saveWithLocalReferences(ResourceGraph graph) throws NotHtmlOperationException, IOException
    {
        byte[] fetched = bytes;

        try
        {
            convertReferencesToLocal(graph);
            save();
        }
        finally
        {
            bytes = fetched;
        }
    }

    /*
     * Path of @target's local copy relative to the folder of this resource, with forward slashes
     */
    public String relativePathTo(ResourceNode target)
    {
        Path from = Paths.get(downloadFolder.isEmpty() ? "." : downloadFolder).toAbsolutePath().normalize();
        Path to = Paths.get(target.getDownloadPath()).toAbsolutePath().normalize();
        return from.relativize(to).toString().replace('\\', '/');
    }

    /* ============================================================================== */

    public void save() throws IOException
    {
        save(getDownloadPath(), false);
    }

    public void save(String path) throws IOException
    {
        save(path, false);
    }

    public void saveAsText(String path) throws IOException
    {
        save(path, true);
    }

    private void save(String path, boolean asText) throws IOException
    {
        if (bytes == null)
            return;

        if (!binary && asText)
            fileStore.write(path, toPlainText(false).getBytes(textEncoding));
        else
            fileStore.write(path, bytes);
    }

    /*
     * Content with tags, scripts and styles removed and entities decoded
     */
    public String toPlainText(boolean removeWhitespace)
    {
        return ReferenceRewriter.toPlainText(getText(), removeWhitespace);
    }

    /* ============================================================================== */

    public String getHtmlTitle() throws NotHtmlOperationException
    {
        if (!isHtml())
            throw new NotHtmlOperationException("Reading <title>", resolvedUrl, contentType);

        return ReferenceRewriter.htmlTitle(getText());
    }

    private String getText()
    {
        if (bytes == null || binary)
            return "";
        return new String(bytes, textEncoding);
    }

    private void setText(String text)
    {
        bytes = text.getBytes(textEncoding);
    }

    @Override
    public String toString()
    {
        if (bytes == null)
            return "";
        if (binary)
            return "[" + bytes.length + " bytes of binary data]";
        return getText();
    }

    /* ============================================================================== */

    public String getDownloadFilename()
    {
        if (downloadFilename == null || downloadFilename.isEmpty())
        {
            String name = null;

            if (useHtmlTitleAsFilename && bytes != null && isHtml())
            {
                String title = ReferenceRewriter.htmlTitle(getText());
                if (!SafeFileName.sanitize(title).isEmpty())
                    name = SafeFileName.sanitize(title) + ".htm";
            }

            if (name == null)
                name = filenameFromUrl();

            downloadFilename = name;
        }

        return downloadFilename;
    }

    public void setDownloadFilename(String downloadFilename)
    {
        this.downloadFilename = downloadFilename;
    }

    /*
     * Last path segment; with a query, disambiguated by the query hash.
     * Otherwise the page title, and the URL hash as the last resort.
     */
    private String filenameFromUrl()
    {
        String url = resolvedUrl != null ? resolvedUrl : "";
        String filename = null;

        Matcher m = FILENAME_FROM_URL.matcher(url);
        if (m.find())
        {
            filename = m.group(1);

            String query = query(url);
            if (query != null && !query.isEmpty())
                filename = Util.stripFileExtension(filename) + "_" + ("?" + query).hashCode() + getDownloadExtension();
        }

        if ((filename == null || filename.isEmpty()) && bytes != null && isHtml())
        {
            filename = ReferenceRewriter.htmlTitle(getText());
            if (!filename.isEmpty())
                filename += ".htm";
        }

        if (filename == null || SafeFileName.sanitize(filename).isEmpty())
            filename = url.hashCode() + getDownloadExtension();

        return SafeFileName.sanitize(filename);
    }

    private static String query(String url)
    {
        try
        {
            return new URI(url).getRawQuery();
        }
        catch (URISyntaxException ex)
        {
            int k = url.indexOf('?');
            return k < 0 ? null : url.substring(k + 1);
        }
    }

    /*
     * Extension with the leading dot, inferred from Content-Type once fetched
     */
    public String getDownloadExtension()
    {
        if (downloadExtension == null || downloadExtension.isEmpty())
        {
            if (bytes != null)
                downloadExtension = ContentClassifier.extensionFor(contentType);
            else
                return "";
        }

        return downloadExtension;
    }

    public void setDownloadExtension(String downloadExtension)
    {
        this.downloadExtension = downloadExtension;
    }

    public String getDownloadPath()
    {
        String filename = getDownloadFilename();

        if (Util.getFileExtension(filename) == null)
            return SafeFileName.combine(downloadFolder, filename + getDownloadExtension());
        else
            return SafeFileName.combine(downloadFolder, filename);
    }

    /*
     * "dir/page.htm" sets folder "dir/" and file name "page.htm",
     * "dir/" sets the folder only
     */
    public void setDownloadPath(String path)
    {
        String name = SafeFileName.fileName(path);

        if (name.isEmpty())
        {
            downloadFolder = path;
        }
        else
        {
            downloadFilename = name;
            downloadFolder = SafeFileName.folder(path);
        }
    }

    /*
     * Folder for the resources this page references: "dir/page_files"
     */
    public String getExternalFilesFolder()
    {
        return SafeFileName.combine(downloadFolder, Util.stripFileExtension(getDownloadFilename())) + "_files";
    }

    public String getDownloadFolder()
    {
        return downloadFolder;
    }

    public void setDownloadFolder(String downloadFolder)
    {
        this.downloadFolder = downloadFolder != null ? downloadFolder : "";
    }

    /* ============================================================================== */

    public boolean isHtml()
    {
        return ContentClassifier.isHtml(contentType);
    }

    public boolean isCss()
    {
        return ContentClassifier.isCss(contentType);
    }

    public boolean isBinary()
    {
        return binary;
    }

    public boolean isFetched()
    {
        return state == DownloadState.FETCHED;
    }

    public DownloadState getState()
    {
        return state;
    }

    public Exception getFailure()
    {
        return failure;
    }

    public String getOriginalUrl()
    {
        return originalUrl;
    }

    /*
     * Canonical form of the URL the node was created with, before any Content-Location
     */
    public String getRequestedUrl()
    {
        return requestedUrl;
    }

    public String getResolvedUrl()
    {
        return resolvedUrl;
    }

    public String getUrlRoot()
    {
        return urlRoot;
    }

    public String getUrlFolder()
    {
        return urlFolder;
    }

    public String getContentType()
    {
        return contentType;
    }

    public Charset getTextEncoding()
    {
        return textEncoding;
    }

    public byte[] getBytes()
    {
        return bytes;
    }

    public FileStorage getStorage()
    {
        return storage;
    }

    public void setStorage(FileStorage storage)
    {
        this.storage = storage;
    }

    public boolean isUseHtmlTitleAsFilename()
    {
        return useHtmlTitleAsFilename;
    }

    public void setUseHtmlTitleAsFilename(boolean useHtmlTitleAsFilename)
    {
        this.useHtmlTitleAsFilename = useHtmlTitleAsFilename;
    }

    public void setIfModifiedSince(String ifModifiedSince)
    {
        this.ifModifiedSince = ifModifiedSince;
    }

    public boolean isAppended()
    {
        return appended;
    }

    public void setAppended(boolean appended)
    {
        this.appended = appended;
    }
}
