package my.MhtBuilder;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import my.MhtBuilder.errors.DownloadFailedException;
import my.MhtBuilder.errors.InvalidExtensionException;
import my.MhtBuilder.errors.InvalidFileNameException;
import my.MhtBuilder.errors.InvalidUrlException;
import my.MhtBuilder.errors.MhtException;
import my.MhtBuilder.links.FileStorage;
import my.MhtBuilder.links.ResourceGraph;
import my.MhtBuilder.links.ResourceNode;
import my.MhtBuilder.mht.ArchiveEncoder;
import my.MhtBuilder.runtime.Util;
import my.MhtBuilder.runtime.file.FileStore;
import my.MhtBuilder.runtime.file.LocalFileStore;
import my.MhtBuilder.runtime.file.SafeFileName;
import my.MhtBuilder.runtime.http.Transport;
import my.MhtBuilder.runtime.http.WebTransport;

/**
 * Saves a web page in one of four forms:
 * <ul>
 * <li>the HTML alone, with references made absolute ({@link #savePage})</li>
 * <li>its plain text ({@link #savePageText})</li>
 * <li>the HTML with all referenced files downloaded next to it and references pointing to them
 * ({@link #savePageComplete})</li>
 * <li>a single MHT archive ({@link #getPageArchive}, {@link #savePageArchive})</li>
 * </ul>
 *
 * A path ending with a separator names a directory; the file name is then made from the page title.
 *
 * <p>
 * Not thread-safe: one build at a time per instance.
 */
public class Builder implements Closeable
{
    private static final Logger logger = LoggerFactory.getLogger(Builder.class);

    public static final String HTML_EXTENSIONS = ".htm;.html";
    public static final String TEXT_EXTENSIONS = ".txt";
    public static final String ARCHIVE_EXTENSIONS = ".mht";

    private final Transport transport;
    private final FileStore fileStore;
    private final boolean ownsTransport;

    private final ResourceNode.Options options = new ResourceNode.Options();
    private final ResourceGraph graph;
    private final ArchiveEncoder encoder;

    private ResourceNode root;
    private boolean allowRecursiveFileRetrieval = true;
    private String ifModifiedSince;

    /*
     * HTTP transport configured from Config, local filesystem
     */
    public Builder() throws Exception
    {
        this(new WebTransport(), new LocalFileStore(), true);
    }

    public Builder(Transport transport, FileStore fileStore)
    {
        this(transport, fileStore, false);
    }

    private Builder(Transport transport, FileStore fileStore, boolean ownsTransport)
    {
        this.transport = transport;
        this.fileStore = fileStore;
        this.ownsTransport = ownsTransport;
        this.graph = new ResourceGraph(transport, fileStore, options);
        this.encoder = new ArchiveEncoder(fileStore);
    }

    @Override
    public void close() throws IOException
    {
        graph.clear();
        if (ownsTransport && transport instanceof Closeable)
            ((Closeable) transport).close();
    }

    /* ============================================================================== */

    /*
     * Target page; setting it discards everything downloaded so far
     */
    public void setUrl(String url) throws InvalidUrlException
    {
        graph.clear();
        root = new ResourceNode(url, FileStorage.MEMORY, transport, fileStore, options);
    }

    public String getUrl()
    {
        return root != null ? root.getResolvedUrl() : null;
    }

    /* ============================================================================== */

    public String savePage(String path) throws MhtException, IOException
    {
        return savePage(path, null);
    }

    /*
     * Save the page HTML with absolute references.
     * @return path of the saved file
     */
    public String savePage(String path, String url) throws MhtException, IOException
    {
        validateFilename(path, HTML_EXTENSIONS);
        downloadRoot(url);

        root.setUseHtmlTitleAsFilename(true);
        root.setDownloadPath(path);
        root.save();

        logger.info("Saved page {} to {}", root.getResolvedUrl(), root.getDownloadPath());
        return root.getDownloadPath();
    }

    public String savePageText(String path) throws MhtException, IOException
    {
        return savePageText(path, null);
    }

    /*
     * Save the page as plain text.
     * @return path of the saved .txt file
     */
    public String savePageText(String path, String url) throws MhtException, IOException
    {
        validateFilename(path, TEXT_EXTENSIONS);
        downloadRoot(url);

        root.setUseHtmlTitleAsFilename(true);
        root.setDownloadPath(path);

        String textPath = SafeFileName.changeExtension(root.getDownloadPath(), ".txt");
        root.saveAsText(textPath);

        logger.info("Saved text of {} to {}", root.getResolvedUrl(), textPath);
        return textPath;
    }

    public String savePageComplete(String path) throws MhtException, IOException
    {
        return savePageComplete(path, null);
    }

    /*
     * Save the page and every file it references, with references pointing to the local copies.
     * Referenced files go to "<page>_files" next to the page.
     * @return path of the saved page
     */
    public String savePageComplete(String path, String url) throws MhtException, IOException
    {
        validateFilename(path, HTML_EXTENSIONS);
        downloadRoot(url);

        root.setDownloadPath(path);
        root.setUseHtmlTitleAsFilename(true);

        graph.clear();
        graph.crawlReferences(root, root, FileStorage.DISK_PERMANENT, root.getExternalFilesFolder(),
                allowRecursiveFileRetrieval);

        for (ResourceNode node : graph.nodes())
        {
            if (node.isFetched() && (node.isHtml() || node.isCss()))
            {
                node.convertReferencesToLocal(graph);
                node.save();
            }
        }

        // the root keeps its absolute references for later archives
        root.saveWithLocalReferences(graph);

        logger.info("Saved page {} with {} resources to {}", root.getResolvedUrl(), graph.size(), root.getDownloadPath());
        return root.getDownloadPath();
    }

    public String getPageArchive() throws MhtException, IOException
    {
        return getPageArchive(null);
    }

    /*
     * Build the MHT archive in memory
     */
    public String getPageArchive(String url) throws MhtException, IOException
    {
        downloadRoot(url);

        try
        {
            graph.clear();
            graph.crawlReferences(root, root, FileStorage.MEMORY, root.getExternalFilesFolder(),
                    allowRecursiveFileRetrieval);

            encoder.writeAll(root, graph);
            return encoder.finish();
        }
        finally
        {
            encoder.reset();
            graph.clear();
        }
    }

    public String savePageArchive(String path, FileStorage storage) throws MhtException, IOException
    {
        return savePageArchive(path, storage, null);
    }

    /*
     * Save the page as an MHT archive, using @storage for resources while it is built.
     * With DISK_PERMANENT a .htm copy of the page and the downloaded files are kept.
     * @return path of the .mht file
     */
    public String savePageArchive(String path, FileStorage storage, String url) throws MhtException, IOException
    {
        validateFilename(path, ARCHIVE_EXTENSIONS);
        downloadRoot(url);
        return buildArchive(path, storage);
    }

    public String convertHtmlToArchive(String html, String path, FileStorage storage) throws MhtException, IOException
    {
        return convertHtmlToArchive(html, null, path, storage);
    }

    /*
     * Like savePageArchive(), for a page given as HTML text.
     * Relative references are resolved against @baseUrl if it is not null.
     */
    public String convertHtmlToArchive(String html, String baseUrl, String path, FileStorage storage)
            throws MhtException, IOException
    {
        validateFilename(path, ARCHIVE_EXTENSIONS);

        graph.clear();
        root = new ResourceNode(baseUrl, FileStorage.MEMORY, transport, fileStore, options);
        root.loadContent(html);
        if (!root.isFetched())
            throw new DownloadFailedException(baseUrl, new IllegalArgumentException("Empty HTML"));

        return buildArchive(path, storage);
    }

    /*
     * Write getPageArchive(@url) to @path
     */
    public void createArchive(String url, String path) throws MhtException, IOException
    {
        String archive = getPageArchive(url);
        fileStore.write(path, archive.getBytes(archiveCharset()));
    }

    /*
     * Archive files are written in the encoding of the page
     */
    private Charset archiveCharset()
    {
        return root.getTextEncoding() != null ? root.getTextEncoding() : Config.defaultCharset();
    }

    private String buildArchive(String path, FileStorage storage) throws MhtException, IOException
    {
        root.setDownloadPath(path);
        root.setUseHtmlTitleAsFilename(true);

        if (storage == FileStorage.DISK_PERMANENT)
            root.save(SafeFileName.changeExtension(root.getDownloadPath(), ".htm"));

        String mhtPath = SafeFileName.changeExtension(root.getDownloadPath(), ".mht");

        boolean done = false;

        try
        {
            graph.clear();
            graph.crawlReferences(root, root, storage, root.getExternalFilesFolder(), allowRecursiveFileRetrieval);

            encoder.writeAll(root, graph);
            encoder.finish(mhtPath, archiveCharset());
            done = true;
        }
        finally
        {
            encoder.reset();

            try
            {
                if (storage == FileStorage.DISK_TEMPORARY)
                    deleteTemporaryFiles();
            }
            catch (IOException ex)
            {
                // do not hide the failure of the build itself
                if (done)
                    throw ex;
                logger.warn("Unable to delete temporary files of {}: {}", mhtPath, ex.getLocalizedMessage());
            }
            finally
            {
                graph.clear();
            }
        }

        logger.info("Saved archive of {} to {}", root.getResolvedUrl(), mhtPath);
        return mhtPath;
    }

    /*
     * Delete temporary resource files, then the folders they leave empty, innermost first
     */
    private void deleteTemporaryFiles() throws IOException
    {
        Set<String> folders = new LinkedHashSet<>();

        for (ResourceNode node : graph.nodes())
        {
            if (node.getStorage() != FileStorage.DISK_TEMPORARY)
                continue;

            if (node.isFetched())
                fileStore.delete(node.getDownloadPath());

            if (!node.getDownloadFolder().isEmpty())
                folders.add(node.getDownloadFolder());
        }

        List<String> sorted = new ArrayList<>(folders);
        sorted.sort((a, b) -> b.length() - a.length());

        for (String folder : sorted)
        {
            if (fileStore.isDirectory(folder) && fileStore.list(folder).isEmpty())
                fileStore.deleteDirectory(folder);
        }
    }

    /* ============================================================================== */

    /*
     * Fetch the target page, setting it first if @url is given
     */
    private void downloadRoot(String url) throws MhtException
    {
        if (url != null && !url.isEmpty())
            setUrl(url);

        if (root == null)
            throw new InvalidUrlException(url);

        root.setStorage(FileStorage.MEMORY);
        root.setIfModifiedSince(ifModifiedSince);
        root.setAppended(false);
        root.fetch();

        if (!root.isFetched())
        {
            String target = root.getResolvedUrl() != null ? root.getResolvedUrl() : root.getOriginalUrl();
            throw new DownloadFailedException(target, root.getFailure());
        }
    }

    /*
     * A directory (trailing separator) is accepted as is, a file must have one of @extensions
     */
    public static void validateFilename(String path, String extensions) throws InvalidFileNameException
    {
        if (path == null || path.isEmpty())
            throw new InvalidFileNameException(path, extensions);

        if (SafeFileName.isDirectoryPath(path))
            return;

        String ext = Util.getFileExtension(path);
        if (ext == null)
            throw new InvalidFileNameException(path, extensions);

        for (String allowed : Util.asList(extensions, ";"))
        {
            if (allowed.equalsIgnoreCase("." + ext))
                return;
        }

        throw new InvalidExtensionException(path, "." + ext, extensions);
    }

    /* ============================================================================== */

    public String getMhtContentType()
    {
        return Config.MhtContentType;
    }

    public ResourceNode getRoot()
    {
        return root;
    }

    public ResourceGraph getGraph()
    {
        return graph;
    }

    public boolean isAddWebMark()
    {
        return options.addWebMark;
    }

    public void setAddWebMark(boolean addWebMark)
    {
        options.addWebMark = addWebMark;
    }

    public boolean isStripScripts()
    {
        return options.stripScripts;
    }

    public void setStripScripts(boolean stripScripts)
    {
        options.stripScripts = stripScripts;
    }

    public boolean isStripIframes()
    {
        return options.stripIframes;
    }

    public void setStripIframes(boolean stripIframes)
    {
        options.stripIframes = stripIframes;
    }

    /*
     * Force this encoding for all text resources instead of the detected one, null to detect
     */
    public void setTextEncoding(Charset textEncoding)
    {
        options.forcedEncoding = textEncoding;
    }

    public Charset getTextEncoding()
    {
        return options.forcedEncoding;
    }

    /*
     * HTTP date sent as If-Modified-Since with the page request, null for none.
     * A "not modified" answer fails the download.
     */
    public void setIfModifiedSince(String ifModifiedSince)
    {
        this.ifModifiedSince = ifModifiedSince;
    }

    public String getIfModifiedSince()
    {
        return ifModifiedSince;
    }

    public boolean isAllowRecursiveFileRetrieval()
    {
        return allowRecursiveFileRetrieval;
    }

    public void setAllowRecursiveFileRetrieval(boolean allowRecursiveFileRetrieval)
    {
        this.allowRecursiveFileRetrieval = allowRecursiveFileRetrieval;
    }
}
