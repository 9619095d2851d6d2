package my.MhtBuilder.mht;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.Charset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Base64;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import my.MhtBuilder.Config;
import my.MhtBuilder.errors.NotHtmlOperationException;
import my.MhtBuilder.links.FileStorage;
import my.MhtBuilder.links.ResourceGraph;
import my.MhtBuilder.links.ResourceNode;
import my.MhtBuilder.runtime.Util;
import my.MhtBuilder.runtime.file.FileStore;

/**
 * Writes a page and its resources as a multipart/related MIME message (RFC 2557).
 *
 * <p>
 * The encoder goes through EMPTY, HEADER_WRITTEN, PART_WRITTEN and FINALIZED. The header carries the root page as its
 * first part; {@link #finish()} hands out the text and discards it, after which a new header starts the next archive.
 */
public class ArchiveEncoder
{
    private static final Logger logger = LoggerFactory.getLogger(ArchiveEncoder.class);

    public static final String BOUNDARY = "----=_NextPart_000_00";

    /* 57 raw bytes give 76 base64 characters per line */
    public static final int BASE64_CHUNK = 57;

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss Z",
            Locale.US);

    public enum State
    {
        EMPTY, HEADER_WRITTEN, PART_WRITTEN, FINALIZED
    }

    private final FileStore fileStore;
    private StringBuilder sb = null;
    private State state = State.EMPTY;

    public ArchiveEncoder(FileStore fileStore)
    {
        this.fileStore = fileStore;
    }

    public State getState()
    {
        return state;
    }

    /* ============================================================================== */

    public void writeHeader(ResourceNode root) throws IOException
    {
        if (state != State.EMPTY && state != State.FINALIZED)
            throw new IllegalStateException("Archive header already written");

        sb = new StringBuilder();

        appendLine("From: <Saved by " + System.getProperty("user.name", "") + " on " + machineName() + ">");
        appendLine("Subject: " + subject(root));
        appendLine("Date: " + ZonedDateTime.now().format(DATE_FORMAT));
        appendLine("MIME-Version: 1.0");
        appendLine("Content-Type: multipart/related;");
        appendLine("\ttype=\"text/html\";");
        appendLine("\tboundary=\"" + BOUNDARY + "\"");
        appendLine("X-MimeOLE: Produced by " + Config.GeneratorName + " " + Config.GeneratorVersion);
        appendLine("");
        appendLine("This is a multi-part message in MIME format.");

        state = State.HEADER_WRITTEN;

        writePart(root);
    }

    private static String subject(ResourceNode root)
    {
        if (!root.isHtml())
            return "";

        try
        {
            return root.getHtmlTitle();
        }
        catch (NotHtmlOperationException ex)
        {
            throw new IllegalStateException(ex);
        }
    }

    private static String machineName()
    {
        try
        {
            return InetAddress.getLocalHost().getHostName();
        }
        catch (UnknownHostException ex)
        {
            String name = System.getenv("HOSTNAME");
            if (name == null)
                name = System.getenv("COMPUTERNAME");
            return name != null ? name : "localhost";
        }
    }

    /*
     * Append one resource unless it was appended already or could not be downloaded
     */
    public void writePart(ResourceNode node) throws IOException
    {
        if (state != State.HEADER_WRITTEN && state != State.PART_WRITTEN)
            throw new IllegalStateException("Archive header is not written");

        if (node.isFetched() && !node.isAppended())
        {
            if (node.isBinary())
                appendBinaryPart(node);
            else
                appendTextPart(node);

            state = State.PART_WRITTEN;
        }

        node.setAppended(true);
    }

    /*
     * Header with the root page, all resources in key order, closing boundary
     */
    public void writeAll(ResourceNode root, ResourceGraph graph) throws IOException
    {
        writeHeader(root);

        for (ResourceNode node : graph.nodes())
            writePart(node);

        appendBoundary();
    }

    private void appendBoundary()
    {
        appendLine("");
        appendLine("--" + BOUNDARY);
    }

    private void appendTextPart(ResourceNode node)
    {
        Charset cs = node.getTextEncoding();

        appendBoundary();
        appendLine("Content-Type: " + node.getContentType() + ";");
        appendLine("\tcharset=\"" + cs.name().toLowerCase(Locale.ROOT) + "\"");
        appendLine("Content-Transfer-Encoding: quoted-printable");
        appendLine("Content-Location: " + location(node));
        appendLine("");
        appendLine(QuotedPrintable.encode(node.toString(), cs));
    }

    private void appendBinaryPart(ResourceNode node) throws IOException
    {
        appendBoundary();
        appendLine("Content-Type: " + node.getContentType());
        appendLine("Content-Transfer-Encoding: base64");
        appendLine("Content-Location: " + location(node));
        appendLine("");

        byte[] bytes;
        if (node.getStorage() == FileStorage.MEMORY)
            bytes = node.getBytes();
        else
            bytes = fileStore.readAll(node.getDownloadPath());

        Base64.Encoder encoder = Base64.getEncoder();
        for (int i = 0; i < bytes.length; i += BASE64_CHUNK)
        {
            int len = Math.min(BASE64_CHUNK, bytes.length - i);
            byte[] chunk = new byte[len];
            System.arraycopy(bytes, i, chunk, 0, len);
            appendLine(encoder.encodeToString(chunk));
        }
    }

    private static String location(ResourceNode node)
    {
        return node.getResolvedUrl() != null ? node.getResolvedUrl() : "";
    }

    private void appendLine(String s)
    {
        sb.append(s);
        sb.append(Util.CRLF);
    }

    /* ============================================================================== */

    /*
     * Archive text; the buffer is discarded
     */
    public String finish()
    {
        checkWritten();

        String s = sb.toString();
        sb = null;
        state = State.FINALIZED;
        return s;
    }

    /*
     * Write the archive to @path in @charset.
     * Write errors are logged, the buffer is discarded in any case.
     */
    public void finish(String path, Charset charset)
    {
        checkWritten();

        try
        {
            logger.info("Writing archive {} ({})", path, charset.name());
            fileStore.write(path, sb.toString().getBytes(charset));
        }
        catch (IOException | SecurityException ex)
        {
            logger.error("Unable to write archive {}: {}", path, ex.getLocalizedMessage());
        }
        finally
        {
            sb = null;
            state = State.FINALIZED;
        }
    }

    /*
     * Drop an unfinished archive, e.g. after a failed part
     */
    public void reset()
    {
        sb = null;
        state = State.EMPTY;
    }

    private void checkWritten()
    {
        if (state != State.HEADER_WRITTEN && state != State.PART_WRITTEN)
            throw new IllegalStateException("Archive header is not written");
    }
}
