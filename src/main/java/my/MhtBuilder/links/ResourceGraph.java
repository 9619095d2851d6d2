package my.MhtBuilder.links;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import my.MhtBuilder.errors.InvalidUrlException;
import my.MhtBuilder.runtime.file.FileStore;
import my.MhtBuilder.runtime.http.Transport;

/**
 * Resources referenced by a page, keyed by the URL as it was referenced.
 *
 * <p>
 * Iteration is in ascending key order, which is the order of parts in an archive. Every URL is fetched at most once
 * per graph, so pages referencing each other do not make the crawl loop.
 */
public class ResourceGraph
{
    private static final Logger logger = LoggerFactory.getLogger(ResourceGraph.class);

    private final Map<String, ResourceNode> nodes = new TreeMap<>();

    private final Transport transport;
    private final FileStore fileStore;
    private final ResourceNode.Options options;

    public ResourceGraph(Transport transport, FileStore fileStore, ResourceNode.Options options)
    {
        this.transport = transport;
        this.fileStore = fileStore;
        this.options = options;
    }

    /*
     * Download everything @node references, and with @recursive what those reference in turn.
     * Files of disk-stored resources go to @targetFolder, resources found in a nested
     * page or stylesheet go to its own "<name>_files" subfolder.
     */
    public void crawlReferences(ResourceNode node, ResourceNode root, FileStorage storage, String targetFolder,
            boolean recursive) throws IOException
    {
        Map<String, String> references = node.extractReferences();
        if (references.isEmpty())
            return;

        logger.debug("Downloading {} references of {}", references.size(), node.getResolvedUrl());

        for (String url : references.values())
        {
            if (isKnown(url, root))
                continue;

            ResourceNode child;
            try
            {
                child = new ResourceNode(url, storage, transport, fileStore, options);
            }
            catch (InvalidUrlException ex)
            {
                logger.warn("Skipping malformed reference {} in {}", url, node.getResolvedUrl());
                continue;
            }

            if (storage.onDisk())
            {
                fileStore.createDirectories(targetFolder);
                child.setDownloadFolder(targetFolder);
            }

            child.fetch();
            nodes.put(url, child);

            if (recursive && child.isFetched() && (child.isHtml() || child.isCss()))
                crawlReferences(child, root, storage, child.getExternalFilesFolder(), recursive);
        }
    }

    private boolean isKnown(String url, ResourceNode root)
    {
        if (nodes.containsKey(url))
            return true;

        if (root != null && (url.equals(root.getOriginalUrl()) || url.equals(root.getRequestedUrl())
                || url.equals(root.getResolvedUrl())))
            return true;

        return false;
    }

    public ResourceNode get(String url)
    {
        return nodes.get(url);
    }

    public boolean contains(String url)
    {
        return nodes.containsKey(url);
    }

    public int size()
    {
        return nodes.size();
    }

    public boolean isEmpty()
    {
        return nodes.isEmpty();
    }

    /*
     * In ascending key order
     */
    public Collection<ResourceNode> nodes()
    {
        return nodes.values();
    }

    public List<String> keys()
    {
        return new ArrayList<>(nodes.keySet());
    }

    public void clear()
    {
        nodes.clear();
    }
}
