package my.MhtBuilder.runtime.file;

import java.io.File;
import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/*
 * FileStore over the local filesystem
 */
public class LocalFileStore implements FileStore
{
    private static final Logger logger = LoggerFactory.getLogger(LocalFileStore.class);

    @Override
    public void createDirectories(String path) throws IOException
    {
        File file = new File(path);
        if (file.exists() && file.isDirectory())
            return;

        FileUtils.forceMkdir(file);

        if (!file.isDirectory())
            throw new UnableCreateDirectoryException("Unable to create directory " + path);
    }

    public static class UnableCreateDirectoryException extends IOException
    {
        private static final long serialVersionUID = 1L;

        public UnableCreateDirectoryException(String msg)
        {
            super(msg);
        }
    }

    @Override
    public void write(String path, byte[] bytes) throws IOException
    {
        logger.debug("Saving to file {}", path);

        File file = new File(path);
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null)
            createDirectories(parent.getPath());

        FileUtils.writeByteArrayToFile(file, bytes);
    }

    @Override
    public byte[] readAll(String path) throws IOException
    {
        return FileUtils.readFileToByteArray(new File(path));
    }

    @Override
    public boolean delete(String path) throws IOException
    {
        return Files.deleteIfExists(Paths.get(path));
    }

    @Override
    public boolean deleteDirectory(String path) throws IOException
    {
        Path dir = Paths.get(path);
        if (!Files.isDirectory(dir))
            return false;

        try
        {
            Files.delete(dir);
            return true;
        }
        catch (DirectoryNotEmptyException ex)
        {
            logger.debug("Not deleting {}, directory is not empty", path);
            return false;
        }
    }

    @Override
    public List<String> list(String path) throws IOException
    {
        List<String> names = new ArrayList<>();

        try (DirectoryStream<Path> stream = Files.newDirectoryStream(Paths.get(path)))
        {
            for (Path entry : stream)
                names.add(entry.getFileName().toString());
        }

        return names;
    }

    @Override
    public boolean exists(String path)
    {
        return new File(path).exists();
    }

    @Override
    public boolean isDirectory(String path)
    {
        return new File(path).isDirectory();
    }
}
