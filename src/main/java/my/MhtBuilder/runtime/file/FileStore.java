package my.MhtBuilder.runtime.file;

import java.io.IOException;
import java.util.List;

/**
 * Filesystem operations needed to save pages and their resources.
 * Paths are plain strings with either separator.
 */
public interface FileStore
{
    /* create directory with parents, no-op if it exists */
    void createDirectories(String path) throws IOException;

    /* create or truncate the file and write @bytes into it */
    void write(String path, byte[] bytes) throws IOException;

    byte[] readAll(String path) throws IOException;

    /* @return false if the file did not exist */
    boolean delete(String path) throws IOException;

    /* delete an empty directory, @return false if it is absent or not empty */
    boolean deleteDirectory(String path) throws IOException;

    /* names of the entries in a directory */
    List<String> list(String path) throws IOException;

    boolean exists(String path);

    boolean isDirectory(String path);
}
