package my.MhtBuilder.links;

/*
 * Where downloaded resources are kept while an archive is being built
 */
public enum FileStorage
{
    /* in memory only, the filesystem is not touched */
    MEMORY,

    /* saved to disk and deleted once the archive is written */
    DISK_TEMPORARY,

    /* saved to disk and kept */
    DISK_PERMANENT;

    public boolean onDisk()
    {
        return this != MEMORY;
    }
}
