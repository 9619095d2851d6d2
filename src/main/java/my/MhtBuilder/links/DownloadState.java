package my.MhtBuilder.links;

public enum DownloadState
{
    NOT_FETCHED, FETCHED, FAILED
}
