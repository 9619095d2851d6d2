package my.MhtBuilder.errors;

/*
 * Base of all failures reported by the archive builder
 */
public class MhtException extends Exception
{
    private static final long serialVersionUID = 1L;

    public MhtException(String msg)
    {
        super(msg);
    }

    public MhtException(String msg, Throwable cause)
    {
        super(msg, cause);
    }
}
