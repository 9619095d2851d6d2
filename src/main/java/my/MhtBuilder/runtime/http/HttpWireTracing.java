package my.MhtBuilder.runtime.http;

import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;

/*
 * Dump Apache HTTP Client 4 traffic to the log
 */
public class HttpWireTracing
{
    public static final String[] LOGGERS = { "org.apache.http.wire", "org.apache.http.headers", "org.apache.http.impl.conn" };

    public static void enable()
    {
        setLevel(Level.TRACE);
    }

    public static void disable()
    {
        setLevel(null);
    }

    private static void setLevel(Level level)
    {
        for (String name : LOGGERS)
            ((Logger) LoggerFactory.getLogger(name)).setLevel(level);
    }

    public static boolean isEnabled()
    {
        return ((Logger) LoggerFactory.getLogger(LOGGERS[0])).getLevel() == Level.TRACE;
    }
}
