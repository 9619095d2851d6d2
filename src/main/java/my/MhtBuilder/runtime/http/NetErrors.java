package my.MhtBuilder.runtime.http;

import javax.net.ssl.SSLException;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

import org.apache.http.NoHttpResponseException;
import org.apache.http.client.ClientProtocolException;
import org.apache.http.conn.ConnectTimeoutException;

/**
 * Classification of fetch failures for retry decisions and log messages.
 */
public final class NetErrors
{
    private NetErrors()
    {
    }

    /**
     * @param ex
     *            any Throwable
     * @return {@code true} if {@code ex} or one of its causes comes from the network or the HTTP exchange
     */
    public static boolean isNetworkException(Throwable ex)
    {
        for (Throwable t = ex; t != null; t = t.getCause())
        {
            if (t instanceof UnknownHostException || t instanceof NoRouteToHostException)
                return true;

            // HttpHostConnectException is a ConnectException
            if (t instanceof ConnectException || t instanceof ConnectTimeoutException)
                return true;

            if (t instanceof SocketException || t instanceof SocketTimeoutException || t instanceof SSLException)
                return true;

            if (t instanceof NoHttpResponseException || t instanceof ClientProtocolException)
                return true;
        }

        return false;
    }

    /*
     * Transient failures worth another attempt
     */
    public static boolean isRetriable(Throwable ex)
    {
        for (Throwable t = ex; t != null; t = t.getCause())
        {
            if (t instanceof SocketTimeoutException || t instanceof NoHttpResponseException)
                return true;
        }

        return false;
    }

    /*
     * One-line description of the innermost cause
     */
    public static String describe(Throwable ex)
    {
        Throwable t = ex;
        while (t.getCause() != null && t.getCause() != t)
            t = t.getCause();

        String msg = t.getLocalizedMessage();
        if (msg == null || msg.isEmpty())
            return t.getClass().getSimpleName();
        else
            return t.getClass().getSimpleName() + ": " + msg;
    }
}
