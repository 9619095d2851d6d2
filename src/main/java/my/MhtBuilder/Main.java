package my.MhtBuilder;

/*
 * Command line front end: save a web page as HTML, text, complete page or MHT archive.
 */

import java.util.ArrayList;
import java.util.List;

import my.MhtBuilder.errors.MhtException;
import my.MhtBuilder.links.FileStorage;
import my.MhtBuilder.runtime.Util;
import my.MhtBuilder.runtime.http.HttpWireTracing;

public class Main
{
    private String command;
    private String url;
    private String path;
    private FileStorage storage = FileStorage.MEMORY;
    private boolean recursive = true;
    private boolean stripScripts = false;
    private boolean stripIframes = false;
    private boolean trace = false;

    public static void main(String[] args)
    {
        Main main = new Main();
        System.exit(main.do_main(args));
    }

    int do_main(String[] args)
    {
        try
        {
            if (!parseArgs(args))
            {
                usage();
                return 2;
            }

            Config.init();
            if (trace)
                HttpWireTracing.enable();

            try (Builder builder = new Builder())
            {
                builder.setAllowRecursiveFileRetrieval(recursive);
                builder.setStripScripts(stripScripts);
                builder.setStripIframes(stripIframes);
                return execute(builder);
            }
        }
        catch (MhtException ex)
        {
            Util.err("*** " + ex.getLocalizedMessage());
            return 1;
        }
        catch (Exception ex)
        {
            Util.err("*** Exception: " + ex.getLocalizedMessage());
            ex.printStackTrace();
            return 1;
        }
    }

    int execute(Builder builder) throws Exception
    {
        switch (command)
        {
        case "page":
            Util.out(">>> Saved " + builder.savePage(path, url));
            break;

        case "text":
            Util.out(">>> Saved " + builder.savePageText(path, url));
            break;

        case "complete":
            Util.out(">>> Saved " + builder.savePageComplete(path, url));
            break;

        case "archive":
            Util.out(">>> Saved " + builder.savePageArchive(path, storage, url));
            break;

        case "mht-string":
            Util.out(builder.getPageArchive(url));
            break;

        default:
            usage();
            return 2;
        }

        return 0;
    }

    boolean parseArgs(String[] args)
    {
        List<String> positional = new ArrayList<>();

        for (String arg : args)
        {
            if (arg.startsWith("--storage="))
            {
                String value = arg.substring("--storage=".length());
                if (value.equals("memory"))
                    storage = FileStorage.MEMORY;
                else if (value.equals("temp"))
                    storage = FileStorage.DISK_TEMPORARY;
                else if (value.equals("permanent"))
                    storage = FileStorage.DISK_PERMANENT;
                else
                    return false;
            }
            else if (arg.equals("--no-recursion"))
            {
                recursive = false;
            }
            else if (arg.equals("--strip-scripts"))
            {
                stripScripts = true;
            }
            else if (arg.equals("--strip-iframes"))
            {
                stripIframes = true;
            }
            else if (arg.equals("--trace"))
            {
                trace = true;
            }
            else if (arg.startsWith("--"))
            {
                return false;
            }
            else
            {
                positional.add(arg);
            }
        }

        if (positional.size() < 2)
            return false;

        command = positional.get(0);
        url = positional.get(1);

        if (command.equals("mht-string"))
            return positional.size() == 2;

        if (positional.size() != 3)
            return false;

        path = positional.get(2);
        return true;
    }

    private static void usage()
    {
        Util.err("Usage: MhtBuilder page|text|complete|archive <url> <path> [options]");
        Util.err("       MhtBuilder mht-string <url> [options]");
        Util.err("");
        Util.err("Options:");
        Util.err("    --storage=memory|temp|permanent   where archive resources are kept while building");
        Util.err("    --no-recursion                    do not follow references of nested pages and stylesheets");
        Util.err("    --strip-scripts                   remove <script> elements");
        Util.err("    --strip-iframes                   remove <iframe> elements");
        Util.err("    --trace                           log HTTP traffic");
        Util.err("");
        Util.err("Settings are read from -D" + Config.SystemPropertyPrefix + "<name> system properties.");
    }

    /* for tests */
    FileStorage getStorage()
    {
        return storage;
    }

    String getCommand()
    {
        return command;
    }

    String getPath()
    {
        return path;
    }

    boolean isRecursive()
    {
        return recursive;
    }
}
