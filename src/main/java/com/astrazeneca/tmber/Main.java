package com.astrazeneca.tmber;

import com.astrazeneca.tmber.exception.ConfigurationException;
import htsjdk.samtools.util.Log;
import org.apache.commons.cli.ParseException;

import java.io.IOException;

public class Main {
    private static final Log log = Log.getInstance(Main.class);

    /**
     * Parses the command line and starts the requested command. Any failure stops the program with exit code 1.
     * @param args array of arguments from command line
     */
    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        Configuration config;
        try {
            config = new CmdParser().parseParams(args);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            return 1;
        }
        if (config == null) {
            return 0;
        }
        Log.setGlobalLogLevel(config.logLevel);
        try {
            new TmbLauncher().start(config);
            return 0;
        } catch (ConfigurationException e) {
            log.error(e.getMessage());
        } catch (IOException | RuntimeException e) {
            log.error(e, "tmber fails: ", e.getMessage());
        }
        return 1;
    }
}
