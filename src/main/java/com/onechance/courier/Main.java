package com.onechance.courier;

import com.onechance.courier.main.Server;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;

import javax.naming.ConfigurationException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Optional;

/**
 * Main runnable.
 *
 * <p>This implements the commandline --server option.
 *
 * @see Server
 */
public class Main {

    /**
     * Application jar name.
     */
    private static final String NAME = "courier.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "Outbound email, SMS and MMS queue";

    private final String[] args;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        new Main(args);
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args String array.
     */
    Main(String[] args) {
        this.args = args;

        Optional<CommandLine> opt = parseArgs(options());
        if (opt.isPresent() && opt.get().hasOption("server")) {
            String path = opt.get().getOptionValue("server");
            try {
                Server.run(path);
            } catch (ConfigurationException e) {
                log("Configuration error: " + e.getMessage());
                System.exit(1);
            }
        } else {
            optionsUsage(options());
        }
    }

    /**
     * CLI options.
     *
     * @return Options instance.
     */
    Options options() {
        Options options = new Options();
        options.addOption(null, "server", true, "Run as server with given configuration directory");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    void optionsUsage(Options options) {
        log(USAGE);
        log(" " + DESCRIPTION);
        log("");

        StringWriter writer = new StringWriter();
        new HelpFormatter().printHelp(new PrintWriter(writer), HelpFormatter.DEFAULT_WIDTH, " ", "", options,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, "", true);

        log(writer.toString());
    }

    /**
     * Parser for CLI arguments.
     *
     * @param options Options instance.
     * @return Optional of CommandLine.
     */
    Optional<CommandLine> parseArgs(Options options) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args, true);
        } catch (Exception e) {
            log("Options error: " + e.getMessage());
            log("");
        }

        return Optional.ofNullable(cmd);
    }

    /**
     * Logging wrapper.
     *
     * @param string String.
     */
    void log(String string) {
        System.out.println(string);
    }
}
