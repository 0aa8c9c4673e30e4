package net.es.netapps.ncxml;

import net.es.netapps.ncxml.operations.Filter;
import net.es.netapps.ncxml.operations.Get;
import net.es.netapps.ncxml.operations.GetConfig;
import net.es.netapps.ncxml.operations.GetReply;
import net.es.netapps.ncxml.operations.RpcError;
import net.es.netapps.ncxml.session.DeviceSession;
import net.es.netapps.ncxml.session.Session;
import net.juniper.netconf.NetconfException;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retrieve configuration or state from a NETCONF device and print the returned
 * data.
 */
public class Retrieve {
    private static final String DEVICE = "device";
    private static final String USERNAME = "username";
    private static final String PASSWORD = "password";
    private static final String OPERATION = "operation";
    private static final String SOURCE = "source";
    private static final String SUBTREE = "subtree";
    private static final String XPATH = "xpath";
    private static final String TIMEOUT = "timeout";

    public static final String GET = "get";
    public static final String GET_CONFIG = "get-config";

    private static final String DEFAULT_SOURCE = "running";

    // 5 minutes to account for large responses.
    private static final int DEFAULT_TIMEOUT = 5 * 60 * 1000;

    private static final Logger logger = LoggerFactory.getLogger(Retrieve.class);

    private Retrieve() {
    }

    public static void main(String[] args) throws ParseException, NetconfException {
        RetrieveOptions options;
        try {
            options = parse(args);
        } catch (ParseException e) {
            System.err.println("Error: You did not provide the correct arguments, see usage below.");
            HelpFormatter formatter = new HelpFormatter();
            formatter.printHelp("netconf-xml -device <device dns or ip> -username <username> -password <password>",
                getOptions());
            throw e;
        }

        logger.info("[Retrieve] starting {}", options);

        DeviceSession session = new DeviceSession(options.getDevice(), options.getUsername(),
            options.getPassword(), options.getTimeout());
        session.connect();
        try {
            GetReply reply = retrieve(session, options);
            if (!reply.isOk()) {
                for (RpcError error : reply.getErrors()) {
                    logger.error("[Retrieve] encountered error \"{}\", {} = \"{}\"",
                        error.getMessage(), error.getType(), error.getTag());
                }
                throw new NetconfException(
                    String.format("Failed to retrieve %s from %s", options.getOperation(), options.getDevice()));
            }

            String data = reply.getDataXml();
            if (data == null) {
                logger.info("[Retrieve] {} returned no data.", options.getDevice());
            } else {
                System.out.println(data);
            }
        } finally {
            disconnect(session);
        }
    }

    /**
     * Close a session, logging rather than raising a failure so it never hides
     * the outcome of the retrieval.
     *
     * @param session the session to close.
     * @return true if the session closed cleanly.
     */
    static boolean disconnect(AutoCloseable session) {
        try {
            session.close();
            return true;
        } catch (Exception ex) {
            logger.warn("[Retrieve] failed to close session {}", session, ex);
            return false;
        }
    }

    /**
     * Issue the requested read operation over a session.
     *
     * @param session an established session.
     * @param options what to retrieve.
     * @return the reply.
     * @throws NetconfException if the operation could not be completed.
     */
    public static GetReply retrieve(Session session, RetrieveOptions options) throws NetconfException {
        if (GET.equals(options.getOperation())) {
            return new Get(session).request(options.getFilter());
        }
        return new GetConfig(session).request(options.getSource(), options.getFilter());
    }

    /**
     * Parse the command line arguments.
     *
     * @param args the arguments.
     * @return the options they describe.
     * @throws ParseException if arguments are missing, malformed or conflicting.
     */
    public static RetrieveOptions parse(String[] args) throws ParseException {
        CommandLineParser parser = new DefaultParser();
        CommandLine cmd = parser.parse(getOptions(), args);

        String operation = cmd.getOptionValue(OPERATION, GET_CONFIG);
        if (!GET.equals(operation) && !GET_CONFIG.equals(operation)) {
            throw new ParseException(String.format("Unknown operation %s, expected %s or %s", operation, GET, GET_CONFIG));
        }

        if (cmd.hasOption(SUBTREE) && cmd.hasOption(XPATH)) {
            throw new ParseException("Only one of -subtree and -xpath may be given.");
        }

        Filter filter = null;
        if (cmd.hasOption(SUBTREE)) {
            filter = Filter.subtree(cmd.getOptionValue(SUBTREE));
        } else if (cmd.hasOption(XPATH)) {
            filter = Filter.xpath(cmd.getOptionValue(XPATH));
        }

        int timeout;
        try {
            timeout = Integer.parseInt(cmd.getOptionValue(TIMEOUT, Integer.toString(DEFAULT_TIMEOUT)));
        } catch (NumberFormatException e) {
            throw new ParseException("Timeout must be a number of milliseconds: " + cmd.getOptionValue(TIMEOUT));
        }

        return RetrieveOptions.builder()
            .device(cmd.getOptionValue(DEVICE))
            .username(cmd.getOptionValue(USERNAME))
            .password(cmd.getOptionValue(PASSWORD))
            .operation(operation)
            .source(cmd.getOptionValue(SOURCE, DEFAULT_SOURCE))
            .filter(filter)
            .timeout(timeout)
            .build();
    }

    private static Options getOptions() {
        // Create Options object to hold our command line options.
        Options options = new Options();

        // Need to know the device to which we are connecting.
        Option deviceOption = new Option(DEVICE, true, "Name of the netconf device.");
        deviceOption.setRequired(true);
        options.addOption(deviceOption);

        // Need to know the username we can use for authentication with the device.
        Option usernameOption = new Option(USERNAME, true, "User name used to authenticate with device.");
        usernameOption.setRequired(true);
        options.addOption(usernameOption);

        // Need to know the password we can use for authentication with the device.
        Option pwOption = new Option(PASSWORD, true, "Password associated with user name.");
        pwOption.setRequired(true);
        options.addOption(pwOption);

        options.addOption(new Option(OPERATION, true, "Operation to issue, get or get-config (default get-config)."));
        options.addOption(new Option(SOURCE, true, "Datastore or URL to read for get-config (default running)."));
        options.addOption(new Option(SUBTREE, true, "Subtree filter as XML."));
        options.addOption(new Option(XPATH, true, "XPath filter expression."));
        options.addOption(new Option(TIMEOUT, true, "Command timeout in milliseconds."));
        return options;
    }
}
