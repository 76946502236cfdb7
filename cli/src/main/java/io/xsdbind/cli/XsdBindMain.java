package io.xsdbind.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the {@code xsd-bind} command line tool. Delegates to {@link XsdBindApp} and exits
 * with its status code.
 */
public final class XsdBindMain {

    private static final Logger LOG = LoggerFactory.getLogger(XsdBindMain.class);

    private XsdBindMain() {
        // utility class
    }

    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int status;
        try {
            status = new XsdBindApp(System.out, System.err, System::getenv).run(args);
        } catch (RuntimeException e) {
            LOG.error("xsd-bind failed: {}", e.getMessage(), e);
            status = XsdBindApp.EXIT_USAGE;
        }
        System.exit(status);
    }
}
