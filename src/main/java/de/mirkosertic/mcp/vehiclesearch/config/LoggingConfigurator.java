package de.mirkosertic.mcp.vehiclesearch.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Switches Logback to file-only output when the server runs behind the STDIO transport.
 * <p>
 * In deployed mode logback-deployed.xml is loaded, so nothing but JSON-RPC frames
 * reaches stdout. In development mode the classpath logback.xml stays active.
 */
public final class LoggingConfigurator {

    private static final Path LOG_DIR = Paths.get(System.getProperty("user.home"), ".mcpvehicles", "log");
    private static final String DEPLOYED_CONFIG = "logback-deployed.xml";

    private LoggingConfigurator() {
    }

    /**
     * Must be called before the first logger is used.
     *
     * @param deployedMode true if running in deployed mode (STDIO transport)
     */
    public static void configure(final boolean deployedMode) {
        if (deployedMode) {
            ensureLogDirectoryExists();
            loadConfiguration(DEPLOYED_CONFIG);
        }
    }

    private static void ensureLogDirectoryExists() {
        try {
            Files.createDirectories(LOG_DIR);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + LOG_DIR + ": " + e.getMessage());
        }
    }

    private static void loadConfiguration(final String configFile) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try (InputStream configStream = LoggingConfigurator.class.getClassLoader().getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + configFile + " on classpath");
                return;
            }
            context.reset();
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logback configuration " + configFile + ": " + e.getMessage());
        }
    }
}
