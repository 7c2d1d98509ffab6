package com.questrail.wirecalc.runtime;

import com.questrail.wirecalc.config.ServerConfig;
import com.questrail.wirecalc.observability.Slf4jServerObservabilitySink;
import com.questrail.wirecalc.server.WireCalcServer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * WireCalcServerMain
 * =============================================================================
 * Process entry point and composition root.
 *
 * <p>Configuration is read from {@code wirecalc.properties} on the classpath,
 * then overridden by JVM system properties with the same keys, for example
 * {@code -Dwirecalc.port=9000}. A JVM shutdown hook clears the server's
 * running flag.</p>
 */
public final class WireCalcServerMain
{
    private static final Logger log = LoggerFactory.getLogger(WireCalcServerMain.class);

    static final String CONFIG_RESOURCE = "wirecalc.properties";

    private WireCalcServerMain() {}

    public static void main(String[] args)
    {
        final ServerConfig config;
        try {
            config = ServerConfig.fromProperties(loadProperties(CONFIG_RESOURCE, System.getProperties()));
        } catch (IllegalArgumentException | UncheckedIOException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        final WireCalcServer server;
        try {
            server = WireCalcServer.builder()
                    .withConfig(config)
                    .withObservabilitySink(new Slf4jServerObservabilitySink())
                    .bind();
        } catch (IOException e) {
            log.error("Failed to bind {}", config.bindAddress(), e);
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "wirecalc-shutdown"));
        server.run();
    }

    /**
     * Loads {@code resource} from the classpath (if present) and applies
     * every {@code wirecalc.*} entry of {@code overrides} on top.
     */
    static Properties loadProperties(String resource, Properties overrides)
    {
        Properties properties = new Properties();

        try (InputStream in = WireCalcServerMain.class.getClassLoader().getResourceAsStream(resource)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }

        for (String key : overrides.stringPropertyNames()) {
            if (key.startsWith("wirecalc.")) {
                properties.setProperty(key, overrides.getProperty(key));
            }
        }
        return properties;
    }
}
