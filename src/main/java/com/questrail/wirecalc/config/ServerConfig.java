package com.questrail.wirecalc.config;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * ServerConfig
 * -----------------------------------------------------------------------------
 * Operational configuration for the WireCalc server.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>bindAddress</b>: Local address of the listening socket. Port 0 binds
 *       an ephemeral port.</li>
 *   <li><b>readBufferSize</b>: Size of the per-connection read buffer. One
 *       blocking read fills at most this many bytes, so it is also the largest
 *       envelope (prefix included) a client can send.</li>
 *   <li><b>acceptPollInterval</b>: Pause between accept attempts when no
 *       connection is pending. Bounds how long the accept loop takes to notice
 *       that the running flag was cleared.</li>
 *   <li><b>backlog</b>: Listen backlog passed to the socket; 0 uses the
 *       platform default.</li>
 * </ul>
 */
public record ServerConfig(
        InetSocketAddress bindAddress,
        int readBufferSize,
        Duration acceptPollInterval,
        int backlog
) {
    public static final String HOST_KEY = "wirecalc.host";
    public static final String PORT_KEY = "wirecalc.port";
    public static final String READ_BUFFER_SIZE_KEY = "wirecalc.readBufferSize";
    public static final String ACCEPT_POLL_INTERVAL_KEY = "wirecalc.acceptPollIntervalMillis";
    public static final String BACKLOG_KEY = "wirecalc.backlog";

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 8080;
    public static final int DEFAULT_READ_BUFFER_SIZE = 512;
    public static final Duration DEFAULT_ACCEPT_POLL_INTERVAL = Duration.ofMillis(100);
    public static final int DEFAULT_BACKLOG = 0;

    /**
     * Canonical constructor with validation.
     */
    public ServerConfig {
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(acceptPollInterval, "acceptPollInterval");

        if (bindAddress.isUnresolved()) {
            throw new IllegalArgumentException("bindAddress cannot be resolved: " + bindAddress.getHostString());
        }

        if (readBufferSize < 1) {
            throw new IllegalArgumentException("readBufferSize must be positive");
        }
        if (acceptPollInterval.isNegative() || acceptPollInterval.isZero()) {
            throw new IllegalArgumentException("acceptPollInterval must be positive");
        }
        if (backlog < 0) {
            throw new IllegalArgumentException("backlog must be non-negative");
        }
    }

    /**
     * Default values:
     * <ul>
     *   <li>bindAddress: localhost:8080</li>
     *   <li>readBufferSize: 512 bytes</li>
     *   <li>acceptPollInterval: 100ms</li>
     *   <li>backlog: platform default</li>
     * </ul>
     */
    public static ServerConfig defaults() {
        return builder().build();
    }

    /**
     * Reads a configuration from properties. Missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value is not a number, is out of range,
     *                                  or names a host that cannot be resolved
     */
    public static ServerConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");

        String host = properties.getProperty(HOST_KEY, DEFAULT_HOST).trim();
        int port = intProperty(properties, PORT_KEY, DEFAULT_PORT);
        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException(PORT_KEY + " out of range: " + port);
        }

        InetSocketAddress bindAddress = new InetSocketAddress(host, port);
        if (bindAddress.isUnresolved()) {
            throw new IllegalArgumentException(HOST_KEY + " cannot be resolved: " + host);
        }

        return builder()
                .withBindAddress(bindAddress)
                .withReadBufferSize(intProperty(properties, READ_BUFFER_SIZE_KEY, DEFAULT_READ_BUFFER_SIZE))
                .withAcceptPollInterval(Duration.ofMillis(intProperty(properties, ACCEPT_POLL_INTERVAL_KEY,
                        (int) DEFAULT_ACCEPT_POLL_INTERVAL.toMillis())))
                .withBacklog(intProperty(properties, BACKLOG_KEY, DEFAULT_BACKLOG))
                .build();
    }

    private static int intProperty(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private InetSocketAddress bindAddress = new InetSocketAddress(DEFAULT_HOST, DEFAULT_PORT);
        private int readBufferSize = DEFAULT_READ_BUFFER_SIZE;
        private Duration acceptPollInterval = DEFAULT_ACCEPT_POLL_INTERVAL;
        private int backlog = DEFAULT_BACKLOG;

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withReadBufferSize(int readBufferSize) {
            this.readBufferSize = readBufferSize;
            return this;
        }

        public Builder withAcceptPollInterval(Duration acceptPollInterval) {
            this.acceptPollInterval = acceptPollInterval;
            return this;
        }

        public Builder withBacklog(int backlog) {
            this.backlog = backlog;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(bindAddress, readBufferSize, acceptPollInterval, backlog);
        }
    }
}
