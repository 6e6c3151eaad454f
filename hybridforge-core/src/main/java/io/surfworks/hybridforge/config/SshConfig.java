package io.surfworks.hybridforge.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings for the remote host.
 *
 * @param host                  SSH hostname
 * @param port                  SSH port
 * @param username              SSH username
 * @param password              password (null = key only)
 * @param privateKeyPath        private key file (null = password only)
 * @param setupCommand          command run before every stage command, e.g. activating an environment (may be null)
 * @param profileInit           shell sequence prefixed to every command (empty = none)
 * @param maxAttempts           connection attempts before giving up
 * @param retryDelay            pause between connection attempts
 * @param connectTimeout        timeout of a single connection attempt
 * @param commandTimeout        timeout of a remote command ({@link Duration#ZERO} = wait forever)
 * @param strictHostKeyChecking whether unknown host keys are rejected
 * @param knownHosts            known_hosts file used when checking host keys (may be null)
 */
public record SshConfig(
        String host,
        int port,
        String username,
        String password,
        Path privateKeyPath,
        String setupCommand,
        String profileInit,
        int maxAttempts,
        Duration retryDelay,
        Duration connectTimeout,
        Duration commandTimeout,
        boolean strictHostKeyChecking,
        Path knownHosts
) {

    /** Default SSH port */
    public static final int DEFAULT_PORT = 22;

    /** Default number of connection attempts */
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    /** Default pause between connection attempts */
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(3);

    /** Default timeout of one connection attempt */
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

    /** Sources the login profile so environment managers are active */
    public static final String DEFAULT_PROFILE_INIT = "source /etc/profile && source ~/.bashrc";

    public SshConfig {
        Objects.requireNonNull(host, "host cannot be null");
        Objects.requireNonNull(username, "username cannot be null");
        Objects.requireNonNull(retryDelay, "retryDelay cannot be null");
        Objects.requireNonNull(connectTimeout, "connectTimeout cannot be null");

        if (host.isBlank()) {
            throw new IllegalArgumentException("host cannot be blank");
        }
        if (username.isBlank()) {
            throw new IllegalArgumentException("username cannot be blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay cannot be negative");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }

        commandTimeout = commandTimeout == null ? Duration.ZERO : commandTimeout;
        if (commandTimeout.isNegative()) {
            throw new IllegalArgumentException("commandTimeout cannot be negative");
        }
        profileInit = profileInit == null ? "" : profileInit.strip();
        if (setupCommand != null && setupCommand.isBlank()) {
            setupCommand = null;
        }
        if (password != null && password.isEmpty()) {
            password = null;
        }
    }

    /**
     * Creates a password-authenticated config with default retry and timeout settings.
     */
    public static SshConfig of(String host, int port, String username, String password) {
        return new SshConfig(host, port, username, password, null, null, DEFAULT_PROFILE_INIT,
                DEFAULT_MAX_ATTEMPTS, DEFAULT_RETRY_DELAY, DEFAULT_CONNECT_TIMEOUT, Duration.ZERO,
                false, null);
    }

    /**
     * Creates a key-authenticated config with default retry and timeout settings.
     */
    public static SshConfig withKey(String host, int port, String username, Path keyPath) {
        return new SshConfig(host, port, username, null, keyPath, null, DEFAULT_PROFILE_INIT,
                DEFAULT_MAX_ATTEMPTS, DEFAULT_RETRY_DELAY, DEFAULT_CONNECT_TIMEOUT, Duration.ZERO,
                false, null);
    }

    /**
     * Returns a new config with the specified setup command.
     */
    public SshConfig setup(String command) {
        return new SshConfig(host, port, username, password, privateKeyPath, command, profileInit,
                maxAttempts, retryDelay, connectTimeout, commandTimeout, strictHostKeyChecking, knownHosts);
    }

    /**
     * Returns a new config with the specified profile initialization sequence.
     */
    public SshConfig profile(String init) {
        return new SshConfig(host, port, username, password, privateKeyPath, setupCommand, init,
                maxAttempts, retryDelay, connectTimeout, commandTimeout, strictHostKeyChecking, knownHosts);
    }

    /**
     * Returns a new config with the specified retry policy.
     */
    public SshConfig retry(int attempts, Duration delay) {
        return new SshConfig(host, port, username, password, privateKeyPath, setupCommand, profileInit,
                attempts, delay, connectTimeout, commandTimeout, strictHostKeyChecking, knownHosts);
    }

    /**
     * Returns a new config with the specified remote command timeout.
     */
    public SshConfig commandTimeout(Duration timeout) {
        return new SshConfig(host, port, username, password, privateKeyPath, setupCommand, profileInit,
                maxAttempts, retryDelay, connectTimeout, timeout, strictHostKeyChecking, knownHosts);
    }

    /**
     * Returns true if remote commands are bounded by a timeout.
     */
    public boolean hasCommandTimeout() {
        return !commandTimeout.isZero();
    }

    /**
     * Returns the connection target ({@code user@host:port}).
     */
    public String target() {
        return username + "@" + host + ":" + port;
    }

    @Override
    public String toString() {
        return "SshConfig[target=" + target()
                + ", password=" + (password != null ? "****" : "none")
                + ", privateKeyPath=" + privateKeyPath
                + ", setupCommand=" + setupCommand
                + ", maxAttempts=" + maxAttempts
                + ", retryDelay=" + retryDelay
                + ", connectTimeout=" + connectTimeout
                + ", commandTimeout=" + commandTimeout
                + ", strictHostKeyChecking=" + strictHostKeyChecking + "]";
    }
}
