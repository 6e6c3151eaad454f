package io.surfworks.hybridforge.testing;

import io.surfworks.hybridforge.config.SshConfig;
import io.surfworks.hybridforge.remote.CommandResult;
import io.surfworks.hybridforge.remote.RemoteConnection;
import io.surfworks.hybridforge.remote.RemoteTransport;
import io.surfworks.hybridforge.remote.TransferChannel;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * In-memory remote host for unit testing.
 *
 * <p>Acts as a {@link RemoteTransport} whose connections run against an
 * in-memory filesystem. Stage commands following the
 * {@code --task/--input/--output/--timing-output} contract are simulated:
 * the output file is written and the timing file reports the compute time
 * configured with {@link #stageTime}. Every connection attempt, command and
 * transfer is recorded for assertions, and failures can be injected at each
 * step.
 */
public final class MockRemoteHost implements RemoteTransport {

    private final Map<String, byte[]> files = new LinkedHashMap<>();
    private final Set<String> directories = new HashSet<>();
    private final List<String> commands = new ArrayList<>();
    private final List<String> stageInvocations = new ArrayList<>();
    private final List<String> uploads = new ArrayList<>();
    private final List<String> downloads = new ArrayList<>();
    private final Map<String, Double> stageTimes = new HashMap<>();
    private final Set<String> failingTasks = new HashSet<>();
    private final Set<String> rejectedUploads = new HashSet<>();

    private int connectAttempts;
    private int connectFailures;
    private int connectionsOpened;
    private int connectionsClosed;
    private int channelsOpened;
    private int channelsClosed;

    private Function<String, CommandResult> commandHandler;
    private ManualClock clock;
    private Duration uploadDelay = Duration.ZERO;
    private Duration downloadDelay = Duration.ZERO;

    @Override
    public String name() {
        return "mock";
    }

    @Override
    public synchronized RemoteConnection connect(SshConfig config) throws IOException {
        connectAttempts++;
        if (connectFailures > 0) {
            connectFailures--;
            throw new ConnectException("Connection refused: " + config.host() + ":" + config.port());
        }
        connectionsOpened++;
        return new MockConnection();
    }

    // ===== Failure injection =====

    /**
     * Makes the next {@code count} connection attempts fail.
     */
    public MockRemoteHost failConnects(int count) {
        this.connectFailures = count;
        return this;
    }

    /**
     * Makes every connection attempt fail.
     */
    public MockRemoteHost failAllConnects() {
        return failConnects(Integer.MAX_VALUE);
    }

    /**
     * Makes the simulated stage with the given task exit with code 1.
     */
    public MockRemoteHost failTask(String task) {
        failingTasks.add(task);
        return this;
    }

    /**
     * Rejects uploads whose remote path ends with the given suffix.
     */
    public MockRemoteHost rejectUploadsTo(String remoteSuffix) {
        rejectedUploads.add(remoteSuffix);
        return this;
    }

    // ===== Behavior =====

    /**
     * Sets the compute time a simulated stage reports.
     */
    public MockRemoteHost stageTime(String task, double seconds) {
        stageTimes.put(task, seconds);
        return this;
    }

    /**
     * Installs a handler consulted before the built-in command simulation; a null result falls through.
     */
    public MockRemoteHost onCommand(Function<String, CommandResult> handler) {
        this.commandHandler = handler;
        return this;
    }

    /**
     * Advances the clock on every upload and download, so transfer times are deterministic.
     */
    public MockRemoteHost transferDelays(ManualClock clock, Duration upload, Duration download) {
        this.clock = clock;
        this.uploadDelay = upload;
        this.downloadDelay = download;
        return this;
    }

    // ===== Remote filesystem =====

    public synchronized void putFile(String remotePath, byte[] content) {
        files.put(remotePath, content.clone());
    }

    public synchronized void putFile(String remotePath, String content) {
        putFile(remotePath, content.getBytes(StandardCharsets.UTF_8));
    }

    public synchronized boolean exists(String remotePath) {
        return files.containsKey(remotePath);
    }

    public synchronized byte[] file(String remotePath) {
        byte[] content = files.get(remotePath);
        return content == null ? null : content.clone();
    }

    public synchronized boolean hasDirectory(String remotePath) {
        return directories.contains(remotePath);
    }

    // ===== Assertions =====

    public synchronized int connectAttempts() {
        return connectAttempts;
    }

    public synchronized int connectionsOpened() {
        return connectionsOpened;
    }

    public synchronized int connectionsClosed() {
        return connectionsClosed;
    }

    public synchronized int channelsOpened() {
        return channelsOpened;
    }

    public synchronized int channelsClosed() {
        return channelsClosed;
    }

    public synchronized List<String> commands() {
        return List.copyOf(commands);
    }

    /**
     * Tasks of the simulated stage commands, in the order they ran.
     */
    public synchronized List<String> stageInvocations() {
        return List.copyOf(stageInvocations);
    }

    public synchronized List<String> uploads() {
        return List.copyOf(uploads);
    }

    public synchronized List<String> downloads() {
        return List.copyOf(downloads);
    }

    // ===== Simulation =====

    private synchronized CommandResult execute(String command) {
        commands.add(command);
        if (commandHandler != null) {
            CommandResult custom = commandHandler.apply(command);
            if (custom != null) {
                return custom;
            }
        }

        String cwd = null;
        for (String segment : command.split(" && ")) {
            String trimmed = segment.trim();
            if (trimmed.startsWith("cd ")) {
                cwd = unquote(trimmed.substring(3).trim());
            } else if (trimmed.startsWith("mkdir -p ")) {
                directories.add(unquote(trimmed.substring(9).trim()));
            } else if (trimmed.contains("--task")) {
                return simulateStage(trimmed, cwd);
            }
        }
        return CommandResult.success("");
    }

    private CommandResult simulateStage(String command, String cwd) {
        Map<String, String> args = new HashMap<>();
        String[] tokens = command.split("\\s+");
        for (int i = 0; i < tokens.length - 1; i++) {
            if (tokens[i].startsWith("--")) {
                args.put(tokens[i], unquote(tokens[i + 1]));
            }
        }

        String task = args.get("--task");
        stageInvocations.add(task);

        String input = resolve(cwd, args.get("--input"));
        if (input != null && !files.containsKey(input)) {
            return new CommandResult(2, "", "No such file: " + input);
        }
        if (failingTasks.contains(task)) {
            return new CommandResult(1, "", "Simulated failure in task " + task);
        }

        String output = resolve(cwd, args.get("--output"));
        String timing = resolve(cwd, args.get("--timing-output"));
        if (output != null) {
            files.put(output, ("output of " + task).getBytes(StandardCharsets.UTF_8));
        }
        if (timing != null) {
            double seconds = stageTimes.getOrDefault(task, 0.0);
            String json = String.format(Locale.ROOT, "{\"time\": %s, \"task\": \"%s\"}", seconds, task);
            files.put(timing, json.getBytes(StandardCharsets.UTF_8));
        }
        return CommandResult.success("[OK] " + task);
    }

    private static String resolve(String cwd, String path) {
        if (path == null || path.startsWith("/") || cwd == null) {
            return path;
        }
        return cwd.endsWith("/") ? cwd + path : cwd + "/" + path;
    }

    private static String unquote(String token) {
        if (token.length() >= 2 && token.startsWith("'") && token.endsWith("'")) {
            return token.substring(1, token.length() - 1);
        }
        return token;
    }

    private synchronized void advance(Duration delay) {
        if (clock != null && !delay.isZero()) {
            clock.advance(delay);
        }
    }

    private final class MockConnection implements RemoteConnection {

        private boolean closed;

        @Override
        public CommandResult exec(String command, Duration timeout) throws IOException {
            ensureOpen();
            return execute(command);
        }

        @Override
        public TransferChannel openTransferChannel() throws IOException {
            ensureOpen();
            synchronized (MockRemoteHost.this) {
                channelsOpened++;
            }
            return new MockChannel();
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            synchronized (MockRemoteHost.this) {
                connectionsClosed++;
            }
        }

        private void ensureOpen() throws IOException {
            if (closed) {
                throw new IOException("Connection is closed");
            }
        }
    }

    private final class MockChannel implements TransferChannel {

        @Override
        public void put(Path localFile, String remotePath) throws IOException {
            synchronized (MockRemoteHost.this) {
                for (String suffix : rejectedUploads) {
                    if (remotePath.endsWith(suffix)) {
                        throw new IOException("Permission denied: " + remotePath);
                    }
                }
                files.put(remotePath, Files.readAllBytes(localFile));
                uploads.add(remotePath);
                advance(uploadDelay);
            }
        }

        @Override
        public void get(String remotePath, Path localFile) throws IOException {
            synchronized (MockRemoteHost.this) {
                byte[] content = files.get(remotePath);
                if (content == null) {
                    throw new FileNotFoundException("No such remote file: " + remotePath);
                }
                Files.write(localFile, content);
                downloads.add(remotePath);
                advance(downloadDelay);
            }
        }

        @Override
        public void remove(String remotePath) throws IOException {
            synchronized (MockRemoteHost.this) {
                if (files.remove(remotePath) == null) {
                    throw new FileNotFoundException("No such remote file: " + remotePath);
                }
            }
        }

        @Override
        public void close() {
            synchronized (MockRemoteHost.this) {
                channelsClosed++;
            }
        }
    }
}
