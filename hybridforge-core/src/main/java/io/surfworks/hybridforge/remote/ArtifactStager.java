package io.surfworks.hybridforge.remote;

import io.surfworks.hybridforge.report.MonotonicClock;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Copies artifacts between the local filesystem and the remote working directory.
 *
 * <p>Every call opens its own transfer channel on the owning session and
 * closes it before returning, whether or not the copy succeeded. The returned
 * duration covers that transfer alone. Destinations are always overwritten.
 */
public final class ArtifactStager {

    private static final Logger LOG = Logger.getLogger(ArtifactStager.class.getName());

    private final RemoteSession session;
    private final Clock clock;

    public ArtifactStager(RemoteSession session) {
        this(session, new MonotonicClock());
    }

    /**
     * Creates a stager that measures transfers with the given clock.
     */
    public ArtifactStager(RemoteSession session, Clock clock) {
        this.session = Objects.requireNonNull(session, "session cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Uploads a local file.
     *
     * @param localPath  file to send
     * @param remotePath destination on the remote host
     * @return elapsed time of the transfer
     * @throws TransferException if the local file is missing or the copy fails
     */
    public Duration upload(Path localPath, String remotePath) throws TransferException {
        if (!Files.isRegularFile(localPath)) {
            throw new TransferException("Local file not found: " + localPath);
        }

        Instant start = clock.instant();
        try (TransferChannel channel = session.openTransferChannel()) {
            channel.put(localPath, remotePath);
        } catch (IOException e) {
            throw new TransferException("Upload " + localPath + " -> " + remotePath
                    + " failed: " + e.getMessage(), e);
        }
        Duration elapsed = MonotonicClock.elapsedSince(clock, start);

        LOG.info("Uploaded " + localPath + " -> " + remotePath + " in " + elapsed.toMillis() + "ms");
        return elapsed;
    }

    /**
     * Downloads a remote file, creating the local parent directory if needed.
     *
     * @param remotePath file on the remote host
     * @param localPath  local destination
     * @return elapsed time of the transfer
     * @throws TransferException if the remote file is missing or the copy fails
     */
    public Duration download(String remotePath, Path localPath) throws TransferException {
        try {
            Path parent = localPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new TransferException("Cannot create local directory for " + localPath, e);
        }

        Instant start = clock.instant();
        try (TransferChannel channel = session.openTransferChannel()) {
            channel.get(remotePath, localPath);
        } catch (IOException e) {
            throw new TransferException("Download " + remotePath + " -> " + localPath
                    + " failed: " + e.getMessage(), e);
        }
        Duration elapsed = MonotonicClock.elapsedSince(clock, start);

        LOG.info("Downloaded " + remotePath + " -> " + localPath + " in " + elapsed.toMillis() + "ms");
        return elapsed;
    }

    /**
     * Mirrors a local directory tree under a remote directory.
     *
     * <p>Remote directories are created as needed; all files travel over one channel.
     *
     * @param localDir  directory to send
     * @param remoteDir remote directory that receives the tree's contents
     * @return elapsed time of the whole transfer
     * @throws TransferException if the local directory is missing or any copy fails
     */
    public Duration uploadDirectory(Path localDir, String remoteDir) throws TransferException {
        if (!Files.isDirectory(localDir)) {
            throw new TransferException("Local directory not found: " + localDir);
        }

        List<Path> entries;
        try (Stream<Path> walk = Files.walk(localDir)) {
            entries = walk.sorted().toList();
        } catch (IOException e) {
            throw new TransferException("Cannot list " + localDir + ": " + e.getMessage(), e);
        }

        Instant start = clock.instant();
        int files = 0;
        try {
            for (Path dir : entries) {
                if (Files.isDirectory(dir)) {
                    session.ensureDirectory(remotePathFor(localDir, dir, remoteDir));
                }
            }
        } catch (RemoteExecutionException e) {
            throw new TransferException("Cannot create remote directories under " + remoteDir, e);
        }

        try (TransferChannel channel = session.openTransferChannel()) {
            for (Path file : entries) {
                if (Files.isRegularFile(file)) {
                    channel.put(file, remotePathFor(localDir, file, remoteDir));
                    files++;
                }
            }
        } catch (IOException e) {
            throw new TransferException("Upload of " + localDir + " -> " + remoteDir
                    + " failed: " + e.getMessage(), e);
        }
        Duration elapsed = MonotonicClock.elapsedSince(clock, start);

        LOG.info("Uploaded " + files + " files from " + localDir + " -> " + remoteDir
                + " in " + elapsed.toMillis() + "ms");
        return elapsed;
    }

    /**
     * Deletes a remote file.
     *
     * @throws TransferException if the file cannot be removed
     */
    public void remove(String remotePath) throws TransferException {
        try (TransferChannel channel = session.openTransferChannel()) {
            channel.remove(remotePath);
        } catch (IOException e) {
            throw new TransferException("Cannot remove remote file " + remotePath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Joins a remote directory and a file name with a single slash.
     */
    public static String remotePath(String remoteDir, String fileName) {
        return remoteDir.endsWith("/") ? remoteDir + fileName : remoteDir + "/" + fileName;
    }

    private static String remotePathFor(Path root, Path entry, String remoteDir) {
        Path relative = root.relativize(entry);
        if (relative.toString().isEmpty()) {
            return remoteDir;
        }
        StringBuilder sb = new StringBuilder(remoteDir);
        for (Path part : relative) {
            if (sb.charAt(sb.length() - 1) != '/') {
                sb.append('/');
            }
            sb.append(part);
        }
        return sb.toString();
    }
}
