package io.surfworks.hybridforge.remote;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Copies a model's Hugging Face cache entries to the remote host so remote
 * stages can load the model without downloading it.
 *
 * <p>Model directories are looked up under {@code <cache>/hub} by a
 * case-insensitive name match, and each one is mirrored to
 * {@code <remote cache>/hub/<name>}.
 */
public final class ModelCacheUploader {

    private static final Logger LOG = Logger.getLogger(ModelCacheUploader.class.getName());

    /** Local Hugging Face cache */
    public static final Path DEFAULT_LOCAL_CACHE =
            Path.of(System.getProperty("user.home"), ".cache", "huggingface");

    /** Hugging Face cache of the remote user */
    public static final String DEFAULT_REMOTE_CACHE = "/root/.cache/huggingface";

    /** Model whose cache entries are uploaded by default */
    public static final String DEFAULT_MODEL = "gpt2";

    private static final String HUB = "hub";

    /**
     * One uploaded model directory.
     *
     * @param localDir  the local cache directory
     * @param remoteDir where it was mirrored
     * @param elapsed   transfer time
     */
    public record Upload(Path localDir, String remoteDir, Duration elapsed) {
    }

    private final RemoteSession session;
    private final ArtifactStager stager;

    public ModelCacheUploader(RemoteSession session, ArtifactStager stager) {
        this.session = Objects.requireNonNull(session, "session cannot be null");
        this.stager = Objects.requireNonNull(stager, "stager cannot be null");
    }

    /**
     * Lists the cache directories of a model, sorted by name.
     *
     * @param localCache local cache root (the directory holding {@code hub})
     * @param model      case-insensitive substring of the directory name
     * @return matching directories; empty if there is no hub directory or no match
     * @throws IOException if the hub directory cannot be listed
     */
    public static List<Path> findModelDirectories(Path localCache, String model) throws IOException {
        Path hub = localCache.resolve(HUB);
        if (!Files.isDirectory(hub)) {
            return List.of();
        }
        String needle = model.toLowerCase(Locale.ROOT);
        try (Stream<Path> entries = Files.list(hub)) {
            return entries
                    .filter(Files::isDirectory)
                    .filter(dir -> dir.getFileName().toString().toLowerCase(Locale.ROOT).contains(needle))
                    .sorted()
                    .toList();
        }
    }

    /**
     * Uploads the given cache directories under the remote cache root.
     *
     * @param modelDirs   directories returned by {@link #findModelDirectories}
     * @param remoteCache remote cache root
     * @return one entry per uploaded directory, in order
     * @throws TransferException on the first directory that cannot be uploaded
     */
    public List<Upload> upload(List<Path> modelDirs, String remoteCache) throws TransferException {
        String remoteHub = ArtifactStager.remotePath(remoteCache, HUB);
        try {
            session.ensureDirectory(remoteHub);
        } catch (RemoteExecutionException e) {
            throw new TransferException("Cannot create remote cache directory " + remoteHub, e);
        }

        List<Upload> uploads = new ArrayList<>();
        for (Path dir : modelDirs) {
            String remoteDir = ArtifactStager.remotePath(remoteHub, dir.getFileName().toString());
            Duration elapsed = stager.uploadDirectory(dir, remoteDir);
            uploads.add(new Upload(dir, remoteDir, elapsed));
        }
        LOG.info("Uploaded " + uploads.size() + " model cache directories to " + session.config().target());
        return uploads;
    }
}
