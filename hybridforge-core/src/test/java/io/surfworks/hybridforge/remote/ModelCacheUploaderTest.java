package io.surfworks.hybridforge.remote;

import io.surfworks.hybridforge.config.SshConfig;
import io.surfworks.hybridforge.testing.ManualClock;
import io.surfworks.hybridforge.testing.MockRemoteHost;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ModelCacheUploader.
 */
class ModelCacheUploaderTest {

    @TempDir
    Path tempDir;

    private Path cache;
    private MockRemoteHost host;
    private ManualClock clock;
    private RemoteSession session;
    private ModelCacheUploader uploader;

    @BeforeEach
    void setUp() throws IOException, ConnectionException {
        cache = tempDir.resolve("huggingface");
        Path hub = cache.resolve("hub");
        Files.createDirectories(hub.resolve("models--gpt2/snapshots/abc"));
        Files.writeString(hub.resolve("models--gpt2/snapshots/abc/config.json"), "{\"n_layer\": 12}");
        Files.createDirectories(hub.resolve("models--GPT2-medium"));
        Files.writeString(hub.resolve("models--GPT2-medium/weights.bin"), "medium");
        Files.createDirectories(hub.resolve("models--bert-base"));
        Files.writeString(hub.resolve("version.txt"), "1");

        host = new MockRemoteHost();
        clock = new ManualClock();
        host.transferDelays(clock, Duration.ofMillis(250), Duration.ZERO);
        session = RemoteSession.connect(SshConfig.of("h", 22, "u", "p"), host, duration -> { });
        uploader = new ModelCacheUploader(session, new ArtifactStager(session, clock));
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    @Test
    void findsModelDirectoriesIgnoringCase() throws IOException {
        List<Path> dirs = ModelCacheUploader.findModelDirectories(cache, "gpt2");

        assertEquals(List.of(cache.resolve("hub/models--GPT2-medium"), cache.resolve("hub/models--gpt2")), dirs);
    }

    @Test
    void missingHubFindsNothing() throws IOException {
        assertEquals(List.of(), ModelCacheUploader.findModelDirectories(tempDir.resolve("empty"), "gpt2"));
    }

    @Test
    void uploadsEachDirectoryUnderRemoteHub() throws Exception {
        List<Path> dirs = ModelCacheUploader.findModelDirectories(cache, "gpt2");

        List<ModelCacheUploader.Upload> uploads = uploader.upload(dirs, "/root/.cache/huggingface");

        assertEquals(2, uploads.size());
        assertEquals("/root/.cache/huggingface/hub/models--GPT2-medium", uploads.get(0).remoteDir());
        assertEquals("/root/.cache/huggingface/hub/models--gpt2", uploads.get(1).remoteDir());
        assertEquals(Duration.ofMillis(250), uploads.get(0).elapsed());
        assertTrue(host.hasDirectory("/root/.cache/huggingface/hub"));
        assertTrue(host.hasDirectory("/root/.cache/huggingface/hub/models--gpt2/snapshots/abc"));
        assertEquals("{\"n_layer\": 12}",
                new String(host.file("/root/.cache/huggingface/hub/models--gpt2/snapshots/abc/config.json")));
        assertEquals("medium", new String(host.file("/root/.cache/huggingface/hub/models--GPT2-medium/weights.bin")));
        assertFalse(host.exists("/root/.cache/huggingface/hub/version.txt"));
    }

    @Test
    void failedUploadStopsAtThatDirectory() throws IOException {
        host.rejectUploadsTo("weights.bin");
        List<Path> dirs = ModelCacheUploader.findModelDirectories(cache, "gpt2");

        assertThrows(TransferException.class, () -> uploader.upload(dirs, "/root/.cache/huggingface"));
        assertFalse(host.exists("/root/.cache/huggingface/hub/models--gpt2/snapshots/abc/config.json"));
    }
}
