package io.surfworks.hybridforge.stage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TimingSideChannel.
 */
class TimingSideChannelTest {

    @TempDir
    Path tempDir;

    private Path write(String json) throws IOException {
        Path file = tempDir.resolve("timing.json");
        Files.writeString(file, json);
        return file;
    }

    @Test
    void readsTimeField() throws Exception {
        assertEquals(12.75, TimingSideChannel.readComputeSeconds(write("{\"time\": 12.75}")));
    }

    @Test
    void ignoresExtraFields() throws Exception {
        assertEquals(3.0, TimingSideChannel.readComputeSeconds(
                write("{\"task\": \"patch\", \"time\": 3, \"device\": \"cuda\"}")));
    }

    @Test
    void missingFileThrows() {
        assertThrows(TimingFileException.class, () ->
                TimingSideChannel.readComputeSeconds(tempDir.resolve("absent.json")));
    }

    @Test
    void malformedJsonThrows() {
        assertThrows(TimingFileException.class, () ->
                TimingSideChannel.readComputeSeconds(write("{\"time\": ")));
    }

    @Test
    void missingTimeThrows() {
        TimingFileException e = assertThrows(TimingFileException.class, () ->
                TimingSideChannel.readComputeSeconds(write("{\"elapsed\": 1.0}")));
        assertTrue(e.getMessage().contains("time"));
    }

    @Test
    void nonNumericTimeThrows() {
        assertThrows(TimingFileException.class, () ->
                TimingSideChannel.readComputeSeconds(write("{\"time\": \"fast\"}")));
    }

    @Test
    void negativeTimeThrows() {
        assertThrows(TimingFileException.class, () ->
                TimingSideChannel.readComputeSeconds(write("{\"time\": -0.5}")));
    }

    @Test
    void nonObjectThrows() {
        assertThrows(TimingFileException.class, () ->
                TimingSideChannel.readComputeSeconds(write("[1.0]")));
    }
}
