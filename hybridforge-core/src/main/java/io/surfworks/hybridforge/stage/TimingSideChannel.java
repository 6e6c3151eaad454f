package io.surfworks.hybridforge.stage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the timing file a stage process writes next to its output.
 *
 * <p>The file must hold a JSON object with a numeric {@code time} field (seconds);
 * any other fields are ignored.
 */
public final class TimingSideChannel {

    /** Field carrying the self-reported compute time */
    public static final String TIME_FIELD = "time";

    private static final ObjectMapper JSON = new ObjectMapper();

    private TimingSideChannel() {
    }

    /**
     * Reads and validates the compute time from a timing file.
     *
     * @param file timing file written by the stage
     * @return compute time in seconds
     * @throws TimingFileException if the file is missing, malformed or lacks a usable {@code time}
     */
    public static double readComputeSeconds(Path file) throws TimingFileException {
        if (!Files.isRegularFile(file)) {
            throw new TimingFileException("Timing file not written: " + file);
        }

        JsonNode root;
        try {
            root = JSON.readTree(Files.readString(file));
        } catch (JsonProcessingException e) {
            throw new TimingFileException("Timing file " + file + " is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new TimingFileException("Cannot read timing file " + file + ": " + e.getMessage(), e);
        }

        if (root == null || !root.isObject()) {
            throw new TimingFileException("Timing file " + file + " must contain a JSON object");
        }
        JsonNode time = root.get(TIME_FIELD);
        if (time == null || time.isNull()) {
            throw new TimingFileException("Timing file " + file + " has no '" + TIME_FIELD + "' field");
        }
        if (!time.isNumber()) {
            throw new TimingFileException("Timing file " + file + ": '" + TIME_FIELD
                    + "' must be a number, got " + time);
        }

        double seconds = time.asDouble();
        if (Double.isNaN(seconds) || Double.isInfinite(seconds) || seconds < 0) {
            throw new TimingFileException("Timing file " + file + ": '" + TIME_FIELD
                    + "' must be a non-negative number, got " + seconds);
        }
        return seconds;
    }
}
