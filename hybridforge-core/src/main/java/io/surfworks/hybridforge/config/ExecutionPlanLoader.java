package io.surfworks.hybridforge.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.surfworks.hybridforge.stage.Location;
import io.surfworks.hybridforge.stage.Stage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Loads an {@link ExecutionPlan} from a JSON document.
 *
 * <p>The document has four sections:
 * <ul>
 *   <li>{@code execution}: {@code "local"} or {@code "remote"} for each remote-eligible stage</li>
 *   <li>{@code paths}: local artifact paths, report path and remote working directory</li>
 *   <li>{@code ssh}: remote host settings (only required when a stage is remote)</li>
 *   <li>{@code commands}: interpreters and scripts (optional)</li>
 * </ul>
 *
 * <p>Unlike a best-effort settings file, a broken plan is never patched with
 * defaults: every problem surfaces as a {@link ConfigException}.
 */
public final class ExecutionPlanLoader {

    /** Config file used when none is given */
    public static final Path DEFAULT_CONFIG = Path.of("hybrid_config.json");

    private static final ObjectMapper JSON = new ObjectMapper();

    private ExecutionPlanLoader() {
    }

    /**
     * Loads the plan from the default config file in the working directory.
     */
    public static ExecutionPlan load() throws ConfigException {
        return load(DEFAULT_CONFIG);
    }

    /**
     * Loads the plan from a specific file.
     *
     * @param configFile path to the config file
     * @return the loaded plan
     * @throws ConfigException if the file is missing, unreadable or invalid
     */
    public static ExecutionPlan load(Path configFile) throws ConfigException {
        if (!Files.isRegularFile(configFile)) {
            throw new ConfigException("Config file not found: " + configFile);
        }
        try {
            return parse(Files.readString(configFile));
        } catch (IOException e) {
            throw new ConfigException("Cannot read config file " + configFile + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses a plan from JSON text.
     *
     * @throws ConfigException if the document is malformed or incomplete
     */
    public static ExecutionPlan parse(String json) throws ConfigException {
        JsonNode root;
        try {
            root = JSON.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Malformed config JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigException("Config must be a JSON object");
        }

        Map<Stage, Location> locations = parseExecution(requireSection(root, "execution"));
        PathTable paths = parsePaths(requireSection(root, "paths"));
        boolean remote = locations.containsValue(Location.REMOTE);

        SshConfig ssh = null;
        if (root.has("ssh") && !root.get("ssh").isNull()) {
            ssh = parseSsh(requireSection(root, "ssh"), remote);
        } else if (remote) {
            throw new ConfigException("Missing 'ssh' section: required when a stage runs remotely");
        }
        if (remote && paths.remoteWorkdir() == null) {
            throw new ConfigException("Missing 'paths.remote_workdir': required when a stage runs remotely");
        }

        CommandConfig commands = root.has("commands")
                ? parseCommands(requireSection(root, "commands"))
                : CommandConfig.defaults();

        try {
            return new ExecutionPlan(locations, paths, ssh, commands);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid execution plan: " + e.getMessage(), e);
        }
    }

    private static Map<Stage, Location> parseExecution(JsonNode node) throws ConfigException {
        Map<Stage, Location> locations = new EnumMap<>(Stage.class);
        for (Stage stage : Stage.remoteEligible()) {
            String tag = requireString(node, "execution", stage.reportName());
            try {
                locations.put(stage, Location.fromTag(tag));
            } catch (IllegalArgumentException e) {
                throw new ConfigException("Invalid 'execution." + stage.reportName() + "': " + e.getMessage(), e);
            }
        }
        return locations;
    }

    private static PathTable parsePaths(JsonNode node) throws ConfigException {
        try {
            return new PathTable(
                    optionalPath(node, "local_data"),
                    Path.of(expandHome(requireString(node, "paths", "local_data_check1"))),
                    Path.of(expandHome(requireString(node, "paths", "local_data_check2"))),
                    Path.of(expandHome(requireString(node, "paths", "local_saved"))),
                    Path.of(expandHome(requireString(node, "paths", "local_results"))),
                    Path.of(expandHome(requireString(node, "paths", "local_heatmap"))),
                    Path.of(expandHome(requireString(node, "paths", "timing_report"))),
                    getStringOrDefault(node, "remote_workdir", null)
            );
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid 'paths': " + e.getMessage(), e);
        }
    }

    private static SshConfig parseSsh(JsonNode node, boolean remote) throws ConfigException {
        String host = requireString(node, "ssh", "host");
        String username = requireString(node, "ssh", "username");
        String password = getStringOrDefault(node, "password", null);
        String keyPath = getStringOrDefault(node, "pkey_path", null);

        if (remote && (password == null || password.isEmpty()) && (keyPath == null || keyPath.isBlank())) {
            throw new ConfigException("'ssh' needs a 'password' or a 'pkey_path'");
        }

        String knownHosts = getStringOrDefault(node, "known_hosts", null);
        try {
            return new SshConfig(
                    host,
                    getInt(node, "port", SshConfig.DEFAULT_PORT),
                    username,
                    password,
                    keyPath == null || keyPath.isBlank() ? null : Path.of(expandHome(keyPath)),
                    getStringOrDefault(node, "setup_cmd", null),
                    getStringOrDefault(node, "profile_init", SshConfig.DEFAULT_PROFILE_INIT),
                    getInt(node, "max_retries", SshConfig.DEFAULT_MAX_ATTEMPTS),
                    getSeconds(node, "retry_delay_seconds", SshConfig.DEFAULT_RETRY_DELAY),
                    getSeconds(node, "connect_timeout_seconds", SshConfig.DEFAULT_CONNECT_TIMEOUT),
                    getSeconds(node, "command_timeout_seconds", Duration.ZERO),
                    node.path("strict_host_key_checking").asBoolean(false),
                    knownHosts == null ? null : Path.of(expandHome(knownHosts))
            );
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid 'ssh': " + e.getMessage(), e);
        }
    }

    private static CommandConfig parseCommands(JsonNode node) throws ConfigException {
        try {
            return new CommandConfig(
                    getStringOrDefault(node, "local_interpreter", CommandConfig.DEFAULT_LOCAL_INTERPRETER),
                    Path.of(expandHome(getStringOrDefault(node, "pre_stage_script",
                            CommandConfig.DEFAULT_PRE_STAGE_SCRIPT.toString()))),
                    Path.of(expandHome(getStringOrDefault(node, "stage_script",
                            CommandConfig.DEFAULT_STAGE_SCRIPT.toString()))),
                    getStringOrDefault(node, "remote_interpreter", CommandConfig.DEFAULT_REMOTE_INTERPRETER),
                    getSeconds(node, "local_timeout_seconds", Duration.ZERO)
            );
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid 'commands': " + e.getMessage(), e);
        }
    }

    private static JsonNode requireSection(JsonNode root, String name) throws ConfigException {
        JsonNode node = root.get(name);
        if (node == null || node.isNull()) {
            throw new ConfigException("Missing '" + name + "' section");
        }
        if (!node.isObject()) {
            throw new ConfigException("'" + name + "' must be a JSON object");
        }
        return node;
    }

    private static String requireString(JsonNode node, String section, String field) throws ConfigException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new ConfigException("Missing '" + section + "." + field + "'");
        }
        if (!value.isTextual() || value.asText().isBlank()) {
            throw new ConfigException("'" + section + "." + field + "' must be a non-empty string");
        }
        return value.asText();
    }

    private static Path optionalPath(JsonNode node, String field) {
        String value = getStringOrDefault(node, field, null);
        return value == null || value.isBlank() ? null : Path.of(expandHome(value));
    }

    private static String getStringOrDefault(JsonNode node, String field, String defaultValue) {
        if (node.hasNonNull(field)) {
            return node.get(field).asText();
        }
        return defaultValue;
    }

    private static int getInt(JsonNode node, String field, int defaultValue) throws ConfigException {
        if (!node.hasNonNull(field)) {
            return defaultValue;
        }
        JsonNode value = node.get(field);
        if (!value.canConvertToInt()) {
            throw new ConfigException("'" + field + "' must be an integer");
        }
        return value.asInt();
    }

    private static Duration getSeconds(JsonNode node, String field, Duration defaultValue) throws ConfigException {
        if (!node.hasNonNull(field)) {
            return defaultValue;
        }
        JsonNode value = node.get(field);
        if (!value.isNumber()) {
            throw new ConfigException("'" + field + "' must be a number of seconds");
        }
        return Duration.ofMillis(Math.round(value.asDouble() * 1000));
    }

    static String expandHome(String path) {
        if (path.equals("~")) {
            return System.getProperty("user.home");
        }
        if (path.startsWith("~/")) {
            return System.getProperty("user.home") + path.substring(1);
        }
        return path;
    }
}
