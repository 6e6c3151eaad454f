package io.surfworks.hybridforge.config;

import io.surfworks.hybridforge.stage.Location;
import io.surfworks.hybridforge.stage.Stage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ExecutionPlanLoader.
 */
class ExecutionPlanLoaderTest {

    @TempDir
    Path tempDir;

    private static final String PATHS = """
            "paths": {
              "local_data_check1": "out/data_check1.json",
              "local_data_check2": "out/data_check2.json",
              "local_saved": "out/saved.pt",
              "local_results": "out/results.pt",
              "local_heatmap": "out/heatmap.png",
              "timing_report": "out/timing.json",
              "remote_workdir": "/root/ioi"
            }
            """;

    private static final String SSH = """
            "ssh": {
              "host": "gpu.example.org",
              "port": 2222,
              "username": "root",
              "password": "secret",
              "setup_cmd": "conda activate ioi"
            }
            """;

    private static String execution(String filter, String collect, String patch, String plot) {
        return """
                "execution": {
                  "filter_gpt2": "%s",
                  "collect_activations": "%s",
                  "patch_activations": "%s",
                  "plot_heatmap": "%s"
                }
                """.formatted(filter, collect, patch, plot);
    }

    private static String doc(String... sections) {
        return "{" + String.join(",", sections) + "}";
    }

    // ===== Valid documents =====

    @Test
    void parsesHybridPlan() throws ConfigException {
        ExecutionPlan plan = ExecutionPlanLoader.parse(
                doc(execution("local", "remote", "remote", "local"), PATHS, SSH));

        assertEquals(Location.LOCAL, plan.locationOf(Stage.FILTER));
        assertEquals(Location.REMOTE, plan.locationOf(Stage.COLLECT));
        assertEquals(Location.REMOTE, plan.locationOf(Stage.PATCH));
        assertEquals(Location.LOCAL, plan.locationOf(Stage.PLOT));
        assertTrue(plan.requiresRemote());

        assertEquals("gpu.example.org", plan.ssh().host());
        assertEquals(2222, plan.ssh().port());
        assertEquals("secret", plan.ssh().password());
        assertEquals("conda activate ioi", plan.ssh().setupCommand());
        assertEquals("/root/ioi", plan.paths().remoteWorkdir());
        assertEquals(Path.of("out/saved.pt"), plan.paths().saved());
    }

    @Test
    void preStagesAreAlwaysLocal() throws ConfigException {
        ExecutionPlan plan = ExecutionPlanLoader.parse(
                doc(execution("remote", "remote", "remote", "remote"), PATHS, SSH));

        assertEquals(Location.LOCAL, plan.locationOf(Stage.GENERATE));
        assertEquals(Location.LOCAL, plan.locationOf(Stage.CHECK));
    }

    @Test
    void appliesDefaults() throws ConfigException {
        ExecutionPlan plan = ExecutionPlanLoader.parse(
                doc(execution("remote", "local", "local", "local"), PATHS, SSH));

        assertEquals(PathTable.DEFAULT_DATA, plan.paths().data());
        assertEquals(SshConfig.DEFAULT_MAX_ATTEMPTS, plan.ssh().maxAttempts());
        assertEquals(SshConfig.DEFAULT_RETRY_DELAY, plan.ssh().retryDelay());
        assertEquals(SshConfig.DEFAULT_PROFILE_INIT, plan.ssh().profileInit());
        assertFalse(plan.ssh().hasCommandTimeout());
        assertEquals(CommandConfig.defaults(), plan.commands());
    }

    @Test
    void allLocalPlanNeedsNoSsh() throws ConfigException {
        String paths = PATHS.replace(",\n  \"remote_workdir\": \"/root/ioi\"", "");
        ExecutionPlan plan = ExecutionPlanLoader.parse(
                doc(execution("local", "local", "local", "local"), paths));

        assertFalse(plan.requiresRemote());
        assertNull(plan.ssh());
    }

    @Test
    void parsesRetryAndCommandSettings() throws ConfigException {
        String ssh = """
                "ssh": {
                  "host": "h",
                  "username": "u",
                  "pkey_path": "/keys/id_ed25519",
                  "max_retries": 5,
                  "retry_delay_seconds": 0.5,
                  "command_timeout_seconds": 600
                }
                """;
        String commands = """
                "commands": {
                  "local_interpreter": "python3 -u",
                  "stage_script": "scripts/stages.py",
                  "remote_interpreter": "/opt/env/bin/python",
                  "local_timeout_seconds": 120
                }
                """;
        ExecutionPlan plan = ExecutionPlanLoader.parse(
                doc(execution("remote", "remote", "local", "local"), PATHS, ssh, commands));

        assertEquals(SshConfig.DEFAULT_PORT, plan.ssh().port());
        assertNull(plan.ssh().password());
        assertEquals(Path.of("/keys/id_ed25519"), plan.ssh().privateKeyPath());
        assertEquals(5, plan.ssh().maxAttempts());
        assertEquals(Duration.ofMillis(500), plan.ssh().retryDelay());
        assertEquals(Duration.ofMinutes(10), plan.ssh().commandTimeout());

        assertEquals("python3 -u", plan.commands().localInterpreter());
        assertEquals(Path.of("scripts/stages.py"), plan.commands().stageScript());
        assertEquals(CommandConfig.DEFAULT_PRE_STAGE_SCRIPT, plan.commands().preStageScript());
        assertEquals("/opt/env/bin/python", plan.commands().remoteInterpreter());
        assertEquals(Duration.ofMinutes(2), plan.commands().localTimeout());
    }

    @Test
    void loadsFromFile() throws IOException, ConfigException {
        Path file = tempDir.resolve("hybrid_config.json");
        Files.writeString(file, doc(execution("local", "local", "remote", "local"), PATHS, SSH));

        ExecutionPlan plan = ExecutionPlanLoader.load(file);

        assertEquals(Location.REMOTE, plan.locationOf(Stage.PATCH));
    }

    // ===== Invalid documents =====

    @Test
    void missingFileThrows() {
        ConfigException e = assertThrows(ConfigException.class, () ->
                ExecutionPlanLoader.load(tempDir.resolve("nope.json")));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    void malformedJsonThrows() {
        assertThrows(ConfigException.class, () -> ExecutionPlanLoader.parse("{ not json"));
    }

    @Test
    void missingExecutionSectionThrows() {
        ConfigException e = assertThrows(ConfigException.class, () ->
                ExecutionPlanLoader.parse(doc(PATHS, SSH)));
        assertTrue(e.getMessage().contains("execution"));
    }

    @Test
    void missingExecutionKeyThrows() {
        String execution = """
                "execution": {
                  "filter_gpt2": "local",
                  "collect_activations": "local",
                  "patch_activations": "local"
                }
                """;
        ConfigException e = assertThrows(ConfigException.class, () ->
                ExecutionPlanLoader.parse(doc(execution, PATHS, SSH)));
        assertTrue(e.getMessage().contains("plot_heatmap"));
    }

    @Test
    void invalidLocationTagThrows() {
        ConfigException e = assertThrows(ConfigException.class, () ->
                ExecutionPlanLoader.parse(doc(execution("local", "cloud", "local", "local"), PATHS, SSH)));
        assertTrue(e.getMessage().contains("collect_activations"));
    }

    @Test
    void missingPathThrows() {
        String paths = PATHS.replace("\"local_saved\": \"out/saved.pt\",", "");
        ConfigException e = assertThrows(ConfigException.class, () ->
                ExecutionPlanLoader.parse(doc(execution("local", "local", "local", "local"), paths)));
        assertTrue(e.getMessage().contains("local_saved"));
    }

    @Test
    void remoteStageWithoutSshThrows() {
        ConfigException e = assertThrows(ConfigException.class, () ->
                ExecutionPlanLoader.parse(doc(execution("local", "remote", "local", "local"), PATHS)));
        assertTrue(e.getMessage().contains("ssh"));
    }

    @Test
    void remoteStageWithoutCredentialsThrows() {
        String ssh = """
                "ssh": { "host": "h", "username": "u" }
                """;
        assertThrows(ConfigException.class, () ->
                ExecutionPlanLoader.parse(doc(execution("remote", "local", "local", "local"), PATHS, ssh)));
    }

    @Test
    void remoteStageWithoutWorkdirThrows() {
        String paths = PATHS.replace(",\n  \"remote_workdir\": \"/root/ioi\"", "");
        ConfigException e = assertThrows(ConfigException.class, () ->
                ExecutionPlanLoader.parse(doc(execution("remote", "local", "local", "local"), paths, SSH)));
        assertTrue(e.getMessage().contains("remote_workdir"));
    }

    @Test
    void nonNumericRetrySettingThrows() {
        String ssh = SSH.replace("\"port\": 2222", "\"port\": \"twenty\"");
        assertThrows(ConfigException.class, () ->
                ExecutionPlanLoader.parse(doc(execution("remote", "local", "local", "local"), PATHS, ssh)));
    }

    @Test
    void expandsHomeDirectory() {
        String home = System.getProperty("user.home");
        assertEquals(home + "/.ssh/id_rsa", ExecutionPlanLoader.expandHome("~/.ssh/id_rsa"));
        assertEquals("/abs/path", ExecutionPlanLoader.expandHome("/abs/path"));
    }
}
