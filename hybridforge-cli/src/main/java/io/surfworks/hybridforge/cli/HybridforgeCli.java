package io.surfworks.hybridforge.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.surfworks.hybridforge.config.ConfigException;
import io.surfworks.hybridforge.config.ExecutionPlan;
import io.surfworks.hybridforge.config.ExecutionPlanLoader;
import io.surfworks.hybridforge.config.SshConfig;
import io.surfworks.hybridforge.pipeline.Orchestrator;
import io.surfworks.hybridforge.pipeline.PipelineException;
import io.surfworks.hybridforge.remote.ArtifactStager;
import io.surfworks.hybridforge.remote.ConnectionException;
import io.surfworks.hybridforge.remote.ModelCacheUploader;
import io.surfworks.hybridforge.remote.RemoteSession;
import io.surfworks.hybridforge.remote.RemoteTransport;
import io.surfworks.hybridforge.remote.ssh.JschRemoteTransport;
import io.surfworks.hybridforge.report.ReportComparator;
import io.surfworks.hybridforge.report.ReportComparison;
import io.surfworks.hybridforge.report.TimingRecord;
import io.surfworks.hybridforge.report.TimingReport;
import io.surfworks.hybridforge.stage.Stage;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hybridforge CLI - runs the analysis pipeline across the local machine and a remote GPU host.
 *
 * <p>Commands:
 * <ul>
 *   <li>(none) - Run the pipeline as the config file's execution plan says</li>
 *   <li>compare - Compare timing reports of local, remote and hybrid runs</li>
 *   <li>upload-cache - Copy the local model cache to the remote host</li>
 * </ul>
 */
public class HybridforgeCli {

    private static final String VERSION = "0.1.0";
    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    static final Path DEFAULT_LOCAL_REPORT = Path.of("timing_local_all.json");
    static final Path DEFAULT_REMOTE_REPORT = Path.of("timing_remote_all.json");
    static final Path DEFAULT_HYBRID_REPORT = Path.of("timing_hybrid.json");

    public static void main(String[] args) {
        int exitCode = execute(args, System.out, System.err);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Runs one CLI invocation.
     *
     * @return process exit code
     */
    static int execute(String[] args, PrintStream out, PrintStream err) {
        return execute(args, out, err, new JschRemoteTransport());
    }

    /**
     * Runs one CLI invocation, connecting to the remote host through the given transport.
     *
     * @return process exit code
     */
    static int execute(String[] args, PrintStream out, PrintStream err, RemoteTransport transport) {
        String command = args.length > 0 ? args[0] : "";
        if (hasFlag(args, "--help") || hasFlag(args, "-h")) {
            if (command.equals("compare")) {
                printCompareHelp(out);
            } else if (command.equals("upload-cache")) {
                printUploadCacheHelp(out);
            } else {
                printHelp(out);
            }
            return 0;
        }
        if (hasFlag(args, "--version") || hasFlag(args, "-v")) {
            out.println("hybridforge " + VERSION);
            return 0;
        }

        try {
            if (command.equals("compare")) {
                return handleCompare(Arrays.copyOfRange(args, 1, args.length), out, err);
            }
            if (command.equals("upload-cache")) {
                return handleUploadCache(Arrays.copyOfRange(args, 1, args.length), out, err, transport);
            }
            return handleRun(args, out, err, transport);
        } catch (ConfigException e) {
            err.println("Configuration error: " + e.getMessage());
            return 1;
        } catch (ConnectionException e) {
            err.println("Connection error: " + e.getMessage());
            return 1;
        } catch (PipelineException e) {
            if (e.stage() != null) {
                err.println("Failed stage: " + e.stage().reportName());
            }
            err.println("Pipeline error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static int handleRun(String[] args, PrintStream out, PrintStream err, RemoteTransport transport)
            throws PipelineException {
        if (!checkArguments(args, List.of("--config"), err)) {
            return 1;
        }

        Path configFile = configFile(args);
        ExecutionPlan plan = ExecutionPlanLoader.load(configFile);

        out.println(ConsoleProgressListener.RULE);
        out.println("Hybrid pipeline");
        out.println(ConsoleProgressListener.RULE);
        out.println("Config: " + configFile);
        for (Stage stage : Stage.remoteEligible()) {
            out.printf("  %-22s %s%n", stage.reportName(), plan.locationOf(stage).tag());
        }
        if (plan.requiresRemote()) {
            out.println("Remote: " + plan.ssh().target() + " (" + plan.paths().remoteWorkdir() + ")");
        }

        Orchestrator orchestrator = new Orchestrator(plan, transport, new ConsoleProgressListener(out));
        TimingReport report = orchestrator.run();

        printSummary(report, out);
        return 0;
    }

    private static int handleCompare(String[] args, PrintStream out, PrintStream err) throws IOException {
        boolean json = hasFlag(args, "--json");
        List<String> reports = Arrays.stream(args).filter(a -> !a.equals("--json")).toList();

        Map<String, Path> files = new LinkedHashMap<>();
        files.put(ReportComparator.LOCAL, reports.size() > 0 ? Path.of(reports.get(0)) : DEFAULT_LOCAL_REPORT);
        files.put(ReportComparator.REMOTE, reports.size() > 1 ? Path.of(reports.get(1)) : DEFAULT_REMOTE_REPORT);
        files.put(ReportComparator.HYBRID, reports.size() > 2 ? Path.of(reports.get(2)) : DEFAULT_HYBRID_REPORT);

        for (Map.Entry<String, Path> entry : files.entrySet()) {
            if (!Files.exists(entry.getValue())) {
                err.println("Warning: " + entry.getKey() + " report not found: " + entry.getValue());
            }
        }

        ReportComparison comparison = ReportComparator.compareFiles(files);
        if (comparison.modes().isEmpty()) {
            err.println("No timing reports found. Run the pipeline with each execution plan first,");
            err.println("saving each run's timing_report as:");
            files.forEach((mode, path) -> err.println("  " + mode + ": " + path));
            return 1;
        }

        if (json) {
            out.println(JSON.writeValueAsString(comparison));
        } else {
            printComparison(comparison, out);
        }
        return 0;
    }

    private static int handleUploadCache(String[] args, PrintStream out, PrintStream err, RemoteTransport transport)
            throws PipelineException, IOException {
        if (!checkArguments(args, List.of("--config", "--cache", "--remote-cache", "--model"), err)) {
            return 1;
        }

        String cacheValue = getFlagValue(args, "--cache");
        Path localCache = cacheValue != null ? Path.of(cacheValue) : ModelCacheUploader.DEFAULT_LOCAL_CACHE;
        String remoteValue = getFlagValue(args, "--remote-cache");
        String remoteCache = remoteValue != null ? remoteValue : ModelCacheUploader.DEFAULT_REMOTE_CACHE;
        String modelValue = getFlagValue(args, "--model");
        String model = modelValue != null ? modelValue : ModelCacheUploader.DEFAULT_MODEL;

        Path configFile = configFile(args);
        SshConfig ssh = ExecutionPlanLoader.load(configFile).ssh();
        if (ssh == null) {
            throw new ConfigException("Missing 'ssh' section: required by upload-cache");
        }
        if ((ssh.password() == null || ssh.password().isEmpty()) && ssh.privateKeyPath() == null) {
            throw new ConfigException("'ssh' needs a 'password' or a 'pkey_path'");
        }

        List<Path> modelDirs = ModelCacheUploader.findModelDirectories(localCache, model);
        if (modelDirs.isEmpty()) {
            err.println("No " + model + " model cache found under " + localCache.resolve("hub"));
            err.println("Run the pipeline locally once so the model is downloaded.");
            return 1;
        }

        out.println("Local cache: " + localCache);
        out.println("Found " + modelDirs.size() + " " + model + " cache "
                + (modelDirs.size() == 1 ? "directory" : "directories") + ":");
        for (Path dir : modelDirs) {
            out.println("  " + dir.getFileName());
        }
        out.println("Connecting to " + ssh.target() + "...");

        try (RemoteSession session = RemoteSession.connect(ssh, transport)) {
            ModelCacheUploader uploader = new ModelCacheUploader(session, new ArtifactStager(session));
            for (ModelCacheUploader.Upload upload : uploader.upload(modelDirs, remoteCache)) {
                out.printf("  %-40s -> %s (%.1fs)%n", upload.localDir().getFileName(), upload.remoteDir(),
                        TimingRecord.seconds(upload.elapsed()));
            }
        }
        out.println("Model cache uploaded to " + remoteCache);
        return 0;
    }

    // ===== Output =====

    private static void printSummary(TimingReport report, PrintStream out) {
        out.println();
        out.println(ConsoleProgressListener.RULE);
        out.println("Timing summary");
        out.println(ConsoleProgressListener.RULE);
        out.printf("%-22s  %-8s  %10s  %10s%n", "Stage", "Where", "Compute", "Total");
        for (TimingRecord record : report.records()) {
            out.printf("%-22s  %-8s  %9.3fs  %9.3fs%n",
                    record.stage().reportName(),
                    record.location().tag(),
                    record.computeSeconds(),
                    record.totalSeconds());
        }
        out.println("-".repeat(60));
        out.printf("%-22s  %-8s  %10s  %9.3fs%n", "Total", "", "", report.totalSeconds());
    }

    private static void printComparison(ReportComparison comparison, PrintStream out) {
        List<String> modes = comparison.modes();

        out.println(ConsoleProgressListener.RULE);
        out.println("Compute time by stage (s)");
        out.println(ConsoleProgressListener.RULE);
        printHeader(out, "Stage", modes, "Fastest");
        for (ReportComparison.StageRow row : comparison.computeRows()) {
            printRow(out, row.stage().reportName(), modes, row.seconds(),
                    row.fastestMode() != null ? row.fastestMode() : "-");
        }

        if (!comparison.transferRows().isEmpty()) {
            out.println();
            out.println("Transfer time by stage (s)");
            out.println("-".repeat(60));
            printHeader(out, "Stage", modes, "");
            for (ReportComparison.TransferRow row : comparison.transferRows()) {
                printRow(out, row.stage().reportName() + " " + row.direction(), modes, row.seconds(), "");
            }
        }

        out.println();
        out.println("Total time (s)");
        out.println("-".repeat(60));
        printHeader(out, "", modes, "Best");
        printRow(out, "total", modes, comparison.totals(),
                comparison.bestMode() != null ? comparison.bestMode() : "-");
        if (comparison.hybridSpeedup() != null) {
            out.printf("Hybrid vs local-only: %.1f%% faster%n", comparison.hybridSpeedup());
        }

        out.println();
        out.println("Stage locations");
        out.println("-".repeat(60));
        printHeader(out, "Stage", modes, "");
        for (Stage stage : Stage.remoteEligible()) {
            StringBuilder line = new StringBuilder(String.format("%-32s", stage.reportName()));
            for (String mode : modes) {
                line.append(String.format("  %10s", comparison.locations().get(mode).get(stage.reportName())));
            }
            out.println(line.toString().stripTrailing());
        }
    }

    private static void printHeader(PrintStream out, String first, List<String> modes, String last) {
        StringBuilder line = new StringBuilder(String.format("%-32s", first));
        for (String mode : modes) {
            line.append(String.format("  %10s", mode));
        }
        line.append(String.format("  %s", last));
        out.println(line.toString().stripTrailing());
    }

    private static void printRow(PrintStream out, String label, List<String> modes,
                                 Map<String, Double> seconds, String last) {
        StringBuilder line = new StringBuilder(String.format("%-32s", label));
        for (String mode : modes) {
            Double value = seconds.get(mode);
            line.append(value != null ? String.format("  %10.2f", value) : String.format("  %10s", "-"));
        }
        line.append(String.format("  %s", last));
        out.println(line.toString().stripTrailing());
    }

    // ===== Arguments =====

    /**
     * Rejects arguments other than the given flags and their values.
     *
     * @return false if an error was printed
     */
    private static boolean checkArguments(String[] args, List<String> valueFlags, PrintStream err) {
        for (int i = 0; i < args.length; i++) {
            if (!valueFlags.contains(args[i])) {
                err.println("Unknown argument: " + args[i]);
                err.println("Run 'hybridforge --help' for usage.");
                return false;
            }
            if (getFlagValue(args, args[i]) == null) {
                err.println("Error: " + args[i] + " requires a value");
                return false;
            }
            i++;
        }
        return true;
    }

    private static Path configFile(String[] args) {
        String configValue = getFlagValue(args, "--config");
        return configValue != null ? Path.of(configValue) : ExecutionPlanLoader.DEFAULT_CONFIG;
    }

    private static boolean hasFlag(String[] args, String flag) {
        return Arrays.asList(args).contains(flag);
    }

    private static String getFlagValue(String[] args, String flag) {
        List<String> argList = Arrays.asList(args);
        int index = argList.indexOf(flag);
        if (index >= 0 && index < args.length - 1) {
            return args[index + 1];
        }
        return null;
    }

    // ===== Help output =====

    private static void printHelp(PrintStream out) {
        out.println("Hybridforge CLI - Hybrid local/remote pipeline runner");
        out.println();
        out.println("Usage: hybridforge [--config <path>]");
        out.println("       hybridforge compare [local.json] [remote.json] [hybrid.json] [--json]");
        out.println("       hybridforge upload-cache [--config <path>] [--cache <dir>] [--remote-cache <dir>]");
        out.println();
        out.println("Commands:");
        out.println("  (none)        Run the pipeline with the given execution plan");
        out.println("  compare       Compare timing reports of different execution plans");
        out.println("  upload-cache  Copy the local model cache to the remote host");
        out.println();
        out.println("Options:");
        out.println("  --config <path>  Config file (default: " + ExecutionPlanLoader.DEFAULT_CONFIG + ")");
        out.println("  -h, --help       Show help");
        out.println("  -v, --version    Show version");
        out.println();
        out.println("Examples:");
        out.println("  hybridforge");
        out.println("  hybridforge --config configs/all_remote.json");
        out.println("  hybridforge compare");
        out.println("  hybridforge upload-cache --config configs/all_remote.json");
    }

    private static void printCompareHelp(PrintStream out) {
        out.println("Usage: hybridforge compare [local.json] [remote.json] [hybrid.json] [--json]");
        out.println();
        out.println("Compare timing reports of local-only, remote-only and hybrid runs.");
        out.println("Missing reports are skipped.");
        out.println();
        out.println("Options:");
        out.println("  --json    Output as JSON");
        out.println();
        out.println("Defaults:");
        out.println("  local   " + DEFAULT_LOCAL_REPORT);
        out.println("  remote  " + DEFAULT_REMOTE_REPORT);
        out.println("  hybrid  " + DEFAULT_HYBRID_REPORT);
    }

    private static void printUploadCacheHelp(PrintStream out) {
        out.println("Usage: hybridforge upload-cache [options]");
        out.println();
        out.println("Copy the model's Hugging Face cache to the remote host, using the config's ssh section.");
        out.println();
        out.println("Options:");
        out.println("  --config <path>        Config file (default: " + ExecutionPlanLoader.DEFAULT_CONFIG + ")");
        out.println("  --cache <dir>          Local cache (default: " + ModelCacheUploader.DEFAULT_LOCAL_CACHE + ")");
        out.println("  --remote-cache <dir>   Remote cache (default: " + ModelCacheUploader.DEFAULT_REMOTE_CACHE + ")");
        out.println("  --model <name>         Model directories to upload (default: "
                + ModelCacheUploader.DEFAULT_MODEL + ")");
    }
}
