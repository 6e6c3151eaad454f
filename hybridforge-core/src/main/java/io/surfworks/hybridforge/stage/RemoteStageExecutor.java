package io.surfworks.hybridforge.stage;

import io.surfworks.hybridforge.config.CommandConfig;
import io.surfworks.hybridforge.pipeline.PipelineException;
import io.surfworks.hybridforge.remote.ArtifactStager;
import io.surfworks.hybridforge.remote.RemoteSession;
import io.surfworks.hybridforge.remote.TransferException;
import io.surfworks.hybridforge.report.TimingRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

import static io.surfworks.hybridforge.remote.ArtifactStager.remotePath;
import static io.surfworks.hybridforge.remote.RemoteSession.quote;

/**
 * Runs a stage on the remote host over an open {@link RemoteSession}.
 *
 * <p>Steps, in order:
 * <ol>
 *   <li>create the remote working directory</li>
 *   <li>upload the input artifact (timed)</li>
 *   <li>upload the stage script, tolerating failure (it is usually already there)</li>
 *   <li>run the stage with the configured remote interpreter and setup command</li>
 *   <li>download the output artifact (timed)</li>
 *   <li>fetch, parse and delete the remote timing file</li>
 * </ol>
 *
 * <p>The session is owned by the caller and is not closed here.
 */
public final class RemoteStageExecutor implements StageExecutor {

    private static final Logger LOG = Logger.getLogger(RemoteStageExecutor.class.getName());

    /** Name of the timing file the stage writes inside the remote working directory */
    public static final String REMOTE_TIMING_FILE = "timing_remote_tmp.json";

    private final RemoteSession session;
    private final ArtifactStager stager;
    private final String remoteWorkdir;
    private final CommandConfig commands;
    private final Path scratchDir;

    public RemoteStageExecutor(RemoteSession session, ArtifactStager stager,
                               String remoteWorkdir, CommandConfig commands) {
        this(session, stager, remoteWorkdir, commands, Path.of(System.getProperty("java.io.tmpdir")));
    }

    public RemoteStageExecutor(RemoteSession session, ArtifactStager stager,
                               String remoteWorkdir, CommandConfig commands, Path scratchDir) {
        this.session = Objects.requireNonNull(session, "session cannot be null");
        this.stager = Objects.requireNonNull(stager, "stager cannot be null");
        this.remoteWorkdir = Objects.requireNonNull(remoteWorkdir, "remoteWorkdir cannot be null");
        this.commands = Objects.requireNonNull(commands, "commands cannot be null");
        this.scratchDir = Objects.requireNonNull(scratchDir, "scratchDir cannot be null");
    }

    @Override
    public Location location() {
        return Location.REMOTE;
    }

    @Override
    public TimingRecord execute(Stage stage, Path input, Path output) throws PipelineException {
        if (!stage.isRemoteEligible()) {
            throw new IllegalArgumentException("Stage " + stage.reportName() + " cannot run remotely");
        }
        Objects.requireNonNull(input, "input cannot be null");

        LOG.info("Running " + stage.reportName() + " on " + session.config().target() + " in " + remoteWorkdir);
        session.ensureDirectory(remoteWorkdir);

        String inputName = input.getFileName().toString();
        String outputName = output.getFileName().toString();

        Duration upload = stager.upload(input, remotePath(remoteWorkdir, inputName));
        uploadScript(stage);

        session.run(buildCommand(stage, inputName, outputName), remoteWorkdir);

        Duration download = stager.download(remotePath(remoteWorkdir, outputName), output);
        double compute = fetchComputeSeconds(stage);

        return TimingRecord.remote(stage, compute, upload, download);
    }

    /**
     * Builds the stage command line, relative to the remote working directory.
     */
    String buildCommand(Stage stage, String inputName, String outputName) {
        String script = commands.scriptFor(stage).getFileName().toString();
        String command = commands.remoteInterpreter() + " " + quote(script)
                + " --task " + stage.task()
                + " --input " + quote(inputName)
                + " --output " + quote(outputName)
                + " --timing-output " + REMOTE_TIMING_FILE;

        String setup = session.config().setupCommand();
        return setup != null ? setup + " && " + command : command;
    }

    private void uploadScript(Stage stage) {
        Path script = commands.scriptFor(stage);
        String target = remotePath(remoteWorkdir, script.getFileName().toString());
        try {
            stager.upload(script, target);
        } catch (TransferException e) {
            LOG.log(Level.INFO, "Script upload skipped (" + e.getMessage()
                    + "); using the copy already on the remote host", e);
        }
    }

    private double fetchComputeSeconds(Stage stage) throws PipelineException {
        String remoteTiming = remotePath(remoteWorkdir, REMOTE_TIMING_FILE);
        Path localTiming = scratchDir.resolve("hybridforge-remote-timing-" + stage.task() + "-"
                + UUID.randomUUID().toString().substring(0, 8) + ".json");

        double compute;
        try {
            stager.download(remoteTiming, localTiming);
            compute = TimingSideChannel.readComputeSeconds(localTiming);
        } finally {
            try {
                Files.deleteIfExists(localTiming);
            } catch (IOException e) {
                LOG.log(Level.WARNING, "Could not delete scratch file " + localTiming, e);
            }
        }

        stager.remove(remoteTiming);
        return compute;
    }
}
