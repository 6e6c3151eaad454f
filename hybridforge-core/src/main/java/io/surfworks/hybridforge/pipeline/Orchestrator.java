package io.surfworks.hybridforge.pipeline;

import io.surfworks.hybridforge.config.ExecutionPlan;
import io.surfworks.hybridforge.remote.ArtifactStager;
import io.surfworks.hybridforge.remote.RemoteSession;
import io.surfworks.hybridforge.remote.RemoteTransport;
import io.surfworks.hybridforge.remote.Sleeper;
import io.surfworks.hybridforge.remote.ssh.JschRemoteTransport;
import io.surfworks.hybridforge.report.MonotonicClock;
import io.surfworks.hybridforge.report.TimingRecord;
import io.surfworks.hybridforge.report.TimingReport;
import io.surfworks.hybridforge.report.TimingReportWriter;
import io.surfworks.hybridforge.stage.LocalStageExecutor;
import io.surfworks.hybridforge.stage.Location;
import io.surfworks.hybridforge.stage.RemoteStageExecutor;
import io.surfworks.hybridforge.stage.Stage;
import io.surfworks.hybridforge.stage.StageExecutor;
import io.surfworks.hybridforge.stage.StageRunner;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Drives the fixed pipeline for one run.
 *
 * <p>Pipeline stages:
 * <ol>
 *   <li><b>generate</b>, <b>check</b>: always local, run before the plan is consulted</li>
 *   <li><b>filter</b>, <b>collect</b>, <b>patch</b>, <b>plot</b>: local or remote as the plan says</li>
 * </ol>
 *
 * <p>Each stage starts only after the previous one completed, because its
 * input is the previous stage's output. A remote session is opened once,
 * after the local pre-stages and only if the plan puts a stage remotely, and
 * is closed once when the run ends, whether it completed or aborted. The
 * first failure aborts the run; the timing report is written in both cases,
 * so an aborted run keeps the timings of the stages that finished.
 */
public final class Orchestrator {

    private static final Logger LOG = Logger.getLogger(Orchestrator.class.getName());

    private final ExecutionPlan plan;
    private final RemoteTransport transport;
    private final StageExecutor localExecutor;
    private final Clock clock;
    private final Sleeper sleeper;
    private final PipelineListener listener;

    /**
     * Creates an orchestrator that connects with JSch and reports to no one.
     */
    public Orchestrator(ExecutionPlan plan) {
        this(plan, new JschRemoteTransport(), PipelineListener.NONE);
    }

    public Orchestrator(ExecutionPlan plan, RemoteTransport transport, PipelineListener listener) {
        this(plan, transport, new LocalStageExecutor(plan.commands()), new MonotonicClock(), Sleeper.SYSTEM, listener);
    }

    /**
     * Creates an orchestrator with every collaborator supplied.
     *
     * @param plan          the run's execution plan
     * @param transport     used to open the remote session (never touched if nothing is remote)
     * @param localExecutor runs local stages
     * @param clock         measures wall and transfer times
     * @param sleeper       pauses between connection attempts
     * @param listener      progress callbacks
     */
    public Orchestrator(ExecutionPlan plan, RemoteTransport transport, StageExecutor localExecutor,
                        Clock clock, Sleeper sleeper, PipelineListener listener) {
        this.plan = Objects.requireNonNull(plan, "plan cannot be null");
        this.transport = Objects.requireNonNull(transport, "transport cannot be null");
        this.localExecutor = Objects.requireNonNull(localExecutor, "localExecutor cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper cannot be null");
        this.listener = Objects.requireNonNull(listener, "listener cannot be null");
    }

    /**
     * Runs the whole pipeline.
     *
     * @return the report of a completed run (also written to the configured path)
     * @throws PipelineException on the first failure; the partial report has been written
     */
    public TimingReport run() throws PipelineException {
        TimingReport report = new TimingReport();
        RemoteSession session = null;
        Stage current = null;
        PipelineException failure = null;

        try {
            StageRunner localOnly = new StageRunner(plan.paths(), localExecutor, null);
            for (Stage stage : Stage.preStages()) {
                current = stage;
                report.add(dispatch(localOnly, stage, Location.LOCAL));
            }
            current = null;

            StageRunner runner = localOnly;
            if (plan.requiresRemote()) {
                session = openSession();
                ArtifactStager stager = new ArtifactStager(session, clock);
                runner = new StageRunner(plan.paths(), localExecutor, new RemoteStageExecutor(
                        session, stager, plan.paths().remoteWorkdir(), plan.commands()));
            }

            for (Stage stage : Stage.remoteEligible()) {
                current = stage;
                report.add(dispatch(runner, stage, plan.locationOf(stage)));
            }
            current = null;

            report.markCompleted();
            return report;

        } catch (PipelineException e) {
            failure = e;
            report.markAborted(current);
            if (current != null) {
                listener.stageFailed(current, e);
            }
            throw e;

        } catch (RuntimeException e) {
            report.markAborted(current);
            throw e;

        } finally {
            if (session != null) {
                session.close();
            }
            persist(report, failure);
        }
    }

    private RemoteSession openSession() throws PipelineException {
        String target = plan.ssh().target();
        listener.connecting(target);
        RemoteSession session = RemoteSession.connect(plan.ssh(), transport, sleeper);
        listener.connected(target);
        return session;
    }

    private TimingRecord dispatch(StageRunner runner, Stage stage, Location location) throws PipelineException {
        listener.stageStarted(stage, location);
        LOG.info("Stage " + stage.reportName() + " -> " + location.tag());

        Instant start = clock.instant();
        TimingRecord record = runner.run(stage, location);
        TimingRecord timed = record.withWallTime(MonotonicClock.elapsedSince(clock, start));

        listener.stageCompleted(timed);
        return timed;
    }

    private void persist(TimingReport report, PipelineException failure) throws PipelineException {
        Path reportFile = plan.paths().timingReport();
        try {
            TimingReportWriter.write(report, reportFile);
            listener.reportWritten(reportFile);
            LOG.info("Timing report (" + report.status() + ") written to " + reportFile);
        } catch (IOException e) {
            if (failure != null) {
                failure.addSuppressed(e);
            } else if (report.status() == TimingReport.Status.COMPLETED) {
                throw new PipelineException("Cannot write timing report " + reportFile + ": " + e.getMessage(), e);
            } else {
                LOG.warning("Cannot write timing report " + reportFile + ": " + e.getMessage());
            }
        }
    }
}
