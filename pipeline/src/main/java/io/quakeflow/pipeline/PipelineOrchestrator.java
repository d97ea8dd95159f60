package io.quakeflow.pipeline;

import io.quakeflow.extract.IntervalExtractor;
import io.quakeflow.functions.FeatureTransformer;
import io.quakeflow.quality.QualityGate;
import io.quakeflow.quality.QualityGateConfig;
import io.quakeflow.utils.PipelineConfig;
import io.quakeflow.utils.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Thin sequencer: Extract, Gate, Transform, then downstream handoffs.
 *
 * <p>Any stage failure aborts the attempt and the failing stage's message is
 * reported unchanged. A failed attempt is retried from IDLE after a fixed
 * delay, up to the configured number of retries. These whole-run retries are
 * independent of the per-request retries inside the session client.
 */
public class PipelineOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final PipelineStage extract;
    private final PipelineStage gate;
    private final PipelineStage transform;
    private final Path initialInput;
    private final int retries;
    private final Duration retryDelay;
    private final Sleeper sleeper;
    private final List<DownstreamHandoff> handoffs = new ArrayList<>();

    private PipelineState state = PipelineState.IDLE;
    private List<PipelineState> history = new ArrayList<>();

    public PipelineOrchestrator(PipelineStage extract, PipelineStage gate, PipelineStage transform,
                                Path initialInput, int retries, Duration retryDelay, Sleeper sleeper) {
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be >= 0, got " + retries);
        }
        this.extract = extract;
        this.gate = gate;
        this.transform = transform;
        this.initialInput = initialInput;
        this.retries = retries;
        this.retryDelay = retryDelay;
        this.sleeper = sleeper;
    }

    public static PipelineOrchestrator fromConfig(PipelineConfig config) {
        QualityGateConfig gateConfig = QualityGateConfig.defaults()
                .withMinRows(config.getMinRows())
                .withNullThreshold(config.getNullThreshold());

        PipelineOrchestrator orchestrator = new PipelineOrchestrator(
                PipelineStages.extraction(IntervalExtractor.fromConfig(config, config.getRawDir()), config),
                PipelineStages.gate(new QualityGate(gateConfig)),
                PipelineStages.transform(new FeatureTransformer(), config.getProcessedDir(), Clock.systemUTC()),
                config.getRawDir(),
                config.getPipelineRetries(),
                config.getPipelineRetryDelay(),
                Sleeper.SYSTEM);
        orchestrator.addHandoff(new LoggingHandoff());
        return orchestrator;
    }

    public PipelineOrchestrator addHandoff(DownstreamHandoff handoff) {
        handoffs.add(handoff);
        return this;
    }

    public PipelineState getState() {
        return state;
    }

    public PipelineRunResult run() {
        int maxAttempts = retries + 1;
        StageException lastFailure = null;
        int attemptsMade = 0;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                LOG.info("Retrying pipeline in {} (attempt {}/{})", retryDelay, attempt, maxAttempts);
                try {
                    sleeper.sleep(retryDelay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.error("Interrupted while waiting to retry; giving up");
                    break;
                }
            }

            attemptsMade = attempt;
            try {
                Path finalTable = runOnce();
                LOG.info("Pipeline finished on attempt {}: {}", attempt, finalTable);
                notifyHandoffs(finalTable);
                return PipelineRunResult.done(finalTable, attempt, history);
            } catch (StageException e) {
                lastFailure = e;
                LOG.error("Pipeline aborted in {} (attempt {}/{}): {}",
                        e.getStage(), attempt, maxAttempts, e.getMessage());
            }
        }

        return PipelineRunResult.aborted(lastFailure, attemptsMade, history);
    }

    private Path runOnce() throws StageException {
        state = PipelineState.IDLE;
        history = new ArrayList<>();
        history.add(state);

        Path extracted = runStage(PipelineState.EXTRACTING, extract, initialInput);
        Path gated = runStage(PipelineState.GATING, gate, extracted);
        Path table = runStage(PipelineState.TRANSFORMING, transform, gated);
        moveTo(PipelineState.DONE);
        return table;
    }

    private Path runStage(PipelineState stage, PipelineStage step, Path input) throws StageException {
        moveTo(stage);
        try {
            return step.execute(input);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            moveTo(PipelineState.ABORTED);
            throw new StageException(stage, e);
        } catch (Exception e) {
            moveTo(PipelineState.ABORTED);
            throw new StageException(stage, e);
        }
    }

    private void moveTo(PipelineState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + next);
        }
        LOG.debug("{} -> {}", state, next);
        state = next;
        history.add(next);
    }

    private void notifyHandoffs(Path finalTable) {
        for (DownstreamHandoff handoff : handoffs) {
            try {
                handoff.accept(finalTable);
            } catch (Exception e) {
                LOG.error("Downstream handoff '{}' failed for {}", handoff.name(), finalTable, e);
            }
        }
    }
}
