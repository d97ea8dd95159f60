package io.quakeflow.pipeline;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * What a pipeline run reports to its scheduler: the final table on success,
 * or the failing stage and its message on abort.
 */
public final class PipelineRunResult {

    private final PipelineState finalState;
    private final Path finalTable;
    private final PipelineState failedStage;
    private final String message;
    private final int attempts;
    private final List<PipelineState> history;

    private PipelineRunResult(PipelineState finalState, Path finalTable, PipelineState failedStage,
                              String message, int attempts, List<PipelineState> history) {
        this.finalState = finalState;
        this.finalTable = finalTable;
        this.failedStage = failedStage;
        this.message = message;
        this.attempts = attempts;
        this.history = Collections.unmodifiableList(history);
    }

    public static PipelineRunResult done(Path finalTable, int attempts, List<PipelineState> history) {
        return new PipelineRunResult(PipelineState.DONE, finalTable, null, null, attempts, history);
    }

    public static PipelineRunResult aborted(StageException failure, int attempts, List<PipelineState> history) {
        return new PipelineRunResult(PipelineState.ABORTED, null, failure.getStage(),
                failure.getMessage(), attempts, history);
    }

    public boolean isDone() {
        return finalState == PipelineState.DONE;
    }

    public PipelineState getFinalState() { return finalState; }
    public Optional<Path> getFinalTable() { return Optional.ofNullable(finalTable); }
    public Optional<PipelineState> getFailedStage() { return Optional.ofNullable(failedStage); }
    public String getMessage() { return message; }
    public int getAttempts() { return attempts; }

    /** States visited by the last attempt, starting at IDLE. */
    public List<PipelineState> getHistory() { return history; }

    public int exitCode() {
        return isDone() ? 0 : 1;
    }

    public String describe() {
        if (isDone()) {
            return "DONE: " + finalTable;
        }
        return failedStage + ": " + message;
    }

    @Override
    public String toString() {
        return String.format("PipelineRunResult{%s, attempts=%d}", describe(), attempts);
    }
}
