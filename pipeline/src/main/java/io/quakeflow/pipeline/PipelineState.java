package io.quakeflow.pipeline;

/**
 * Orchestrator states. Stages advance strictly in declaration order;
 * ABORTED is reachable from any non-terminal state.
 */
public enum PipelineState {
    IDLE,
    EXTRACTING,
    GATING,
    TRANSFORMING,
    DONE,
    ABORTED;

    public boolean isTerminal() {
        return this == DONE || this == ABORTED;
    }

    public boolean canTransitionTo(PipelineState next) {
        if (isTerminal()) {
            return false;
        }
        if (next == ABORTED) {
            return true;
        }
        return next.ordinal() == ordinal() + 1;
    }
}
