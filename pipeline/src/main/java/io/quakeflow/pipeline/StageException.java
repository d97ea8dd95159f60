package io.quakeflow.pipeline;

/**
 * A stage failure tagged with the state it happened in.
 * The message is the cause's own message, unchanged.
 */
public class StageException extends Exception {

    private static final long serialVersionUID = 1L;

    private final PipelineState stage;

    public StageException(PipelineState stage, Throwable cause) {
        super(messageOf(cause), cause);
        this.stage = stage;
    }

    public PipelineState getStage() {
        return stage;
    }

    private static String messageOf(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    }
}
