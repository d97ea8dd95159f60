package io.quakeflow.pipeline;

import java.nio.file.Path;

/**
 * One step of the pipeline. Receives the location produced by the previous
 * step and returns the location of its own output.
 */
@FunctionalInterface
public interface PipelineStage {

    Path execute(Path input) throws Exception;
}
