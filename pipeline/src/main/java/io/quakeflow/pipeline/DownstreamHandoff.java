package io.quakeflow.pipeline;

import java.nio.file.Path;

/**
 * A consumer of the final feature table (uploader, profiler, trainer).
 * Invoked only after a successful run.
 */
public interface DownstreamHandoff {

    String name();

    void accept(Path finalTable) throws Exception;
}
