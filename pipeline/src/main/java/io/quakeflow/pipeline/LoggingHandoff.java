package io.quakeflow.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Announces the final table in the log, for schedulers that pick the path
 * up from there.
 */
public class LoggingHandoff implements DownstreamHandoff {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingHandoff.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void accept(Path finalTable) {
        LOG.info("Feature table ready for downstream consumers: {}", finalTable.toAbsolutePath());
    }
}
