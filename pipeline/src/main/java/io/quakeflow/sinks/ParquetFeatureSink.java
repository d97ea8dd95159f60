package io.quakeflow.sinks;

import io.quakeflow.models.FeatureRow;
import io.quakeflow.models.FeatureTable;
import io.quakeflow.serialization.FeatureSchema;
import org.apache.avro.generic.GenericRecord;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.io.OutputFile;
import org.apache.parquet.io.PositionOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes a {@link FeatureTable} as a single Snappy-compressed Parquet file.
 *
 * <p>Uses a small {@link OutputFile} adapter over {@link java.nio.file} so no
 * Hadoop file system is involved on the write path.
 */
public class ParquetFeatureSink {

    private static final Logger LOG = LoggerFactory.getLogger(ParquetFeatureSink.class);
    private static final int ROW_GROUP_SIZE = 64 * 1024 * 1024;

    public Path write(FeatureTable table, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        OutputFile outputFile = new NioOutputFile(target);

        try (ParquetWriter<GenericRecord> writer = AvroParquetWriter.<GenericRecord>builder(outputFile)
                .withSchema(FeatureSchema.FEATURE_ROW_SCHEMA)
                .withCompressionCodec(CompressionCodecName.SNAPPY)
                .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
                .withRowGroupSize(ROW_GROUP_SIZE)
                .build()) {
            for (FeatureRow row : table.getRows()) {
                writer.write(FeatureSchema.toRecord(row));
            }
        }

        LOG.info("Wrote feature table Parquet: {} ({} rows, {} columns)",
                target, table.size(), table.getColumns().size());
        return target;
    }

    /**
     * Adapts a local {@link Path} to Parquet's {@link OutputFile} interface.
     */
    private static class NioOutputFile implements OutputFile {
        private final Path path;

        NioOutputFile(Path path) {
            this.path = path;
        }

        @Override
        public PositionOutputStream create(long blockSizeHint) throws IOException {
            return new NioPositionOutputStream(Files.newOutputStream(path,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE));
        }

        @Override
        public PositionOutputStream createOrOverwrite(long blockSizeHint) throws IOException {
            return new NioPositionOutputStream(Files.newOutputStream(path,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE));
        }

        @Override
        public boolean supportsBlockSize() {
            return false;
        }

        @Override
        public long defaultBlockSize() {
            return ROW_GROUP_SIZE;
        }

        @Override
        public String getPath() {
            return path.toString();
        }
    }

    /**
     * Wraps an {@link OutputStream} as a Parquet {@link PositionOutputStream},
     * tracking the current write position.
     */
    private static class NioPositionOutputStream extends PositionOutputStream {
        private final OutputStream delegate;
        private long pos = 0;

        NioPositionOutputStream(OutputStream delegate) {
            this.delegate = delegate;
        }

        @Override
        public long getPos() {
            return pos;
        }

        @Override
        public void write(int b) throws IOException {
            delegate.write(b);
            pos++;
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            delegate.write(b, off, len);
            pos += len;
        }

        @Override
        public void flush() throws IOException {
            delegate.flush();
        }

        @Override
        public void close() throws IOException {
            delegate.close();
        }
    }
}
