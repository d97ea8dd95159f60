package io.quakeflow.serialization;

import io.quakeflow.models.RawDataset;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.util.HadoopInputFile;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.Type;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads a Parquet file into a {@link RawDataset}. The column set is the file's
 * own schema, so a missing core column is visible to the quality gate.
 */
public class ParquetDatasetReader {

    public RawDataset read(Path file) throws IOException {
        Configuration conf = new Configuration();
        HadoopInputFile inputFile = HadoopInputFile.fromPath(
                new org.apache.hadoop.fs.Path(file.toAbsolutePath().toUri()), conf);

        Set<String> columns = new LinkedHashSet<>();
        try (ParquetFileReader fileReader = ParquetFileReader.open(inputFile)) {
            MessageType schema = fileReader.getFooter().getFileMetaData().getSchema();
            for (Type field : schema.getFields()) {
                columns.add(field.getName());
            }
        }

        List<Map<String, Object>> rows = new ArrayList<>();

        try (ParquetReader<GenericRecord> reader = AvroParquetReader.<GenericRecord>builder(inputFile)
                .withConf(conf)
                .build()) {
            GenericRecord record;
            while ((record = reader.read()) != null) {
                Schema schema = record.getSchema();
                Map<String, Object> row = new LinkedHashMap<>();
                for (Schema.Field field : schema.getFields()) {
                    row.put(field.name(), normalize(record.get(field.pos())));
                }
                rows.add(row);
            }
        }
        return new RawDataset(file.toString(), columns, rows);
    }

    /** Avro strings come back as {@code Utf8}; expose them as plain strings. */
    private static Object normalize(Object value) {
        if (value instanceof CharSequence) {
            return value.toString();
        }
        return value;
    }
}
