package io.quakeflow.serialization;

import io.quakeflow.models.RawDataset;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Dispatches a dataset path to the reader for its declared format.
 */
public final class DatasetReaders {

    private DatasetReaders() {}

    public static RawDataset read(Path file, DatasetFormat format) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString(), null, "Input file not found");
        }
        switch (format) {
            case GEOJSON:
                return new GeoJsonDatasetReader().read(file);
            case PARQUET:
                return new ParquetDatasetReader().read(file);
            default:
                throw new IllegalArgumentException("Unsupported format: " + format);
        }
    }
}
