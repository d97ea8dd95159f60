package io.quakeflow.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Generic JSON serializer for reports and summaries written next to the data.
 */
public class JsonSerializer<T> {

    private final ObjectMapper mapper;

    public JsonSerializer() {
        this.mapper = JsonMappers.create();
    }

    public byte[] serialize(T element) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(element);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + element, e);
        }
    }

    public void write(T element, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(target, serialize(element));
    }
}
