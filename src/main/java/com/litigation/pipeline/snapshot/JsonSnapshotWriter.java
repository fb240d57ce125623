package com.litigation.pipeline.snapshot;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes and reads graph and session snapshots as JSON.
 */
public class JsonSnapshotWriter {
    private static final Logger log = LoggerFactory.getLogger(JsonSnapshotWriter.class);

    private final ObjectMapper objectMapper;

    public JsonSnapshotWriter() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void writeGraph(GraphSnapshot snapshot, Path target) throws IOException {
        write(snapshot, target);
        log.info("snapshot.graph.written path={} entities={} relationships={}",
                target, snapshot.entities().size(), snapshot.relationships().size());
    }

    public GraphSnapshot readGraph(Path source) throws IOException {
        return objectMapper.readValue(source.toFile(), GraphSnapshot.class);
    }

    public void writeSession(SessionSnapshot snapshot, Path target) throws IOException {
        write(snapshot, target);
        log.info("snapshot.session.written path={} sessionId={}", target, snapshot.id());
    }

    public SessionSnapshot readSession(Path source) throws IOException {
        return objectMapper.readValue(source.toFile(), SessionSnapshot.class);
    }

    public String toJson(Object snapshot) throws IOException {
        return objectMapper.writeValueAsString(snapshot);
    }

    private void write(Object value, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(target.toFile(), value);
    }
}
