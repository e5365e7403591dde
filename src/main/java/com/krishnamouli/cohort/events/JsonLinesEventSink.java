package com.krishnamouli.cohort.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.krishnamouli.cohort.config.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Appends one JSON document per line to a file.
 */
public class JsonLinesEventSink implements EventSink {
    private static final Logger logger = LoggerFactory.getLogger(JsonLinesEventSink.class);

    private final Path path;
    private final ObjectMapper mapper;

    public JsonLinesEventSink(Path path) throws IOException {
        this.path = path;
        this.mapper = JsonMappers.newMapper();
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        logger.info("Recording events to {}", path.toAbsolutePath());
    }

    @Override
    public synchronized void append(TrackedEvent event) throws IOException {
        String json = mapper.writeValueAsString(event) + "\n";
        Files.writeString(
                path,
                json,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND);
    }

    /**
     * Scans the whole file. Unreadable lines are skipped.
     */
    @Override
    public synchronized List<TrackedEvent> findByExperiment(String experimentId) throws IOException {
        List<TrackedEvent> matching = new ArrayList<>();
        if (!Files.exists(path)) {
            return matching;
        }

        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    TrackedEvent event = mapper.readValue(line, TrackedEvent.class);
                    if (experimentId.equals(event.getExperimentId())) {
                        matching.add(event);
                    }
                } catch (JsonProcessingException e) {
                    logger.warn("Skipping unreadable event at {}:{}: {}", path, lineNumber, e.getOriginalMessage());
                }
            }
        }
        return matching;
    }

    public Path getPath() {
        return path;
    }
}
