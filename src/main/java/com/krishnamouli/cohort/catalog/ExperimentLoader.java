package com.krishnamouli.cohort.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.krishnamouli.cohort.config.JsonMappers;
import com.krishnamouli.cohort.experiment.Experiment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads experiment definitions from a JSON array.
 */
public class ExperimentLoader {
    private static final Logger logger = LoggerFactory.getLogger(ExperimentLoader.class);

    /** Definitions bundled with the application. */
    public static final String DEFAULT_RESOURCE = "experiments.json";

    private static final TypeReference<List<Experiment>> EXPERIMENT_LIST = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public ExperimentLoader() {
        this(JsonMappers.newMapper());
    }

    public ExperimentLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<Experiment> fromFile(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            List<Experiment> experiments = mapper.readValue(in, EXPERIMENT_LIST);
            logger.info("Read {} experiments from {}", experiments.size(), path);
            return experiments;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read experiments from " + path, e);
        }
    }

    public List<Experiment> fromResource(String resource) {
        try (InputStream in = ExperimentLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new UncheckedIOException(new IOException("Resource not found: " + resource));
            }
            List<Experiment> experiments = mapper.readValue(in, EXPERIMENT_LIST);
            logger.info("Read {} experiments from classpath:{}", experiments.size(), resource);
            return experiments;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read experiments from classpath:" + resource, e);
        }
    }

    public List<Experiment> fromJson(String json) {
        try {
            return mapper.readValue(json, EXPERIMENT_LIST);
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed experiment definitions", e);
        }
    }
}
