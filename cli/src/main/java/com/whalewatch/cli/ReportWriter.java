package com.whalewatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes a {@link SessionReport} as indented JSON.
 */
public class ReportWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper mapper;

    public ReportWriter() {
        this.mapper = objectMapper();
    }

    /**
     * @param report the session answers
     * @param target file to create or replace; parent directories are created
     * @throws IllegalStateException if the file cannot be written
     */
    public void write(SessionReport report, Path target) {
        Objects.requireNonNull(report, "report must not be null");
        Objects.requireNonNull(target, "target must not be null");
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(target.toFile(), report);
            LOG.info("Wrote session report to {}", target);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to write session report " + target, e);
        }
    }

    /**
     * @param report the session answers
     * @return JSON text
     */
    public String toJson(SessionReport report) {
        try {
            return mapper.writeValueAsString(report);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize session report", e);
        }
    }

    static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }
}
