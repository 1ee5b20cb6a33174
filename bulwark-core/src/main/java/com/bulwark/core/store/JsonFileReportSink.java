package com.bulwark.core.store;

import com.bulwark.core.model.SecurityReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes reports as pretty-printed JSON to a fixed file, replacing any earlier report.
 */
public class JsonFileReportSink implements ReportSink {

    private static final Logger log = LoggerFactory.getLogger(JsonFileReportSink.class);

    private final Path outputPath;
    private final ObjectMapper objectMapper;

    public JsonFileReportSink(Path outputPath) {
        this(outputPath, createObjectMapper());
    }

    public JsonFileReportSink(Path outputPath, ObjectMapper objectMapper) {
        if (outputPath == null) {
            throw new IllegalArgumentException("outputPath must not be null");
        }
        this.outputPath = outputPath.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
    }

    /** ISO-8601 timestamps, indented output. */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    @Override
    public String save(SecurityReport report) throws IOException {
        if (report == null) {
            throw new IllegalArgumentException("report must not be null");
        }
        Path parent = outputPath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        String path = outputPath.toString();
        // the persisted copy already carries its own location
        String json = objectMapper.writeValueAsString(report.withReportPath(path));
        Files.writeString(outputPath, json);

        log.debug("[Bulwark] Report {} written to {} ({} bytes)", report.getId(), path, Files.size(outputPath));
        return path;
    }

    public Path getOutputPath() {
        return outputPath;
    }
}
