package com.taskweaver.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.taskweaver.core.model.InvalidPlanException;
import com.taskweaver.core.model.ProjectPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link ProjectPlan} documents as JSON.
 * <p>
 * Property names are snake_case, dates ISO-8601, unknown properties are ignored.
 * Working days may be given as day names ("MONDAY") or as indexes where 0 is Monday.
 */
@Component
public class PlanJson {

    private static final Logger log = LoggerFactory.getLogger(PlanJson.class);

    private final ObjectMapper mapper;

    public PlanJson() {
        this.mapper = defaultMapper();
    }

    public static ObjectMapper defaultMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }

    public ProjectPlan read(Path path) {
        String json;
        try {
            json = Files.readString(path);
        } catch (IOException e) {
            throw new PlanParseException("Cannot read plan file " + path + ": " + e.getMessage(), e);
        }
        log.debug("Read plan file {} ({} chars)", path, json.length());
        return parse(json);
    }

    public ProjectPlan parse(String json) {
        try {
            return mapper.readValue(json, ProjectPlan.class);
        } catch (JsonProcessingException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InvalidPlanException invalid) {
                throw new PlanParseException("Invalid plan: " + invalid.getMessage(), invalid);
            }
            throw new PlanParseException("Malformed plan JSON: " + e.getOriginalMessage(), e);
        }
    }

    public String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PlanParseException("Cannot serialize " + value.getClass().getSimpleName()
                    + ": " + e.getOriginalMessage(), e);
        }
    }

    public void write(ProjectPlan plan, Path path) {
        try {
            Files.writeString(path, toJson(plan));
        } catch (IOException e) {
            throw new PlanParseException("Cannot write plan file " + path + ": " + e.getMessage(), e);
        }
        log.info("Wrote plan '{}' to {}", plan.title(), path);
    }
}
