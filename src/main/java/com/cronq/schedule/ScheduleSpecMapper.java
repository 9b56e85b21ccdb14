package com.cronq.schedule;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

/**
 * Converts between the schedule document stored with a job and {@link ScheduleSpec}.
 */
public class ScheduleSpecMapper {

    private final ObjectMapper objectMapper;
    private final ObjectReader reader;

    public ScheduleSpecMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.reader = objectMapper.readerFor(ScheduleSpec.class);
    }

    /**
     * @throws ScheduleUnsatisfiableException if the document is missing or malformed
     */
    public ScheduleSpec read(JsonNode document) {
        if (document == null || document.isNull() || document.isMissingNode()) {
            throw new ScheduleUnsatisfiableException("Job has no schedule");
        }
        try {
            return reader.readValue(document);
        } catch (Exception e) {
            throw new ScheduleUnsatisfiableException("Unreadable schedule: " + rootMessage(e), e);
        }
    }

    public JsonNode write(ScheduleSpec schedule) {
        return objectMapper.valueToTree(schedule);
    }

    private static String rootMessage(Exception e) {
        if (e instanceof JsonProcessingException jsonError) {
            return jsonError.getOriginalMessage();
        }
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
