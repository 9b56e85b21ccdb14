package com.cronq;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Locale;

/**
 * Lifecycle status of a persisted cron job. Stored in lower case to stay
 * compatible with documents written by other producers.
 */
public enum CronJobStatus {
    PENDING,
    ASSIGNED,
    RUNNING,
    COMPLETED,
    FAILED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CronJobStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported status: " + value, e);
        }
    }

    @Converter(autoApply = true)
    public static class JpaConverter implements AttributeConverter<CronJobStatus, String> {

        @Override
        public String convertToDatabaseColumn(CronJobStatus status) {
            return status == null ? null : status.value();
        }

        @Override
        public CronJobStatus convertToEntityAttribute(String value) {
            return value == null ? null : fromValue(value);
        }
    }
}
