package com.cronq;

import org.springframework.context.ApplicationEvent;

import java.util.List;

/**
 * Notification that records of a collection were created, updated or deleted.
 * For deletions only the record ids are significant.
 */
public class RecordChangeEvent extends ApplicationEvent {

    public enum ChangeType {
        CREATE,
        UPDATE,
        DELETE
    }

    private final ChangeType changeType;
    private final String collection;
    private final List<CronJob> records;

    public RecordChangeEvent(Object source, ChangeType changeType, String collection, List<CronJob> records) {
        super(source);
        this.changeType = changeType;
        this.collection = collection;
        this.records = records == null ? List.of() : List.copyOf(records);
    }

    public ChangeType getChangeType() {
        return changeType;
    }

    public String getCollection() {
        return collection;
    }

    public List<CronJob> getRecords() {
        return records;
    }
}
