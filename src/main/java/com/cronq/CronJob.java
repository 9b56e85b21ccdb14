package com.cronq;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import jakarta.persistence.Version;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "cronq_jobs")
public class CronJob {

    @Id
    private UUID id;

    @Column(name = "organization_id", nullable = false)
    private String organizationId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false)
    private JsonNode schedule;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private JsonNode task;

    @Column(name = "next_execution_time")
    private OffsetDateTime nextExecutionTime;

    @Column(nullable = false)
    private CronJobStatus status = CronJobStatus.PENDING;

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "retries")
    private Integer retries;

    @Column(name = "retry_interval")
    private String retryInterval;

    @Column(name = "retry_count")
    private int retryCount = 0;

    /** The occurrence a pending retry belongs to; null outside of retries. */
    @Column(name = "occurrence_time")
    private OffsetDateTime occurrenceTime;

    @Column(name = "cluster_id")
    private String clusterId;

    @Column(name = "server_id")
    private String serverId;

    @Column(name = "worker_id")
    private String workerId;

    @Column(name = "log_timestamp")
    private OffsetDateTime logTimestamp;

    @Column(name = "log_status")
    private String logStatus;

    @Column(name = "log_message", columnDefinition = "text")
    private String logMessage;

    @Column(name = "created_at", insertable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @Version
    private Long version;

    public CronJob() {
    }

    public CronJob(UUID id, String organizationId, JsonNode schedule, JsonNode task) {
        this.id = id;
        this.organizationId = organizationId;
        this.schedule = schedule;
        this.task = task;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(String organizationId) {
        this.organizationId = organizationId;
    }

    public JsonNode getSchedule() {
        return schedule;
    }

    public void setSchedule(JsonNode schedule) {
        this.schedule = schedule;
    }

    public JsonNode getTask() {
        return task;
    }

    public void setTask(JsonNode task) {
        this.task = task;
    }

    public OffsetDateTime getNextExecutionTime() {
        return nextExecutionTime;
    }

    public void setNextExecutionTime(OffsetDateTime nextExecutionTime) {
        this.nextExecutionTime = nextExecutionTime;
    }

    public CronJobStatus getStatus() {
        return status;
    }

    public void setStatus(CronJobStatus status) {
        this.status = status;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    @Transient
    public RetryPolicy getRetryPolicy() {
        if (retries == null) {
            return null;
        }
        return RetryPolicy.of(retries, retryInterval);
    }

    public void setRetryPolicy(RetryPolicy retryPolicy) {
        if (retryPolicy == null) {
            this.retries = null;
            this.retryInterval = null;
            return;
        }
        this.retries = retryPolicy.retries();
        this.retryInterval = retryPolicy.retryInterval().toString();
    }

    public Integer getRetries() {
        return retries;
    }

    public void setRetries(Integer retries) {
        this.retries = retries;
    }

    public String getRetryInterval() {
        return retryInterval;
    }

    public void setRetryInterval(String retryInterval) {
        this.retryInterval = retryInterval;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public void incrementRetryCount() {
        this.retryCount++;
    }

    public OffsetDateTime getOccurrenceTime() {
        return occurrenceTime;
    }

    public void setOccurrenceTime(OffsetDateTime occurrenceTime) {
        this.occurrenceTime = occurrenceTime;
    }

    public String getClusterId() {
        return clusterId;
    }

    public void setClusterId(String clusterId) {
        this.clusterId = clusterId;
    }

    public String getServerId() {
        return serverId;
    }

    public void setServerId(String serverId) {
        this.serverId = serverId;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public void assignTo(WorkerIdentity identity) {
        this.clusterId = identity.clusterId();
        this.serverId = identity.serverId();
        this.workerId = identity.workerId();
    }

    public OffsetDateTime getLogTimestamp() {
        return logTimestamp;
    }

    public void setLogTimestamp(OffsetDateTime logTimestamp) {
        this.logTimestamp = logTimestamp;
    }

    public String getLogStatus() {
        return logStatus;
    }

    public void setLogStatus(String logStatus) {
        this.logStatus = logStatus;
    }

    public String getLogMessage() {
        return logMessage;
    }

    public void setLogMessage(String logMessage) {
        this.logMessage = logMessage;
    }

    /**
     * Records the outcome of the latest execution attempt.
     */
    public void recordLog(OffsetDateTime timestamp, CronJobStatus outcome, String message) {
        this.logTimestamp = timestamp;
        this.logStatus = outcome.value();
        this.logMessage = message;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }
}
