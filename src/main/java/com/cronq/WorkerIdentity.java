package com.cronq;

/**
 * Ownership stamp written onto a job when it is assigned to a worker.
 */
public record WorkerIdentity(String clusterId, String serverId, String workerId) {
}
