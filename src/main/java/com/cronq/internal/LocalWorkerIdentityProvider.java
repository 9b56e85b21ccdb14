package com.cronq.internal;

import com.cronq.WorkerIdentity;
import com.cronq.WorkerIdentityProvider;
import com.cronq.config.CronQProperties;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

/**
 * Identity of a single process: configured cluster and server ids plus a
 * worker id generated at startup. Provides no mutual exclusion between
 * processes.
 */
public class LocalWorkerIdentityProvider implements WorkerIdentityProvider {

    private final WorkerIdentity identity;

    public LocalWorkerIdentityProvider(CronQProperties properties) {
        CronQProperties.Identity config = properties.getIdentity();
        String serverId = config.getServerId() == null || config.getServerId().isBlank()
                ? localHostName()
                : config.getServerId().trim();
        this.identity = new WorkerIdentity(config.getClusterId(), serverId, "worker-" + UUID.randomUUID());
    }

    @Override
    public WorkerIdentity currentIdentity() {
        return identity;
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown-host";
        }
    }
}
