package com.cronq.internal;

import com.cronq.WorkerIdentity;
import com.cronq.config.CronQProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LocalWorkerIdentityProviderTest {

    @Test
    void shouldUseConfiguredIdsAndStableWorkerId() {
        CronQProperties properties = new CronQProperties();
        properties.getIdentity().setClusterId("eu-west");
        properties.getIdentity().setServerId(" node-7 ");
        LocalWorkerIdentityProvider provider = new LocalWorkerIdentityProvider(properties);

        WorkerIdentity identity = provider.currentIdentity();

        assertThat(identity.clusterId()).isEqualTo("eu-west");
        assertThat(identity.serverId()).isEqualTo("node-7");
        assertThat(identity.workerId()).startsWith("worker-");
        assertThat(provider.currentIdentity()).isEqualTo(identity);
    }

    @Test
    void shouldFallBackToHostNameAndDistinctWorkers() {
        CronQProperties properties = new CronQProperties();

        WorkerIdentity first = new LocalWorkerIdentityProvider(properties).currentIdentity();
        WorkerIdentity second = new LocalWorkerIdentityProvider(properties).currentIdentity();

        assertThat(first.serverId()).isNotBlank();
        assertThat(first.workerId()).isNotEqualTo(second.workerId());
    }
}
