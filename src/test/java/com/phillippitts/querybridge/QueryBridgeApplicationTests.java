package com.phillippitts.querybridge;

import com.phillippitts.querybridge.config.IntegrationTestConfiguration;
import com.phillippitts.querybridge.service.cache.ResponseCache;
import com.phillippitts.querybridge.service.queue.JobQueue;
import com.phillippitts.querybridge.service.worker.WorkerBridge;
import com.phillippitts.querybridge.testutil.FakeWorkerBridge;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.HealthContributorRegistry;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import static org.assertj.core.api.Assertions.assertThat;

@Import(IntegrationTestConfiguration.class)
@SpringBootTest
class QueryBridgeApplicationTests {

    @Autowired
    private WorkerBridge bridge;

    @Autowired
    private JobQueue queue;

    @Autowired
    private ResponseCache cache;

    @Autowired
    private HealthContributorRegistry healthContributors;

    @Test
    void contextLoads() {
        assertThat(bridge).isInstanceOf(FakeWorkerBridge.class);
        assertThat(queue.isPaused()).isFalse();
        assertThat(cache.healthCheck()).isTrue();
    }

    @Test
    void healthIndicatorsAreRegisteredUnderComponentNames() {
        assertThat(healthContributors.getContributor("worker")).isNotNull();
        assertThat(healthContributors.getContributor("responseCache")).isNotNull();
        assertThat(healthContributors.getContributor("jobQueue")).isNotNull();
    }
}
