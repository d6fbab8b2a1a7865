package com.phillippitts.querybridge.service.worker;

import com.phillippitts.querybridge.annotation.RequiresRealBinary;
import com.phillippitts.querybridge.config.properties.QueryValidationProperties;
import com.phillippitts.querybridge.config.properties.WorkerProperties;
import com.phillippitts.querybridge.domain.WorkerAnswer;
import com.phillippitts.querybridge.service.metrics.PipelineMetrics;
import com.phillippitts.querybridge.service.validation.QueryValidator;
import com.phillippitts.querybridge.testutil.EventCapturingPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the bridge against a real {@code python3} child process speaking the line protocol.
 */
@RequiresRealBinary("python3 on PATH")
class RealWorkerProcessTest {

    private static final String ECHO_WORKER = String.join("\n",
            "import json, sys",
            "print(json.dumps({'success': True, 'message': 'Ready'}), flush=True)",
            "for line in sys.stdin:",
            "    req = json.loads(line)",
            "    print(json.dumps({'success': True, 'answer': 'echo:' + req['query'],",
            "                      'sources': ['doc-1']}), flush=True)");

    private PersistentWorkerBridge bridge;

    @AfterEach
    void tearDown() {
        if (bridge != null) {
            bridge.close();
        }
    }

    @Test
    void answersThroughRealProcess() {
        WorkerProperties props = new WorkerProperties();
        props.setAutoStart(false);
        props.setCommand(List.of("python3", "-u", "-c", ECHO_WORKER));
        bridge = new PersistentWorkerBridge(props,
                new QueryValidator(QueryValidationProperties.defaults()),
                new EventCapturingPublisher(),
                new PipelineMetrics(new SimpleMeterRegistry()));

        WorkerAnswer first = bridge.query("first question", "u-1", List.of());
        WorkerAnswer second = bridge.query("second question", "u-1", List.of());

        assertThat(first.answer()).isEqualTo("echo:first question");
        assertThat(second.answer()).isEqualTo("echo:second question");
        assertThat(second.sources()).containsExactly("doc-1");
        assertThat(bridge.state()).isEqualTo(WorkerState.READY);
        assertThat(bridge.healthCheck(Duration.ofSeconds(5))).isTrue();
    }
}
