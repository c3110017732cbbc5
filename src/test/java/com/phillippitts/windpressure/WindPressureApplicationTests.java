package com.phillippitts.windpressure;

import com.phillippitts.windpressure.service.orchestration.CorrectionOrchestrator;
import com.phillippitts.windpressure.service.peak.PeakAggregator;
import com.phillippitts.windpressure.service.peak.RowCountPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    properties = {
        "correction.output-dir=${java.io.tmpdir}/wind-pressure-test",
        "correction.peak.row-count-policy=TRUNCATE",
        "threadpool.correction.core-pool-size=2"
    }
)
class WindPressureApplicationTests {

    @Autowired
    private CorrectionOrchestrator orchestrator;

    @Autowired
    private PeakAggregator peakAggregator;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    void contextLoads() {
        assertThat(orchestrator).isNotNull();
        assertThat(peakAggregator.getRowCountPolicy()).isEqualTo(RowCountPolicy.TRUNCATE);
        assertThat(meterRegistry.find("correction.pool.size").gauge()).isNotNull();
    }

}
