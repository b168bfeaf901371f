package com.iksanov.rangecache.engine.app;

import com.iksanov.rangecache.engine.app.workload.RangeWorkloadBenchmark;
import com.iksanov.rangecache.engine.app.workload.RecurrenceBenchmark;
import com.iksanov.rangecache.engine.config.BenchmarkConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class BenchmarkApplicationTest {

    private final BenchmarkConfig smallConfig = new BenchmarkConfig(1_000, 500, 50, 100, 5L, 60, 20, 2);

    @Test
    @DisplayName("Small end-to-end run should complete both phases")
    void runsBothPhases() {
        BenchmarkApplication app = new BenchmarkApplication(smallConfig);

        RangeWorkloadBenchmark.Result range = app.runRangeWorkload();
        List<RecurrenceBenchmark.Sample> samples = app.runRecurrence();

        assertThat(range.checksum()).isPositive();
        assertThat(samples).hasSize(4);
        assertThatCode(app::run).doesNotThrowAnyException();
    }
}
