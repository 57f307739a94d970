package com.ngramengine.progress;

import com.ngramengine.memory.FakeMemoryProbe;
import com.ngramengine.memory.MemoryBudget;
import com.ngramengine.memory.MemoryMonitor;
import com.ngramengine.memory.PressureTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ProgressReporterTest {

    private static final long BUDGET = 1_000_000L;
    private static final long SYSTEM = 8L * 1024 * 1024 * 1024;

    /**
     * 可手动推进的时钟。
     */
    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    @Test
    @DisplayName("回调抛出的异常被吞掉，其余调用照常转发")
    void testSafeReporterSwallowsFailures() {
        List<String> calls = new ArrayList<>();
        ProgressReporter flaky = new ProgressReporter() {
            @Override
            public void startSubstep(String parentId, String substepId) {
                throw new IllegalStateException("broken");
            }

            @Override
            public void completeSubstep(String parentId, String substepId) {
                calls.add(parentId + "/" + substepId);
            }
        };
        ProgressReporter safe = SafeProgressReporter.wrap(flaky);

        assertDoesNotThrow(() -> safe.startSubstep("step", "sub"));
        safe.completeSubstep("step", "sub");

        assertEquals(List.of("step/sub"), calls);
    }

    @Test
    void testWrapIsIdempotent() {
        ProgressReporter reporter = new ProgressReporter() {
        };
        ProgressReporter wrapped = SafeProgressReporter.wrap(reporter);

        assertSame(ProgressReporter.NOOP, SafeProgressReporter.wrap(null));
        assertSame(ProgressReporter.NOOP, SafeProgressReporter.wrap(ProgressReporter.NOOP));
        assertSame(wrapped, SafeProgressReporter.wrap(wrapped));
    }

    @Test
    @DisplayName("高压告警按 30 秒限频，且每次更新都会触发回收检查")
    void testMemoryAwareProgressRateLimitsWarnings() {
        FakeMemoryProbe probe = new FakeMemoryProbe(850_000L, SYSTEM);
        AtomicInteger gcRuns = new AtomicInteger();
        MemoryMonitor monitor = new MemoryMonitor(probe, new MemoryBudget(BUDGET, SYSTEM), 0.70, 0.80, 0.90, 10,
            gcRuns::incrementAndGet, Clock.systemUTC());
        MutableClock clock = new MutableClock();
        List<Long> forwarded = new ArrayList<>();
        MemoryAwareProgress progress = new MemoryAwareProgress(new ProgressReporter() {
            @Override
            public void updateSubstep(String parentId, String substepId, long current) {
                forwarded.add(current);
            }
        }, monitor, clock);

        progress.updateSubstep("generate_ngrams", "chunked", 1);
        progress.updateSubstep("generate_ngrams", "chunked", 2);
        assertEquals(1, progress.getWarningCount());

        clock.advance(Duration.ofSeconds(31));
        progress.updateSubstep("generate_ngrams", "chunked", 3);
        assertEquals(2, progress.getWarningCount());

        assertEquals(List.of(1L, 2L, 3L), forwarded);
        assertTrue(gcRuns.get() >= 3);
    }

    @Test
    @DisplayName("低压时不告警也不回收，汇总记录峰值")
    void testMemorySummary() {
        FakeMemoryProbe probe = new FakeMemoryProbe(100_000L, SYSTEM);
        AtomicInteger gcRuns = new AtomicInteger();
        MemoryMonitor monitor = new MemoryMonitor(probe, new MemoryBudget(BUDGET, SYSTEM), 0.70, 0.80, 0.90, 10,
            gcRuns::incrementAndGet, Clock.systemUTC());
        MemoryAwareProgress progress = new MemoryAwareProgress(ProgressReporter.NOOP, monitor);

        progress.updateStep("load", 1);
        probe.setResidentBytes(300_000L);
        progress.updateStep("load", 2);
        probe.setResidentBytes(200_000L);
        MemorySummary summary = progress.logMemorySummary();

        assertEquals(0, progress.getWarningCount());
        assertEquals(0, gcRuns.get());
        assertEquals(300_000L, summary.peakResidentBytes());
        assertEquals(BUDGET, summary.budgetBytes());
        assertEquals(PressureTier.LOW, summary.finalTier());
        assertEquals(3, summary.sampleCount());
    }

    @Test
    void testConsoleReporterOutput() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ConsoleProgressReporter reporter = new ConsoleProgressReporter(
            new PrintStream(buffer, true, StandardCharsets.UTF_8));

        reporter.addStep("generate_ngrams", "生成 n-gram", 10);
        reporter.startStep("generate_ngrams");
        reporter.addSubstep("generate_ngrams", "chunked", "分块生成", 4);
        reporter.updateSubstep("generate_ngrams", "chunked", 2);
        reporter.failSubstep("generate_ngrams", "chunked", "oom");
        reporter.completeStep("generate_ngrams");

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("生成 n-gram"));
        assertTrue(output.contains("分块生成: 2/4"));
        assertTrue(output.contains("oom"));
    }
}
