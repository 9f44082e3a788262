package io.palletchain.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public class BlockMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter blocksExecuted = registry.counter("runtime.blocks.executed");
    private static final Counter extrinsicsOk = Counter.builder("runtime.extrinsics")
            .tag("result", "ok")
            .description("Extrinsics dispatched successfully")
            .register(registry);
    private static final Counter extrinsicsFailed = Counter.builder("runtime.extrinsics")
            .tag("result", "failed")
            .description("Extrinsics that failed and were skipped")
            .register(registry);
    private static final Timer executionTime = registry.timer("runtime.block.execution.time");

    public static <T> T recordExecution(Supplier<T> blockExecutionLogic) {
        return executionTime.record(blockExecutionLogic);
    }

    public static void incrementBlocks() {
        blocksExecuted.increment();
    }

    public static void recordExtrinsic(boolean ok) {
        if (ok) {
            extrinsicsOk.increment();
        } else {
            extrinsicsFailed.increment();
        }
    }

    public static double blocksExecuted() {
        return blocksExecuted.count();
    }

    public static double extrinsicsFailed() {
        return extrinsicsFailed.count();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                for (Tag tag : m.getId().getTags()) {
                    sb.append('{').append(tag.getKey()).append('=').append(tag.getValue()).append('}');
                }
                sb.append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
