package com.example.opentelemetry.pipeline.hostmetrics;

import com.example.opentelemetry.pipeline.model.MetricDescriptor;
import oshi.hardware.CentralProcessor;

import java.util.Locale;
import java.util.Map;

/**
 * {@code system.cpu.time} per logical processor and state, {@code system.cpu.utilization} per logical processor
 * and for the whole host, {@code system.cpu.logical.count}.
 * <p>
 * Utilization is computed from the tick deltas since the previous scrape, so the first scrape reports none.
 */
class CpuScraper implements HostMetricsScraper {

    static final MetricDescriptor CPU_TIME =
            MetricDescriptor.cumulativeSum("system.cpu.time", "s", "Seconds each logical CPU spent on each mode.", true);
    static final MetricDescriptor CPU_UTILIZATION =
            MetricDescriptor.gauge("system.cpu.utilization", "1", "Difference in system.cpu.time since the last measurement, divided by the elapsed time.");
    static final MetricDescriptor CPU_LOGICAL_COUNT =
            MetricDescriptor.cumulativeSum("system.cpu.logical.count", "{cpu}", "Number of available logical CPUs.", false);

    private static final double MILLIS_PER_SECOND = 1000.0;

    private final CentralProcessor processor;
    private long[][] previousProcessorTicks;
    private long[] previousSystemTicks;

    CpuScraper(CentralProcessor processor) {
        this.processor = processor;
    }

    @Override
    public String name() {
        return "cpu";
    }

    @Override
    public void scrape(MetricPoints points) {
        long[][] processorTicks = processor.getProcessorCpuLoadTicks();
        for (int cpu = 0; cpu < processorTicks.length; cpu++) {
            for (CentralProcessor.TickType tickType : CentralProcessor.TickType.values()) {
                int index = tickType.getIndex();
                if (index < processorTicks[cpu].length) {
                    points.sum(CPU_TIME, processorTicks[cpu][index] / MILLIS_PER_SECOND,
                            Map.of("cpu", "cpu" + cpu, "state", state(tickType)));
                }
            }
        }

        if (previousProcessorTicks != null && previousProcessorTicks.length == processorTicks.length) {
            double[] loads = processor.getProcessorCpuLoadBetweenTicks(previousProcessorTicks);
            for (int cpu = 0; cpu < loads.length; cpu++) {
                points.gauge(CPU_UTILIZATION, clamp(loads[cpu]), Map.of("cpu", "cpu" + cpu));
            }
        }
        if (previousSystemTicks != null) {
            points.gauge(CPU_UTILIZATION, clamp(processor.getSystemCpuLoadBetweenTicks(previousSystemTicks)), Map.of());
        }
        previousProcessorTicks = processorTicks;
        previousSystemTicks = processor.getSystemCpuLoadTicks();

        points.sum(CPU_LOGICAL_COUNT, (long) processor.getLogicalProcessorCount(), Map.of());
    }

    private static String state(CentralProcessor.TickType tickType) {
        return switch (tickType) {
            case IOWAIT -> "wait";
            case IRQ -> "interrupt";
            default -> tickType.name().toLowerCase(Locale.ROOT);
        };
    }

    private static double clamp(double utilization) {
        if (Double.isNaN(utilization) || utilization < 0) {
            return 0.0;
        }
        return Math.min(1.0, utilization);
    }
}
