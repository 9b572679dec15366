package com.whereq.tempo.metrics;

import com.whereq.tempo.config.TempoProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rolling window of recent job runtimes, used for wait estimates and the metrics snapshot
 */
@Component
public class RuntimeStatistics {

    private final int sampleSize;

    private final long defaultEstimateMs;

    private final Deque<Long> samples = new ArrayDeque<>();

    private long windowTotalMs;

    public RuntimeStatistics(TempoProperties properties) {
        this.sampleSize = Math.max(1, properties.getQueue().getRuntimeSampleSize());
        this.defaultEstimateMs = properties.getQueue().getDefaultRuntimeEstimateMs();
    }

    /**
     * Record the runtime of a finished job
     */
    public synchronized void record(long runtimeMs) {
        long sample = Math.max(0, runtimeMs);
        samples.addLast(sample);
        windowTotalMs += sample;
        if (samples.size() > sampleSize) {
            windowTotalMs -= samples.removeFirst();
        }
    }

    /**
     * Average of the recorded window, 0 when nothing has finished yet
     */
    public synchronized long averageMs() {
        return samples.isEmpty() ? 0 : windowTotalMs / samples.size();
    }

    /**
     * Average used for estimates: falls back to the configured default until a job finishes
     */
    public synchronized long estimateMs() {
        return samples.isEmpty() ? defaultEstimateMs : windowTotalMs / samples.size();
    }
}
