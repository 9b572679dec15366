package com.whereq.tempo.admission;

import com.whereq.tempo.config.TempoProperties;
import com.whereq.tempo.queue.JobStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Randomized admission delay that staggers bursts of submissions.
 * The delay is spent before the job is inserted, so it never holds an execution slot.
 */
@Component
public class JitterController {

    private static final long BASE_DELAY_PER_ITEM_MS = 50;

    private static final long MAX_EXTRA_DELAY_MS = 5_000;

    private final TempoProperties.JitterConfig config;

    private final JobStore jobStore;

    private final Random random;

    @Autowired
    public JitterController(TempoProperties properties, JobStore jobStore) {
        this(properties, jobStore, null);
    }

    JitterController(TempoProperties properties, JobStore jobStore, Random random) {
        this.config = properties.getJitter();
        this.jobStore = jobStore;
        this.random = random;
    }

    /**
     * Delay to apply before the next insert
     *
     * @return milliseconds, 0 when jitter is disabled
     */
    public long computeDelay() {
        if (!config.isEnabled()) {
            return 0;
        }
        return uniformJitter() + queueDepthDelay(jobStore.queueLength());
    }

    /**
     * Extra delay growing with queue depth; logarithmic so deep queues stay bounded
     */
    static long queueDepthDelay(int queueLength) {
        if (queueLength <= 0) {
            return 0;
        }
        double log2 = Math.log(queueLength + 1) / Math.log(2);
        double scaled = log2 * BASE_DELAY_PER_ITEM_MS * queueLength / 10.0;
        return (long) Math.min(scaled, MAX_EXTRA_DELAY_MS);
    }

    private long uniformJitter() {
        long max = config.getMaxJitterMs();
        if (max <= 0) {
            return 0;
        }
        Random source = random != null ? random : ThreadLocalRandom.current();
        return (long) (source.nextDouble() * (max + 1));
    }
}
