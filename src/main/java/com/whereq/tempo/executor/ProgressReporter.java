package com.whereq.tempo.executor;

/**
 * Callback a running processor uses to publish progress
 */
@FunctionalInterface
public interface ProgressReporter {

    /**
     * Report progress; values are clamped to [0, 100]
     *
     * @param percent completion percentage
     */
    void report(int percent);
}
