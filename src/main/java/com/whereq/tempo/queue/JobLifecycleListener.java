package com.whereq.tempo.queue;

import com.whereq.tempo.model.Job;

/**
 * Callback for jobs leaving the in-flight set.
 * Invoked after the store lock is released.
 */
public interface JobLifecycleListener {

    /**
     * Called once when a job reaches COMPLETED, FAILED or CANCELLED
     *
     * @param job the job in its terminal state
     */
    void onJobFinished(Job job);
}
