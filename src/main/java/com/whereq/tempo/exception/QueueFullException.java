package com.whereq.tempo.exception;

import lombok.Getter;

/**
 * Exception thrown when the job queue is at capacity.
 * Reflects system load rather than caller misbehaviour.
 */
@Getter
public class QueueFullException extends RuntimeException {

    private final int queueLength;

    public QueueFullException(int queueLength, int maxQueueSize) {
        super("Queue is full (" + queueLength + "/" + maxQueueSize + "). Please try again later.");
        this.queueLength = queueLength;
    }
}
