package com.sgr.runtime.executor;

/**
 * Thrown inside a task once its deadline fired or it was cancelled.
 */
public class TaskCancelledException extends RuntimeException {

    public TaskCancelledException(String message) {
        super(message);
    }
}
