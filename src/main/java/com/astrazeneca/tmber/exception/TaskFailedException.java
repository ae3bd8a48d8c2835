package com.astrazeneca.tmber.exception;


/**
 * Wraps a checked exception thrown by a worker task so it can abort the whole computation.
 */
public class TaskFailedException extends RuntimeException {

    public TaskFailedException(String task, Throwable cause) {
        super("Task " + task + " failed: " + cause.getMessage(), cause);
    }
}
