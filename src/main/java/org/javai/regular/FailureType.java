package org.javai.regular;

/**
 * Classifies engine failures by where they came from.
 */
public enum FailureType {
    /**
     * The schedule description could not be accepted.
     * Examples: malformed "HH:MM" value, hour out of range, unreadable config file.
     */
    CONFIGURATION,

    /**
     * The task reported an error. Retried after the failure delay unless that delay is negative.
     */
    TASK,

    /**
     * The task threw an unchecked exception. Same retry policy as {@link #TASK}, but usually
     * points at a bug in the task body.
     */
    DEFECT,

    /**
     * The execution context was cancelled: window end, shutdown or thread interruption.
     * A normal stop condition, not an application error.
     */
    CANCELLED
}
