package com.flow.core.scheduler;

/**
 * Signals a broken scheduler invariant (budget accounting, lost completions).
 * Fatal to the run; never caused by workflow input.
 */
public class InternalSchedulingException extends RuntimeException {
    public InternalSchedulingException(String message) {
        super(message);
    }

    public InternalSchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}
