package io.kairon.core.exception;

import java.io.Serial;

/// Thrown when a fixed workflow document cannot be written back to disk.
public class WorkflowWriteException extends Exception {

    @Serial private static final long serialVersionUID = 7723590148336457012L;

    public WorkflowWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
