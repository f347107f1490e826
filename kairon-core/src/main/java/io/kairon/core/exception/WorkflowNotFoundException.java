package io.kairon.core.exception;

import java.io.Serial;

/// Thrown when a workflow document file does not exist or is not a regular file.
public class WorkflowNotFoundException extends Exception {

    @Serial private static final long serialVersionUID = -2675313988207532104L;

    public WorkflowNotFoundException(String message) {
        super(message);
    }
}
