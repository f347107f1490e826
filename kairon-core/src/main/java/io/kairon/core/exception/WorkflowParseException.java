package io.kairon.core.exception;

import java.io.Serial;

/// Thrown when a workflow document cannot be parsed.
///
/// Covers invalid JSON syntax as well as documents whose top-level shape cannot be
/// interpreted at all (non-object root, `nodes` that is not an array, nodes without a
/// name). Analysis of the affected document stops; sibling documents are unaffected.
///
/// @see WorkflowNotFoundException
public class WorkflowParseException extends Exception {

    @Serial private static final long serialVersionUID = 3180456472907193615L;

    /// Creates an exception with the specified detail message.
    ///
    /// @param message description of the parse failure, not null
    public WorkflowParseException(String message) {
        super(message);
    }

    /// Creates an exception with the specified detail message and cause.
    ///
    /// @param message description of the parse failure, not null
    /// @param cause the underlying parser exception, may be null
    public WorkflowParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
