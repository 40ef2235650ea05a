package io.tessera.core.agent;

import java.io.Serial;

/// Thrown when a raw agent payload cannot be normalized into an
/// {@link AgentResponse}.
public class ResponseParseException extends RuntimeException {

    @Serial private static final long serialVersionUID = 3356790122051476613L;

    public ResponseParseException(String message) {
        super(message);
    }

    public ResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
