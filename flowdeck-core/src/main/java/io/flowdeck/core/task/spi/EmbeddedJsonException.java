package io.flowdeck.core.task.spi;

import java.io.Serial;

/// Raised by a {@link StructuralFieldParser} when string-encoded task JSON cannot be decoded.
public class EmbeddedJsonException extends Exception {
    @Serial private static final long serialVersionUID = 3190475218840264511L;

    public EmbeddedJsonException(String message) {
        super(message);
    }

    public EmbeddedJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
