package ch.so.arp.rag.assistant;

import java.util.Objects;

/**
 * Base type for all failures raised below the pipeline boundary.
 */
public class RagException extends RuntimeException {

    private final ErrorKind kind;

    public RagException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public RagException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }
}
