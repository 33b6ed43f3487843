package ch.so.arp.rag.assistant;

/**
 * A call to the embedding or completion service failed: network error,
 * timeout or an error status.
 */
public class UpstreamCallException extends RagException {

    public UpstreamCallException(String message, Throwable cause) {
        super(ErrorKind.UPSTREAM_CALL_FAILURE, message, cause);
    }

    protected UpstreamCallException(ErrorKind kind, String message) {
        super(kind, message);
    }
}
