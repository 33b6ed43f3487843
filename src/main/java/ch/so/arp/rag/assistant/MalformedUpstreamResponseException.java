package ch.so.arp.rag.assistant;

/**
 * The remote service answered with a body the client does not understand.
 */
public class MalformedUpstreamResponseException extends UpstreamCallException {

    public MalformedUpstreamResponseException(String message) {
        super(ErrorKind.MALFORMED_UPSTREAM_RESPONSE, message);
    }
}
