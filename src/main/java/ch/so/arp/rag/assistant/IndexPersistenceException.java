package ch.so.arp.rag.assistant;

/**
 * Writing the index artifacts to durable storage failed.
 */
public class IndexPersistenceException extends RagException {

    public IndexPersistenceException(String message, Throwable cause) {
        super(ErrorKind.INDEX_PERSISTENCE, message, cause);
    }
}
