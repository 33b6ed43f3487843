package ch.so.arp.rag.assistant;

/**
 * Parallel input lists (texts, vectors, sources) differ in size.
 */
public class LengthMismatchException extends RagException {

    public LengthMismatchException(String message) {
        super(ErrorKind.LENGTH_MISMATCH, message);
    }
}
