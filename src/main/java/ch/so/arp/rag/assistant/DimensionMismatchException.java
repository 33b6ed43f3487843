package ch.so.arp.rag.assistant;

/**
 * A vector does not have the dimension the index was created with.
 */
public class DimensionMismatchException extends RagException {

    public DimensionMismatchException(int expected, int actual) {
        super(ErrorKind.DIMENSION_MISMATCH,
                "Vector dimension mismatch. Expected=" + expected + ", actual=" + actual);
    }
}
