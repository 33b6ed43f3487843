package ch.so.arp.rag.assistant;

/**
 * Classification of the failures the assistant can report. Callers branch on
 * the kind instead of parsing user-facing messages.
 */
public enum ErrorKind {

    CONFIGURATION,

    INDEX_NOT_LOADED,

    DIMENSION_MISMATCH,

    LENGTH_MISMATCH,

    UPSTREAM_CALL_FAILURE,

    MALFORMED_UPSTREAM_RESPONSE,

    INDEX_PERSISTENCE,

    INTERNAL
}
