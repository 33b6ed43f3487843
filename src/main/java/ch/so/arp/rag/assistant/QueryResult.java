package ch.so.arp.rag.assistant;

import java.util.List;

/**
 * Outcome of a knowledge-base query. A result is always produced; failures are
 * reported through an answer starting with {@link #ERROR_MARKER} and a non-null
 * {@link #errorKind()}.
 *
 * @param answer     generated answer or user-facing failure message
 * @param context    context block sent to the model, empty on failure
 * @param sources    distinct source labels in relevance order, empty on failure
 * @param model      name of the completion model
 * @param cleanQuery the query as it was processed
 * @param errorKind  failure classification, {@code null} on success
 */
public record QueryResult(
        String answer,
        String context,
        List<String> sources,
        String model,
        String cleanQuery,
        ErrorKind errorKind) {

    public static final String ERROR_MARKER = "❌";

    static final String NOT_LOADED_MESSAGE = ERROR_MARKER
            + " The knowledge base is not loaded. Run the indexing (/ingest) to index the documents.";

    static final String FAILURE_PREFIX = ERROR_MARKER + " An error occurred while processing the request: ";

    public QueryResult {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public static QueryResult answered(String answer, String context, List<String> sources, String model,
            String query) {
        return new QueryResult(answer, context, sources, model, query, null);
    }

    public static QueryResult notLoaded(String model, String query) {
        return new QueryResult(NOT_LOADED_MESSAGE, "", List.of(), model, query, ErrorKind.INDEX_NOT_LOADED);
    }

    public static QueryResult failed(ErrorKind kind, String detail, String model, String query) {
        return new QueryResult(FAILURE_PREFIX + detail, "", List.of(), model, query, kind);
    }

    public boolean failed() {
        return errorKind != null;
    }
}
