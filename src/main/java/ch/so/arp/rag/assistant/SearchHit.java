package ch.so.arp.rag.assistant;

/**
 * Result element returned by the vector index.
 *
 * @param position insertion position of the record inside the index
 * @param text     stored document text
 * @param source   source label of the document
 * @param distance distance to the query vector, lower is better
 */
public record SearchHit(int position, String text, String source, double distance) {

    /**
     * Formats the hit for the context block of a prompt, optionally keeping the
     * source label next to the text so that the model can refer to it.
     */
    public String formatForPrompt(boolean includeSource) {
        if (includeSource && source != null && !source.isBlank()) {
            return "Source: " + source + "\n" + text;
        }
        return text;
    }
}
