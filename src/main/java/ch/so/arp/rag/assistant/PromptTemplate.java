package ch.so.arp.rag.assistant;

import java.util.Objects;

/**
 * Question-with-context template with {@code {context}} and {@code {query}}
 * placeholders. Substitution happens in one pass, placeholder text inside the
 * substituted values is left as is.
 */
final class PromptTemplate {

    static final String CONTEXT_PLACEHOLDER = "{context}";
    static final String QUERY_PLACEHOLDER = "{query}";

    private final String template;

    PromptTemplate(String template) {
        this.template = Objects.requireNonNull(template, "template");
    }

    String render(String context, String query) {
        StringBuilder builder = new StringBuilder(template.length() + context.length() + query.length());
        int position = 0;
        while (position < template.length()) {
            if (template.startsWith(CONTEXT_PLACEHOLDER, position)) {
                builder.append(context);
                position += CONTEXT_PLACEHOLDER.length();
            } else if (template.startsWith(QUERY_PLACEHOLDER, position)) {
                builder.append(query);
                position += QUERY_PLACEHOLDER.length();
            } else {
                builder.append(template.charAt(position));
                position++;
            }
        }
        return builder.toString();
    }
}
