package ch.so.arp.rag.assistant;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * JSON sidecar of the vector store. Entry {@code i} describes vector {@code i}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record IndexMetadata(int version, String generation, int dimension, String metric, List<Entry> records) {

    static IndexMetadata of(String generation, SimilarityMetric metric, int dimension, List<String> texts,
            List<String> sources) {
        List<Entry> entries = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            entries.add(new Entry(texts.get(i), sources.get(i)));
        }
        return new IndexMetadata(FlatFileVectorIndex.FORMAT_VERSION, generation, dimension, metric.name(), entries);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Entry(String text, String source) {
    }
}
