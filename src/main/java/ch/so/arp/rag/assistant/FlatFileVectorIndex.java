package ch.so.arp.rag.assistant;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Exact nearest-neighbour index that keeps all vectors in memory and persists
 * them to two files:
 * <ul>
 * <li>a binary vector store ({@code RVEC} header followed by the raw floats)</li>
 * <li>a JSON sidecar listing text and source of every vector, in vector order</li>
 * </ul>
 * Both files carry the same generation token. A pair with different tokens was
 * not written by the same {@link #save()} and is rejected by {@link #load()}.
 * <p>
 * Each file is written to a temporary sibling and moved into place. The two
 * moves are not atomic as a pair: a reader loading between them sees a
 * generation mismatch and reports "not loaded".
 * <p>
 * The records live in an immutable snapshot that is swapped on every mutation,
 * so searches never observe a half-applied append. Mutations are serialized.
 */
public class FlatFileVectorIndex implements VectorIndex {

    private static final Logger LOGGER = LoggerFactory.getLogger(FlatFileVectorIndex.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final int MAGIC = 0x52564543;

    static final int FORMAT_VERSION = 1;

    private final Path vectorFile;
    private final Path metadataFile;
    private final SimilarityMetric metric;

    private volatile Snapshot snapshot;
    private volatile boolean loaded;

    public FlatFileVectorIndex(Path vectorFile, Path metadataFile, SimilarityMetric metric) {
        this.vectorFile = Objects.requireNonNull(vectorFile, "vectorFile");
        this.metadataFile = Objects.requireNonNull(metadataFile, "metadataFile");
        this.metric = Objects.requireNonNull(metric, "metric");
    }

    public FlatFileVectorIndex(RagProperties.Index properties) {
        this(properties.vectorFile(), properties.metadataFile(), properties.metric());
    }

    @Override
    public synchronized void create(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Vector dimension must be > 0");
        }
        snapshot = Snapshot.empty(dimension);
        loaded = false;
        LOGGER.info("Created empty index with dimension {} ({})", dimension, metric);
    }

    @Override
    public synchronized void add(List<String> texts, List<float[]> vectors, List<String> sources) {
        Objects.requireNonNull(texts, "texts");
        Objects.requireNonNull(vectors, "vectors");
        Objects.requireNonNull(sources, "sources");
        Snapshot current = snapshot;
        if (current == null) {
            throw new IllegalStateException("Index has not been created or loaded");
        }
        if (texts.size() != vectors.size() || texts.size() != sources.size()) {
            throw new LengthMismatchException("texts, vectors and sources must have the same size (texts="
                    + texts.size() + ", vectors=" + vectors.size() + ", sources=" + sources.size() + ")");
        }
        for (float[] vector : vectors) {
            int actual = vector == null ? 0 : vector.length;
            if (actual != current.dimension()) {
                throw new DimensionMismatchException(current.dimension(), actual);
            }
        }

        snapshot = current.append(texts, vectors, sources);
        LOGGER.debug("Appended {} records, index now holds {}", texts.size(), snapshot.size());
    }

    @Override
    public List<SearchHit> search(float[] queryVector, int k) {
        Objects.requireNonNull(queryVector, "queryVector");
        Snapshot current = snapshot;
        if (current == null || current.size() == 0 || k <= 0) {
            return List.of();
        }
        if (queryVector.length != current.dimension()) {
            throw new DimensionMismatchException(current.dimension(), queryVector.length);
        }

        List<SearchHit> hits = new ArrayList<>(current.size());
        for (int i = 0; i < current.size(); i++) {
            hits.add(new SearchHit(i, current.texts().get(i), current.sources().get(i),
                    metric.distance(queryVector, current.vectors().get(i))));
        }
        hits.sort(Comparator.comparingDouble(SearchHit::distance).thenComparingInt(SearchHit::position));
        return List.copyOf(hits.subList(0, Math.min(k, hits.size())));
    }

    @Override
    public synchronized void save() {
        Snapshot current = snapshot;
        if (current == null) {
            throw new IllegalStateException("Nothing to save, the index has not been created");
        }
        String generation = UUID.randomUUID().toString();
        Path vectorTemp = null;
        Path metadataTemp = null;
        try {
            byte[] metadata = MAPPER.writerWithDefaultPrettyPrinter()
                    .writeValueAsBytes(IndexMetadata.of(generation, metric, current.dimension(), current.texts(),
                            current.sources()));
            vectorTemp = writeTemporary(vectorFile, out -> writeVectors(out, current, generation, metric.name()));
            metadataTemp = writeTemporary(metadataFile, out -> out.write(metadata));

            moveIntoPlace(vectorTemp, vectorFile);
            vectorTemp = null;
            moveIntoPlace(metadataTemp, metadataFile);
            metadataTemp = null;
        } catch (IOException ex) {
            throw new IndexPersistenceException("Failed to save index to " + vectorFile + " / " + metadataFile, ex);
        } finally {
            deleteQuietly(vectorTemp);
            deleteQuietly(metadataTemp);
        }
        loaded = true;
        LOGGER.info("Saved index with {} records to {} and {}", current.size(), vectorFile, metadataFile);
    }

    /**
     * {@inheritDoc}
     * <p>
     * The in-memory index is replaced by the persisted one. When no valid pair of
     * artifacts exists the in-memory index is discarded as well.
     */
    @Override
    public synchronized boolean load() {
        loaded = false;
        if (!Files.isRegularFile(vectorFile) || !Files.isRegularFile(metadataFile)) {
            LOGGER.info("No persisted index found at {} / {}", vectorFile, metadataFile);
            snapshot = null;
            return false;
        }
        try {
            VectorFile vectors = readVectors(vectorFile);
            IndexMetadata metadata = MAPPER.readValue(metadataFile.toFile(), IndexMetadata.class);
            String problem = findInconsistency(vectors, metadata);
            if (problem != null) {
                LOGGER.warn("Ignoring persisted index: {}", problem);
                snapshot = null;
                return false;
            }

            List<String> texts = new ArrayList<>(metadata.records().size());
            List<String> sources = new ArrayList<>(metadata.records().size());
            for (IndexMetadata.Entry entry : metadata.records()) {
                texts.add(entry.text());
                sources.add(entry.source());
            }
            snapshot = Snapshot.empty(vectors.dimension()).append(texts, vectors.vectors(), sources);
            loaded = true;
            LOGGER.info("Loaded index with {} records (dimension {})", snapshot.size(), snapshot.dimension());
            return true;
        } catch (IOException ex) {
            LOGGER.warn("Unable to read persisted index from {} / {}", vectorFile, metadataFile, ex);
            snapshot = null;
            return false;
        }
    }

    @Override
    public IndexStats stats() {
        Snapshot current = snapshot;
        if (current == null) {
            return new IndexStats(0, 0, false);
        }
        return new IndexStats(current.size(), current.dimension(), loaded);
    }

    private String findInconsistency(VectorFile vectors, IndexMetadata metadata) {
        if (metadata.version() != FORMAT_VERSION) {
            return "unsupported metadata version " + metadata.version();
        }
        if (!Objects.equals(vectors.generation(), metadata.generation())) {
            return "vector store and metadata belong to different saves";
        }
        if (metadata.records() == null || metadata.records().size() != vectors.vectors().size()) {
            return "vector count does not match metadata count";
        }
        if (metadata.records().contains(null)) {
            return "metadata contains empty records";
        }
        if (metadata.dimension() != vectors.dimension()) {
            return "dimension differs between vector store and metadata";
        }
        if (!metric.name().equals(vectors.metric()) || !metric.name().equals(metadata.metric())) {
            return "index was built with metric " + vectors.metric() + " but " + metric + " is configured";
        }
        return null;
    }

    private static void writeVectors(OutputStream target, Snapshot current, String generation,
            String metricName) throws IOException {
        DataOutputStream out = new DataOutputStream(target);
        out.writeInt(MAGIC);
        out.writeInt(FORMAT_VERSION);
        out.writeUTF(generation);
        out.writeUTF(metricName);
        out.writeInt(current.dimension());
        out.writeInt(current.size());
        for (float[] vector : current.vectors()) {
            for (float value : vector) {
                out.writeFloat(value);
            }
        }
        out.flush();
    }

    private VectorFile readVectors(Path path) throws IOException {
        try (InputStream raw = Files.newInputStream(path);
                DataInputStream in = new DataInputStream(new BufferedInputStream(raw))) {
            if (in.readInt() != MAGIC) {
                throw new IOException("Not a vector store file: " + path);
            }
            int version = in.readInt();
            if (version != FORMAT_VERSION) {
                throw new IOException("Unsupported vector store version " + version);
            }
            String generation = in.readUTF();
            String metricName = in.readUTF();
            int dimension = in.readInt();
            int count = in.readInt();
            if (dimension <= 0 || count < 0) {
                throw new IOException("Corrupt vector store header (dimension=" + dimension + ", count=" + count + ")");
            }
            long headerBytes = 4L * Integer.BYTES + modifiedUtf8Length(generation) + modifiedUtf8Length(metricName);
            long expectedBytes = headerBytes + (long) count * dimension * Float.BYTES;
            long actualBytes = Files.size(path);
            if (actualBytes != expectedBytes) {
                throw new IOException("Vector store " + path + " has " + actualBytes + " bytes, header announces "
                        + expectedBytes + " (dimension=" + dimension + ", count=" + count + ")");
            }
            List<float[]> vectors = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                float[] vector = new float[dimension];
                for (int j = 0; j < dimension; j++) {
                    vector[j] = in.readFloat();
                }
                vectors.add(vector);
            }
            return new VectorFile(generation, metricName, dimension, vectors);
        }
    }

    private static long modifiedUtf8Length(String value) {
        long length = 2L;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c >= 0x0001 && c <= 0x007F) {
                length += 1;
            } else if (c > 0x07FF) {
                length += 3;
            } else {
                length += 2;
            }
        }
        return length;
    }

    private Path writeTemporary(Path target, IoWriter writer) throws IOException {
        Path directory = target.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, target.getFileName().toString() + ".", ".tmp");
        try (FileOutputStream file = new FileOutputStream(temp.toFile());
                BufferedOutputStream out = new BufferedOutputStream(file)) {
            writer.write(out);
            out.flush();
            file.getFD().sync();
        } catch (IOException ex) {
            deleteQuietly(temp);
            throw ex;
        }
        return temp;
    }

    private void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            LOGGER.warn("Atomic move not supported for {}, falling back to a replacing move", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            LOGGER.warn("Unable to delete temporary file {}", path, ex);
        }
    }

    @FunctionalInterface
    private interface IoWriter {
        void write(OutputStream out) throws IOException;
    }

    private record VectorFile(String generation, String metric, int dimension, List<float[]> vectors) {
    }

    private record Snapshot(int dimension, List<String> texts, List<float[]> vectors, List<String> sources) {

        static Snapshot empty(int dimension) {
            return new Snapshot(dimension, List.of(), List.of(), List.of());
        }

        int size() {
            return texts.size();
        }

        Snapshot append(List<String> newTexts, List<float[]> newVectors, List<String> newSources) {
            List<String> texts = new ArrayList<>(this.texts);
            List<float[]> vectors = new ArrayList<>(this.vectors);
            List<String> sources = new ArrayList<>(this.sources);
            for (int i = 0; i < newTexts.size(); i++) {
                texts.add(Objects.toString(newTexts.get(i), ""));
                vectors.add(newVectors.get(i).clone());
                sources.add(Objects.toString(newSources.get(i), ""));
            }
            return new Snapshot(dimension, List.copyOf(texts), List.copyOf(vectors), List.copyOf(sources));
        }
    }
}
