package ch.so.arp.rag.assistant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs once on application startup and reports whether the embedding service
 * can be reached. A failed check is logged, it does not stop the application.
 */
@Component
@ConditionalOnProperty(name = "rag.check-connection", havingValue = "true", matchIfMissing = true)
public class ConnectionCheckRunner implements CommandLineRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionCheckRunner.class);

    private final RagPipeline pipeline;

    public ConnectionCheckRunner(RagPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    public void run(String... args) {
        LOGGER.info("Checking connection to the embedding service...");
        if (!pipeline.checkConnection()) {
            LOGGER.warn("Embedding service not reachable at startup, queries and indexing will fail until it is");
        }
    }
}
