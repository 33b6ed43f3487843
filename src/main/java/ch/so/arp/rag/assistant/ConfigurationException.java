package ch.so.arp.rag.assistant;

/**
 * Required credentials or identifiers are missing. Raised while the
 * application context starts, there is no degraded mode for it.
 */
public class ConfigurationException extends RagException {

    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }
}
