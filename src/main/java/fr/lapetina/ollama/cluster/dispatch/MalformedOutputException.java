package fr.lapetina.ollama.cluster.dispatch;

/**
 * Thrown when a reply's content does not match the expected schema.
 */
public class MalformedOutputException extends Exception {

    public MalformedOutputException(String message) {
        super(message);
    }

    public MalformedOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
