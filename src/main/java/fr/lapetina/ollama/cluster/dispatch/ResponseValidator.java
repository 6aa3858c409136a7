package fr.lapetina.ollama.cluster.dispatch;

/**
 * Checks the content of a successful reply before the dispatcher accepts it.
 * A rejected reply is charged to the server and retried elsewhere.
 */
@FunctionalInterface
public interface ResponseValidator {

    ResponseValidator ACCEPT_ALL = content -> { };

    void validate(String content) throws MalformedOutputException;
}
