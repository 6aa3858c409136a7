package fr.lapetina.ollama.cluster.domain.model;

/**
 * Failure taxonomy for probes and dispatched requests.
 * Callers branch on the kind instead of catching exceptions.
 */
public enum FailureKind {
    /** Host did not answer the reachability check; no HTTP exchange attempted */
    UNREACHABLE,

    /** Server answered with a non-success status or the connection failed */
    PROTOCOL_FAILURE,

    /** Server did not answer within its configured timeout */
    TIMEOUT,

    /** Reply received but its payload does not match the expected schema */
    MALFORMED_OUTPUT,

    /** No active server exists */
    OUTAGE,

    /** Unexpected local error */
    INTERNAL_ERROR;

    /**
     * Whether this failure is charged to the server that produced it.
     */
    public boolean isServerFault() {
        return this != OUTAGE && this != INTERNAL_ERROR;
    }
}
