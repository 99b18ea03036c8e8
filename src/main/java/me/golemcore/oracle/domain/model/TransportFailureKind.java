package me.golemcore.oracle.domain.model;

/**
 * Classification of failures talking to the completion service.
 */
public enum TransportFailureKind {
    TIMEOUT(OracleStatus.TIMEOUT),
    CONNECTION_FAILURE(OracleStatus.CONNECTION_FAILURE),
    RATE_LIMIT(OracleStatus.RATE_LIMIT),
    CONTEXT_LENGTH_EXCEEDED(OracleStatus.CONTEXT_LENGTH_EXCEEDED),
    GENERIC_FAILURE(OracleStatus.FAILURE);

    private final OracleStatus status;

    TransportFailureKind(OracleStatus status) {
        this.status = status;
    }

    public OracleStatus toStatus() {
        return status;
    }
}
