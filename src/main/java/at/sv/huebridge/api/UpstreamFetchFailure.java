package at.sv.huebridge.api;

/**
 * Signals that a collaborator call used to populate the mirror (configuration, rules, resource graph) was rejected.
 * Not retried where it is raised; the connection controller catches it and restarts the connection attempt.
 */
public final class UpstreamFetchFailure extends RuntimeException {
    public UpstreamFetchFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
