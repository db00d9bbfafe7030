package fr.lapetina.mesh.domain.routing;

/**
 * Closed set of traffic rule kinds.
 */
public enum RuleKind {
    /** Matches a request header against a value */
    HEADER_MATCH,

    /** Matches when the routing key hashes into the first {@code percent} buckets */
    PERCENTAGE_BUCKET,

    /** Always matches */
    DEFAULT
}
