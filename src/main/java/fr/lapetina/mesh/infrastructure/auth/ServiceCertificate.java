package fr.lapetina.mesh.infrastructure.auth;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.time.Instant;

/**
 * Short-lived credential bound to one service identity.
 * Never extended: a new certificate (with a new id) replaces it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServiceCertificate(
        String certificateId,
        String serviceId,
        String serviceName,
        String credential,
        Instant issuedAt,
        Instant expiresAt
) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean expiresWithin(Duration window, Instant now) {
        return !now.plus(window).isBefore(expiresAt);
    }

    /**
     * Same certificate without its credential, for listings.
     */
    public ServiceCertificate redacted() {
        return new ServiceCertificate(certificateId, serviceId, serviceName, null, issuedAt, expiresAt);
    }
}
