package fr.lapetina.mesh.infrastructure.auth;

import fr.lapetina.mesh.domain.exception.CertificateExpiredException;
import fr.lapetina.mesh.domain.exception.CertificateInvalidException;
import fr.lapetina.mesh.domain.exception.NotFoundException;
import fr.lapetina.mesh.domain.exception.UnauthorizedServiceException;
import fr.lapetina.mesh.domain.exception.ValidationException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues service certificates and enforces service-to-service ACLs.
 *
 * <p>Certificates are HMAC-SHA256 signed JWTs whose subject is the service id.
 * Only the latest certificate of a service id is trusted: rotating or
 * revoking makes every earlier token invalid.
 *
 * <p>Authorization is fail-closed. Without an ACL row for the
 * (source, target) pair, {@link #authorize} returns false.
 */
public final class ServiceAuthority implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServiceAuthority.class);

    static final String ISSUER = "mesh-authority";
    private static final String SERVICE_NAME_CLAIM = "serviceName";
    private static final int MIN_SECRET_BYTES = 32;

    private final SecretKey key;
    private final Duration certificateTtl;
    private final Duration rotationThreshold;
    private final Map<String, ServiceCertificate> certificates = new ConcurrentHashMap<>();
    private final Map<AclEntry.Key, AclEntry> acls = new ConcurrentHashMap<>();
    private final Set<String> rotationScheduled = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private ScheduledExecutorService rotationScheduler;

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong authenticatedRequests = new AtomicLong();
    private final AtomicLong failedAuth = new AtomicLong();
    private final AtomicLong deniedByAcl = new AtomicLong();
    private final AtomicLong expiredCertificates = new AtomicLong();
    private final AtomicLong certificateRotations = new AtomicLong();

    /**
     * @param signingSecret     HMAC secret of at least 32 bytes; a random key is generated when blank
     * @param certificateTtl    lifetime of every issued certificate
     * @param rotationThreshold certificates expiring within this window are due for rotation
     */
    public ServiceAuthority(String signingSecret, Duration certificateTtl, Duration rotationThreshold) {
        this.key = createKey(signingSecret);
        this.certificateTtl = certificateTtl;
        this.rotationThreshold = rotationThreshold;
    }

    private static SecretKey createKey(String secret) {
        byte[] bytes;
        if (secret == null || secret.isBlank()) {
            bytes = new byte[MIN_SECRET_BYTES];
            new SecureRandom().nextBytes(bytes);
            log.warn("No signing secret configured, certificates will not survive a restart");
        } else {
            bytes = secret.getBytes(StandardCharsets.UTF_8);
            if (bytes.length < MIN_SECRET_BYTES) {
                throw new IllegalArgumentException(
                        "Signing secret must be at least " + MIN_SECRET_BYTES + " bytes, got " + bytes.length);
            }
        }
        return new SecretKeySpec(bytes, "HmacSHA256");
    }

    /**
     * Issues a fresh certificate for {@code serviceId}, replacing any previous one.
     */
    public ServiceCertificate issueCertificate(String serviceId, String serviceName) {
        ValidationException.requireText(serviceId, "serviceId");
        ValidationException.requireText(serviceName, "serviceName");

        Instant issuedAt = Instant.now();
        Instant expiresAt = issuedAt.plus(certificateTtl);
        String certificateId = UUID.randomUUID().toString();

        String credential = Jwts.builder()
                .id(certificateId)
                .issuer(ISSUER)
                .subject(serviceId)
                .claim(SERVICE_NAME_CLAIM, serviceName)
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .signWith(key)
                .compact();

        ServiceCertificate certificate = new ServiceCertificate(
                certificateId, serviceId, serviceName, credential, issuedAt, expiresAt);
        certificates.put(serviceId, certificate);
        rotationScheduled.remove(serviceId);

        log.info("Certificate issued: serviceId={}, serviceName={}, certificateId={}, expiresAt={}",
                serviceId, serviceName, certificateId, expiresAt);
        return certificate;
    }

    /**
     * Verifies a credential and returns the certificate it belongs to.
     *
     * @throws CertificateExpiredException if the credential is past its expiry
     * @throws CertificateInvalidException if it is malformed, forged, revoked or superseded
     */
    public ServiceCertificate verifyCertificate(String credential) {
        if (credential == null || credential.isBlank()) {
            throw new CertificateInvalidException("Certificate is empty");
        }

        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .requireIssuer(ISSUER)
                    .build()
                    .parseSignedClaims(credential)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            expiredCertificates.incrementAndGet();
            log.warn("Expired certificate presented: serviceId={}", e.getClaims().getSubject());
            throw new CertificateExpiredException("Certificate expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Invalid certificate presented: error={}", e.getMessage());
            throw new CertificateInvalidException("Certificate is invalid", e);
        }

        ServiceCertificate current = certificates.get(claims.getSubject());
        if (current == null || !current.certificateId().equals(claims.getId())) {
            log.warn("Superseded or revoked certificate presented: serviceId={}, certificateId={}",
                    claims.getSubject(), claims.getId());
            throw new CertificateInvalidException("Certificate has been revoked or superseded");
        }
        if (current.isExpired(Instant.now())) {
            expiredCertificates.incrementAndGet();
            throw new CertificateExpiredException("Certificate expired", null);
        }
        return current;
    }

    /**
     * Reissues the certificate of a known service id.
     *
     * @throws NotFoundException if no certificate was ever issued for it
     */
    public ServiceCertificate rotateCertificate(String serviceId) {
        ServiceCertificate current = certificates.get(serviceId);
        if (current == null) {
            throw new NotFoundException("Certificate", serviceId);
        }
        ServiceCertificate rotated = issueCertificate(serviceId, current.serviceName());
        certificateRotations.incrementAndGet();
        log.info("Certificate rotated: serviceId={}, previousCertificateId={}, certificateId={}",
                serviceId, current.certificateId(), rotated.certificateId());
        return rotated;
    }

    public boolean revokeCertificate(String serviceId) {
        ServiceCertificate removed = certificates.remove(serviceId);
        rotationScheduled.remove(serviceId);
        if (removed != null) {
            log.info("Certificate revoked: serviceId={}, certificateId={}", serviceId, removed.certificateId());
        }
        return removed != null;
    }

    public Optional<ServiceCertificate> getCertificate(String serviceId) {
        return Optional.ofNullable(certificates.get(serviceId)).map(ServiceCertificate::redacted);
    }

    /**
     * All current certificates, credentials stripped.
     */
    public List<ServiceCertificate> getCertificates() {
        return certificates.values().stream()
                .map(ServiceCertificate::redacted)
                .sorted(Comparator.comparing(ServiceCertificate::serviceId))
                .toList();
    }

    /**
     * Inserts or replaces the ACL row of {@code (sourceService, targetService)}.
     * Takes effect for the next authorization.
     */
    public AclEntry addAcl(AclEntry entry) {
        AclEntry previous = acls.put(entry.key(), entry);
        log.info("ACL {}: source={}, target={}, allowed={}, permissions={}",
                previous == null ? "added" : "updated",
                entry.sourceService(), entry.targetService(), entry.allowed(), entry.permissions());
        return entry;
    }

    public boolean removeAcl(String sourceService, String targetService) {
        AclEntry removed = acls.remove(AclEntry.key(sourceService, targetService));
        if (removed != null) {
            log.info("ACL removed: source={}, target={}", sourceService, targetService);
        }
        return removed != null;
    }

    public List<AclEntry> getAcls() {
        return acls.values().stream()
                .sorted(Comparator.comparing(AclEntry::sourceService).thenComparing(AclEntry::targetService))
                .toList();
    }

    /**
     * Evaluates the ACL row for the pair. No row means deny.
     */
    public boolean authorize(String sourceService, String targetService, String permission) {
        AclEntry entry = acls.get(AclEntry.key(sourceService, targetService));
        boolean allowed = entry != null && entry.grants(permission);
        if (!allowed) {
            deniedByAcl.incrementAndGet();
            log.warn("Authorization denied: source={}, target={}, permission={}, aclPresent={}",
                    sourceService, targetService, permission, entry != null);
        } else {
            log.debug("Authorization granted: source={}, target={}, permission={}",
                    sourceService, targetService, permission);
        }
        return allowed;
    }

    /**
     * Verifies the caller's credential, then authorizes its service name against the target.
     *
     * @return The caller's certificate
     * @throws UnauthorizedServiceException on a missing, expired or invalid certificate (401)
     *         or an ACL denial (403)
     */
    public ServiceCertificate authenticate(String credential, String targetService, String permission) {
        totalRequests.incrementAndGet();
        if (credential == null || credential.isBlank()) {
            failedAuth.incrementAndGet();
            throw UnauthorizedServiceException.missingCertificate();
        }

        ServiceCertificate certificate;
        try {
            certificate = verifyCertificate(credential);
        } catch (UnauthorizedServiceException e) {
            failedAuth.incrementAndGet();
            throw e;
        }

        if (!authorize(certificate.serviceName(), targetService, permission)) {
            failedAuth.incrementAndGet();
            throw UnauthorizedServiceException.denied(certificate.serviceName(), targetService, permission);
        }
        authenticatedRequests.incrementAndGet();
        return certificate;
    }

    /**
     * Flags certificates expiring within the rotation threshold and, when
     * {@code autoRotate} is set, reissues them.
     *
     * @return Number of certificates found due for rotation
     */
    public int checkRotations(boolean autoRotate) {
        Instant now = Instant.now();
        int due = 0;
        for (ServiceCertificate certificate : List.copyOf(certificates.values())) {
            if (!certificate.expiresWithin(rotationThreshold, now)) {
                continue;
            }
            due++;
            if (autoRotate) {
                rotateCertificate(certificate.serviceId());
            } else if (rotationScheduled.add(certificate.serviceId())) {
                log.warn("Certificate rotation due: serviceId={}, expiresAt={}",
                        certificate.serviceId(), certificate.expiresAt());
            }
        }
        return due;
    }

    /**
     * Runs {@link #checkRotations} periodically on a daemon thread.
     */
    public synchronized void startRotationChecks(Duration interval, boolean autoRotate) {
        if (rotationScheduler != null) {
            return;
        }
        rotationScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "certificate-rotation");
            t.setDaemon(true);
            return t;
        });
        rotationScheduler.scheduleWithFixedDelay(() -> {
            try {
                checkRotations(autoRotate);
            } catch (RuntimeException e) {
                log.error("Certificate rotation check failed", e);
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Certificate rotation checks started: interval={}, autoRotate={}", interval, autoRotate);
    }

    public boolean isOperative() {
        return !closed.get();
    }

    public Duration getCertificateTtl() {
        return certificateTtl;
    }

    public AuthStats getStats() {
        Instant now = Instant.now();
        int expiringSoon = (int) certificates.values().stream()
                .filter(certificate -> certificate.expiresWithin(rotationThreshold, now))
                .count();
        return new AuthStats(
                totalRequests.get(),
                authenticatedRequests.get(),
                failedAuth.get(),
                deniedByAcl.get(),
                expiredCertificates.get(),
                certificateRotations.get(),
                certificates.size(),
                expiringSoon,
                acls.size()
        );
    }

    /**
     * Zeroes counters; certificates and ACLs are kept.
     */
    public void resetStats() {
        totalRequests.set(0);
        authenticatedRequests.set(0);
        failedAuth.set(0);
        deniedByAcl.set(0);
        expiredCertificates.set(0);
        certificateRotations.set(0);
    }

    @Override
    public synchronized void close() {
        if (closed.compareAndSet(false, true) && rotationScheduler != null) {
            rotationScheduler.shutdownNow();
            log.info("Certificate rotation checks stopped");
        }
    }

    public record AuthStats(
            long totalRequests,
            long authenticatedRequests,
            long failedAuth,
            long deniedByAcl,
            long expiredCertificates,
            long certificateRotations,
            int totalCertificates,
            int expiringSoon,
            int totalAcls
    ) {
    }
}
