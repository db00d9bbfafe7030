package fr.lapetina.mesh.infrastructure.auth;

import fr.lapetina.mesh.domain.exception.CertificateExpiredException;
import fr.lapetina.mesh.domain.exception.CertificateInvalidException;
import fr.lapetina.mesh.domain.exception.NotFoundException;
import fr.lapetina.mesh.domain.exception.UnauthorizedServiceException;
import fr.lapetina.mesh.domain.model.ErrorType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceAuthorityTest {

    private static final String SECRET = "test-signing-secret-of-at-least-32-bytes";

    private ServiceAuthority authority;

    @BeforeEach
    void setUp() {
        authority = new ServiceAuthority(SECRET, Duration.ofHours(24), Duration.ofHours(1));
    }

    @AfterEach
    void tearDown() {
        authority.close();
    }

    @Nested
    @DisplayName("Certificates")
    class CertificateTests {

        @Test
        @DisplayName("should verify a freshly issued certificate")
        void shouldVerifyIssuedCertificate() {
            ServiceCertificate issued = authority.issueCertificate("api-gateway-1", "api-gateway");

            ServiceCertificate verified = authority.verifyCertificate(issued.credential());

            assertThat(verified.serviceId()).isEqualTo("api-gateway-1");
            assertThat(verified.serviceName()).isEqualTo("api-gateway");
            assertThat(verified.certificateId()).isEqualTo(issued.certificateId());
            assertThat(issued.expiresAt()).isAfter(issued.issuedAt());
        }

        @Test
        @DisplayName("should reject a certificate signed with another key")
        void shouldRejectForeignSignature() {
            ServiceAuthority other = new ServiceAuthority(
                    "another-signing-secret-of-32-bytes-long", Duration.ofHours(24), Duration.ofHours(1));
            String foreign = other.issueCertificate("api-gateway-1", "api-gateway").credential();
            authority.issueCertificate("api-gateway-1", "api-gateway");

            assertThatThrownBy(() -> authority.verifyCertificate(foreign))
                    .isInstanceOf(CertificateInvalidException.class);
        }

        @Test
        @DisplayName("should reject malformed and empty credentials")
        void shouldRejectGarbage() {
            assertThatThrownBy(() -> authority.verifyCertificate("not-a-token"))
                    .isInstanceOf(CertificateInvalidException.class);
            assertThatThrownBy(() -> authority.verifyCertificate(""))
                    .isInstanceOf(CertificateInvalidException.class);
        }

        @Test
        @DisplayName("should reject the previous certificate after rotation")
        void shouldInvalidatePreviousOnRotation() {
            ServiceCertificate first = authority.issueCertificate("booking-1", "booking-service");

            ServiceCertificate rotated = authority.rotateCertificate("booking-1");

            assertThat(rotated.certificateId()).isNotEqualTo(first.certificateId());
            assertThat(authority.verifyCertificate(rotated.credential()).serviceId()).isEqualTo("booking-1");
            assertThatThrownBy(() -> authority.verifyCertificate(first.credential()))
                    .isInstanceOf(CertificateInvalidException.class);
            assertThat(authority.getStats().certificateRotations()).isEqualTo(1);
        }

        @Test
        @DisplayName("should reject a revoked certificate")
        void shouldRejectRevoked() {
            ServiceCertificate issued = authority.issueCertificate("booking-1", "booking-service");

            assertThat(authority.revokeCertificate("booking-1")).isTrue();

            assertThatThrownBy(() -> authority.verifyCertificate(issued.credential()))
                    .isInstanceOf(CertificateInvalidException.class);
            assertThat(authority.revokeCertificate("booking-1")).isFalse();
        }

        @Test
        @DisplayName("should fail to rotate an unknown service id")
        void shouldNotRotateUnknown() {
            assertThatThrownBy(() -> authority.rotateCertificate("ghost"))
                    .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("should reject an expired certificate")
        void shouldRejectExpired() throws InterruptedException {
            ServiceAuthority shortLived = new ServiceAuthority(SECRET, Duration.ofSeconds(1), Duration.ZERO);
            ServiceCertificate issued = shortLived.issueCertificate("booking-1", "booking-service");

            Thread.sleep(2100);

            assertThatThrownBy(() -> shortLived.verifyCertificate(issued.credential()))
                    .isInstanceOf(CertificateExpiredException.class)
                    .satisfies(e -> assertThat(((UnauthorizedServiceException) e).getHttpStatus()).isEqualTo(401));
        }

        @Test
        @DisplayName("should strip credentials from listings")
        void shouldRedactListings() {
            authority.issueCertificate("booking-1", "booking-service");

            assertThat(authority.getCertificates()).hasSize(1);
            assertThat(authority.getCertificates().get(0).credential()).isNull();
            assertThat(authority.getCertificate("booking-1")).hasValueSatisfying(
                    certificate -> assertThat(certificate.credential()).isNull());
        }

        @Test
        @DisplayName("should refuse a signing secret shorter than 32 bytes")
        void shouldRejectShortSecret() {
            assertThatThrownBy(() -> new ServiceAuthority("too-short", Duration.ofHours(1), Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Rotation checks")
    class RotationTests {

        @Test
        @DisplayName("should flag certificates expiring within the threshold")
        void shouldFlagExpiringCertificates() {
            ServiceAuthority soon = new ServiceAuthority(SECRET, Duration.ofMinutes(10), Duration.ofHours(1));
            soon.issueCertificate("booking-1", "booking-service");

            assertThat(soon.checkRotations(false)).isEqualTo(1);
            assertThat(soon.getStats().expiringSoon()).isEqualTo(1);
            assertThat(soon.getStats().certificateRotations()).isZero();
        }

        @Test
        @DisplayName("should reissue due certificates when auto-rotating")
        void shouldAutoRotate() {
            ServiceAuthority soon = new ServiceAuthority(SECRET, Duration.ofMinutes(10), Duration.ofHours(1));
            ServiceCertificate first = soon.issueCertificate("booking-1", "booking-service");

            soon.checkRotations(true);

            assertThat(soon.getCertificate("booking-1")).hasValueSatisfying(
                    certificate -> assertThat(certificate.certificateId()).isNotEqualTo(first.certificateId()));
        }

        @Test
        @DisplayName("should leave long-lived certificates alone")
        void shouldIgnoreFreshCertificates() {
            authority.issueCertificate("booking-1", "booking-service");

            assertThat(authority.checkRotations(true)).isZero();
        }
    }

    @Nested
    @DisplayName("Authorization")
    class AuthorizationTests {

        @Test
        @DisplayName("should deny pairs without an ACL row")
        void shouldFailClosed() {
            assertThat(authority.authorize("api-gateway", "payment-service", "read")).isFalse();
            assertThat(authority.getStats().deniedByAcl()).isEqualTo(1);
        }

        @Test
        @DisplayName("should grant only the listed permissions")
        void shouldCheckPermissions() {
            authority.addAcl(AclEntry.of("api-gateway", "booking-service", true, List.of("read", "write")));

            assertThat(authority.authorize("api-gateway", "booking-service", "read")).isTrue();
            assertThat(authority.authorize("api-gateway", "booking-service", "delete")).isFalse();
        }

        @Test
        @DisplayName("should treat the wildcard as every permission")
        void shouldHonorWildcard() {
            authority.addAcl(AclEntry.of("booking-service", "payment-service", true, List.of("*")));

            assertThat(authority.authorize("booking-service", "payment-service", "delete")).isTrue();
        }

        @Test
        @DisplayName("should deny when the row is explicitly disallowed")
        void shouldHonorExplicitDeny() {
            authority.addAcl(AclEntry.of("api-gateway", "payment-service", false, List.of("*")));

            assertThat(authority.authorize("api-gateway", "payment-service", "read")).isFalse();
        }

        @Test
        @DisplayName("should not let a row match another pair that joins to the same text")
        void shouldKeepPairsDistinct() {
            authority.addAcl(AclEntry.of("a:b", "c", true, List.of("*")));

            assertThat(authority.authorize("a:b", "c", "read")).isTrue();
            assertThat(authority.authorize("a", "b:c", "read")).isFalse();
            assertThat(authority.removeAcl("a", "b:c")).isFalse();
        }

        @Test
        @DisplayName("should apply ACL updates to the next call")
        void shouldApplyUpdatesImmediately() {
            authority.addAcl(AclEntry.of("api-gateway", "booking-service", true, List.of("read")));
            authority.addAcl(AclEntry.of("api-gateway", "booking-service", true, List.of("write")));

            assertThat(authority.authorize("api-gateway", "booking-service", "read")).isFalse();
            assertThat(authority.authorize("api-gateway", "booking-service", "write")).isTrue();

            assertThat(authority.removeAcl("api-gateway", "booking-service")).isTrue();
            assertThat(authority.authorize("api-gateway", "booking-service", "write")).isFalse();
        }
    }

    @Nested
    @DisplayName("Authentication")
    class AuthenticationTests {

        @Test
        @DisplayName("should authenticate an allowed caller")
        void shouldAuthenticate() {
            authority.addAcl(AclEntry.of("api-gateway", "booking-service", true, List.of("write")));
            String credential = authority.issueCertificate("api-gateway-1", "api-gateway").credential();

            ServiceCertificate caller = authority.authenticate(credential, "booking-service", "write");

            assertThat(caller.serviceName()).isEqualTo("api-gateway");
            assertThat(authority.getStats().authenticatedRequests()).isEqualTo(1);
        }

        @Test
        @DisplayName("should answer 401 without a certificate")
        void shouldRequireCertificate() {
            assertThatThrownBy(() -> authority.authenticate(null, "booking-service", "read"))
                    .isInstanceOf(UnauthorizedServiceException.class)
                    .satisfies(e -> assertThat(((UnauthorizedServiceException) e).getErrorType())
                            .isEqualTo(ErrorType.UNAUTHORIZED));
        }

        @Test
        @DisplayName("should answer 403 when the ACL denies the call")
        void shouldDenyWithoutAcl() {
            String credential = authority.issueCertificate("api-gateway-1", "api-gateway").credential();

            assertThatThrownBy(() -> authority.authenticate(credential, "payment-service", "write"))
                    .isInstanceOf(UnauthorizedServiceException.class)
                    .satisfies(e -> assertThat(((UnauthorizedServiceException) e).getHttpStatus()).isEqualTo(403));
            assertThat(authority.getStats().failedAuth()).isEqualTo(1);
        }
    }
}
