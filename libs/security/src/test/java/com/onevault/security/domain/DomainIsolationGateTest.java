package com.onevault.security.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.onevault.identity.HashKey;
import com.onevault.identity.IdentityResolver;
import com.onevault.identity.IdentityValidationException;
import com.onevault.identity.NotFoundException;
import com.onevault.security.AccessAction;
import com.onevault.security.DenialReason;
import com.onevault.security.testing.ZeroTrustTestKit;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Domain isolation")
class DomainIsolationGateTest {

    private ZeroTrustTestKit kit;
    private DomainAssignmentRegistry registry;
    private DomainIsolationGate gate;
    private HashKey agent;

    @BeforeEach
    void setUp() {
        kit = ZeroTrustTestKit.create();
        registry = kit.domains();
        gate = kit.gate();
        agent = kit.identities().hub("agent-cardiology");
    }

    private DenialReason reasonOf(AccessDecision decision) {
        assertThat(decision).isInstanceOf(AccessDecision.Denied.class);
        return ((AccessDecision.Denied) decision).reason();
    }

    @Nested
    @DisplayName("authorize()")
    class Authorize {

        @Test
        @DisplayName("an actor without an assignment is refused everything")
        void noAssignment() {
            for (AccessAction action : AccessAction.values()) {
                assertThat(reasonOf(gate.authorize(agent, "cardiology", action)))
                        .isEqualTo(DenialReason.NO_DOMAIN_ASSIGNED);
            }
        }

        @Test
        @DisplayName("allows permitted actions inside the assigned domain")
        void allowsOwnDomain() {
            registry.grant(kit.identities().tenantKey(), agent,
                    DomainGrant.of("cardiology", AccessAction.READ, AccessAction.INFERENCE));

            assertThat(gate.authorize(agent, "cardiology", AccessAction.READ).allowed()).isTrue();
            assertThat(gate.authorize(agent, "cardiology", AccessAction.INFERENCE).allowed()).isTrue();
            assertThat(reasonOf(gate.authorize(agent, "cardiology", AccessAction.LEARN)))
                    .isEqualTo(DenialReason.ACTION_NOT_PERMITTED);
        }

        @Test
        @DisplayName("any other domain is a cross-domain violation")
        void crossDomain() {
            registry.grant(kit.identities().tenantKey(), agent, DomainGrant.of("cardiology", AccessAction.READ));

            assertThat(reasonOf(gate.authorize(agent, "oncology", AccessAction.READ)))
                    .isEqualTo(DenialReason.CROSS_DOMAIN_VIOLATION);
        }

        @Test
        @DisplayName("a forbidden domain is refused even if it is the assigned one")
        void forbiddenDomain() {
            registry.grant(kit.identities().tenantKey(), agent,
                    DomainGrant.of("cardiology", AccessAction.READ).withForbiddenDomains("cardiology"));

            assertThat(reasonOf(gate.authorize(agent, "cardiology", AccessAction.READ)))
                    .isEqualTo(DenialReason.CROSS_DOMAIN_VIOLATION);
        }

        @Test
        @DisplayName("checks categories: deny-list before allow-list")
        void categories() {
            registry.grant(kit.identities().tenantKey(), agent, DomainGrant.of("cardiology", AccessAction.READ)
                    .withAllowedCategories("ecg", "lab", "notes")
                    .withForbiddenCategories("notes"));

            assertThat(gate.authorize(agent, "cardiology", AccessAction.READ, "ecg").allowed()).isTrue();
            assertThat(reasonOf(gate.authorize(agent, "cardiology", AccessAction.READ, "notes")))
                    .isEqualTo(DenialReason.FORBIDDEN_CATEGORY);
            assertThat(reasonOf(gate.authorize(agent, "cardiology", AccessAction.READ, "billing")))
                    .isEqualTo(DenialReason.CATEGORY_NOT_ALLOWED);
            assertThat(reasonOf(gate.authorize(agent, "cardiology", AccessAction.READ)))
                    .isEqualTo(DenialReason.CATEGORY_NOT_ALLOWED);
        }

        @Test
        @DisplayName("the first failing check wins")
        void order() {
            registry.grant(kit.identities().tenantKey(), agent, DomainGrant.of("cardiology")
                    .withForbiddenCategories("psychiatry"));

            assertThat(reasonOf(gate.authorize(agent, "oncology", AccessAction.LEARN, "psychiatry")))
                    .isEqualTo(DenialReason.CROSS_DOMAIN_VIOLATION);
            assertThat(reasonOf(gate.authorize(agent, "cardiology", AccessAction.LEARN, "psychiatry")))
                    .isEqualTo(DenialReason.FORBIDDEN_CATEGORY);
            assertThat(reasonOf(gate.authorize(agent, "cardiology", AccessAction.LEARN, "ecg")))
                    .isEqualTo(DenialReason.ACTION_NOT_PERMITTED);
        }

        @Test
        @DisplayName("the lowest possible risk never opens another domain")
        void riskCannotWidenAccess() {
            registry.grant(kit.identities().tenantKey(), agent, DomainGrant.of("cardiology", AccessAction.READ));
            kit.setAllSignals(0);
            String token = kit.sessions().issue(agent).token();

            var outcome = kit.gateway().authorize(kit.request(token, agent, "oncology", AccessAction.READ));

            assertThat(outcome.allowed()).isFalse();
            assertThat(outcome.reason()).isEqualTo(DenialReason.CROSS_DOMAIN_VIOLATION);
            assertThat(outcome.assessment()).isNull();
        }
    }

    @Nested
    @DisplayName("DomainAssignmentRegistry")
    class Registry {

        @Test
        @DisplayName("one active assignment per actor")
        void singleActiveAssignment() {
            registry.grant(kit.identities().tenantKey(), agent, DomainGrant.of("cardiology", AccessAction.READ));

            assertThatThrownBy(() -> registry.grant(kit.identities().tenantKey(), agent,
                    DomainGrant.of("oncology", AccessAction.READ)))
                    .isInstanceOf(DomainAssignmentConflictException.class)
                    .hasMessageContaining("cardiology");
        }

        @Test
        @DisplayName("revoke then grant moves the actor, keeping history")
        void reassignment() {
            registry.grant(kit.identities().tenantKey(), agent, DomainGrant.of("cardiology", AccessAction.READ));
            Instant whileCardiology = kit.clock().advance(Duration.ofHours(1));
            kit.clock().advance(Duration.ofHours(1));

            DomainAssignment revoked = registry.revoke(agent, "transferred");
            registry.grant(kit.identities().tenantKey(), agent, DomainGrant.of("oncology", AccessAction.READ));

            assertThat(revoked.isActive()).isFalse();
            assertThat(revoked.revocationReason()).isEqualTo("transferred");
            assertThat(registry.current(agent)).get().extracting(DomainAssignment::domain).isEqualTo("oncology");
            assertThat(registry.asOf(agent, whileCardiology)).get().extracting(DomainAssignment::domain)
                    .isEqualTo("cardiology");
            assertThat(registry.history(agent)).extracting(DomainAssignment::status).containsExactly(
                    DomainAssignment.Status.ACTIVE, DomainAssignment.Status.REVOKED, DomainAssignment.Status.ACTIVE);
            assertThat(gate.authorize(agent, "cardiology", AccessAction.READ).allowed()).isFalse();
        }

        @Test
        @DisplayName("a revoked actor is refused everything")
        void revokedActor() {
            registry.grant(kit.identities().tenantKey(), agent, DomainGrant.of("cardiology", AccessAction.READ));
            registry.revoke(agent, null);

            assertThat(reasonOf(gate.authorize(agent, "cardiology", AccessAction.READ)))
                    .isEqualTo(DenialReason.NO_DOMAIN_ASSIGNED);
            assertThatThrownBy(() -> registry.revoke(agent, "again")).isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("links the actor to the knowledge-domain hub")
        void linksDomainHub() {
            registry.grant(kit.identities().tenantKey(), agent, DomainGrant.of("cardiology", AccessAction.READ));

            HashKey domainHub = kit.resolver().resolve(kit.identities().tenantKey(),
                    IdentityResolver.compositeKey("knowledge-domain", "cardiology"));
            assertThat(kit.resolver().find(domainHub)).isPresent();
            assertThat(kit.links().find(kit.links().linkKeyOf(List.of(agent, domainHub)))).isPresent();
        }

        @Test
        @DisplayName("refuses unknown actors and actors of another tenant")
        void tenantChecks() {
            assertThatThrownBy(() -> registry.grant(kit.identities().tenantKey(),
                    kit.identities().unrecorded("ghost"), DomainGrant.of("cardiology")))
                    .isInstanceOf(NotFoundException.class);

            HashKey otherTenant = kit.resolver().ensureTenant("globex", "test").hashKey();
            assertThatThrownBy(() -> registry.grant(otherTenant, agent, DomainGrant.of("cardiology")))
                    .isInstanceOf(IdentityValidationException.class);
        }
    }
}
