package com.onevault.accessservice.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.onevault.security.session.SessionSettings;
import java.time.Duration;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link AccessProperties}: compact-constructor defaults and conversion into the
 * core's value types, without starting a Spring context.
 */
@DisplayName("AccessProperties")
class AccessPropertiesTest {

    @Test
    @DisplayName("absent blocks fall back to the documented defaults")
    void defaults() {
        var props = new AccessProperties("svc", null, null, null, null);

        assertThat(props.risk().weights().toRiskWeights().total()).isEqualTo(100.0);
        assertThat(props.risk().tiers().toBoundaries().fullMax()).isEqualTo(20.0);
        assertThat(props.risk().flaggedAddresses()).isEmpty();
        assertThat(props.session().ttl()).isEqualTo(Duration.ofMinutes(30));
        assertThat(props.store().lockTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(props.audit().retryCapacity()).isEqualTo(10_000);
        assertThat(props.audit().retryInterval()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    @DisplayName("zero usage caps mean unlimited")
    void unlimitedSessions() {
        SessionSettings settings = new AccessProperties.Session(Duration.ofMinutes(5), 0, 0, 0).toSettings();

        assertThat(settings.defaultTtl()).isEqualTo(Duration.ofMinutes(5));
        assertThat(settings.defaultLimits().maxRequests()).isEqualTo(Long.MAX_VALUE);
        assertThat(settings.defaultLimits().maxBytes()).isEqualTo(Long.MAX_VALUE);
        assertThat(settings.maxTransitionRetries()).isEqualTo(8);
    }

    @Test
    @DisplayName("data caps are configured in megabytes")
    void megabytes() {
        SessionSettings settings = new AccessProperties.Session(null, 100, 2, 3).toSettings();

        assertThat(settings.defaultLimits().maxBytes()).isEqualTo(2L * 1024 * 1024);
        assertThat(settings.defaultLimits().maxRequests()).isEqualTo(100);
    }

    @Test
    @DisplayName("tier bounds out of order fail when the core builds them")
    void badTiers() {
        var risk = new AccessProperties.Risk(null, new AccessProperties.Tiers(60, 50, 80), Set.of());

        assertThatThrownBy(() -> risk.tiers().toBoundaries()).isInstanceOf(IllegalArgumentException.class);
    }
}
