package com.atrium.tenancy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TenantKeys")
class TenantKeysTest {

    @Test
    @DisplayName("accepts a canonical UUID")
    void acceptsCanonical() {
        var key = UUID.randomUUID();
        assertThat(TenantKeys.parse(key.toString())).contains(key);
    }

    @Test
    @DisplayName("rejects the short forms UUID.fromString tolerates")
    void rejectsShortForms() {
        assertThat(TenantKeys.parse("1-2-3-4-5")).isEmpty();
    }

    @Test
    @DisplayName("rejects a key padded with whitespace")
    void rejectsPadded() {
        var key = UUID.randomUUID().toString();

        assertThat(TenantKeys.parse(" " + key)).isEmpty();
        assertThat(TenantKeys.parse(key + " ")).isEmpty();
        assertThat(TenantKeys.parse(key + "\n")).isEmpty();
    }

    @Test
    @DisplayName("reads the configured route parameter only")
    void readsConfiguredParameter() {
        var key = UUID.randomUUID();
        var route = Map.of("workspace", key.toString());

        assertThat(TenantKeys.fromRoute(route, "workspace")).contains(key);
        assertThat(TenantKeys.fromRoute(route, "tenantKey")).isEmpty();
        assertThat(TenantKeys.fromRoute(null, "tenantKey")).isEmpty();
    }
}
