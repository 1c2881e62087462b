package com.github.dimitryivaniuta.keygateway.proxy;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayPropertiesTest {

    @Test
    void shouldSplitSemicolonSeparatedKeys() {
        GatewayProperties p = new GatewayProperties();
        p.setApiKeys(List.of("k1;k2; k3 ;"));

        assertThat(p.credentials()).containsExactly("k1", "k2", "k3");
    }

    @Test
    void shouldAcceptListEntriesAndDropBlanksAndDuplicates() {
        GatewayProperties p = new GatewayProperties();
        p.setApiKeys(List.of("k1", " ", "k2;k1", ";;"));

        assertThat(p.credentials()).containsExactly("k1", "k2");
    }

    @Test
    void defaultsShouldMatchDocumentedValues() {
        GatewayProperties p = new GatewayProperties();

        assertThat(p.credentials()).isEmpty();
        assertThat(p.getRateLimit().getLimit()).isEqualTo(15);
        assertThat(p.getRateLimit().getWindow()).hasSeconds(60);
        assertThat(p.getCredential().getHeaderName()).isEqualTo("Authorization");
        assertThat(p.getCredential().getHeaderPrefix()).isEqualTo("Bearer ");
        assertThat(p.getUpstream().getReadTimeout()).hasSeconds(180);
    }
}
