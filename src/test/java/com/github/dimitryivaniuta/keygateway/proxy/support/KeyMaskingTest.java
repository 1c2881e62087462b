package com.github.dimitryivaniuta.keygateway.proxy.support;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class KeyMaskingTest {

    @Test
    void shouldKeepOnlyLastFourCharacters() {
        assertThat(KeyMasking.mask("AIzaSyD-1234567890abcd")).isEqualTo("****abcd");
    }

    @Test
    void shortOrMissingKeysAreFullyMasked() {
        assertThat(KeyMasking.mask("short")).isEqualTo("****");
        assertThat(KeyMasking.mask("")).isEqualTo("****");
        assertThat(KeyMasking.mask(null)).isEqualTo("****");
    }
}
