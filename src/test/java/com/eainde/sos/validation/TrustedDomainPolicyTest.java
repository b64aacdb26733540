package com.eainde.sos.validation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TrustedDomainPolicyTest {

    private final TrustedDomainPolicy policy = new TrustedDomainPolicy(List.of("gov.in", ".org", "NHS.UK"));

    @ParameterizedTest
    @ValueSource(strings = {
            "https://112.gov.in/",
            "https://gov.in",
            "http://www.aasra.org/contact",
            "https://www.nhs.uk/mental-health/",
            "telemanas.mohfw.gov.in/home",
            "https://WWW.SAMARITANS.ORG/"
    })
    void acceptsAllowListedHosts(String url) {
        assertThat(policy.isTrusted(url)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "https://example-blog.com/helplines",
            "https://notgov.in/",
            "https://gov.in.evil.com/",
            "https://org.example.net/",
            "not a url at all",
            ""
    })
    void rejectsOtherHosts(String url) {
        assertThat(policy.isTrusted(url)).isFalse();
    }

    @Test
    void nullUrlIsUntrusted() {
        assertThat(policy.isTrusted(null)).isFalse();
    }

    @Test
    void suffixesAreNormalized() {
        assertThat(policy.getSuffixes()).containsExactly("gov.in", "org", "nhs.uk");
    }
}
