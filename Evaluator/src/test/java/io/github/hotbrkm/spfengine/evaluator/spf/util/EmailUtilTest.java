package io.github.hotbrkm.spfengine.evaluator.spf.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EmailUtil test")
class EmailUtilTest {

    @DisplayName("Splits at the last @")
    @Test
    void testExtract() {
        assertThat(EmailUtil.extractLocalPart("strong-bad@email.example.com")).isEqualTo("strong-bad");
        assertThat(EmailUtil.extractDomain("strong-bad@email.example.com")).isEqualTo("email.example.com");
        assertThat(EmailUtil.extractLocalPart("\"a@b\"@example.com")).isEqualTo("\"a@b\"");
    }

    @DisplayName("Missing parts give null")
    @Test
    void testMissingParts() {
        assertThat(EmailUtil.extractLocalPart("@example.com")).isNull();
        assertThat(EmailUtil.extractDomain("user@")).isNull();
        assertThat(EmailUtil.extractDomain("example.com")).isNull();
        assertThat(EmailUtil.extractLocalPart(null)).isNull();
    }
}
