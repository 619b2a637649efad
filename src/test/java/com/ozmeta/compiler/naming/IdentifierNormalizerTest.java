package com.ozmeta.compiler.naming;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.ozmeta.compiler.model.canonical.CasePolicy;
import com.ozmeta.compiler.model.canonical.ConstraintProfile;
import com.ozmeta.compiler.model.canonical.NormalizeRule;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for identifier normalization.
 */
class IdentifierNormalizerTest {

    private static final ConstraintProfile PG = ConstraintProfile.builder()
            .code("pg")
            .maxLength(63)
            .casePolicy(CasePolicy.LOWER)
            .allowedCharsPattern("[a-z0-9_]")
            .normalizeRule(NormalizeRule.replaceWith('_'))
            .build();

    private static final ConstraintProfile SHORT = ConstraintProfile.builder()
            .code("short")
            .maxLength(10)
            .casePolicy(CasePolicy.LOWER)
            .allowedCharsPattern("[a-z0-9_]")
            .build();

    @ParameterizedTest
    @CsvSource({
            "Transaction, transaction",
            "TR_Amount, tr_amount",
            "Order Line, order_line",
            "SFO-Dev-Fabric-All-USW, sfo_dev_fabric_all_usw"
    })
    void testNormalizeLowerCaseProfile(String canonical, String expected) {
        assertThat(IdentifierNormalizer.normalizeIdentifier(canonical, PG)).isEqualTo(expected);
    }

    @Test
    void testUpperCaseProfile() {
        ConstraintProfile snowflake = ConstraintProfile.builder()
                .code("sf")
                .maxLength(255)
                .casePolicy(CasePolicy.UPPER)
                .allowedCharsPattern("[A-Z0-9_]")
                .build();

        assertThat(IdentifierNormalizer.normalizeIdentifier("TR_Amount", snowflake)).isEqualTo("TR_AMOUNT");
    }

    @Test
    void testStripRuleDropsDisallowedCharacters() {
        ConstraintProfile strip = ConstraintProfile.builder()
                .code("strip")
                .maxLength(30)
                .casePolicy(CasePolicy.PRESERVE)
                .allowedCharsPattern("[A-Za-z0-9]")
                .normalizeRule(NormalizeRule.strip())
                .build();

        assertThat(IdentifierNormalizer.normalizeIdentifier("Order-Line #1", strip)).isEqualTo("OrderLine1");
    }

    @Test
    void testLongNameGetsHashSuffixWithinMaxLength() {
        String name = IdentifierNormalizer.normalizeIdentifier("VeryLongTableName", SHORT);

        assertThat(name).hasSize(10);
        assertThat(name).startsWith("ver_");
        assertThat(name.substring(4)).matches("[0-9a-f]{6}");
    }

    @Test
    void testHashSuffixIsDeterministicAndDistinguishesNames() {
        String first = IdentifierNormalizer.normalizeIdentifier("VeryLongTableName", SHORT);
        String again = IdentifierNormalizer.normalizeIdentifier("VeryLongTableName", SHORT);
        String other = IdentifierNormalizer.normalizeIdentifier("VeryLongTableNameTwo", SHORT);

        assertThat(again).isEqualTo(first);
        assertThat(other).isNotEqualTo(first);
    }

    @ParameterizedTest
    @CsvSource({
            "Transaction",
            "VeryLongTableNameThatOverflows",
            "_TenantID",
            "fk_TR_CU_TR_CustomerID"
    })
    void testNormalizationIsIdempotent(String canonical) {
        String once = IdentifierNormalizer.normalizeIdentifier(canonical, SHORT);
        String twice = IdentifierNormalizer.normalizeIdentifier(once, SHORT);

        assertThat(twice).isEqualTo(once);
        assertThat(IdentifierNormalizer.conforms(once, SHORT)).isTrue();
    }

    @Test
    void testEmptyResultFallsBackToPlaceholder() {
        ConstraintProfile strip = ConstraintProfile.builder()
                .code("strip")
                .maxLength(30)
                .casePolicy(CasePolicy.LOWER)
                .allowedCharsPattern("[a-z]")
                .normalizeRule(NormalizeRule.strip())
                .build();

        assertThat(IdentifierNormalizer.normalizeIdentifier("123", strip)).isEqualTo("x");
    }

    @Test
    void testConforms() {
        assertThat(IdentifierNormalizer.conforms("transaction", PG)).isTrue();
        assertThat(IdentifierNormalizer.conforms("Transaction", PG)).isFalse();
        assertThat(IdentifierNormalizer.conforms("tr-amount", PG)).isFalse();
        assertThat(IdentifierNormalizer.conforms("", PG)).isFalse();
        assertThat(IdentifierNormalizer.conforms("abcdefghijk", SHORT)).isFalse();
    }
}
