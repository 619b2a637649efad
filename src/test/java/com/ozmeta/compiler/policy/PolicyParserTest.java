package com.ozmeta.compiler.policy;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.ozmeta.compiler.exception.CompilationException;
import com.ozmeta.compiler.policy.PolicyExpression.BooleanLiteral;
import com.ozmeta.compiler.policy.PolicyExpression.ColumnRef;
import com.ozmeta.compiler.policy.PolicyExpression.ContextKey;
import com.ozmeta.compiler.policy.PolicyExpression.ContextRef;
import com.ozmeta.compiler.policy.PolicyExpression.NumberLiteral;
import com.ozmeta.compiler.policy.PolicyExpression.Operation;
import com.ozmeta.compiler.policy.PolicyExpression.Operator;
import com.ozmeta.compiler.policy.PolicyExpression.StringLiteral;
import com.ozmeta.compiler.util.JsonSupport;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for reading security guard expressions.
 */
class PolicyParserTest {

    private final PolicyParser parser = new PolicyParser();

    private PolicyExpression parse(String json) throws Exception {
        JsonNode node = JsonSupport.mapper().readTree(json);
        return parser.parse("TEST", node);
    }

    @Test
    void testTenantShorthand() {
        PolicyExpression expression = parser.parse("TEST", TextNode.valueOf("tenant"));

        assertThat(expression).isEqualTo(new Operation(Operator.EQ,
                List.of(ColumnRef.unresolved("_TenantID"), new ContextRef(ContextKey.TENANT_ID))));
    }

    @Test
    void testConstantShorthands() {
        assertThat(parser.parse("TEST", TextNode.valueOf("allow"))).isEqualTo(BooleanLiteral.TRUE);
        assertThat(parser.parse("TEST", TextNode.valueOf("1=0"))).isEqualTo(BooleanLiteral.FALSE);
    }

    @Test
    void testGuardDocument() throws Exception {
        PolicyExpression expression = parse("{\"kind\": \"Guard\", \"expr\": {\"op\": \"And\", \"args\": ["
                + "{\"op\": \"gte\", \"args\": [{\"ref\": \"TR_Amount\"}, 100]},"
                + "{\"op\": \"in\", \"args\": [{\"ref\": \"TR_Currency\"}, \"EUR\", {\"lit\": \"USD\"}]}]}}");

        assertThat(expression).isEqualTo(new Operation(Operator.AND, List.of(
                new Operation(Operator.GTE, List.of(ColumnRef.unresolved("TR_Amount"),
                        new NumberLiteral(new BigDecimal("100")))),
                new Operation(Operator.IN, List.of(ColumnRef.unresolved("TR_Currency"),
                        new StringLiteral("EUR"), new StringLiteral("USD"))))));
    }

    @Test
    void testGuardWithoutExpressionAllowsAll() throws Exception {
        assertThat(parse("{\"kind\": \"Guard\"}")).isEqualTo(BooleanLiteral.TRUE);
    }

    @Test
    void testJsonTextIsParsed() {
        PolicyExpression expression = parser.parse("TEST",
                TextNode.valueOf("{\"op\": \"eq\", \"args\": [{\"ref\": \"user.role\"}, {\"lit\": \"admin\"}]}"));

        assertThat(expression).isEqualTo(new Operation(Operator.EQ,
                List.of(new ContextRef(ContextKey.USER_ROLE), new StringLiteral("admin"))));
    }

    @Test
    void testMalformedTextIsRejected() {
        assertThatThrownBy(() -> parser.parse("region_only", TextNode.valueOf("region = 'EMEA'")))
                .isInstanceOf(CompilationException.class)
                .hasMessageStartingWith("Policy 'region_only': expression is neither a shorthand nor JSON");
    }

    @Test
    void testUnknownOperator() {
        assertThatThrownBy(() -> parse("{\"op\": \"dateadd\", \"args\": []}"))
                .isInstanceOf(CompilationException.class)
                .hasMessage("Policy 'TEST': unknown operator 'dateadd'");
    }

    @Test
    void testOperatorArity() {
        assertThatThrownBy(() -> parse("{\"op\": \"eq\", \"args\": [{\"ref\": \"TR_ID\"}]}"))
                .isInstanceOf(CompilationException.class)
                .hasMessage("Policy 'TEST': operator 'eq' does not take 1 argument(s)");
    }

    @Test
    void testUnknownSessionReference() {
        assertThatThrownBy(() -> parse("{\"ref\": \"context.region\"}"))
                .isInstanceOf(CompilationException.class)
                .hasMessage("Policy 'TEST': unknown session reference 'context.region'");
    }
}
