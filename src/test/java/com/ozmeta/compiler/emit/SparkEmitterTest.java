package com.ozmeta.compiler.emit;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.ozmeta.compiler.exception.CompilationException;
import com.ozmeta.compiler.model.canonical.SecurityArea;
import com.ozmeta.compiler.model.canonical.SecurityMode;
import com.ozmeta.compiler.model.output.DriftRuleKind;
import com.ozmeta.compiler.model.output.EmitResult;
import com.ozmeta.compiler.util.JsonSupport;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Delta table generation.
 */
class SparkEmitterTest {

    @Test
    void testDeltaTablePartitionedByTenant() throws IOException {
        EmitResult result = new SparkEmitter(new TemplateRenderer()).emit(EmitterFixtures.project("Databricks"));
        String ddl = EmitterFixtures.contents(result, "sql/transaction.sql");

        assertThat(ddl).contains("CREATE TABLE IF NOT EXISTS `dp`.`transaction` (\n");
        assertThat(ddl).doesNotContain("PRIMARY KEY");
        assertThat(ddl).endsWith(")\nUSING DELTA\nPARTITIONED BY (`_tenantid`)\n"
                + "TBLPROPERTIES ('delta.enableChangeDataFeed' = 'true');\n");
        assertThat(result.getDriftRules())
                .filteredOn(r -> r.getKind() == DriftRuleKind.PARTITIONING)
                .singleElement()
                .satisfies(r -> assertThat(r.getExpected()).isEqualTo("_tenantid"));
    }

    @Test
    void testRowFilterFunction() throws IOException {
        EmitResult result = new SparkEmitter(new TemplateRenderer()).emit(EmitterFixtures.projectSecured("Databricks"));

        assertThat(EmitterFixtures.contents(result, SharedArtifacts.RLS_FILE)).endsWith(
                "CREATE OR REPLACE FUNCTION `dp`.`rls_tr`(`tr_currency` STRING, `_tenantid` STRING) RETURNS BOOLEAN "
                        + "RETURN ((`tr_currency` = 'EUR') AND (`_tenantid` = CAST(current_user() AS STRING)));\n"
                        + "ALTER TABLE `dp`.`transaction` SET ROW FILTER `dp`.`rls_tr` ON (`tr_currency`, `_tenantid`);\n");
    }

    @Test
    void testRoleGuardIsRejected() {
        SecurityArea security = SecurityArea.builder()
                .policies(List.of(EmitterFixtures.policy(EmitterFixtures.TENANT_POLICY_ID, "admins",
                        JsonSupport.mapper().valueToTree(Map.of("op", "eq",
                                "args", List.of(Map.of("ref", "user.role"), Map.of("lit", "admin")))))))
                .tableSecurity(List.of(EmitterFixtures.applied(EmitterFixtures.TENANT_POLICY_ID, SecurityMode.FILTER)))
                .build();

        assertThatThrownBy(() -> new SparkEmitter(new TemplateRenderer())
                .emit(EmitterFixtures.projectWithSecurity("Databricks", security)))
                .isInstanceOf(CompilationException.class)
                .hasMessage("Session value USER_ROLE is not available on SPARK");
    }
}
