package com.ozmeta.compiler.emit;

import java.io.IOException;

import org.junit.jupiter.api.Test;

import com.ozmeta.compiler.TestSnapshots;
import com.ozmeta.compiler.model.output.DriftRuleKind;
import com.ozmeta.compiler.model.output.EmitResult;
import com.ozmeta.compiler.model.output.EmittedFile;
import com.ozmeta.compiler.model.physical.TargetProjection;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PostgreSQL artifact generation.
 */
class PostgresEmitterTest {

    private final PostgresEmitter emitter = new PostgresEmitter(new TemplateRenderer());

    @Test
    void testCreateTableStatement() throws IOException {
        EmitResult result = emitter.emit(EmitterFixtures.project("Postgres"));
        String ddl = EmitterFixtures.contents(result, "sql/transaction.sql");

        assertThat(ddl).startsWith("-- Generated by ozmeta for default-Dev-Postgres-All-Local.Postgres. Do not edit.\n"
                + "CREATE TABLE IF NOT EXISTS \"dp\".\"transaction\" (\n"
                + "    \"tr_id\" uuid NOT NULL,\n"
                + "    \"tr_amount\" numeric(19,4) NOT NULL,\n"
                + "    \"tr_currency\" varchar(255),\n"
                + "    \"_tenantid\" uuid NOT NULL,\n");
        assertThat(ddl).contains("    CONSTRAINT \"pk_tr\" PRIMARY KEY (\"tr_id\")\n);\n");
        assertThat(ddl).contains("COMMENT ON COLUMN \"dp\".\"transaction\".\"tr_amount\" IS "
                + "'sensitivity: confidential, masked';\n");
    }

    @Test
    void testFileSet() throws IOException {
        EmitResult result = emitter.emit(EmitterFixtures.project("Postgres"));

        assertThat(result.getFiles())
                .extracting(EmittedFile::getPath)
                .containsExactlyInAnyOrder(SharedArtifacts.SCHEMAS_FILE, "sql/transaction.sql",
                        SharedArtifacts.DRIFT_RULES_FILE);
        assertThat(EmitterFixtures.contents(result, SharedArtifacts.SCHEMAS_FILE))
                .endsWith("CREATE SCHEMA IF NOT EXISTS \"dp\";\n");
    }

    @Test
    void testDriftRulesCoverObjectsTypesAndMandatoryFields() throws IOException {
        TargetProjection projection = EmitterFixtures.project("Postgres");
        EmitResult result = emitter.emit(projection);

        assertThat(result.getDriftRules())
                .filteredOn(r -> r.getKind() == DriftRuleKind.OBJECT_EXISTS)
                .hasSize(1);
        assertThat(result.getDriftRules())
                .filteredOn(r -> r.getKind() == DriftRuleKind.FIELD_TYPE)
                .hasSize(9);
        assertThat(result.getDriftRules())
                .filteredOn(r -> r.getKind() == DriftRuleKind.MANDATORY_FIELD)
                .hasSize(6);
        assertThat(EmitterFixtures.contents(result, SharedArtifacts.DRIFT_RULES_FILE))
                .contains("\"target\" : \"default-Dev-Postgres-All-Local.Postgres\"");
    }

    @Test
    void testEmissionIsDeterministic() throws IOException {
        EmitResult first = emitter.emit(EmitterFixtures.project("Postgres"));
        EmitResult second = emitter.emit(EmitterFixtures.project("Postgres"));

        assertThat(second.getFiles()).isEqualTo(first.getFiles());
    }

    @Test
    void testDeclaredForeignKeysBecomeDriftRules() throws IOException {
        EmitResult result = emitter.emit(EmitterFixtures.projectMultiTarget(TestSnapshots.POSTGRES_TP));

        assertThat(result.getDriftRules())
                .filteredOn(r -> r.getKind() == DriftRuleKind.FOREIGN_KEY)
                .singleElement()
                .satisfies(rule -> {
                    assertThat(rule.getObject()).isEqualTo("transaction");
                    assertThat(rule.getColumn()).isEqualTo("tr_customerid");
                    assertThat(rule.getConstraint()).isEqualTo("fk_tr_cu_tr_customerid");
                    assertThat(rule.getExpected()).isEqualTo("dp.customer.cu_id");
                });
        assertThat(result.getDriftRules())
                .noneMatch(r -> r.getKind() == DriftRuleKind.LOGICAL_FOREIGN_KEY);
    }

    @Test
    void testRowPoliciesCombineFilterAndWriteCheck() throws IOException {
        EmitResult result = emitter.emit(EmitterFixtures.projectSecured("Postgres"));

        assertThat(EmitterFixtures.contents(result, SharedArtifacts.RLS_FILE)).isEqualTo(
                "-- Generated by ozmeta for default-Dev-Postgres-All-Local.Postgres. Do not edit.\n"
                        + "-- rls_tr: currency_eur, tenant_isolation\n"
                        + "ALTER TABLE \"dp\".\"transaction\" ENABLE ROW LEVEL SECURITY;\n"
                        + "DROP POLICY IF EXISTS \"rls_tr\" ON \"dp\".\"transaction\";\n"
                        + "CREATE POLICY \"rls_tr\" ON \"dp\".\"transaction\" "
                        + "USING ((\"tr_currency\" = 'EUR') AND (\"_tenantid\" = CAST(current_setting('app.tenant_id') AS uuid))) "
                        + "WITH CHECK (\"_tenantid\" = CAST(current_setting('app.tenant_id') AS uuid));\n");
    }

    @Test
    void testNoRowPolicyFileWithoutSecurity() throws IOException {
        EmitResult result = emitter.emit(EmitterFixtures.project("Postgres"));

        assertThat(result.getFiles()).extracting(EmittedFile::getPath).doesNotContain(SharedArtifacts.RLS_FILE);
    }
}
