package br.edu.ifba.graphrag.storage;

import br.edu.ifba.graphrag.core.TenantId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TenantScopedQueryBuilderTest {

    private static final TenantId TENANT = TenantId.of("acme");

    @Nested
    @DisplayName("Tenant binding")
    class TenantBinding {

        @Test
        @DisplayName("group_id is always injected from the tenant")
        void injectsGroupId() {
            final TenantScopedStatement statement = TenantScopedQueryBuilder.forTenant(TENANT)
                .statement(GraphQuery.ENTITIES_BY_ID)
                .param("entity_ids", List.of("e-1"))
                .build();

            assertEquals("acme", statement.params().get(TenantScopedStatement.GROUP_ID));
            assertEquals(TENANT, statement.tenant());
        }

        @Test
        @DisplayName("callers cannot override group_id")
        void rejectsGroupIdOverride() {
            final TenantScopedQueryBuilder builder = TenantScopedQueryBuilder.forTenant(TENANT)
                .statement(GraphQuery.ENTITIES_BY_ID);

            assertThrows(IllegalArgumentException.class, () -> builder.param("group_id", "globex"));
        }

        @Test
        @DisplayName("a tenant is mandatory")
        void requiresTenant() {
            assertThrows(NullPointerException.class, () -> TenantScopedQueryBuilder.forTenant(null));
        }
    }

    @Nested
    @DisplayName("Parameter validation")
    class ParameterValidation {

        @Test
        @DisplayName("missing required parameters fail the build")
        void missingParameter() {
            final TenantScopedQueryBuilder builder = TenantScopedQueryBuilder.forTenant(TENANT)
                .statement(GraphQuery.NEIGHBORS_BATCH)
                .param("entity_ids", List.of("e-1"));

            final IllegalStateException error = assertThrows(IllegalStateException.class, builder::build);
            assertTrue(error.getMessage().contains("limit_per_node"));
        }

        @Test
        @DisplayName("a statement must be chosen")
        void missingStatement() {
            assertThrows(IllegalStateException.class, () -> TenantScopedQueryBuilder.forTenant(TENANT).build());
        }

        @Test
        @DisplayName("collection parameters are copied")
        void copiesCollections() {
            final List<String> ids = new ArrayList<>(List.of("e-1"));
            final TenantScopedStatement statement = TenantScopedQueryBuilder.forTenant(TENANT)
                .statement(GraphQuery.ENTITIES_BY_ID)
                .param("entity_ids", ids)
                .build();
            ids.add("e-2");

            final List<String> bound = statement.param("entity_ids");
            assertEquals(List.of("e-1"), bound);
        }
    }

    @Test
    @DisplayName("every statement text filters on the tenant")
    void everyStatementFiltersOnGroupId() {
        for (GraphQuery query : GraphQuery.values()) {
            assertTrue(query.cypher().contains("$group_id"), query + " must filter on $group_id");
        }
    }
}
