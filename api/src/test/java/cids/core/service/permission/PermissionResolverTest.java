package cids.core.service.permission;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import cids.core.model.capability.CapabilityGraph;
import cids.core.model.capability.Endpoint;
import cids.core.model.capability.FieldMetadata;
import cids.core.model.capability.SensitivityCategory;
import cids.core.model.permission.Grant;
import cids.core.model.role.FilterOperator;
import cids.core.model.role.GroupRoleMapping;
import cids.core.model.role.RlsFilter;
import cids.core.model.role.Role;
import cids.core.model.role.RoleSnapshot;

@DisplayName("PermissionResolver")
class PermissionResolverTest {

    private static final String CLIENT = "hr-app";

    private PermissionResolver resolver;
    private CapabilityGraph graph;

    @BeforeEach
    void setUp() {
        resolver = new PermissionResolver();

        final var employeeFields = new LinkedHashMap<String, FieldMetadata>();
        employeeFields.put("id", FieldMetadata.of("id", SensitivityCategory.BASE));
        employeeFields.put("name", FieldMetadata.of("name", SensitivityCategory.BASE));
        employeeFields.put("email", FieldMetadata.of("email", SensitivityCategory.PII));
        employeeFields.put("salary", FieldMetadata.of("salary", SensitivityCategory.FINANCIAL));
        employeeFields.put("diagnosis", FieldMetadata.of("diagnosis", SensitivityCategory.PHI));

        graph = new CapabilityGraph(
                CLIENT,
                "HR",
                3L,
                null,
                null,
                List.of(
                        new Endpoint(
                                "/api/employees",
                                "GET",
                                "employees",
                                "read",
                                "",
                                List.of("id", "name", "email", "salary", "diagnosis")),
                        new Endpoint("/api/employees/{id}", "PUT", "employees", "update", "", List.of("id", "name")),
                        new Endpoint("/api/employees/{id}", "DELETE", "employees", "delete", "", List.of())),
                Map.of("employees", employeeFields));
    }

    private static Role role(String name, int priority, String... grants) {
        final var builder = Role.builder(CLIENT, name).priority(priority);
        for (var grant : grants) {
            builder.grant(Grant.parse(grant));
        }
        return builder.build();
    }

    private static RoleSnapshot snapshot(List<Role> roles, GroupRoleMapping... mappings) {
        return new RoleSnapshot(CLIENT, roles, List.of(mappings));
    }

    private static GroupRoleMapping mapping(String group, String role) {
        return new GroupRoleMapping(CLIENT, group, role);
    }

    @Nested
    @DisplayName("expansion")
    class Expansion {

        @Test
        @DisplayName("should expand a base grant to the base category and its fields")
        void shouldExpandBaseGrant() {
            final var roles = List.of(role("viewer", 0, "employees.read"));

            final var result = resolver.resolve(Set.of("Staff"), snapshot(roles, mapping("Staff", "viewer")), graph);

            assertEquals(
                    List.of("employees.read", "employees.read.base", "employees.read.id", "employees.read.name"),
                    result.permissions());
            assertEquals(3L, result.graphVersion());
            assertEquals(List.of("viewer"), result.roles());
        }

        @Test
        @DisplayName("should add category fields on top of base access")
        void shouldExpandCategoryGrant() {
            final var roles = List.of(role("hr", 0, "employees.read.pii"));

            final var result = resolver.resolve(Set.of("HR"), snapshot(roles, mapping("HR", "hr")), graph);

            assertTrue(result.permissions().contains("employees.read.pii"));
            assertTrue(result.permissions().contains("employees.read.email"));
            assertTrue(result.permissions().contains("employees.read.name"));
            assertFalse(result.permissions().contains("employees.read.salary"));
        }

        @Test
        @DisplayName("should grant every field for a wildcard grant")
        void shouldExpandWildcard() {
            final var roles = List.of(role("admin", 0, "employees.read.*"));

            final var result = resolver.resolve(Set.of("Admins"), snapshot(roles, mapping("Admins", "admin")), graph);

            assertTrue(result.permissions().contains("employees.read.diagnosis"));
            assertTrue(result.permissions().contains("employees.read.phi"));
            assertTrue(result.permissions().contains("employees.read.financial"));
        }

        @Test
        @DisplayName("should grant only the base action when the action returns no fields")
        void shouldGrantBaseOnlyForFieldlessAction() {
            final var roles = List.of(role("cleaner", 0, "employees.delete"), role("auditor", 0, "employees.delete.pii"));

            final var result = resolver.resolve(
                    Set.of("Ops"), snapshot(roles, mapping("Ops", "cleaner"), mapping("Ops", "auditor")), graph);

            assertEquals(
                    List.of("employees.delete", "employees.delete.base", "employees.delete.pii"), result.permissions());
            assertFalse(result.permissions().contains("employees.delete.email"));
            assertFalse(result.permissions().contains("employees.delete.id"));
        }

        @Test
        @DisplayName("should only reach the fields an action's endpoints return")
        void shouldScopeFieldsToAction() {
            final var roles = List.of(role("editor", 0, "employees.update.*"));

            final var result = resolver.resolve(Set.of("Editors"), snapshot(roles, mapping("Editors", "editor")), graph);

            assertTrue(result.permissions().contains("employees.update.name"));
            assertFalse(result.permissions().contains("employees.update.salary"));
            assertFalse(result.permissions().contains("employees.update.email"));
        }

        @Test
        @DisplayName("should treat a field grant on an action that does not return it as stale")
        void shouldReportFieldOutsideAction() {
            final var roles = List.of(role("editor", 0, "employees.update.salary"));

            assertEquals(List.of("editor:employees.update.salary"), resolver.staleGrants(roles, graph));
        }

        @Test
        @DisplayName("should return nothing when no group maps to a role")
        void shouldReturnEmptyWithoutMappings() {
            final var roles = List.of(role("viewer", 0, "employees.read"));

            final var result = resolver.resolve(Set.of("Other"), snapshot(roles, mapping("Staff", "viewer")), graph);

            assertTrue(result.isEmpty());
        }

        @Test
        @DisplayName("should report grants that no longer match the graph as stale")
        void shouldReportStaleGrants() {
            final var roles = List.of(role("viewer", 0, "employees.read", "payroll.read"));

            final var result = resolver.resolve(Set.of("Staff"), snapshot(roles, mapping("Staff", "viewer")), graph);

            assertEquals(List.of("viewer:payroll.read"), result.staleReferences());
            assertFalse(result.permissions().contains("payroll.read"));
        }

        @Test
        @DisplayName("should ignore inactive and service-only roles")
        void shouldIgnoreInactiveAndA2aRoles() {
            final var inactive = role("inactive", 0, "employees.read").toBuilder().active(false).build();
            final var service = role("svc", 0, "employees.update").toBuilder().a2aOnly(true).build();

            final var result = resolver.resolve(
                    Set.of("Staff"),
                    snapshot(List.of(inactive, service), mapping("Staff", "inactive"), mapping("Staff", "svc")),
                    graph);

            assertTrue(result.isEmpty());
        }
    }

    @Nested
    @DisplayName("denials")
    class Denials {

        @Test
        @DisplayName("should let a deny from a low-priority role override a high-priority allow")
        void shouldDenyAcrossRoles() {
            final var roles = List.of(
                    role("admin", 100, "employees.read.*"), role("restricted", 1, "!employees.read.phi"));

            final var result = resolver.resolve(
                    Set.of("Admins", "Contractors"),
                    snapshot(roles, mapping("Admins", "admin"), mapping("Contractors", "restricted")),
                    graph);

            assertFalse(result.permissions().contains("employees.read.phi"));
            assertFalse(result.permissions().contains("employees.read.diagnosis"));
            assertTrue(result.permissions().contains("employees.read.salary"));
        }

        @Test
        @DisplayName("should remove a whole action when its base permission is denied")
        void shouldDenyBase() {
            final var roles = List.of(role("editor", 0, "employees.read", "employees.update", "!employees.update"));

            final var result = resolver.resolve(Set.of("Editors"), snapshot(roles, mapping("Editors", "editor")), graph);

            assertTrue(result.permissions().contains("employees.read"));
            assertTrue(result.permissions().stream().noneMatch(p -> p.startsWith("employees.update")));
        }

        @Test
        @DisplayName("should remove a single denied field")
        void shouldDenyField() {
            final var roles = List.of(role("hr", 0, "employees.read.pii", "!employees.read.email"));

            final var result = resolver.resolve(Set.of("HR"), snapshot(roles, mapping("HR", "hr")), graph);

            assertFalse(result.permissions().contains("employees.read.email"));
            assertFalse(result.permissions().contains("employees.read.pii"));
            assertTrue(result.permissions().contains("employees.read.name"));
        }
    }

    @Nested
    @DisplayName("default role and filters")
    class DefaultRoleAndFilters {

        private RlsFilter filter(String id, String expression, int priority) {
            return new RlsFilter(id, "employees", "read", null, expression, FilterOperator.AND, priority);
        }

        @Test
        @DisplayName("should apply the default role to every principal")
        void shouldApplyDefaultRole() {
            final var everyone = role("everyone", 0, "employees.read").toBuilder().defaultRole(true).build();

            final var result = resolver.resolve(Set.of(), snapshot(List.of(everyone)), graph);

            assertEquals(List.of("everyone"), result.roles());
            assertTrue(result.permissions().contains("employees.read"));
        }

        @Test
        @DisplayName("should drop default role filters when a group role filters the same key")
        void shouldPreferGroupFilters() {
            final var everyone = role("everyone", 0, "employees.read").toBuilder()
                    .defaultRole(true)
                    .rlsFilter(filter("f1", "id = @current_user_id", 0))
                    .build();
            final var manager = role("manager", 10, "employees.read").toBuilder()
                    .rlsFilter(filter("f2", "department = @current_user_department", 0))
                    .build();

            final var result = resolver.resolve(
                    Set.of("Managers"), snapshot(List.of(everyone, manager), mapping("Managers", "manager")), graph);

            assertEquals(
                    Map.of("employees.read", List.of("department = @current_user_department")), result.rlsFilters());
            assertEquals(Map.of("employees.read", List.of("AND")), result.rlsOperators());
        }

        @Test
        @DisplayName("should order filters by role precedence then filter priority")
        void shouldOrderFilters() {
            final var low = role("low", 1, "employees.read").toBuilder()
                    .rlsFilter(filter("a", "id = @current_user_id", 0))
                    .build();
            final var high = role("high", 5, "employees.read").toBuilder()
                    .rlsFilter(filter("b", "active = true", 1))
                    .rlsFilter(filter("c", "region = 'EU'", 9))
                    .build();

            final var result = resolver.resolve(
                    Set.of("G"), snapshot(List.of(low, high), mapping("G", "low"), mapping("G", "high")), graph);

            assertEquals(
                    List.of("region = 'EU'", "active = true", "id = @current_user_id"),
                    result.rlsFilters().get("employees.read"));
        }

        @Test
        @DisplayName("should omit filters for actions that were not granted")
        void shouldOmitUngrantedFilters() {
            final var viewer = role("viewer", 0, "employees.update").toBuilder()
                    .rlsFilter(filter("a", "id = @current_user_id", 0))
                    .build();

            final var result = resolver.resolve(Set.of("G"), snapshot(List.of(viewer), mapping("G", "viewer")), graph);

            assertTrue(result.rlsFilters().isEmpty());
        }
    }

    @Nested
    @DisplayName("staleGrants()")
    class StaleGrants {

        @Test
        @DisplayName("should list grants whose field disappeared")
        void shouldListMissingField() {
            final var roles = List.of(role("hr", 0, "employees.read.ssn", "employees.read.email"));

            assertEquals(List.of("hr:employees.read.ssn"), resolver.staleGrants(roles, graph));
        }

        @Test
        @DisplayName("should treat every grant as stale without a graph")
        void shouldTreatAllAsStaleWithoutGraph() {
            final var roles = List.of(role("hr", 0, "employees.read"));

            assertEquals(List.of("hr:employees.read"), resolver.staleGrants(roles, null));
        }
    }
}
