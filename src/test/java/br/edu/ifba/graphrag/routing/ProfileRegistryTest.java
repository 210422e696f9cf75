package br.edu.ifba.graphrag.routing;

import br.edu.ifba.exception.UnknownProfileException;
import br.edu.ifba.graphrag.TestGraphs;
import br.edu.ifba.graphrag.core.QueryRoute;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProfileRegistryTest {

    private static RouteProfile profile(String name, QueryRoute... routes) {
        return new RouteProfile(name, name + " profile", Set.of(routes));
    }

    @Nested
    @DisplayName("Lookup")
    class Lookup {

        private final ProfileRegistry registry = new ProfileRegistry("test", List.of(
            profile("default", QueryRoute.values()),
            profile("speed-critical", QueryRoute.DIRECT_VECTOR_LOOKUP, QueryRoute.LOCAL_GRAPH_SEARCH)));

        @Test
        @DisplayName("null or blank names select the default profile")
        void defaultProfile() {
            assertEquals("default", registry.get(null).name());
            assertEquals("default", registry.get("  ").name());
        }

        @Test
        @DisplayName("profiles are found by name")
        void byName() {
            final RouteProfile profile = registry.get("speed-critical");

            assertTrue(profile.permits(QueryRoute.DIRECT_VECTOR_LOOKUP));
            assertFalse(profile.permits(QueryRoute.MULTI_HOP_DISCOVERY));
        }

        @Test
        @DisplayName("unknown names are rejected")
        void unknown() {
            assertThrows(UnknownProfileException.class, () -> registry.get("fastest"));
        }

        @Test
        @DisplayName("the profile map cannot be modified")
        void immutable() {
            assertThrows(UnsupportedOperationException.class, () -> registry.profiles().clear());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("a default profile is required")
        void requiresDefault() {
            assertThrows(IllegalStateException.class, () -> new ProfileRegistry("v1",
                List.of(profile("speed-critical", QueryRoute.LOCAL_GRAPH_SEARCH))));
        }

        @Test
        @DisplayName("duplicate names are rejected")
        void duplicates() {
            assertThrows(IllegalStateException.class, () -> new ProfileRegistry("v1", List.of(
                profile("default", QueryRoute.LOCAL_GRAPH_SEARCH),
                profile("default", QueryRoute.GLOBAL_SUMMARY_SEARCH))));
        }

        @Test
        @DisplayName("a profile must allow at least one route")
        void emptyProfile() {
            assertThrows(IllegalArgumentException.class,
                () -> new RouteProfile("empty", "", EnumSet.noneOf(QueryRoute.class)));
        }
    }

    @Test
    @DisplayName("the bundled configuration defines the three standard profiles")
    void bundledConfiguration() {
        final ProfileRegistry registry = new ProfileRegistry();
        registry.resource = "profiles/query-profiles.json";
        registry.objectMapper = TestGraphs.objectMapper();

        registry.initialize();

        assertEquals(Set.of("default", "high-assurance", "speed-critical"), registry.profiles().keySet());
        assertFalse(registry.get("high-assurance").permits(QueryRoute.DIRECT_VECTOR_LOOKUP));
        assertFalse(registry.get("speed-critical").permits(QueryRoute.MULTI_HOP_DISCOVERY));
        assertEquals(EnumSet.allOf(QueryRoute.class), registry.get("default").allowedRoutes());
        assertTrue(registry.version() != null && !registry.version().isBlank());
    }
}
