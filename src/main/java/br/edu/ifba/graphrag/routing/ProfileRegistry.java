package br.edu.ifba.graphrag.routing;

import br.edu.ifba.exception.UnknownProfileException;
import br.edu.ifba.graphrag.core.QueryRoute;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Route profiles loaded once at startup from a versioned JSON resource and immutable afterwards.
 */
@ApplicationScoped
public class ProfileRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ProfileRegistry.class);

    public static final String DEFAULT_PROFILE = "default";

    @ConfigProperty(name = "graphrag.profiles.resource", defaultValue = "profiles/query-profiles.json")
    String resource;

    @Inject
    ObjectMapper objectMapper;

    private volatile String version;
    private volatile Map<String, RouteProfile> profiles = Map.of();

    /**
     * Default constructor for CDI.
     */
    public ProfileRegistry() {
    }

    public ProfileRegistry(@NotNull String version, @NotNull List<RouteProfile> profiles) {
        install(version, profiles);
    }

    @PostConstruct
    void initialize() {
        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Profile configuration not found: " + resource);
            }
            ProfileFile file = objectMapper.readValue(in, ProfileFile.class);
            install(file.version(), file.toProfiles());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read profile configuration " + resource, e);
        }
        logger.info("Loaded {} route profile(s), version {}", profiles.size(), version);
    }

    private void install(String version, List<RouteProfile> loaded) {
        Map<String, RouteProfile> byName = new LinkedHashMap<>();
        for (RouteProfile profile : loaded) {
            if (byName.putIfAbsent(profile.name(), profile) != null) {
                throw new IllegalStateException("Duplicate profile: " + profile.name());
            }
        }
        if (!byName.containsKey(DEFAULT_PROFILE)) {
            throw new IllegalStateException("Profile configuration must define '" + DEFAULT_PROFILE + "'");
        }
        this.version = version;
        this.profiles = Collections.unmodifiableMap(byName);
    }

    /**
     * @param name profile name; null or blank selects the default profile
     * @throws UnknownProfileException if no profile has that name
     */
    @NotNull
    public RouteProfile get(@Nullable String name) {
        String key = name == null || name.isBlank() ? DEFAULT_PROFILE : name.trim();
        RouteProfile profile = profiles.get(key);
        if (profile == null) {
            throw new UnknownProfileException(key);
        }
        return profile;
    }

    @NotNull
    public Map<String, RouteProfile> profiles() {
        return profiles;
    }

    public String version() {
        return version;
    }

    record ProfileFile(String version, Map<String, ProfileEntry> profiles) {

        List<RouteProfile> toProfiles() {
            if (profiles == null) {
                return List.of();
            }
            return profiles.entrySet().stream()
                .map(e -> new RouteProfile(e.getKey(), e.getValue().description(),
                    new LinkedHashSet<>(e.getValue().routes())))
                .toList();
        }
    }

    record ProfileEntry(String description, @JsonProperty("allowedRoutes") List<QueryRoute> allowedRoutes) {

        Set<QueryRoute> routes() {
            return allowedRoutes != null ? new LinkedHashSet<>(allowedRoutes) : Set.of();
        }
    }
}
