package br.edu.ifba.graphrag.query;

import br.edu.ifba.graphrag.core.GraphRagAnswer;
import br.edu.ifba.graphrag.core.TenantId;
import br.edu.ifba.graphrag.utils.TextNormalizer;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.Optional;

/**
 * Short-lived answer cache to avoid repeating identical queries.
 *
 * <h2>Cache Key Computation:</h2>
 * <p>The key is the tenant id plus a SHA-256 hash of:</p>
 * <ul>
 *   <li>Normalized query text</li>
 *   <li>Profile name</li>
 * </ul>
 *
 * <p>Only complete answers are stored: provisional and degraded answers, and answers without
 * evidence, are not, since a transient backend failure produces exactly those. A disabled
 * cache misses on every lookup.</p>
 */
public class QueryCacheService {

    private static final Logger logger = LoggerFactory.getLogger(QueryCacheService.class);

    private final Cache<CacheKey, GraphRagAnswer> cache;

    public QueryCacheService(boolean enabled, @NotNull Duration ttl, long maximumSize) {
        this.cache = enabled
            ? Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .build()
            : null;
    }

    public Optional<GraphRagAnswer> get(@NotNull TenantId tenant, @NotNull String query, @NotNull String profile) {
        if (cache == null) {
            return Optional.empty();
        }
        CacheKey key = key(tenant, query, profile);
        GraphRagAnswer cached = cache.getIfPresent(key);
        if (cached != null) {
            logger.debug("Query cache HIT for tenant={}, profile={}, hash={}", tenant, profile, key.hash().substring(0, 8));
        } else {
            logger.debug("Query cache MISS for tenant={}, profile={}, hash={}", tenant, profile, key.hash().substring(0, 8));
        }
        return Optional.ofNullable(cached);
    }

    public void store(@NotNull TenantId tenant, @NotNull String query, @NotNull String profile,
                      @NotNull GraphRagAnswer answer) {
        if (cache == null || !isCacheable(answer)) {
            return;
        }
        cache.put(key(tenant, query, profile), answer);
    }

    static boolean isCacheable(GraphRagAnswer answer) {
        return !answer.provisional() && !answer.degraded() && answer.hasEvidence();
    }

    public long size() {
        if (cache == null) {
            return 0;
        }
        cache.cleanUp();
        return cache.estimatedSize();
    }

    static CacheKey key(TenantId tenant, String query, String profile) {
        return new CacheKey(tenant, sha256Hash(TextNormalizer.normalize(query) + "|" + profile));
    }

    private static String sha256Hash(@NotNull String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));

            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    hexString.append('0');
                }
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    record CacheKey(TenantId tenant, String hash) {
    }
}
