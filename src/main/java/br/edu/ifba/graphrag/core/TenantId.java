package br.edu.ifba.graphrag.core;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Identifier of the tenant partition ({@code group_id}) a request runs in.
 * Every node and edge of the knowledge graph belongs to exactly one tenant.
 */
public record TenantId(@NotNull String value) {

    private static final Pattern VALID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.:-]{0,127}$");

    public TenantId {
        Objects.requireNonNull(value, "tenant id must not be null");
        if (!VALID.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid tenant id: '" + value + "'");
        }
    }

    public static TenantId of(@NotNull String value) {
        return new TenantId(value.trim());
    }

    @Override
    public String toString() {
        return value;
    }
}
