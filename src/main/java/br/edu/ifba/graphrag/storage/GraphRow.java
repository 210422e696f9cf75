package br.edu.ifba.graphrag.storage;

import br.edu.ifba.graphrag.utils.EmbeddingUtil;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One row returned by the knowledge graph store, with typed accessors.
 */
public final class GraphRow {

    private final Map<String, Object> values;

    public GraphRow(@NotNull Map<String, Object> values) {
        this.values = Objects.requireNonNull(values, "values must not be null");
    }

    @NotNull
    public Map<String, Object> values() {
        return values;
    }

    @Nullable
    public String groupId() {
        return getString(TenantScopedStatement.GROUP_ID);
    }

    @Nullable
    public String getString(@NotNull String key) {
        Object value = values.get(key);
        return value != null ? value.toString() : null;
    }

    @NotNull
    public String requireString(@NotNull String key) {
        String value = getString(key);
        if (value == null) {
            throw new IllegalStateException("Row is missing column '" + key + "'");
        }
        return value;
    }

    public double getDouble(@NotNull String key, double defaultValue) {
        Object value = values.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            return Double.parseDouble(text);
        }
        return defaultValue;
    }

    public int getInt(@NotNull String key, int defaultValue) {
        Object value = values.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        return defaultValue;
    }

    @NotNull
    public List<String> getStringList(@NotNull String key) {
        Object value = values.get(key);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<String> result = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }

    /**
     * Reads an embedding stored either as {@code float[]} or as a list of numbers.
     */
    @Nullable
    public float[] getEmbedding(@NotNull String key) {
        Object value = values.get(key);
        if (value instanceof float[] array) {
            return array.length > 0 ? array : null;
        }
        if (value instanceof List<?> list && !list.isEmpty()) {
            List<Number> numbers = new ArrayList<>(list.size());
            for (Object item : list) {
                numbers.add((Number) item);
            }
            return EmbeddingUtil.toFloatArray(numbers);
        }
        return null;
    }

    @Override
    public String toString() {
        return "GraphRow" + values.keySet();
    }
}
