package br.edu.ifba.graphrag.storage.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * JSON image of a multi-tenant knowledge graph, keyed by tenant ({@code group_id}).
 * Loaded by the in-memory store; produced by the ingestion side, which is not part of
 * this service.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GraphSnapshot(Map<String, TenantSnapshot> tenants) {

    public GraphSnapshot {
        tenants = tenants != null ? Map.copyOf(tenants) : Map.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TenantSnapshot(
        List<DocumentNode> documents,
        List<SectionNode> sections,
        List<ChunkNode> chunks,
        List<EntityNode> entities,
        List<MentionEdge> mentions,
        List<RelationEdge> relations,
        List<SimilarityEdge> sectionSimilarities,
        List<KeyValueNode> keyValuePairs
    ) {
        public TenantSnapshot {
            documents = documents != null ? List.copyOf(documents) : List.of();
            sections = sections != null ? List.copyOf(sections) : List.of();
            chunks = chunks != null ? List.copyOf(chunks) : List.of();
            entities = entities != null ? List.copyOf(entities) : List.of();
            mentions = mentions != null ? List.copyOf(mentions) : List.of();
            relations = relations != null ? List.copyOf(relations) : List.of();
            sectionSimilarities = sectionSimilarities != null ? List.copyOf(sectionSimilarities) : List.of();
            keyValuePairs = keyValuePairs != null ? List.copyOf(keyValuePairs) : List.of();
        }
    }

    public record DocumentNode(String id, String title, String url) {}

    public record SectionNode(String id, String documentId, String title, List<String> path) {}

    public record ChunkNode(String id, String documentId, String sectionId, int ordinal, String text, List<Float> embedding) {}

    public record EntityNode(String id, String name, List<String> aliases, List<Float> embedding) {}

    /** Chunk to entity provenance edge. */
    public record MentionEdge(String chunkId, String entityId) {}

    /** Undirected entity relation; duplicates in either direction collapse to one edge. */
    public record RelationEdge(String source, String target, Double weight) {}

    public record SimilarityEdge(String source, String target, double weight) {}

    /** Key-value field extracted from a document, linked to the entity it describes. */
    public record KeyValueNode(String key, String value, String entityId) {}
}
