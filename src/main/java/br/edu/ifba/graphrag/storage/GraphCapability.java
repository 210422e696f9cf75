package br.edu.ifba.graphrag.storage;

/**
 * Optional capabilities a knowledge graph store may offer.
 */
public enum GraphCapability {

    /**
     * Server-side personalized PageRank.
     */
    NATIVE_RANKING,

    /**
     * Vector index over entity and chunk embeddings.
     */
    VECTOR_INDEX
}
