package br.edu.ifba.graphrag.disambiguation;

/**
 * Disambiguation strategies in cascade order. A mention is resolved by the first strategy
 * that yields at least one candidate.
 */
public enum MatchStrategy {

    /** Case-insensitive equality with the entity name. */
    EXACT(1.0),

    /** Case-insensitive equality with one of the entity aliases. */
    ALIAS(0.9),

    /** Equality with the key of an extracted key-value field linked to the entity. */
    STRUCTURED_FIELD(0.8),

    /** Name contains the mention or the mention contains the name; overlap of at least 3 characters. */
    SUBSTRING(0.6),

    /** Jaccard token overlap above 0.5; confidence is half the overlap. */
    TOKEN_OVERLAP(0.5),

    /** Cosine similarity of embeddings above 0.75; confidence is the similarity. */
    VECTOR_SIMILARITY(1.0);

    private final double confidence;

    MatchStrategy(double confidence) {
        this.confidence = confidence;
    }

    /**
     * Fixed confidence for the lookup strategies, or the scaling factor for the scored ones.
     */
    public double confidence() {
        return confidence;
    }
}
