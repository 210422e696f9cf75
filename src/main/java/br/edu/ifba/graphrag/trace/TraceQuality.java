package br.edu.ifba.graphrag.trace;

/**
 * How the ranking of a trace was obtained.
 */
public enum TraceQuality {

    /** Query-guided beam search. */
    BEAM(false),

    /** Personalized PageRank computed by the store. */
    NATIVE(false),

    /** Closed-form distance-decay approximation of personalized PageRank. */
    APPROXIMATE(true),

    /** Seeds only, uniform weight. */
    SEED_ONLY(true);

    private final boolean degraded;

    TraceQuality(boolean degraded) {
        this.degraded = degraded;
    }

    public boolean isDegraded() {
        return degraded;
    }
}
