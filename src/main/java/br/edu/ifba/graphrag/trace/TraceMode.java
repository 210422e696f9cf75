package br.edu.ifba.graphrag.trace;

public enum TraceMode {
    APPROXIMATE_RANK,
    BEAM_SEARCH
}
