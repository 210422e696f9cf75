package br.edu.ifba.exception;

/**
 * The knowledge graph store cannot be reached. Mapped to HTTP 503.
 */
public class KnowledgeGraphUnavailableException extends RuntimeException {

    public KnowledgeGraphUnavailableException(String message) {
        super(message);
    }

    public KnowledgeGraphUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
