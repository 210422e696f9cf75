package br.edu.ifba.graphrag.core;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.time.Duration;
import java.util.List;

/**
 * Pipeline configuration.
 *
 * All properties are read from application.properties with the prefix "graphrag".
 */
@ConfigMapping(prefix = "graphrag")
public interface GraphRagConfig {

    Storage storage();

    Profiles profiles();

    Disambiguation disambiguation();

    Trace trace();

    Synthesis synthesis();

    MultiHop multiHop();

    Timeouts timeouts();

    Cache cache();

    Pipeline pipeline();

    /**
     * Validates configuration at startup.
     * Throws IllegalArgumentException if invalid.
     */
    default void validate() {
        if (trace().damping() <= 0.0 || trace().damping() >= 1.0) {
            throw new IllegalArgumentException(
                String.format("Damping must be in (0.0, 1.0), got %.3f", trace().damping()));
        }
        if (synthesis().gapFillIterations() > QueryParam.MAX_GAP_FILL_ITERATIONS) {
            throw new IllegalArgumentException(
                String.format("Gap-fill iterations must not exceed %d, got %d",
                    QueryParam.MAX_GAP_FILL_ITERATIONS, synthesis().gapFillIterations()));
        }
        if (timeouts().queryDeadline().isNegative() || timeouts().queryDeadline().isZero()) {
            throw new IllegalArgumentException("Query deadline must be positive");
        }
    }

    /**
     * Storage backend selection. The backend itself is a build-time property.
     */
    interface Storage {

        @WithDefault("memory")
        String backend();

        Memory memory();

        Age age();

        interface Memory {
            /**
             * Classpath resource or file path of the JSON graph snapshot.
             */
            @WithDefault("graph/sample-graph.json")
            String snapshot();

            @WithDefault("NATIVE_RANKING,VECTOR_INDEX")
            List<String> capabilities();
        }

        interface Age {
            @WithDefault("knowledge_graph")
            String graphName();

            /**
             * Comma separated capabilities, or "none".
             */
            @WithDefault("none")
            String capabilities();
        }
    }

    interface Profiles {
        @WithDefault("profiles/query-profiles.json")
        String resource();
    }

    interface Disambiguation {

        @WithDefault("3")
        @Min(1)
        int maxCandidatesPerMention();

        /**
         * "heuristic" or "llm".
         */
        @WithDefault("heuristic")
        String mentionExtractor();
    }

    interface Trace {

        @WithDefault("10")
        @Min(1)
        int beamWidth();

        @WithDefault("3")
        @Min(1)
        int maxHops();

        @WithDefault("0.85")
        double damping();

        /**
         * Upper bound only; the approximation is a closed-form single pass.
         */
        @WithDefault("20")
        @Min(1)
        int maxIterations();

        @WithDefault("20")
        @Min(1)
        int topK();

        @WithDefault("25")
        @Min(1)
        int oneHopLimit();

        @WithDefault("10")
        @Min(1)
        int twoHopLimit();
    }

    interface Synthesis {

        @WithDefault("12")
        @Min(1)
        int limitPerEntity();

        @WithDefault("1")
        @Min(0)
        int gapFillIterations();

        @WithDefault("0.6")
        @Min(0)
        @Max(1)
        double confidenceThreshold();
    }

    interface MultiHop {
        @WithDefault("3")
        @Min(1)
        int maxSubQuestions();
    }

    interface Timeouts {

        @WithDefault("5S")
        Duration storeCall();

        @WithDefault("10S")
        Duration embeddingCall();

        @WithDefault("45S")
        Duration completionCall();

        @WithDefault("90S")
        Duration queryDeadline();
    }

    interface Cache {

        @WithDefault("true")
        boolean enabled();

        @WithDefault("60S")
        Duration ttl();

        @WithDefault("1000")
        long maximumSize();
    }

    interface Pipeline {
        @WithDefault("16")
        int threads();
    }
}
