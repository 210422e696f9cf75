package br.edu.ifba.graphrag.core;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Per-query execution parameters: tenant, profile, trace and synthesis budgets, timeouts
 * and the overall deadline.
 */
public final class QueryParam {

    /** Upper bound for the gap-fill loop regardless of configuration. */
    public static final int MAX_GAP_FILL_ITERATIONS = 2;

    @NotNull
    private final TenantId tenant;

    @NotNull
    private final String profile;

    private final int beamWidth;

    private final int maxHops;

    private final double damping;

    private final int maxIterations;

    private final int topK;

    private final int oneHopLimit;

    private final int twoHopLimit;

    private final int limitPerEntity;

    private final int gapFillIterations;

    private final double confidenceThreshold;

    private final int maxSubQuestions;

    private final int maxCandidatesPerMention;

    @NotNull
    private final Duration storeCallTimeout;

    @NotNull
    private final Duration embeddingCallTimeout;

    @NotNull
    private final Duration completionCallTimeout;

    @NotNull
    private final Instant deadline;

    private QueryParam(Builder builder) {
        this.tenant = builder.tenant;
        this.profile = builder.profile;
        this.beamWidth = builder.beamWidth;
        this.maxHops = builder.maxHops;
        this.damping = builder.damping;
        this.maxIterations = builder.maxIterations;
        this.topK = builder.topK;
        this.oneHopLimit = builder.oneHopLimit;
        this.twoHopLimit = builder.twoHopLimit;
        this.limitPerEntity = builder.limitPerEntity;
        this.gapFillIterations = Math.min(builder.gapFillIterations, MAX_GAP_FILL_ITERATIONS);
        this.confidenceThreshold = builder.confidenceThreshold;
        this.maxSubQuestions = builder.maxSubQuestions;
        this.maxCandidatesPerMention = builder.maxCandidatesPerMention;
        this.storeCallTimeout = builder.storeCallTimeout;
        this.embeddingCallTimeout = builder.embeddingCallTimeout;
        this.completionCallTimeout = builder.completionCallTimeout;
        this.deadline = builder.deadline != null
                ? builder.deadline
                : Instant.now().plus(builder.queryTimeout);
    }

    @NotNull
    public TenantId getTenant() {
        return tenant;
    }

    @NotNull
    public String getProfile() {
        return profile;
    }

    public int getBeamWidth() {
        return beamWidth;
    }

    public int getMaxHops() {
        return maxHops;
    }

    public double getDamping() {
        return damping;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public int getTopK() {
        return topK;
    }

    public int getOneHopLimit() {
        return oneHopLimit;
    }

    public int getTwoHopLimit() {
        return twoHopLimit;
    }

    public int getLimitPerEntity() {
        return limitPerEntity;
    }

    public int getGapFillIterations() {
        return gapFillIterations;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public int getMaxSubQuestions() {
        return maxSubQuestions;
    }

    public int getMaxCandidatesPerMention() {
        return maxCandidatesPerMention;
    }

    @NotNull
    public Duration getStoreCallTimeout() {
        return storeCallTimeout;
    }

    @NotNull
    public Duration getEmbeddingCallTimeout() {
        return embeddingCallTimeout;
    }

    @NotNull
    public Duration getCompletionCallTimeout() {
        return completionCallTimeout;
    }

    @NotNull
    public Instant getDeadline() {
        return deadline;
    }

    /**
     * @return true once the overall query deadline has passed
     */
    public boolean isDeadlineReached() {
        return !Instant.now().isBefore(deadline);
    }

    /**
     * Time left before the deadline, never negative.
     */
    @NotNull
    public Duration remaining() {
        Duration left = Duration.between(Instant.now(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder initialized with this instance's values, including the deadline.
     */
    public Builder toBuilder() {
        return new Builder()
                .tenant(tenant)
                .profile(profile)
                .beamWidth(beamWidth)
                .maxHops(maxHops)
                .damping(damping)
                .maxIterations(maxIterations)
                .topK(topK)
                .oneHopLimit(oneHopLimit)
                .twoHopLimit(twoHopLimit)
                .limitPerEntity(limitPerEntity)
                .gapFillIterations(gapFillIterations)
                .confidenceThreshold(confidenceThreshold)
                .maxSubQuestions(maxSubQuestions)
                .maxCandidatesPerMention(maxCandidatesPerMention)
                .storeCallTimeout(storeCallTimeout)
                .embeddingCallTimeout(embeddingCallTimeout)
                .completionCallTimeout(completionCallTimeout)
                .deadline(deadline);
    }

    /**
     * Builder for QueryParam instances.
     */
    public static class Builder {
        private TenantId tenant;
        private String profile = "default";
        private int beamWidth = 10;
        private int maxHops = 3;
        private double damping = 0.85;
        private int maxIterations = 20;
        private int topK = 20;
        private int oneHopLimit = 25;
        private int twoHopLimit = 10;
        private int limitPerEntity = 12;
        private int gapFillIterations = 1;
        private double confidenceThreshold = 0.6;
        private int maxSubQuestions = 3;
        private int maxCandidatesPerMention = 3;
        private Duration storeCallTimeout = Duration.ofSeconds(5);
        private Duration embeddingCallTimeout = Duration.ofSeconds(10);
        private Duration completionCallTimeout = Duration.ofSeconds(45);
        private Duration queryTimeout = Duration.ofSeconds(90);
        private Instant deadline;

        public Builder tenant(@NotNull TenantId tenant) {
            this.tenant = Objects.requireNonNull(tenant);
            return this;
        }

        public Builder profile(@NotNull String profile) {
            this.profile = Objects.requireNonNull(profile);
            return this;
        }

        public Builder beamWidth(int beamWidth) {
            if (beamWidth < 1) {
                throw new IllegalArgumentException("beamWidth must be positive");
            }
            this.beamWidth = beamWidth;
            return this;
        }

        public Builder maxHops(int maxHops) {
            if (maxHops < 0) {
                throw new IllegalArgumentException("maxHops must not be negative");
            }
            this.maxHops = maxHops;
            return this;
        }

        public Builder damping(double damping) {
            if (damping <= 0.0 || damping >= 1.0) {
                throw new IllegalArgumentException("damping must be in (0, 1)");
            }
            this.damping = damping;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder topK(int topK) {
            if (topK < 1) {
                throw new IllegalArgumentException("topK must be positive");
            }
            this.topK = topK;
            return this;
        }

        public Builder oneHopLimit(int oneHopLimit) {
            this.oneHopLimit = oneHopLimit;
            return this;
        }

        public Builder twoHopLimit(int twoHopLimit) {
            this.twoHopLimit = twoHopLimit;
            return this;
        }

        public Builder limitPerEntity(int limitPerEntity) {
            this.limitPerEntity = limitPerEntity;
            return this;
        }

        public Builder gapFillIterations(int gapFillIterations) {
            if (gapFillIterations < 0) {
                throw new IllegalArgumentException("gapFillIterations must not be negative");
            }
            this.gapFillIterations = gapFillIterations;
            return this;
        }

        public Builder confidenceThreshold(double confidenceThreshold) {
            this.confidenceThreshold = confidenceThreshold;
            return this;
        }

        public Builder maxSubQuestions(int maxSubQuestions) {
            this.maxSubQuestions = maxSubQuestions;
            return this;
        }

        public Builder maxCandidatesPerMention(int maxCandidatesPerMention) {
            this.maxCandidatesPerMention = maxCandidatesPerMention;
            return this;
        }

        public Builder storeCallTimeout(@NotNull Duration storeCallTimeout) {
            this.storeCallTimeout = Objects.requireNonNull(storeCallTimeout);
            return this;
        }

        public Builder embeddingCallTimeout(@NotNull Duration embeddingCallTimeout) {
            this.embeddingCallTimeout = Objects.requireNonNull(embeddingCallTimeout);
            return this;
        }

        public Builder completionCallTimeout(@NotNull Duration completionCallTimeout) {
            this.completionCallTimeout = Objects.requireNonNull(completionCallTimeout);
            return this;
        }

        /**
         * Overall budget measured from {@link #build()}; ignored when an explicit deadline is set.
         */
        public Builder queryTimeout(@NotNull Duration queryTimeout) {
            this.queryTimeout = Objects.requireNonNull(queryTimeout);
            return this;
        }

        public Builder deadline(@NotNull Instant deadline) {
            this.deadline = Objects.requireNonNull(deadline);
            return this;
        }

        public QueryParam build() {
            if (tenant == null) {
                throw new IllegalStateException("tenant is required");
            }
            return new QueryParam(this);
        }
    }
}
