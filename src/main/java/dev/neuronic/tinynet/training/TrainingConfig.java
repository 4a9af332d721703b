package dev.neuronic.tinynet.training;

/**
 * Settings for one {@link dev.neuronic.tinynet.Model#train} call.
 *
 * <pre>{@code
 * TrainingConfig config = TrainingConfig.builder()
 *     .learningRate(0.01f)
 *     .batchSize(32)
 *     .epochs(10)
 *     .randomSeed(42)
 *     .build();
 * }</pre>
 */
public class TrainingConfig {
    public final int batchSize;
    public final int epochs;
    public final float learningRate;
    public final boolean dropLast;
    public final boolean shuffle;
    public final Long randomSeed; // null = use the dataset source's random

    private TrainingConfig(Builder builder) {
        this.batchSize = builder.batchSize;
        this.epochs = builder.epochs;
        this.learningRate = builder.learningRate;
        this.dropLast = builder.dropLast;
        this.shuffle = builder.shuffle;
        this.randomSeed = builder.randomSeed;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "TrainingConfig[batchSize=" + batchSize + ", epochs=" + epochs + ", learningRate=" + learningRate +
               ", dropLast=" + dropLast + ", shuffle=" + shuffle + ", randomSeed=" + randomSeed + "]";
    }

    public static class Builder {
        private int batchSize = 32;
        private int epochs = 1;
        private float learningRate = 0.01f;
        private boolean dropLast = false;
        private boolean shuffle = true;
        private Long randomSeed = null;

        public Builder batchSize(int batchSize) {
            if (batchSize <= 0)
                throw new IllegalArgumentException("Batch size must be positive");
            this.batchSize = batchSize;
            return this;
        }

        public Builder epochs(int epochs) {
            if (epochs < 0)
                throw new IllegalArgumentException("Epochs must be non-negative");
            this.epochs = epochs;
            return this;
        }

        public Builder learningRate(float learningRate) {
            if (!(learningRate > 0) || Float.isInfinite(learningRate))
                throw new IllegalArgumentException("Learning rate must be positive: " + learningRate);
            this.learningRate = learningRate;
            return this;
        }

        public Builder dropLast(boolean dropLast) {
            this.dropLast = dropLast;
            return this;
        }

        /**
         * Whether the train subset is reshuffled every epoch. The test subset is never shuffled.
         */
        public Builder shuffle(boolean shuffle) {
            this.shuffle = shuffle;
            return this;
        }

        public Builder randomSeed(long seed) {
            this.randomSeed = seed;
            return this;
        }

        public TrainingConfig build() {
            return new TrainingConfig(this);
        }
    }
}
