package org.satpath.solver;

import org.satpath.encoding.NodeRepetitionPolicy;
import org.satpath.encoding.WeightBoundPolicy;
import org.satpath.oracle.CdclOracle;
import org.satpath.oracle.SatOracle;

/**
 * CONFIGURAZIONE DELLA RICERCA - Parametri immutabili dei solutori iterativi
 *
 * • oracle: oracolo SAT usato per ogni probe
 * • repetitionPolicy: variante del vincolo di unicità dei nodi (solo ricerca non pesata)
 * • boundPolicy: trattamento del limite di peso (solo ricerca pesata)
 * • parallelism: numero di lunghezze provate in parallelo (1 = sequenziale)
 */
public final class PathSearchConfiguration {

    //region VALORI DI DEFAULT

    public static final NodeRepetitionPolicy DEFAULT_REPETITION_POLICY = NodeRepetitionPolicy.FULL_PAIRWISE;

    public static final WeightBoundPolicy DEFAULT_BOUND_POLICY = WeightBoundPolicy.ENFORCED;

    public static final int DEFAULT_PARALLELISM = 1;

    public static final int MIN_PARALLELISM = 1;

    //endregion

    private final SatOracle oracle;

    private final NodeRepetitionPolicy repetitionPolicy;

    private final WeightBoundPolicy boundPolicy;

    private final int parallelism;

    private PathSearchConfiguration(Builder builder) {
        this.oracle = builder.oracle != null ? builder.oracle : new CdclOracle();
        this.repetitionPolicy = builder.repetitionPolicy;
        this.boundPolicy = builder.boundPolicy;
        this.parallelism = builder.parallelism;
    }

    public static PathSearchConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public SatOracle getOracle() {
        return oracle;
    }

    public NodeRepetitionPolicy getRepetitionPolicy() {
        return repetitionPolicy;
    }

    public WeightBoundPolicy getBoundPolicy() {
        return boundPolicy;
    }

    public int getParallelism() {
        return parallelism;
    }

    public boolean isParallel() {
        return parallelism > 1;
    }

    @Override
    public String toString() {
        return String.format("PathSearchConfiguration[oracle=%s, ripetizione=%s, limite=%s, parallelismo=%d]",
                oracle.name(), repetitionPolicy, boundPolicy, parallelism);
    }

    public static final class Builder {

        private SatOracle oracle;

        private NodeRepetitionPolicy repetitionPolicy = DEFAULT_REPETITION_POLICY;

        private WeightBoundPolicy boundPolicy = DEFAULT_BOUND_POLICY;

        private int parallelism = DEFAULT_PARALLELISM;

        private Builder() {
        }

        public Builder oracle(SatOracle oracle) {
            this.oracle = oracle;
            return this;
        }

        public Builder repetitionPolicy(NodeRepetitionPolicy repetitionPolicy) {
            if (repetitionPolicy == null) {
                throw new IllegalArgumentException("Politica di ripetizione non può essere null");
            }
            this.repetitionPolicy = repetitionPolicy;
            return this;
        }

        public Builder boundPolicy(WeightBoundPolicy boundPolicy) {
            if (boundPolicy == null) {
                throw new IllegalArgumentException("Politica del limite non può essere null");
            }
            this.boundPolicy = boundPolicy;
            return this;
        }

        /**
         * @throws IllegalArgumentException se parallelism &lt; 1
         */
        public Builder parallelism(int parallelism) {
            if (parallelism < MIN_PARALLELISM) {
                throw new IllegalArgumentException("Parallelismo deve essere >= " + MIN_PARALLELISM + ", ricevuto: " + parallelism);
            }
            this.parallelism = parallelism;
            return this;
        }

        public PathSearchConfiguration build() {
            return new PathSearchConfiguration(this);
        }
    }
}
