package org.satpath.baseline;

/**
 * Distanza di Dijkstra: raggiunta con un valore, oppure non raggiunta.
 *
 * Sostituisce la sentinella "infinito": i confronti passano da {@link #compareTo},
 * dove una distanza non raggiunta è maggiore di qualsiasi distanza raggiunta.
 */
public interface Distance extends Comparable<Distance> {

    static Distance reached(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Distanza negativa: " + value);
        }
        return new Reached(value);
    }

    static Distance unreached() {
        return Unreached.INSTANCE;
    }

    boolean isReached();

    /**
     * @throws IllegalStateException se la distanza non è raggiunta
     */
    long value();

    /**
     * @return distanza estesa di un arco; una distanza non raggiunta resta tale
     */
    Distance plus(long weight);

    @Override
    default int compareTo(Distance other) {
        if (isReached() && other.isReached()) {
            return Long.compare(value(), other.value());
        }
        return Boolean.compare(!isReached(), !other.isReached());
    }

    record Reached(long value) implements Distance {

        @Override
        public boolean isReached() {
            return true;
        }

        @Override
        public Distance plus(long weight) {
            return Distance.reached(value + weight);
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    final class Unreached implements Distance {

        private static final Unreached INSTANCE = new Unreached();

        private Unreached() {
        }

        @Override
        public boolean isReached() {
            return false;
        }

        @Override
        public long value() {
            throw new IllegalStateException("Distanza non raggiunta");
        }

        @Override
        public Distance plus(long weight) {
            return this;
        }

        @Override
        public String toString() {
            return "non raggiunto";
        }
    }
}
