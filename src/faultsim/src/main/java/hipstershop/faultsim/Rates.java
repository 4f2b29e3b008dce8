package hipstershop.faultsim;

import java.util.OptionalLong;
import java.util.Random;

final class Rates {

    private Rates() {}

    static double checkProbability(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0.0, 1.0], got " + value);
        }
        return value;
    }

    static long checkDelay(String name, long value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0, got " + value);
        }
        return value;
    }

    static void checkWindow(String name, long min, long max) {
        if (min > max) {
            throw new IllegalArgumentException(name + " window is empty: min " + min + " > max " + max);
        }
    }

    /** Uniform in [min, max), or exactly {@code min} when the window is a single point. */
    static long uniform(Random random, long min, long max) {
        if (max <= min) {
            return min;
        }
        return min + (long) (random.nextDouble() * (max - min));
    }

    static Random newRandom(OptionalLong seed) {
        return seed.isPresent() ? new Random(seed.getAsLong()) : new Random();
    }
}
