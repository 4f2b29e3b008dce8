package hipstershop.faultsim;

import java.net.SocketException;
import java.net.SocketTimeoutException;

/**
 * Categories of simulated storage faults.
 *
 * <p>Each hard failure raises the same exception type the storage client
 * raises for that category, so a synthetic fault cannot be told apart from a
 * real one downstream, while the three categories stay distinguishable from
 * each other.
 */
public enum FaultKind {

    NONE,

    /** The storage did not answer in time. */
    TIMEOUT {
        @Override
        public Exception newException(String operationName) {
            return new SocketTimeoutException("Storage connection timeout during " + operationName);
        }
    },

    /** The socket to the storage was dropped mid-operation. */
    CONNECTION_RESET {
        @Override
        public Exception newException(String operationName) {
            return new SocketException("Connection reset by storage peer during " + operationName);
        }
    },

    /** No pooled connection could be borrowed. */
    POOL_EXHAUSTED {
        @Override
        public Exception newException(String operationName) {
            return new IllegalStateException("Storage connection pool exhausted during " + operationName);
        }
    },

    /** Degraded but succeeding: the real operation runs after a delay. */
    SLOW_OPERATION;

    static final FaultKind[] HARD_FAILURES = {TIMEOUT, CONNECTION_RESET, POOL_EXHAUSTED};

    public boolean isHardFailure() {
        return this == TIMEOUT || this == CONNECTION_RESET || this == POOL_EXHAUSTED;
    }

    /**
     * Creates the exception that stands in for this fault.
     *
     * @throws UnsupportedOperationException if this kind is not a hard failure
     */
    public Exception newException(String operationName) {
        throw new UnsupportedOperationException(name() + " does not raise an exception");
    }
}
