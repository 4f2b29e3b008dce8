package hipstershop;

/**
 * Byte-oriented key-value cache holding one serialized cart per user.
 * Implementations may throw any exception on connectivity problems; callers retry.
 */
public interface CartCache {

    /** @return the stored bytes, or {@code null} if the key is absent */
    byte[] get(String key) throws Exception;

    void set(String key, byte[] value) throws Exception;

    boolean ping();
}
