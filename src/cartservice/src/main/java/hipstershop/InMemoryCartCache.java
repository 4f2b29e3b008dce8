package hipstershop;

import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory cart cache for development and testing.
 */
public class InMemoryCartCache implements CartCache {

    private final ConcurrentHashMap<String, byte[]> entries = new ConcurrentHashMap<>();

    @Override
    public byte[] get(String key) {
        byte[] value = entries.get(key);
        return value != null ? value.clone() : null;
    }

    @Override
    public void set(String key, byte[] value) {
        entries.put(key, value.clone());
    }

    @Override
    public boolean ping() {
        return true;
    }
}
