package hipstershop;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisException;

import java.nio.charset.StandardCharsets;

/**
 * Redis-backed cart cache. Every write refreshes the entry's TTL.
 */
public class RedisCartCache implements CartCache, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RedisCartCache.class);
    private static final long CART_TTL_SECONDS = 86400; // 24 hours
    private final JedisPool pool;

    public RedisCartCache(String redisAddr, int maxConnections) {
        String host;
        int port = 6379;
        if (redisAddr.contains(":")) {
            String[] parts = redisAddr.split(":");
            host = parts[0];
            port = Integer.parseInt(parts[1]);
        } else {
            host = redisAddr;
        }
        JedisPoolConfig config = new JedisPoolConfig();
        config.setMaxTotal(maxConnections);
        pool = new JedisPool(config, host, port);
        logger.info("Redis cart cache initialized at {}:{}", host, port);
    }

    @Override
    public byte[] get(String key) {
        try (Jedis jedis = pool.getResource()) {
            return jedis.get(key.getBytes(StandardCharsets.UTF_8));
        }
    }

    @Override
    public void set(String key, byte[] value) {
        try (Jedis jedis = pool.getResource()) {
            jedis.setex(key.getBytes(StandardCharsets.UTF_8), CART_TTL_SECONDS, value);
        }
    }

    @Override
    public boolean ping() {
        try (Jedis jedis = pool.getResource()) {
            return "PONG".equalsIgnoreCase(jedis.ping());
        } catch (JedisException e) {
            logger.warn("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        pool.close();
    }
}
