package com.phillippitts.sodam.service.transcript;

import com.phillippitts.sodam.domain.TranscriptEntry;
import com.phillippitts.sodam.exception.TranscriptStoreException;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.Pipeline;
import redis.clients.jedis.exceptions.JedisException;

import java.net.URI;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Redis-backed {@link TranscriptStore}.
 *
 * <p>Each call's transcript is a Redis list at {@code call:{callId}:transcripts}; every element
 * is a JSON object {@code {"speaker":"user"|"agent","text":...,"timestamp":...}} with an
 * ISO-8601 timestamp. Append and expiry refresh are sent in one pipeline.
 *
 * <p>The {@link JedisPool} is created on first use under a lock, so a worker whose Redis is down
 * still starts and serves sessions, and closed on shutdown.
 */
public class RedisTranscriptStore implements TranscriptStore, AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(RedisTranscriptStore.class);

    static final String KEY_PREFIX = "call:";
    static final String KEY_SUFFIX = ":transcripts";

    private final URI redisUri;
    private final Function<URI, JedisPool> poolFactory;
    private final Lock poolLock = new ReentrantLock();
    private volatile JedisPool pool;
    private volatile boolean closed;

    public RedisTranscriptStore(String redisUrl) {
        this(URI.create(redisUrl), JedisPool::new);
    }

    // Visible for tests
    RedisTranscriptStore(URI redisUri, Function<URI, JedisPool> poolFactory) {
        this.redisUri = Objects.requireNonNull(redisUri, "redisUri must not be null");
        this.poolFactory = Objects.requireNonNull(poolFactory, "poolFactory must not be null");
    }

    static String keyFor(String callId) {
        return KEY_PREFIX + callId + KEY_SUFFIX;
    }

    static String toJson(TranscriptEntry entry) {
        return new JSONObject()
                .put("speaker", entry.speaker().wireName())
                .put("text", entry.text())
                .put("timestamp", entry.timestamp().toString())
                .toString();
    }

    @Override
    public void append(String callId, TranscriptEntry entry) {
        try (Jedis jedis = pool().getResource()) {
            jedis.rpush(keyFor(callId), toJson(entry));
        } catch (JedisException e) {
            throw new TranscriptStoreException(callId, "Failed to append transcript entry", e);
        }
    }

    @Override
    public void setExpiry(String callId, long seconds) {
        try (Jedis jedis = pool().getResource()) {
            jedis.expire(keyFor(callId), seconds);
        } catch (JedisException e) {
            throw new TranscriptStoreException(callId, "Failed to set transcript expiry", e);
        }
    }

    @Override
    public void appendAndRefreshExpiry(String callId, TranscriptEntry entry, long expirySeconds) {
        String key = keyFor(callId);
        try (Jedis jedis = pool().getResource()) {
            Pipeline pipeline = jedis.pipelined();
            pipeline.rpush(key, toJson(entry));
            pipeline.expire(key, expirySeconds);
            pipeline.sync();
        } catch (JedisException e) {
            throw new TranscriptStoreException(callId, "Failed to append transcript entry", e);
        }
    }

    private JedisPool pool() {
        JedisPool current = pool;
        if (current != null) {
            return current;
        }
        poolLock.lock();
        try {
            if (closed) {
                throw new JedisException("Transcript store is closed");
            }
            if (pool == null) {
                pool = poolFactory.apply(redisUri);
                LOG.info("Redis transcript store connected to {}:{}", redisUri.getHost(), redisUri.getPort());
            }
            return pool;
        } finally {
            poolLock.unlock();
        }
    }

    @PreDestroy
    @Override
    public void close() {
        poolLock.lock();
        try {
            closed = true;
            if (pool != null) {
                pool.close();
                pool = null;
                LOG.info("Redis transcript store closed");
            }
        } finally {
            poolLock.unlock();
        }
    }
}
