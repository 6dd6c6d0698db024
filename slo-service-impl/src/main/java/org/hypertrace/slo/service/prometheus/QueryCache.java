package org.hypertrace.slo.service.prometheus;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.io.Closeable;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Query results keyed by a 64 bit hash of the query text and, for range queries, the range bounds.
 * Hash collisions are accepted; callers check the result type of every hit. The cache is bounded
 * by the summed cost of its entries and every entry expires after its own time to live.
 */
@Slf4j
public class QueryCache implements Closeable {
  private static final HashFunction KEY_HASH = Hashing.farmHashFingerprint64();

  private final Cache<Long, CacheEntry> cache;
  private volatile boolean closed;

  public QueryCache(long maxCost) {
    this(maxCost, Ticker.systemTicker(), ForkJoinPool.commonPool());
  }

  QueryCache(long maxCost, Ticker ticker, Executor executor) {
    this.cache =
        Caffeine.newBuilder()
            .maximumWeight(maxCost)
            .<Long, CacheEntry>weigher((key, entry) -> entry.getCost())
            .expireAfter(new EntryExpiry())
            .ticker(ticker)
            .executor(executor)
            .build();
  }

  public static long key(String query) {
    return KEY_HASH.hashString(query, UTF_8).asLong();
  }

  public static long key(String query, Instant start, Instant end) {
    return KEY_HASH
        .newHasher()
        .putString(query, UTF_8)
        .putString(start.toString(), UTF_8)
        .putString(end.toString(), UTF_8)
        .hash()
        .asLong();
  }

  public Optional<QueryValue> get(long key) {
    CacheEntry entry = cache.getIfPresent(key);
    return entry == null ? Optional.empty() : Optional.of(entry.getValue());
  }

  public void put(long key, QueryValue value, int cost, Duration ttl) {
    if (closed) {
      return;
    }
    cache.put(key, new CacheEntry(value, cost, ttl));
    log.debug("Cached {} result under {} for {}", value.getResultType().getName(), key, ttl);
  }

  public long size() {
    return cache.estimatedSize();
  }

  /** Drops every entry, later writes are ignored. */
  @Override
  public void close() {
    closed = true;
    cache.invalidateAll();
    cache.cleanUp();
  }

  @Value
  private static class CacheEntry {
    QueryValue value;
    int cost;
    Duration ttl;
  }

  private static class EntryExpiry implements Expiry<Long, CacheEntry> {
    @Override
    public long expireAfterCreate(Long key, CacheEntry entry, long currentTime) {
      return entry.getTtl().toNanos();
    }

    @Override
    public long expireAfterUpdate(
        Long key, CacheEntry entry, long currentTime, long currentDuration) {
      return entry.getTtl().toNanos();
    }

    @Override
    public long expireAfterRead(
        Long key, CacheEntry entry, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
