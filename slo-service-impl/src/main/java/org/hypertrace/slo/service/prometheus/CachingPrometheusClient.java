package org.hypertrace.slo.service.prometheus;

import io.reactivex.rxjava3.core.Single;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves repeated queries from a {@link QueryCache}. Only non-empty results of the expected type
 * without warnings are admitted; warnings may indicate inconsistent data which is passed through
 * to the caller but never memoized. Failed or cancelled calls never reach the cache.
 */
public class CachingPrometheusClient implements PrometheusClient {
  private static final Logger LOG = LoggerFactory.getLogger(CachingPrometheusClient.class);

  static final int VECTOR_COST = 10;
  static final int MATRIX_COST = 100;

  private final PrometheusClient delegate;
  private final QueryCache cache;
  private final Duration instantTtl;
  private final Duration rangeTtl;

  public CachingPrometheusClient(
      PrometheusClient delegate, QueryCache cache, Duration instantTtl, Duration rangeTtl) {
    this.delegate = delegate;
    this.cache = cache;
    this.instantTtl = instantTtl;
    this.rangeTtl = rangeTtl;
  }

  @Override
  public Single<QueryResult> query(String query, Instant time) {
    long key = QueryCache.key(query);
    return Single.defer(
        () -> {
          Optional<VectorValue> cached =
              cache
                  .get(key)
                  .flatMap(value -> expect(value, ResultType.VECTOR, QueryValues::asVector));
          if (cached.isPresent()) {
            LOG.debug("Cache hit for query {}", query);
            return Single.just(QueryResult.of(cached.get()));
          }
          return delegate
              .query(query, time)
              .doOnSuccess(
                  result -> {
                    Optional<VectorValue> vector = QueryValues.asVector(result.getValue());
                    if (vector.isPresent() && !vector.get().isEmpty() && !result.hasWarnings()) {
                      cache.put(key, vector.get(), VECTOR_COST, instantTtl);
                    }
                  });
        });
  }

  @Override
  public Single<QueryResult> queryRange(String query, QueryRange range) {
    long key = QueryCache.key(query, range.getStart(), range.getEnd());
    return Single.defer(
        () -> {
          Optional<MatrixValue> cached =
              cache
                  .get(key)
                  .flatMap(value -> expect(value, ResultType.MATRIX, QueryValues::asMatrix));
          if (cached.isPresent()) {
            LOG.debug("Cache hit for range query {}", query);
            return Single.just(QueryResult.of(cached.get()));
          }
          return delegate
              .queryRange(query, range)
              .doOnSuccess(
                  result -> {
                    Optional<MatrixValue> matrix = QueryValues.asMatrix(result.getValue());
                    if (matrix.isPresent() && !matrix.get().isEmpty() && !result.hasWarnings()) {
                      cache.put(key, matrix.get(), MATRIX_COST, rangeTtl);
                    }
                  });
        });
  }

  /** A hit of another result type can only stem from a key collision and counts as a miss. */
  private static <T extends QueryValue> Optional<T> expect(
      QueryValue value, ResultType expected, Function<QueryValue, Optional<T>> cast) {
    Optional<T> typed = cast.apply(value);
    if (typed.isEmpty()) {
      LOG.debug(
          "Ignoring cached {} where a {} was expected",
          value.getResultType().getName(),
          expected.getName());
    }
    return typed;
  }
}
