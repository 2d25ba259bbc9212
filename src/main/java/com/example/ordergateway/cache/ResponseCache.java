package com.example.ordergateway.cache;

import com.example.ordergateway.adapter.orders.dto.OrderOutcome;
import com.example.ordergateway.adapter.orders.dto.OrderStatus;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Process-local order status cache keyed by order id.
 *
 * Entries are never evicted and never expire; they live as long as the process. The last
 * successful write for an id wins. Concurrent misses for the same id share one fetch.
 *
 * Fetches are coalesced in {@code inFlight} rather than through a Caffeine {@code AsyncCache}:
 * an async cache publishes the pending future as the entry, so a NotFound or Unavailable
 * outcome would be visible to later readers until it was invalidated. Here only Found
 * outcomes ever become entries.
 */
@Slf4j
@Component
public class ResponseCache {

  private final Cache<String, OrderStatus> entries = Caffeine.newBuilder().build();

  private final ConcurrentMap<String, CompletableFuture<OrderOutcome>> inFlight = new ConcurrentHashMap<>();

  public Optional<OrderStatus> get(String orderId) {
    return Optional.ofNullable(entries.getIfPresent(orderId));
  }

  public void put(String orderId, OrderStatus status) {
    entries.put(orderId, status);
  }

  /**
   * Returns the cached order, or runs {@code fetcher} once for all concurrent callers missing
   * the same id. Only {@link OrderOutcome.Found} results are stored; every other outcome,
   * and any exception thrown by the fetcher, is handed to each waiting caller and forgotten.
   */
  public OrderOutcome getOrFetch(String orderId, Function<String, OrderOutcome> fetcher) {
    OrderStatus cached = entries.getIfPresent(orderId);
    if (cached != null) {
      log.debug("Cache hit for order {}", orderId);
      return new OrderOutcome.Found(cached);
    }

    CompletableFuture<OrderOutcome> pending = new CompletableFuture<>();
    CompletableFuture<OrderOutcome> leader = inFlight.putIfAbsent(orderId, pending);
    if (leader != null) {
      log.debug("Joining in-flight fetch for order {}", orderId);
      return await(leader);
    }

    try {
      OrderOutcome outcome = fetchAndStore(orderId, fetcher);
      pending.complete(outcome);
      return outcome;
    } catch (RuntimeException | Error e) {
      pending.completeExceptionally(e);
      throw e;
    } finally {
      inFlight.remove(orderId, pending);
    }
  }

  public long size() {
    return entries.estimatedSize();
  }

  private OrderOutcome fetchAndStore(String orderId, Function<String, OrderOutcome> fetcher) {
    // A fetch that finished between our miss and taking the lead has already stored the entry
    OrderStatus cached = entries.getIfPresent(orderId);
    if (cached != null) {
      return new OrderOutcome.Found(cached);
    }

    log.debug("Cache miss for order {}", orderId);
    OrderOutcome outcome = fetcher.apply(orderId);
    if (outcome instanceof OrderOutcome.Found found) {
      entries.put(orderId, found.order());
    }
    return outcome;
  }

  private static OrderOutcome await(CompletableFuture<OrderOutcome> leader) {
    try {
      return leader.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw e;
    }
  }
}
