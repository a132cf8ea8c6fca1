package relay.dispatch;

import relay.OutboundMessage;
import relay.SendResult;
import relay.breaker.CircuitBreaker;
import relay.breaker.CircuitBreakerRegistry;
import relay.breaker.CircuitState;
import relay.bus.MessageBus;
import relay.dead.DeadLetterRecord;
import relay.dedupe.DedupeCache;
import relay.dedupe.DefaultOutboundDedupePolicy;
import relay.dedupe.OutboundDedupePolicy;
import relay.ratelimit.TokenBucketRateLimiter;
import relay.spi.ChannelRegistry;
import relay.spi.DeadLetterStore;
import relay.spi.MetricsExporter;
import relay.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reliable outbound delivery on top of a {@link ChannelRegistry}.
 *
 * <p>Each {@link #send} call runs the same pipeline:
 * <ol>
 *   <li>take a rate-limit token, waiting at most once for the next refill</li>
 *   <li>answer from the dedupe cache when an equivalent message was delivered recently</li>
 *   <li>transmit up to {@code inlineRetries + 1} times with backoff in between, stopping
 *       early on a non-retryable error or an open circuit</li>
 *   <li>if still failing with a retryable error and the message's
 *       {@value OutboundMessage#DISPATCH_RETRY} counter is below {@code retryMax}, schedule
 *       a copy with the counter incremented for re-publication on the bus</li>
 *   <li>otherwise, once the retry budget is spent, write a dead letter</li>
 * </ol>
 *
 * <p>Delivery problems are returned as failed {@link SendResult}s; {@code send} does not
 * throw for them. {@link #start()} launches a daemon loop that consumes the bus'
 * outbound lane and feeds each message through {@code send}.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see DispatchService.Builder
 */
public final class DispatchService implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DispatchService.class.getName());

  private static final long JOIN_GRACE_MS = 5000;

  private final MessageBus bus;
  private final ChannelRegistry channelRegistry;
  private final DeadLetterStore deadLetterStore;
  private final OutboundDedupePolicy dedupePolicy;
  private final DedupeCache dedupeCache;
  private final TokenBucketRateLimiter rateLimiter;
  private final CircuitBreakerRegistry circuitBreakers;
  private final RetryPolicy retryPolicy;
  private final int inlineRetries;
  private final int retryMax;
  private final long consumeTimeoutMs;
  private final MetricsExporter metrics;
  private final Sleeper sleeper;
  private final Clock clock;

  private final ScheduledThreadPoolExecutor retryScheduler;
  private final Set<PendingRetry> pendingRetries = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicBoolean stopped = new AtomicBoolean(false);
  private final Object lifecycleLock = new Object();
  private Thread loopThread;

  private DispatchService(Builder builder) {
    this.bus = Objects.requireNonNull(builder.bus, "bus");
    this.channelRegistry = Objects.requireNonNull(builder.channelRegistry, "channelRegistry");
    this.clock = Objects.requireNonNull(builder.clock, "clock");
    this.deadLetterStore = builder.deadLetterStore;
    this.circuitBreakers = builder.circuitBreakers;
    this.dedupePolicy = builder.dedupePolicy != null
        ? builder.dedupePolicy : new DefaultOutboundDedupePolicy();
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(700, 25_000, 250);
    this.rateLimiter = builder.rateLimiter != null
        ? builder.rateLimiter : TokenBucketRateLimiter.builder().clock(clock).build();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.THREAD;

    if (builder.inlineRetries < 0) {
      throw new IllegalArgumentException("inlineRetries must be >= 0, got: " + builder.inlineRetries);
    }
    if (builder.retryMax < 0) {
      throw new IllegalArgumentException("retryMax must be >= 0, got: " + builder.retryMax);
    }
    if (builder.consumeTimeoutMs < 1) {
      throw new IllegalArgumentException("consumeTimeoutMs must be >= 1, got: " + builder.consumeTimeoutMs);
    }
    this.inlineRetries = builder.inlineRetries;
    this.retryMax = builder.retryMax;
    this.consumeTimeoutMs = builder.consumeTimeoutMs;
    this.dedupeCache = new DedupeCache(builder.dedupeTtlMs, builder.dedupeMaxSize, clock);

    this.retryScheduler = new ScheduledThreadPoolExecutor(1, new DaemonThreadFactory("relay-retry-"));
    this.retryScheduler.setRemoveOnCancelPolicy(true);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Delivers a message to {@code provider}.
   *
   * @param provider destination key; when blank, {@link OutboundMessage#resolveProvider()} is used
   * @param message  the message
   * @return the outcome: success (possibly from the dedupe cache) or a failure whose error
   *     is prefixed {@code requeued_retry_<n>:} when an out-of-band retry was scheduled
   */
  public SendResult send(String provider, OutboundMessage message) {
    Objects.requireNonNull(message, "message");
    String destination = resolveDestination(provider, message);

    acquireRateToken(destination);

    dedupeCache.trim();
    String dedupeKey = dedupePolicy.key(destination, message);
    DedupeCache.Entry cached = dedupeCache.lookup(dedupeKey);
    if (cached != null) {
      metrics.incrementDispatchDeduplicated();
      logger.fine("Deduplicated outbound message provider=" + destination
          + " messageId=" + message.id() + " cachedId=" + cached.messageId());
      return SendResult.success(cached.messageId());
    }

    String error = "unknown_error";
    boolean retryable = true;
    int attempts = inlineRetries + 1;
    for (int attempt = 1; attempt <= attempts; attempt++) {
      CircuitBreaker breaker = circuitBreakers == null ? null : circuitBreakers.forDestination(destination);
      if (breaker != null && !breaker.tryAcquire()) {
        error = "circuit_open:" + destination;
        metrics.incrementCircuitRejected();
        break;
      }
      SendResult result = transmit(message);
      if (result.ok()) {
        if (breaker != null) {
          breaker.recordSuccess();
        }
        String deliveredId = result.messageId();
        dedupeCache.record(dedupeKey,
            deliveredId == null || deliveredId.isBlank() ? message.id() : deliveredId);
        metrics.incrementDispatchSuccess();
        return result;
      }
      if (breaker != null) {
        breaker.recordFailure();
      }
      error = result.error();
      retryable = ErrorClassifier.isRetryable(error);
      if (!retryable) {
        break;
      }
      if (attempt < attempts) {
        long delayMs = retryPolicy.computeDelayMs(attempt);
        logger.fine("Inline retry provider=" + destination + " messageId=" + message.id()
            + " attempt=" + attempt + " delayMs=" + delayMs + " error=" + error);
        try {
          sleeper.sleep(delayMs);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          break;
        }
      }
    }

    if (!retryable) {
      metrics.incrementDispatchRejected();
      logger.fine("Non-retryable failure provider=" + destination + " messageId=" + message.id()
          + " error=" + error);
      return SendResult.failure(error);
    }

    int retry = message.dispatchRetry();
    if (retry < retryMax) {
      return requeue(destination, message, retry + 1, error);
    }
    deadLetter(destination, message, error, retry);
    return SendResult.failure(error);
  }

  /**
   * Starts the background consume loop. Subsequent calls are no-ops while running.
   *
   * @throws IllegalStateException if the service has been stopped
   */
  public void start() {
    synchronized (lifecycleLock) {
      if (stopped.get()) {
        throw new IllegalStateException("DispatchService has been stopped");
      }
      if (!running.compareAndSet(false, true)) {
        return;
      }
      loopThread = new DaemonThreadFactory("relay-dispatch-").newThread(this::consumeLoop);
      loopThread.start();
    }
    logger.info("Dispatch service started consumeTimeoutMs=" + consumeTimeoutMs);
  }

  /**
   * Stops the consume loop and cancels every pending retry. Retries that fire afterwards
   * are discarded. A stopped service cannot be restarted.
   */
  public void stop() {
    Thread loop;
    synchronized (lifecycleLock) {
      if (!stopped.compareAndSet(false, true)) {
        return;
      }
      running.set(false);
      loop = loopThread;
      loopThread = null;
    }
    int cancelled = cancelPendingRetries();
    if (loop != null && loop != Thread.currentThread()) {
      try {
        loop.join(consumeTimeoutMs + JOIN_GRACE_MS);
        if (loop.isAlive()) {
          logger.warning("Dispatch loop did not exit in time; interrupting " + loop.getName());
          loop.interrupt();
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    // The loop may have scheduled a retry while we were waiting for it.
    cancelled += cancelPendingRetries();
    retryScheduler.shutdownNow();
    // Anything that slipped in before shutdownNow() will never run.
    cancelled += cancelPendingRetries();
    logger.info("Dispatch service stopped cancelledRetries=" + cancelled);
  }

  @Override
  public void close() {
    stop();
  }

  public boolean isRunning() {
    return running.get();
  }

  public DispatchHealth health() {
    Map<String, CircuitState> states = circuitBreakers == null
        ? Map.of() : circuitBreakers.states();
    return new DispatchHealth(
        running.get(),
        dedupeCache.size(),
        pendingRetries.size(),
        rateLimiter.available(),
        states);
  }

  public int pendingRetryCount() {
    return pendingRetries.size();
  }

  private void consumeLoop() {
    Duration timeout = Duration.ofMillis(consumeTimeoutMs);
    while (running.get() && !Thread.currentThread().isInterrupted()) {
      try {
        OutboundMessage message = bus.consumeOutbound(timeout);
        if (message == null) {
          if (bus.isClosed()) {
            logger.info("Message bus closed; dispatch loop exiting");
            break;
          }
          continue;
        }
        String provider = message.resolveProvider();
        if (provider == null) {
          logger.warning("Skipping outbound message without provider messageId=" + message.id());
          continue;
        }
        SendResult result = send(provider, message);
        if (!result.ok()) {
          logger.fine("Dispatch failed provider=" + provider + " messageId=" + message.id()
              + " error=" + result.error());
        }
        metrics.recordQueueDepths(bus.size(MessageBus.Direction.INBOUND), bus.size(MessageBus.Direction.OUTBOUND));
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Dispatch loop error", t);
      }
    }
    running.set(false);
  }

  private void acquireRateToken(String destination) {
    if (rateLimiter.tryConsume()) {
      return;
    }
    metrics.incrementRateLimited();
    long waitMs = rateLimiter.waitTimeMs();
    logger.fine("Rate limited provider=" + destination + " waitMs=" + waitMs);
    if (waitMs > 0) {
      try {
        sleeper.sleep(waitMs);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
    }
    // Best effort: proceed whether or not the second attempt yields a token.
    rateLimiter.tryConsume();
  }

  private SendResult transmit(OutboundMessage message) {
    try {
      SendResult result = channelRegistry.send(message);
      return result != null ? result : SendResult.failure("unknown_error");
    } catch (RuntimeException e) {
      String detail = e.getMessage();
      return SendResult.failure(detail == null || detail.isBlank() ? e.getClass().getName() : detail);
    }
  }

  private SendResult requeue(String destination, OutboundMessage message, int nextRetry, String error) {
    long delayMs = retryPolicy.computeDelayMs(nextRetry);
    OutboundMessage retried = message.toBuilder()
        .metadata(OutboundMessage.DISPATCH_RETRY, nextRetry)
        .metadata(OutboundMessage.DISPATCH_ERROR, error)
        .metadata(OutboundMessage.DISPATCH_RETRY_AT, clock.millis() + delayMs)
        .build();

    PendingRetry pending = new PendingRetry(retried);
    pendingRetries.add(pending);
    // Added before checking, so a concurrent stop() either sees it or we see the stop.
    if (stopped.get()) {
      pendingRetries.remove(pending);
      logger.warning("Dispatch service stopped; not scheduling retry provider=" + destination
          + " messageId=" + message.id() + " error=" + error);
      return SendResult.failure(error);
    }
    try {
      pending.future = retryScheduler.schedule(pending, delayMs, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      pendingRetries.remove(pending);
      logger.warning("Retry scheduler shut down; not scheduling retry provider=" + destination
          + " messageId=" + message.id() + " error=" + error);
      return SendResult.failure(error);
    }
    metrics.incrementDispatchRequeued();
    metrics.recordPendingRetries(pendingRetries.size());
    logger.fine("Requeued outbound message provider=" + destination + " messageId=" + message.id()
        + " retry=" + nextRetry + " delayMs=" + delayMs + " error=" + error);
    return SendResult.failure("requeued_retry_" + nextRetry + ":" + error);
  }

  private void deadLetter(String destination, OutboundMessage message, String error, int retryCount) {
    if (deadLetterStore == null) {
      logger.warning("Retry budget exhausted; dead-lettering disabled, dropping provider=" + destination
          + " messageId=" + message.id() + " error=" + error);
      return;
    }
    try {
      deadLetterStore.append(DeadLetterRecord.of(destination, message, error, retryCount));
      metrics.incrementDispatchDead();
      logger.warning("Dead-lettered outbound message provider=" + destination
          + " messageId=" + message.id() + " retryCount=" + retryCount + " error=" + error);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to write dead letter provider=" + destination
          + " messageId=" + message.id() + " store=" + deadLetterStore.location(), e);
    }
  }

  private int cancelPendingRetries() {
    int count = 0;
    for (PendingRetry pending : pendingRetries) {
      pending.cancel();
      pendingRetries.remove(pending);
      count++;
    }
    metrics.recordPendingRetries(pendingRetries.size());
    return count;
  }

  private static String resolveDestination(String provider, OutboundMessage message) {
    if (provider != null && !provider.isBlank()) {
      return provider.trim().toLowerCase(Locale.ROOT);
    }
    String resolved = message.resolveProvider();
    return resolved == null ? "" : resolved;
  }

  private final class PendingRetry implements Runnable {
    private final OutboundMessage message;
    private volatile ScheduledFuture<?> future;
    private volatile boolean cancelled;

    PendingRetry(OutboundMessage message) {
      this.message = message;
    }

    @Override
    public void run() {
      pendingRetries.remove(this);
      if (cancelled || stopped.get()) {
        return;
      }
      if (bus.isClosed()) {
        logger.warning("Message bus closed; dropping retry messageId=" + message.id());
        return;
      }
      try {
        bus.publishOutbound(message);
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to re-publish retry messageId=" + message.id(), e);
      }
    }

    void cancel() {
      cancelled = true;
      ScheduledFuture<?> f = future;
      if (f != null) {
        f.cancel(false);
      }
    }
  }

  /** Builder for {@link DispatchService}. */
  public static final class Builder {
    private MessageBus bus;
    private ChannelRegistry channelRegistry;
    private DeadLetterStore deadLetterStore;
    private OutboundDedupePolicy dedupePolicy;
    private long dedupeTtlMs = 25_000;
    private int dedupeMaxSize = 20_000;
    private TokenBucketRateLimiter rateLimiter;
    private CircuitBreakerRegistry circuitBreakers;
    private RetryPolicy retryPolicy;
    private int inlineRetries = 0;
    private int retryMax = 3;
    private long consumeTimeoutMs = 2000;
    private MetricsExporter metrics;
    private Sleeper sleeper;
    private Clock clock = Clock.systemUTC();

    private Builder() {
    }

    /**
     * Bus whose outbound lane feeds the consume loop and receives scheduled retries.
     *
     * <p><b>Required.</b>
     */
    public Builder bus(MessageBus bus) {
      this.bus = bus;
      return this;
    }

    /**
     * Transmits messages to their channels.
     *
     * <p><b>Required.</b>
     */
    public Builder channelRegistry(ChannelRegistry channelRegistry) {
      this.channelRegistry = channelRegistry;
      return this;
    }

    /**
     * Sink for messages that exhausted their retry budget.
     *
     * <p>Optional. {@code null} disables dead-lettering; exhausted messages are logged and dropped.
     */
    public Builder deadLetterStore(DeadLetterStore deadLetterStore) {
      this.deadLetterStore = deadLetterStore;
      return this;
    }

    /** Optional. Defaults to {@link DefaultOutboundDedupePolicy}. */
    public Builder dedupePolicy(OutboundDedupePolicy dedupePolicy) {
      this.dedupePolicy = dedupePolicy;
      return this;
    }

    /** How long a delivery suppresses equivalent messages. Optional, defaults to {@code 25000} ms. */
    public Builder dedupeTtlMs(long dedupeTtlMs) {
      this.dedupeTtlMs = dedupeTtlMs;
      return this;
    }

    /** Soft bound on cached dedupe keys. Optional, defaults to {@code 20000}. */
    public Builder dedupeMaxSize(int dedupeMaxSize) {
      this.dedupeMaxSize = dedupeMaxSize;
      return this;
    }

    /** Optional. Defaults to a 30-token bucket refilled by one token per second. */
    public Builder rateLimiter(TokenBucketRateLimiter rateLimiter) {
      this.rateLimiter = rateLimiter;
      return this;
    }

    /**
     * Per-provider circuit breakers consulted before each transmission.
     *
     * <p>Optional. {@code null} (the default) disables circuit gating.
     */
    public Builder circuitBreakers(CircuitBreakerRegistry circuitBreakers) {
      this.circuitBreakers = circuitBreakers;
      return this;
    }

    /**
     * Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with base {@code 700} ms,
     * cap {@code 25000} ms and jitter {@code 250} ms.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /** Extra transmission attempts within one {@code send}. Optional, defaults to {@code 0}. */
    public Builder inlineRetries(int inlineRetries) {
      this.inlineRetries = inlineRetries;
      return this;
    }

    /**
     * Out-of-band retries before a message is dead-lettered.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 0.
     */
    public Builder retryMax(int retryMax) {
      this.retryMax = retryMax;
      return this;
    }

    /** Consume-loop poll timeout. Optional, defaults to {@code 2000} ms. */
    public Builder consumeTimeoutMs(long consumeTimeoutMs) {
      this.consumeTimeoutMs = consumeTimeoutMs;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to {@link Thread#sleep(long)}. */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /** Time source for the dedupe cache and the default rate limiter. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the service. The consume loop is not started until {@link DispatchService#start()}.
     *
     * @throws NullPointerException if {@code bus} or {@code channelRegistry} is null
     * @throws IllegalArgumentException if a numeric option is out of range
     */
    public DispatchService build() {
      return new DispatchService(this);
    }
  }
}
