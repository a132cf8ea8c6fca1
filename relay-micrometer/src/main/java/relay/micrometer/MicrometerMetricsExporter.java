package relay.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import relay.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code relay.dispatch.success} delivered messages</li>
 *   <li>{@code relay.dispatch.deduplicated} sends answered from the dedupe cache</li>
 *   <li>{@code relay.dispatch.requeued} messages scheduled for a delayed retry</li>
 *   <li>{@code relay.dispatch.dead} messages written to the dead-letter store</li>
 *   <li>{@code relay.dispatch.rejected} sends failed with a non-retryable error</li>
 *   <li>{@code relay.ratelimit.waits} sends that waited for a token</li>
 *   <li>{@code relay.circuit.rejected} attempts refused by an open circuit</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code relay.bus.inbound.depth}</li>
 *   <li>{@code relay.bus.outbound.depth}</li>
 *   <li>{@code relay.retry.pending} retry timers not yet fired</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  public static final String DEFAULT_PREFIX = "relay";

  private final MeterRegistry registry;
  private final List<Meter> meters = new ArrayList<>();
  private final Counter success;
  private final Counter deduplicated;
  private final Counter requeued;
  private final Counter dead;
  private final Counter rejected;
  private final Counter rateLimited;
  private final Counter circuitRejected;

  private final AtomicInteger inboundDepth = new AtomicInteger();
  private final AtomicInteger outboundDepth = new AtomicInteger();
  private final AtomicInteger pendingRetries = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@value #DEFAULT_PREFIX}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names, e.g. {@code "support.relay"}
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;

    this.success = counter(namePrefix + ".dispatch.success", "Messages delivered");
    this.deduplicated = counter(namePrefix + ".dispatch.deduplicated", "Sends answered from the dedupe cache");
    this.requeued = counter(namePrefix + ".dispatch.requeued", "Messages scheduled for a delayed retry");
    this.dead = counter(namePrefix + ".dispatch.dead", "Messages written to the dead-letter store");
    this.rejected = counter(namePrefix + ".dispatch.rejected", "Sends failed with a non-retryable error");
    this.rateLimited = counter(namePrefix + ".ratelimit.waits", "Sends that waited for a rate-limit token");
    this.circuitRejected = counter(namePrefix + ".circuit.rejected", "Attempts refused by an open circuit");

    gauge(namePrefix + ".bus.inbound.depth", inboundDepth);
    gauge(namePrefix + ".bus.outbound.depth", outboundDepth);
    gauge(namePrefix + ".retry.pending", pendingRetries);
  }

  private Counter counter(String name, String description) {
    Counter counter = Counter.builder(name).description(description).register(registry);
    meters.add(counter);
    return counter;
  }

  private void gauge(String name, AtomicInteger value) {
    meters.add(Gauge.builder(name, value, AtomicInteger::get).register(registry));
  }

  @Override
  public void incrementDispatchSuccess() {
    if (closed) return;
    success.increment();
  }

  @Override
  public void incrementDispatchDeduplicated() {
    if (closed) return;
    deduplicated.increment();
  }

  @Override
  public void incrementDispatchRequeued() {
    if (closed) return;
    requeued.increment();
  }

  @Override
  public void incrementDispatchDead() {
    if (closed) return;
    dead.increment();
  }

  @Override
  public void incrementDispatchRejected() {
    if (closed) return;
    rejected.increment();
  }

  @Override
  public void incrementRateLimited() {
    if (closed) return;
    rateLimited.increment();
  }

  @Override
  public void incrementCircuitRejected() {
    if (closed) return;
    circuitRejected.increment();
  }

  @Override
  public void recordQueueDepths(int inboundDepth, int outboundDepth) {
    if (closed) return;
    this.inboundDepth.set(inboundDepth);
    this.outboundDepth.set(outboundDepth);
  }

  @Override
  public void recordPendingRetries(int pending) {
    if (closed) return;
    pendingRetries.set(pending);
  }

  /**
   * Removes all meters registered by this exporter from the registry. Later updates
   * are ignored.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
