package relay.bus;

import relay.OutboundMessage;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Volatile in-memory bus decoupling message producers from the dispatch consumer loop.
 *
 * <p>Three named lanes are exposed: {@code inbound} and {@code outbound} carry
 * {@link OutboundMessage}s, {@code progress} carries {@link ProgressEvent}s. Each lane has
 * rendezvous semantics: a publish is handed directly to the oldest blocked consumer when
 * there is one, and queued otherwise. Every published item reaches at most one consumer.
 *
 * <p>Nothing survives a restart; durable recovery is the job of the dead-letter store.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * MessageBus bus = new MessageBus();
 * bus.publishOutbound(OutboundMessage.text("slack", "C123", "hello"));
 *
 * OutboundMessage next = bus.consumeOutbound(Duration.ofSeconds(2)); // null on timeout
 * }</pre>
 *
 * <p>This class is thread-safe.
 */
public final class MessageBus implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(MessageBus.class.getName());

  static final long DEFAULT_CONSUME_TIMEOUT_MS = 30_000;
  static final long MAX_CONSUME_TIMEOUT_MS = 300_000;
  static final int DEFAULT_PEEK_LIMIT = 20;
  static final int DEFAULT_DRAIN_LIMIT = 5000;

  /** Message lanes addressable by {@link #size(Direction)}. */
  public enum Direction {
    INBOUND,
    OUTBOUND
  }

  private final ChannelQueue<OutboundMessage> inbound = new ChannelQueue<>();
  private final ChannelQueue<OutboundMessage> outbound = new ChannelQueue<>();
  private final ChannelQueue<ProgressEvent> progress = new ChannelQueue<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public void publishInbound(OutboundMessage message) {
    Objects.requireNonNull(message, "message");
    inbound.publish(message);
  }

  /**
   * Publishes a message for delivery. Silently ignored once the bus is closed.
   *
   * @param message the message to deliver
   */
  public void publishOutbound(OutboundMessage message) {
    Objects.requireNonNull(message, "message");
    outbound.publish(message);
  }

  public void publishProgress(ProgressEvent event) {
    Objects.requireNonNull(event, "event");
    progress.publish(event);
  }

  public OutboundMessage consumeInbound() {
    return inbound.consume(DEFAULT_CONSUME_TIMEOUT_MS);
  }

  public OutboundMessage consumeInbound(Duration timeout) {
    return inbound.consume(clampTimeout(timeout));
  }

  public OutboundMessage consumeOutbound() {
    return outbound.consume(DEFAULT_CONSUME_TIMEOUT_MS);
  }

  /**
   * Takes the oldest outbound message, blocking up to {@code timeout} for one to arrive.
   *
   * <p>The timeout is clamped to [1 ms, 300 s]. A consumer that times out leaves no trace
   * on the lane, so a message published right after the timeout goes to the next consumer.
   *
   * @param timeout maximum time to wait
   * @return the message, or {@code null} on timeout, interruption or a closed bus
   */
  public OutboundMessage consumeOutbound(Duration timeout) {
    return outbound.consume(clampTimeout(timeout));
  }

  public ProgressEvent consumeProgress() {
    return progress.consume(DEFAULT_CONSUME_TIMEOUT_MS);
  }

  public ProgressEvent consumeProgress(Duration timeout) {
    return progress.consume(clampTimeout(timeout));
  }

  /**
   * Returns up to {@code limit} pending inbound messages followed by up to {@code limit}
   * pending outbound messages, without removing them.
   *
   * @param limit per-lane bound; values below 1 fall back to 20
   * @return snapshot of pending messages
   */
  public List<OutboundMessage> peek(int limit) {
    int n = limit < 1 ? DEFAULT_PEEK_LIMIT : limit;
    List<OutboundMessage> result = new ArrayList<>(inbound.peek(n));
    result.addAll(outbound.peek(n));
    return result;
  }

  public int size() {
    return inbound.size() + outbound.size();
  }

  public int size(Direction direction) {
    return switch (direction) {
      case INBOUND -> inbound.size();
      case OUTBOUND -> outbound.size();
    };
  }

  public QueueSizes sizes() {
    int in = inbound.size();
    int out = outbound.size();
    return new QueueSizes(in, out, in + out);
  }

  /**
   * Discards pending items from every lane.
   *
   * @param limit per-lane bound; values below 1 fall back to 5000
   * @return how many items were discarded from each lane
   */
  public DrainResult drain(int limit) {
    int max = limit < 1 ? DEFAULT_DRAIN_LIMIT : limit;
    return new DrainResult(inbound.drain(max), outbound.drain(max), progress.drain(max));
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Closes the bus: later publishes are ignored, every blocked consumer is released with
   * {@code null} and pending items are drained. Idempotent.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    inbound.close();
    outbound.close();
    progress.close();
    DrainResult drained = drain(DEFAULT_DRAIN_LIMIT);
    logger.fine(() -> "Message bus closed; drained inbound=" + drained.inbound()
        + " outbound=" + drained.outbound() + " progress=" + drained.progress());
  }

  int waiterCount(Direction direction) {
    return switch (direction) {
      case INBOUND -> inbound.waiterCount();
      case OUTBOUND -> outbound.waiterCount();
    };
  }

  private static long clampTimeout(Duration timeout) {
    if (timeout == null) {
      return DEFAULT_CONSUME_TIMEOUT_MS;
    }
    long ms = timeout.toMillis();
    return Math.max(1, Math.min(MAX_CONSUME_TIMEOUT_MS, ms));
  }
}
