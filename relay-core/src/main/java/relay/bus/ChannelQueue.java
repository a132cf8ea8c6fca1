package relay.bus;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One named lane of the {@link MessageBus}: a FIFO of pending items plus a FIFO of
 * blocked consumers.
 *
 * <p>A publish hands the item straight to the oldest waiter when one exists, otherwise it
 * is queued. Waiters are {@link CompletableFuture}s; a waiter that times out removes
 * itself under the lock, so it can never be resolved twice and never leaks.
 *
 * <p>This class is thread-safe.
 */
final class ChannelQueue<T> {
  private final ReentrantLock lock = new ReentrantLock();
  private final Deque<T> pending = new ArrayDeque<>();
  private final Deque<CompletableFuture<T>> waiters = new ArrayDeque<>();
  private boolean closed;

  void publish(T item) {
    lock.lock();
    try {
      if (closed) {
        return;
      }
      CompletableFuture<T> waiter = waiters.pollFirst();
      if (waiter == null) {
        pending.addLast(item);
      } else {
        // Completed under the lock so an abandoning waiter always observes the hand-off.
        waiter.complete(item);
      }
    } finally {
      lock.unlock();
    }
  }

  T consume(long timeoutMs) {
    CompletableFuture<T> waiter;
    lock.lock();
    try {
      if (closed) {
        return null;
      }
      T immediate = pending.pollFirst();
      if (immediate != null) {
        return immediate;
      }
      waiter = new CompletableFuture<>();
      waiters.addLast(waiter);
    } finally {
      lock.unlock();
    }

    try {
      return waiter.get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      return abandon(waiter);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return abandon(waiter);
    } catch (ExecutionException e) {
      throw new IllegalStateException("Bus waiter failed", e.getCause());
    }
  }

  /**
   * Removes a waiter that gave up. If a publisher already handed it an item in the
   * meantime, that item is returned so it is not lost.
   */
  private T abandon(CompletableFuture<T> waiter) {
    lock.lock();
    try {
      if (waiters.remove(waiter)) {
        return null;
      }
    } finally {
      lock.unlock();
    }
    return waiter.getNow(null);
  }

  /** Stops accepting items and resolves every waiter with {@code null}. Pending items stay until drained. */
  void close() {
    lock.lock();
    try {
      closed = true;
      CompletableFuture<T> waiter;
      while ((waiter = waiters.pollFirst()) != null) {
        waiter.complete(null);
      }
    } finally {
      lock.unlock();
    }
  }

  List<T> peek(int limit) {
    lock.lock();
    try {
      List<T> result = new ArrayList<>(Math.min(limit, pending.size()));
      for (T item : pending) {
        if (result.size() >= limit) break;
        result.add(item);
      }
      return result;
    } finally {
      lock.unlock();
    }
  }

  int drain(int limit) {
    lock.lock();
    try {
      int drained = 0;
      while (drained < limit && pending.pollFirst() != null) {
        drained++;
      }
      return drained;
    } finally {
      lock.unlock();
    }
  }

  int size() {
    lock.lock();
    try {
      return pending.size();
    } finally {
      lock.unlock();
    }
  }

  int waiterCount() {
    lock.lock();
    try {
      return waiters.size();
    } finally {
      lock.unlock();
    }
  }
}
