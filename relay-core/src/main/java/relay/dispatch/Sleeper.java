package relay.dispatch;

/**
 * Blocking pause used for rate-limit waits and inline backoff.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
