package tech.streamingenhancement.platforms.client;

import org.jboss.logging.Logger;
import tech.streamingenhancement.platforms.exception.PlatformException;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Fixed-interval dispatch gate: at most one request start per interval, no bursts.
 *
 * <p>Callers are released one at a time in arrival order (fair lock). A caller arriving
 * before the interval has elapsed since the previous dispatch waits for the remainder.
 * Only the dispatch start is serialized; the request itself runs outside the gate.
 */
public class RequestThrottle {

    private static final Logger LOG = Logger.getLogger(RequestThrottle.class);

    private final long intervalMillis;
    private final Sleeper sleeper;
    private final LongSupplier clockMillis;
    private final ReentrantLock lock = new ReentrantLock(true);

    private boolean dispatched;
    private long lastDispatchMillis;

    public RequestThrottle(Duration interval) {
        this(interval, Sleeper.system(), () -> System.nanoTime() / 1_000_000);
    }

    public RequestThrottle(Duration interval, Sleeper sleeper, LongSupplier clockMillis) {
        if (interval.isNegative()) {
            throw new IllegalArgumentException("Throttle interval must not be negative: " + interval);
        }
        this.intervalMillis = interval.toMillis();
        this.sleeper = sleeper;
        this.clockMillis = clockMillis;
    }

    /**
     * Block until the caller may dispatch its request.
     */
    public void acquire() {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlatformException("Interrupted while waiting for rate limiter", e);
        }
        try {
            if (dispatched) {
                long waitMillis = lastDispatchMillis + intervalMillis - clockMillis.getAsLong();
                if (waitMillis > 0) {
                    LOG.debugf("Rate limit: waiting %dms", waitMillis);
                    sleeper.sleep(Duration.ofMillis(waitMillis));
                }
            }
            lastDispatchMillis = clockMillis.getAsLong();
            dispatched = true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PlatformException("Interrupted while waiting for rate limiter", e);
        } finally {
            lock.unlock();
        }
    }

    public Duration interval() {
        return Duration.ofMillis(intervalMillis);
    }
}
