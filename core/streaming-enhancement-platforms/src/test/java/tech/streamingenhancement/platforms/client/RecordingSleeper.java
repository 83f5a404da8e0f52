package tech.streamingenhancement.platforms.client;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sleeper that records requested pauses instead of blocking.
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    @Override
    public void sleep(Duration duration) {
        sleeps.add(duration);
    }

    public List<Duration> sleeps() {
        return List.copyOf(sleeps);
    }

    public List<Long> millis() {
        return sleeps.stream().map(Duration::toMillis).toList();
    }
}
