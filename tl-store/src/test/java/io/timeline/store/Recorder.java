package io.timeline.store;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Flow;

import static org.assertj.core.api.Assertions.fail;

/** Collects everything a publisher delivers. */
final class Recorder<T> implements Flow.Subscriber<T> {
    final List<T> items = new CopyOnWriteArrayList<>();
    volatile boolean completed;

    @Override public void onSubscribe(Flow.Subscription s) { s.request(Long.MAX_VALUE); }
    @Override public void onNext(T item) { items.add(item); }
    @Override public void onError(Throwable t) { completed = true; }
    @Override public void onComplete() { completed = true; }

    List<T> await(int count) {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (items.size() < count) {
            if (System.nanoTime() > deadline) fail("expected " + count + " items, got " + items);
            Thread.onSpinWait();
        }
        return List.copyOf(items);
    }

    void awaitCompletion() {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (!completed) {
            if (System.nanoTime() > deadline) fail("publisher never completed");
            Thread.onSpinWait();
        }
    }
}
