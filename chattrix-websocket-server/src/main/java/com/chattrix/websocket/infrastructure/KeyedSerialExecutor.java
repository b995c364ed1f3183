package com.chattrix.websocket.infrastructure;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs tasks on a shared executor while keeping tasks with the same key in
 * submission order. Tasks for different keys run in parallel.
 *
 * Each key has a tail future; a new task is chained behind it and becomes the
 * new tail. The tail is dropped once it completes and nothing was queued after it.
 */
@Slf4j
public class KeyedSerialExecutor {

    private final Executor executor;
    private final ConcurrentHashMap<Object, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public KeyedSerialExecutor(Executor executor) {
        this.executor = executor;
    }

    public CompletableFuture<Void> submit(Object key, Runnable task) {
        CompletableFuture<Void> next = new CompletableFuture<>();
        CompletableFuture<Void> previous = tails.put(key, next);
        if (previous == null) {
            previous = CompletableFuture.completedFuture(null);
        }

        previous.whenComplete((ignored, error) -> {
            try {
                executor.execute(() -> runTask(key, task, next));
            } catch (RejectedExecutionException e) {
                log.error("Task rejected: key={}", key, e);
                finish(key, next);
            }
        });
        return next;
    }

    /**
     * Number of keys with queued or running work.
     */
    public int activeKeys() {
        return tails.size();
    }

    private void runTask(Object key, Runnable task, CompletableFuture<Void> done) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Serial task failed: key={}", key, e);
        } finally {
            finish(key, done);
        }
    }

    private void finish(Object key, CompletableFuture<Void> done) {
        tails.remove(key, done);
        done.complete(null);
    }
}
