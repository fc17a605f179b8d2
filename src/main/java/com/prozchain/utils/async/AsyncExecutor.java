package com.prozchain.utils.async;

import com.prozchain.exception.global.ThreadInterruptedException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

public class AsyncExecutor {

    private final ExecutorService executorService;

    private AsyncExecutor(int poolSize) {
        this.executorService = Executors.newFixedThreadPool(poolSize);
    }

    public static AsyncExecutor withPoolSize(int poolSize) {
        return new AsyncExecutor(poolSize);
    }

    public static AsyncExecutor withSingleThread() {
        return new AsyncExecutor(1);
    }

    public <T> CompletableFuture<T> executeAsync(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, executorService);
    }

    public CompletableFuture<Void> executeAsync(Runnable task) {
        return CompletableFuture.runAsync(task, executorService);
    }

    public void executeAndForget(Runnable task) {
        executorService.execute(task);
    }

    public void shutdown(long timeoutMillis) {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
            throw new ThreadInterruptedException(e);
        }
    }
}
