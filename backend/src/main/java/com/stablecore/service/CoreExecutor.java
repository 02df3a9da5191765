package com.stablecore.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * The single thread every state transition runs on. Entry points and continuations are
 * queued here, so transitions never overlap and run in submission order.
 * Tasks must not block on other tasks of this executor.
 */
@Component
@Slf4j
public class CoreExecutor implements DisposableBean {

    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "stable-core");
        t.setDaemon(true);
        return t;
    });

    public <T> CompletableFuture<T> submit(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, executor);
    }

    public CompletableFuture<Void> run(Runnable task) {
        return CompletableFuture.runAsync(task, executor);
    }

    @Override
    public void destroy() {
        log.info("[core] shutting down executor");
        executor.shutdown();
    }
}
