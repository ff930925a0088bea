package com.ormguard.core.dev;

import com.ormguard.core.runtime.PolicyStore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 策略文件热加载（开发模式）
 * 职责：监听策略文件变化，防抖后重新发布到 {@link PolicyStore}。
 * 加载失败时保留原策略。
 */
@Slf4j
public class PolicyFileWatcher implements AutoCloseable {

    private static final long DEFAULT_DEBOUNCE_MS = 500;

    private final Path file;
    private final PolicyStore store;
    private final long debounceMs;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private WatchService watchService;

    // 防抖调度器：一次保存可能触发多次事件
    private final ScheduledExecutorService debounceExecutor = Executors.newSingleThreadScheduledExecutor(
            r -> {
                Thread thread = new Thread(r, "ormguard-policy-debounce");
                thread.setDaemon(true);
                thread.setUncaughtExceptionHandler(
                        (t, e) -> log.error("Thread {} exception: {}", t.getName(), e.getMessage()));
                return thread;
            });
    private ScheduledFuture<?> debounceTask;

    public PolicyFileWatcher(Path file, PolicyStore store) {
        this(file, store, DEFAULT_DEBOUNCE_MS);
    }

    public PolicyFileWatcher(Path file, PolicyStore store, long debounceMs) {
        this.file = file.toAbsolutePath().normalize();
        this.store = store;
        this.debounceMs = debounceMs;
    }

    public synchronized void start() {
        // 关闭后防抖调度器已停止，不可复用
        if (closed.get()) {
            throw new IllegalStateException("Policy file watcher is closed: " + file);
        }
        if (started.get()) {
            return;
        }
        Path dir = file.getParent();
        try {
            this.watchService = FileSystems.getDefault().newWatchService();
            dir.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY, StandardWatchEventKinds.ENTRY_CREATE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to watch policy directory: " + dir, e);
        }
        startWatchLoop();
        started.set(true);
        log.info("[PolicyStore] Watching policy file: {}", file);
    }

    /**
     * 立即重新加载
     *
     * @return 是否发布成功
     */
    public boolean reloadNow() {
        try {
            store.publish(file);
            return true;
        } catch (RuntimeException e) {
            log.warn("[PolicyStore] Reload of {} failed, keeping previous policy: {}", file, e.getMessage());
            return false;
        }
    }

    public boolean isStarted() {
        return started.get();
    }

    @Override
    public synchronized void close() {
        closed.set(true);
        started.set(false);
        debounceExecutor.shutdownNow();
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("[PolicyStore] Failed to close watch service", e);
            }
        }
    }

    private void startWatchLoop() {
        Thread thread = new Thread(() -> {
            while (true) {
                try {
                    WatchKey key = watchService.take();
                    boolean relevant = false;
                    for (WatchEvent<?> event : key.pollEvents()) {
                        Object context = event.context();
                        if (context instanceof Path && file.getFileName().equals(context)) {
                            relevant = true;
                        }
                    }
                    if (relevant) {
                        scheduleReload();
                    }
                    if (!key.reset()) {
                        log.warn("[PolicyStore] Policy directory no longer accessible: {}", file.getParent());
                        break;
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (ClosedWatchServiceException e) {
                    break;
                } catch (Exception e) {
                    log.error("Error in policy watch loop", e);
                }
            }
        });
        thread.setDaemon(true);
        thread.setName("ormguard-policy-watcher");
        thread.start();
    }

    private synchronized void scheduleReload() {
        if (debounceTask != null && !debounceTask.isDone()) {
            debounceTask.cancel(false);
        }
        debounceTask = debounceExecutor.schedule(this::reloadNow, debounceMs, TimeUnit.MILLISECONDS);
    }
}
