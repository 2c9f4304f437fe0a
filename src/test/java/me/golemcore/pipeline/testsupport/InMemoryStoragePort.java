package me.golemcore.pipeline.testsupport;

import me.golemcore.pipeline.port.outbound.StoragePort;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map-backed {@link StoragePort}; every operation completes immediately.
 */
public final class InMemoryStoragePort implements StoragePort {

    private final Map<String, String> files = new ConcurrentHashMap<>();
    private final AtomicInteger writes = new AtomicInteger();
    private volatile boolean failWrites;

    public String content(String directory, String path) {
        return files.get(key(directory, path));
    }

    public void put(String directory, String path, String content) {
        files.put(key(directory, path), content);
    }

    public int writeCount() {
        return writes.get();
    }

    public void failWrites(boolean fail) {
        this.failWrites = fail;
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.completedFuture(files.get(key(directory, path)));
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        String base = directory + "/" + (prefix != null ? prefix : "");
        List<String> paths = files.keySet().stream()
                .filter(k -> k.startsWith(base))
                .map(k -> k.substring(directory.length() + 1))
                .sorted()
                .toList();
        return CompletableFuture.completedFuture(paths);
    }

    @Override
    public CompletableFuture<Void> appendText(String directory, String path, String content) {
        files.merge(key(directory, path), content, String::concat);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content) {
        if (failWrites) {
            return CompletableFuture.failedFuture(new IllegalStateException("disk full"));
        }
        writes.incrementAndGet();
        files.put(key(directory, path), content);
        return CompletableFuture.completedFuture(null);
    }

    private static String key(String directory, String path) {
        return directory + "/" + path;
    }
}
