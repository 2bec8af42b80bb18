package me.golemcore.membank.testsupport;

import me.golemcore.membank.port.outbound.StoragePort;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed StoragePort for service tests, with switches that make writes to
 * a given directory fail.
 */
public class InMemoryStoragePort implements StoragePort {

    private final Map<String, String> files = new ConcurrentHashMap<>();
    private final Map<String, Boolean> failingWrites = new ConcurrentHashMap<>();

    public void failWritesTo(String directory, boolean fail) {
        failingWrites.put(directory, fail);
    }

    public String raw(String directory, String path) {
        return files.get(key(directory, path));
    }

    public void putRaw(String directory, String path, String content) {
        files.put(key(directory, path), content);
    }

    public int fileCount(String directory) {
        String prefix = directory + "/";
        return (int) files.keySet().stream().filter(k -> k.startsWith(prefix)).count();
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.completedFuture(files.get(key(directory, path)));
    }

    @Override
    public CompletableFuture<Boolean> exists(String directory, String path) {
        return CompletableFuture.completedFuture(files.containsKey(key(directory, path)));
    }

    @Override
    public CompletableFuture<Void> deleteObject(String directory, String path) {
        if (isFailing(directory)) {
            return failed(directory, path);
        }
        files.remove(key(directory, path));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        String dirPrefix = directory + "/";
        String fullPrefix = dirPrefix + (prefix != null ? prefix : "");
        List<String> result = files.keySet().stream()
                .filter(k -> k.startsWith(fullPrefix))
                .map(k -> k.substring(dirPrefix.length()))
                .sorted()
                .toList();
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public CompletableFuture<Void> appendText(String directory, String path, String content) {
        if (isFailing(directory)) {
            return failed(directory, path);
        }
        files.merge(key(directory, path), content, String::concat);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content) {
        if (isFailing(directory)) {
            return failed(directory, path);
        }
        files.put(key(directory, path), content);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> ensureDirectory(String directory) {
        return CompletableFuture.completedFuture(null);
    }

    private boolean isFailing(String directory) {
        return failingWrites.getOrDefault(directory, false);
    }

    private static CompletableFuture<Void> failed(String directory, String path) {
        return CompletableFuture.failedFuture(
                new UncheckedIOException(new IOException("Simulated write failure: " + directory + "/" + path)));
    }

    private static String key(String directory, String path) {
        return directory + "/" + path;
    }
}
