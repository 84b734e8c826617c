package me.golemcore.spoiler.support;

import me.golemcore.spoiler.port.outbound.StoragePort;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * StoragePort backed by a map, with switchable write failures.
 */
public class InMemoryStoragePort implements StoragePort {

    private final Map<String, String> files = new ConcurrentHashMap<>();
    private final List<String> backups = new CopyOnWriteArrayList<>();
    private volatile boolean failWrites;
    private volatile boolean failReads;

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        if (failReads) {
            return CompletableFuture.failedFuture(new IllegalStateException("read failed"));
        }
        return CompletableFuture.completedFuture(files.get(key(directory, path)));
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        if (failWrites) {
            return CompletableFuture.failedFuture(new IllegalStateException("disk full"));
        }
        String key = key(directory, path);
        if (backup && files.containsKey(key)) {
            backups.add(files.get(key));
        }
        files.put(key, content);
        return CompletableFuture.completedFuture(null);
    }

    public String read(String directory, String path) {
        return files.get(key(directory, path));
    }

    public void write(String directory, String path, String content) {
        files.put(key(directory, path), content);
    }

    public List<String> getBackups() {
        return new ArrayList<>(backups);
    }

    public void setFailWrites(boolean failWrites) {
        this.failWrites = failWrites;
    }

    public void setFailReads(boolean failReads) {
        this.failReads = failReads;
    }

    private static String key(String directory, String path) {
        return directory + "/" + path;
    }
}
