package me.golemcore.pipeline.port.outbound;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Workspace files behind the JSON document collections and the usage journal.
 * Every path is relative to a collection directory ("signals", "usage", ...).
 */
public interface StoragePort {

    /**
     * @return the file's UTF-8 text, or {@code null} when it does not exist
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Paths of regular files under {@code prefix}, relative to the directory and
     * sorted. A missing directory yields an empty list.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Append to a file, creating it when absent.
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Replace a file's content so that readers observe either the old or the new
     * document, never a partial one.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content);
}
