/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.pipeline.adapter.outbound.storage;

import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import me.golemcore.pipeline.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * {@link StoragePort} over a workspace directory on the local disk.
 *
 * <p>
 * Each collection lives in its own subdirectory of
 * {@code pipeline.storage.local.base-path}: signals, insights, review,
 * similarity, agents, webhooks and the JSONL usage journal under usage.
 * Documents are replaced through a synced temporary sibling that is then
 * renamed over the target.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    static final List<String> KNOWN_DIRECTORIES = List.of(
            "signals", "insights", "review", "similarity", "agents", "webhooks", "usage");

    private final PipelineProperties properties;

    private Path workspace;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getLocal().getBasePath()
                .replace("${user.home}", System.getProperty("user.home"));
        workspace = Paths.get(configured).toAbsolutePath().normalize();
        try {
            for (String directory : KNOWN_DIRECTORIES) {
                Files.createDirectories(workspace.resolve(directory));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot prepare workspace " + workspace, e);
        }
        log.info("[Store] Workspace ready at {}", workspace);
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return onDisk("read", directory, path, file -> Files.isRegularFile(file)
                ? Files.readString(file, StandardCharsets.UTF_8)
                : null);
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        String start = prefix == null ? "" : prefix;
        return onDisk("list", directory, start, root -> {
            if (!Files.exists(root)) {
                return List.of();
            }
            Path collection = workspace.resolve(directory);
            try (Stream<Path> walk = Files.walk(root)) {
                return walk.filter(Files::isRegularFile)
                        .map(file -> collection.relativize(file).toString())
                        .sorted()
                        .toList();
            }
        });
    }

    @Override
    public CompletableFuture<Void> appendText(String directory, String path, String content) {
        return onDisk("append", directory, path, file -> {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content) {
        return onDisk("write", directory, path, file -> {
            Files.createDirectories(file.getParent());
            Path staged = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
            try {
                try (FileChannel channel = FileChannel.open(staged, StandardOpenOption.WRITE,
                        StandardOpenOption.TRUNCATE_EXISTING)) {
                    ByteBuffer buffer = ByteBuffer.wrap(content.getBytes(StandardCharsets.UTF_8));
                    while (buffer.hasRemaining()) {
                        channel.write(buffer);
                    }
                    channel.force(true);
                }
                replace(staged, file);
            } finally {
                Files.deleteIfExists(staged);
            }
            log.debug("[Store] Wrote {}/{}", directory, path);
            return null;
        });
    }

    private static void replace(Path staged, Path target) throws IOException {
        try {
            Files.move(staged, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Store] Filesystem has no atomic rename, replacing {} in place", target.getFileName());
            Files.move(staged, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private <T> CompletableFuture<T> onDisk(String action, String directory, String path, FileAction<T> body) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = locate(directory, path);
            try {
                return body.apply(file);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to " + action + " " + directory + "/" + path, e);
            }
        });
    }

    private Path locate(String directory, String path) {
        Path resolved = workspace.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(workspace.resolve(directory))) {
            throw new IllegalArgumentException("Path escapes its collection: " + directory + "/" + path);
        }
        return resolved;
    }

    @FunctionalInterface
    private interface FileAction<T> {
        T apply(Path file) throws IOException;
    }
}
