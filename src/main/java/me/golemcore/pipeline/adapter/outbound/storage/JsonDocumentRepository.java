package me.golemcore.pipeline.adapter.outbound.storage;

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

import me.golemcore.pipeline.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/**
 * Base of the JSON-file repositories. The whole collection is one document
 * held in memory and rewritten atomically after every mutation that changes
 * its serialized form.
 *
 * <p>
 * Every read and write runs under a single per-collection lock, so a unique
 * key can be checked and inserted in one critical section. Readers receive
 * copies; callers never hold a reference into the stored state.
 *
 * @param <T>
 *            element type
 */
@Slf4j
abstract class JsonDocumentRepository<T> {

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final String directory;
    private final String file;
    private final Class<T> elementType;
    private final JavaType listType;
    private final Object lock = new Object();

    private List<T> items;
    private String persisted;

    protected JsonDocumentRepository(StoragePort storagePort, ObjectMapper objectMapper, String directory,
            String file, Class<T> elementType) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.directory = directory;
        this.file = file;
        this.elementType = elementType;
        this.listType = objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
    }

    /**
     * Run a read-only query. The list and its elements must not be modified.
     */
    protected <R> R read(Function<List<T>, R> query) {
        synchronized (lock) {
            return query.apply(loaded());
        }
    }

    /**
     * Run a mutation and persist the document unless it serializes exactly as
     * the stored one. When persisting fails the in-memory state is dropped and
     * reloaded from disk on next access.
     */
    protected <R> R write(Function<List<T>, R> mutation) {
        synchronized (lock) {
            List<T> working = loaded();
            R result = mutation.apply(working);
            try {
                String json = objectMapper.writeValueAsString(working);
                if (!json.equals(persisted)) {
                    storagePort.putTextAtomic(directory, file, json).join();
                    persisted = json;
                }
            } catch (JsonProcessingException | CompletionException e) {
                items = null;
                persisted = null;
                throw new IllegalStateException("Failed to persist " + directory + "/" + file, e);
            }
            return result;
        }
    }

    protected T copy(T item) {
        return item == null ? null : objectMapper.convertValue(item, elementType);
    }

    protected List<T> copyAll(List<T> source) {
        List<T> copies = new ArrayList<>(source.size());
        for (T item : source) {
            copies.add(copy(item));
        }
        return copies;
    }

    private List<T> loaded() {
        if (items == null) {
            items = load();
        }
        return items;
    }

    private List<T> load() {
        String json;
        try {
            json = storagePort.getText(directory, file).join();
        } catch (CompletionException e) {
            throw new IllegalStateException("Failed to read " + directory + "/" + file, e);
        }
        try {
            List<T> parsed = new ArrayList<>();
            if (json != null && !json.isBlank()) {
                parsed = objectMapper.readValue(json, listType);
            }
            persisted = objectMapper.writeValueAsString(parsed);
            log.debug("[Store] Loaded {} records from {}/{}", parsed.size(), directory, file);
            return new ArrayList<>(parsed);
        } catch (JsonProcessingException e) {
            log.error("[Store] Corrupt document {}/{}", directory, file, e);
            throw new IllegalStateException("Corrupt document " + directory + "/" + file, e);
        }
    }
}
