package me.golemcore.membank.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for durable storage of the memory bank. Files are grouped by directory
 * (artifacts, ledger, gc) and addressed by a path relative to it.
 *
 * <p>
 * Artifact documents are replaced with {@link #putTextAtomic}; ledgers and the
 * garbage collection log grow through {@link #appendText} only.
 */
public interface StoragePort {

    /**
     * Read text content from file.
     *
     * @return file content, or {@code null} when the file does not exist
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Check if file exists.
     */
    CompletableFuture<Boolean> exists(String directory, String path);

    /**
     * Delete a file. Missing files are ignored.
     */
    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * List files under a directory, optionally narrowed by a sub-path prefix.
     * Returned paths are relative to the directory.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Append text to a file, creating it when needed (JSONL ledgers).
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Crash-safe replacement of a file: write to a {@code .tmp} sibling, fsync,
     * then rename over the target.
     *
     * @param directory
     *            subdirectory
     * @param path
     *            relative path within directory
     * @param content
     *            text content to write
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content);

    /**
     * Ensure directory exists.
     */
    CompletableFuture<Void> ensureDirectory(String directory);
}
