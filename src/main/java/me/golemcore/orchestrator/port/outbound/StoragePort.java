package me.golemcore.orchestrator.port.outbound;

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
 * Port for persistent storage within the local workspace. Files are organized
 * by directory (conversations, users, memory, usage) with support for text,
 * atomic and append-only (JSONL) writes.
 */
public interface StoragePort {

    /**
     * Read text content from file, or {@code null} when the file does not exist.
     *
     * @param directory
     *            subdirectory (e.g., "conversations", "users")
     * @param path
     *            relative path within directory
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * List files by prefix, relative to the directory.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Append text to a file (for logs, JSONL).
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Write through a temp file and atomic rename so readers never observe a
     * partially written document.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content);
}
