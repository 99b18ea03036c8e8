package me.golemcore.oracle.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Durable storage for the oracle's records, one directory per record kind
 * (history, notes, tasks, aegis).
 *
 * <p>
 * Two write shapes are supported: whole-document JSON rewritten atomically
 * (notes, tasks), and append-only JSONL rows (conversation entries, aegis
 * snapshots). Both are on disk before the returned future completes.
 */
public interface StoragePort {

    /**
     * Reads a whole file, completing with {@code null} when it does not exist.
     */
    CompletableFuture<String> readText(String directory, String path);

    /**
     * Appends one JSONL row. A trailing newline is added when missing.
     */
    CompletableFuture<Void> appendLine(String directory, String path, String line);

    /**
     * Replaces a file through a synced temporary file and an atomic rename.
     *
     * @param backup
     *            keep the previous version next to the file as {@code .bak}
     */
    CompletableFuture<Void> writeAtomic(String directory, String path, String content, boolean backup);
}
