package me.golemcore.pilot.port.outbound;

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
 * Port for durable record and artifact storage. Content is organized by
 * directory ("runs", "contexts", "browser_sessions", "otp", "artifacts") and
 * a relative path inside it.
 */
public interface StoragePort {

    /**
     * Write binary content to file.
     *
     * @param directory
     *            top-level directory (e.g., "runs", "artifacts")
     * @param path
     *            relative path within directory
     * @param content
     *            binary content
     */
    CompletableFuture<Void> putObject(String directory, String path, byte[] content);

    /**
     * Write text content to file.
     */
    CompletableFuture<Void> putText(String directory, String path, String content);

    /**
     * Read binary content, or {@code null} when the file does not exist.
     */
    CompletableFuture<byte[]> getObject(String directory, String path);

    /**
     * Read text content, or {@code null} when the file does not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    CompletableFuture<Boolean> exists(String directory, String path);

    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * List file paths (relative to {@code directory}) under a prefix.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Crash-safe write: temp file, fsync, optional {@code .bak} copy of the
     * previous version, then atomic rename.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);
}
