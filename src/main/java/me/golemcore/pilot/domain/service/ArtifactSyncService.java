package me.golemcore.pilot.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pilot.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Copies browser session recordings (video, network log) into durable storage
 * under {@code artifacts/{organizationId}/{sessionId}/}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArtifactSyncService {

    static final String ARTIFACTS_DIR = "artifacts";

    private final StoragePort storagePort;

    /**
     * Syncs every readable file and returns the storage keys written. Unreadable
     * files are skipped with a warning.
     */
    public List<String> syncSessionArtifacts(String organizationId, String sessionId, List<Path> files) {
        List<String> keys = new ArrayList<>();
        if (files == null || files.isEmpty()) {
            return keys;
        }
        for (Path file : files) {
            if (file == null || file.getFileName() == null) {
                continue;
            }
            String key = organizationId + "/" + sessionId + "/" + file.getFileName();
            try {
                byte[] content = Files.readAllBytes(file);
                storagePort.putObject(ARTIFACTS_DIR, key, content).join();
                keys.add(key);
            } catch (IOException | RuntimeException e) { // NOSONAR - one lost recording must not block close
                log.warn("[Artifacts] Failed to sync {} for session '{}': {}", file, sessionId, e.getMessage());
            }
        }
        log.info("[Artifacts] Synced {} artifact(s) for session '{}'", keys.size(), sessionId);
        return keys;
    }
}
