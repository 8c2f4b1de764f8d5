package me.golemcore.pilot.adapter.inbound.web.controller;

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
import me.golemcore.pilot.adapter.inbound.web.dto.BrowserSessionDto;
import me.golemcore.pilot.adapter.inbound.web.dto.CreateBrowserSessionRequest;
import me.golemcore.pilot.domain.model.BrowserSession;
import me.golemcore.pilot.domain.service.BrowserSessionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/**
 * Persistent browser session endpoints.
 */
@RestController
@RequestMapping("/api/browser-sessions")
@RequiredArgsConstructor
public class BrowserSessionsController {

    private final BrowserSessionService browserSessionService;

    @PostMapping
    public Mono<ResponseEntity<BrowserSessionDto>> createSession(
            @RequestHeader(RunsController.ORGANIZATION_HEADER) String organizationId,
            @RequestBody(required = false) CreateBrowserSessionRequest request) {
        CreateBrowserSessionRequest body = request != null ? request : new CreateBrowserSessionRequest();
        BrowserSession session = browserSessionService.create(organizationId, body.getProxyLocation(),
                body.getTimeoutMinutes());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(toDto(session)));
    }

    @GetMapping
    public Mono<ResponseEntity<List<BrowserSessionDto>>> listActiveSessions(
            @RequestHeader(RunsController.ORGANIZATION_HEADER) String organizationId) {
        List<BrowserSessionDto> dtos = browserSessionService.getActiveSessions(organizationId).stream()
                .map(BrowserSessionsController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @PostMapping("/{sessionId}/renew")
    public Mono<ResponseEntity<BrowserSessionDto>> renewSession(
            @RequestHeader(RunsController.ORGANIZATION_HEADER) String organizationId,
            @PathVariable String sessionId) {
        return Mono.just(ResponseEntity.ok(toDto(browserSessionService.renewOrClose(organizationId, sessionId))));
    }

    @PostMapping("/{sessionId}/close")
    public Mono<ResponseEntity<BrowserSessionDto>> closeSession(
            @RequestHeader(RunsController.ORGANIZATION_HEADER) String organizationId,
            @PathVariable String sessionId) {
        browserSessionService.requireSession(organizationId, sessionId);
        return Mono.just(ResponseEntity.ok(toDto(browserSessionService.close(organizationId, sessionId))));
    }

    private static BrowserSessionDto toDto(BrowserSession session) {
        return BrowserSessionDto.builder()
                .id(session.getId())
                .status(session.getStatus().name().toLowerCase(Locale.ROOT))
                .proxyLocation(session.getProxyLocation())
                .timeoutMinutes(session.getTimeoutMinutes())
                .runnableType(session.getRunnableType())
                .runnableId(session.getRunnableId())
                .createdAt(session.getCreatedAt())
                .startedAt(session.getStartedAt())
                .completedAt(session.getCompletedAt())
                .expiresAt(session.getExpiresAt())
                .build();
    }
}
