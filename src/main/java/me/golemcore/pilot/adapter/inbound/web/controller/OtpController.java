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
import me.golemcore.pilot.adapter.inbound.web.dto.OtpCodeDto;
import me.golemcore.pilot.adapter.inbound.web.dto.SubmitOtpRequest;
import me.golemcore.pilot.domain.model.OtpCode;
import me.golemcore.pilot.domain.service.OtpCodeService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Accepts one-time codes pushed by email/SMS forwarders or by hand.
 */
@RestController
@RequestMapping("/api/otp")
@RequiredArgsConstructor
public class OtpController {

    private final OtpCodeService otpCodeService;

    @PostMapping
    public Mono<ResponseEntity<OtpCodeDto>> submitCode(
            @RequestHeader(RunsController.ORGANIZATION_HEADER) String organizationId,
            @RequestBody SubmitOtpRequest request) {
        OtpCode saved = otpCodeService.submit(OtpCode.builder()
                .organizationId(organizationId)
                .identifier(request.getIdentifier())
                .runId(request.getRunId())
                .taskId(request.getTaskId())
                .content(request.getContent())
                .source(request.getSource())
                .expiredAt(request.getExpiredAt())
                .build());
        OtpCodeDto dto = OtpCodeDto.builder()
                .id(saved.getId())
                .identifier(saved.getIdentifier())
                .runId(saved.getRunId())
                .taskId(saved.getTaskId())
                .type(saved.getType().name().toLowerCase(Locale.ROOT))
                .expiredAt(saved.getExpiredAt())
                .createdAt(saved.getCreatedAt())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(dto));
    }
}
