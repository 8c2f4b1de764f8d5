package me.golemcore.pilot.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BrowserSessionDto {
    private String id;
    private String status;
    private String proxyLocation;
    private Integer timeoutMinutes;
    private String runnableType;
    private String runnableId;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private Instant expiresAt;
}
