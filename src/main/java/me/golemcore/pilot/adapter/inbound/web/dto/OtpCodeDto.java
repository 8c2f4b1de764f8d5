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
public class OtpCodeDto {
    private String id;
    private String identifier;
    private String runId;
    private String taskId;
    private String type;
    private Instant expiredAt;
    private Instant createdAt;
}
