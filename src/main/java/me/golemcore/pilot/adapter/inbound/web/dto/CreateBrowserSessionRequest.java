package me.golemcore.pilot.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateBrowserSessionRequest {
    private String proxyLocation;
    private Integer timeoutMinutes;
}
