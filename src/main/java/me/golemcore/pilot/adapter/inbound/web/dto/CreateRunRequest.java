package me.golemcore.pilot.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateRunRequest {
    private String prompt;
    private String url;
    private String title;
    private Map<String, Object> outputSchema;
    private String webhookUrl;
    private String totpVerificationUrl;
    private String totpIdentifier;
    private String totpSecret;
    private Integer maxSteps;
    private String browserSessionId;
}
