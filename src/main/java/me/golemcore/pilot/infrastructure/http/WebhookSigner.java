package me.golemcore.pilot.infrastructure.http;

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
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Signs outbound webhook payloads with HMAC-SHA256.
 *
 * <p>
 * The signed message is {@code <epoch seconds>.<body>}; receivers recompute it
 * from the {@value #TIMESTAMP_HEADER} header and the raw body. Verification
 * uses a constant-time comparison.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookSigner {

    public static final String SIGNATURE_HEADER = "X-Pilot-Signature";
    public static final String TIMESTAMP_HEADER = "X-Pilot-Timestamp";
    private static final String SIGNATURE_PREFIX = "v1=";
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final Clock clock;

    /**
     * Signs a serialized JSON body.
     *
     * @param body
     *            exact bytes that will be sent, as UTF-8 text
     * @param apiKey
     *            shared secret
     * @return the body together with the headers to attach
     */
    public SignedPayload sign(String body, String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("Webhook API key is not configured");
        }
        String timestamp = Long.toString(clock.instant().getEpochSecond());
        String signature = computeHmacSha256(apiKey, timestamp + "." + body);

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(TIMESTAMP_HEADER, timestamp);
        headers.put(SIGNATURE_HEADER, SIGNATURE_PREFIX + signature);
        headers.put("Content-Type", "application/json");
        return new SignedPayload(body, headers);
    }

    public boolean verify(String body, String timestamp, String signatureHeader, String apiKey) {
        if (signatureHeader == null || !signatureHeader.startsWith(SIGNATURE_PREFIX) || timestamp == null) {
            return false;
        }
        String expected = SIGNATURE_PREFIX + computeHmacSha256(apiKey, timestamp + "." + body);
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                signatureHeader.getBytes(StandardCharsets.UTF_8));
    }

    private String computeHmacSha256(String secret, String data) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            log.error("[Webhook] Failed to compute HMAC: {}", e.getMessage());
            throw new IllegalStateException("Failed to sign webhook payload", e);
        }
    }

    @Value
    public static class SignedPayload {
        String body;
        Map<String, String> headers;
    }
}
