package me.golemcore.pilot.domain.model;

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

import lombok.Value;

import java.util.Locale;

/**
 * A resolved one-time credential ready to be typed or followed.
 */
@Value
public class OtpValue {

    String value;
    OtpType type;

    public static OtpValue of(String value) {
        return new OtpValue(value, detectType(value));
    }

    public static OtpType detectType(String value) {
        if (value == null) {
            return OtpType.TOTP;
        }
        String lower = value.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://") ? OtpType.MAGIC_LINK : OtpType.TOTP;
    }
}
