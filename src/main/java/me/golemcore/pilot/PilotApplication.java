package me.golemcore.pilot;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Main application class for GolemCore Pilot.
 *
 * <p>
 * GolemCore Pilot drives a browser-automation agent: it accepts a
 * natural-language goal and a starting page, decides one concrete action per
 * iteration, executes it against a live browser and judges whether the goal is
 * satisfied.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → RunsController, BrowserSessionsController, OtpController
 * Domain Layer       → PlanningLoop, BlockGenerator, OtpCoordinator, BrowserSessionService
 * Infrastructure     → LLM/Storage/Browser/Notification Adapters
 * </pre>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
public class PilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(PilotApplication.class, args);
    }
}
