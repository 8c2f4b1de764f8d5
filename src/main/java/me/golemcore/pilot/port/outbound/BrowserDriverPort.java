package me.golemcore.pilot.port.outbound;

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

import me.golemcore.pilot.domain.model.BrowserAction;
import me.golemcore.pilot.domain.model.BrowserPage;
import me.golemcore.pilot.domain.model.ScrapedPage;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the live browser behind a browser session. Every operation works on
 * the session's single working page.
 */
public interface BrowserDriverPort {

    /**
     * Returns the working page, opening it at {@code url} when none exists yet.
     */
    CompletableFuture<BrowserPage> getOrCreatePage(String sessionId, String url);

    /**
     * Navigates the working page. The returned page reports whether it loaded.
     */
    CompletableFuture<BrowserPage> navigate(String sessionId, String url);

    /**
     * Current URL of the working page, or {@code null} when no page is open.
     */
    CompletableFuture<String> currentUrl(String sessionId);

    /**
     * Captures screenshots and the interactable element tree of the working page.
     */
    CompletableFuture<ScrapedPage> scrape(String sessionId);

    /**
     * Performs one element-level action on the working page.
     */
    CompletableFuture<Void> perform(String sessionId, BrowserAction action);

    /**
     * Closes the browser context of a session and returns the recorded artifact
     * files (video, network log) so they can be synced.
     */
    CompletableFuture<List<Path>> closeSession(String sessionId);

    boolean isAvailable();
}
