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

package me.golemcore.pilot.adapter.outbound.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.LoadState;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pilot.domain.model.BrowserAction;
import me.golemcore.pilot.domain.model.BrowserPage;
import me.golemcore.pilot.domain.model.PageElement;
import me.golemcore.pilot.domain.model.ScrapedPage;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.port.outbound.BrowserDriverPort;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Playwright implementation of {@link BrowserDriverPort}.
 *
 * <p>
 * One Chromium instance is shared; every browser session gets its own
 * {@link BrowserContext} with a single working page. Contexts optionally
 * record video and a HAR network log, which are returned on
 * {@link #closeSession(String)} for artifact sync.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code pilot.browser.enabled} - Enable/disable browser
 * <li>{@code pilot.browser.headless} - Run in headless mode
 * <li>{@code pilot.browser.timeout} - Action timeout (ms)
 * <li>{@code pilot.browser.load-timeout} - Page load timeout (ms)
 * <li>{@code pilot.browser.record-video} / {@code record-har} - Recordings
 * </ul>
 *
 * <p>
 * Playwright objects are not thread-safe, so every call runs on one dedicated
 * browser thread. The browser is launched lazily on first use.
 */
@Component
@Slf4j
public class PlaywrightBrowserDriverAdapter implements BrowserDriverPort {

    static final String ELEMENT_ID_ATTRIBUTE = "data-pilot-id";

    private static final String TAG_ELEMENTS_SCRIPT = """
            (() => {
                const selector = 'a, button, input, select, textarea, [role=button], [role=link], [onclick]';
                const result = [];
                let counter = 0;
                document.querySelectorAll(selector).forEach(el => {
                    const rect = el.getBoundingClientRect();
                    if (rect.width === 0 && rect.height === 0) {
                        return;
                    }
                    const id = 'e' + (counter++);
                    el.setAttribute('data-pilot-id', id);
                    const attributes = {};
                    ['type', 'name', 'placeholder', 'href', 'aria-label', 'value', 'role'].forEach(name => {
                        const value = el.getAttribute(name);
                        if (value) {
                            attributes[name] = value.substring(0, 200);
                        }
                    });
                    result.push({
                        id: id,
                        tagName: el.tagName.toLowerCase(),
                        text: (el.innerText || '').trim().substring(0, 200),
                        attributes: attributes
                    });
                });
                return result;
            })()
            """;

    private final PilotProperties properties;
    private final Map<String, SessionBrowser> sessions = new ConcurrentHashMap<>();
    private final ExecutorService browserThread = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "pilot-playwright");
        t.setDaemon(true);
        return t;
    });

    private Playwright playwright;
    private Browser browser;
    private volatile boolean initialized = false;

    public PlaywrightBrowserDriverAdapter(PilotProperties properties) {
        this.properties = properties;
    }

    @SuppressWarnings("PMD.CloseResource")
    private void ensureInitialized() {
        if (initialized || !properties.getBrowser().isEnabled()) {
            return;
        }
        Playwright pw = null;
        try {
            pw = Playwright.create();
            BrowserType.LaunchOptions launchOptions = new BrowserType.LaunchOptions()
                    .setHeadless(properties.getBrowser().isHeadless());
            this.browser = pw.chromium().launch(launchOptions);
            this.playwright = pw;
            initialized = true;
            log.info("[Browser] Playwright initialized (headless: {})", properties.getBrowser().isHeadless());
        } catch (Exception e) {
            log.warn("[Browser] Failed to initialize Playwright: {}", e.getMessage());
            if (pw != null) {
                try {
                    pw.close();
                } catch (Exception ex) {
                    log.trace("[Browser] Error closing Playwright: {}", ex.getMessage());
                }
            }
        }
    }

    @Override
    public CompletableFuture<BrowserPage> getOrCreatePage(String sessionId, String url) {
        return onBrowserThread(() -> {
            SessionBrowser existing = sessions.get(sessionId);
            if (existing != null && !existing.page().isClosed()) {
                return BrowserPage.builder()
                        .url(existing.page().url())
                        .title(existing.page().title())
                        .loaded(hasBody(existing.page()))
                        .build();
            }
            SessionBrowser created = openSession(sessionId);
            return load(created.page(), url);
        });
    }

    @Override
    public CompletableFuture<BrowserPage> navigate(String sessionId, String url) {
        return onBrowserThread(() -> {
            SessionBrowser session = sessions.get(sessionId);
            Page page = session != null && !session.page().isClosed() ? session.page() : openSession(sessionId).page();
            return load(page, url);
        });
    }

    @Override
    public CompletableFuture<String> currentUrl(String sessionId) {
        return onBrowserThread(() -> {
            SessionBrowser session = sessions.get(sessionId);
            return session != null && !session.page().isClosed() ? session.page().url() : null;
        });
    }

    @Override
    @SuppressWarnings("unchecked")
    public CompletableFuture<ScrapedPage> scrape(String sessionId) {
        return onBrowserThread(() -> {
            Page page = requirePage(sessionId);
            Object raw = page.evaluate(TAG_ELEMENTS_SCRIPT);
            List<PageElement> elements = new ArrayList<>();
            if (raw instanceof List<?> list) {
                for (Object item : list) {
                    if (item instanceof Map<?, ?> map) {
                        elements.add(toElement((Map<String, Object>) map));
                    }
                }
            }
            byte[] screenshot = page.screenshot(new Page.ScreenshotOptions().setFullPage(false));
            List<byte[]> screenshots = new ArrayList<>();
            screenshots.add(screenshot);
            return ScrapedPage.builder()
                    .url(page.url())
                    .title(page.title())
                    .screenshots(screenshots)
                    .elements(elements)
                    .build();
        });
    }

    @Override
    public CompletableFuture<Void> perform(String sessionId, BrowserAction action) {
        return onBrowserThread(() -> {
            Page page = requirePage(sessionId);
            Locator target = page.locator("[" + ELEMENT_ID_ATTRIBUTE + "='" + action.getElementId() + "']");
            switch (action.getType()) {
            case CLICK -> target.click();
            case INPUT_TEXT -> target.fill(action.getText() != null ? action.getText() : "");
            case SELECT_OPTION -> target.selectOption(action.getText());
            default -> throw new IllegalArgumentException("Not a page action: " + action.getType());
            }
            page.waitForLoadState(LoadState.DOMCONTENTLOADED);
            return null;
        });
    }

    @Override
    public CompletableFuture<List<Path>> closeSession(String sessionId) {
        return onBrowserThread(() -> {
            SessionBrowser session = sessions.remove(sessionId);
            List<Path> artifacts = new ArrayList<>();
            if (session == null) {
                return artifacts;
            }
            Path videoPath = null;
            try {
                if (session.page().video() != null) {
                    videoPath = session.page().video().path();
                }
            } catch (PlaywrightException e) {
                log.debug("[Browser] No video for session '{}': {}", sessionId, e.getMessage());
            }
            session.context().close();
            if (videoPath != null && Files.exists(videoPath)) {
                artifacts.add(videoPath);
            }
            if (session.harPath() != null && Files.exists(session.harPath())) {
                artifacts.add(session.harPath());
            }
            log.info("[Browser] Closed context of session '{}' ({} artifact(s))", sessionId, artifacts.size());
            return artifacts;
        });
    }

    @Override
    public boolean isAvailable() {
        return properties.getBrowser().isEnabled() && browser != null && browser.isConnected();
    }

    @PreDestroy
    public void destroy() {
        try {
            browserThread.submit(() -> {
                sessions.values().forEach(session -> {
                    try {
                        session.context().close();
                    } catch (PlaywrightException e) {
                        log.trace("[Browser] Error closing context: {}", e.getMessage());
                    }
                });
                sessions.clear();
                if (browser != null) {
                    browser.close();
                }
                if (playwright != null) {
                    playwright.close();
                }
            }).get(10, TimeUnit.SECONDS);
            log.info("[Browser] Playwright closed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("[Browser] Error closing Playwright", e);
        } finally {
            browserThread.shutdownNow();
        }
    }

    // ==================== Internals ====================

    private <T> CompletableFuture<T> onBrowserThread(Supplier<T> action) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            if (!isAvailable()) {
                throw new IllegalStateException("Browser not available or disabled");
            }
            return action.get();
        }, browserThread);
    }

    private SessionBrowser openSession(String sessionId) {
        Browser.NewContextOptions options = new Browser.NewContextOptions();
        String userAgent = properties.getBrowser().getUserAgent();
        if (userAgent != null && !userAgent.isBlank()) {
            options.setUserAgent(userAgent);
        }
        Path sessionDir = recordingsRoot().resolve(sessionId);
        if (properties.getBrowser().isRecordVideo()) {
            options.setRecordVideoDir(sessionDir.resolve("video"));
        }
        Path harPath = null;
        if (properties.getBrowser().isRecordHar()) {
            harPath = sessionDir.resolve("network.har");
            options.setRecordHarPath(harPath);
        }
        BrowserContext context = browser.newContext(options);
        context.setDefaultTimeout(properties.getBrowser().getTimeout());
        Page page = context.newPage();
        SessionBrowser session = new SessionBrowser(context, page, harPath);
        sessions.put(sessionId, session);
        log.info("[Browser] Opened context for session '{}'", sessionId);
        return session;
    }

    private BrowserPage load(Page page, String url) {
        try {
            page.navigate(url, new Page.NavigateOptions().setTimeout(properties.getBrowser().getLoadTimeout()));
            page.waitForLoadState(LoadState.DOMCONTENTLOADED);
            return BrowserPage.builder()
                    .url(page.url())
                    .title(page.title())
                    .loaded(hasBody(page))
                    .build();
        } catch (PlaywrightException e) {
            log.warn("[Browser] Failed to load {}: {}", url, e.getMessage());
            return BrowserPage.builder().url(url).loaded(false).build();
        }
    }

    private Page requirePage(String sessionId) {
        SessionBrowser session = sessions.get(sessionId);
        if (session == null || session.page().isClosed()) {
            throw new IllegalStateException("No open page for browser session " + sessionId);
        }
        return session.page();
    }

    private static boolean hasBody(Page page) {
        try {
            return page.querySelector("body") != null;
        } catch (PlaywrightException e) {
            return false;
        }
    }

    private Path recordingsRoot() {
        String configured = properties.getBrowser().getRecordingsPath();
        return Paths.get(configured.replace("${user.home}", System.getProperty("user.home")));
    }

    static PageElement toElement(Map<String, Object> raw) {
        Map<String, String> attributes = new HashMap<>();
        if (raw.get("attributes") instanceof Map<?, ?> attrs) {
            attrs.forEach((key, value) -> attributes.put(String.valueOf(key), String.valueOf(value)));
        }
        return PageElement.builder()
                .id(String.valueOf(raw.get("id")))
                .tagName(String.valueOf(raw.get("tagName")))
                .text(raw.get("text") != null ? raw.get("text").toString() : null)
                .attributes(attributes)
                .build();
    }

    private record SessionBrowser(BrowserContext context, Page page, Path harPath) {
    }
}
