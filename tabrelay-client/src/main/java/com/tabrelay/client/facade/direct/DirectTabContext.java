package com.tabrelay.client.facade.direct;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.SameSiteAttribute;
import com.tabrelay.client.facade.TabCdpSession;
import com.tabrelay.client.facade.TabContext;
import com.tabrelay.client.facade.TabCookie;
import com.tabrelay.client.facade.TabInfo;
import com.tabrelay.client.facade.TabPage;
import com.tabrelay.common.error.RelayException;
import com.tabrelay.common.protocol.RelayJson;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A Playwright {@link BrowserContext} behind the tab facade, for browsers launched or
 * reached directly rather than through the relay.
 */
@Slf4j
public class DirectTabContext implements TabContext {

    @Getter private final BrowserContext context;
    private final Playwright owned;
    private final Map<Page, DirectTabPage> pages = new ConcurrentHashMap<>();

    /**
     * Wrap a context owned by the caller; {@link #close()} closes the context only.
     */
    public DirectTabContext(BrowserContext context) {
        this(context, null);
    }

    private DirectTabContext(BrowserContext context, Playwright owned) {
        this.context = context;
        this.owned = owned;
    }

    // ==================== Launch ====================

    /**
     * Launch a local Chromium and open a fresh context in it.
     */
    public static DirectTabContext launch(boolean headless) throws RelayException {
        Playwright playwright = Playwright.create();
        try {
            Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(headless));
            log.info("Launched Chromium (headless={})", headless);
            return new DirectTabContext(browser.newContext(), playwright);
        } catch (PlaywrightException e) {
            playwright.close();
            throw new RelayException("Browser launch failed: " + e.getMessage(), e);
        }
    }

    /**
     * Attach to a running Chrome through its CDP endpoint, reusing its first context.
     */
    public static DirectTabContext connectOverCdp(String cdpUrl) throws RelayException {
        Playwright playwright = Playwright.create();
        try {
            log.info("Connecting Playwright to CDP: {}", cdpUrl);
            Browser browser = playwright.chromium().connectOverCDP(cdpUrl);
            List<BrowserContext> contexts = browser.contexts();
            BrowserContext context = contexts.isEmpty() ? browser.newContext() : contexts.get(0);
            return new DirectTabContext(context, playwright);
        } catch (PlaywrightException e) {
            playwright.close();
            throw new RelayException("CDP connection failed: " + e.getMessage(), e);
        }
    }

    // ==================== Pages ====================

    /** Reuses the context's first open page, creating one only when there is none. */
    @Override
    public TabPage newPage() throws RelayException {
        Page page = PlaywrightCalls.call("new page", () -> {
            for (Page existing : context.pages()) {
                if (!existing.isClosed() && !pages.containsKey(existing)) return existing;
            }
            return context.newPage();
        });
        return wrap(page);
    }

    @Override
    public List<TabPage> pages() {
        List<TabPage> open = new ArrayList<>();
        for (Page page : context.pages()) {
            if (!page.isClosed()) open.add(wrap(page));
        }
        return open;
    }

    private DirectTabPage wrap(Page page) {
        return pages.computeIfAbsent(page, p -> new DirectTabPage(this, p));
    }

    @Override
    public TabCdpSession newCdpSession(TabPage page) throws RelayException {
        if (!(page instanceof DirectTabPage direct)) {
            throw new IllegalArgumentException("Not a page of a direct context: " + page);
        }
        Page target = direct.getPage();
        return new DirectTabCdpSession(PlaywrightCalls.call("new CDP session",
                () -> context.newCDPSession(target)), target);
    }

    // ==================== Cookies and tabs ====================

    @Override
    public JsonNode addCookies(List<TabCookie> cookies) throws RelayException {
        ArrayNode results = RelayJson.mapper().createArrayNode();
        for (TabCookie cookie : cookies) {
            ObjectNode outcome = results.addObject();
            outcome.set("cookie", RelayJson.mapper().valueToTree(cookie));
            try {
                context.addCookies(List.of(toPlaywright(cookie)));
                outcome.put("success", true);
            } catch (PlaywrightException e) {
                outcome.put("success", false);
                outcome.put("error", e.getMessage());
            }
        }
        return results;
    }

    @Override
    public List<TabCookie> cookies(String url) throws RelayException {
        List<Cookie> found = PlaywrightCalls.call("cookies", () -> context.cookies(url));
        List<TabCookie> cookies = new ArrayList<>(found.size());
        for (Cookie cookie : found) {
            cookies.add(fromPlaywright(cookie));
        }
        return cookies;
    }

    @Override
    public List<TabInfo> tabs() throws RelayException {
        List<Page> open = PlaywrightCalls.call("list pages", context::pages);
        List<TabInfo> tabs = new ArrayList<>(open.size());
        for (int i = 0; i < open.size(); i++) {
            Page page = open.get(i);
            tabs.add(TabInfo.builder()
                    .tabId(i)
                    .index(i)
                    .url(page.url())
                    .title(PlaywrightCalls.call("title", page::title))
                    .build());
        }
        return tabs;
    }

    static Cookie toPlaywright(TabCookie cookie) {
        Cookie pw = new Cookie(cookie.getName(), cookie.getValue());
        if (cookie.getUrl() != null) pw.setUrl(cookie.getUrl());
        if (cookie.getDomain() != null) pw.setDomain(cookie.getDomain());
        if (cookie.getPath() != null) pw.setPath(cookie.getPath());
        if (cookie.getExpirationDate() != null) pw.setExpires(cookie.getExpirationDate());
        if (cookie.getHttpOnly() != null) pw.setHttpOnly(cookie.getHttpOnly());
        if (cookie.getSecure() != null) pw.setSecure(cookie.getSecure());
        SameSiteAttribute sameSite = sameSite(cookie.getSameSite());
        if (sameSite != null) pw.setSameSite(sameSite);
        return pw;
    }

    static TabCookie fromPlaywright(Cookie cookie) {
        return TabCookie.builder()
                .name(cookie.name)
                .value(cookie.value)
                .domain(cookie.domain)
                .path(cookie.path)
                .secure(cookie.secure)
                .httpOnly(cookie.httpOnly)
                .sameSite(cookie.sameSite == null ? null : switch (cookie.sameSite) {
                    case NONE -> "no_restriction";
                    case LAX -> "lax";
                    case STRICT -> "strict";
                })
                // Playwright reports -1 for session cookies
                .expirationDate(cookie.expires == null || cookie.expires < 0 ? null : cookie.expires)
                .build();
    }

    private static SameSiteAttribute sameSite(String value) {
        if (value == null) return null;
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "no_restriction", "none" -> SameSiteAttribute.NONE;
            case "lax" -> SameSiteAttribute.LAX;
            case "strict" -> SameSiteAttribute.STRICT;
            default -> null;
        };
    }

    // ==================== Lifecycle ====================

    @Override
    public void close() {
        try {
            context.close();
        } catch (PlaywrightException e) {
            log.error("Error closing browser context: {}", e.getMessage());
        }
        if (owned != null) {
            try {
                owned.close();
            } catch (PlaywrightException e) {
                log.error("Error closing Playwright: {}", e.getMessage());
            }
        }
    }
}
