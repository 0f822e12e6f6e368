package com.tabrelay.client.facade.direct;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitUntilState;
import com.tabrelay.client.facade.NavigateOptions;
import com.tabrelay.client.facade.TabContext;
import com.tabrelay.client.facade.TabLocator;
import com.tabrelay.client.facade.TabPage;
import com.tabrelay.common.error.RelayException;
import com.tabrelay.common.protocol.RelayJson;
import lombok.Getter;

import java.util.Arrays;

/**
 * A Playwright {@link Page} behind the tab facade.
 */
public class DirectTabPage implements TabPage {

    private final DirectTabContext context;
    @Getter private final Page page;

    DirectTabPage(DirectTabContext context, Page page) {
        this.context = context;
        this.page = page;
    }

    @Override
    public JsonNode navigate(String url) throws RelayException {
        return navigate(url, null);
    }

    /** @return {@code {navigated, url[, status]}}, the shape the extension reports */
    @Override
    public JsonNode navigate(String url, NavigateOptions options) throws RelayException {
        Page.NavigateOptions pwOptions = new Page.NavigateOptions();
        if (options != null) {
            if (options.getWaitUntil() != null) {
                pwOptions.setWaitUntil(PlaywrightCalls.option(WaitUntilState.class, options.getWaitUntil()));
            }
            if (options.getTimeout() != null) {
                pwOptions.setTimeout(options.getTimeout());
            }
        }
        Response response = PlaywrightCalls.call("navigate " + url, () -> page.navigate(url, pwOptions));
        ObjectNode result = RelayJson.object();
        result.put("navigated", true);
        result.put("url", page.url());
        if (response != null) {
            result.put("status", response.status());
        }
        return result;
    }

    @Override
    public String currentUrl() {
        return page.url();
    }

    @Override
    public String title() throws RelayException {
        return PlaywrightCalls.call("title", page::title);
    }

    @Override
    public JsonNode evaluate(String script, Object... args) throws RelayException {
        Object[] values = args != null ? args : new Object[0];
        return PlaywrightCalls.call("evaluate", () -> {
            Object result = values.length == 0
                    ? page.evaluate(script)
                    : page.evaluate("(args) => (" + script + ")(...args)", Arrays.asList(values));
            return PlaywrightCalls.toTree(result);
        });
    }

    @Override
    public void waitForLoadState() throws RelayException {
        waitForLoadState("load");
    }

    @Override
    public void waitForLoadState(String state) throws RelayException {
        LoadState loadState = PlaywrightCalls.option(LoadState.class, state);
        PlaywrightCalls.run("wait for " + state, () -> page.waitForLoadState(loadState));
    }

    @Override
    public void addInitScript(String script) throws RelayException {
        PlaywrightCalls.run("add init script", () -> page.addInitScript(script));
    }

    @Override
    public TabLocator locator(String selector) {
        return new DirectTabLocator(page.locator(selector), selector);
    }

    @Override
    public void close() throws RelayException {
        PlaywrightCalls.run("close page", page::close);
    }

    @Override
    public TabContext context() {
        return context;
    }
}
