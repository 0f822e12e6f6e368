package com.tabrelay.client.facade.direct;

import com.fasterxml.jackson.databind.JsonNode;
import com.microsoft.playwright.Locator;
import com.tabrelay.client.facade.TabLocator;
import com.tabrelay.common.error.RelayException;

import java.util.Arrays;

/**
 * Playwright locator behind the tab facade. Like the relayed locator it acts on the
 * first match and reports a missing element as {@code false}.
 */
public class DirectTabLocator implements TabLocator {

    private final Locator locator;
    private final String selector;

    DirectTabLocator(Locator locator, String selector) {
        this.locator = locator;
        this.selector = selector;
    }

    @Override
    public boolean click() throws RelayException {
        return PlaywrightCalls.call("click " + selector, () -> {
            if (locator.count() == 0) return false;
            locator.first().click();
            return true;
        });
    }

    @Override
    public boolean fill(String value) throws RelayException {
        return PlaywrightCalls.call("fill " + selector, () -> {
            if (locator.count() == 0) return false;
            locator.first().fill(value);
            return true;
        });
    }

    @Override
    public JsonNode evaluate(String fn, Object... args) throws RelayException {
        return PlaywrightCalls.call("evaluate on " + selector, () -> {
            if (locator.count() == 0) return null;
            Object result = locator.first().evaluate(
                    "(element, args) => (" + fn + ")(element, ...args)", Arrays.asList(args));
            return PlaywrightCalls.toTree(result);
        });
    }

    @Override
    public TabLocator first() {
        return new DirectTabLocator(locator.first(), selector);
    }

    @Override
    public String selector() {
        return selector;
    }
}
