package com.tabrelay.client.facade.relayed;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabrelay.client.facade.TabLocator;
import com.tabrelay.common.error.RelayException;

/**
 * Locator that resolves its element with an XPath lookup inside one EVALUATE round trip.
 */
public class RelayTabLocator implements TabLocator {

    private final RelayTabPage page;
    private final String selector;

    RelayTabLocator(RelayTabPage page, String selector) {
        this.page = page;
        this.selector = selector;
    }

    @Override
    public boolean click() throws RelayException {
        return page.evaluate(LocatorScripts.click(selector)).asBoolean(false);
    }

    @Override
    public boolean fill(String value) throws RelayException {
        return page.evaluate(LocatorScripts.fill(selector, value)).asBoolean(false);
    }

    @Override
    public JsonNode evaluate(String fn, Object... args) throws RelayException {
        return page.evaluate(LocatorScripts.evaluate(selector, fn), args);
    }

    /** XPath lookups already return the first match. */
    @Override
    public TabLocator first() {
        return this;
    }

    @Override
    public String selector() {
        return selector;
    }
}
