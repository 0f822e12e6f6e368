package com.tabrelay.client.facade;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabrelay.common.error.RelayException;

/**
 * Handle on one browser tab.
 */
public interface TabPage {

    JsonNode navigate(String url) throws RelayException;

    JsonNode navigate(String url, NavigateOptions options) throws RelayException;

    String currentUrl() throws RelayException;

    String title() throws RelayException;

    /**
     * Evaluate a JavaScript function in the page.
     *
     * @param script source of a function expression; it is called with {@code args}
     * @return the function's JSON-serializable result
     */
    JsonNode evaluate(String script, Object... args) throws RelayException;

    /** Wait for the page to reach the "load" state. */
    void waitForLoadState() throws RelayException;

    void waitForLoadState(String state) throws RelayException;

    /** Run {@code script} in the page and its frames. */
    void addInitScript(String script) throws RelayException;

    TabLocator locator(String selector);

    /** Close the tab itself. */
    void close() throws RelayException;

    TabContext context();
}
