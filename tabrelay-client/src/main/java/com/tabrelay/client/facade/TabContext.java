package com.tabrelay.client.facade;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabrelay.common.error.RelayException;

import java.util.List;

/**
 * A browser context that owns one or more tabs. Callers depend on this interface only;
 * whether the tab is driven through a relay or by a locally launched browser is an
 * implementation detail.
 */
public interface TabContext extends AutoCloseable {

    /** A page handle for a tab of this context. */
    TabPage newPage() throws RelayException;

    /** Page handles handed out so far. */
    List<TabPage> pages();

    TabCdpSession newCdpSession(TabPage page) throws RelayException;

    /**
     * Set cookies in the browser.
     *
     * @return one outcome per cookie, {@code {success, cookie[, error]}}
     */
    JsonNode addCookies(List<TabCookie> cookies) throws RelayException;

    /** Cookies visible to {@code url}. */
    List<TabCookie> cookies(String url) throws RelayException;

    /** Every tab the browser has open. */
    List<TabInfo> tabs() throws RelayException;

    /** Release the tab and the connection behind it. Failures are logged, not thrown. */
    @Override
    void close();
}
