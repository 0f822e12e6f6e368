package com.tabrelay.client.facade.relayed;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tabrelay.client.ClientMessageRouter;
import com.tabrelay.client.facade.TabCdpSession;
import com.tabrelay.client.facade.TabContext;
import com.tabrelay.client.facade.TabCookie;
import com.tabrelay.client.facade.TabInfo;
import com.tabrelay.client.facade.TabPage;
import com.tabrelay.common.error.ProtocolException;
import com.tabrelay.common.error.RelayException;
import com.tabrelay.common.protocol.MessageTypes;
import com.tabrelay.common.protocol.RelayJson;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Context over the one tab the relay session is bound to. Closing it detaches the
 * debugger and closes the router.
 */
@Slf4j
public class RelayTabContext implements TabContext {

    @Getter private final ClientMessageRouter router;
    @Getter private final int tabId;
    private final List<TabPage> pages = new CopyOnWriteArrayList<>();

    public RelayTabContext(ClientMessageRouter router, int tabId) {
        this.router = router;
        this.tabId = tabId;
    }

    /** The extension works with an existing tab, so every page wraps the bound tab. */
    @Override
    public TabPage newPage() {
        RelayTabPage page = new RelayTabPage(router, this, tabId);
        pages.add(page);
        return page;
    }

    @Override
    public List<TabPage> pages() {
        return List.copyOf(pages);
    }

    @Override
    public TabCdpSession newCdpSession(TabPage page) {
        int target = page instanceof RelayTabPage relayed ? relayed.getTabId() : tabId;
        return new RelayTabCdpSession(router, target);
    }

    @Override
    public JsonNode addCookies(List<TabCookie> cookies) throws RelayException {
        ObjectNode params = RelayJson.object();
        params.set("cookies", RelayJson.mapper().valueToTree(cookies));
        return router.sendCommand(MessageTypes.SET_COOKIES, params);
    }

    @Override
    public List<TabCookie> cookies(String url) throws RelayException {
        ObjectNode params = RelayJson.object();
        params.put("url", url);
        return convert(router.sendCommand(MessageTypes.GET_COOKIES, params),
                new TypeReference<List<TabCookie>>() {
        });
    }

    @Override
    public List<TabInfo> tabs() throws RelayException {
        return convert(router.sendCommand(MessageTypes.GET_ALL_TABS, RelayJson.object()),
                new TypeReference<List<TabInfo>>() {
        });
    }

    private static <T> List<T> convert(JsonNode result, TypeReference<List<T>> type) throws ProtocolException {
        if (result == null || result.isNull()) return List.of();
        try {
            return RelayJson.mapper().convertValue(result, type);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("Unexpected result shape: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        ObjectNode params = RelayJson.object();
        params.put("tabId", tabId);
        try {
            router.sendCommand(MessageTypes.DETACH_DEBUGGER, params, router.getConfig().getConnectStepTimeoutMs());
        } catch (RelayException e) {
            log.error("Error detaching debugger: {}", e.getMessage());
        }
        router.close();
    }
}
