package com.tabrelay.client.facade.relayed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tabrelay.client.ClientMessageRouter;
import com.tabrelay.client.facade.NavigateOptions;
import com.tabrelay.client.facade.TabContext;
import com.tabrelay.client.facade.TabLocator;
import com.tabrelay.client.facade.TabPage;
import com.tabrelay.common.error.RelayException;
import com.tabrelay.common.protocol.MessageTypes;
import com.tabrelay.common.protocol.RelayJson;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;

/**
 * Tab driven through the relay; every operation is one correlated command.
 */
public class RelayTabPage implements TabPage {

    private final ClientMessageRouter router;
    private final RelayTabContext context;
    @Getter private final int tabId;
    private volatile String cachedUrl;

    RelayTabPage(ClientMessageRouter router, RelayTabContext context, int tabId) {
        this.router = router;
        this.context = context;
        this.tabId = tabId;
    }

    @Override
    public JsonNode navigate(String url) throws RelayException {
        return navigate(url, null);
    }

    @Override
    public JsonNode navigate(String url, NavigateOptions options) throws RelayException {
        ObjectNode params = tabParams();
        params.put("url", url);
        params.set("options", options != null
                ? RelayJson.mapper().valueToTree(options)
                : RelayJson.object());
        JsonNode result = router.sendCommand(MessageTypes.NAVIGATE, params);
        // optimistic: the tab may still redirect
        cachedUrl = url;
        return result;
    }

    /** The last navigated URL when known, else the tab's reported URL. */
    @Override
    public String currentUrl() throws RelayException {
        String url = cachedUrl;
        if (url != null) return url;
        return tabInfo().path("url").asText("");
    }

    @Override
    public String title() throws RelayException {
        return tabInfo().path("title").asText("");
    }

    private JsonNode tabInfo() throws RelayException {
        return router.sendCommand(MessageTypes.GET_TAB_INFO, tabParams());
    }

    @Override
    public JsonNode evaluate(String script, Object... args) throws RelayException {
        ObjectNode params = tabParams();
        params.put("script", script);
        params.set("args", RelayJson.mapper().valueToTree(args != null ? Arrays.asList(args) : List.of()));
        return router.sendCommand(MessageTypes.EVALUATE, params);
    }

    @Override
    public void waitForLoadState() throws RelayException {
        waitForLoadState("load");
    }

    /**
     * Fixed delay; the relay has no load-state signal to wait on.
     */
    @Override
    public void waitForLoadState(String state) throws RelayException {
        try {
            Thread.sleep(router.getConfig().getLoadStateDelayMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RelayException("Interrupted waiting for load state " + state);
        }
    }

    @Override
    public void addInitScript(String script) throws RelayException {
        ObjectNode params = tabParams();
        params.put("script", script);
        router.sendCommand(MessageTypes.INJECT_SCRIPT, params);
    }

    @Override
    public TabLocator locator(String selector) {
        return new RelayTabLocator(this, selector);
    }

    @Override
    public void close() throws RelayException {
        router.sendCommand(MessageTypes.CLOSE_TAB, tabParams());
        cachedUrl = null;
    }

    @Override
    public TabContext context() {
        return context;
    }

    private ObjectNode tabParams() {
        ObjectNode params = RelayJson.object();
        params.put("tabId", tabId);
        return params;
    }

    @Override
    public String toString() {
        return "RelayTabPage{tab=" + tabId + "}";
    }
}
