package com.tabrelay.client.facade;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabrelay.common.error.RelayException;

/**
 * Element lookup by selector. Actions run once against the first match; there is
 * no retry and no actionability wait.
 */
public interface TabLocator {

    /** @return false if nothing matched */
    boolean click() throws RelayException;

    /** @return false if nothing matched */
    boolean fill(String value) throws RelayException;

    /**
     * Apply the function {@code fn} to the matched element.
     *
     * @return its result, or null if nothing matched
     */
    JsonNode evaluate(String fn, Object... args) throws RelayException;

    TabLocator first();

    String selector();
}
