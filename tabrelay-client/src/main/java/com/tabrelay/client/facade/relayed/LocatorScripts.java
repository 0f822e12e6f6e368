package com.tabrelay.client.facade.relayed;

import com.tabrelay.common.protocol.RelayJson;

/**
 * Builds the EVALUATE function sources behind relayed locators. Each script is a
 * function expression that the extension calls with the command's args; every
 * caller-supplied string is embedded as a JSON literal.
 */
final class LocatorScripts {

    private static final String XPATH_PREFIX = "xpath=";

    private LocatorScripts() {
    }

    static String xpath(String selector) {
        return selector.startsWith(XPATH_PREFIX) ? selector.substring(XPATH_PREFIX.length()) : selector;
    }

    static String click(String selector) {
        return withElement(selector,
                "element.click();\n"
                        + "    return true;",
                "false");
    }

    static String fill(String selector, String value) {
        return withElement(selector,
                "element.value = " + RelayJson.quote(value) + ";\n"
                        + "    element.dispatchEvent(new Event('input', { bubbles: true }));\n"
                        + "    element.dispatchEvent(new Event('change', { bubbles: true }));\n"
                        + "    return true;",
                "false");
    }

    static String evaluate(String selector, String fn) {
        return withElement(selector,
                "return (" + fn + ")(element, ...args);",
                "null");
    }

    private static String withElement(String selector, String body, String missing) {
        return "function(...args) {\n"
                + "  const element = document.evaluate(\n"
                + "    " + RelayJson.quote(xpath(selector)) + ",\n"
                + "    document, null, XPathResult.FIRST_ORDERED_NODE_TYPE, null\n"
                + "  ).singleNodeValue;\n"
                + "  if (element) {\n"
                + "    " + body + "\n"
                + "  }\n"
                + "  return " + missing + ";\n"
                + "}";
    }
}
