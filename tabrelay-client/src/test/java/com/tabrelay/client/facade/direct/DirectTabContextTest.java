package com.tabrelay.client.facade.direct;

import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.SameSiteAttribute;
import com.tabrelay.client.facade.TabCookie;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cookie translation between the extension's shape and Playwright's. No browser needed.
 */
class DirectTabContextTest {

    @Test
    void toPlaywright_mapsChromeFields() {
        Cookie cookie = DirectTabContext.toPlaywright(TabCookie.builder()
                .name("sid")
                .value("abc")
                .domain(".example.com")
                .path("/")
                .secure(true)
                .httpOnly(false)
                .sameSite("no_restriction")
                .expirationDate(1.9e9)
                .build());

        assertEquals("sid", cookie.name);
        assertEquals("abc", cookie.value);
        assertEquals(".example.com", cookie.domain);
        assertEquals("/", cookie.path);
        assertEquals(Boolean.TRUE, cookie.secure);
        assertEquals(Boolean.FALSE, cookie.httpOnly);
        assertEquals(SameSiteAttribute.NONE, cookie.sameSite);
        assertEquals(1.9e9, cookie.expires);
        assertNull(cookie.url);
    }

    @Test
    void toPlaywright_unknownSameSite_isLeftUnset() {
        Cookie cookie = DirectTabContext.toPlaywright(TabCookie.builder()
                .name("a").value("b").url("https://example.com").sameSite("unspecified").build());

        assertNull(cookie.sameSite);
        assertEquals("https://example.com", cookie.url);
    }

    @Test
    void fromPlaywright_sessionCookie_hasNoExpiration() {
        Cookie cookie = new Cookie("sid", "abc")
                .setDomain("example.com")
                .setPath("/")
                .setExpires(-1)
                .setSameSite(SameSiteAttribute.LAX);

        TabCookie converted = DirectTabContext.fromPlaywright(cookie);

        assertEquals("sid", converted.getName());
        assertEquals("lax", converted.getSameSite());
        assertNull(converted.getExpirationDate());
    }
}
