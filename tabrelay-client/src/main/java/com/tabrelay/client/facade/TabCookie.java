package com.tabrelay.client.facade;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A cookie in the extension's shape ({@code chrome.cookies}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TabCookie {
    private String name;
    private String value;
    private String url;
    private String domain;
    private String path;
    private Boolean secure;
    private Boolean httpOnly;
    /** "no_restriction", "lax", "strict" or "unspecified" */
    private String sameSite;
    /** Seconds since the epoch; absent for session cookies. */
    private Double expirationDate;
}
