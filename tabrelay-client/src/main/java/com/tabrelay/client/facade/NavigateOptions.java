package com.tabrelay.client.facade;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Navigation options forwarded with NAVIGATE.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NavigateOptions {
    /** "commit", "domcontentloaded", "load" or "networkidle"; null returns once navigation starts. */
    private String waitUntil;
    private Long timeout;
}
