package com.koni.historyinjector.infrastructure.web.dto;

import lombok.Getter;

/**
 * DTO describing what a cache refresh dropped.
 */
@Getter
public class RefreshResponse {

    private final int evicted;

    public RefreshResponse(int evicted) {
        this.evicted = evicted;
    }
}
