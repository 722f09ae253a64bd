package com.analytics.workflow.domain.service;

import java.util.Optional;
import java.util.UUID;

final class Ids {
    
    private Ids() {
    }
    
    /**
     * Empty for null or malformed ids, so lookups report "not found".
     */
    static Optional<UUID> parse(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(id.trim()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
