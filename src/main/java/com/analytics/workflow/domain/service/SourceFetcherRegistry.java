package com.analytics.workflow.domain.service;

import com.analytics.workflow.domain.model.SourceKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up the {@link SourceFetcher} bean registered for a source.
 */
@Slf4j
@Component
public class SourceFetcherRegistry {
    
    private final Map<SourceKey, SourceFetcher> fetchers;
    
    public SourceFetcherRegistry(List<SourceFetcher> fetchers) {
        Map<SourceKey, SourceFetcher> bySource = new EnumMap<>(SourceKey.class);
        for (SourceFetcher fetcher : fetchers) {
            SourceFetcher previous = bySource.put(fetcher.source(), fetcher);
            if (previous != null) {
                throw new IllegalStateException("Duplicate fetcher for source " + fetcher.source()
                        + ": " + previous.getClass().getSimpleName()
                        + " and " + fetcher.getClass().getSimpleName());
            }
        }
        this.fetchers = Collections.unmodifiableMap(bySource);
        log.info("Registered source fetchers: {}", this.fetchers.keySet());
    }
    
    public Optional<SourceFetcher> find(SourceKey source) {
        return Optional.ofNullable(fetchers.get(source));
    }
}
