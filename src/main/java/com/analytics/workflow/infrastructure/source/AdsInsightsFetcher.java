package com.analytics.workflow.infrastructure.source;

import com.analytics.workflow.config.SourceApiProperties;
import com.analytics.workflow.domain.model.ExecutionContext;
import com.analytics.workflow.domain.model.SourceKey;
import io.github.resilience4j.retry.annotation.Retry;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Daily ad insights from the ads platform, one record per ad.
 */
@Component
public class AdsInsightsFetcher extends RestSourceFetcher {
    
    private final SourceApiProperties properties;
    
    public AdsInsightsFetcher(RestTemplate restTemplate,
                              SourceRecordWriter recordWriter,
                              SourceApiProperties properties) {
        super(restTemplate, recordWriter);
        this.properties = properties;
    }
    
    @Override
    public SourceKey source() {
        return SourceKey.ADS;
    }
    
    @Override
    @Retry(name = "adsApi")
    public List<Map<String, Object>> fetch(ExecutionContext context, LocalDate day) {
        return fetchDay(context, day);
    }
    
    @Override
    protected SourceApiProperties.Endpoint endpoint() {
        return properties.getAds();
    }
    
    @Override
    protected String idField() {
        return "ad_id";
    }
}
