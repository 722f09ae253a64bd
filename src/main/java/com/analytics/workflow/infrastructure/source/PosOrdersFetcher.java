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
 * Orders placed on a day at the point-of-sale platform.
 */
@Component
public class PosOrdersFetcher extends RestSourceFetcher {
    
    static final String ID_FIELD = "id";
    
    private final SourceApiProperties properties;
    
    public PosOrdersFetcher(RestTemplate restTemplate,
                            SourceRecordWriter recordWriter,
                            SourceApiProperties properties) {
        super(restTemplate, recordWriter);
        this.properties = properties;
    }
    
    @Override
    public SourceKey source() {
        return SourceKey.POS;
    }
    
    @Override
    @Retry(name = "posApi")
    public List<Map<String, Object>> fetch(ExecutionContext context, LocalDate day) {
        return fetchDay(context, day);
    }
    
    @Override
    protected SourceApiProperties.Endpoint endpoint() {
        return properties.getPos();
    }
    
    @Override
    protected String idField() {
        return ID_FIELD;
    }
}
