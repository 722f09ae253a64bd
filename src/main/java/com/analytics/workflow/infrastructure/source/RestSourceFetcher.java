package com.analytics.workflow.infrastructure.source;

import com.analytics.workflow.config.SourceApiProperties;
import com.analytics.workflow.domain.model.ExecutionContext;
import com.analytics.workflow.domain.service.SourceFetcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Thin HTTP adapter for a source that serves one day of records as
 * {"data": [...]}.
 * 
 * Calls carry the tenant in X-Tenant-Id. A 404 means no data for the day.
 * Pacing between calls is the orchestrator's rate limiter; transient
 * failures are retried by Resilience4j in the subclasses.
 */
@Slf4j
public abstract class RestSourceFetcher implements SourceFetcher {
    
    private static final ParameterizedTypeReference<Map<String, Object>> RESPONSE_TYPE =
            new ParameterizedTypeReference<>() {
            };
    
    private final RestTemplate restTemplate;
    private final SourceRecordWriter recordWriter;
    
    protected RestSourceFetcher(RestTemplate restTemplate, SourceRecordWriter recordWriter) {
        this.restTemplate = restTemplate;
        this.recordWriter = recordWriter;
    }
    
    protected abstract SourceApiProperties.Endpoint endpoint();
    
    /** Field of a record holding its stable external id. */
    protected abstract String idField();
    
    protected List<Map<String, Object>> fetchDay(ExecutionContext context, LocalDate day) {
        SourceApiProperties.Endpoint endpoint = endpoint();
        String url = UriComponentsBuilder
                .fromHttpUrl(endpoint.getBaseUrl() + endpoint.getPath())
                .queryParam("date", day.toString())
                .toUriString();
        
        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Tenant-Id", context.getTenantId());
        
        log.debug("Fetching {} for tenant {}: {}", source(), context.getTenantId(), url);
        try {
            ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
                    url, HttpMethod.GET, new HttpEntity<>(headers), RESPONSE_TYPE);
            return extractRecords(response.getBody());
            
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("No {} data (404) for {}", source(), day);
            return Collections.emptyList();
        }
    }
    
    @Override
    public int process(ExecutionContext context, LocalDate day, List<Map<String, Object>> records) {
        return recordWriter.upsertAll(
                context.getTenantId(),
                source(),
                day,
                records,
                idField(),
                UUID.fromString(context.getExecutionId()));
    }
    
    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> extractRecords(Map<String, Object> body) {
        if (body == null) {
            return Collections.emptyList();
        }
        Object data = body.get("data");
        if (!(data instanceof List)) {
            return Collections.emptyList();
        }
        List<Map<String, Object>> records = new ArrayList<>();
        for (Object item : (List<Object>) data) {
            if (item instanceof Map) {
                records.add((Map<String, Object>) item);
            }
        }
        return records;
    }
}
