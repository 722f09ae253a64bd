package com.analytics.workflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Endpoints of the external source APIs, bound from "source-api.*".
 */
@Data
@Component
@ConfigurationProperties(prefix = "source-api")
public class SourceApiProperties {
    
    private Endpoint ads = new Endpoint("http://localhost:9101", "/insights");
    private Endpoint pos = new Endpoint("http://localhost:9102", "/orders");
    
    @Data
    public static class Endpoint {
        private String baseUrl;
        private String path;
        
        public Endpoint() {
        }
        
        public Endpoint(String baseUrl, String path) {
            this.baseUrl = baseUrl;
            this.path = path;
        }
    }
}
