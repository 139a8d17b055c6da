package com.concierge.core.tools;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Serper web/places search settings bound from {@code concierge.search.*}.
 */
@Component
@ConfigurationProperties(prefix = "concierge.search")
public class SearchProperties {

    private String serperApiKey = "";
    private String baseUrl = "https://google.serper.dev";
    private String region = "de";
    private Duration timeout = Duration.ofSeconds(15);

    public String getSerperApiKey() { return serperApiKey; }
    public void setSerperApiKey(String serperApiKey) { this.serperApiKey = serperApiKey; }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getRegion() { return region; }
    public void setRegion(String region) { this.region = region; }

    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }
}
