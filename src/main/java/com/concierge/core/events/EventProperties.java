package com.concierge.core.events;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Progress event settings bound from {@code concierge.events.*}.
 */
@Component
@ConfigurationProperties(prefix = "concierge.events")
public class EventProperties {

    private int progressCapacity = 256;

    public int getProgressCapacity() { return progressCapacity; }
    public void setProgressCapacity(int progressCapacity) { this.progressCapacity = progressCapacity; }
}
