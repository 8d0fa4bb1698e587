package com.blazesports.intel.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Scheduled cache warming
 */
@ConfigurationProperties(prefix = "blaze.warming")
public class WarmingProperties {

    private boolean enabled;
    private long interval = 30000;
    private List<String> liveSports = new ArrayList<>(List.of("mlb", "nfl", "nba", "ncaaf", "college-baseball"));

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getInterval() {
        return interval;
    }

    public void setInterval(long interval) {
        this.interval = interval;
    }

    public List<String> getLiveSports() {
        return liveSports;
    }

    public void setLiveSports(List<String> liveSports) {
        this.liveSports = liveSports;
    }
}
