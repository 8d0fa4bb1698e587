package com.blazesports.intel.infrastructure.cron;

import com.blazesports.intel.application.CacheWarmer;
import com.blazesports.intel.application.WarmingResult;
import com.blazesports.intel.infrastructure.config.WarmingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(prefix = "blaze.warming", name = "enabled", havingValue = "true")
public class ScheduledCacheWarmer {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledCacheWarmer.class);

    private final CacheWarmer cacheWarmer;
    private final WarmingProperties properties;

    public ScheduledCacheWarmer(CacheWarmer cacheWarmer, WarmingProperties properties) {
        this.cacheWarmer = cacheWarmer;
        this.properties = properties;
    }

    @Scheduled(fixedRateString = "${blaze.warming.interval:30000}")
    public void warmLiveGames() {
        logger.debug("Running scheduled live score warming for {}", properties.getLiveSports());
        try {
            WarmingResult result = cacheWarmer.warmLiveGames(properties.getLiveSports());
            if (result.errors() > 0) {
                logger.warn("Live score warming had {} errors out of {} keys", result.errors(), result.total());
            }
        } catch (Exception e) {
            logger.error("Scheduled live score warming failed", e);
        }
    }
}
