package com.taskweaver.core.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class SchedulingConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulingConfig.class);

    @Bean
    public Clock schedulingClock(SchedulingProperties properties) {
        if (properties.hasZone()) {
            ZoneId zone = ZoneId.of(properties.getZone().trim());
            log.info("Scheduling fallback dates use zone {}", zone);
            return Clock.system(zone);
        }
        return Clock.systemDefaultZone();
    }
}
