package com.taskweaver.core.scheduler;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "taskweaver.scheduling")
public class SchedulingProperties {

    /**
     * When true, a task that would fall back to today's date fails the run instead.
     */
    private boolean requirePlanStart = false;

    /**
     * Zone used to determine "today" for the fallback start date. Blank means the system zone.
     */
    private String zone = "";

    public boolean isRequirePlanStart() {
        return requirePlanStart;
    }

    public void setRequirePlanStart(boolean requirePlanStart) {
        this.requirePlanStart = requirePlanStart;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public boolean hasZone() {
        return zone != null && !zone.isBlank();
    }
}
