package com.taskweaver.core.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class SchedulingPropertiesTest {

    @Test
    @DisplayName("Defaults: lenient fallback, system zone")
    void defaults() {
        var props = new SchedulingProperties();
        assertFalse(props.isRequirePlanStart());
        assertEquals("", props.getZone());
        assertFalse(props.hasZone());
    }

    @Test
    @DisplayName("Clock uses the configured zone")
    void configuredZone() {
        var props = new SchedulingProperties();
        props.setZone("Europe/Berlin");
        assertTrue(props.hasZone());
        assertEquals(ZoneId.of("Europe/Berlin"), new SchedulingConfig().schedulingClock(props).getZone());
    }

    @Test
    @DisplayName("Blank zone falls back to the system default")
    void blankZone() {
        var props = new SchedulingProperties();
        props.setZone("  ");
        assertFalse(props.hasZone());
        assertEquals(ZoneId.systemDefault(), new SchedulingConfig().schedulingClock(props).getZone());
    }
}
