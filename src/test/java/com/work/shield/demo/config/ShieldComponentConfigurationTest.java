package com.work.shield.demo.config;

import com.work.shield.lattice.scheduler.SchedulerOptions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class ShieldComponentConfigurationTest {

    @Test
    public void scheduler_options_copy_properties_and_run_on_chain() {
        SchedulerProperties properties = new SchedulerProperties();
        properties.setPollInterval(Duration.ofMillis(250));
        properties.setMaxConcurrent(3);
        properties.setProofTimeout(Duration.ofSeconds(90));
        properties.setVerifyBalances(false);

        SchedulerOptions options = new ShieldComponentConfiguration().schedulerOptions(properties);

        assertEquals(Duration.ofMillis(250), options.getPollInterval());
        assertEquals(3, options.getMaxConcurrent());
        assertEquals(Duration.ofSeconds(90), options.getProofTimeout());
        assertFalse(options.isVerifyBalances());
        assertTrue(options.isOnChainMode());
    }
}
