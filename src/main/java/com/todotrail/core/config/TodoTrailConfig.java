package com.todotrail.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.todotrail.core.persistence.JsonFileStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Infrastructure beans shared by the TodoTrail components.
 */
@Configuration
public class TodoTrailConfig {

    private static final Logger log = LoggerFactory.getLogger(TodoTrailConfig.class);

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock todoTrailClock() {
        return Clock.systemUTC();
    }

    /**
     * Registry for the CLI process; replaced by the actuator's registry when one is on the classpath.
     */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry todoTrailMeterRegistry() {
        return new SimpleMeterRegistry();
    }

    /**
     * File store with its own mapper; workspace files are written indented and with
     * ISO-8601 timestamps regardless of how the application's web mapper is tuned.
     */
    @Bean
    public JsonFileStore jsonFileStore() {
        ObjectMapper mapper = JsonFileStore.defaultMapper();
        log.debug("Configured workspace JSON store");
        return new JsonFileStore(mapper);
    }
}
