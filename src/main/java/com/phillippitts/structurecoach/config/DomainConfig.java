package com.phillippitts.structurecoach.config;

import com.phillippitts.structurecoach.service.framework.FrameworkRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Application-scoped domain objects handed to request handling by injection: the framework
 * registry and the clock used for submission and analysis timestamps.
 */
@Configuration
public class DomainConfig {

    @Bean
    public FrameworkRegistry frameworkRegistry() {
        return FrameworkRegistry.withBuiltIns();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
