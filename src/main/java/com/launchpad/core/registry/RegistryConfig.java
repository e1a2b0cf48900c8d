package com.launchpad.core.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link HandlerRegistry} bean. Fixed at startup; tests and embedders can supply
 * their own registry bean instead.
 */
@Configuration
public class RegistryConfig {

    private static final Logger log = LoggerFactory.getLogger(RegistryConfig.class);

    @Bean
    @ConditionalOnMissingBean(HandlerRegistry.class)
    public HandlerRegistry handlerRegistry() {
        var registry = LaunchHandlers.standard();
        log.info("Handler registry initialized with {} handlers", registry.size());
        return registry;
    }
}
