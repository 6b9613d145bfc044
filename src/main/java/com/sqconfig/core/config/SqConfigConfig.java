package com.sqconfig.core.config;

import com.sqconfig.core.cache.RemoteObjectCache;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SqConfigConfig {

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    /**
     * One identity cache for the whole process, shared by every platform
     * connection; entries are scoped by endpoint.
     */
    @Bean
    public RemoteObjectCache remoteObjectCache() {
        return new RemoteObjectCache();
    }
}
