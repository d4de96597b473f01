package com.feerouter.distribution.config;

import com.feerouter.distribution.engine.DistributionEngine;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({DistributionProperties.class, KeeperProperties.class})
public class DistributionConfig {

    @Bean
    public DistributionEngine distributionEngine(DistributionProperties properties) {
        return new DistributionEngine(properties.getMaxPageSize());
    }
}
