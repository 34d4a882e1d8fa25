package com.grantlens.search.service;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SearchResultProperties.class)
public class SearchServiceConfig {

    @Bean
    public Clock searchClock() {
        return Clock.systemDefaultZone();
    }
}
