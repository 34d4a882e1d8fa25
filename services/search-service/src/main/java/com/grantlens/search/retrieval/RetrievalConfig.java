package com.grantlens.search.retrieval;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({LexicalSearchProperties.class, VectorSearchProperties.class})
public class RetrievalConfig {
}
