package com.example.intel.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableReactiveMongoRepositories;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(BriefingProperties.class)
@EnableReactiveMongoRepositories(basePackages = "com.example.intel.repo")
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
