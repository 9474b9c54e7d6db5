package com.calai.goals.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(GoalsProperties.class)
public class PropertiesConfig {

    /** ✅ 用 Clock 算年齡，測試可以換成 fixed clock */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
