package com.faceregistry.config;

import com.faceregistry.service.DisplayCodeGenerator;
import com.faceregistry.service.RandomDisplayCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;

@Configuration
public class RegistryConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public DisplayCodeGenerator displayCodeGenerator(RegistryProperties properties) {
        return new RandomDisplayCodeGenerator(properties.getDisplayCode().getPrefix(), new SecureRandom());
    }
}
