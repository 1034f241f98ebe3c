package com.matchmate.backend.global.config;

import com.matchmate.backend.global.common.time.TimeConfig;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@Configuration
@EnableJpaRepositories(basePackages = "com.matchmate.backend.modules")
@EnableJpaAuditing(dateTimeProviderRef = TimeConfig.AUDITING_TIME_PROVIDER)
public class JpaConfig {
}
