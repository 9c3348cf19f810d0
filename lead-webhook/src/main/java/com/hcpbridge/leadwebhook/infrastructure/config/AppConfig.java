package com.hcpbridge.leadwebhook.infrastructure.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({LeadConfig.class, HcpConfig.class})
public class AppConfig {
}
