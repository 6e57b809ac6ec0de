package com.studioflow.finance.config;

import com.studioflow.finance.service.ModulePermissions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Slf4j
@Configuration
@EnableConfigurationProperties(FinanceProperties.class)
public class FinanceConfig {

    @Bean
    public Clock financeClock(FinanceProperties properties) {
        return Clock.system(ZoneId.of(properties.getTimeZone()));
    }

    @Bean
    public ModulePermissions modulePermissions(FinanceProperties properties) {
        ModulePermissions permissions = ModulePermissions.withOverrides(properties.getPermissions());
        log.info("Resolved module permissions for {} roles ({} overridden)",
                permissions.roleCount(), properties.getPermissions().size());
        return permissions;
    }
}
