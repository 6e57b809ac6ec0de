package com.studioflow.finance.config;

import com.studioflow.finance.model.AppModule;
import com.studioflow.finance.model.Role;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Settings bound from {@code studioflow.finance.*}.
 */
@Data
@ConfigurationProperties(prefix = "studioflow.finance")
public class FinanceProperties {

    /**
     * Zone used to decide what "today" is for status refreshes and recurring runs.
     */
    private String timeZone = "Asia/Kolkata";

    private boolean recurringEnabled = true;

    private String recurringCron = "0 15 1 * * *";

    /**
     * Per-role module overrides, replacing the built-in defaults for that role.
     */
    private Map<Role, Set<AppModule>> permissions = new HashMap<>();
}
