package com.mailflow.mailflow_backend.config;

import com.mailflow.mailflow_backend.mail.MailDriverResolver;
import com.mailflow.mailflow_backend.mail.UnavailableMailDriver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The mail provider integration registers its own MailDriverResolver. Without one,
 * every label operation fails with a clear per-node error instead of breaking startup.
 */
@Slf4j
@Configuration
public class MailDriverConfig {

    @Bean
    @ConditionalOnMissingBean(MailDriverResolver.class)
    public MailDriverResolver unavailableMailDriverResolver() {
        log.warn("[MailDriverConfig] No MailDriverResolver bean found; label actions will fail");
        return connectionId -> new UnavailableMailDriver("No mail driver configured for connection " + connectionId);
    }
}
