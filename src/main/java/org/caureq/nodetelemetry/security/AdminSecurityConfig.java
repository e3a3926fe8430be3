package org.caureq.nodetelemetry.security;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/** Only the admin endpoints are guarded; /metrics and the read API stay open to the monitoring network. */
@Configuration
public class AdminSecurityConfig {

    @Bean
    public FilterRegistrationBean<ApiKeyAdminFilter> adminFilterRegistration(ApiKeyAdminFilter filter) {
        var reg = new FilterRegistrationBean<>(filter);
        reg.setName("adminApiKeyFilter");
        reg.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
        reg.addUrlPatterns(ApiKeyAdminFilter.PROTECTED_PREFIX + "*");
        return reg;
    }
}
