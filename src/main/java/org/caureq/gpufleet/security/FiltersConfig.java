package org.caureq.gpufleet.security;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FiltersConfig {

    @Bean
    public FilterRegistrationBean<AdminApiKeyFilter> adminFilterRegistration(AdminApiKeyFilter f) {
        var reg = new FilterRegistrationBean<>(f);
        reg.setOrder(10);
        reg.addUrlPatterns("/api/admin/*");
        return reg;
    }
}
