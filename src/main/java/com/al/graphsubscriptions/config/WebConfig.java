package com.al.graphsubscriptions.config;

import com.al.graphsubscriptions.interceptor.CronSecretInterceptor;
import com.al.graphsubscriptions.interceptor.MdcInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final MdcInterceptor mdcInterceptor;
    private final CronSecretInterceptor cronSecretInterceptor;

    public WebConfig(MdcInterceptor mdcInterceptor, CronSecretInterceptor cronSecretInterceptor) {
        this.mdcInterceptor = mdcInterceptor;
        this.cronSecretInterceptor = cronSecretInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(mdcInterceptor);
        registry.addInterceptor(cronSecretInterceptor)
                .addPathPatterns("/api/cron/**");
    }
}
