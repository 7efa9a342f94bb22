package io.github.drompincen.webdeck.gateway.config;

import io.github.drompincen.webdeck.gateway.web.BearerTokenInterceptor;
import io.github.drompincen.webdeck.gateway.web.ClientAddress;
import io.github.drompincen.webdeck.gateway.web.RateLimitInterceptor;
import io.github.drompincen.webdeck.runtime.ratelimit.RateLimiters;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    private final RateLimiters rateLimiters;
    private final BearerTokenInterceptor bearerTokenInterceptor;
    private final ThreadPoolTaskExecutor streamExecutor;
    private final ClientAddress clientAddress;

    public WebMvcConfig(RateLimiters rateLimiters,
                        BearerTokenInterceptor bearerTokenInterceptor,
                        ThreadPoolTaskExecutor streamExecutor,
                        ClientAddress clientAddress) {
        this.rateLimiters = rateLimiters;
        this.clientAddress = clientAddress;
        this.bearerTokenInterceptor = bearerTokenInterceptor;
        this.streamExecutor = streamExecutor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new RateLimitInterceptor(rateLimiters.authWrite(), clientAddress))
                .addPathPatterns("/api/auth/register", "/api/auth/verify", "/api/auth/authorize", "/api/auth/devices/*");
        registry.addInterceptor(new RateLimitInterceptor(rateLimiters.authRead(), clientAddress))
                .addPathPatterns("/api/auth/devices");
        registry.addInterceptor(new RateLimitInterceptor(rateLimiters.stream(), clientAddress))
                .addPathPatterns("/api/chat", "/api/terminal/execute");
        registry.addInterceptor(bearerTokenInterceptor)
                .addPathPatterns("/api/**")
                .excludePathPatterns("/api/auth/register", "/api/auth/verify");
    }

    @Override
    public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
        configurer.setTaskExecutor(streamExecutor);
    }
}
