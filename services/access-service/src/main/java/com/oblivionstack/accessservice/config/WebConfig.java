package com.oblivionstack.accessservice.config;

import com.oblivionstack.accessservice.infrastructure.web.RequestContextArgumentResolver;
import com.oblivionstack.security.IdentityResolver;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: request-context resolution and CORS for local front ends.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final IdentityResolver identityResolver;

    public WebConfig(IdentityResolver identityResolver) {
        this.identityResolver = identityResolver;
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new RequestContextArgumentResolver(identityResolver));
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        // Production origins come from the gateway, which terminates CORS itself.
        registry.addMapping("/api/**")
                .allowedOrigins("http://localhost:3000", "http://localhost:5173")
                .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true)
                .maxAge(3600);
    }
}
