package io.github.hydrate.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hydrate.gateway.web.BodySizeLimitFilter;
import io.github.hydrate.runtime.config.HydrateProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** The frontend is served from another origin, so every route accepts cross-origin calls. */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOrigins("*")
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*");
    }

    @Bean
    FilterRegistrationBean<BodySizeLimitFilter> bodySizeLimitFilter(HydrateProperties properties,
                                                                     ObjectMapper objectMapper) {
        var registration = new FilterRegistrationBean<>(
                new BodySizeLimitFilter(properties.getHttp().getMaxBodySize().toBytes(), objectMapper));
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
        return registration;
    }
}
