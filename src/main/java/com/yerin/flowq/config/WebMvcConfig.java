package com.yerin.flowq.config;

import com.yerin.flowq.web.BoardAuthInterceptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@ConditionalOnProperty(name = "flowq.board.enabled", havingValue = "true")
public class WebMvcConfig implements WebMvcConfigurer {

    @Value("${flowq.board.username:admin}")
    private String username;

    @Value("${flowq.board.password:}")
    private String password;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new BoardAuthInterceptor(username, password))
                .addPathPatterns("/admin/**")
                .excludePathPatterns(
                        "/actuator/**",
                        "/swagger-ui/**",
                        "/v3/api-docs/**"
                );
    }
}
