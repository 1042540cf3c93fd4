package eu.virtualparadox.articlefinder.application.config;

import eu.virtualparadox.articlefinder.security.RoleHierarchy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SecurityConfig {

    @Bean
    public RoleHierarchy roleHierarchy(final ApplicationConfig config) {
        if (config.getRoleHierarchy() == null || config.getRoleHierarchy().isEmpty()) {
            return RoleHierarchy.defaults();
        }
        return RoleHierarchy.of(config.getRoleHierarchy());
    }
}
