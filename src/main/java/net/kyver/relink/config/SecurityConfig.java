package net.kyver.relink.config;

import net.kyver.relink.filter.SecretKeyValidationFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private final SecretKeyValidationFilter secretKeyValidationFilter;

    public SecurityConfig(SecretKeyValidationFilter secretKeyValidationFilter) {
        this.secretKeyValidationFilter = secretKeyValidationFilter;
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
                .csrf(AbstractHttpConfigurer::disable)
                .sessionManagement(session ->
                        session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .addFilterBefore(secretKeyValidationFilter, UsernamePasswordAuthenticationFilter.class);

        if (secretKeyValidationFilter.isApiKeyRequired()) {
            http.authorizeHttpRequests(auth -> auth
                    .requestMatchers("/error", "/favicon.ico").permitAll()
                    .requestMatchers("/api/v1/**").hasRole("API_USER")
                    .anyRequest().authenticated());
        } else {
            http.authorizeHttpRequests(auth -> auth.anyRequest().permitAll());
        }

        http.headers(headers -> headers
                        .frameOptions(frameOptions -> frameOptions.deny())
                        .contentTypeOptions(contentTypeOptions -> {}))
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable);

        return http.build();
    }
}
