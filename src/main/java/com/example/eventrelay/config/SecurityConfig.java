package com.example.eventrelay.config;

import com.example.eventrelay.security.BearerTokenAuthenticationFilter;
import com.example.eventrelay.security.IdentityResolver;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;

/**
 * Spring Security 配置（无状态）
 *
 * 安全规则:
 * ✅ 开放：/ws/**, /sse/**, /graphql (实时端点，身份可选，仅用于过滤)
 * ✅ 开放：/api/realtime/**, /actuator/health
 * 🔒 保护：/api/webhooks/** (按订阅归属者隔离)
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

        private final IdentityResolver identityResolver;

        @Bean
        public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
                http
                                // 纯 API 服务，无表单与会话
                                .csrf(csrf -> csrf.disable())
                                .sessionManagement(session -> session
                                                .sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                                .formLogin(form -> form.disable())
                                .httpBasic(basic -> basic.disable())
                                .authorizeHttpRequests(auth -> auth
                                                .requestMatchers("/ws/**", "/sse/**", "/graphql").permitAll()
                                                .requestMatchers("/api/realtime/**").permitAll()
                                                .requestMatchers("/actuator/health", "/error").permitAll()
                                                .requestMatchers("/api/webhooks/**").authenticated()
                                                .anyRequest().authenticated())
                                .exceptionHandling(ex -> ex
                                                .authenticationEntryPoint((request, response, authException) -> {
                                                        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
                                                        response.setContentType("application/json");
                                                        response.getWriter().write(
                                                                        "{\"status\":401,\"error\":\"Unauthorized\",\"message\":\"Authentication required\",\"path\":\""
                                                                                        + request.getRequestURI() + "\"}");
                                                }))
                                .addFilterBefore(new BearerTokenAuthenticationFilter(identityResolver),
                                                AnonymousAuthenticationFilter.class);

                return http.build();
        }
}
