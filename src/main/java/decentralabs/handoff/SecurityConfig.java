package decentralabs.handoff;

import decentralabs.handoff.config.HandoffProperties;
import decentralabs.handoff.security.SessionAuthenticationEntryPoint;
import decentralabs.handoff.security.SessionCookieAuthenticationFilter;
import decentralabs.handoff.service.session.SessionCookieTransport;
import decentralabs.handoff.service.session.SessionTokenService;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;

/**
 * Stateless security: the session cookie is the only credential.
 * Relayed traffic gets its own chain without response header writers so
 * upstream responses leave the gateway untouched.
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final HandoffProperties properties;
    private final SessionTokenService sessionTokenService;
    private final SessionCookieTransport cookieTransport;

    @Bean
    @Order(1)
    public SecurityFilterChain protectedRouteFilterChain(HttpSecurity http) throws Exception {
        String prefix = properties.getGateway().getProtectedPrefix();
        configureSession(http.securityMatcher(prefix, prefix + "/**"))
            .headers(headers -> headers.disable())
            .authorizeHttpRequests(auth -> auth.anyRequest().authenticated());
        return http.build();
    }

    @Bean
    @Order(2)
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        configureSession(http)
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/auth/me").authenticated()
                .requestMatchers("/api/sso-users/**").authenticated()
                .anyRequest().permitAll()
            );
        return http.build();
    }

    private HttpSecurity configureSession(HttpSecurity http) throws Exception {
        return http
            .csrf(csrf -> csrf.disable())
            .cors(cors -> cors.disable())
            .httpBasic(basic -> basic.disable())
            .formLogin(form -> form.disable())
            .logout(logout -> logout.disable())
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .exceptionHandling(ex -> ex.authenticationEntryPoint(new SessionAuthenticationEntryPoint()))
            .addFilterBefore(new SessionCookieAuthenticationFilter(sessionTokenService, cookieTransport),
                AnonymousAuthenticationFilter.class);
    }
}
