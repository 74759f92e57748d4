package com.example.translator.config;

import static com.example.translator.web.rest.ApiConstants.ApiPath.*;

import com.example.translator.security.filter.RateLimitFilter;
import com.example.translator.security.filter.SessionAuthenticationFilter;
import com.example.translator.web.rest.errors.DelegatedAuthenticationEntryPoint;
import jakarta.servlet.DispatcherType;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer.FrameOptionsConfig;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;
import org.springframework.security.web.header.writers.XXssProtectionHeaderWriter.HeaderValue;

/**
 * Stateless security configuration with three filter chains.
 * <p>
 * PUBLIC (@Order(1)): login, health, cache administration and actuator.
 * PROTECTED (@Order(2)): bearer-token endpoints, authenticated by {@link SessionAuthenticationFilter}.
 * DEFAULT (@Order(3)): deny everything else.
 * <p>
 * {@link RateLimitFilter} is a plain servlet filter ordered ahead of all three chains.
 */
@Configuration(proxyBeanMethods = false)
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

  private final SessionAuthenticationFilter sessionAuthenticationFilter;
  private final DelegatedAuthenticationEntryPoint delegatedAuthenticationEntryPoint;

  @Bean
  @Order(1)
  public SecurityFilterChain publicEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher(AUTH_BASE + LOGIN,
                         HEALTH_BASE,
                         HEALTH_BASE + "/**",
                         CACHE_STATUS,
                         CACHE,
                         "/actuator/**",
                         "/error",
                         "/v3/api-docs/**",
                         "/swagger-ui/**",
                         "/swagger-ui.html")
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(2)
  public SecurityFilterChain protectedEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher(AUTH_BASE + LOGOUT,
                         AUTH_BASE + ME,
                         TRANSLATE_STREAM)
        .addFilterBefore(sessionAuthenticationFilter,
                         UsernamePasswordAuthenticationFilter.class)
        // the completing dispatch of a stream was authenticated when the stream was opened
        .authorizeHttpRequests(authorize -> authorize
            .dispatcherTypeMatchers(DispatcherType.ASYNC).permitAll()
            .anyRequest().authenticated())
        // JSON 401 instead of a login challenge
        .exceptionHandling(exceptions ->
                               exceptions.authenticationEntryPoint(delegatedAuthenticationEntryPoint));

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(3)
  public SecurityFilterChain defaultDenyFilterChain(HttpSecurity http) throws Exception {
    http.authorizeHttpRequests(authorize -> authorize.anyRequest().denyAll());
    applyCommonSettings(http);
    return http.build();
  }

  /**
   * The session filter only runs inside the protected chain, never as a servlet filter of its own.
   */
  @Bean
  public FilterRegistrationBean<SessionAuthenticationFilter> sessionAuthenticationFilterRegistration(
      SessionAuthenticationFilter filter) {
    FilterRegistrationBean<SessionAuthenticationFilter> registration = new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  private void applyCommonSettings(HttpSecurity http) throws Exception {
    http
        // Bearer tokens only, no cookies to forge
        .csrf(AbstractHttpConfigurer::disable)

        .sessionManagement(session -> session
                               .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
                          )

        .headers(headers -> headers
                     .frameOptions(FrameOptionsConfig::deny)
                     .xssProtection(xss -> xss
                                        .headerValue(HeaderValue.ENABLED_MODE_BLOCK)
                                   )
                     .contentTypeOptions(contentType -> {
                     })
                     .referrerPolicy(referrer -> referrer
                                         .policy(ReferrerPolicy.STRICT_ORIGIN_WHEN_CROSS_ORIGIN)
                                    )
                     .permissionsPolicyHeader(permissions -> permissions
                                                  .policy("camera=(), microphone="
                                                              + "(), geolocation="
                                                              + "(), payment=()")
                                             )
                     .httpStrictTransportSecurity(hsts -> hsts
                                                      .maxAgeInSeconds(Duration.ofDays(365).toSeconds())
                                                      .includeSubDomains(true)
                                                 )
                     .addHeaderWriter((request, response) -> {
                       // Translations and tokens must not sit in shared caches
                       response.setHeader("Cache-Control",
                                          "no-cache, no-store, must-revalidate");
                       response.setHeader("Pragma",
                                          "no-cache");
                       response.setHeader("Expires",
                                          "0");
                     })
                );
  }
}
