package ru.marthastudios.nudgebot.configuration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimNames;
import org.springframework.security.oauth2.jwt.JwtClaimValidator;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtValidators;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.web.SecurityFilterChain;

import java.util.List;

/**
 * The channel endpoint only accepts activities signed by the Bot Framework for this bot's app id. The admin
 * API has its own open chain.
 */
@Configuration
public class SecurityConfiguration {
    public static final String BOT_ENDPOINT = "/api/messages";

    @Bean
    @Order(1)
    public SecurityFilterChain botChannelChain(HttpSecurity http) throws Exception {
        http.securityMatcher(BOT_ENDPOINT);

        http
                .csrf(csrf -> csrf.disable())
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .anyRequest().authenticated()
                )
                .oauth2ResourceServer(oauth2 -> oauth2.jwt(Customizer.withDefaults()))
                .requestCache(cache -> cache.disable())
                .formLogin(fl -> fl.disable())
                .logout(lo -> lo.disable());

        return http.build();
    }

    @Bean
    @Order(2)
    public SecurityFilterChain adminApiChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .anyRequest().permitAll()
                )
                .httpBasic(hb -> hb.disable())
                .formLogin(fl -> fl.disable())
                .logout(lo -> lo.disable());

        return http.build();
    }

    /**
     * Signing keys come from the Bot Framework OpenID metadata and are fetched on the first token.
     */
    @Bean
    public JwtDecoder botFrameworkJwtDecoder(@Value("${bot.openid-jwks-uri:https://login.botframework.com/v1/.well-known/keys}") String jwksUri,
                                             @Value("${bot.token-issuer:https://api.botframework.com}") String issuer,
                                             @Value("${bot.app-id}") String appId) {
        NimbusJwtDecoder decoder = NimbusJwtDecoder.withJwkSetUri(jwksUri).build();

        JwtClaimValidator<List<String>> audienceValidator = new JwtClaimValidator<>(JwtClaimNames.AUD,
                aud -> aud != null && aud.contains(appId));

        decoder.setJwtValidator(new DelegatingOAuth2TokenValidator<Jwt>(
                JwtValidators.createDefaultWithIssuer(issuer), audienceValidator));

        return decoder;
    }
}
