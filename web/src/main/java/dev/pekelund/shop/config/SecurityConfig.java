package dev.pekelund.shop.config;

import com.google.firebase.auth.FirebaseAuth;
import dev.pekelund.shop.security.FirebaseIdTokenFilter;
import dev.pekelund.shop.security.SecurityContextOwnerResolver;
import jakarta.servlet.DispatcherType;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.crypto.factory.PasswordEncoderFactories;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.client.registration.ClientRegistrationRepository;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.www.BasicAuthenticationFilter;
import org.springframework.security.web.util.matcher.AntPathRequestMatcher;
import org.springframework.util.StringUtils;

@Configuration
@EnableConfigurationProperties(StorefrontSecurityProperties.class)
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    @Bean
    public SecurityFilterChain securityFilterChain(
        HttpSecurity http,
        ObjectProvider<ClientRegistrationRepository> clientRegistrationRepositoryProvider,
        ObjectProvider<FirebaseAuth> firebaseAuthProvider,
        SecurityContextOwnerResolver ownerResolver
    ) throws Exception {
        http
            .authorizeHttpRequests(authorize -> authorize
                .dispatcherTypeMatchers(DispatcherType.ASYNC, DispatcherType.ERROR).permitAll()
                .requestMatchers("/error").permitAll()
                .anyRequest().authenticated()
            )
            .httpBasic(Customizer.withDefaults())
            .exceptionHandling(exceptions -> exceptions
                .defaultAuthenticationEntryPointFor(
                    new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED),
                    new AntPathRequestMatcher("/api/**"))
            )
            .csrf(csrf -> csrf.ignoringRequestMatchers("/api/**"))
            .addFilterAfter(new RequestLoggingContextFilter(ownerResolver), AnonymousAuthenticationFilter.class);

        FirebaseAuth firebaseAuth = firebaseAuthProvider.getIfAvailable();
        if (firebaseAuth != null) {
            http.addFilterBefore(new FirebaseIdTokenFilter(firebaseAuth), BasicAuthenticationFilter.class);
        }

        ClientRegistrationRepository clientRegistrationRepository =
            clientRegistrationRepositoryProvider.getIfAvailable();

        boolean oauthEnabled = false;
        if (clientRegistrationRepository != null) {
            if (clientRegistrationRepository instanceof Iterable<?>) {
                oauthEnabled = ((Iterable<?>) clientRegistrationRepository).iterator().hasNext();
            } else {
                oauthEnabled = true;
            }
        }

        if (oauthEnabled) {
            http.oauth2Login(Customizer.withDefaults());
        } else {
            log.info("OAuth2 login disabled - no client registrations configured.");
        }

        return http.build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return PasswordEncoderFactories.createDelegatingPasswordEncoder();
    }

    @Bean
    @ConditionalOnProperty(value = "firebase.enabled", havingValue = "false", matchIfMissing = true)
    public UserDetailsService userDetailsService(StorefrontSecurityProperties properties,
                                                 PasswordEncoder passwordEncoder) {
        List<UserDetails> users = new ArrayList<>();
        for (StorefrontSecurityProperties.FallbackUser fallbackUser : properties.getFallbackUsers()) {
            if (!StringUtils.hasText(fallbackUser.getUsername()) || !StringUtils.hasText(fallbackUser.getPassword())) {
                log.warn("Ignoring fallback user without username or password");
                continue;
            }
            users.add(User.builder()
                .username(fallbackUser.getUsername())
                .password(passwordEncoder.encode(fallbackUser.getPassword()))
                .roles(fallbackUser.getRoles().toArray(String[]::new))
                .build());
        }
        if (users.isEmpty()) {
            log.warn("Firebase authentication disabled and no fallback users configured; the API rejects every request");
        } else {
            log.info("Firebase authentication disabled; {} fallback user(s) configured for HTTP Basic", users.size());
        }
        return new InMemoryUserDetailsManager(users);
    }
}
