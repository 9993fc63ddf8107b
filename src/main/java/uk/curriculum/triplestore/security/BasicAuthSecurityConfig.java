package uk.curriculum.triplestore.security;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configuration.WebSecurityConfigurerAdapter;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.crypto.password.Pbkdf2PasswordEncoder;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;

/**
 * HTTP Basic with two fixed accounts: {@code admin} may update, {@code viewer} may only query.
 * Passwords come from the environment and are hashed (PBKDF2, SHA-256) when the server starts.
 */
@Configuration
@EnableWebSecurity
@ConditionalOnWebApplication
@ConditionalOnProperty(prefix = "application.security",
                       name = "enabled",
                       havingValue = "true")
@Slf4j
public class BasicAuthSecurityConfig extends WebSecurityConfigurerAdapter {
  static final String ADMIN_USER = "admin";
  static final String VIEWER_USER = "viewer";

  @Value("${application.security.admin-password}")
  private String adminPassword;
  @Value("${application.security.viewer-password}")
  private String viewerPassword;
  @Value("${application.security.hash-iterations}")
  private int hashIterations;

  @Override
  protected void configure(HttpSecurity http) throws Exception {
    http
            .csrf().disable()
            .sessionManagement().sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            .and()
            .authorizeRequests()
            .antMatchers("/$/ping").permitAll()
            .anyRequest().authenticated()
            .and()
            .httpBasic();
  }

  @Bean
  public PasswordEncoder passwordEncoder() {
    Pbkdf2PasswordEncoder encoder = new Pbkdf2PasswordEncoder("", 32, hashIterations, 256);
    encoder.setAlgorithm(Pbkdf2PasswordEncoder.SecretKeyFactoryAlgorithm.PBKDF2WithHmacSHA256);
    return encoder;
  }

  @Bean
  public UserDetailsService users() {
    if (StringUtils.isAnyBlank(adminPassword, viewerPassword)) {
      throw new IllegalStateException("password environment variables not set, required: "
                                      + "TRIPLESTORE_ADMIN_PASSWORD, TRIPLESTORE_VIEWER_PASSWORD");
    }
    PasswordEncoder encoder = passwordEncoder();
    log.info("hashing passwords with {} iterations", hashIterations);
    return new InMemoryUserDetailsManager(
            User.withUsername(ADMIN_USER).password(encoder.encode(adminPassword)).roles("ADMIN", "READER").build(),
            User.withUsername(VIEWER_USER).password(encoder.encode(viewerPassword)).roles("READER").build()
    );
  }
}
