package io.b2mash.rental.leaseflow.config;

import io.b2mash.rental.leaseflow.proofing.VerificationProperties;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Time limits for calls to external collaborators. */
@Configuration
public class ResilienceConfig {

  public static final String IDENTITY_VERIFICATION = "identity-verification";

  private static final Logger log = LoggerFactory.getLogger(ResilienceConfig.class);

  @Bean
  TimeLimiterRegistry timeLimiterRegistry(VerificationProperties verificationProperties) {
    log.info(
        "Identity verification calls time out after {}", verificationProperties.timeout());

    // A timed-out call is interrupted if running and dropped if still queued.
    var verificationConfig =
        TimeLimiterConfig.custom()
            .timeoutDuration(verificationProperties.timeout())
            .cancelRunningFuture(true)
            .build();

    var registry = TimeLimiterRegistry.ofDefaults();
    registry.timeLimiter(IDENTITY_VERIFICATION, verificationConfig);
    return registry;
  }
}
