package io.b2mash.rental.leaseflow.proofing;

import io.b2mash.rental.leaseflow.config.ResilienceConfig;
import io.b2mash.rental.leaseflow.integration.verification.IdentityVerifier;
import io.b2mash.rental.leaseflow.integration.verification.VerificationRequest;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Calls the {@link IdentityVerifier} under a time limit and turns every result into a {@link
 * VerificationOutcome}. Never throws for verifier trouble: a timeout, an error or a full call pool
 * is a failed attempt. A timed-out call is cancelled, so it never reaches the verifier afterwards.
 */
@Component
public class VerificationGateway {

  private static final Logger log = LoggerFactory.getLogger(VerificationGateway.class);

  private final IdentityVerifier identityVerifier;
  private final TimeLimiter timeLimiter;
  private final double minConfidence;
  private final ExecutorService executor;

  @Autowired
  public VerificationGateway(
      IdentityVerifier identityVerifier,
      TimeLimiterRegistry timeLimiterRegistry,
      VerificationProperties properties) {
    this(
        identityVerifier,
        timeLimiterRegistry.timeLimiter(ResilienceConfig.IDENTITY_VERIFICATION),
        properties.minConfidence(),
        boundedExecutor(properties.maxConcurrentCalls()));
  }

  VerificationGateway(
      IdentityVerifier identityVerifier,
      TimeLimiter timeLimiter,
      double minConfidence,
      ExecutorService executor) {
    this.identityVerifier = identityVerifier;
    this.timeLimiter = timeLimiter;
    this.minConfidence = minConfidence;
    this.executor = executor;
  }

  /**
   * Fixed pool of {@code maxConcurrentCalls} threads with an equally small wait queue. Submissions
   * beyond that are rejected instead of piling up behind a hung verifier.
   */
  static ExecutorService boundedExecutor(int maxConcurrentCalls) {
    return new ThreadPoolExecutor(
        maxConcurrentCalls,
        maxConcurrentCalls,
        0L,
        TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(maxConcurrentCalls),
        new ThreadPoolExecutor.AbortPolicy());
  }

  public VerificationOutcome verify(VerificationRequest request) {
    try {
      var result =
          timeLimiter.executeFutureSupplier(
              () -> executor.submit(() -> identityVerifier.verify(request)));
      if (result == null) {
        return VerificationOutcome.failed(0.0, "Verifier returned no result");
      }
      if (!result.passed()) {
        var reason = result.reason() != null ? result.reason() : "Verification failed";
        log.warn(
            "Verifier rejected {} for {} on contract {}: {}",
            request.step(),
            request.partyRole(),
            request.contractId(),
            reason);
        return VerificationOutcome.failed(result.confidence(), reason);
      }
      if (result.confidence() < minConfidence) {
        log.warn(
            "Verifier confidence {} below threshold {} for {} on contract {}",
            result.confidence(),
            minConfidence,
            request.step(),
            request.contractId());
        return VerificationOutcome.failed(
            result.confidence(),
            "Confidence " + result.confidence() + " is below the required " + minConfidence);
      }
      return VerificationOutcome.passed(result.confidence());
    } catch (TimeoutException e) {
      log.warn(
          "Verifier timed out for {} on contract {}", request.step(), request.contractId());
      return VerificationOutcome.failed(0.0, "Verifier timed out");
    } catch (RejectedExecutionException e) {
      log.warn(
          "Verifier busy, rejected {} on contract {}", request.step(), request.contractId());
      return VerificationOutcome.failed(0.0, "Verifier busy");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return VerificationOutcome.failed(0.0, "Interrupted while waiting for the verifier");
    } catch (Exception e) {
      log.warn(
          "Verifier call failed for {} on contract {}: {}",
          request.step(),
          request.contractId(),
          e.getMessage());
      return VerificationOutcome.failed(0.0, "Verifier error: " + e.getMessage());
    }
  }

  @PreDestroy
  void shutdown() {
    executor.shutdownNow();
  }
}
