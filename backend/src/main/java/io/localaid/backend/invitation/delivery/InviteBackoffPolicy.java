package io.localaid.backend.invitation.delivery;

import io.localaid.backend.config.JobProperties;
import java.time.Duration;
import org.springframework.stereotype.Component;

/**
 * Exponential retry delay for invite delivery: {@code base * 2^(attempts - 1)}, capped at {@code
 * max}. Non-decreasing in the attempt count and never above the cap.
 */
@Component
public class InviteBackoffPolicy {

  private static final int MAX_EXPONENT = 30;

  private final Duration base;
  private final Duration max;

  public InviteBackoffPolicy(JobProperties properties) {
    this(properties.invites().backoffBase(), properties.invites().backoffMax());
  }

  InviteBackoffPolicy(Duration base, Duration max) {
    if (base.isNegative() || base.isZero()) {
      throw new IllegalArgumentException("Backoff base must be positive: " + base);
    }
    if (max.compareTo(base) < 0) {
      throw new IllegalArgumentException("Backoff max " + max + " is below base " + base);
    }
    this.base = base;
    this.max = max;
  }

  /**
   * Delay before the next attempt, given the number of attempts made so far (including the one that
   * just failed).
   */
  public Duration delayFor(int attempts) {
    int exponent = Math.min(Math.max(attempts, 1) - 1, MAX_EXPONENT);
    try {
      Duration delay = base.multipliedBy(1L << exponent);
      return delay.compareTo(max) > 0 ? max : delay;
    } catch (ArithmeticException e) {
      return max;
    }
  }

  public Duration max() {
    return max;
  }
}
