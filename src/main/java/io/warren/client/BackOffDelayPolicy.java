// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package io.warren.client;

import java.time.Duration;

/**
 * Contract to determine a delay between attempts of some task.
 *
 * <p>The task is typically the re-creation of a connection after it has been dropped.
 */
public interface BackOffDelayPolicy {

  Duration TIMEOUT = Duration.ofMillis(Long.MAX_VALUE);

  /**
   * Returns the delay to use for a given attempt.
   *
   * <p>The policy can return the TIMEOUT constant to indicate that the task has reached a timeout.
   *
   * @param recoveryAttempt number of the recovery attempt, starting at 0
   * @return the delay, TIMEOUT if the task should stop being retried
   */
  Duration delay(int recoveryAttempt);

  /**
   * Policy with a fixed delay.
   *
   * @param delay the fixed delay
   * @return fixed-delay policy
   */
  static BackOffDelayPolicy fixed(Duration delay) {
    return new FixedWithInitialDelayBackOffPolicy(delay, delay);
  }

  /**
   * Policy with an initial delay for the first attempt, then a fixed delay.
   *
   * @param initialDelay delay for the first attempt
   * @param delay delay for other attempts than the first one
   * @return fixed-delay policy with initial delay
   */
  static BackOffDelayPolicy fixedWithInitialDelay(Duration initialDelay, Duration delay) {
    return new FixedWithInitialDelayBackOffPolicy(initialDelay, delay);
  }

  /**
   * Policy with an initial delay for the first attempt, then a fixed delay, and a timeout.
   *
   * @param initialDelay delay for the first attempt
   * @param delay delay for other attempts than the first one
   * @param timeout timeout
   * @return fixed-delay policy with initial delay and timeout
   */
  static BackOffDelayPolicy fixedWithInitialDelay(
      Duration initialDelay, Duration delay, Duration timeout) {
    return new FixedWithInitialDelayAndTimeoutBackOffPolicy(initialDelay, delay, timeout);
  }

  /**
   * Policy that doubles the delay after each attempt, up to a maximum.
   *
   * @param initialDelay delay for the first attempt
   * @param maxDelay upper bound of the delay
   * @return exponential policy
   */
  static BackOffDelayPolicy exponential(Duration initialDelay, Duration maxDelay) {
    return new ExponentialBackOffPolicy(initialDelay, maxDelay);
  }

  /**
   * Limit the number of attempts of another policy.
   *
   * @param policy the policy to limit
   * @param maxAttempts maximum number of attempts
   * @return policy returning TIMEOUT once the number of attempts is reached
   */
  static BackOffDelayPolicy maxAttempts(BackOffDelayPolicy policy, int maxAttempts) {
    return new MaxAttemptsBackOffPolicy(policy, maxAttempts);
  }

  final class FixedWithInitialDelayBackOffPolicy implements BackOffDelayPolicy {

    private final Duration initialDelay;
    private final Duration delay;

    private FixedWithInitialDelayBackOffPolicy(Duration initialDelay, Duration delay) {
      this.initialDelay = initialDelay;
      this.delay = delay;
    }

    @Override
    public Duration delay(int recoveryAttempt) {
      return recoveryAttempt == 0 ? initialDelay : delay;
    }

    @Override
    public String toString() {
      return "FixedWithInitialDelayBackOffPolicy{"
          + "initialDelay="
          + initialDelay
          + ", delay="
          + delay
          + '}';
    }
  }

  final class FixedWithInitialDelayAndTimeoutBackOffPolicy implements BackOffDelayPolicy {

    private final int attemptLimitBeforeTimeout;
    private final BackOffDelayPolicy delegate;

    private FixedWithInitialDelayAndTimeoutBackOffPolicy(
        Duration initialDelay, Duration delay, Duration timeout) {
      if (timeout.toMillis() < initialDelay.toMillis()) {
        throw new IllegalArgumentException("Timeout must be longer than initial delay");
      }
      this.delegate = fixedWithInitialDelay(initialDelay, delay);
      long timeoutWithInitialDelay = timeout.toMillis() - initialDelay.toMillis();
      this.attemptLimitBeforeTimeout =
          (int) (timeoutWithInitialDelay / Math.max(delay.toMillis(), 1)) + 1;
    }

    @Override
    public Duration delay(int recoveryAttempt) {
      if (recoveryAttempt >= attemptLimitBeforeTimeout) {
        return TIMEOUT;
      } else {
        return delegate.delay(recoveryAttempt);
      }
    }

    @Override
    public String toString() {
      return "FixedWithInitialDelayAndTimeoutBackOffPolicy{"
          + "attemptLimitBeforeTimeout="
          + attemptLimitBeforeTimeout
          + ", delegate="
          + delegate
          + '}';
    }
  }

  final class ExponentialBackOffPolicy implements BackOffDelayPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;

    private ExponentialBackOffPolicy(Duration initialDelay, Duration maxDelay) {
      if (initialDelay.isNegative() || maxDelay.compareTo(initialDelay) < 0) {
        throw new IllegalArgumentException(
            "Initial delay must be positive and lower than max delay");
      }
      this.initialDelay = initialDelay;
      this.maxDelay = maxDelay;
    }

    @Override
    public Duration delay(int recoveryAttempt) {
      // 2^30 ms is already way over any sensible max delay
      int shift = Math.min(recoveryAttempt, 30);
      long delay = initialDelay.toMillis() << shift;
      if (delay < 0 || delay > maxDelay.toMillis()) {
        return maxDelay;
      }
      return Duration.ofMillis(delay);
    }

    @Override
    public String toString() {
      return "ExponentialBackOffPolicy{"
          + "initialDelay="
          + initialDelay
          + ", maxDelay="
          + maxDelay
          + '}';
    }
  }

  final class MaxAttemptsBackOffPolicy implements BackOffDelayPolicy {

    private final BackOffDelayPolicy delegate;
    private final int maxAttempts;

    private MaxAttemptsBackOffPolicy(BackOffDelayPolicy delegate, int maxAttempts) {
      if (maxAttempts <= 0) {
        throw new IllegalArgumentException("Max attempts must be greater than 0");
      }
      this.delegate = delegate;
      this.maxAttempts = maxAttempts;
    }

    @Override
    public Duration delay(int recoveryAttempt) {
      if (recoveryAttempt >= maxAttempts) {
        return TIMEOUT;
      } else {
        return delegate.delay(recoveryAttempt);
      }
    }

    @Override
    public String toString() {
      return "MaxAttemptsBackOffPolicy{"
          + "maxAttempts="
          + maxAttempts
          + ", delegate="
          + delegate
          + '}';
    }
  }
}
