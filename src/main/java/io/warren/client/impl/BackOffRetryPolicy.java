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
package io.warren.client.impl;

import io.warren.client.BackOffDelayPolicy;
import io.warren.client.RetryPolicy;
import io.warren.client.WarrenException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RetryPolicy} that waits between attempts according to a {@link BackOffDelayPolicy}.
 *
 * <p>The first attempt waits for {@link BackOffDelayPolicy#delay(int)} with 0, the second with 1,
 * and so on. The policy gives up as soon as the delay policy returns {@link
 * BackOffDelayPolicy#TIMEOUT}.
 */
public class BackOffRetryPolicy implements RetryPolicy {

  private static final Logger LOGGER = LoggerFactory.getLogger(BackOffRetryPolicy.class);

  private final BackOffDelayPolicy delayPolicy;

  public BackOffRetryPolicy(BackOffDelayPolicy delayPolicy) {
    if (delayPolicy == null) {
      throw new IllegalArgumentException("Delay policy cannot be null");
    }
    this.delayPolicy = delayPolicy;
  }

  @Override
  public void waitForNextRetry(RetryAction action) {
    int attempt = 0;
    Exception lastException = null;
    Utils.StopWatch stopWatch = new Utils.StopWatch();
    while (true) {
      Duration delay = this.delayPolicy.delay(attempt);
      if (BackOffDelayPolicy.TIMEOUT.equals(delay)) {
        break;
      }
      if (!delay.isZero()) {
        try {
          Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          lastException = e;
          break;
        }
      }
      attempt++;
      try {
        LOGGER.debug("Starting retry attempt #{}", attempt);
        action.run();
        LOGGER.debug(
            "Retry succeeded in {} ms after {} attempt(s)", stopWatch.stop().toMillis(), attempt);
        return;
      } catch (WarrenException.ResourceClosedException e) {
        LOGGER.debug("Resource closed, stopping retries");
        throw e;
      } catch (Exception e) {
        LOGGER.debug("Retry attempt #{} failed: {}", attempt, Utils.exceptionMessage(e));
        lastException = e;
      }
    }
    String message =
        String.format(
            "Giving up after %d attempt(s) (reason: %s)",
            attempt, Utils.exceptionMessage(lastException));
    LOGGER.debug(message);
    throw new WarrenException.RetryExhaustedException(message, attempt, lastException);
  }

  @Override
  public String toString() {
    return "BackOffRetryPolicy{" + "delayPolicy=" + delayPolicy + '}';
  }
}
