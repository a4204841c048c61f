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

import static java.time.Duration.ofMillis;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import io.warren.client.BackOffDelayPolicy;
import io.warren.client.RetryPolicy;
import io.warren.client.WarrenException;
import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public class BackOffRetryPolicyTest {

  @Mock RetryPolicy.RetryAction action;

  @Test
  void waitForNextRetryShouldReturnWhenActionSucceeds() throws Exception {
    doThrow(new IOException("connection refused"))
        .doThrow(new IOException("connection refused"))
        .doNothing()
        .when(action)
        .run();
    RetryPolicy policy = new BackOffRetryPolicy(BackOffDelayPolicy.fixed(ofMillis(1)));
    policy.waitForNextRetry(action);
    verify(action, times(3)).run();
  }

  @Test
  void waitForNextRetryShouldGiveUpWhenDelayPolicyTimesOut() throws Exception {
    IOException failure = new IOException("connection refused");
    doThrow(failure).when(action).run();
    RetryPolicy policy =
        new BackOffRetryPolicy(
            BackOffDelayPolicy.maxAttempts(BackOffDelayPolicy.fixed(ofMillis(1)), 3));
    assertThatThrownBy(() -> policy.waitForNextRetry(action))
        .isInstanceOf(WarrenException.RetryExhaustedException.class)
        .hasCause(failure)
        .satisfies(
            e ->
                assertThat(((WarrenException.RetryExhaustedException) e).attempts())
                    .isEqualTo(3));
    verify(action, times(3)).run();
  }

  @Test
  void waitForNextRetryShouldStopImmediatelyWhenResourceIsClosed() throws Exception {
    doThrow(new WarrenException.ResourceClosedException("closed")).when(action).run();
    RetryPolicy policy = new BackOffRetryPolicy(BackOffDelayPolicy.fixed(ofMillis(1)));
    assertThatThrownBy(() -> policy.waitForNextRetry(action))
        .isInstanceOf(WarrenException.ResourceClosedException.class);
    verify(action, times(1)).run();
  }

  @Test
  void waitForNextRetryShouldGiveUpWhenThreadIsInterrupted() throws Exception {
    RetryPolicy policy = new BackOffRetryPolicy(BackOffDelayPolicy.fixed(ofMillis(10_000)));
    Thread.currentThread().interrupt();
    try {
      assertThatThrownBy(() -> policy.waitForNextRetry(action))
          .isInstanceOf(WarrenException.RetryExhaustedException.class)
          .hasCauseInstanceOf(InterruptedException.class);
    } finally {
      Thread.interrupted();
    }
    verify(action, times(0)).run();
  }

  @Test
  void firstAttemptShouldRunAfterInitialDelay() throws Exception {
    doNothing().when(action).run();
    RetryPolicy policy =
        new BackOffRetryPolicy(BackOffDelayPolicy.fixedWithInitialDelay(ofMillis(50), ofMillis(1)));
    long start = System.nanoTime();
    policy.waitForNextRetry(action);
    assertThat(System.nanoTime() - start).isGreaterThanOrEqualTo(ofMillis(50).toNanos());
    verify(action, times(1)).run();
  }
}
