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

/**
 * Strategy to run an action until it succeeds.
 *
 * <p>Durable connections use it to drive reconnection after the broker connection has been lost.
 * Implementations decide how long to wait between attempts and when to give up.
 *
 * @see BackOffDelayPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

  /**
   * Run the action, waiting between attempts, until it completes without throwing.
   *
   * <p>The call blocks the calling thread. A {@link WarrenException.ResourceClosedException}
   * thrown by the action stops the attempts and is rethrown as-is.
   *
   * @param action the action to retry
   * @throws WarrenException.RetryExhaustedException if the policy gives up
   */
  void waitForNextRetry(RetryAction action);

  /** Unit of work a {@link RetryPolicy} retries. */
  @FunctionalInterface
  interface RetryAction {

    /**
     * Perform one attempt.
     *
     * @throws Exception if the attempt fails
     */
    void run() throws Exception;
  }
}
