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
 * Turns a {@link Delivery} into one application callback invocation.
 *
 * <p>Dispatchers never throw from {@link #handle(Delivery)}: failures go to the configured {@link
 * ConsumerErrorHandler}. Listeners are notified once per delivery, whatever the outcome.
 *
 * <p>Implementations are thread-safe, deliveries can be dispatched concurrently.
 */
public interface MessageDispatcher {

  /**
   * Process a delivery.
   *
   * @param delivery inbound delivery
   * @return the outcome
   */
  DispatchOutcome handle(Delivery delivery);

  void addListener(Listener listener);

  void removeListener(Listener listener);

  /**
   * Lifecycle notifications of a dispatcher.
   *
   * <p>Exceptions thrown by listeners are logged and do not prevent other listeners from being
   * called.
   */
  interface Listener {

    /**
     * Called when the delivery has not been handled, because the callback declined it or failed.
     *
     * @param delivery the delivery
     */
    default void messageWasNotHandled(Delivery delivery) {}

    /**
     * Called exactly once per delivery, after all processing, whatever the outcome.
     *
     * <p>This is the signal to settle the delivery.
     *
     * @param delivery the delivery
     * @param outcome the outcome of the processing
     */
    default void handlingComplete(Delivery delivery, DispatchOutcome outcome) {}
  }
}
