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
 * Publish/subscribe session on top of a {@link DurableConnection}.
 *
 * <p>Subscriptions survive connection losses: they are restarted each time the durable connection
 * reconnects.
 *
 * @see TunnelBuilder
 */
public interface Tunnel extends AutoCloseable {

  /**
   * Publish a message to the exchange the {@link RouteFinder} gives for its type.
   *
   * @param message the message
   * @throws WarrenException.ResourceInvalidStateException if the tunnel is not connected
   */
  void publish(Object message);

  /**
   * Subscribe to messages of the given type.
   *
   * @param subscriptionName name of the subscription
   * @param type message type
   * @param callback application callback
   * @param <T> message type
   * @return the subscription
   */
  <T> Subscription subscribe(String subscriptionName, Class<T> type, MessageCallback<T> callback);

  <T> Subscription subscribe(
      SubscriptionOptions options, Class<T> type, MessageCallback<T> callback);

  boolean isConnected();

  void addListener(DurableConnection.Listener listener);

  /** Cancel the subscriptions and close the underlying durable connection. */
  @Override
  void close();
}
