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
 * Logical connection to a broker that survives drops of the underlying physical connection.
 *
 * <p>When the physical connection shuts down for another reason than an application close, the
 * durable connection uses its {@link RetryPolicy} to reconnect, and notifies its listeners on both
 * sides of the outage.
 *
 * <p>Durable connections with the same {@link ConnectionKey} share one physical connection.
 *
 * @see DurableConnectionBuilder
 */
public interface DurableConnection extends AutoCloseable {

  /**
   * Establish the connection, if not already connected.
   *
   * @throws WarrenException.ConnectionException if the physical connection cannot be established
   * @throws WarrenException.ResourceClosedException if the durable connection has been closed
   */
  void connect();

  State state();

  boolean isConnected();

  ConnectionKey key();

  /**
   * Open a channel on the current physical connection.
   *
   * @return the channel
   * @throws WarrenException.ResourceInvalidStateException if not connected
   */
  MessageChannel createChannel();

  void addListener(Listener listener);

  void removeListener(Listener listener);

  /** Close the durable connection for good. No reconnection happens afterwards. */
  @Override
  void close();

  /** State of a durable connection. */
  enum State {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
  }

  /**
   * Connection lifecycle notifications.
   *
   * <p>Listeners are called synchronously, in registration order. An exception thrown by a listener
   * is logged and does not prevent the other listeners from being called.
   */
  interface Listener {

    default void connected(DurableConnection connection) {}

    default void disconnected(DurableConnection connection, ShutdownReason reason) {}

    /**
     * Called when the retry policy gave up reconnecting.
     *
     * @param connection the connection
     * @param cause the failure reported by the retry policy
     */
    default void recoveryFailed(DurableConnection connection, WarrenException cause) {}
  }
}
