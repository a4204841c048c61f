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
 * A physical connection to the broker, as provided by a {@link ConnectionFactory}.
 *
 * <p>Several durable connections can share the same handle.
 */
public interface ConnectionHandle extends AutoCloseable {

  /**
   * Whether the physical connection is still usable.
   *
   * @return true if open
   */
  boolean isOpen();

  /**
   * Register a listener called once when the physical connection shuts down.
   *
   * <p>The listener is called immediately if the connection is already closed.
   *
   * @param listener shutdown listener
   */
  void addShutdownListener(ShutdownListener listener);

  void removeShutdownListener(ShutdownListener listener);

  /**
   * Open a new channel on this connection.
   *
   * @return the channel
   * @throws WarrenException if the channel cannot be opened
   */
  MessageChannel createChannel();

  /** Close the physical connection. The shutdown is reported as application-initiated. */
  @Override
  void close();

  @FunctionalInterface
  interface ShutdownListener {

    void shutdownCompleted(ShutdownReason reason);
  }
}
