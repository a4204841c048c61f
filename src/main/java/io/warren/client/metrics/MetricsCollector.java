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
package io.warren.client.metrics;

import io.warren.client.DispatchOutcome;

/** Interface to collect execution data of the library. */
public interface MetricsCollector {

  /** Called when a {@link io.warren.client.DurableConnection} gets connected. */
  void openConnection();

  /** Called when a connected {@link io.warren.client.DurableConnection} gets disconnected. */
  void closeConnection();

  /** Called when a {@link io.warren.client.DurableConnection} reconnects after a connection loss. */
  void recoverConnection();

  /** Called when a tunnel subscription starts consuming. */
  void openConsumer();

  /** Called when a tunnel subscription stops consuming. */
  void closeConsumer();

  /** Called when a message is published through a {@link io.warren.client.Tunnel}. */
  void publish();

  /** Called when a delivery reaches a {@link io.warren.client.MessageDispatcher}. */
  void consume();

  /**
   * Called when a {@link io.warren.client.MessageDispatcher} is done with a delivery.
   *
   * @param outcome outcome of the dispatch
   */
  void consumeOutcome(DispatchOutcome outcome);
}
