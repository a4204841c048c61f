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
 * Entry point to create durable connections, dispatchers and tunnels.
 *
 * <p>The environment owns the resources they share: the registry of physical connections and the
 * executors. Close it to release them.
 *
 * @see io.warren.client.impl.WarrenEnvironmentBuilder
 */
public interface Environment extends AutoCloseable {

  DurableConnectionBuilder connectionBuilder();

  <T> DispatcherBuilder<T> dispatcherBuilder(Class<T> type);

  TunnelBuilder tunnelBuilder();

  /** Close the environment and the connections it created. */
  @Override
  void close();
}
