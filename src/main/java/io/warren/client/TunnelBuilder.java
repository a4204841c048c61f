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

import java.util.function.Supplier;

/** Builder for {@link Tunnel} instances. */
public interface TunnelBuilder {

  /**
   * The durable connection to use. A new one is built from the environment settings if not set.
   *
   * @param connection durable connection
   * @return this builder instance
   */
  TunnelBuilder connection(DurableConnection connection);

  TunnelBuilder routeFinder(RouteFinder routeFinder);

  TunnelBuilder serializer(Serializer serializer);

  TunnelBuilder errorHandler(ConsumerErrorHandler errorHandler);

  /**
   * Generator of correlation IDs stamped on published messages.
   *
   * <p>Default is a random UUID per message.
   *
   * @param correlationIdGenerator correlation ID generator
   * @return this builder instance
   */
  TunnelBuilder correlationIdGenerator(Supplier<String> correlationIdGenerator);

  /**
   * Whether published messages are persistent. Default is true.
   *
   * @param persistent persistent delivery mode flag
   * @return this builder instance
   */
  TunnelBuilder persistent(boolean persistent);

  /**
   * Create the tunnel and connect it.
   *
   * @return the tunnel
   * @throws WarrenException.ConnectionException if the first connection attempt fails
   */
  Tunnel build();
}
