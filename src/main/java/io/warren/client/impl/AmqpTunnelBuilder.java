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

import io.warren.client.ConsumerErrorHandler;
import io.warren.client.DurableConnection;
import io.warren.client.RouteFinder;
import io.warren.client.Serializer;
import io.warren.client.Tunnel;
import io.warren.client.TunnelBuilder;
import java.util.UUID;
import java.util.function.Supplier;

final class AmqpTunnelBuilder implements TunnelBuilder {

  private static final Supplier<String> UUID_GENERATOR = () -> UUID.randomUUID().toString();

  private final WarrenEnvironment environment;
  private DurableConnection connection;
  private RouteFinder routeFinder;
  private Serializer serializer;
  private ConsumerErrorHandler errorHandler;
  private Supplier<String> correlationIdGenerator = UUID_GENERATOR;
  private boolean persistent = true;

  AmqpTunnelBuilder(WarrenEnvironment environment) {
    this.environment = environment;
    this.serializer = environment.serializer();
    this.errorHandler = environment.errorHandler();
  }

  @Override
  public TunnelBuilder connection(DurableConnection connection) {
    this.connection = connection;
    return this;
  }

  @Override
  public TunnelBuilder routeFinder(RouteFinder routeFinder) {
    this.routeFinder = routeFinder;
    return this;
  }

  @Override
  public TunnelBuilder serializer(Serializer serializer) {
    this.serializer = serializer;
    return this;
  }

  @Override
  public TunnelBuilder errorHandler(ConsumerErrorHandler errorHandler) {
    this.errorHandler = errorHandler;
    return this;
  }

  @Override
  public TunnelBuilder correlationIdGenerator(Supplier<String> correlationIdGenerator) {
    this.correlationIdGenerator = correlationIdGenerator;
    return this;
  }

  @Override
  public TunnelBuilder persistent(boolean persistent) {
    this.persistent = persistent;
    return this;
  }

  @Override
  public Tunnel build() {
    DurableConnection c =
        this.connection == null ? this.environment.connectionBuilder().build() : this.connection;
    RouteFinder rf =
        this.routeFinder == null
            ? new DefaultRouteFinder(
                DefaultRouteFinder.DEFAULT_EXCHANGE,
                DefaultRouteFinder.DEFAULT_QUEUE_PREFIX,
                this.environment.typeNameSerializer())
            : this.routeFinder;
    AmqpTunnel tunnel =
        new AmqpTunnel(
            c,
            rf,
            this.serializer,
            this.environment.typeNameSerializer(),
            this.errorHandler,
            this.environment.dispatchingExecutor(),
            this.correlationIdGenerator,
            this.persistent,
            this.environment.metricsCollector());
    try {
      tunnel.connect();
    } catch (RuntimeException e) {
      if (this.connection == null) {
        tunnel.close();
      } else {
        tunnel.detach();
      }
      throw e;
    }
    return tunnel;
  }
}
