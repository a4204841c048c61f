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

import io.warren.client.BackOffDelayPolicy;
import io.warren.client.ConnectionFactory;
import io.warren.client.ConnectionKey;
import io.warren.client.ConsumerErrorHandler;
import io.warren.client.DispatcherBuilder;
import io.warren.client.DurableConnection;
import io.warren.client.DurableConnectionBuilder;
import io.warren.client.Environment;
import io.warren.client.RetryPolicy;
import io.warren.client.Serializer;
import io.warren.client.TunnelBuilder;
import io.warren.client.TypeNameSerializer;
import io.warren.client.WarrenException;
import io.warren.client.metrics.MetricsCollector;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class WarrenEnvironment implements Environment {

  private static final Logger LOGGER = LoggerFactory.getLogger(WarrenEnvironment.class);
  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);

  private final long id;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final SharedConnectionRegistry registry = new SharedConnectionRegistry();
  private final Set<AmqpDurableConnection> connections = ConcurrentHashMap.newKeySet();
  private final boolean internalRecoveryExecutor;
  private final boolean internalDispatchingExecutor;
  private final ExecutorService recoveryExecutor;
  private final Executor dispatchingExecutor;
  private final MetricsCollector metricsCollector;
  private final Serializer serializer;
  private final TypeNameSerializer typeNameSerializer;
  private final ConsumerErrorHandler errorHandler;
  private final ConnectionFactory connectionFactory;
  private final BackOffDelayPolicy backOffDelayPolicy;

  WarrenEnvironment(
      ExecutorService recoveryExecutor,
      Executor dispatchingExecutor,
      MetricsCollector metricsCollector,
      Serializer serializer,
      TypeNameSerializer typeNameSerializer,
      ConsumerErrorHandler errorHandler,
      ConnectionFactory connectionFactory,
      BackOffDelayPolicy backOffDelayPolicy) {
    this.id = ID_SEQUENCE.getAndIncrement();
    String threadPrefix = String.format("warren-environment-%d-", this.id);
    if (recoveryExecutor == null) {
      this.recoveryExecutor = Utils.executorService(threadPrefix + "recovery-");
      this.internalRecoveryExecutor = true;
    } else {
      this.recoveryExecutor = recoveryExecutor;
      this.internalRecoveryExecutor = false;
    }
    if (dispatchingExecutor == null) {
      this.dispatchingExecutor = Utils.executorService(threadPrefix + "dispatching-");
      this.internalDispatchingExecutor = true;
    } else {
      this.dispatchingExecutor = dispatchingExecutor;
      this.internalDispatchingExecutor = false;
    }
    this.metricsCollector = metricsCollector;
    this.serializer = serializer;
    this.typeNameSerializer = typeNameSerializer;
    this.errorHandler = errorHandler == null ? LoggingConsumerErrorHandler.INSTANCE : errorHandler;
    this.connectionFactory = connectionFactory;
    this.backOffDelayPolicy = backOffDelayPolicy;
  }

  @Override
  public DurableConnectionBuilder connectionBuilder() {
    checkNotClosed();
    return new AmqpDurableConnectionBuilder(this);
  }

  @Override
  public <T> DispatcherBuilder<T> dispatcherBuilder(Class<T> type) {
    checkNotClosed();
    return new DefaultDispatcherBuilder<>(
        type, this.serializer, this.typeNameSerializer, this.errorHandler, this.metricsCollector);
  }

  @Override
  public TunnelBuilder tunnelBuilder() {
    checkNotClosed();
    return new AmqpTunnelBuilder(this);
  }

  DurableConnection durableConnection(
      String name,
      ConnectionKey key,
      ConnectionFactory factory,
      RetryPolicy retryPolicy,
      List<DurableConnection.Listener> listeners) {
    checkNotClosed();
    AmqpDurableConnection connection =
        new AmqpDurableConnection(
            name,
            key,
            factory,
            this.registry,
            retryPolicy,
            this.recoveryExecutor,
            this.metricsCollector,
            listeners,
            this.connections::remove);
    this.connections.add(connection);
    LOGGER.debug("Created durable connection '{}' for {}", name, key);
    return connection;
  }

  Executor dispatchingExecutor() {
    return this.dispatchingExecutor;
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  Serializer serializer() {
    return this.serializer;
  }

  TypeNameSerializer typeNameSerializer() {
    return this.typeNameSerializer;
  }

  ConsumerErrorHandler errorHandler() {
    return this.errorHandler;
  }

  ConnectionFactory connectionFactory() {
    return this.connectionFactory;
  }

  BackOffDelayPolicy backOffDelayPolicy() {
    return this.backOffDelayPolicy;
  }

  int connectionCount() {
    return this.connections.size();
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      LOGGER.debug("Closing environment {}", this.id);
      for (AmqpDurableConnection connection : new ArrayList<>(this.connections)) {
        try {
          connection.close();
        } catch (Exception e) {
          LOGGER.warn("Error while closing connection '{}'", connection.name(), e);
        }
      }
      this.registry.close();
      if (this.internalRecoveryExecutor) {
        this.recoveryExecutor.shutdownNow();
      }
      if (this.internalDispatchingExecutor) {
        ((ExecutorService) this.dispatchingExecutor).shutdownNow();
      }
      LOGGER.debug("Environment {} has been closed", this.id);
    }
  }

  private void checkNotClosed() {
    if (this.closed.get()) {
      throw new WarrenException.ResourceClosedException("Environment is closed");
    }
  }

  @Override
  public String toString() {
    return "warren-environment-" + this.id;
  }
}
