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
import io.warren.client.MessageCallback;
import io.warren.client.MessageChannel;
import io.warren.client.MessageDispatcher;
import io.warren.client.RouteFinder;
import io.warren.client.Serializer;
import io.warren.client.ShutdownReason;
import io.warren.client.Subscription;
import io.warren.client.SubscriptionOptions;
import io.warren.client.Tunnel;
import io.warren.client.TypeNameSerializer;
import io.warren.client.WarrenException;
import io.warren.client.metrics.MetricsCollector;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpTunnel implements Tunnel {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpTunnel.class);

  private final DurableConnection connection;
  private final RouteFinder routeFinder;
  private final Serializer serializer;
  private final TypeNameSerializer typeNameSerializer;
  private final ConsumerErrorHandler errorHandler;
  private final Supplier<String> correlationIdGenerator;
  private final boolean persistent;
  private final MetricsCollector metricsCollector;
  private final ConsumerManager consumerManager;
  private final DurableConnection.Listener publishChannelListener;
  private final Lock publishLock = new ReentrantLock();
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private volatile MessageChannel publishChannel;

  AmqpTunnel(
      DurableConnection connection,
      RouteFinder routeFinder,
      Serializer serializer,
      TypeNameSerializer typeNameSerializer,
      ConsumerErrorHandler errorHandler,
      Executor dispatchingExecutor,
      Supplier<String> correlationIdGenerator,
      boolean persistent,
      MetricsCollector metricsCollector) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.routeFinder = Objects.requireNonNull(routeFinder, "routeFinder");
    this.serializer = Objects.requireNonNull(serializer, "serializer");
    this.typeNameSerializer = Objects.requireNonNull(typeNameSerializer, "typeNameSerializer");
    this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler");
    Objects.requireNonNull(dispatchingExecutor, "dispatchingExecutor");
    this.correlationIdGenerator =
        Objects.requireNonNull(correlationIdGenerator, "correlationIdGenerator");
    this.persistent = persistent;
    this.metricsCollector = Objects.requireNonNull(metricsCollector, "metricsCollector");
    this.consumerManager =
        new ConsumerManager(connection, dispatchingExecutor, metricsCollector);
    this.publishChannelListener =
        new DurableConnection.Listener() {
          @Override
          public void disconnected(DurableConnection c, ShutdownReason reason) {
            dropPublishChannel();
          }
        };
    this.connection.addListener(this.consumerManager);
    this.connection.addListener(this.publishChannelListener);
  }

  void connect() {
    this.connection.connect();
  }

  @Override
  public void publish(Object message) {
    Objects.requireNonNull(message, "message");
    checkNotClosed();
    Class<?> type = message.getClass();
    if (!this.connection.isConnected()) {
      throw new WarrenException.ResourceInvalidStateException(
          "Tunnel is not connected, cannot publish message of type %s", type.getName());
    }
    byte[] body = this.serializer.serialize(message);
    String exchange = this.routeFinder.exchangeName(type);
    String routingKey = this.routeFinder.routingKey(type);
    this.publishLock.lock();
    try {
      this.publishChannel()
          .publish(
              exchange,
              routingKey,
              this.typeNameSerializer.serialize(type),
              this.serializer.contentType(),
              this.correlationIdGenerator.get(),
              this.persistent,
              null,
              body);
    } finally {
      this.publishLock.unlock();
    }
    this.metricsCollector.publish();
    LOGGER.debug(
        "Published {} ({} byte(s)) to exchange '{}' with routing key '{}'",
        type.getSimpleName(),
        body.length,
        exchange,
        routingKey);
  }

  private MessageChannel publishChannel() {
    MessageChannel current = this.publishChannel;
    if (current == null || !current.isOpen()) {
      current = this.connection.createChannel();
      this.publishChannel = current;
    }
    return current;
  }

  private void dropPublishChannel() {
    this.publishLock.lock();
    try {
      MessageChannel current = this.publishChannel;
      this.publishChannel = null;
      Utils.maybeClose(current, e -> LOGGER.debug("Error while closing publish channel", e));
    } finally {
      this.publishLock.unlock();
    }
  }

  @Override
  public <T> Subscription subscribe(
      String subscriptionName, Class<T> type, MessageCallback<T> callback) {
    return this.subscribe(SubscriptionOptions.subscription(subscriptionName), type, callback);
  }

  @Override
  public <T> Subscription subscribe(
      SubscriptionOptions options, Class<T> type, MessageCallback<T> callback) {
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(callback, "callback");
    checkNotClosed();
    String name = options.subscriptionName();
    String queue =
        options.queue() == null ? this.routeFinder.queueName(type, name) : options.queue();
    MessageDispatcher dispatcher =
        new DefaultDispatcherBuilder<>(
                type,
                this.serializer,
                this.typeNameSerializer,
                this.errorHandler,
                this.metricsCollector)
            .subscriptionName(name)
            .callback(callback)
            .build();
    return this.consumerManager.subscribe(name, queue, options.prefetch(), dispatcher);
  }

  @Override
  public boolean isConnected() {
    return this.connection.isConnected();
  }

  @Override
  public void addListener(DurableConnection.Listener listener) {
    this.connection.addListener(listener);
  }

  ConsumerManager consumerManager() {
    return this.consumerManager;
  }

  @Override
  public void close() {
    this.close(true);
  }

  /** Release the tunnel resources and leave the connection open. */
  void detach() {
    this.close(false);
  }

  private void close(boolean closeConnection) {
    if (this.closed.compareAndSet(false, true)) {
      LOGGER.debug("Closing tunnel on {}", this.connection.key());
      this.consumerManager.close();
      this.dropPublishChannel();
      this.connection.removeListener(this.consumerManager);
      this.connection.removeListener(this.publishChannelListener);
      if (closeConnection) {
        this.connection.close();
      }
    }
  }

  private void checkNotClosed() {
    if (this.closed.get()) {
      throw new WarrenException.ResourceClosedException("Tunnel is closed");
    }
  }
}
