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

import io.warren.client.Delivery;
import io.warren.client.DispatchOutcome;
import io.warren.client.DurableConnection;
import io.warren.client.MessageChannel;
import io.warren.client.MessageDispatcher;
import io.warren.client.ShutdownReason;
import io.warren.client.Subscription;
import io.warren.client.WarrenException;
import io.warren.client.metrics.MetricsCollector;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the subscriptions of a tunnel consuming across reconnections.
 *
 * <p>Registered as a listener of the durable connection: every subscription gets a new channel on
 * {@code connected} and drops it on {@code disconnected}.
 */
final class ConsumerManager implements DurableConnection.Listener, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConsumerManager.class);

  private final DurableConnection connection;
  private final Executor dispatchingExecutor;
  private final MetricsCollector metricsCollector;
  private final List<ManagedSubscription> subscriptions = new CopyOnWriteArrayList<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  ConsumerManager(
      DurableConnection connection,
      Executor dispatchingExecutor,
      MetricsCollector metricsCollector) {
    this.connection = connection;
    this.dispatchingExecutor = dispatchingExecutor;
    this.metricsCollector = metricsCollector;
  }

  Subscription subscribe(
      String name, String queue, int prefetch, MessageDispatcher dispatcher) {
    if (this.closed.get()) {
      throw new WarrenException.ResourceClosedException("Consumer manager is closed");
    }
    ManagedSubscription subscription = new ManagedSubscription(name, queue, prefetch, dispatcher);
    this.subscriptions.add(subscription);
    LOGGER.debug("Subscription '{}' registered on queue '{}'", name, queue);
    if (this.connection.isConnected()) {
      subscription.start();
    }
    return subscription;
  }

  int subscriptionCount() {
    return this.subscriptions.size();
  }

  @Override
  public void connected(DurableConnection connection) {
    if (this.closed.get()) {
      return;
    }
    LOGGER.debug("Connection available, (re)starting {} subscription(s)", this.subscriptions.size());
    for (ManagedSubscription subscription : this.subscriptions) {
      try {
        subscription.start();
      } catch (Exception e) {
        LOGGER.warn(
            "Could not start subscription '{}' on queue '{}': {}",
            subscription.name,
            subscription.queue,
            Utils.exceptionMessage(e));
      }
    }
  }

  @Override
  public void disconnected(DurableConnection connection, ShutdownReason reason) {
    LOGGER.debug("Connection lost, dropping {} subscription channel(s)", this.subscriptions.size());
    this.subscriptions.forEach(ManagedSubscription::drop);
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      this.subscriptions.forEach(ManagedSubscription::close);
      this.subscriptions.clear();
    }
  }

  private void acknowledge(MessageChannel channel, Delivery delivery, DispatchOutcome outcome) {
    try {
      if (outcome == DispatchOutcome.NOT_HANDLED) {
        channel.nack(delivery.deliveryTag(), true);
      } else {
        channel.ack(delivery.deliveryTag());
      }
    } catch (Exception e) {
      LOGGER.info(
          "Could not settle message {} ({}), the channel may be stale: {}",
          delivery.deliveryTag(),
          outcome,
          Utils.exceptionMessage(e));
    }
  }

  private final class ManagedSubscription implements Subscription {

    private final String name;
    private final String queue;
    private final int prefetch;
    private final MessageDispatcher dispatcher;
    private final Lock lock = new ReentrantLock();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile MessageChannel channel;
    private volatile String consumerTag;

    private ManagedSubscription(
        String name, String queue, int prefetch, MessageDispatcher dispatcher) {
      this.name = name;
      this.queue = queue;
      this.prefetch = prefetch;
      this.dispatcher = dispatcher;
    }

    private void start() {
      this.lock.lock();
      try {
        if (this.cancelled.get()) {
          return;
        }
        MessageChannel current = this.channel;
        if (current != null && current.isOpen()) {
          LOGGER.debug("Subscription '{}' already consuming", this.name);
          return;
        }
        MessageChannel newChannel = connection.createChannel();
        String tag;
        try {
          tag = newChannel.consume(this.queue, this.prefetch, d -> this.enqueue(newChannel, d));
        } catch (RuntimeException e) {
          Utils.maybeClose(newChannel, ex -> LOGGER.debug("Error while closing channel", ex));
          throw e;
        }
        this.channel = newChannel;
        this.consumerTag = tag;
        metricsCollector.openConsumer();
        LOGGER.debug(
            "Subscription '{}' consuming from queue '{}' (consumer tag {})",
            this.name,
            this.queue,
            tag);
      } finally {
        this.lock.unlock();
      }
    }

    private void enqueue(MessageChannel deliveryChannel, Delivery delivery) {
      try {
        dispatchingExecutor.execute(
            () -> {
              DispatchOutcome outcome = DispatchOutcome.FAILED;
              try {
                outcome = this.dispatcher.handle(delivery);
              } finally {
                acknowledge(deliveryChannel, delivery, outcome);
              }
            });
      } catch (RejectedExecutionException e) {
        LOGGER.warn(
            "Dispatching rejected for message {} of subscription '{}', requeuing",
            delivery.deliveryTag(),
            this.name);
        acknowledge(deliveryChannel, delivery, DispatchOutcome.NOT_HANDLED);
      }
    }

    private void drop() {
      this.lock.lock();
      try {
        MessageChannel current = this.channel;
        this.channel = null;
        this.consumerTag = null;
        if (current != null) {
          metricsCollector.closeConsumer();
          Utils.maybeClose(current, e -> LOGGER.debug("Error while closing channel", e));
        }
      } finally {
        this.lock.unlock();
      }
    }

    @Override
    public String name() {
      return this.name;
    }

    @Override
    public String queue() {
      return this.queue;
    }

    @Override
    public String consumerTag() {
      return this.consumerTag;
    }

    @Override
    public void close() {
      if (this.cancelled.compareAndSet(false, true)) {
        this.lock.lock();
        try {
          MessageChannel current = this.channel;
          String tag = this.consumerTag;
          if (current != null && current.isOpen() && tag != null) {
            try {
              current.cancel(tag);
            } catch (Exception e) {
              LOGGER.debug("Error while cancelling consumer {}: {}", tag, e.getMessage());
            }
          }
        } finally {
          this.lock.unlock();
        }
        this.drop();
        subscriptions.remove(this);
        LOGGER.debug("Subscription '{}' closed", this.name);
      }
    }
  }
}
