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

import io.warren.client.ConnectionFactory;
import io.warren.client.ConnectionHandle;
import io.warren.client.ConnectionKey;
import io.warren.client.DurableConnection;
import io.warren.client.MessageChannel;
import io.warren.client.RetryPolicy;
import io.warren.client.ShutdownReason;
import io.warren.client.WarrenException;
import io.warren.client.metrics.MetricsCollector;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DurableConnection} on top of a {@link SharedConnectionRegistry}.
 *
 * <p>The instance subscribes to the shutdown notification of the physical connection it adopts.
 * A shutdown not initiated by the application removes the physical connection from the registry
 * and starts a recovery task on the recovery executor. The task hands a reconnect closure to the
 * {@link RetryPolicy}.
 */
final class AmqpDurableConnection implements DurableConnection {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpDurableConnection.class);

  private final String name;
  private final ConnectionKey key;
  private final ConnectionFactory connectionFactory;
  private final SharedConnectionRegistry registry;
  private final RetryPolicy retryPolicy;
  private final Executor recoveryExecutor;
  private final MetricsCollector metricsCollector;
  private final List<Listener> listeners;
  private final Consumer<AmqpDurableConnection> closeCallback;
  private final AtomicReference<State> state = new AtomicReference<>(State.DISCONNECTED);
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final AtomicBoolean recovering = new AtomicBoolean(false);
  private final AtomicBoolean recoveryRequested = new AtomicBoolean(false);
  private final Lock instanceLock = new ReentrantLock();
  private volatile ConnectionHandle handle;
  private volatile ConnectionHandle.ShutdownListener shutdownListener;
  private volatile Future<?> recoveryTask;

  AmqpDurableConnection(
      String name,
      ConnectionKey key,
      ConnectionFactory connectionFactory,
      SharedConnectionRegistry registry,
      RetryPolicy retryPolicy,
      Executor recoveryExecutor,
      MetricsCollector metricsCollector,
      List<Listener> listeners,
      Consumer<AmqpDurableConnection> closeCallback) {
    this.name = name;
    this.key = key;
    this.connectionFactory = connectionFactory;
    this.registry = registry;
    this.retryPolicy = retryPolicy;
    this.recoveryExecutor = recoveryExecutor;
    this.metricsCollector = metricsCollector;
    this.listeners = new CopyOnWriteArrayList<>(listeners);
    this.closeCallback = closeCallback;
  }

  @Override
  public void connect() {
    this.instanceLock.lock();
    try {
      this.doConnect(false);
    } finally {
      this.instanceLock.unlock();
    }
  }

  private void reconnect() {
    this.instanceLock.lock();
    try {
      this.doConnect(true);
    } finally {
      this.instanceLock.unlock();
    }
  }

  private void doConnect(boolean recovery) {
    // close() may have completed while this thread was waiting for the lock
    checkNotClosed();
    ConnectionHandle current = this.handle;
    if (this.state.get() == State.CONNECTED && current != null && current.isOpen()) {
      LOGGER.debug("Connection '{}' already connected to {}", this.name, this.key);
      return;
    }
    this.state.set(State.CONNECTING);
    LOGGER.debug("Connecting '{}' to {}...", this.name, this.key);
    ConnectionHandle newHandle;
    try {
      newHandle = this.registry.getOrCreate(this.key, this.connectionFactory);
    } catch (WarrenException.ConnectionException e) {
      this.state.set(State.DISCONNECTED);
      throw e;
    } catch (Exception e) {
      this.state.set(State.DISCONNECTED);
      throw new WarrenException.ConnectionException(
          String.format(
              "Error while connecting '%s' to %s: %s",
              this.name, this.key, Utils.exceptionMessage(e)),
          e);
    }
    ConnectionHandle.ShutdownListener listener =
        reason -> this.handleShutdown(newHandle, reason);
    this.handle = newHandle;
    this.shutdownListener = listener;
    newHandle.addShutdownListener(listener);
    if (!this.state.compareAndSet(State.CONNECTING, State.CONNECTED)) {
      // shutdown signal received between creation and subscription
      this.handle = null;
      this.shutdownListener = null;
      try {
        newHandle.removeShutdownListener(listener);
      } catch (Exception e) {
        LOGGER.debug("Error while unsubscribing from connection '{}'", this.name, e);
      }
      this.registry.release(this.key, newHandle);
      throw new WarrenException.ConnectionException(
          "Connection '%s' to %s closed while connecting", this.name, this.key);
    }
    LOGGER.debug("Connection '{}' connected to {}", this.name, this.key);
    this.metricsCollector.openConnection();
    if (recovery) {
      this.metricsCollector.recoverConnection();
    }
    this.dispatch(l -> l.connected(this));
  }

  private void handleShutdown(ConnectionHandle shutdownHandle, ShutdownReason reason) {
    if (shutdownHandle != this.handle) {
      LOGGER.debug(
          "Ignoring shutdown of stale connection for '{}' ({})", this.name, reason.cause());
      return;
    }
    State previous = this.state.getAndSet(State.DISCONNECTED);
    if (previous == State.DISCONNECTED) {
      LOGGER.debug("Connection '{}' already disconnected, ignoring {}", this.name, reason);
      return;
    }
    if (previous == State.CONNECTING) {
      // the connecting thread rolls back and reports the failure
      LOGGER.debug("Connection '{}' shut down while connecting: {}", this.name, reason);
      return;
    }
    this.handle = null;
    this.shutdownListener = null;
    if (previous == State.CONNECTED) {
      this.metricsCollector.closeConnection();
    }
    if (reason.initiatedByApplication()) {
      LOGGER.debug("Connection '{}' closed by application: {}", this.name, reason.cause());
      this.cancelRecovery();
      this.dispatch(l -> l.disconnected(this, reason));
      return;
    }
    this.registry.remove(this.key, shutdownHandle);
    LOGGER.info(
        "Connection '{}' to {} has been disconnected ({}), initializing recovery",
        this.name,
        this.key,
        reason);
    this.dispatch(l -> l.disconnected(this, reason));
    if (this.closed.get()) {
      return;
    }
    this.scheduleRecovery();
  }

  private void scheduleRecovery() {
    if (this.recovering.compareAndSet(false, true)) {
      LOGGER.debug("Queueing recovery task for '{}'", this.name);
      FutureTask<Void> task = new FutureTask<>(this::recover, null);
      this.recoveryTask = task;
      try {
        this.recoveryExecutor.execute(task);
      } catch (RejectedExecutionException e) {
        this.recovering.set(false);
        LOGGER.warn("Could not schedule recovery of connection '{}'", this.name, e);
      }
    } else {
      this.recoveryRequested.set(true);
      LOGGER.debug(
          "Filtering recovery task scheduling, recovery of '{}' already in progress", this.name);
    }
  }

  private void recover() {
    this.recoveryRequested.set(false);
    try {
      this.retryPolicy.waitForNextRetry(this::reconnect);
      LOGGER.info("Recovered connection '{}' to {}", this.name, this.key);
    } catch (WarrenException.ResourceClosedException e) {
      LOGGER.debug("Connection '{}' closed, stopping recovery", this.name);
    } catch (RuntimeException e) {
      if (this.closed.get()) {
        LOGGER.debug("Connection '{}' closed during recovery", this.name);
      } else {
        LOGGER.warn(
            "Could not recover connection '{}' to {}: {}",
            this.name,
            this.key,
            Utils.exceptionMessage(e));
        WarrenException cause =
            e instanceof WarrenException ? (WarrenException) e : new WarrenException(e);
        this.dispatch(l -> l.recoveryFailed(this, cause));
      }
    } finally {
      this.recovering.set(false);
    }
    if (this.recoveryRequested.compareAndSet(true, false)
        && !this.closed.get()
        && this.state.get() == State.DISCONNECTED) {
      // connection lost again while the recovery task was completing
      this.scheduleRecovery();
    }
  }

  private void cancelRecovery() {
    Future<?> task = this.recoveryTask;
    if (task != null && !task.isDone()) {
      LOGGER.debug("Cancelling recovery of connection '{}'", this.name);
      task.cancel(true);
    }
  }

  @Override
  public State state() {
    return this.state.get();
  }

  @Override
  public boolean isConnected() {
    ConnectionHandle current = this.handle;
    return this.state.get() == State.CONNECTED && current != null && current.isOpen();
  }

  @Override
  public ConnectionKey key() {
    return this.key;
  }

  String name() {
    return this.name;
  }

  boolean recovering() {
    return this.recovering.get();
  }

  @Override
  public MessageChannel createChannel() {
    checkNotClosed();
    ConnectionHandle current = this.handle;
    if (this.state.get() != State.CONNECTED || current == null) {
      throw new WarrenException.ResourceInvalidStateException(
          "Connection '%s' is not connected (state %s)", this.name, this.state.get());
    }
    return current.createChannel();
  }

  @Override
  public void addListener(Listener listener) {
    if (listener == null) {
      throw new IllegalArgumentException("Listener cannot be null");
    }
    this.listeners.add(listener);
  }

  @Override
  public void removeListener(Listener listener) {
    this.listeners.remove(listener);
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      LOGGER.debug("Closing connection '{}'", this.name);
      this.cancelRecovery();
      State previous;
      this.instanceLock.lock();
      try {
        ConnectionHandle current = this.handle;
        ConnectionHandle.ShutdownListener listener = this.shutdownListener;
        this.handle = null;
        this.shutdownListener = null;
        previous = this.state.getAndSet(State.DISCONNECTED);
        if (current != null) {
          if (listener != null) {
            try {
              current.removeShutdownListener(listener);
            } catch (Exception e) {
              LOGGER.debug("Error while unsubscribing from connection '{}'", this.name, e);
            }
          }
          this.registry.release(this.key, current);
        }
      } finally {
        this.instanceLock.unlock();
      }
      if (previous == State.CONNECTED) {
        this.metricsCollector.closeConnection();
        ShutdownReason reason = ShutdownReason.application("Connection closed by application");
        this.dispatch(l -> l.disconnected(this, reason));
      }
      this.closeCallback.accept(this);
      LOGGER.debug("Connection '{}' closed", this.name);
    }
  }

  private void dispatch(Consumer<Listener> event) {
    for (Listener listener : this.listeners) {
      try {
        event.accept(listener);
      } catch (Exception e) {
        LOGGER.warn("Error in connection listener", e);
      }
    }
  }

  private void checkNotClosed() {
    if (this.closed.get()) {
      throw new WarrenException.ResourceClosedException(
          "Connection '" + this.name + "' is closed");
    }
  }

  @Override
  public String toString() {
    return "AmqpDurableConnection{"
        + "name='"
        + name
        + '\''
        + ", key="
        + key
        + ", state="
        + state.get()
        + '}';
  }
}
