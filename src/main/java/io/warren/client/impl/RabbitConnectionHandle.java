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

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownSignalException;
import io.warren.client.ConnectionHandle;
import io.warren.client.MessageChannel;
import io.warren.client.ShutdownReason;
import io.warren.client.WarrenException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class RabbitConnectionHandle implements ConnectionHandle {

  private static final Logger LOGGER = LoggerFactory.getLogger(RabbitConnectionHandle.class);

  private final Connection connection;
  private final Map<ShutdownListener, com.rabbitmq.client.ShutdownListener> listeners =
      new ConcurrentHashMap<>();

  RabbitConnectionHandle(Connection connection) {
    this.connection = connection;
  }

  @Override
  public boolean isOpen() {
    return this.connection.isOpen();
  }

  @Override
  public void addShutdownListener(ShutdownListener listener) {
    com.rabbitmq.client.ShutdownListener delegate =
        signal -> listener.shutdownCompleted(shutdownReason(signal));
    this.listeners.put(listener, delegate);
    this.connection.addShutdownListener(delegate);
  }

  @Override
  public void removeShutdownListener(ShutdownListener listener) {
    com.rabbitmq.client.ShutdownListener delegate = this.listeners.remove(listener);
    if (delegate != null) {
      this.connection.removeShutdownListener(delegate);
    }
  }

  @Override
  public MessageChannel createChannel() {
    try {
      Channel channel = this.connection.createChannel();
      if (channel == null) {
        throw new WarrenException.ResourceInvalidStateException("No channel available");
      }
      return new RabbitMessageChannel(channel);
    } catch (Exception e) {
      throw ExceptionUtils.convert(e, "Error while opening channel");
    }
  }

  @Override
  public void close() {
    if (this.connection.isOpen()) {
      try {
        this.connection.close();
      } catch (Exception e) {
        throw ExceptionUtils.convert(e, "Error while closing connection");
      }
    } else {
      LOGGER.debug("Connection already closed");
    }
  }

  static ShutdownReason shutdownReason(ShutdownSignalException signal) {
    Method reason = signal.getReason();
    int code = 0;
    String text = signal.getMessage();
    if (reason instanceof AMQP.Connection.Close) {
      code = ((AMQP.Connection.Close) reason).getReplyCode();
      text = ((AMQP.Connection.Close) reason).getReplyText();
    } else if (reason instanceof AMQP.Channel.Close) {
      code = ((AMQP.Channel.Close) reason).getReplyCode();
      text = ((AMQP.Channel.Close) reason).getReplyText();
    }
    ShutdownReason.Initiator initiator;
    if (signal.isInitiatedByApplication()) {
      initiator = ShutdownReason.Initiator.APPLICATION;
    } else if (reason != null) {
      initiator = ShutdownReason.Initiator.PEER;
    } else if (signal.getCause() != null) {
      initiator = ShutdownReason.Initiator.LIBRARY;
    } else {
      initiator = ShutdownReason.Initiator.UNKNOWN;
    }
    Throwable exception = signal.getCause() == null ? signal : signal.getCause();
    return new ShutdownReason(initiator, code, text, exception);
  }
}
