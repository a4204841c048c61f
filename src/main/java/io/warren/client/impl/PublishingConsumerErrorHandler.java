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
import io.warren.client.Delivery;
import io.warren.client.DurableConnection;
import io.warren.client.MessageChannel;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ConsumerErrorHandler} that republishes failed messages to an error exchange.
 *
 * <p>The original body and type are kept, the failure is described in headers. Publications go
 * through a single channel, one at a time.
 */
public class PublishingConsumerErrorHandler implements ConsumerErrorHandler {

  static final String HEADER_EXCEPTION_TYPE = "x-exception-type";
  static final String HEADER_EXCEPTION_MESSAGE = "x-exception-message";
  static final String HEADER_ORIGINAL_EXCHANGE = "x-original-exchange";
  static final String HEADER_ORIGINAL_ROUTING_KEY = "x-original-routing-key";

  private static final Logger LOGGER =
      LoggerFactory.getLogger(PublishingConsumerErrorHandler.class);

  private final DurableConnection connection;
  private final String errorExchange;
  private final Lock lock = new ReentrantLock();
  private MessageChannel channel;

  public PublishingConsumerErrorHandler(DurableConnection connection, String errorExchange) {
    if (connection == null) {
      throw new IllegalArgumentException("Connection cannot be null");
    }
    if (errorExchange == null) {
      throw new IllegalArgumentException("Error exchange cannot be null");
    }
    this.connection = connection;
    this.errorExchange = errorExchange;
  }

  @Override
  public void handleError(Delivery delivery, Exception exception) {
    Map<String, Object> headers = new LinkedHashMap<>(delivery.headers());
    headers.put(HEADER_EXCEPTION_TYPE, exception.getClass().getName());
    headers.put(
        HEADER_EXCEPTION_MESSAGE, exception.getMessage() == null ? "" : exception.getMessage());
    headers.put(HEADER_ORIGINAL_EXCHANGE, delivery.exchange());
    headers.put(HEADER_ORIGINAL_ROUTING_KEY, delivery.routingKey());
    // the channel is shared by all dispatching threads and does not support concurrent publishing
    this.lock.lock();
    try {
      this.channel()
          .publish(
              this.errorExchange,
              delivery.routingKey(),
              delivery.type(),
              delivery.contentType(),
              delivery.correlationId(),
              true,
              headers,
              delivery.body());
    } finally {
      this.lock.unlock();
    }
    LOGGER.debug(
        "Message {} republished to error exchange '{}'",
        delivery.deliveryTag(),
        this.errorExchange);
  }

  private MessageChannel channel() {
    if (this.channel == null || !this.channel.isOpen()) {
      this.channel = this.connection.createChannel();
    }
    return this.channel;
  }
}
