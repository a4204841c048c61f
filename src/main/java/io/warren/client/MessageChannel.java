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

import java.util.Map;

/**
 * A channel multiplexed on a physical connection, with the operations tunnels need.
 *
 * <p>Failures are reported as {@link WarrenException}s.
 */
public interface MessageChannel extends AutoCloseable {

  /**
   * Start consuming from a queue, with manual acknowledgement.
   *
   * @param queue the queue to consume from
   * @param prefetch maximum number of unacknowledged deliveries, 0 for no limit
   * @param listener called for each inbound delivery
   * @return the consumer tag
   */
  String consume(String queue, int prefetch, DeliveryListener listener);

  void cancel(String consumerTag);

  void ack(long deliveryTag);

  void nack(long deliveryTag, boolean requeue);

  /**
   * Publish a message.
   *
   * @param exchange target exchange
   * @param routingKey routing key
   * @param type type tag of the message
   * @param contentType content type of the body
   * @param correlationId correlation ID, can be null
   * @param persistent whether the broker should persist the message
   * @param headers message headers, can be null
   * @param body message body
   */
  void publish(
      String exchange,
      String routingKey,
      String type,
      String contentType,
      String correlationId,
      boolean persistent,
      Map<String, Object> headers,
      byte[] body);

  boolean isOpen();

  @Override
  void close();

  @FunctionalInterface
  interface DeliveryListener {

    void handle(Delivery delivery);
  }
}
