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
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import io.warren.client.Delivery;
import io.warren.client.MessageChannel;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class RabbitMessageChannel implements MessageChannel {

  private static final Logger LOGGER = LoggerFactory.getLogger(RabbitMessageChannel.class);

  private static final int TRANSIENT_DELIVERY_MODE = 1;
  private static final int PERSISTENT_DELIVERY_MODE = 2;

  private final Channel channel;

  RabbitMessageChannel(Channel channel) {
    this.channel = channel;
  }

  @Override
  public String consume(String queue, int prefetch, DeliveryListener listener) {
    try {
      this.channel.basicQos(prefetch);
      return this.channel.basicConsume(
          queue,
          false,
          new DefaultConsumer(this.channel) {
            @Override
            public void handleDelivery(
                String consumerTag,
                Envelope envelope,
                AMQP.BasicProperties properties,
                byte[] body) {
              listener.handle(delivery(consumerTag, envelope, properties, body));
            }
          });
    } catch (Exception e) {
      throw ExceptionUtils.convert(e, "Error while consuming from queue '%s'", queue);
    }
  }

  @Override
  public void cancel(String consumerTag) {
    try {
      this.channel.basicCancel(consumerTag);
    } catch (Exception e) {
      throw ExceptionUtils.convert(e, "Error while cancelling consumer '%s'", consumerTag);
    }
  }

  @Override
  public void ack(long deliveryTag) {
    try {
      this.channel.basicAck(deliveryTag, false);
    } catch (Exception e) {
      throw ExceptionUtils.convert(e, "Error while acknowledging message %d", deliveryTag);
    }
  }

  @Override
  public void nack(long deliveryTag, boolean requeue) {
    try {
      this.channel.basicNack(deliveryTag, false, requeue);
    } catch (Exception e) {
      throw ExceptionUtils.convert(e, "Error while rejecting message %d", deliveryTag);
    }
  }

  @Override
  public void publish(
      String exchange,
      String routingKey,
      String type,
      String contentType,
      String correlationId,
      boolean persistent,
      Map<String, Object> headers,
      byte[] body) {
    AMQP.BasicProperties properties =
        new AMQP.BasicProperties.Builder()
            .type(type)
            .contentType(contentType)
            .correlationId(correlationId)
            .deliveryMode(persistent ? PERSISTENT_DELIVERY_MODE : TRANSIENT_DELIVERY_MODE)
            .headers(headers)
            .build();
    try {
      this.channel.basicPublish(exchange, routingKey, properties, body);
    } catch (Exception e) {
      throw ExceptionUtils.convert(
          e, "Error while publishing to exchange '%s' (routing key '%s')", exchange, routingKey);
    }
  }

  @Override
  public boolean isOpen() {
    return this.channel.isOpen();
  }

  @Override
  public void close() {
    if (this.channel.isOpen()) {
      try {
        this.channel.close();
      } catch (Exception e) {
        LOGGER.debug("Error while closing channel: {}", e.getMessage());
      }
    }
  }

  static Delivery delivery(
      String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
    Delivery.Builder builder =
        Delivery.builder()
            .consumerTag(consumerTag)
            .deliveryTag(envelope.getDeliveryTag())
            .exchange(envelope.getExchange())
            .routingKey(envelope.getRoutingKey())
            .redelivered(envelope.isRedeliver())
            .body(body);
    if (properties != null) {
      builder
          .type(properties.getType())
          .correlationId(properties.getCorrelationId())
          .contentType(properties.getContentType())
          .headers(properties.getHeaders());
    }
    return builder.build();
  }
}
