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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import io.warren.client.Delivery;
import io.warren.client.WarrenException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

public class RabbitMessageChannelTest {

  Channel channel;
  RabbitMessageChannel messageChannel;

  @BeforeEach
  void init() {
    channel = mock(Channel.class);
    messageChannel = new RabbitMessageChannel(channel);
  }

  @Test
  void deliveryShouldBeCreatedFromEnvelopeAndProperties() {
    Envelope envelope = new Envelope(5L, true, "warren.exchange", "com.acme.Order");
    AMQP.BasicProperties properties =
        new AMQP.BasicProperties.Builder()
            .type("com.acme.Order")
            .correlationId("corr-1")
            .contentType("application/json")
            .headers(Collections.singletonMap("x-retry", 1))
            .build();

    Delivery delivery =
        RabbitMessageChannel.delivery(
            "ctag-1", envelope, properties, "{}".getBytes(StandardCharsets.UTF_8));

    assertThat(delivery.consumerTag()).isEqualTo("ctag-1");
    assertThat(delivery.deliveryTag()).isEqualTo(5L);
    assertThat(delivery.redelivered()).isTrue();
    assertThat(delivery.exchange()).isEqualTo("warren.exchange");
    assertThat(delivery.routingKey()).isEqualTo("com.acme.Order");
    assertThat(delivery.type()).isEqualTo("com.acme.Order");
    assertThat(delivery.correlationId()).isEqualTo("corr-1");
    assertThat(delivery.contentType()).isEqualTo("application/json");
    assertThat(delivery.headers()).containsEntry("x-retry", 1);
    assertThat(delivery.bodySize()).isEqualTo(2);
  }

  @Test
  void deliveryWithoutPropertiesShouldHaveNoType() {
    Delivery delivery =
        RabbitMessageChannel.delivery(
            "ctag-1", new Envelope(1L, false, "", "orders"), null, new byte[0]);

    assertThat(delivery.type()).isNull();
    assertThat(delivery.redelivered()).isFalse();
  }

  @Test
  void consumeShouldSetPrefetchAndForwardDeliveries() throws Exception {
    when(channel.basicConsume(eq("orders"), eq(false), any(Consumer.class))).thenReturn("ctag-1");
    AtomicReference<Delivery> received = new AtomicReference<>();

    String consumerTag = messageChannel.consume("orders", 7, received::set);

    assertThat(consumerTag).isEqualTo("ctag-1");
    verify(channel, times(1)).basicQos(7);
    ArgumentCaptor<Consumer> consumer = ArgumentCaptor.forClass(Consumer.class);
    verify(channel).basicConsume(eq("orders"), eq(false), consumer.capture());
    consumer
        .getValue()
        .handleDelivery(
            "ctag-1",
            new Envelope(3L, false, "warren.exchange", "rk"),
            new AMQP.BasicProperties.Builder().type("t").build(),
            new byte[] {1});
    assertThat(received.get().deliveryTag()).isEqualTo(3L);
    assertThat(received.get().type()).isEqualTo("t");
  }

  @Test
  void consumeShouldConvertFailure() throws Exception {
    when(channel.basicConsume(eq("missing"), eq(false), any(Consumer.class)))
        .thenThrow(new IOException("NOT_FOUND"));

    assertThatThrownBy(() -> messageChannel.consume("missing", 1, d -> {}))
        .isInstanceOf(WarrenException.ConnectionException.class)
        .hasMessage("Error while consuming from queue 'missing'");
  }

  @Test
  void ackAndNackShouldSettleSingleMessage() throws Exception {
    messageChannel.ack(3L);
    messageChannel.nack(4L, true);
    messageChannel.nack(5L, false);

    verify(channel, times(1)).basicAck(3L, false);
    verify(channel, times(1)).basicNack(4L, false, true);
    verify(channel, times(1)).basicNack(5L, false, false);
  }

  @Test
  void ackOnClosedChannelShouldThrowResourceClosedException() throws Exception {
    doThrow(new AlreadyClosedException(new ShutdownSignalException(false, false, null, channel)))
        .when(channel)
        .basicAck(3L, false);

    assertThatThrownBy(() -> messageChannel.ack(3L))
        .isInstanceOf(WarrenException.ResourceClosedException.class);
  }

  @Test
  void publishShouldSetMessageProperties() throws Exception {
    Map<String, Object> headers = Collections.singletonMap("x-exception-type", "boom");
    byte[] body = "{}".getBytes(StandardCharsets.UTF_8);

    messageChannel.publish(
        "warren.exchange", "rk", "com.acme.Order", "application/json", "corr-1", true, headers, body);
    messageChannel.publish(
        "warren.exchange", "rk", "com.acme.Order", "application/json", "corr-2", false, null, body);

    ArgumentCaptor<AMQP.BasicProperties> properties =
        ArgumentCaptor.forClass(AMQP.BasicProperties.class);
    verify(channel, times(2))
        .basicPublish(eq("warren.exchange"), eq("rk"), properties.capture(), eq(body));
    AMQP.BasicProperties persistent = properties.getAllValues().get(0);
    assertThat(persistent.getType()).isEqualTo("com.acme.Order");
    assertThat(persistent.getContentType()).isEqualTo("application/json");
    assertThat(persistent.getCorrelationId()).isEqualTo("corr-1");
    assertThat(persistent.getDeliveryMode()).isEqualTo(2);
    assertThat(persistent.getHeaders()).containsEntry("x-exception-type", "boom");
    AMQP.BasicProperties transientProperties = properties.getAllValues().get(1);
    assertThat(transientProperties.getDeliveryMode()).isEqualTo(1);
    assertThat(transientProperties.getHeaders()).isNull();
  }

  @Test
  void closeShouldOnlyCloseOpenChannel() throws Exception {
    when(channel.isOpen()).thenReturn(false);
    messageChannel.close();
    verify(channel, never()).close();

    when(channel.isOpen()).thenReturn(true);
    doThrow(new IOException("Already closing")).when(channel).close();
    messageChannel.close();
    verify(channel, times(1)).close();
  }
}
