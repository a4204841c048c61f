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
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.warren.client.ConsumerErrorHandler;
import io.warren.client.DurableConnection;
import io.warren.client.MessageChannel;
import io.warren.client.RouteFinder;
import io.warren.client.Serializer;
import io.warren.client.ShutdownReason;
import io.warren.client.Subscription;
import io.warren.client.SubscriptionOptions;
import io.warren.client.TypeNameSerializer;
import io.warren.client.WarrenException;
import io.warren.client.metrics.MetricsCollector;
import io.warren.client.serialization.GsonSerializer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

public class AmqpTunnelTest {

  static final String ORDER_TYPE = Order.class.getName();

  DurableConnection connection;
  MessageChannel channel;
  RouteFinder routeFinder;
  Serializer serializer;
  TypeNameSerializer typeNameSerializer;
  ConsumerErrorHandler errorHandler;
  Executor executor;
  Supplier<String> correlationIdGenerator;
  MetricsCollector metricsCollector;

  @BeforeEach
  void init() {
    connection = mock(DurableConnection.class);
    channel = ConsumerManagerTest.openChannel("ctag-1");
    when(connection.createChannel()).thenReturn(channel);
    routeFinder = new DefaultRouteFinder();
    serializer = new GsonSerializer();
    typeNameSerializer = DefaultTypeNameSerializer.INSTANCE;
    errorHandler = mock(ConsumerErrorHandler.class);
    executor = Runnable::run;
    correlationIdGenerator = () -> "corr-1";
    metricsCollector = mock(MetricsCollector.class);
  }

  @Test
  void constructorShouldRejectNullArguments() {
    assertThatThrownBy(
            () ->
                new AmqpTunnel(
                    null,
                    routeFinder,
                    serializer,
                    typeNameSerializer,
                    errorHandler,
                    executor,
                    correlationIdGenerator,
                    true,
                    metricsCollector))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("connection");
    assertThatThrownBy(
            () ->
                new AmqpTunnel(
                    connection,
                    null,
                    serializer,
                    typeNameSerializer,
                    errorHandler,
                    executor,
                    correlationIdGenerator,
                    true,
                    metricsCollector))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("routeFinder");
    assertThatThrownBy(
            () ->
                new AmqpTunnel(
                    connection,
                    routeFinder,
                    null,
                    typeNameSerializer,
                    errorHandler,
                    executor,
                    correlationIdGenerator,
                    true,
                    metricsCollector))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("serializer");
    assertThatThrownBy(
            () ->
                new AmqpTunnel(
                    connection,
                    routeFinder,
                    serializer,
                    typeNameSerializer,
                    errorHandler,
                    executor,
                    null,
                    true,
                    metricsCollector))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("correlationIdGenerator");
  }

  @Test
  void tunnelShouldListenToConnectionEvents() {
    AmqpTunnel tunnel = tunnel();
    verify(connection, times(1)).addListener(tunnel.consumerManager());
  }

  @Test
  void publishShouldSerializeAndRouteMessage() {
    when(connection.isConnected()).thenReturn(true);
    AmqpTunnel tunnel = tunnel();
    Order order = new Order("42", 3);

    tunnel.publish(order);
    tunnel.publish(order);

    ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
    verify(channel, times(2))
        .publish(
            eq(DefaultRouteFinder.DEFAULT_EXCHANGE),
            eq(ORDER_TYPE),
            eq(ORDER_TYPE),
            eq("application/json"),
            eq("corr-1"),
            eq(true),
            isNull(),
            body.capture());
    assertThat(new String(body.getValue(), StandardCharsets.UTF_8))
        .isEqualTo("{\"id\":\"42\",\"quantity\":3}");
    verify(connection, times(1)).createChannel();
    verify(metricsCollector, times(2)).publish();
  }

  @Test
  void publishShouldFailWhenDisconnected() {
    when(connection.isConnected()).thenReturn(false);
    AmqpTunnel tunnel = tunnel();

    assertThatThrownBy(() -> tunnel.publish(new Order("42", 3)))
        .isInstanceOf(WarrenException.ResourceInvalidStateException.class);
    verify(connection, never()).createChannel();
  }

  @Test
  void publishChannelShouldBeRecreatedAfterDisconnection() {
    when(connection.isConnected()).thenReturn(true);
    MessageChannel newChannel = ConsumerManagerTest.openChannel("ctag-2");
    AmqpTunnel tunnel = tunnel();
    tunnel.publish(new Order("1", 1));
    when(connection.createChannel()).thenReturn(newChannel);

    ArgumentCaptor<DurableConnection.Listener> listeners =
        ArgumentCaptor.forClass(DurableConnection.Listener.class);
    verify(connection, times(2)).addListener(listeners.capture());
    ShutdownReason reason =
        new ShutdownReason(ShutdownReason.Initiator.LIBRARY, 0, "Missed heartbeats");
    listeners.getAllValues().forEach(l -> l.disconnected(connection, reason));
    tunnel.publish(new Order("2", 1));

    verify(channel, times(1)).close();
    verify(newChannel, times(1))
        .publish(anyString(), anyString(), anyString(), anyString(), any(), eq(true), any(), any());
  }

  @Test
  void subscribeShouldUseRouteFinderQueueName() {
    when(connection.isConnected()).thenReturn(true);
    AmqpTunnel tunnel = tunnel();

    Subscription subscription = tunnel.subscribe("billing", Order.class, (order, context) -> {});

    assertThat(subscription.queue()).isEqualTo("warren.queue.billing.Order");
    verify(channel, times(1)).consume(eq("warren.queue.billing.Order"), eq(10), any());
  }

  @Test
  void subscribeShouldUseOptions() {
    when(connection.isConnected()).thenReturn(true);
    AmqpTunnel tunnel = tunnel();

    Subscription subscription =
        tunnel.subscribe(
            SubscriptionOptions.subscription("billing").queue("orders").prefetch(50),
            Order.class,
            (order, context) -> {});

    assertThat(subscription.queue()).isEqualTo("orders");
    verify(channel, times(1)).consume(eq("orders"), eq(50), any());
  }

  @Test
  void subscribeShouldRejectNullArguments() {
    AmqpTunnel tunnel = tunnel();
    assertThatThrownBy(() -> tunnel.subscribe("billing", Order.class, null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("callback");
    assertThatThrownBy(() -> tunnel.subscribe("billing", null, (order, context) -> {}))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("type");
  }

  @Test
  void closeShouldCloseConnectionAndForbidFurtherOperations() {
    when(connection.isConnected()).thenReturn(true);
    AmqpTunnel tunnel = tunnel();
    tunnel.subscribe("billing", Order.class, (order, context) -> {});

    tunnel.close();
    tunnel.close();

    verify(channel, times(1)).cancel("ctag-1");
    verify(connection, times(1)).removeListener(tunnel.consumerManager());
    verify(connection, times(1)).close();
    assertThatThrownBy(() -> tunnel.publish(new Order("1", 1)))
        .isInstanceOf(WarrenException.ResourceClosedException.class);
    assertThatThrownBy(() -> tunnel.subscribe("billing", Order.class, (order, context) -> {}))
        .isInstanceOf(WarrenException.ResourceClosedException.class);
  }

  @Test
  void detachShouldKeepConnectionOpen() {
    AmqpTunnel tunnel = tunnel();
    tunnel.detach();
    verify(connection, times(1)).removeListener(tunnel.consumerManager());
    verify(connection, never()).close();
  }

  @Test
  void addListenerShouldRegisterOnConnection() {
    AmqpTunnel tunnel = tunnel();
    DurableConnection.Listener listener = mock(DurableConnection.Listener.class);
    tunnel.addListener(listener);
    verify(connection, times(1)).addListener(listener);
  }

  AmqpTunnel tunnel() {
    return new AmqpTunnel(
        connection,
        routeFinder,
        serializer,
        typeNameSerializer,
        errorHandler,
        executor,
        correlationIdGenerator,
        true,
        metricsCollector);
  }

  static class Order {

    String id;
    int quantity;

    Order() {}

    Order(String id, int quantity) {
      this.id = id;
      this.quantity = quantity;
    }
  }
}
