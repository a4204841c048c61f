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
import io.warren.client.DeliveryContext;
import io.warren.client.DispatchHook;
import io.warren.client.DispatchOutcome;
import io.warren.client.MessageCallback;
import io.warren.client.MessageDispatcher;
import io.warren.client.Serializer;
import io.warren.client.TypeNameSerializer;
import io.warren.client.WarrenException;
import io.warren.client.metrics.MetricsCollector;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatch pipeline of a subscription.
 *
 * <p>The pipeline runs the before hook, checks the declared type, deserializes the body and calls
 * the callback. Any failure goes to the {@link ConsumerErrorHandler}. Clean-up steps always run
 * and {@link Listener#handlingComplete(Delivery, DispatchOutcome)} fires exactly once per
 * delivery.
 *
 * @param <T> type of the messages
 */
final class DefaultMessageDispatcher<T> implements MessageDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultMessageDispatcher.class);

  private static final int MAX_LOGGED_BODY_SIZE = 4096;

  private final String subscriptionName;
  private final Class<T> type;
  private final String expectedTypeName;
  private final MessageCallback<T> callback;
  private final ConsumerErrorHandler errorHandler;
  private final Serializer serializer;
  private final DispatchHook beforeHandling;
  private final DispatchHook afterHandling;
  private final MetricsCollector metricsCollector;
  private final List<Listener> listeners;

  DefaultMessageDispatcher(
      String subscriptionName,
      Class<T> type,
      MessageCallback<T> callback,
      ConsumerErrorHandler errorHandler,
      Serializer serializer,
      TypeNameSerializer typeNameSerializer,
      DispatchHook beforeHandling,
      DispatchHook afterHandling,
      MetricsCollector metricsCollector,
      List<Listener> listeners) {
    this.subscriptionName = subscriptionName;
    this.type = type;
    this.expectedTypeName = typeNameSerializer.serialize(type);
    this.callback = callback;
    this.errorHandler = errorHandler;
    this.serializer = serializer;
    this.beforeHandling = beforeHandling;
    this.afterHandling = afterHandling;
    this.metricsCollector = metricsCollector;
    this.listeners = new CopyOnWriteArrayList<>(listeners);
  }

  @Override
  public DispatchOutcome handle(Delivery delivery) {
    DispatchOutcome outcome = DispatchOutcome.FAILED;
    try {
      this.recordConsume();
      this.beforeHandling.run(delivery);
      this.checkMessageType(delivery);
      T message = this.deserialize(delivery);
      DefaultDeliveryContext context = new DefaultDeliveryContext(this.subscriptionName, delivery);
      if (LOGGER.isDebugEnabled()) {
        LOGGER.debug(
            "Dispatching message {} ({} byte(s)) to subscription '{}'",
            delivery.deliveryTag(),
            delivery.bodySize(),
            this.subscriptionName);
      }
      this.callback.handle(message, context);
      outcome = context.declined ? DispatchOutcome.NOT_HANDLED : DispatchOutcome.HANDLED;
    } catch (Exception e) {
      outcome = DispatchOutcome.FAILED;
      this.handleError(delivery, e);
    } catch (Throwable e) {
      // errors thrown by the callback (e.g. assertions) still go to the error handler
      outcome = DispatchOutcome.FAILED;
      this.handleError(
          delivery,
          new WarrenException("Error while handling message: " + Utils.exceptionMessage(e), e));
    } finally {
      this.cleanUp(delivery, outcome);
    }
    return outcome;
  }

  private void recordConsume() {
    try {
      this.metricsCollector.consume();
    } catch (Exception e) {
      LOGGER.warn("Error while recording delivery of subscription '{}'", this.subscriptionName, e);
    }
  }

  private void checkMessageType(Delivery delivery) {
    if (!this.expectedTypeName.equals(delivery.type())) {
      LOGGER.error(
          "Message type is incorrect. Expected '{}', but was '{}'",
          this.expectedTypeName,
          delivery.type());
      throw new WarrenException.TypeMismatchException(this.expectedTypeName, delivery.type());
    }
  }

  private T deserialize(Delivery delivery) {
    try {
      return this.serializer.deserialize(delivery.body(), this.type);
    } catch (WarrenException.DeserializationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new WarrenException.DeserializationException(
          "Cannot deserialize message to " + this.type.getName(), e);
    }
  }

  private void handleError(Delivery delivery, Exception exception) {
    LOGGER.error(
        "Error while handling message {} of subscription '{}': {}",
        delivery.deliveryTag(),
        this.subscriptionName,
        Utils.exceptionMessage(exception));
    if (LOGGER.isErrorEnabled()) {
      LOGGER.error(this.failureDetails(delivery), exception);
    }
    try {
      this.errorHandler.handleError(delivery, exception);
    } catch (Exception e) {
      LOGGER.error(
          "Error in consumer error handler for message {} of subscription '{}'",
          delivery.deliveryTag(),
          this.subscriptionName,
          e);
    }
  }

  private void cleanUp(Delivery delivery, DispatchOutcome outcome) {
    if (outcome != DispatchOutcome.HANDLED) {
      this.dispatch(l -> l.messageWasNotHandled(delivery), "message was not handled");
    }
    try {
      this.afterHandling.run(delivery);
    } catch (Exception e) {
      LOGGER.warn("Error in after-handling hook of subscription '{}'", this.subscriptionName, e);
    }
    this.dispatch(l -> l.handlingComplete(delivery, outcome), "handling complete");
    try {
      this.metricsCollector.consumeOutcome(outcome);
    } catch (Exception e) {
      LOGGER.warn("Error while recording outcome of subscription '{}'", this.subscriptionName, e);
    }
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(
          "Message {} of subscription '{}' dispatched, outcome {}",
          delivery.deliveryTag(),
          this.subscriptionName,
          outcome);
    }
  }

  private void dispatch(Consumer<Listener> event, String eventLabel) {
    for (Listener listener : this.listeners) {
      try {
        event.accept(listener);
      } catch (Exception e) {
        LOGGER.warn("Error in dispatcher listener ({})", eventLabel, e);
      }
    }
  }

  private String failureDetails(Delivery delivery) {
    byte[] body = delivery.body();
    String bodyText =
        body.length > MAX_LOGGED_BODY_SIZE
            ? new String(body, 0, MAX_LOGGED_BODY_SIZE, StandardCharsets.UTF_8) + "..."
            : new String(body, StandardCharsets.UTF_8);
    return "Failed to handle message"
        + System.lineSeparator()
        + "  Subscription: "
        + this.subscriptionName
        + System.lineSeparator()
        + "  Exchange: "
        + delivery.exchange()
        + System.lineSeparator()
        + "  Routing key: "
        + delivery.routingKey()
        + System.lineSeparator()
        + "  Redelivered: "
        + delivery.redelivered()
        + System.lineSeparator()
        + "  Message body: "
        + bodyText
        + System.lineSeparator()
        + "  Properties: type="
        + delivery.type()
        + ", contentType="
        + delivery.contentType()
        + ", correlationId="
        + delivery.correlationId()
        + ", headers="
        + delivery.headers();
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

  private static final class DefaultDeliveryContext implements DeliveryContext {

    private final String subscriptionName;
    private final Delivery delivery;
    private volatile boolean declined = false;

    private DefaultDeliveryContext(String subscriptionName, Delivery delivery) {
      this.subscriptionName = subscriptionName;
      this.delivery = delivery;
    }

    @Override
    public String consumerTag() {
      return this.delivery.consumerTag();
    }

    @Override
    public long deliveryTag() {
      return this.delivery.deliveryTag();
    }

    @Override
    public String subscriptionName() {
      return this.subscriptionName;
    }

    @Override
    public boolean redelivered() {
      return this.delivery.redelivered();
    }

    @Override
    public Delivery delivery() {
      return this.delivery;
    }

    @Override
    public void decline() {
      this.declined = true;
    }
  }
}
