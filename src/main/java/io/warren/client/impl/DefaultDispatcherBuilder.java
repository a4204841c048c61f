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
import io.warren.client.DispatchHook;
import io.warren.client.DispatcherBuilder;
import io.warren.client.MessageCallback;
import io.warren.client.MessageDispatcher;
import io.warren.client.Serializer;
import io.warren.client.TypeNameSerializer;
import io.warren.client.metrics.MetricsCollector;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

final class DefaultDispatcherBuilder<T> implements DispatcherBuilder<T> {

  private final Class<T> type;
  private final MetricsCollector metricsCollector;
  private String subscriptionName;
  private MessageCallback<T> callback;
  private ConsumerErrorHandler errorHandler;
  private Serializer serializer;
  private TypeNameSerializer typeNameSerializer;
  private DispatchHook beforeHandling = DispatchHook.NO_OP;
  private DispatchHook afterHandling = DispatchHook.NO_OP;
  private final List<MessageDispatcher.Listener> listeners = new ArrayList<>();

  DefaultDispatcherBuilder(
      Class<T> type,
      Serializer serializer,
      TypeNameSerializer typeNameSerializer,
      ConsumerErrorHandler errorHandler,
      MetricsCollector metricsCollector) {
    if (type == null) {
      throw new IllegalArgumentException("Message type cannot be null");
    }
    this.type = type;
    this.serializer = serializer;
    this.typeNameSerializer = typeNameSerializer;
    this.errorHandler = errorHandler;
    this.metricsCollector = metricsCollector;
  }

  @Override
  public DispatcherBuilder<T> subscriptionName(String subscriptionName) {
    this.subscriptionName = subscriptionName;
    return this;
  }

  @Override
  public DispatcherBuilder<T> callback(MessageCallback<T> callback) {
    this.callback = callback;
    return this;
  }

  @Override
  public DispatcherBuilder<T> errorHandler(ConsumerErrorHandler errorHandler) {
    this.errorHandler = errorHandler;
    return this;
  }

  @Override
  public DispatcherBuilder<T> serializer(Serializer serializer) {
    this.serializer = serializer;
    return this;
  }

  @Override
  public DispatcherBuilder<T> typeNameSerializer(TypeNameSerializer typeNameSerializer) {
    this.typeNameSerializer = typeNameSerializer;
    return this;
  }

  @Override
  public DispatcherBuilder<T> beforeHandling(DispatchHook hook) {
    this.beforeHandling = hook == null ? DispatchHook.NO_OP : hook;
    return this;
  }

  @Override
  public DispatcherBuilder<T> afterHandling(DispatchHook hook) {
    this.afterHandling = hook == null ? DispatchHook.NO_OP : hook;
    return this;
  }

  @Override
  public DispatcherBuilder<T> listeners(MessageDispatcher.Listener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.listeners.clear();
    } else {
      this.listeners.addAll(Arrays.asList(listeners));
    }
    return this;
  }

  @Override
  public MessageDispatcher build() {
    if (this.subscriptionName == null || this.subscriptionName.isBlank()) {
      throw new IllegalArgumentException("Subscription name must be set");
    }
    if (this.callback == null) {
      throw new IllegalArgumentException("Message callback must be set");
    }
    if (this.serializer == null || this.typeNameSerializer == null) {
      throw new IllegalArgumentException("Serializer and type name serializer must be set");
    }
    if (this.errorHandler == null) {
      throw new IllegalArgumentException("Error handler must be set");
    }
    return new DefaultMessageDispatcher<>(
        this.subscriptionName,
        this.type,
        this.callback,
        this.errorHandler,
        this.serializer,
        this.typeNameSerializer,
        this.beforeHandling,
        this.afterHandling,
        this.metricsCollector,
        this.listeners);
  }
}
