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

import io.warren.client.RouteFinder;
import io.warren.client.TypeNameSerializer;

/**
 * {@link RouteFinder} publishing everything to one exchange, with the type tag as routing key.
 *
 * <p>Queue names are <code>{prefix}.{subscription}.{type simple name}</code>.
 */
public class DefaultRouteFinder implements RouteFinder {

  static final String DEFAULT_EXCHANGE = "warren.exchange";
  static final String DEFAULT_QUEUE_PREFIX = "warren.queue";

  private final String exchange;
  private final String queuePrefix;
  private final TypeNameSerializer typeNameSerializer;

  public DefaultRouteFinder() {
    this(DEFAULT_EXCHANGE, DEFAULT_QUEUE_PREFIX, DefaultTypeNameSerializer.INSTANCE);
  }

  public DefaultRouteFinder(
      String exchange, String queuePrefix, TypeNameSerializer typeNameSerializer) {
    if (exchange == null || queuePrefix == null || typeNameSerializer == null) {
      throw new IllegalArgumentException(
          "Exchange, queue prefix and type name serializer cannot be null");
    }
    this.exchange = exchange;
    this.queuePrefix = queuePrefix;
    this.typeNameSerializer = typeNameSerializer;
  }

  @Override
  public String exchangeName(Class<?> messageType) {
    return this.exchange;
  }

  @Override
  public String routingKey(Class<?> messageType) {
    return this.typeNameSerializer.serialize(messageType);
  }

  @Override
  public String queueName(Class<?> messageType, String subscriptionName) {
    return this.queuePrefix + "." + subscriptionName + "." + messageType.getSimpleName();
  }
}
