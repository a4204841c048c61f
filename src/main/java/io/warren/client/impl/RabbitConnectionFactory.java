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

import com.rabbitmq.client.Connection;
import io.warren.client.ConnectionFactory;
import io.warren.client.ConnectionHandle;
import io.warren.client.ConnectionKey;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ConnectionFactory} creating physical connections with the <a
 * href="https://www.rabbitmq.com/client-libraries/java-api-guide">RabbitMQ Java client</a>.
 *
 * <p>Automatic recovery of the underlying client is disabled, recovery is the responsibility of
 * {@link io.warren.client.DurableConnection}.
 */
public class RabbitConnectionFactory implements ConnectionFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(RabbitConnectionFactory.class);

  private final String password;
  private final String clientProvidedName;
  private final Consumer<com.rabbitmq.client.ConnectionFactory> customizer;

  public RabbitConnectionFactory(String password) {
    this(password, null, f -> {});
  }

  /**
   * Create a factory.
   *
   * @param password password to use, the username comes from the {@link ConnectionKey}
   * @param clientProvidedName name of the connections, visible in the management UI
   * @param customizer callback to tune the underlying factory (TLS, heartbeat, etc)
   */
  public RabbitConnectionFactory(
      String password,
      String clientProvidedName,
      Consumer<com.rabbitmq.client.ConnectionFactory> customizer) {
    this.password = password;
    this.clientProvidedName = clientProvidedName;
    this.customizer = customizer == null ? f -> {} : customizer;
  }

  @Override
  public ConnectionHandle createConnection(ConnectionKey key) {
    com.rabbitmq.client.ConnectionFactory factory = this.newFactory(key);
    try {
      LOGGER.debug("Opening connection to {}", key);
      Connection connection = factory.newConnection(this.clientProvidedName);
      return new RabbitConnectionHandle(connection);
    } catch (Exception e) {
      throw ExceptionUtils.convert(e, "Error while opening connection to %s", key);
    }
  }

  com.rabbitmq.client.ConnectionFactory newFactory(ConnectionKey key) {
    com.rabbitmq.client.ConnectionFactory factory = new com.rabbitmq.client.ConnectionFactory();
    factory.setHost(key.host());
    factory.setPort(key.port());
    factory.setVirtualHost(key.virtualHost());
    if (key.username() != null) {
      factory.setUsername(key.username());
    }
    if (this.password != null) {
      factory.setPassword(this.password);
    }
    this.customizer.accept(factory);
    factory.setAutomaticRecoveryEnabled(false);
    factory.setTopologyRecoveryEnabled(false);
    return factory;
  }
}
