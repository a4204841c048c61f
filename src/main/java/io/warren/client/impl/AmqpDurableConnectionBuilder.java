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

import io.warren.client.ConnectionFactory;
import io.warren.client.ConnectionKey;
import io.warren.client.DurableConnection;
import io.warren.client.DurableConnectionBuilder;
import io.warren.client.RetryPolicy;
import io.warren.client.WarrenException;
import java.net.URI;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

final class AmqpDurableConnectionBuilder implements DurableConnectionBuilder {

  static final String DEFAULT_HOST = "localhost";
  static final int DEFAULT_PORT = 5672;
  static final int DEFAULT_TLS_PORT = 5671;
  static final String DEFAULT_VIRTUAL_HOST = "/";
  static final String DEFAULT_USERNAME = "guest";
  static final String DEFAULT_PASSWORD = "guest";

  private final WarrenEnvironment environment;
  private String host = DEFAULT_HOST;
  private int port = -1;
  private boolean tls = false;
  private String username = DEFAULT_USERNAME;
  private String password = DEFAULT_PASSWORD;
  private String virtualHost = DEFAULT_VIRTUAL_HOST;
  private String name;
  private RetryPolicy retryPolicy;
  private final List<DurableConnection.Listener> listeners = new ArrayList<>();

  AmqpDurableConnectionBuilder(WarrenEnvironment environment) {
    this.environment = environment;
  }

  @Override
  public DurableConnectionBuilder uri(String uriString) {
    URI uri;
    try {
      uri = new URI(uriString);
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid URI: " + uriString, e);
    }
    if ("amqps".equalsIgnoreCase(uri.getScheme())) {
      this.tls = true;
    } else if ("amqp".equalsIgnoreCase(uri.getScheme())) {
      this.tls = false;
    } else {
      throw new IllegalArgumentException(
          "Wrong scheme in AMQP URI, expected amqp or amqps: " + uriString);
    }
    if (uri.getHost() != null) {
      this.host = uri.getHost();
    }
    this.port = uri.getPort();
    String userInfo = uri.getUserInfo();
    if (userInfo != null) {
      int separator = userInfo.indexOf(':');
      if (separator < 0) {
        this.username = userInfo;
      } else {
        this.username = userInfo.substring(0, separator);
        this.password = userInfo.substring(separator + 1);
      }
    }
    String path = uri.getPath();
    if (path != null && path.length() > 1) {
      // the first slash is the separator, a URI-encoded slash is the default virtual host
      this.virtualHost = path.substring(1);
    } else {
      this.virtualHost = DEFAULT_VIRTUAL_HOST;
    }
    return this;
  }

  @Override
  public DurableConnectionBuilder host(String host) {
    this.host = host;
    return this;
  }

  @Override
  public DurableConnectionBuilder port(int port) {
    this.port = port;
    return this;
  }

  @Override
  public DurableConnectionBuilder username(String username) {
    this.username = username;
    return this;
  }

  @Override
  public DurableConnectionBuilder password(String password) {
    this.password = password;
    return this;
  }

  @Override
  public DurableConnectionBuilder virtualHost(String virtualHost) {
    this.virtualHost = virtualHost;
    return this;
  }

  @Override
  public DurableConnectionBuilder name(String name) {
    this.name = name;
    return this;
  }

  @Override
  public DurableConnectionBuilder retryPolicy(RetryPolicy retryPolicy) {
    this.retryPolicy = retryPolicy;
    return this;
  }

  @Override
  public DurableConnectionBuilder listeners(DurableConnection.Listener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.listeners.clear();
    } else {
      this.listeners.addAll(Arrays.asList(listeners));
    }
    return this;
  }

  ConnectionKey key() {
    int p = this.port > 0 ? this.port : (this.tls ? DEFAULT_TLS_PORT : DEFAULT_PORT);
    return new ConnectionKey(this.host, p, this.virtualHost, this.username);
  }

  boolean tls() {
    return this.tls;
  }

  @Override
  public DurableConnection build() {
    String connectionName = this.name == null ? Utils.NAME_SUPPLIER.get() : this.name;
    ConnectionFactory factory = this.environment.connectionFactory();
    if (factory == null) {
      factory =
          new RabbitConnectionFactory(
              this.password,
              connectionName,
              f -> {
                if (this.tls) {
                  try {
                    f.useSslProtocol();
                  } catch (GeneralSecurityException e) {
                    throw new WarrenException("Error while configuring TLS", e);
                  }
                }
              });
    }
    RetryPolicy policy =
        this.retryPolicy == null
            ? new BackOffRetryPolicy(this.environment.backOffDelayPolicy())
            : this.retryPolicy;
    return this.environment.durableConnection(
        connectionName, this.key(), factory, policy, this.listeners);
  }
}
