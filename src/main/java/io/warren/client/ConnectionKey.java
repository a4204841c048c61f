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

import java.util.Objects;

/**
 * Identity of a physical broker connection.
 *
 * <p>Durable connections with equal keys share the same physical connection.
 */
public final class ConnectionKey {

  private final String host;
  private final int port;
  private final String virtualHost;
  private final String username;

  public ConnectionKey(String host, int port, String virtualHost, String username) {
    this.host = Objects.requireNonNull(host, "host");
    this.port = port;
    this.virtualHost = Objects.requireNonNull(virtualHost, "virtualHost");
    this.username = username;
  }

  public String host() {
    return this.host;
  }

  public int port() {
    return this.port;
  }

  public String virtualHost() {
    return this.virtualHost;
  }

  public String username() {
    return this.username;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ConnectionKey that = (ConnectionKey) o;
    return port == that.port
        && host.equals(that.host)
        && virtualHost.equals(that.virtualHost)
        && Objects.equals(username, that.username);
  }

  @Override
  public int hashCode() {
    return Objects.hash(host, port, virtualHost, username);
  }

  @Override
  public String toString() {
    return (username == null ? "" : username + "@") + host + ":" + port + virtualHost;
  }
}
