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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An inbound message, as handed over by the transport.
 *
 * <p>Instances are immutable.
 */
public final class Delivery {

  private final byte[] body;
  private final String consumerTag;
  private final long deliveryTag;
  private final String exchange;
  private final String routingKey;
  private final boolean redelivered;
  private final String type;
  private final String correlationId;
  private final String contentType;
  private final Map<String, Object> headers;

  private Delivery(Builder builder) {
    this.body = builder.body == null ? new byte[0] : builder.body.clone();
    this.consumerTag = builder.consumerTag;
    this.deliveryTag = builder.deliveryTag;
    this.exchange = builder.exchange;
    this.routingKey = builder.routingKey;
    this.redelivered = builder.redelivered;
    this.type = builder.type;
    this.correlationId = builder.correlationId;
    this.contentType = builder.contentType;
    this.headers =
        builder.headers == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * A copy of the message body.
   *
   * @return body bytes
   */
  public byte[] body() {
    return this.body.clone();
  }

  public int bodySize() {
    return this.body.length;
  }

  public String consumerTag() {
    return this.consumerTag;
  }

  /**
   * Identifier to use when acknowledging the delivery.
   *
   * @return delivery tag
   */
  public long deliveryTag() {
    return this.deliveryTag;
  }

  public String exchange() {
    return this.exchange;
  }

  public String routingKey() {
    return this.routingKey;
  }

  public boolean redelivered() {
    return this.redelivered;
  }

  /**
   * The declared type tag of the message, can be null.
   *
   * @return type tag
   */
  public String type() {
    return this.type;
  }

  public String correlationId() {
    return this.correlationId;
  }

  public String contentType() {
    return this.contentType;
  }

  public Map<String, Object> headers() {
    return this.headers;
  }

  @Override
  public String toString() {
    return "Delivery{"
        + "consumerTag='"
        + consumerTag
        + '\''
        + ", deliveryTag="
        + deliveryTag
        + ", exchange='"
        + exchange
        + '\''
        + ", routingKey='"
        + routingKey
        + '\''
        + ", type='"
        + type
        + '\''
        + '}';
  }

  public static final class Builder {

    private byte[] body;
    private String consumerTag;
    private long deliveryTag;
    private String exchange;
    private String routingKey;
    private boolean redelivered;
    private String type;
    private String correlationId;
    private String contentType;
    private Map<String, Object> headers;

    private Builder() {}

    public Builder body(byte[] body) {
      this.body = body;
      return this;
    }

    public Builder consumerTag(String consumerTag) {
      this.consumerTag = consumerTag;
      return this;
    }

    public Builder deliveryTag(long deliveryTag) {
      this.deliveryTag = deliveryTag;
      return this;
    }

    public Builder exchange(String exchange) {
      this.exchange = exchange;
      return this;
    }

    public Builder routingKey(String routingKey) {
      this.routingKey = routingKey;
      return this;
    }

    public Builder redelivered(boolean redelivered) {
      this.redelivered = redelivered;
      return this;
    }

    public Builder type(String type) {
      this.type = type;
      return this;
    }

    public Builder correlationId(String correlationId) {
      this.correlationId = correlationId;
      return this;
    }

    public Builder contentType(String contentType) {
      this.contentType = contentType;
      return this;
    }

    public Builder headers(Map<String, Object> headers) {
      this.headers = headers;
      return this;
    }

    public Delivery build() {
      return new Delivery(this);
    }
  }
}
