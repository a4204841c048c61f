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
package io.warren.client.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.gson.GsonBuilder;
import io.warren.client.WarrenException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

public class GsonSerializerTest {

  GsonSerializer serializer = new GsonSerializer();

  @Test
  void serializeShouldProduceUtf8Json() {
    byte[] body = serializer.serialize(new Order("Café-1", 2));
    assertThat(new String(body, StandardCharsets.UTF_8))
        .isEqualTo("{\"id\":\"Café-1\",\"quantity\":2}");
    assertThat(serializer.contentType()).isEqualTo("application/json");
  }

  @Test
  void deserializeShouldCreateMessage() {
    Order order =
        serializer.deserialize(
            "{\"id\":\"42\",\"quantity\":3}".getBytes(StandardCharsets.UTF_8), Order.class);
    assertThat(order.id).isEqualTo("42");
    assertThat(order.quantity).isEqualTo(3);
  }

  @Test
  void invalidJsonShouldThrowDeserializationException() {
    assertThatThrownBy(
            () ->
                serializer.deserialize(
                    "{\"id\":".getBytes(StandardCharsets.UTF_8), Order.class))
        .isInstanceOf(WarrenException.DeserializationException.class)
        .hasMessageContaining(Order.class.getName());
    assertThatThrownBy(
            () ->
                serializer.deserialize(
                    "\"not an order\"".getBytes(StandardCharsets.UTF_8), Order.class))
        .isInstanceOf(WarrenException.DeserializationException.class);
  }

  @Test
  void emptyBodyShouldThrowDeserializationException() {
    assertThatThrownBy(() -> serializer.deserialize(new byte[0], Order.class))
        .isInstanceOf(WarrenException.DeserializationException.class)
        .hasMessageStartingWith("Empty message body");
  }

  @Test
  void customGsonShouldBeUsed() {
    GsonSerializer custom = new GsonSerializer(new GsonBuilder().serializeNulls().create());
    assertThat(new String(custom.serialize(new Order(null, 1)), StandardCharsets.UTF_8))
        .isEqualTo("{\"id\":null,\"quantity\":1}");
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
