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

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.warren.client.Serializer;
import io.warren.client.WarrenException;
import java.nio.charset.StandardCharsets;

/** JSON {@link Serializer} based on <a href="https://github.com/google/gson">Gson</a>. */
public class GsonSerializer implements Serializer {

  private static final String CONTENT_TYPE = "application/json";

  private final Gson gson;

  public GsonSerializer() {
    this(new Gson());
  }

  public GsonSerializer(Gson gson) {
    this.gson = gson;
  }

  @Override
  public byte[] serialize(Object message) {
    return this.gson.toJson(message).getBytes(StandardCharsets.UTF_8);
  }

  @Override
  public <T> T deserialize(byte[] body, Class<T> type) {
    String json = new String(body, StandardCharsets.UTF_8);
    T message;
    try {
      message = this.gson.fromJson(json, type);
    } catch (JsonParseException e) {
      throw new WarrenException.DeserializationException(
          "Cannot deserialize message to " + type.getName(), e);
    }
    if (message == null) {
      throw new WarrenException.DeserializationException(
          "Empty message body, cannot deserialize to " + type.getName(), null);
    }
    return message;
  }

  @Override
  public String contentType() {
    return CONTENT_TYPE;
  }
}
