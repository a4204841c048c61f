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

/** Converts messages to and from bytes. */
public interface Serializer {

  byte[] serialize(Object message);

  /**
   * Turn bytes into a message.
   *
   * @param body message body
   * @param type expected type
   * @param <T> expected type
   * @return the message
   * @throws WarrenException.DeserializationException if the body is not a valid message
   */
  <T> T deserialize(byte[] body, Class<T> type);

  /**
   * MIME type of the serialized messages.
   *
   * @return content type
   */
  String contentType();
}
