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

/**
 * Builder for {@link MessageDispatcher} instances.
 *
 * @param <T> type of the messages the dispatcher handles
 */
public interface DispatcherBuilder<T> {

  DispatcherBuilder<T> subscriptionName(String subscriptionName);

  DispatcherBuilder<T> callback(MessageCallback<T> callback);

  DispatcherBuilder<T> errorHandler(ConsumerErrorHandler errorHandler);

  DispatcherBuilder<T> serializer(Serializer serializer);

  DispatcherBuilder<T> typeNameSerializer(TypeNameSerializer typeNameSerializer);

  /**
   * Hook run before the type check of each delivery. Default is no-op.
   *
   * @param hook the hook
   * @return this builder instance
   */
  DispatcherBuilder<T> beforeHandling(DispatchHook hook);

  /**
   * Hook run after each delivery, whatever the outcome. Default is no-op.
   *
   * @param hook the hook
   * @return this builder instance
   */
  DispatcherBuilder<T> afterHandling(DispatchHook hook);

  DispatcherBuilder<T> listeners(MessageDispatcher.Listener... listeners);

  MessageDispatcher build();
}
