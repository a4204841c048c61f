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

/** An active subscription of a {@link Tunnel}. */
public interface Subscription extends AutoCloseable {

  String name();

  String queue();

  /**
   * The current consumer tag, null if not consuming (e.g. while disconnected).
   *
   * @return consumer tag
   */
  String consumerTag();

  /** Stop consuming. The subscription is not restarted after a reconnection. */
  @Override
  void close();
}
