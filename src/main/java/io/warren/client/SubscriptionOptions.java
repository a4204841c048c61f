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

/** Settings of a {@link Tunnel} subscription. */
public final class SubscriptionOptions {

  static final int DEFAULT_PREFETCH = 10;

  private final String subscriptionName;
  private int prefetch = DEFAULT_PREFETCH;
  private String queue;

  private SubscriptionOptions(String subscriptionName) {
    if (subscriptionName == null || subscriptionName.isBlank()) {
      throw new IllegalArgumentException("Subscription name cannot be null or blank");
    }
    this.subscriptionName = subscriptionName;
  }

  public static SubscriptionOptions subscription(String subscriptionName) {
    return new SubscriptionOptions(subscriptionName);
  }

  /**
   * Maximum number of deliveries being processed at the same time. Default is 10.
   *
   * @param prefetch prefetch count
   * @return these options
   */
  public SubscriptionOptions prefetch(int prefetch) {
    if (prefetch < 0) {
      throw new IllegalArgumentException("Prefetch cannot be negative");
    }
    this.prefetch = prefetch;
    return this;
  }

  /**
   * Queue to consume from, instead of the one the {@link RouteFinder} computes.
   *
   * @param queue queue name
   * @return these options
   */
  public SubscriptionOptions queue(String queue) {
    this.queue = queue;
    return this;
  }

  public String subscriptionName() {
    return this.subscriptionName;
  }

  public int prefetch() {
    return this.prefetch;
  }

  public String queue() {
    return this.queue;
  }
}
