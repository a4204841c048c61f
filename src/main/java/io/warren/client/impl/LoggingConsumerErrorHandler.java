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

import io.warren.client.ConsumerErrorHandler;
import io.warren.client.Delivery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default {@link ConsumerErrorHandler}: logs the failure, the message is then acknowledged. */
final class LoggingConsumerErrorHandler implements ConsumerErrorHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(LoggingConsumerErrorHandler.class);

  static final ConsumerErrorHandler INSTANCE = new LoggingConsumerErrorHandler();

  private LoggingConsumerErrorHandler() {}

  @Override
  public void handleError(Delivery delivery, Exception exception) {
    LOGGER.warn(
        "Message {} from exchange '{}' (routing key '{}') dropped after failure: {}",
        delivery.deliveryTag(),
        delivery.exchange(),
        delivery.routingKey(),
        Utils.exceptionMessage(exception));
  }
}
