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

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.ShutdownSignalException;
import io.warren.client.WarrenException;
import java.io.IOException;
import java.util.concurrent.TimeoutException;

abstract class ExceptionUtils {

  private ExceptionUtils() {}

  static WarrenException convert(Exception e) {
    return convert(e, null);
  }

  static WarrenException convert(Exception e, String format, Object... args) {
    String message = format == null ? null : String.format(format, args);
    if (e instanceof WarrenException) {
      return (WarrenException) e;
    } else if (e instanceof AlreadyClosedException) {
      return new WarrenException.ResourceClosedException(
          message == null ? e.getMessage() : message, e);
    } else if (e instanceof ShutdownSignalException
        || e instanceof IOException
        || e instanceof TimeoutException) {
      return new WarrenException.ConnectionException(
          message == null ? Utils.exceptionMessage(e) : message, e);
    } else {
      return message == null ? new WarrenException(e) : new WarrenException(message, e);
    }
  }
}
