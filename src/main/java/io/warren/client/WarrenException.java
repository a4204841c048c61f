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

/** Base class for the exceptions the library throws. All of them are unchecked. */
public class WarrenException extends RuntimeException {

  public WarrenException(Throwable cause) {
    super(cause);
  }

  public WarrenException(String format, Object... args) {
    super(String.format(format, args));
  }

  public WarrenException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Establishing a physical connection to the broker failed. */
  public static class ConnectionException extends WarrenException {

    public ConnectionException(String message, Throwable cause) {
      super(message, cause);
    }

    public ConnectionException(String format, Object... args) {
      super(format, args);
    }
  }

  /** A {@link RetryPolicy} gave up before the retried action succeeded. */
  public static class RetryExhaustedException extends WarrenException {

    private final int attempts;

    public RetryExhaustedException(String message, int attempts, Throwable cause) {
      super(message, cause);
      this.attempts = attempts;
    }

    /**
     * Number of attempts made before giving up.
     *
     * @return attempt count
     */
    public int attempts() {
      return this.attempts;
    }
  }

  public static class ResourceInvalidStateException extends WarrenException {

    public ResourceInvalidStateException(String format, Object... args) {
      super(format, args);
    }

    public ResourceInvalidStateException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public static class ResourceClosedException extends ResourceInvalidStateException {

    public ResourceClosedException(String message) {
      super(message, (Throwable) null);
    }

    public ResourceClosedException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** The type tag of a delivery does not match the type a dispatcher expects. */
  public static class TypeMismatchException extends WarrenException {

    private final String expectedType;
    private final String actualType;

    public TypeMismatchException(String expectedType, String actualType) {
      super("Message type is incorrect. Expected '%s', but was '%s'", expectedType, actualType);
      this.expectedType = expectedType;
      this.actualType = actualType;
    }

    public String expectedType() {
      return this.expectedType;
    }

    public String actualType() {
      return this.actualType;
    }
  }

  /** A message body could not be turned into the expected type. */
  public static class DeserializationException extends WarrenException {

    public DeserializationException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
