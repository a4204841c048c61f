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

import java.util.Objects;

/** Why a physical connection has been shut down. */
public final class ShutdownReason {

  /** Who initiated the shutdown. */
  public enum Initiator {
    /** The application closed the connection on purpose. */
    APPLICATION,
    /** The broker closed the connection. */
    PEER,
    /** The client library closed the connection, e.g. after a network failure. */
    LIBRARY,
    UNKNOWN
  }

  private final Initiator initiator;
  private final int code;
  private final String cause;
  private final Throwable exception;

  public ShutdownReason(Initiator initiator, int code, String cause) {
    this(initiator, code, cause, null);
  }

  public ShutdownReason(Initiator initiator, int code, String cause, Throwable exception) {
    this.initiator = Objects.requireNonNull(initiator, "initiator");
    this.code = code;
    this.cause = cause;
    this.exception = exception;
  }

  public static ShutdownReason application(String cause) {
    return new ShutdownReason(Initiator.APPLICATION, 200, cause);
  }

  public Initiator initiator() {
    return this.initiator;
  }

  public boolean initiatedByApplication() {
    return this.initiator == Initiator.APPLICATION;
  }

  /**
   * The reply code, as sent in the close method, 0 if unknown.
   *
   * @return reply code
   */
  public int code() {
    return this.code;
  }

  /**
   * Human-readable cause.
   *
   * @return cause description
   */
  public String cause() {
    return this.cause;
  }

  /**
   * The underlying exception, can be null.
   *
   * @return exception, null if none
   */
  public Throwable exception() {
    return this.exception;
  }

  @Override
  public String toString() {
    return "ShutdownReason{"
        + "initiator="
        + initiator
        + ", code="
        + code
        + ", cause='"
        + cause
        + '\''
        + '}';
  }
}
