/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package dev.agentrelay.core;

/**
 * RelayException is the base exception for all Agent Relay errors. It carries
 * the {@link ErrorKind} of the failure and optional structured details.
 */
public class RelayException extends RuntimeException {

  private final ErrorKind kind;
  private final Object details;

  /**
   * Creates a new RelayException of kind {@link ErrorKind#INTERNAL}.
   *
   * @param message
   *            the error message
   */
  public RelayException(String message) {
    this(ErrorKind.INTERNAL, message, null, null);
  }

  /**
   * Creates a new RelayException of kind {@link ErrorKind#INTERNAL} with a
   * cause.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   */
  public RelayException(String message, Throwable cause) {
    this(ErrorKind.INTERNAL, message, cause, null);
  }

  /**
   * Creates a new RelayException of the given kind.
   *
   * @param kind
   *            the error kind
   * @param message
   *            the error message
   */
  public RelayException(ErrorKind kind, String message) {
    this(kind, message, null, null);
  }

  /**
   * Creates a new RelayException with full details.
   *
   * @param kind
   *            the error kind
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   * @param details
   *            additional error details
   */
  public RelayException(ErrorKind kind, String message, Throwable cause, Object details) {
    super(message, cause);
    this.kind = kind != null ? kind : ErrorKind.INTERNAL;
    this.details = details;
  }

  /**
   * Returns the error kind.
   *
   * @return the error kind, never null
   */
  public ErrorKind getKind() {
    return kind;
  }

  /**
   * Returns additional error details.
   *
   * @return the error details, or null if not set
   */
  public Object getDetails() {
    return details;
  }

  /**
   * Creates a builder for RelayException.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for RelayException.
   */
  public static class Builder {
    private ErrorKind kind = ErrorKind.INTERNAL;
    private String message;
    private Throwable cause;
    private Object details;

    public Builder kind(ErrorKind kind) {
      this.kind = kind;
      return this;
    }

    public Builder message(String message) {
      this.message = message;
      return this;
    }

    public Builder cause(Throwable cause) {
      this.cause = cause;
      return this;
    }

    public Builder details(Object details) {
      this.details = details;
      return this;
    }

    public RelayException build() {
      if (message == null || message.isEmpty()) {
        throw new IllegalStateException("message is required");
      }
      return new RelayException(kind, message, cause, details);
    }
  }
}
