/*
 * Copyright (C) 2015 Square, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package okurl;

/**
 * Thrown when text can't be turned into a {@link Url} or one of its components. The {@link
 * #reason() reason} identifies which rule the input broke; parsing stops at the first broken rule.
 */
public final class InvalidUrlException extends IllegalArgumentException {
  public enum Reason {
    INVALID_LABEL,
    INVALID_HOST,
    UNSUPPORTED_SCHEME,
    MISSING_SCHEME,
    INVALID_PORT,
    INVALID_PATH,
    INVALID_QUERY,
    INVALID_ENCODING
  }

  private final Reason reason;

  public InvalidUrlException(Reason reason, String message) {
    super(message);
    if (reason == null) throw new NullPointerException("reason == null");
    this.reason = reason;
  }

  public InvalidUrlException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    if (reason == null) throw new NullPointerException("reason == null");
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
