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

import javax.annotation.Nullable;

import static okurl.InvalidUrlException.Reason.INVALID_LABEL;
import static okurl.internal.Util.toHumanReadableAscii;

/**
 * One dot-separated segment of a hostname, like {@code example} or {@code com} in {@code
 * example.com}.
 *
 * <p>Labels are 1 to 63 ASCII letters, digits and hyphens, and don't start or end with a hyphen.
 * Case is preserved: {@code Example} and {@code example} are different labels.
 */
public final class Label {
  static final int MAX_LENGTH = 63;

  private final String value;

  private Label(String value) {
    this.value = value;
  }

  /**
   * Returns the label for {@code value}.
   *
   * @throws InvalidUrlException if {@code value} is not a valid label.
   */
  public static Label get(String value) {
    if (value == null) throw new NullPointerException("value == null");
    String problem = problem(value);
    if (problem != null) {
      throw new InvalidUrlException(INVALID_LABEL,
          "Invalid label \"" + toHumanReadableAscii(value) + "\": " + problem);
    }
    return new Label(value);
  }

  /** Returns the label for {@code value}, or null if it isn't a valid label. */
  public static @Nullable Label parse(String value) {
    if (value == null) throw new NullPointerException("value == null");
    return problem(value) == null ? new Label(value) : null;
  }

  private static @Nullable String problem(String value) {
    int length = value.length();
    if (length == 0) return "empty";
    if (length > MAX_LENGTH) return "longer than " + MAX_LENGTH + " characters";
    for (int i = 0; i < length; i++) {
      char c = value.charAt(i);
      if ((c < 'a' || c > 'z')
          && (c < 'A' || c > 'Z')
          && (c < '0' || c > '9')
          && c != '-') {
        return "unexpected character at " + i;
      }
    }
    if (value.charAt(0) == '-' || value.charAt(length - 1) == '-') {
      return "starts or ends with '-'";
    }
    return null;
  }

  @Override public boolean equals(@Nullable Object other) {
    return other instanceof Label && ((Label) other).value.equals(value);
  }

  @Override public int hashCode() {
    return value.hashCode();
  }

  @Override public String toString() {
    return value;
  }
}
