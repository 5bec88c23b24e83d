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

import static okurl.InvalidUrlException.Reason.UNSUPPORTED_SCHEME;
import static okurl.internal.Util.toHumanReadableAscii;

/** The URL schemes this library supports. */
public enum Scheme {
  HTTP("http", 80),
  HTTPS("https", 443),
  WS("ws", 80),
  WSS("wss", 443);

  private final String canonicalName;
  private final int defaultPort;

  Scheme(String canonicalName, int defaultPort) {
    this.canonicalName = canonicalName;
    this.defaultPort = defaultPort;
  }

  /**
   * Returns the scheme named {@code scheme}, ignoring case.
   *
   * @throws InvalidUrlException if {@code scheme} is not supported.
   */
  public static Scheme get(String scheme) {
    Scheme result = parse(scheme);
    if (result == null) {
      throw new InvalidUrlException(UNSUPPORTED_SCHEME,
          "Unsupported scheme: \"" + toHumanReadableAscii(scheme) + "\"");
    }
    return result;
  }

  /** Returns the scheme named {@code scheme} ignoring case, or null if it is not supported. */
  public static @Nullable Scheme parse(String scheme) {
    if (scheme == null) throw new NullPointerException("scheme == null");
    for (int i = 0, length = scheme.length(); i < length; i++) {
      if (scheme.charAt(i) > '\u007f') return null; // Only ASCII case folding.
    }
    for (Scheme value : values()) {
      if (value.canonicalName.equalsIgnoreCase(scheme)) return value;
    }
    return null;
  }

  /** Returns 80 for {@code http} and {@code ws}, and 443 for {@code https} and {@code wss}. */
  public int defaultPort() {
    return defaultPort;
  }

  /** Returns the lowercase scheme name, like {@code https}. */
  @Override public String toString() {
    return canonicalName;
  }
}
