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
package okurl.internal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import okio.Buffer;

/** Junk drawer of utility methods. */
public final class Util {
  private Util() {
  }

  /** Returns an immutable copy of {@code list}. */
  public static <T> List<T> immutableList(List<T> list) {
    return Collections.unmodifiableList(new ArrayList<>(list));
  }

  /**
   * Returns the index of the first character in {@code input} that contains a character in {@code
   * delimiters}. Returns limit if there is no such character.
   */
  public static int delimiterOffset(String input, int pos, int limit, String delimiters) {
    for (int i = pos; i < limit; i++) {
      if (delimiters.indexOf(input.charAt(i)) != -1) return i;
    }
    return limit;
  }

  /**
   * Returns the index of the first character in {@code input} that is {@code delimiter}. Returns
   * limit if there is no such character.
   */
  public static int delimiterOffset(String input, int pos, int limit, char delimiter) {
    for (int i = pos; i < limit; i++) {
      if (input.charAt(i) == delimiter) return i;
    }
    return limit;
  }

  /** Returns true if {@code input} is non-empty and every character in it is in '0'..'9'. */
  public static boolean isAsciiDigits(String input, int pos, int limit) {
    if (pos >= limit) return false;
    for (int i = pos; i < limit; i++) {
      char c = input.charAt(i);
      if (c < '0' || c > '9') return false;
    }
    return true;
  }

  /**
   * Returns the index of the first surrogate in {@code s} that isn't part of a surrogate pair, or
   * -1 if every surrogate is paired. Unpaired surrogates have no UTF-8 encoding.
   */
  public static int indexOfUnpairedSurrogate(String s) {
    for (int i = 0, length = s.length(); i < length; i++) {
      char c = s.charAt(i);
      if (Character.isHighSurrogate(c)) {
        if (i + 1 == length || !Character.isLowSurrogate(s.charAt(i + 1))) return i;
        i++; // Skip the low surrogate of this pair.
      } else if (Character.isLowSurrogate(c)) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Throws if {@code value} can't be percent-encoded. Components are checked when they're set so
   * that converting a URL to a string never fails.
   */
  public static String checkEncodable(String value, String name) {
    int unpaired = indexOfUnpairedSurrogate(value);
    if (unpaired != -1) {
      throw new IllegalArgumentException(name + " has an unpaired surrogate at " + unpaired);
    }
    return value;
  }

  /** Returns {@code s} with control characters and non-ASCII characters replaced with '?'. */
  public static String toHumanReadableAscii(String s) {
    for (int i = 0, length = s.length(), c; i < length; i += Character.charCount(c)) {
      c = s.codePointAt(i);
      if (c > '\u001f' && c < '\u007f') continue;

      Buffer buffer = new Buffer();
      buffer.writeUtf8(s, 0, i);
      for (int j = i; j < length; j += Character.charCount(c)) {
        c = s.codePointAt(j);
        buffer.writeUtf8CodePoint(c > '\u001f' && c < '\u007f' ? c : '?');
      }
      return buffer.readUtf8();
    }
    return s;
  }

  public static int decodeHexDigit(char c) {
    if (c >= '0' && c <= '9') return c - '0';
    if (c >= 'a' && c <= 'f') return c - 'a' + 10;
    if (c >= 'A' && c <= 'F') return c - 'A' + 10;
    return -1;
  }
}
