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

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import okio.Buffer;
import okurl.InvalidUrlException;

import static okurl.InvalidUrlException.Reason.INVALID_ENCODING;
import static okurl.internal.Util.decodeHexDigit;
import static okurl.internal.Util.indexOfUnpairedSurrogate;
import static okurl.internal.Util.toHumanReadableAscii;

/**
 * Percent-encodes and decodes URL components. Encoding works on the UTF-8 bytes of its input:
 * every byte outside of the component's safe set becomes {@code %} followed by two uppercase hex
 * digits. Decoding reverses that and accepts either hex case.
 *
 * <p>Unlike HTML form encoding, {@code +} is never a space. It is escaped when it would be
 * ambiguous and otherwise decodes to itself.
 */
public final class PercentCodec {
  private static final char[] HEX_DIGITS =
      {'0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'A', 'B', 'C', 'D', 'E', 'F'};

  /** RFC 3986 unreserved characters. These are never escaped. */
  private static final String UNRESERVED =
      "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-._~";

  /** The characters that may appear unescaped in one component of a URL. */
  public enum EncodeSet {
    /** A single path segment. '/' is escaped because it separates segments. */
    PATH_SEGMENT(UNRESERVED + "!$&'()*+,;=:@"),

    /** A query parameter name or value. '&', '=' and '+' are escaped. */
    QUERY_COMPONENT(UNRESERVED + "!$'()*,;:@/?"),

    /** Everything after the '#'. */
    FRAGMENT(UNRESERVED + "!$&'()*+,;=:@/?");

    private final boolean[] safe = new boolean[128];

    EncodeSet(String safeCharacters) {
      for (int i = 0; i < safeCharacters.length(); i++) {
        safe[safeCharacters.charAt(i)] = true;
      }
    }

    boolean isSafe(int b) {
      return b < 0x80 && safe[b];
    }
  }

  private PercentCodec() {
  }

  /**
   * Returns {@code input} with each byte that isn't safe in {@code encodeSet} percent-encoded.
   *
   * @throws IllegalArgumentException if {@code input} has an unpaired surrogate.
   */
  public static String encode(String input, EncodeSet encodeSet) {
    if (input == null) throw new NullPointerException("input == null");
    if (encodeSet == null) throw new NullPointerException("encodeSet == null");
    int unpaired = indexOfUnpairedSurrogate(input);
    if (unpaired != -1) {
      throw new IllegalArgumentException(
          "Unpaired surrogate at offset " + unpaired + " can't be encoded");
    }

    for (int i = 0, length = input.length(); i < length; i++) {
      if (!encodeSet.isSafe(input.charAt(i))) {
        // Slow path: the character at i requires encoding!
        Buffer out = new Buffer();
        out.writeUtf8(input, 0, i);
        encode(out, input, i, length, encodeSet);
        return out.readUtf8();
      }
    }

    // Fast path: nothing in input required encoding.
    return input;
  }

  private static void encode(Buffer out, String input, int pos, int limit, EncodeSet encodeSet) {
    Buffer utf8Buffer = new Buffer();
    utf8Buffer.writeUtf8(input, pos, limit);
    while (!utf8Buffer.exhausted()) {
      int b = utf8Buffer.readByte() & 0xff;
      if (encodeSet.isSafe(b)) {
        out.writeByte(b);
      } else {
        out.writeByte('%');
        out.writeByte(HEX_DIGITS[(b >> 4) & 0xf]);
        out.writeByte(HEX_DIGITS[b & 0xf]);
      }
    }
  }

  /**
   * Returns {@code encoded} with each {@code %XX} escape replaced by the byte it encodes. Other
   * characters are kept as-is.
   *
   * @throws InvalidUrlException if a '%' isn't followed by two hex digits, if {@code encoded} has
   *     an unpaired surrogate, or if the decoded bytes aren't well-formed UTF-8.
   */
  public static String decode(String encoded) {
    if (encoded == null) throw new NullPointerException("encoded == null");
    int unpaired = indexOfUnpairedSurrogate(encoded);
    if (unpaired != -1) {
      throw new InvalidUrlException(INVALID_ENCODING,
          "Unpaired surrogate at offset " + unpaired + ": \"" + toHumanReadableAscii(encoded)
              + "\"");
    }

    int percent = encoded.indexOf('%');
    if (percent == -1) return encoded; // Fast path: nothing to decode.

    Buffer out = new Buffer();
    out.writeUtf8(encoded, 0, percent);
    int codePoint;
    for (int i = percent, limit = encoded.length(); i < limit; i += Character.charCount(codePoint)) {
      codePoint = encoded.codePointAt(i);
      if (codePoint != '%') {
        out.writeUtf8CodePoint(codePoint);
        continue;
      }
      int d1 = i + 1 < limit ? decodeHexDigit(encoded.charAt(i + 1)) : -1;
      int d2 = i + 2 < limit ? decodeHexDigit(encoded.charAt(i + 2)) : -1;
      if (d1 == -1 || d2 == -1) {
        throw new InvalidUrlException(INVALID_ENCODING,
            "Malformed percent escape at offset " + i + ": \"" + toHumanReadableAscii(encoded)
                + "\"");
      }
      out.writeByte((d1 << 4) + d2);
      i += 2;
    }
    return strictUtf8(out.readByteArray(), encoded);
  }

  /** Decodes {@code bytes}, rejecting malformed sequences rather than substituting U+FFFD. */
  private static String strictUtf8(byte[] bytes, String encoded) {
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    try {
      return decoder.decode(ByteBuffer.wrap(bytes)).toString();
    } catch (CharacterCodingException e) {
      throw new InvalidUrlException(INVALID_ENCODING,
          "Percent escapes are not UTF-8: \"" + toHumanReadableAscii(encoded) + "\"", e);
    }
  }
}
