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

import java.util.Arrays;
import java.util.List;
import okurl.InvalidUrlException;
import okurl.InvalidUrlException.Reason;
import okurl.internal.PercentCodec.EncodeSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

public final class PercentCodecTest {
  private static final int UNICODE_2 = 0x07ff; // Arbitrary code point that's 2 bytes in UTF-8.
  private static final int UNICODE_3 = 0xffff; // Arbitrary code point that's 3 bytes in UTF-8.
  private static final int UNICODE_4 = 0x10ffff; // Arbitrary code point that's 4 bytes in UTF-8.

  private static final List<String> SAMPLES = Arrays.asList(
      "",
      "plain",
      "a b",
      "100%",
      "a+b",
      "&=#?/:@",
      "key=with=equals",
      "val#with#hashtag",
      "%2",
      "%41",
      "\t\n\u0000\u007f",
      "café",
      new String(new int[] {UNICODE_2, UNICODE_3, UNICODE_4}, 0, 3));

  @ParameterizedTest @EnumSource(EncodeSet.class)
  public void decodeReversesEncode(EncodeSet encodeSet) {
    for (String sample : SAMPLES) {
      assertThat(PercentCodec.decode(PercentCodec.encode(sample, encodeSet)))
          .describedAs("%s in %s", sample, encodeSet)
          .isEqualTo(sample);
    }
  }

  @ParameterizedTest @EnumSource(EncodeSet.class)
  public void unreservedAreNeverEncoded(EncodeSet encodeSet) {
    String unreserved = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-._~";
    assertThat(PercentCodec.encode(unreserved, encodeSet)).isSameAs(unreserved);
  }

  @ParameterizedTest @EnumSource(EncodeSet.class)
  public void alwaysEncoded(EncodeSet encodeSet) {
    assertThat(PercentCodec.encode(" ", encodeSet)).isEqualTo("%20");
    assertThat(PercentCodec.encode("%", encodeSet)).isEqualTo("%25");
    assertThat(PercentCodec.encode("#", encodeSet)).isEqualTo("%23");
    assertThat(PercentCodec.encode("\"<>\\^`{|}", encodeSet))
        .isEqualTo("%22%3C%3E%5C%5E%60%7B%7C%7D");
    assertThat(PercentCodec.encode("\u0000\u007f", encodeSet)).isEqualTo("%00%7F");
  }

  @Test public void encodeUsesUtf8AndUppercaseHex() {
    assertThat(PercentCodec.encode("café", EncodeSet.PATH_SEGMENT)).isEqualTo("caf%C3%A9");
    assertThat(PercentCodec.encode(new String(new int[] {UNICODE_4}, 0, 1), EncodeSet.FRAGMENT))
        .isEqualTo("%F4%8F%BF%BF");
  }

  @Test public void delimitersPerEncodeSet() {
    assertThat(PercentCodec.encode("a/b", EncodeSet.PATH_SEGMENT)).isEqualTo("a%2Fb");
    assertThat(PercentCodec.encode("a?b", EncodeSet.PATH_SEGMENT)).isEqualTo("a%3Fb");
    assertThat(PercentCodec.encode("a&b=c+d", EncodeSet.PATH_SEGMENT)).isEqualTo("a&b=c+d");

    assertThat(PercentCodec.encode("a/b?c", EncodeSet.QUERY_COMPONENT)).isEqualTo("a/b?c");
    assertThat(PercentCodec.encode("a&b=c+d", EncodeSet.QUERY_COMPONENT))
        .isEqualTo("a%26b%3Dc%2Bd");

    assertThat(PercentCodec.encode("a/b?c", EncodeSet.FRAGMENT)).isEqualTo("a/b?c");
    assertThat(PercentCodec.encode("a&b=c+d", EncodeSet.FRAGMENT)).isEqualTo("a&b=c+d");
  }

  @ParameterizedTest @EnumSource(EncodeSet.class)
  public void encodeRejectsUnpairedSurrogates(EncodeSet encodeSet) {
    for (String sample : Arrays.asList("a\ud800b", "\ud800", "a\udc00", "\ude00\ud83d")) {
      try {
        PercentCodec.encode(sample, encodeSet);
        fail("Expected encode to reject " + sample.length() + " chars in " + encodeSet);
      } catch (IllegalArgumentException expected) {
        assertThat(expected).isNotInstanceOf(InvalidUrlException.class);
      }
    }
  }

  @Test public void decodeRejectsUnpairedSurrogates() {
    assertMalformed("a\ud800b");
    assertMalformed("%41\udc00");
  }

  @Test public void decode() {
    assertThat(PercentCodec.decode("a%20b")).isEqualTo("a b");
    assertThat(PercentCodec.decode("caf%c3%a9")).isEqualTo("café");
    assertThat(PercentCodec.decode("caf%C3%A9")).isEqualTo("café");
    assertThat(PercentCodec.decode("café")).isEqualTo("café");
    assertThat(PercentCodec.decode("%2525")).isEqualTo("%25");
  }

  @Test public void decodeNeverTreatsPlusAsSpace() {
    assertThat(PercentCodec.decode("a+b")).isEqualTo("a+b");
    assertThat(PercentCodec.decode("a%2Bb")).isEqualTo("a+b");
  }

  @Test public void decodeMalformedEscapes() {
    assertMalformed("%");
    assertMalformed("%2");
    assertMalformed("abc%2");
    assertMalformed("%zz");
    assertMalformed("%2g");
    assertMalformed("%%41");
  }

  @Test public void decodeRejectsBytesThatAreNotUtf8() {
    assertMalformed("%FF");
    assertMalformed("%C3");
    assertMalformed("%C3%28");
  }

  private static void assertMalformed(String encoded) {
    try {
      PercentCodec.decode(encoded);
      fail("Expected decode(\"" + encoded + "\") to throw");
    } catch (InvalidUrlException expected) {
      assertThat(expected.reason()).isEqualTo(Reason.INVALID_ENCODING);
    }
  }
}
