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

import okurl.InvalidUrlException.Reason;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

public final class SchemeTest {
  @Test public void caseInsensitive() {
    assertThat(Scheme.get("http")).isEqualTo(Scheme.HTTP);
    assertThat(Scheme.get("HTTP")).isEqualTo(Scheme.HTTP);
    assertThat(Scheme.get("HtTpS")).isEqualTo(Scheme.HTTPS);
    assertThat(Scheme.get("ws")).isEqualTo(Scheme.WS);
    assertThat(Scheme.get("WSS")).isEqualTo(Scheme.WSS);
  }

  @Test public void serializesLowercase() {
    assertThat(Scheme.HTTP.toString()).isEqualTo("http");
    assertThat(Scheme.HTTPS.toString()).isEqualTo("https");
    assertThat(Scheme.WS.toString()).isEqualTo("ws");
    assertThat(Scheme.WSS.toString()).isEqualTo("wss");
  }

  @Test public void defaultPorts() {
    assertThat(Scheme.HTTP.defaultPort()).isEqualTo(80);
    assertThat(Scheme.HTTPS.defaultPort()).isEqualTo(443);
    assertThat(Scheme.WS.defaultPort()).isEqualTo(80);
    assertThat(Scheme.WSS.defaultPort()).isEqualTo(443);
  }

  @Test public void nonAsciiLookalikesAreUnsupported() {
    // U+017F LATIN SMALL LETTER LONG S folds to 's' under Unicode case rules.
    assertThat(Scheme.parse("http\u017f")).isNull();
    assertThat(Scheme.parse("w\u017f")).isNull();
    assertThat(Scheme.parse("W\u017fS")).isNull();
    try {
      Url.get("http\u017f://example.com/");
      fail();
    } catch (InvalidUrlException expected) {
      assertThat(expected.reason()).isEqualTo(Reason.UNSUPPORTED_SCHEME);
    }
  }

  @Test public void unsupported() {
    assertThat(Scheme.parse("ftp")).isNull();
    assertThat(Scheme.parse("")).isNull();
    assertThat(Scheme.parse("http ")).isNull();
    try {
      Scheme.get("mailto");
      fail();
    } catch (InvalidUrlException expected) {
      assertThat(expected.reason()).isEqualTo(Reason.UNSUPPORTED_SCHEME);
      assertThat(expected.getMessage()).isEqualTo("Unsupported scheme: \"mailto\"");
    }
  }
}
