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

import java.util.logging.Level;
import java.util.logging.Logger;
import okurl.internal.PercentCodec;

import static okurl.InvalidUrlException.Reason.INVALID_PORT;
import static okurl.InvalidUrlException.Reason.MISSING_SCHEME;
import static okurl.internal.Util.delimiterOffset;
import static okurl.internal.Util.isAsciiDigits;
import static okurl.internal.Util.toHumanReadableAscii;

/**
 * Reads a {@link Url} in one left-to-right pass: scheme, authority, path, query, fragment. Each
 * component is handed to its own type for validation and the first failure aborts the parse.
 */
final class UrlParser {
  private static final Logger logger = Logger.getLogger(Url.class.getName());

  /** More significant digits than this can't be a port in [0..65535]. */
  private static final int MAX_PORT_DIGITS = 5;

  private final String input;
  private final int limit;
  private int pos;

  UrlParser(String input) {
    this.input = input;
    this.limit = input.length();
  }

  Url parse() {
    try {
      return readUrl();
    } catch (InvalidUrlException e) {
      if (logger.isLoggable(Level.FINE)) {
        logger.log(Level.FINE, "Rejected URL \"" + toHumanReadableAscii(input) + "\": "
            + e.reason(), e);
      }
      throw e;
    }
  }

  private Url readUrl() {
    Url.Builder builder = new Url.Builder();
    builder.scheme(readScheme());
    readAuthority(builder);

    // Path. The authority ends at '/', '?', '#' or the end of input, so anything that remains
    // either starts a path or skips straight to the query or fragment.
    if (pos < limit && input.charAt(pos) == '/') {
      int pathDelimiterOffset = delimiterOffset(input, pos, limit, "?#");
      builder.path(Path.get(input.substring(pos, pathDelimiterOffset)));
      pos = pathDelimiterOffset;
    }

    // Query.
    if (pos < limit && input.charAt(pos) == '?') {
      int queryDelimiterOffset = delimiterOffset(input, pos + 1, limit, '#');
      builder.query(Query.get(input.substring(pos + 1, queryDelimiterOffset)));
      pos = queryDelimiterOffset;
    }

    // Fragment.
    if (pos < limit && input.charAt(pos) == '#') {
      builder.fragment(PercentCodec.decode(input.substring(pos + 1, limit)));
      pos = limit;
    }

    return builder.build();
  }

  private Scheme readScheme() {
    int schemeDelimiterOffset = input.indexOf("://");
    if (schemeDelimiterOffset == -1) {
      throw new InvalidUrlException(MISSING_SCHEME,
          "Expected a scheme followed by \"://\": \"" + toHumanReadableAscii(input) + "\"");
    }
    Scheme scheme = Scheme.get(input.substring(0, schemeDelimiterOffset));
    pos = schemeDelimiterOffset + 3; // "://".length() == 3.
    return scheme;
  }

  /**
   * Reads the host and optional port. The port is whatever follows the last ':' of the authority,
   * but only if that is all digits; otherwise the ':' is left for host validation to reject.
   */
  private void readAuthority(Url.Builder builder) {
    int authorityEnd = delimiterOffset(input, pos, limit, "/?#");
    int portColonOffset = input.lastIndexOf(':', authorityEnd - 1);

    if (portColonOffset >= pos && isAsciiDigits(input, portColonOffset + 1, authorityEnd)) {
      builder.host(Host.get(input.substring(pos, portColonOffset)));
      builder.port(parsePort(portColonOffset + 1, authorityEnd));
    } else {
      builder.host(Host.get(input.substring(pos, authorityEnd)));
    }
    pos = authorityEnd;
  }

  private int parsePort(int portStart, int portEnd) {
    int significantStart = portStart;
    while (significantStart < portEnd - 1 && input.charAt(significantStart) == '0') {
      significantStart++; // Skip leading zeros; "000080" is 80.
    }
    if (portEnd - significantStart <= MAX_PORT_DIGITS) {
      int port = Integer.parseInt(input.substring(significantStart, portEnd));
      if (port <= 65535) return port;
    }
    throw new InvalidUrlException(INVALID_PORT,
        "Port out of range: \"" + input.substring(portStart, portEnd) + "\"");
  }
}
