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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;
import okurl.internal.PercentCodec;

import static okurl.InvalidUrlException.Reason.INVALID_PATH;
import static okurl.internal.PercentCodec.EncodeSet.PATH_SEGMENT;
import static okurl.internal.Util.checkEncodable;
import static okurl.internal.Util.delimiterOffset;
import static okurl.internal.Util.immutableList;
import static okurl.internal.Util.toHumanReadableAscii;

/**
 * An absolute URL path, held as a list of decoded segments. Segments may contain any character,
 * including '/', which is escaped when the path is {@linkplain #encoded() encoded}.
 *
 * <p><table summary="">
 *   <tr><th>Encoded</th><th>{@code segments()}</th></tr>
 *   <tr><td>{@code /}</td><td>{@code []}</td></tr>
 *   <tr><td>{@code /a/b/c}</td><td>{@code ["a", "b", "c"]}</td></tr>
 *   <tr><td>{@code /a/b/}</td><td>{@code ["a", "b", ""]}</td></tr>
 *   <tr><td>{@code /a/b%2Fc%20d}</td><td>{@code ["a", "b/c d"]}</td></tr>
 * </table>
 */
public final class Path {
  /** The path {@code /}. */
  public static final Path ROOT = new Path(Collections.<String>emptyList());

  private final List<String> segments;

  private Path(List<String> segments) {
    this.segments = segments;
  }

  public static Path of(String... segments) {
    if (segments == null) throw new NullPointerException("segments == null");
    return of(Arrays.asList(segments));
  }

  /**
   * Returns the path with {@code segments}, which are not encoded.
   *
   * @throws IllegalArgumentException if a segment has an unpaired surrogate.
   */
  public static Path of(List<String> segments) {
    if (segments == null) throw new NullPointerException("segments == null");
    for (String segment : segments) {
      if (segment == null) throw new NullPointerException("segments contains null");
      checkEncodable(segment, "segment");
    }
    // A lone empty segment is the root path: both are "/".
    if (segments.isEmpty() || (segments.size() == 1 && segments.get(0).isEmpty())) return ROOT;
    return new Path(immutableList(segments));
  }

  /**
   * Returns the path for the encoded path {@code encodedPath}. The empty string is the root path.
   *
   * @throws InvalidUrlException if {@code encodedPath} is non-empty and doesn't start with '/', or
   *     if a segment has a malformed percent escape.
   */
  public static Path get(String encodedPath) {
    if (encodedPath == null) throw new NullPointerException("encodedPath == null");
    if (encodedPath.isEmpty()) return ROOT;
    if (encodedPath.charAt(0) != '/') {
      throw new InvalidUrlException(INVALID_PATH,
          "Path is not absolute: \"" + toHumanReadableAscii(encodedPath) + "\"");
    }

    List<String> result = new ArrayList<>();
    for (int pos = 1, limit = encodedPath.length(); pos <= limit; ) {
      int segmentEnd = delimiterOffset(encodedPath, pos, limit, '/');
      result.add(PercentCodec.decode(encodedPath.substring(pos, segmentEnd)));
      pos = segmentEnd + 1;
    }
    return of(result);
  }

  /** Returns the decoded segments of this path. Empty for the root path. */
  public List<String> segments() {
    return segments;
  }

  public int size() {
    return segments.size();
  }

  public boolean isRoot() {
    return segments.isEmpty();
  }

  /**
   * Returns this path without its last segment, ignoring a trailing '/'. Both {@code /a/b} and
   * {@code /a/b/} have the parent {@code /a}. The root is its own parent.
   */
  public Path parent() {
    int end = segments.size();
    if (end > 0 && segments.get(end - 1).isEmpty()) end--;
    if (end == 0) return ROOT;
    return of(segments.subList(0, end - 1));
  }

  /**
   * Returns this path with {@code segment} appended. The segment is not encoded and may contain
   * '/'. A trailing empty segment, as in {@code /a/}, is replaced.
   */
  public Path child(String segment) {
    if (segment == null) throw new NullPointerException("segment == null");
    List<String> result = new ArrayList<>(segments);
    if (!result.isEmpty() && result.get(result.size() - 1).isEmpty()) {
      result.remove(result.size() - 1);
    }
    result.add(segment);
    return of(result);
  }

  /** Returns this path with each segment percent-encoded, like {@code /a/b%20c}. */
  public String encoded() {
    if (segments.isEmpty()) return "/";
    StringBuilder out = new StringBuilder();
    for (int i = 0, size = segments.size(); i < size; i++) {
      out.append('/');
      out.append(PercentCodec.encode(segments.get(i), PATH_SEGMENT));
    }
    return out.toString();
  }

  @Override public boolean equals(@Nullable Object other) {
    return other instanceof Path && ((Path) other).segments.equals(segments);
  }

  @Override public int hashCode() {
    return segments.hashCode();
  }

  @Override public String toString() {
    return encoded();
  }
}
