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
import okurl.internal.PercentCodec;

import static okurl.internal.PercentCodec.EncodeSet.FRAGMENT;
import static okurl.internal.Util.checkEncodable;

/**
 * A URL held as validated components rather than as a string. Use this class to compose and
 * decompose addresses without string concatenation. For example, this composes a search URL:
 * <pre>   {@code
 *
 *   Url url = new Url.Builder()
 *       .scheme(Scheme.HTTPS)
 *       .host(Host.get("www.example.com"))
 *       .path(Path.of("search"))
 *       .query(Query.EMPTY.with("q", "polar bears"))
 *       .build();
 *   System.out.println(url);
 * }</pre>
 *
 * which prints: <pre>   {@code
 *
 *     https://www.example.com/search?q=polar%20bears
 * }</pre>
 *
 * <h3>Components</h3>
 *
 * <p>The scheme is one of {@link Scheme}. The host is a {@link Host} of two or more labels. The
 * port is optional: {@link #port()} returns -1 when the URL doesn't specify one, and {@link
 * #effectivePort()} falls back to the scheme's default. The {@link Path} is always absolute. The
 * {@link Query} maps each name to one value. The fragment is optional.
 *
 * <p>Path segments, query names and values, and the fragment are all held decoded. They are
 * percent-encoded each time the URL is converted to a string, and decoded by {@link #get get()}.
 *
 * <h3>Canonical form</h3>
 *
 * <p>{@link #toString()} always produces the same string for equal URLs: the scheme is lowercase,
 * escapes use uppercase hex digits, query parameters are sorted by name and an empty query is
 * omitted. Parsing that string yields an equal URL.
 */
public final class Url {
  private final Scheme scheme;
  private final Host host;

  /** In [0..65535], or -1 for no port. */
  private final int port;

  private final Path path;
  private final Query query;

  /** Decoded fragment, or null for no fragment. */
  private final @Nullable String fragment;

  Url(Builder builder) {
    this.scheme = builder.scheme;
    this.host = builder.host;
    this.port = builder.port;
    this.path = builder.path;
    this.query = builder.query;
    this.fragment = builder.fragment;
  }

  public Scheme scheme() {
    return scheme;
  }

  public Host host() {
    return host;
  }

  /** Returns the explicit port of this URL, or -1 if it doesn't have one. */
  public int port() {
    return port;
  }

  /** Returns the explicit port of this URL, or its scheme's default port. */
  public int effectivePort() {
    return port != -1 ? port : scheme.defaultPort();
  }

  public Path path() {
    return path;
  }

  public Query query() {
    return query;
  }

  /** Returns the decoded fragment, like {@code abc} for {@code http://host.com/#abc}. */
  public @Nullable String fragment() {
    return fragment;
  }

  /** Returns this URL with the last segment of its path removed. */
  public Url parent() {
    return newBuilder().path(path.parent()).build();
  }

  public Builder newBuilder() {
    Builder result = new Builder();
    result.scheme = scheme;
    result.host = host;
    result.port = port;
    result.path = path;
    result.query = query;
    result.fragment = fragment;
    return result;
  }

  /**
   * Returns the URL for {@code url}.
   *
   * @throws InvalidUrlException if {@code url} is not a well-formed URL, with a reason naming the
   *     first problem found.
   */
  public static Url get(String url) {
    if (url == null) throw new NullPointerException("url == null");
    return new UrlParser(url).parse();
  }

  /** Returns the URL for {@code url}, or null if it isn't a well-formed URL. */
  public static @Nullable Url parse(String url) {
    try {
      return get(url);
    } catch (InvalidUrlException ignored) {
      return null;
    }
  }

  @Override public boolean equals(@Nullable Object other) {
    if (!(other instanceof Url)) return false;
    Url that = (Url) other;
    return scheme == that.scheme
        && host.equals(that.host)
        && port == that.port
        && path.equals(that.path)
        && query.equals(that.query)
        && (fragment == null ? that.fragment == null : fragment.equals(that.fragment));
  }

  @Override public int hashCode() {
    int result = 17;
    result = 31 * result + scheme.hashCode();
    result = 31 * result + host.hashCode();
    result = 31 * result + port;
    result = 31 * result + path.hashCode();
    result = 31 * result + query.hashCode();
    result = 31 * result + (fragment != null ? fragment.hashCode() : 0);
    return result;
  }

  /** Returns the canonical string form of this URL. This is recomputed on each call. */
  @Override public String toString() {
    StringBuilder result = new StringBuilder();
    result.append(scheme);
    result.append("://");
    result.append(host);
    if (port != -1) {
      result.append(':');
      result.append(port);
    }
    result.append(path.encoded());
    if (!query.isEmpty()) {
      result.append('?');
      result.append(query.encoded());
    }
    if (fragment != null) {
      result.append('#');
      result.append(PercentCodec.encode(fragment, FRAGMENT));
    }
    return result.toString();
  }

  public static final class Builder {
    @Nullable Scheme scheme;
    @Nullable Host host;
    int port = -1;
    Path path = Path.ROOT;
    Query query = Query.EMPTY;
    @Nullable String fragment;

    public Builder() {
    }

    public Builder scheme(Scheme scheme) {
      if (scheme == null) throw new NullPointerException("scheme == null");
      this.scheme = scheme;
      return this;
    }

    public Builder host(Host host) {
      if (host == null) throw new NullPointerException("host == null");
      this.host = host;
      return this;
    }

    public Builder port(int port) {
      if (port < 0 || port > 65535) throw new IllegalArgumentException("unexpected port: " + port);
      this.port = port;
      return this;
    }

    /** Removes the explicit port. */
    public Builder removePort() {
      this.port = -1;
      return this;
    }

    public Builder path(Path path) {
      if (path == null) throw new NullPointerException("path == null");
      this.path = path;
      return this;
    }

    /** Appends {@code segment}, which is not encoded, to the path. */
    public Builder addPathSegment(String segment) {
      this.path = path.child(segment);
      return this;
    }

    public Builder query(Query query) {
      if (query == null) throw new NullPointerException("query == null");
      this.query = query;
      return this;
    }

    /** Sets the query parameter {@code name}, which is not encoded, to {@code value}. */
    public Builder setQueryParameter(String name, String value) {
      this.query = query.with(name, value);
      return this;
    }

    public Builder removeQueryParameter(String name) {
      this.query = query.without(name);
      return this;
    }

    /** Sets the decoded fragment, or removes it if {@code fragment} is null. */
    public Builder fragment(@Nullable String fragment) {
      this.fragment = fragment != null ? checkEncodable(fragment, "fragment") : null;
      return this;
    }

    public Url build() {
      if (scheme == null) throw new IllegalStateException("scheme == null");
      if (host == null) throw new IllegalStateException("host == null");
      return new Url(this);
    }
  }
}
