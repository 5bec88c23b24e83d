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
import java.util.List;
import javax.annotation.Nullable;

import static okurl.InvalidUrlException.Reason.INVALID_HOST;
import static okurl.internal.Util.immutableList;
import static okurl.internal.Util.toHumanReadableAscii;

/**
 * A fully-qualified hostname like {@code www.example.com}. The leftmost label is the {@linkplain
 * #name() name} and the rest are its {@linkplain #domains() domains}, in the order they're written:
 * <pre>   {@code
 *
 *   Host host = Host.get("www.example.com");
 *   host.name();    // www
 *   host.domains(); // [example, com]
 * }</pre>
 *
 * <p>A host always has at least one domain. Single-label names like {@code localhost}, IP
 * addresses and internationalized names are not supported.
 */
public final class Host {
  private final Label name;
  private final List<Label> domains;

  private Host(Label name, List<Label> domains) {
    this.name = name;
    this.domains = domains;
  }

  /**
   * Returns the host named {@code name} in {@code domains}.
   *
   * @throws InvalidUrlException if {@code domains} is empty.
   */
  public static Host of(Label name, List<Label> domains) {
    if (name == null) throw new NullPointerException("name == null");
    if (domains == null) throw new NullPointerException("domains == null");
    for (Label domain : domains) {
      if (domain == null) throw new NullPointerException("domains contains null");
    }
    if (domains.isEmpty()) {
      throw new InvalidUrlException(INVALID_HOST,
          "Invalid host \"" + name + "\": expected at least two labels");
    }
    return new Host(name, immutableList(domains));
  }

  /**
   * Returns the host for {@code hostname}, splitting it on '.' and validating each label.
   *
   * @throws InvalidUrlException if any label is invalid, or if there are fewer than two labels.
   */
  public static Host get(String hostname) {
    if (hostname == null) throw new NullPointerException("hostname == null");
    List<Label> labels = new ArrayList<>();
    for (int pos = 0, limit = hostname.length(); pos <= limit; ) {
      int dot = hostname.indexOf('.', pos);
      if (dot == -1) dot = limit;
      labels.add(Label.get(hostname.substring(pos, dot)));
      pos = dot + 1;
    }
    if (labels.size() < 2) {
      throw new InvalidUrlException(INVALID_HOST,
          "Invalid host \"" + toHumanReadableAscii(hostname) + "\": expected at least two labels");
    }
    return new Host(labels.get(0), immutableList(labels.subList(1, labels.size())));
  }

  /** Returns the host for {@code hostname}, or null if it isn't a valid host. */
  public static @Nullable Host parse(String hostname) {
    try {
      return get(hostname);
    } catch (InvalidUrlException ignored) {
      return null;
    }
  }

  /** Returns the leftmost label, like {@code www} in {@code www.example.com}. */
  public Label name() {
    return name;
  }

  /**
   * Returns the labels after the name, like {@code [example, com]} in {@code www.example.com}.
   * Never empty.
   */
  public List<Label> domains() {
    return domains;
  }

  /** Returns the name followed by the domains. */
  public List<Label> labels() {
    List<Label> result = new ArrayList<>(domains.size() + 1);
    result.add(name);
    result.addAll(domains);
    return immutableList(result);
  }

  @Override public boolean equals(@Nullable Object other) {
    return other instanceof Host
        && ((Host) other).name.equals(name)
        && ((Host) other).domains.equals(domains);
  }

  @Override public int hashCode() {
    int result = 17;
    result = 31 * result + name.hashCode();
    result = 31 * result + domains.hashCode();
    return result;
  }

  /** Returns the dot-joined hostname, like {@code www.example.com}. */
  @Override public String toString() {
    StringBuilder result = new StringBuilder();
    result.append(name);
    for (Label domain : domains) {
      result.append('.').append(domain);
    }
    return result.toString();
  }
}
