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

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import javax.annotation.Nullable;
import okurl.internal.PercentCodec;

import static okurl.InvalidUrlException.Reason.INVALID_QUERY;
import static okurl.internal.PercentCodec.EncodeSet.QUERY_COMPONENT;
import static okurl.internal.Util.checkEncodable;
import static okurl.internal.Util.toHumanReadableAscii;

/**
 * The query parameters of a URL, like {@code a=apple&b=banana}. Names are unique and each has
 * exactly one value. Names and values are held decoded.
 *
 * <p>Parameters are always ordered by name, so two queries holding the same parameters encode
 * identically regardless of how they were built.
 */
public final class Query {
  public static final Query EMPTY = new Query(new TreeMap<String, String>());

  private final SortedMap<String, String> parameters;

  private Query(TreeMap<String, String> parameters) {
    this.parameters = Collections.unmodifiableSortedMap(parameters);
  }

  /** Returns a query holding a copy of {@code parameters}, whose entries are not encoded. */
  public static Query of(Map<String, String> parameters) {
    if (parameters == null) throw new NullPointerException("parameters == null");
    TreeMap<String, String> copy = new TreeMap<>();
    for (Map.Entry<String, String> entry : parameters.entrySet()) {
      if (entry.getKey() == null) throw new NullPointerException("parameter name == null");
      if (entry.getValue() == null) throw new NullPointerException("parameter value == null");
      copy.put(checkEncodable(entry.getKey(), "parameter name"),
          checkEncodable(entry.getValue(), "parameter value"));
    }
    return copy.isEmpty() ? EMPTY : new Query(copy);
  }

  /**
   * Returns the query for {@code encodedQuery}, the text between '?' and '#' of a URL. Each pair
   * is split on its first '='. If a name repeats, its last value wins. The empty string is the
   * empty query.
   *
   * @throws InvalidUrlException if a pair has no '=', or if a name or value has a malformed
   *     percent escape.
   */
  public static Query get(String encodedQuery) {
    if (encodedQuery == null) throw new NullPointerException("encodedQuery == null");
    if (encodedQuery.isEmpty()) return EMPTY;

    TreeMap<String, String> result = new TreeMap<>();
    for (int pos = 0, limit = encodedQuery.length(); pos <= limit; ) {
      int ampersandOffset = encodedQuery.indexOf('&', pos);
      if (ampersandOffset == -1) ampersandOffset = limit;

      int equalsOffset = encodedQuery.indexOf('=', pos);
      if (equalsOffset == -1 || equalsOffset > ampersandOffset) {
        throw new InvalidUrlException(INVALID_QUERY, "Query parameter has no '=': \""
            + toHumanReadableAscii(encodedQuery.substring(pos, ampersandOffset)) + "\"");
      }
      String name = PercentCodec.decode(encodedQuery.substring(pos, equalsOffset));
      String value = PercentCodec.decode(encodedQuery.substring(equalsOffset + 1, ampersandOffset));
      result.put(name, value);
      pos = ampersandOffset + 1;
    }
    return new Query(result);
  }

  /** Returns the value of the parameter {@code name}, or null if there is no such parameter. */
  public @Nullable String value(String name) {
    if (name == null) throw new NullPointerException("name == null");
    return parameters.get(name);
  }

  /** Returns the parameter names in sorted order. */
  public Set<String> names() {
    return parameters.keySet();
  }

  public int size() {
    return parameters.size();
  }

  public boolean isEmpty() {
    return parameters.isEmpty();
  }

  /** Returns an unmodifiable view of the parameters, sorted by name. */
  public SortedMap<String, String> asMap() {
    return parameters;
  }

  /** Returns a copy of this query with {@code name} set to {@code value}. */
  public Query with(String name, String value) {
    if (name == null) throw new NullPointerException("name == null");
    if (value == null) throw new NullPointerException("value == null");
    TreeMap<String, String> result = new TreeMap<>(parameters);
    result.put(checkEncodable(name, "name"), checkEncodable(value, "value"));
    return new Query(result);
  }

  /** Returns a copy of this query without the parameter {@code name}. */
  public Query without(String name) {
    if (name == null) throw new NullPointerException("name == null");
    if (!parameters.containsKey(name)) return this;
    TreeMap<String, String> result = new TreeMap<>(parameters);
    result.remove(name);
    return result.isEmpty() ? EMPTY : new Query(result);
  }

  /**
   * Returns the encoded query like {@code a=apple&b=banana}, without a leading '?'. Returns the
   * empty string for the empty query.
   */
  public String encoded() {
    StringBuilder out = new StringBuilder();
    for (Map.Entry<String, String> parameter : parameters.entrySet()) {
      if (out.length() > 0) out.append('&');
      out.append(PercentCodec.encode(parameter.getKey(), QUERY_COMPONENT));
      out.append('=');
      out.append(PercentCodec.encode(parameter.getValue(), QUERY_COMPONENT));
    }
    return out.toString();
  }

  @Override public boolean equals(@Nullable Object other) {
    return other instanceof Query && ((Query) other).parameters.equals(parameters);
  }

  @Override public int hashCode() {
    return parameters.hashCode();
  }

  @Override public String toString() {
    return encoded();
  }
}
