// This file is part of GraphiteQL.
// Copyright (C) 2026  The GraphiteQL Authors.
//
// This program is free software: you can redistribute it and/or modify it
// under the terms of the GNU Lesser General Public License as published by
// the Free Software Foundation, either version 2.1 of the License, or (at your
// option) any later version.  This program is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the implied warranty
// of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the GNU Lesser
// General Public License for more details.  You should have received a copy
// of the GNU Lesser General Public License along with this program.  If not,
// see <http://www.gnu.org/licenses/>.
package net.graphiteql.utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import com.google.common.collect.Lists;

/**
 * Glob and brace matching over single namespace segments. Callers split paths
 * on dots and match one segment at a time, so nothing here ever crosses a
 * segment boundary.
 * <p>
 * Supported syntax: {@code *}, {@code ?}, {@code [abc]}, {@code [a-z]},
 * {@code [!a]}, nestable {@code {alt1,alt2}} groups and backslash escapes.
 * Matching is case sensitive and always covers the whole name.
 * @since 1.0
 */
public final class GlobMatcher {

  /** Don't instantiate me! */
  private GlobMatcher() { }

  /**
   * Whether or not the string carries any glob or brace syntax.
   * @param pattern The string to check
   * @return True if a wildcard, character class or brace group is present
   */
  public static boolean isPattern(final String pattern) {
    if (pattern == null) {
      return false;
    }
    for (int i = 0; i < pattern.length(); i++) {
      final char c = pattern.charAt(i);
      if (c == '*' || c == '?' || c == '[' || c == '{') {
        return true;
      }
    }
    return false;
  }

  /**
   * Expands brace groups into one pattern per alternative. The right-most
   * unescaped opening brace is paired with the first unescaped closing brace
   * after it, its comma separated alternatives are substituted in and the
   * results expanded again until no groups remain. A group without commas
   * simply loses its braces. Escaped closing braces are unescaped once all
   * groups are gone.
   * @param pattern The pattern to expand
   * @return A de-duplicated list of expansions in first-seen order
   * @throws IllegalArgumentException if the pattern was null
   */
  public static List<String> expandBraces(final String pattern) {
    if (pattern == null) {
      throw new IllegalArgumentException("Pattern cannot be null");
    }
    final Set<String> results = new LinkedHashSet<String>();
    expand(pattern, results);
    return new ArrayList<String>(results);
  }

  private static void expand(final String pattern, final Set<String> results) {
    final int open = lastUnescaped(pattern, '{');
    final int close = open < 0 ? -1 : nextUnescaped(pattern, '}', open + 1);
    if (open < 0 || close < 0) {
      results.add(pattern.replace("\\}", "}"));
      return;
    }

    final String head = pattern.substring(0, open);
    final String body = pattern.substring(open + 1, close);
    final String tail = pattern.substring(close + 1);
    if (body.indexOf(',') < 0) {
      expand(head + body + tail, results);
      return;
    }
    for (final String alternative : body.split(",", -1)) {
      expand(head + alternative + tail, results);
    }
  }

  private static int lastUnescaped(final String pattern, final char c) {
    for (int i = pattern.length() - 1; i >= 0; i--) {
      if (pattern.charAt(i) == c && !isEscaped(pattern, i)) {
        return i;
      }
    }
    return -1;
  }

  private static int nextUnescaped(final String pattern, final char c,
      final int from) {
    for (int i = from; i < pattern.length(); i++) {
      if (pattern.charAt(i) == c && !isEscaped(pattern, i)) {
        return i;
      }
    }
    return -1;
  }

  /** @return true if the character at idx is preceded by an odd number of
   * backslashes */
  private static boolean isEscaped(final String pattern, final int idx) {
    int slashes = 0;
    for (int i = idx - 1; i >= 0 && pattern.charAt(i) == '\\'; i--) {
      slashes++;
    }
    return slashes % 2 == 1;
  }

  /**
   * Splits a pattern on dots that are neither escaped nor inside a brace
   * group.
   * @param pattern The pattern to split
   * @return The segments
   */
  public static List<String> splitPattern(final String pattern) {
    final List<String> parts = Lists.newArrayList();
    final StringBuilder current = new StringBuilder();
    int depth = 0;
    for (int i = 0; i < pattern.length(); i++) {
      final char c = pattern.charAt(i);
      if (c == '\\' && i + 1 < pattern.length()) {
        current.append(c).append(pattern.charAt(++i));
        continue;
      }
      if (c == '{') {
        depth++;
      } else if (c == '}' && depth > 0) {
        depth--;
      } else if (c == '.' && depth == 0) {
        parts.add(current.toString());
        current.setLength(0);
        continue;
      }
      current.append(c);
    }
    parts.add(current.toString());
    return parts;
  }

  /**
   * Filters the names that match the pattern after brace expansion.
   * @param names The candidate segment names
   * @param pattern The segment pattern
   * @return Matching names, de-duplicated, in the order they were found
   */
  public static List<String> matchEntries(final Collection<String> names,
      final String pattern) {
    final Set<String> matched = new LinkedHashSet<String>();
    for (final String variant : expandBraces(pattern)) {
      final Pattern regex = toRegex(variant);
      for (final String name : names) {
        if (regex.matcher(name).matches()) {
          matched.add(name);
        }
      }
    }
    return Lists.newArrayList(matched);
  }

  /**
   * Matches a single name against a pattern, braces included.
   * @param name The name to test
   * @param pattern The segment pattern
   * @return True on a match
   */
  public static boolean matches(final String name, final String pattern) {
    for (final String variant : expandBraces(pattern)) {
      if (toRegex(variant).matcher(name).matches()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Removes backslash escapes so an escaped literal segment can be compared
   * with stored names.
   * @param segment The segment to unescape
   * @return The literal text
   */
  public static String unescape(final String segment) {
    if (segment.indexOf('\\') < 0) {
      return segment;
    }
    final StringBuilder buf = new StringBuilder(segment.length());
    for (int i = 0; i < segment.length(); i++) {
      final char c = segment.charAt(i);
      if (c == '\\' && i + 1 < segment.length()) {
        buf.append(segment.charAt(++i));
      } else {
        buf.append(c);
      }
    }
    return buf.toString();
  }

  /**
   * Translates a brace-free glob into an anchored regular expression.
   * Package private for UTs.
   * @param glob The glob to translate
   * @return A compiled pattern
   */
  static Pattern toRegex(final String glob) {
    final StringBuilder regex = new StringBuilder();
    final int n = glob.length();
    int i = 0;
    while (i < n) {
      final char c = glob.charAt(i++);
      switch (c) {
        case '*':
          regex.append(".*");
          break;
        case '?':
          regex.append('.');
          break;
        case '\\':
          if (i < n) {
            regex.append(Pattern.quote(String.valueOf(glob.charAt(i++))));
          } else {
            regex.append("\\\\");
          }
          break;
        case '[':
          int j = i;
          if (j < n && glob.charAt(j) == '!') {
            j++;
          }
          if (j < n && glob.charAt(j) == ']') {
            j++;
          }
          while (j < n && glob.charAt(j) != ']') {
            j++;
          }
          if (j >= n) {
            // unterminated, take it literally
            regex.append("\\[");
            break;
          }
          String body = glob.substring(i, j);
          i = j + 1;
          final StringBuilder cls = new StringBuilder("[");
          if (body.startsWith("!")) {
            cls.append('^');
            body = body.substring(1);
          }
          for (int k = 0; k < body.length(); k++) {
            final char b = body.charAt(k);
            if (b == '\\' || b == '[' || b == ']' || b == '^' || b == '&') {
              cls.append('\\');
            }
            cls.append(b);
          }
          regex.append(cls).append(']');
          break;
        default:
          regex.append(Pattern.quote(String.valueOf(c)));
      }
    }
    return Pattern.compile(regex.toString(), Pattern.DOTALL);
  }
}
