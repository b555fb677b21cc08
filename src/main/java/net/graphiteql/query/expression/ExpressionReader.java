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
package net.graphiteql.query.expression;

import java.util.NoSuchElementException;

/**
 * A cursor over the characters of a target string.
 * Please use {@link #isEOF()} before any method call. Otherwise the methods
 * will throw a NoSuchElementException.
 * <p>
 * The mark can be moved back with {@link #reset(int)} so the parser can try
 * one production and fall back to another.
 * @since 1.0
 */
public class ExpressionReader {
  /** The character array to parse */
  protected final char[] chars;

  /** The current index in the character array */
  private int mark = 0;

  /**
   * Default ctor
   * @param chars The characters to parse
   */
  public ExpressionReader(final char[] chars) {
    if (chars == null) {
      throw new IllegalArgumentException("Character set cannot be null");
    }
    this.chars = chars;
  }

  /** @return the current index */
  public int getMark() {
    return mark;
  }

  /**
   * Moves the index back to a previously read mark.
   * @param mark The index to return to
   */
  public void reset(final int mark) {
    if (mark < 0 || mark > chars.length) {
      throw new IllegalArgumentException("Mark " + mark + " is out of bounds "
          + chars.length);
    }
    this.mark = mark;
  }

  /** @return the current character without advancing the index */
  public char peek() {
    if (isEOF()) {
      throw new NoSuchElementException("Index " + mark + " is out of bounds "
          + chars.length);
    }
    return chars[mark];
  }

  /** @return the current character and advances the index */
  public char next() {
    if (isEOF()) {
      throw new NoSuchElementException("Index " + mark + " is out of bounds "
          + chars.length);
    }
    return chars[mark++];
  }

  /** @param num the number of characters to skip */
  public void skip(final int num) {
    if (num < 0) {
      throw new UnsupportedOperationException("Skipping backwards is not allowed");
    }
    mark += num;
  }

  /**
   * Checks to see if the next character matches the parameter
   * @param c The character to check for
   * @return True if they match, false if not
   */
  public boolean isNextChar(final char c) {
    return peek() == c;
  }

  /** @return true if the given sequence appears next in the array. */
  public boolean isNextSeq(final CharSequence seq) {
    if (seq == null) {
      throw new IllegalArgumentException("Comparative sequence cannot be null");
    }
    for (int i = 0; i < seq.length(); i++) {
      if (mark + i >= chars.length) {
        return false;
      }
      if (chars[mark + i] != seq.charAt(i)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Reads a function or keyword argument name, {@code [A-Za-z_][A-Za-z0-9_]*}.
   * @return The name or null if the next character cannot start one, in
   * which case the index is not moved
   */
  public String readIdentifier() {
    if (isEOF() || !isIdentifierStart(peek())) {
      return null;
    }
    final StringBuilder builder = new StringBuilder();
    builder.append(next());
    while (!isEOF() && isIdentifierPart(peek())) {
      builder.append(next());
    }
    return builder.toString();
  }

  /** @return Whether or not the index is at the end of the character array */
  public boolean isEOF() {
    return mark >= chars.length;
  }

  /** Increments the mark over white spaces */
  public void skipWhitespaces() {
    for (int i = mark; i < chars.length; i++) {
      if (Character.isWhitespace(chars[i])) {
        mark++;
      } else {
        break;
      }
    }
  }

  static boolean isIdentifierStart(final char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  static boolean isIdentifierPart(final char c) {
    return isIdentifierStart(c) || (c >= '0' && c <= '9');
  }

  @Override
  public String toString() {
    // make a copy
    return new String(chars);
  }

}
