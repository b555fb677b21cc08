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

/**
 * Thrown when a {@code template(...)} call could not be parsed as a template,
 * usually because its substitution arguments were not literals.
 * @since 1.0
 */
public class InvalidTemplateException extends IllegalArgumentException {

  public InvalidTemplateException(final String msg) {
    super(msg);
  }

  private static final long serialVersionUID = 3019684720476592215L;
}
