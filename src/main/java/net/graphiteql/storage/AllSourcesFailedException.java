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
package net.graphiteql.storage;

import java.io.IOException;

/**
 * Thrown when every reader behind a {@link MultiReader} failed or had no data.
 * @since 1.0
 */
public class AllSourcesFailedException extends IOException {

  public AllSourcesFailedException(final String msg) {
    super(msg);
  }

  private static final long serialVersionUID = -2398471298765123741L;
}
