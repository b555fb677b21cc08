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
package net.graphiteql.core;

/**
 * An exception thrown during query execution when a request cannot be
 * answered at all, e.g. the fetch pipeline broke while joining. Carries an
 * HTTP style status code for the web layer sitting in front of the engine.
 * @since 1.0
 */
public final class QueryException extends RuntimeException {

  /** Status used when the caller did not pick one */
  public static final int BAD_REQUEST = 400;

  /** Status for backend failures */
  public static final int SERVICE_UNAVAILABLE = 503;

  /** An optional, detailed error message  */
  private final String details;

  /** The HTTP status code to return to the user  */
  private final int status;

  /**
   * Default ctor
   * @param msg Message describing the problem.
   */
  public QueryException(final String msg) {
    super(msg);
    status = BAD_REQUEST;
    details = msg;
  }

  /**
   * Ctor setting the status
   * @param status The status code to respond with for HTTP requests
   * @param msg Message describing the problem.
   */
  public QueryException(final int status, final String msg) {
    super(msg);
    this.status = status;
    details = msg;
  }

  /**
   * Ctor setting status, message and cause
   * @param status The status code to respond with for HTTP requests
   * @param msg Message describing the problem.
   * @param cause The exception that triggered this one
   */
  public QueryException(final int status, final String msg,
      final Throwable cause) {
    super(msg, cause);
    this.status = status;
    details = cause == null ? msg : cause.getMessage();
  }

  /** @return the HTTP status code */
  public final int getStatus() {
    return this.status;
  }

  /** @return the details, may be an empty string */
  public final String getDetails() {
    return this.details;
  }

  private static final long serialVersionUID = 4476213845611220718L;
}
