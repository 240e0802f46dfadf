/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.proplogic.parse;

import static java.util.Objects.requireNonNull;

import net.hydromatic.proplogic.ast.Pos;

/** Exception caused by a parse error. */
public class PropParseException extends RuntimeException {
  private final Pos pos;
  private final String reason;

  PropParseException(String reason, Pos pos) {
    super(reason + " at " + pos);
    this.reason = requireNonNull(reason);
    this.pos = requireNonNull(pos);
  }

  /** Returns the position of the error. */
  public Pos pos() {
    return pos;
  }

  /** Returns the offset of the first character of the error. */
  public int offset() {
    return pos.startOffset;
  }

  /** Returns the reason for the error, without the position. */
  public String reason() {
    return reason;
  }

  /** Appends a description of this error, such as "1.5: unknown character
   * '$'", to a builder. */
  public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf).append(": ").append(reason);
  }
}

// End PropParseException.java
