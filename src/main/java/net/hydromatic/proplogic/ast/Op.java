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
package net.hydromatic.proplogic.ast;

import com.google.common.collect.ImmutableList;

/** Sub-types of {@link Formula}. */
public enum Op {
  /** Boolean constant, "true" or "false". */
  CONSTANT(true),
  /** Propositional variable. */
  ATOM(true),

  NOT(8, 8),
  AND(6, 7),
  OR(4, 5),
  // IMPLIES, IFF and XOR share a precedence level. IMPLIES associates to the
  // right, IFF and XOR to the left; an IMPLIES on the left of any of them
  // needs parentheses.
  IMPLIES(2, 1),
  IFF(2, 3),
  XOR(2, 3);

  /** Connectives, in order of decreasing precedence. */
  public static final ImmutableList<Op> CONNECTIVES =
      ImmutableList.of(NOT, AND, OR, IMPLIES, IFF, XOR);

  /** Binary connectives. */
  public static final ImmutableList<Op> BINARY_CONNECTIVES =
      ImmutableList.of(AND, OR, IMPLIES, IFF, XOR);

  /** Left precedence. */
  public final int left;
  /** Right precedence. */
  public final int right;

  Op(boolean atom) {
    this(99, 99);
    assert atom;
  }

  Op(int left, int right) {
    this.left = left;
    this.right = right;
  }

  /** Returns whether this is a binary connective. */
  public boolean isBinary() {
    switch (this) {
      case AND:
      case OR:
      case IMPLIES:
      case IFF:
      case XOR:
        return true;
      default:
        return false;
    }
  }

  /** Returns whether this is a connective (not an atom or a constant). */
  public boolean isConnective() {
    return this == NOT || isBinary();
  }
}

// End Op.java
