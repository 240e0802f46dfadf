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

import static java.util.Objects.requireNonNull;

/** Context for writing a formula out as a string. */
public class FormulaWriter {
  private final StringBuilder b = new StringBuilder();
  private final SymbolTable symbolTable;

  /** Creates a FormulaWriter. */
  public FormulaWriter(SymbolTable symbolTable) {
    this.symbolTable = requireNonNull(symbolTable);
  }

  /** Appends a string to the output. */
  public FormulaWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends the name of an atom. */
  public FormulaWriter id(String name) {
    return append(symbolTable.atomName(name));
  }

  /** Appends a constant. */
  public FormulaWriter constant(boolean value) {
    return append(symbolTable.constantName(value));
  }

  /** Appends a call to a prefix operator. */
  public FormulaWriter prefix(int left, Op op, Formula a, int right) {
    if (left > op.left || op.right < right) {
      return append("(").prefix(0, op, a, 0).append(")");
    }
    final String symbol = symbolTable.symbol(op);
    append(symbol);
    if (!symbol.isEmpty()
        && Character.isLetterOrDigit(symbol.charAt(symbol.length() - 1))) {
      // A word such as "not" must be separated from its operand.
      append(" ");
    }
    a.unparse(this, op.right, right);
    return this;
  }

  /** Appends a call to an infix operator. */
  public FormulaWriter infix(int left, Formula a0, Op op, Formula a1,
      int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    a0.unparse(this, left, op.left);
    append(" ").append(symbolTable.symbol(op)).append(" ");
    a1.unparse(this, op.right, right);
    return this;
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End FormulaWriter.java
