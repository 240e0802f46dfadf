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

import java.util.Iterator;

/** Builds formulas. */
public enum FormulaBuilder {
  /**
   * The singleton instance of the formula builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  prop;

  /** Returns the constant "true". */
  public Formula.Constant trueLiteral() {
    return Formula.Constant.TRUE;
  }

  /** Returns the constant "false". */
  public Formula.Constant falseLiteral() {
    return Formula.Constant.FALSE;
  }

  /** Returns a constant with a given value. */
  public Formula.Constant constant(boolean value) {
    return value ? Formula.Constant.TRUE : Formula.Constant.FALSE;
  }

  /**
   * Creates an atom.
   *
   * @throws InvalidAtomNameException if the name is not valid
   * @see Formula.Atom#isValidName(String)
   */
  public Formula.Atom atom(String name) {
    if (!Formula.Atom.isValidName(requireNonNull(name, "name"))) {
      throw new InvalidAtomNameException(name);
    }
    return new Formula.Atom(name);
  }

  public Formula.Not not(Formula operand) {
    return new Formula.Not(requireNonNull(operand, "operand"));
  }

  public Formula.Binary and(Formula left, Formula right) {
    return binary(Op.AND, left, right);
  }

  public Formula.Binary or(Formula left, Formula right) {
    return binary(Op.OR, left, right);
  }

  public Formula.Binary implies(Formula left, Formula right) {
    return binary(Op.IMPLIES, left, right);
  }

  public Formula.Binary iff(Formula left, Formula right) {
    return binary(Op.IFF, left, right);
  }

  public Formula.Binary xor(Formula left, Formula right) {
    return binary(Op.XOR, left, right);
  }

  /** Creates a call to a binary connective. */
  public Formula.Binary binary(Op op, Formula left, Formula right) {
    return new Formula.Binary(
        op, requireNonNull(left, "left"), requireNonNull(right, "right"));
  }

  /**
   * Creates the conjunction of a list of formulas, nested to the left.
   * Returns "true" if the list is empty, and the sole element if the list
   * has one element.
   */
  public Formula andAll(Iterable<? extends Formula> formulas) {
    return fold(Op.AND, formulas, trueLiteral());
  }

  /**
   * Creates the disjunction of a list of formulas, nested to the left.
   * Returns "false" if the list is empty, and the sole element if the list
   * has one element.
   */
  public Formula orAll(Iterable<? extends Formula> formulas) {
    return fold(Op.OR, formulas, falseLiteral());
  }

  private Formula fold(Op op, Iterable<? extends Formula> formulas,
      Formula empty) {
    final Iterator<? extends Formula> iterator = formulas.iterator();
    if (!iterator.hasNext()) {
      return empty;
    }
    Formula formula = iterator.next();
    while (iterator.hasNext()) {
      formula = binary(op, formula, iterator.next());
    }
    return formula;
  }
}

// End FormulaBuilder.java
