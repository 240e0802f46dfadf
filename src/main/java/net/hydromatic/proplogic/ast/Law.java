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

import static net.hydromatic.proplogic.ast.FormulaBuilder.prop;

import java.util.function.Function;

/**
 * Laws of propositional logic.
 *
 * <p>Each law is a biconditional between two formulas over the atoms {@code
 * phi}, {@code psi} and {@code chi}, and is a tautology. Substitute formulas
 * for the atoms to obtain instances of the law.
 */
public enum Law {
  DOUBLE_NEGATION(v -> prop.iff(prop.not(prop.not(v.phi)), v.phi)),
  IDEMPOTENT_AND(v -> prop.iff(prop.and(v.phi, v.phi), v.phi)),
  IDEMPOTENT_OR(v -> prop.iff(prop.or(v.phi, v.phi), v.phi)),
  COMMUTATIVE_AND(
      v -> prop.iff(prop.and(v.phi, v.psi), prop.and(v.psi, v.phi))),
  COMMUTATIVE_OR(v -> prop.iff(prop.or(v.phi, v.psi), prop.or(v.psi, v.phi))),
  ASSOCIATIVE_AND(
      v ->
          prop.iff(
              prop.and(prop.and(v.phi, v.psi), v.chi),
              prop.and(v.phi, prop.and(v.psi, v.chi)))),
  ASSOCIATIVE_OR(
      v ->
          prop.iff(
              prop.or(prop.or(v.phi, v.psi), v.chi),
              prop.or(v.phi, prop.or(v.psi, v.chi)))),
  /** Conjunction distributes over disjunction. */
  DISTRIBUTIVE_AND(
      v ->
          prop.iff(
              prop.and(v.phi, prop.or(v.psi, v.chi)),
              prop.or(prop.and(v.phi, v.psi), prop.and(v.phi, v.chi)))),
  /** Disjunction distributes over conjunction. */
  DISTRIBUTIVE_OR(
      v ->
          prop.iff(
              prop.or(v.phi, prop.and(v.psi, v.chi)),
              prop.and(prop.or(v.phi, v.psi), prop.or(v.phi, v.chi)))),
  DE_MORGAN_AND(
      v ->
          prop.iff(
              prop.not(prop.and(v.phi, v.psi)),
              prop.or(prop.not(v.phi), prop.not(v.psi)))),
  DE_MORGAN_OR(
      v ->
          prop.iff(
              prop.not(prop.or(v.phi, v.psi)),
              prop.and(prop.not(v.phi), prop.not(v.psi)))),
  ABSORPTION_AND(
      v -> prop.iff(prop.and(v.phi, prop.or(v.phi, v.psi)), v.phi)),
  ABSORPTION_OR(v -> prop.iff(prop.or(v.phi, prop.and(v.phi, v.psi)), v.phi)),
  IMPLICATION(
      v ->
          prop.iff(
              prop.implies(v.phi, v.psi), prop.or(prop.not(v.phi), v.psi)));

  /** The law, a biconditional. */
  public final Formula.Binary formula;

  Law(Function<Vars, Formula.Binary> fn) {
    this.formula = fn.apply(Vars.INSTANCE);
  }

  /** Returns the left-hand side of the law. */
  public Formula lhs() {
    return formula.left;
  }

  /** Returns the right-hand side of the law. */
  public Formula rhs() {
    return formula.right;
  }

  /** Atoms that occur in laws. */
  private static class Vars {
    static final Vars INSTANCE = new Vars();

    final Formula.Atom phi = prop.atom("phi");
    final Formula.Atom psi = prop.atom("psi");
    final Formula.Atom chi = prop.atom("chi");
  }
}

// End Law.java
