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
package net.hydromatic.proplogic;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.proplogic.Matchers.isCnf;
import static net.hydromatic.proplogic.Matchers.isDnf;
import static net.hydromatic.proplogic.Matchers.isEquivalentTo;
import static net.hydromatic.proplogic.Matchers.isNnf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.fail;

import com.google.common.collect.ImmutableList;
import net.hydromatic.proplogic.ast.Formula;
import net.hydromatic.proplogic.ast.Pos;
import net.hydromatic.proplogic.compile.NormalForms;
import net.hydromatic.proplogic.compile.Simplifier;
import net.hydromatic.proplogic.eval.Evaluator;
import net.hydromatic.proplogic.eval.Interpretation;
import net.hydromatic.proplogic.eval.Semantics;
import net.hydromatic.proplogic.eval.TruthTable;
import net.hydromatic.proplogic.parse.FormulaParser;
import net.hydromatic.proplogic.parse.PropParseException;
import net.hydromatic.proplogic.parse.Syntax;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Fluent test helper. */
public class Pl {
  private final String text;
  private final @Nullable Pos pos;
  private final Syntax syntax;

  private Pl(String text, @Nullable Pos pos, Syntax syntax) {
    this.text = requireNonNull(text);
    this.pos = pos;
    this.syntax = requireNonNull(syntax);
  }

  /** Creates a {@code Pl}. */
  public static Pl pl(String text) {
    return new Pl(text, null, Syntax.DEFAULT);
  }

  /**
   * Creates a {@code Pl} containing an error position delimited by '$'. For
   * example, in "P &amp; $)$", the error is at the ")".
   */
  public static Pl plE(String text) {
    final int i0 = text.indexOf('$');
    final int i1 = text.indexOf('$', i0 + 1);
    if (i0 < 0 || i1 < 0) {
      throw new IllegalArgumentException("expected two '$' in " + text);
    }
    final String text2 =
        text.substring(0, i0) + text.substring(i0 + 1, i1)
            + text.substring(i1 + 1);
    return new Pl(text2, Pos.of(text2, i0, i1 - 1), Syntax.DEFAULT);
  }

  /** Returns a copy of this fixture that parses using a given syntax. */
  public Pl withSyntax(Syntax syntax) {
    return new Pl(text, pos, syntax);
  }

  /** Parses the text. */
  public Formula formula() {
    return new FormulaParser(syntax).parseFormula(text);
  }

  /** Checks that the text parses to a formula that prints as expected. */
  public Pl assertParse(String expected) {
    final Formula formula = formula();
    assertThat(formula, hasToString(expected));
    // What we print, we can read back.
    assertThat(FormulaParser.parse(formula.toString()), is(formula));
    return this;
  }

  /** Checks that the text parses and prints unchanged. */
  public Pl assertParseSame() {
    return assertParse(text);
  }

  /** Checks that parsing fails with a given reason at the position marked
   * by '$'. */
  public Pl assertParseThrows(String reason) {
    if (pos == null) {
      throw new IllegalStateException("use plE to specify a position");
    }
    try {
      final Formula formula = formula();
      fail("expected error, got " + formula);
    } catch (PropParseException e) {
      assertThat(e.reason(), is(reason));
      assertThat(e.pos(), is(pos));
      assertThat(e.offset(), is(pos.startOffset));
    }
    return this;
  }

  /** Checks the atoms of the formula, in order of first occurrence. */
  public Pl assertAtoms(String... names) {
    assertThat(formula().atoms().asList(), is(ImmutableList.copyOf(names)));
    return this;
  }

  /** Checks the result of evaluating under an interpretation. */
  public Pl assertEval(Interpretation interpretation, String expected) {
    assertThat(Evaluator.evaluate(formula(), interpretation),
        hasToString(expected));
    return this;
  }

  /**
   * Checks the result of simplification, and that the result is equivalent
   * to the original and cannot be simplified further.
   */
  public Pl assertSimplify(String expected) {
    final Formula formula = formula();
    final Formula simplified = Simplifier.simplify(formula);
    assertThat(simplified, hasToString(expected));
    assertThat(simplified, isEquivalentTo(formula));
    assertThat(Simplifier.simplify(simplified), is(simplified));
    return this;
  }

  /** Checks the negation normal form of the formula. */
  public Pl assertNnf(String expected) {
    final Formula formula = formula();
    final Formula nnf = NormalForms.toNnf(formula);
    assertThat(nnf, hasToString(expected));
    assertThat(nnf, isNnf());
    assertThat(nnf, isEquivalentTo(formula));
    return this;
  }

  /** Checks the conjunctive normal form of the formula. */
  public Pl assertCnf(String expected) {
    final Formula formula = formula();
    final Formula cnf = NormalForms.toCnf(formula);
    assertThat(cnf, hasToString(expected));
    assertThat(cnf, isCnf());
    assertThat(cnf, isEquivalentTo(formula));
    return this;
  }

  /** Checks the disjunctive normal form of the formula. */
  public Pl assertDnf(String expected) {
    final Formula formula = formula();
    final Formula dnf = NormalForms.toDnf(formula);
    assertThat(dnf, hasToString(expected));
    assertThat(dnf, isDnf());
    assertThat(dnf, isEquivalentTo(formula));
    return this;
  }

  /**
   * Checks whether the formula is a tautology and whether it is satisfiable,
   * and that the other decision procedures agree.
   */
  public Pl assertSemantics(boolean tautology, boolean satisfiable) {
    final Formula formula = formula();
    assertThat(Semantics.isTautology(formula), is(tautology));
    assertThat(Semantics.isSatisfiable(formula), is(satisfiable));
    assertThat(Semantics.isContradiction(formula), is(!satisfiable));
    assertThat(Semantics.isFalsifiable(formula), is(!tautology));
    final TruthTable table = TruthTable.of(formula);
    assertThat(table.isAllTrue(), is(tautology));
    assertThat(table.isAllFalse(), is(!satisfiable));
    return this;
  }

  /** Checks the text rendering of the truth table. */
  public Pl assertTable(String expected) {
    assertThat(TruthTable.of(formula()), hasToString(expected));
    return this;
  }
}

// End Pl.java
