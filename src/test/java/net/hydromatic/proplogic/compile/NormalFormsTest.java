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
package net.hydromatic.proplogic.compile;

import static net.hydromatic.proplogic.Matchers.isCnf;
import static net.hydromatic.proplogic.Matchers.isEquivalentTo;
import static net.hydromatic.proplogic.Pl.pl;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.proplogic.ast.Formula;
import net.hydromatic.proplogic.ast.Op;
import net.hydromatic.proplogic.parse.FormulaParser;
import org.junit.jupiter.api.Test;

/** Tests for {@link NormalForms}. */
public class NormalFormsTest {
  private static Formula parse(String s) {
    return FormulaParser.parse(s);
  }

  @Test void testExample() {
    final Formula cnf = NormalForms.toCnf(parse("P -> Q"));
    assertThat(cnf, hasToString("~P | Q"));
    assertThat(cnf, isEquivalentTo(parse("~P | Q")));
    assertThat(cnf, isCnf());
    for (Formula f : cnf.subformulas()) {
      assertThat(f.op == Op.IMPLIES, is(false));
    }
  }

  @Test void testSteps() {
    assertThat(NormalForms.eliminateEquivalences(parse("P <-> Q")),
        hasToString("P & Q | ~P & ~Q"));
    assertThat(NormalForms.eliminateEquivalences(parse("P ^ Q")),
        hasToString("~(P & Q | ~P & ~Q)"));
    assertThat(NormalForms.eliminateEquivalences(parse("P -> (Q <-> R)")),
        hasToString("P -> Q & R | ~Q & ~R"));
    assertThat(NormalForms.eliminateImplications(parse("P -> Q -> R")),
        hasToString("~P | (~Q | R)"));
    assertThat(NormalForms.eliminateImplications(parse("(P -> Q) -> R")),
        hasToString("~(~P | Q) | R"));
    assertThat(NormalForms.pushNegations(parse("~(~P | Q) | R")),
        hasToString("P & ~Q | R"));
    assertThat(NormalForms.pushNegations(parse("~(P & ~(Q | ~R))")),
        hasToString("~P | (Q | ~R)"));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> NormalForms.pushNegations(parse("~(P -> Q)")));
    assertThat(e.getMessage(),
        is("cannot push negation through IMPLIES; eliminate it first"));
  }

  @Test void testNnf() {
    pl("~(P & Q)").assertNnf("~P | ~Q");
    pl("~(P | ~Q)").assertNnf("~P & Q");
    pl("~(P -> Q)").assertNnf("P & ~Q");
    pl("~~P").assertNnf("P");
    pl("~~~P").assertNnf("~P");
    pl("~true | P").assertNnf("false | P");
    pl("P <-> Q").assertNnf("P & Q | ~P & ~Q");
    pl("P ^ Q").assertNnf("(~P | ~Q) & (P | Q)");
    pl("~(P <-> Q)").assertNnf("(~P | ~Q) & (P | Q)");
    pl("P").assertNnf("P");
  }

  @Test void testCnf() {
    pl("P | Q & R").assertCnf("(P | Q) & (P | R)");
    pl("P & Q | R & S")
        .assertCnf("(P | R) & (P | S) & ((Q | R) & (Q | S))");
    pl("P <-> Q")
        .assertCnf("(P | ~P) & (P | ~Q) & ((Q | ~P) & (Q | ~Q))");
    pl("~(P | Q) | R").assertCnf("(~P | R) & (~Q | R)");
    pl("P & Q").assertCnf("P & Q");
    pl("P").assertCnf("P");
    pl("true").assertCnf("true");
    pl("P -> false").assertCnf("~P | false");
  }

  @Test void testDnf() {
    pl("P & (Q | R)").assertDnf("P & Q | P & R");
    pl("(P | Q) & (R | S)")
        .assertDnf("P & R | P & S | (Q & R | Q & S)");
    pl("P ^ Q").assertDnf("~P & P | ~P & Q | (~Q & P | ~Q & Q)");
    pl("~(P & Q)").assertDnf("~P | ~Q");
    pl("P | Q").assertDnf("P | Q");
    pl("false").assertDnf("false");
  }

  /** No simplification happens after conversion. */
  @Test void testNotSimplified() {
    final Formula cnf = NormalForms.toCnf(parse("P | ~P"));
    assertThat(cnf, hasToString("P | ~P"));
    final Formula dnf = NormalForms.toDnf(parse("P & P"));
    assertThat(dnf, hasToString("P & P"));
  }

  @Test void testPredicates() {
    assertThat(NormalForms.isLiteral(parse("P")), is(true));
    assertThat(NormalForms.isLiteral(parse("~P")), is(true));
    assertThat(NormalForms.isLiteral(parse("true")), is(true));
    assertThat(NormalForms.isLiteral(parse("~~P")), is(false));
    assertThat(NormalForms.isNnf(parse("~P | Q & ~R")), is(true));
    assertThat(NormalForms.isNnf(parse("~(P & Q)")), is(false));
    assertThat(NormalForms.isNnf(parse("P -> Q")), is(false));
    assertThat(NormalForms.isNnf(parse("~true")), is(false));
    assertThat(NormalForms.isCnf(parse("(P | ~Q) & R")), is(true));
    assertThat(NormalForms.isCnf(parse("P | Q & R")), is(false));
    assertThat(NormalForms.isCnf(parse("P")), is(true));
    assertThat(NormalForms.isCnf(parse("P | Q")), is(true));
    assertThat(NormalForms.isDnf(parse("P | Q & R")), is(true));
    assertThat(NormalForms.isDnf(parse("(P | Q) & R")), is(false));
    assertThat(NormalForms.isDnf(parse("P & Q")), is(true));
    assertThat(NormalForms.isDnf(parse("P ^ Q")), is(false));
  }

  @Test void testClauses() {
    final Formula cnf = NormalForms.toCnf(parse("P <-> Q"));
    assertThat(NormalForms.clauses(cnf),
        hasToString("[[P, ~P], [P, ~Q], [Q, ~P], [Q, ~Q]]"));
    assertThat(NormalForms.clauses(parse("P")), hasToString("[[P]]"));
    assertThat(NormalForms.clauses(parse("P | ~Q | R")),
        hasToString("[[P, ~Q, R]]"));
    assertThat(NormalForms.terms(parse("P & Q | ~P & ~Q")),
        hasToString("[[P, Q], [~P, ~Q]]"));
    assertThat(NormalForms.terms(parse("true")), hasToString("[[true]]"));
    assertThrows(IllegalArgumentException.class,
        () -> NormalForms.clauses(parse("P | Q & R")));
    assertThrows(IllegalArgumentException.class,
        () -> NormalForms.terms(parse("P -> Q")));
  }

  /** The tracer sees each step of conversion. */
  @Test void testTracer() {
    final List<NormalForms.Step> steps = new ArrayList<>();
    final List<String> formulas = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnStep(Tracers.empty(),
            (step, formula) -> {
              steps.add(step);
              formulas.add(formula.toString());
            });
    NormalForms.toCnf(parse("~(P <-> Q)"), tracer);
    assertThat(ImmutableList.copyOf(steps),
        is(
            ImmutableList.of(NormalForms.Step.ELIMINATE_EQUIVALENCES,
                NormalForms.Step.ELIMINATE_IMPLICATIONS,
                NormalForms.Step.PUSH_NEGATIONS,
                NormalForms.Step.DISTRIBUTE)));
    assertThat(formulas,
        hasToString("[~(P & Q | ~P & ~Q), ~(P & Q | ~P & ~Q), "
            + "(~P | ~Q) & (P | Q), (~P | ~Q) & (P | Q)]"));

    steps.clear();
    NormalForms.toNnf(parse("P"), tracer);
    assertThat(steps.size(), is(3));
    assertThat(NormalForms.Step.PUSH_NEGATIONS.camelName,
        is("pushNegations"));
  }
}

// End NormalFormsTest.java
