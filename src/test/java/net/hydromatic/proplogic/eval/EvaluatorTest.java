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
package net.hydromatic.proplogic.eval;

import static net.hydromatic.proplogic.Matchers.isFormula;
import static net.hydromatic.proplogic.Pl.pl;
import static net.hydromatic.proplogic.ast.FormulaBuilder.prop;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import net.hydromatic.proplogic.ast.Formula;
import net.hydromatic.proplogic.ast.Op;
import net.hydromatic.proplogic.parse.FormulaParser;
import org.junit.jupiter.api.Test;

/** Tests for {@link Evaluator}. */
public class EvaluatorTest {
  /** Evaluates a formula under a total interpretation given as a string
   * of "T" and "F", one per atom in sorted order. */
  private static boolean eval(String formula, String values) {
    final Formula f = FormulaParser.parse(formula);
    final Interpretation.Builder b = Interpretation.builder();
    int i = 0;
    for (String atom : f.sortedAtoms()) {
      b.put(atom, values.charAt(i++) == 'T');
    }
    return Evaluator.booleanValue(f, b.build());
  }

  @Test void testConjunction() {
    assertThat(eval("P & Q", "TT"), is(true));
    assertThat(eval("P & Q", "TF"), is(false));
    assertThat(eval("P & Q", "FT"), is(false));
    assertThat(eval("P & Q", "FF"), is(false));
  }

  @Test void testDisjunction() {
    assertThat(eval("P | Q", "TT"), is(true));
    assertThat(eval("P | Q", "TF"), is(true));
    assertThat(eval("P | Q", "FT"), is(true));
    assertThat(eval("P | Q", "FF"), is(false));
  }

  @Test void testNegation() {
    assertThat(eval("~P", "T"), is(false));
    assertThat(eval("~P", "F"), is(true));
    assertThat(eval("~~P", "F"), is(false));
  }

  @Test void testImplication() {
    assertThat(eval("P -> Q", "TT"), is(true));
    assertThat(eval("P -> Q", "TF"), is(false));
    assertThat(eval("P -> Q", "FT"), is(true));
    assertThat(eval("P -> Q", "FF"), is(true));
  }

  @Test void testBiconditional() {
    assertThat(eval("P <-> Q", "TT"), is(true));
    assertThat(eval("P <-> Q", "TF"), is(false));
    assertThat(eval("P <-> Q", "FT"), is(false));
    assertThat(eval("P <-> Q", "FF"), is(true));
  }

  @Test void testExclusiveOr() {
    assertThat(eval("P ^ Q", "TT"), is(false));
    assertThat(eval("P ^ Q", "TF"), is(true));
    assertThat(eval("P ^ Q", "FT"), is(true));
    assertThat(eval("P ^ Q", "FF"), is(false));
  }

  @Test void testConstants() {
    assertThat(eval("true", ""), is(true));
    assertThat(eval("~true | false", ""), is(false));
    assertThat(eval("false -> false", ""), is(true));
  }

  @Test void testComplexFormulas() {
    final String f1 = "(P & Q | R) -> (S <-> ~T)";
    assertThat(eval(f1, "TFTFT"), is(true));
    assertThat(eval(f1, "FTFTF"), is(true));
    assertThat(eval(f1, "TTFTF"), is(true));
    assertThat(eval(f1, "TTFTT"), is(false));

    final String f2 = "~(P & (Q | R)) | S & T";
    assertThat(eval(f2, "TTFFT"), is(false));
    assertThat(eval(f2, "FFTTF"), is(true));
    assertThat(eval(f2, "TFTTF"), is(false));

    final String f3 = "P & Q & R | ~P & ~Q & ~R";
    assertThat(eval(f3, "TTT"), is(true));
    assertThat(eval(f3, "FFF"), is(true));
    assertThat(eval(f3, "TFT"), is(false));

    final String f4 =
        "(((P -> Q) -> (Q -> R)) -> (R -> S)) -> (S -> T)";
    assertThat(eval(f4, "TTTTT"), is(true));
    assertThat(eval(f4, "FTFTF"), is(false));
    assertThat(eval(f4, "TFTFT"), is(true));
  }

  @Test void testExample() {
    final Formula f = FormulaParser.parse("P & (Q -> R)");
    final Interpretation i =
        Interpretation.builder()
            .put("P", true)
            .put("Q", false)
            .put("R", true)
            .build();
    assertThat(Evaluator.evaluate(f, i), isFormula(prop.trueLiteral()));
    assertThat(Evaluator.booleanValue(f, i), is(true));
    assertThat(Evaluator.isTotal(f, i), is(true));
    assertThat(Evaluator.isTotal(f, Interpretation.of("P", true)), is(false));
  }

  /** If some atoms are unbound, the result is a residual formula. */
  @Test void testPartial() {
    final Interpretation pTrue = Interpretation.of("P", true);
    final Interpretation pFalse = Interpretation.of("P", false);
    final Interpretation qFalse = Interpretation.of("Q", false);
    pl("P & Q").assertEval(pTrue, "Q");
    pl("P & Q").assertEval(pFalse, "false");
    pl("Q & P").assertEval(pTrue, "Q");
    pl("Q & P").assertEval(pFalse, "false");
    pl("P | Q").assertEval(pTrue, "true");
    pl("P | Q").assertEval(pFalse, "Q");
    pl("P -> Q").assertEval(pTrue, "Q");
    pl("P -> Q").assertEval(pFalse, "true");
    pl("P -> Q").assertEval(qFalse, "~P");
    pl("Q -> P").assertEval(pTrue, "true");
    pl("P <-> Q").assertEval(pTrue, "Q");
    pl("P <-> Q").assertEval(qFalse, "~P");
    pl("P ^ Q").assertEval(pTrue, "~Q");
    pl("P ^ Q").assertEval(qFalse, "P");
    pl("~P & R").assertEval(qFalse, "~P & R");
    pl("(P & Q | R) -> S").assertEval(pTrue, "Q | R -> S");
    pl("~P ^ Q").assertEval(qFalse, "~P");
    pl("~P <-> Q").assertEval(qFalse, "P");
    pl("R").assertEval(Interpretation.empty(), "R");
  }

  /** The right operand is not evaluated if the left operand decides the
   * result. Here, evaluating it would overflow the stack. */
  @Test void testShortCircuit() {
    Formula deep = prop.atom("X");
    for (int i = 0; i < 200_000; i++) {
      deep = prop.not(deep);
    }
    final Interpretation empty = Interpretation.empty();
    assertThat(Evaluator.evaluate(prop.and(prop.falseLiteral(), deep), empty),
        isFormula(prop.falseLiteral()));
    assertThat(Evaluator.evaluate(prop.or(prop.trueLiteral(), deep), empty),
        isFormula(prop.trueLiteral()));
    assertThat(
        Evaluator.evaluate(prop.implies(prop.falseLiteral(), deep), empty),
        isFormula(prop.trueLiteral()));
    final Interpretation pFalse = Interpretation.of("P", false);
    assertThat(
        Evaluator.booleanValue(prop.and(prop.atom("P"), deep), pFalse),
        is(false));
  }

  @Test void testUnbound() {
    final Formula f = FormulaParser.parse("P & Q");
    final UnboundAtomException e =
        assertThrows(UnboundAtomException.class,
            () -> Evaluator.booleanValue(f, Interpretation.of("P", true)));
    assertThat(e.getMessage(), is("unbound atom Q"));
    assertThat(e.atoms(), is(ImmutableSet.of("Q")));
    assertThat(e.residual(), hasToString("Q"));

    final UnboundAtomException e2 =
        assertThrows(UnboundAtomException.class,
            () -> Evaluator.booleanValue(FormulaParser.parse("R | Q & P"),
                Interpretation.empty()));
    assertThat(e2.getMessage(), is("unbound atoms R, Q, P"));

    // An unbound atom whose value does not matter is not an error
    assertThat(
        Evaluator.booleanValue(FormulaParser.parse("P | Q"),
            Interpretation.of("P", true)),
        is(true));
  }

  @Test void testFold() {
    final Formula p = prop.atom("P");
    assertThat(Evaluator.fold(Op.AND, p, prop.trueLiteral()), is(p));
    assertThat(Evaluator.fold(Op.OR, p, prop.trueLiteral()),
        isFormula(prop.trueLiteral()));
    assertThat(Evaluator.fold(Op.IMPLIES, prop.trueLiteral(), p), is(p));
    assertThat(Evaluator.fold(Op.XOR, prop.not(p), prop.trueLiteral()),
        is(p));
    assertThat(Evaluator.fold(Op.IFF, prop.falseLiteral(), p),
        isFormula(prop.not(p)));
    assertThat(Evaluator.fold(Op.AND, p, p), nullValue());
    assertThat(Evaluator.negate(prop.not(p)), is(p));
    assertThat(Evaluator.negate(prop.falseLiteral()),
        isFormula(prop.trueLiteral()));
    assertThat(Evaluator.negate(p), isFormula(prop.not(p)));
  }

  @Test void testInterpretation() {
    final Interpretation i = Interpretation.of("P", true, "Q", false);
    assertThat(i.get("P"), is(true));
    assertThat(i.get("Q"), is(false));
    assertThat(i.get("R"), nullValue());
    assertThat(i.isBound("Q"), is(true));
    assertThat(i.isBound("R"), is(false));
    assertThat(i.size(), is(2));
    assertThat(i, hasToString("{P=true, Q=false}"));
    assertThat(i.with("R", true).names(), is(ImmutableSet.of("P", "Q", "R")));
    assertThat(i.with("P", false).get("P"), is(false));
    assertThat(i.get("P"), is(true));
    assertThat(Interpretation.of(ImmutableMap.of("P", true, "Q", false)),
        is(i));
    assertThat(Interpretation.empty().size(), is(0));
    assertThat(
        Interpretation.of(ImmutableMap.of()), is(Interpretation.empty()));
    assertThat(i.covers(FormulaParser.parse("P -> Q")), is(true));
    assertThat(i.covers(FormulaParser.parse("P -> R")), is(false));
    assertThrows(IllegalArgumentException.class,
        () -> Interpretation.of("1P", true));
    assertThrows(IllegalArgumentException.class,
        () -> Interpretation.of(ImmutableMap.of("P Q", true)));
  }
}

// End EvaluatorTest.java
