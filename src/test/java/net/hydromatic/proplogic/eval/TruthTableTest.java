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

import static net.hydromatic.proplogic.Pl.pl;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import net.hydromatic.proplogic.ast.Formula;
import net.hydromatic.proplogic.ast.SymbolTable;
import net.hydromatic.proplogic.parse.FormulaParser;
import org.junit.jupiter.api.Test;

/** Tests for {@link TruthTable}. */
public class TruthTableTest {
  @Test void testExcludedMiddle() {
    final TruthTable table = TruthTable.of(FormulaParser.parse("P | ~P"));
    assertThat(table.size(), is(2));
    assertThat(table.rows().size(), is(2));
    assertThat(table.values(), is(ImmutableList.of(true, true)));
    assertThat(table.isAllTrue(), is(true));
    assertThat(table.isAllFalse(), is(false));
    assertThat(Semantics.isTautology(table.formula), is(true));
  }

  @Test void testToString() {
    final String expected = "P | Q | P & Q\n"
        + "--+---+------\n"
        + "F | F | F\n"
        + "F | T | F\n"
        + "T | F | F\n"
        + "T | T | T\n";
    pl("P & Q").assertTable(expected);

    final String expected2 = "P | rain | P -> rain\n"
        + "--+------+----------\n"
        + "F | F    | T\n"
        + "F | T    | T\n"
        + "T | F    | F\n"
        + "T | T    | T\n";
    pl("P -> rain").assertTable(expected2);
  }

  @Test void testUnicode() {
    final TruthTable table = TruthTable.of(FormulaParser.parse("~P"));
    final String expected = "P | ¬P\n"
        + "--+---\n"
        + "F | T\n"
        + "T | F\n";
    assertThat(table.describeTo(new StringBuilder(), SymbolTable.UNICODE)
            .toString(),
        is(expected));
  }

  /** A formula with no atoms has one row. */
  @Test void testConstant() {
    final TruthTable table =
        TruthTable.of(FormulaParser.parse("true & ~false"));
    assertThat(table.atoms().isEmpty(), is(true));
    assertThat(table.size(), is(1));
    assertThat(table.values(), is(ImmutableList.of(true)));
    pl("false").assertTable("false\n-----\nF\n");
  }

  /** Atoms are sorted; the first varies slowest. */
  @Test void testOrder() {
    final TruthTable table = TruthTable.of(FormulaParser.parse("Q & ~P"));
    assertThat(table.atoms(), is(ImmutableList.of("P", "Q")));
    assertThat(table.values(),
        is(ImmutableList.of(false, true, false, false)));
    assertThat(table.rows().get(1).interpretation.get("P"), is(false));
    assertThat(table.rows().get(1).interpretation.get("Q"), is(true));
  }

  /** The table has 2<sup>n</sup> rows, each binding exactly the atoms. */
  @Test void testRows() {
    final Formula f = FormulaParser.parse("(A -> B) ^ (C <-> A)");
    final TruthTable table = TruthTable.of(f);
    assertThat(table.size(), is(8));
    for (TruthTable.Row row : table.rows) {
      assertThat(row.interpretation.names(), is(f.sortedAtoms()));
      assertThat(Evaluator.booleanValue(f, row.interpretation),
          is(row.value));
    }
  }
}

// End TruthTableTest.java
