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

import static java.util.Objects.requireNonNull;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.proplogic.ast.Formula;
import net.hydromatic.proplogic.ast.SymbolTable;

/**
 * Truth table of a formula.
 *
 * <p>There is one row for each total interpretation of the formula's atoms,
 * in the order given by {@link Semantics#interpretations}: atoms sorted, the
 * first atom varying slowest, false before true. A formula with {@code n}
 * distinct atoms has 2<sup>n</sup> rows; a formula with no atoms has one row.
 */
public class TruthTable {
  public final Formula formula;
  public final ImmutableList<String> atoms;
  public final ImmutableList<Row> rows;

  private TruthTable(Formula formula, ImmutableList<String> atoms,
      ImmutableList<Row> rows) {
    this.formula = requireNonNull(formula);
    this.atoms = requireNonNull(atoms);
    this.rows = requireNonNull(rows);
  }

  /** Computes the truth table of a formula. */
  public static TruthTable of(Formula formula) {
    final ImmutableList<String> atoms = formula.sortedAtoms().asList();
    final ImmutableList.Builder<Row> rows = ImmutableList.builder();
    for (Interpretation interpretation : Semantics.interpretations(atoms)) {
      rows.add(
          new Row(interpretation,
              Evaluator.booleanValue(formula, interpretation)));
    }
    return new TruthTable(formula, atoms, rows.build());
  }

  /** Returns the atoms, sorted; one column per atom. */
  public ImmutableList<String> atoms() {
    return atoms;
  }

  /** Returns the rows, in binary-counting order. */
  public ImmutableList<Row> rows() {
    return rows;
  }

  /** Returns the number of rows. */
  public int size() {
    return rows.size();
  }

  /** Returns the value of the formula in each row. */
  public ImmutableList<Boolean> values() {
    final ImmutableList.Builder<Boolean> values = ImmutableList.builder();
    rows.forEach(row -> values.add(row.value));
    return values.build();
  }

  /** Returns whether the formula is true in every row. */
  public boolean isAllTrue() {
    return rows.stream().allMatch(row -> row.value);
  }

  /** Returns whether the formula is false in every row. */
  public boolean isAllFalse() {
    return rows.stream().noneMatch(row -> row.value);
  }

  @Override public String toString() {
    return describeTo(new StringBuilder(), SymbolTable.ASCII).toString();
  }

  /**
   * Writes this table as text, one line per row, with "T" and "F" for the
   * truth values. For example, the table for "P &amp; Q" is
   *
   * <blockquote><pre>
   * P | Q | P &amp; Q
   * --+---+------
   * F | F | F
   * F | T | F
   * T | F | F
   * T | T | T
   * </pre></blockquote>
   */
  public StringBuilder describeTo(StringBuilder buf, SymbolTable symbolTable) {
    final List<String> headings = new ArrayList<>();
    atoms.forEach(atom -> headings.add(symbolTable.atomName(atom)));
    headings.add(formula.unparse(symbolTable));

    line(buf, headings, ' ');
    final List<String> rules = new ArrayList<>();
    headings.forEach(heading -> rules.add(""));
    line(buf, headings, rules, '-', "-+-");
    for (Row row : rows) {
      final List<String> cells = new ArrayList<>();
      for (String atom : atoms) {
        cells.add(tf(row.interpretation.get(atom)));
      }
      cells.add(tf(row.value));
      line(buf, headings, cells, ' ', " | ");
    }
    return buf;
  }

  private static void line(StringBuilder buf, List<String> headings,
      char pad) {
    line(buf, headings, headings, pad, " | ");
  }

  private static void line(StringBuilder buf, List<String> headings,
      List<String> cells, char pad, String separator) {
    for (int i = 0; i < cells.size(); i++) {
      if (i > 0) {
        buf.append(separator);
      }
      final String cell = cells.get(i);
      if (i < cells.size() - 1) {
        buf.append(Strings.padEnd(cell, headings.get(i).length(), pad));
      } else if (pad == ' ') {
        buf.append(cell);
      } else {
        buf.append(Strings.padEnd(cell, headings.get(i).length(), pad));
      }
    }
    buf.append('\n');
  }

  private static String tf(Boolean b) {
    return b ? "T" : "F";
  }

  /** Row of a truth table. */
  public static class Row {
    public final Interpretation interpretation;
    public final boolean value;

    Row(Interpretation interpretation, boolean value) {
      this.interpretation = requireNonNull(interpretation);
      this.value = value;
    }

    @Override public String toString() {
      return interpretation + " => " + value;
    }
  }
}

// End TruthTable.java
