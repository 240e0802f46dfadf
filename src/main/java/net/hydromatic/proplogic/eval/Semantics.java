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

import static net.hydromatic.proplogic.ast.FormulaBuilder.prop;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import net.hydromatic.proplogic.ast.Formula;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Decides semantic properties of formulas: whether they are tautologies,
 * contradictions, satisfiable, falsifiable, or equivalent to each other.
 *
 * <p>Each procedure enumerates all interpretations over the atoms of the
 * formula, stopping as soon as the answer is known. The cost is exponential
 * in the number of distinct atoms; callers that need to bound it should check
 * the number of atoms first.
 */
public class Semantics {
  private static final ImmutableList<Boolean> FALSE_TRUE =
      ImmutableList.of(false, true);

  private Semantics() {}

  /**
   * Returns all total interpretations over a collection of atoms.
   *
   * <p>The atoms are sorted. The interpretations are in binary counting
   * order, with false before true and the first atom varying slowest. If there
   * are no atoms, the result is a single, empty, interpretation.
   */
  public static List<Interpretation> interpretations(
      Collection<String> atoms) {
    final ImmutableList<String> names =
        ImmutableSortedSet.copyOf(atoms).asList();
    final List<List<Boolean>> valueLists = new ArrayList<>();
    for (int i = 0; i < names.size(); i++) {
      valueLists.add(FALSE_TRUE);
    }
    return Lists.transform(Lists.cartesianProduct(valueLists),
        values -> {
          final Interpretation.Builder b = Interpretation.builder();
          for (int i = 0; i < names.size(); i++) {
            b.put(names.get(i), values.get(i));
          }
          return b.build();
        });
  }

  /** Returns whether a formula is true under every interpretation. */
  public static boolean isTautology(Formula formula) {
    return !exists(formula, false);
  }

  /** Returns whether a formula is false under every interpretation. */
  public static boolean isContradiction(Formula formula) {
    return !exists(formula, true);
  }

  /** Returns whether a formula is true under at least one interpretation. */
  public static boolean isSatisfiable(Formula formula) {
    return exists(formula, true);
  }

  /** Returns whether a formula is false under at least one
   * interpretation. */
  public static boolean isFalsifiable(Formula formula) {
    return exists(formula, false);
  }

  /**
   * Returns whether two formulas have the same value under every
   * interpretation of the atoms of both.
   */
  public static boolean isEquivalent(Formula formula0, Formula formula1) {
    return isTautology(prop.iff(formula0, formula1));
  }

  /**
   * Finds an interpretation under which a formula is true, or null if there
   * is none.
   */
  public static @Nullable Interpretation solve(Formula formula) {
    for (Interpretation interpretation
        : interpretations(formula.atoms())) {
      if (Evaluator.booleanValue(formula, interpretation)) {
        return interpretation;
      }
    }
    return null;
  }

  /** Returns all interpretations under which a formula is true. */
  public static ImmutableList<Interpretation> satisfyingInterpretations(
      Formula formula) {
    return filter(formula, true);
  }

  /** Returns all interpretations under which a formula is false. */
  public static ImmutableList<Interpretation> falsifyingInterpretations(
      Formula formula) {
    return filter(formula, false);
  }

  private static boolean exists(Formula formula, boolean value) {
    for (Interpretation interpretation
        : interpretations(formula.atoms())) {
      if (Evaluator.booleanValue(formula, interpretation) == value) {
        return true;
      }
    }
    return false;
  }

  private static ImmutableList<Interpretation> filter(Formula formula,
      boolean value) {
    final ImmutableList.Builder<Interpretation> list = ImmutableList.builder();
    for (Interpretation interpretation
        : interpretations(formula.atoms())) {
      if (Evaluator.booleanValue(formula, interpretation) == value) {
        list.add(interpretation);
      }
    }
    return list.build();
  }
}

// End Semantics.java
