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

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.proplogic.ast.FormulaBuilder.prop;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableList;
import net.hydromatic.proplogic.ast.Formula;
import net.hydromatic.proplogic.ast.Op;
import net.hydromatic.proplogic.ast.Shuttle;

/**
 * Converts formulas to negation, conjunctive and disjunctive normal form.
 *
 * <p>Conversion runs in steps: equivalences ({@code <->} and {@code ^}) are
 * eliminated, then implications, then negations are pushed down to the atoms
 * (giving negation normal form), then one connective is distributed over the
 * other. The result is equivalent to the input but is not simplified, and
 * may be exponentially larger.
 *
 * <p>Constants are treated as literals. A constant that survives conversion
 * occupies the position of a literal in the result.
 */
public abstract class NormalForms {
  private NormalForms() {}

  /** Converts a formula to negation normal form. */
  public static Formula toNnf(Formula formula) {
    return toNnf(formula, Tracers.empty());
  }

  /** Converts a formula to negation normal form, reporting each step. */
  public static Formula toNnf(Formula formula, Tracer tracer) {
    final Formula f1 = eliminateEquivalences(formula);
    tracer.onStep(Step.ELIMINATE_EQUIVALENCES, f1);
    final Formula f2 = eliminateImplications(f1);
    tracer.onStep(Step.ELIMINATE_IMPLICATIONS, f2);
    final Formula f3 = pushNegations(f2);
    tracer.onStep(Step.PUSH_NEGATIONS, f3);
    return f3;
  }

  /**
   * Converts a formula to conjunctive normal form, a conjunction of clauses
   * each of which is a disjunction of literals.
   */
  public static Formula toCnf(Formula formula) {
    return toCnf(formula, Tracers.empty());
  }

  /** Converts a formula to conjunctive normal form, reporting each step. */
  public static Formula toCnf(Formula formula, Tracer tracer) {
    final Formula cnf = distribute(toNnf(formula, tracer), Op.AND, Op.OR);
    tracer.onStep(Step.DISTRIBUTE, cnf);
    return cnf;
  }

  /**
   * Converts a formula to disjunctive normal form, a disjunction of terms
   * each of which is a conjunction of literals.
   */
  public static Formula toDnf(Formula formula) {
    return toDnf(formula, Tracers.empty());
  }

  /** Converts a formula to disjunctive normal form, reporting each step. */
  public static Formula toDnf(Formula formula, Tracer tracer) {
    final Formula dnf = distribute(toNnf(formula, tracer), Op.OR, Op.AND);
    tracer.onStep(Step.DISTRIBUTE, dnf);
    return dnf;
  }

  /**
   * Replaces {@code a <-> b} with {@code (a & b) | (~a & ~b)}, and
   * {@code a ^ b} with {@code ~((a & b) | (~a & ~b))}.
   */
  public static Formula eliminateEquivalences(Formula formula) {
    return formula.accept(
        new Shuttle() {
          @Override protected Formula visit(Formula.Binary binary) {
            final Formula f = super.visit(binary);
            switch (f.op) {
              case IFF:
                return bothOrNeither((Formula.Binary) f);
              case XOR:
                return prop.not(bothOrNeither((Formula.Binary) f));
              default:
                return f;
            }
          }
        });
  }

  private static Formula bothOrNeither(Formula.Binary binary) {
    return prop.or(prop.and(binary.left, binary.right),
        prop.and(prop.not(binary.left), prop.not(binary.right)));
  }

  /** Replaces {@code a -> b} with {@code ~a | b}. */
  public static Formula eliminateImplications(Formula formula) {
    return formula.accept(
        new Shuttle() {
          @Override protected Formula visit(Formula.Binary binary) {
            final Formula f = super.visit(binary);
            if (f.op == Op.IMPLIES) {
              final Formula.Binary implies = (Formula.Binary) f;
              return prop.or(prop.not(implies.left), implies.right);
            }
            return f;
          }
        });
  }

  /**
   * Pushes negations down to the atoms, using De Morgan's laws and removing
   * double negations. A negated constant becomes the opposite constant.
   *
   * @throws IllegalArgumentException if the formula contains a connective
   *     other than {@code ~}, {@code &} and {@code |}
   */
  public static Formula pushNegations(Formula formula) {
    return push(formula, false);
  }

  private static Formula push(Formula formula, boolean negated) {
    switch (formula.op) {
      case CONSTANT:
        return negated ? ((Formula.Constant) formula).negate() : formula;
      case ATOM:
        return negated ? prop.not(formula) : formula;
      case NOT:
        return push(((Formula.Not) formula).operand, !negated);
      case AND:
      case OR:
        final Formula.Binary binary = (Formula.Binary) formula;
        final Formula left = push(binary.left, negated);
        final Formula right = push(binary.right, negated);
        if (!negated) {
          return binary.copy(left, right);
        }
        return prop.binary(binary.op == Op.AND ? Op.OR : Op.AND, left, right);
      default:
        throw new IllegalArgumentException("cannot push negation through "
            + formula.op + "; eliminate it first");
    }
  }

  /**
   * Distributes {@code inner} over {@code outer} in a formula in negation
   * normal form. For conjunctive normal form, {@code outer} is AND and
   * {@code inner} is OR.
   */
  private static Formula distribute(Formula nnf, Op outer, Op inner) {
    if (nnf.op == outer) {
      final Formula.Binary binary = (Formula.Binary) nnf;
      return binary.copy(distribute(binary.left, outer, inner),
          distribute(binary.right, outer, inner));
    }
    if (nnf.op == inner) {
      final Formula.Binary binary = (Formula.Binary) nnf;
      return distribute2(distribute(binary.left, outer, inner),
          distribute(binary.right, outer, inner), outer, inner);
    }
    return nnf;
  }

  /**
   * Combines two formulas, each already in normal form, with {@code inner},
   * distributing over any {@code outer} at the top of either.
   */
  private static Formula distribute2(Formula a, Formula b, Op outer,
      Op inner) {
    if (a.op == outer) {
      final Formula.Binary binary = (Formula.Binary) a;
      return prop.binary(outer, distribute2(binary.left, b, outer, inner),
          distribute2(binary.right, b, outer, inner));
    }
    if (b.op == outer) {
      final Formula.Binary binary = (Formula.Binary) b;
      return prop.binary(outer, distribute2(a, binary.left, outer, inner),
          distribute2(a, binary.right, outer, inner));
    }
    return prop.binary(inner, a, b);
  }

  /**
   * Returns whether a formula is a literal (an atom or a negated atom) or a
   * constant.
   */
  public static boolean isLiteral(Formula formula) {
    return formula.isConstant() || formula.isLiteral();
  }

  /**
   * Returns whether a formula is in negation normal form: it contains no
   * connectives other than {@code ~}, {@code &} and {@code |}, and each
   * {@code ~} is applied to an atom.
   */
  public static boolean isNnf(Formula formula) {
    switch (formula.op) {
      case AND:
      case OR:
        final Formula.Binary binary = (Formula.Binary) formula;
        return isNnf(binary.left) && isNnf(binary.right);
      default:
        return isLiteral(formula);
    }
  }

  /** Returns whether a formula is in conjunctive normal form. */
  public static boolean isCnf(Formula formula) {
    return isNormal(formula, Op.AND, Op.OR);
  }

  /** Returns whether a formula is in disjunctive normal form. */
  public static boolean isDnf(Formula formula) {
    return isNormal(formula, Op.OR, Op.AND);
  }

  private static boolean isNormal(Formula formula, Op outer, Op inner) {
    if (formula.op == outer) {
      final Formula.Binary binary = (Formula.Binary) formula;
      return isNormal(binary.left, outer, inner)
          && isNormal(binary.right, outer, inner);
    }
    return isFlat(formula, inner);
  }

  /** Returns whether a formula is a tree of {@code op} over literals. */
  private static boolean isFlat(Formula formula, Op op) {
    if (formula.op == op) {
      final Formula.Binary binary = (Formula.Binary) formula;
      return isFlat(binary.left, op) && isFlat(binary.right, op);
    }
    return isLiteral(formula);
  }

  /**
   * Returns the clauses of a formula in conjunctive normal form, each clause
   * as a list of literals, left to right.
   */
  public static ImmutableList<ImmutableList<Formula>> clauses(Formula cnf) {
    checkArgument(isCnf(cnf), "not in conjunctive normal form: %s", cnf);
    return split(cnf, Op.AND, Op.OR);
  }

  /**
   * Returns the terms of a formula in disjunctive normal form, each term as a
   * list of literals, left to right.
   */
  public static ImmutableList<ImmutableList<Formula>> terms(Formula dnf) {
    checkArgument(isDnf(dnf), "not in disjunctive normal form: %s", dnf);
    return split(dnf, Op.OR, Op.AND);
  }

  private static ImmutableList<ImmutableList<Formula>> split(Formula formula,
      Op outer, Op inner) {
    final ImmutableList.Builder<Formula> groups = ImmutableList.builder();
    flatten(formula, outer, groups);
    final ImmutableList.Builder<ImmutableList<Formula>> result =
        ImmutableList.builder();
    for (Formula group : groups.build()) {
      final ImmutableList.Builder<Formula> literals = ImmutableList.builder();
      flatten(group, inner, literals);
      result.add(literals.build());
    }
    return result.build();
  }

  private static void flatten(Formula formula, Op op,
      ImmutableList.Builder<Formula> builder) {
    if (formula.op == op) {
      final Formula.Binary binary = (Formula.Binary) formula;
      flatten(binary.left, op, builder);
      flatten(binary.right, op, builder);
    } else {
      builder.add(formula);
    }
  }

  /** Step of normal form conversion. */
  public enum Step {
    ELIMINATE_EQUIVALENCES,
    ELIMINATE_IMPLICATIONS,
    PUSH_NEGATIONS,
    DISTRIBUTE;

    /** Name in lower camel case, for example "pushNegations". */
    public final String camelName =
        CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.LOWER_CAMEL, name());
  }
}

// End NormalForms.java
