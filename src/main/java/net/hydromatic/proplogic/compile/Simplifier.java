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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.proplogic.ast.FormulaBuilder.prop;

import com.google.common.base.CaseFormat;
import net.hydromatic.proplogic.ast.Formula;
import net.hydromatic.proplogic.ast.Op;
import net.hydromatic.proplogic.ast.Shuttle;
import net.hydromatic.proplogic.eval.Evaluator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Simplifier of formulas.
 *
 * <p>Applies local rewrite rules bottom-up, in repeated passes, until a pass
 * makes no change. Every rule produces an equivalent formula with fewer
 * nodes, so the process terminates, and the result is a fixed point:
 * simplifying it again returns it unchanged.
 *
 * <ul>
 *   <li>{@code ~true} &rarr; {@code false}, {@code P & true} &rarr;
 *       {@code P}, {@code P -> false} &rarr; {@code ~P}, and the other
 *       identities and annihilators of the constants
 *   <li>{@code ~~P} &rarr; {@code P}
 *   <li>{@code P & P} &rarr; {@code P}, {@code P | P} &rarr; {@code P},
 *       {@code P -> P} &rarr; {@code true}, {@code P <-> P} &rarr;
 *       {@code true}, {@code P ^ P} &rarr; {@code false}
 *   <li>{@code P & ~P} &rarr; {@code false}, {@code P | ~P} &rarr;
 *       {@code true}, {@code P <-> ~P} &rarr; {@code false},
 *       {@code P ^ ~P} &rarr; {@code true}, {@code P -> ~P} &rarr;
 *       {@code ~P}, {@code ~P -> P} &rarr; {@code P}
 *   <li>{@code P & (P | Q)} &rarr; {@code P}, {@code P | (P & Q)} &rarr;
 *       {@code P}
 * </ul>
 *
 * <p>De Morgan's laws are not applied; they do not make a formula smaller.
 */
public class Simplifier {
  private final Tracer tracer;

  private Simplifier(Tracer tracer) {
    this.tracer = requireNonNull(tracer);
  }

  /** Simplifies a formula. */
  public static Formula simplify(Formula formula) {
    return simplify(formula, Tracers.empty());
  }

  /** Simplifies a formula, reporting each rewrite and pass to a tracer. */
  public static Formula simplify(Formula formula, Tracer tracer) {
    final Simplifier simplifier = new Simplifier(tracer);
    final RewriteShuttle shuttle = simplifier.new RewriteShuttle();
    for (int pass = 0;; pass++) {
      final Formula formula2 = formula.accept(shuttle);
      tracer.onPass(pass, formula2);
      if (formula2.equals(formula)) {
        return formula;
      }
      formula = formula2;
    }
  }

  /** Applies rules to a node until none applies. */
  private Formula rewrite(Formula formula) {
    for (;;) {
      final Formula formula2 = apply(formula);
      if (formula2 == null) {
        return formula;
      }
      formula = formula2;
    }
  }

  /** Applies the first rule that matches a node, or returns null. */
  private @Nullable Formula apply(Formula formula) {
    switch (formula.op) {
      case NOT:
        final Formula operand = ((Formula.Not) formula).operand;
        switch (operand.op) {
          case CONSTANT:
            return fire(Rule.CONSTANT, formula,
                ((Formula.Constant) operand).negate());
          case NOT:
            return fire(Rule.DOUBLE_NEGATION, formula,
                ((Formula.Not) operand).operand);
          default:
            return null;
        }

      case AND:
      case OR:
      case IMPLIES:
      case IFF:
      case XOR:
        return apply((Formula.Binary) formula);

      default:
        return null;
    }
  }

  private @Nullable Formula apply(Formula.Binary binary) {
    final Formula left = binary.left;
    final Formula right = binary.right;
    final Formula folded = Evaluator.fold(binary.op, left, right);
    if (folded != null) {
      return fire(Rule.CONSTANT, binary, folded);
    }

    if (left.equals(right)) {
      switch (binary.op) {
        case AND:
        case OR:
          return fire(Rule.IDEMPOTENCE, binary, left);
        case IMPLIES:
        case IFF:
          return fire(Rule.IDEMPOTENCE, binary, prop.trueLiteral());
        default:
          return fire(Rule.IDEMPOTENCE, binary, prop.falseLiteral());
      }
    }

    if (isNegationOf(left, right) || isNegationOf(right, left)) {
      switch (binary.op) {
        case AND:
        case IFF:
          return fire(Rule.COMPLEMENT, binary, prop.falseLiteral());
        case OR:
        case XOR:
          return fire(Rule.COMPLEMENT, binary, prop.trueLiteral());
        default:
          // "P -> ~P" is "~P"; "~P -> P" is "P"
          return fire(Rule.COMPLEMENT, binary, right);
      }
    }

    switch (binary.op) {
      case AND:
        if (hasOperand(right, Op.OR, left)) {
          return fire(Rule.ABSORPTION, binary, left);
        }
        if (hasOperand(left, Op.OR, right)) {
          return fire(Rule.ABSORPTION, binary, right);
        }
        return null;
      case OR:
        if (hasOperand(right, Op.AND, left)) {
          return fire(Rule.ABSORPTION, binary, left);
        }
        if (hasOperand(left, Op.AND, right)) {
          return fire(Rule.ABSORPTION, binary, right);
        }
        return null;
      default:
        return null;
    }
  }

  private Formula fire(Rule rule, Formula before, Formula after) {
    tracer.onRewrite(rule, before, after);
    return after;
  }

  /** Returns whether {@code f} is {@code ~g}. */
  private static boolean isNegationOf(Formula f, Formula g) {
    return f.op == Op.NOT && ((Formula.Not) f).operand.equals(g);
  }

  /**
   * Returns whether {@code f} is a binary formula with connective {@code op}
   * one of whose operands is {@code g}.
   */
  private static boolean hasOperand(Formula f, Op op, Formula g) {
    if (f.op != op) {
      return false;
    }
    final Formula.Binary binary = (Formula.Binary) f;
    return binary.left.equals(g) || binary.right.equals(g);
  }

  /** Family of rewrite rules. */
  public enum Rule {
    /** Folds constants. */
    CONSTANT,
    /** Removes a double negation. */
    DOUBLE_NEGATION,
    /** Collapses a connective applied to two equal operands. */
    IDEMPOTENCE,
    /** Collapses a connective applied to a formula and its negation. */
    COMPLEMENT,
    /** Absorbs a disjunction into a conjunction, or vice versa. */
    ABSORPTION;

    /** Name in lower camel case, for example "doubleNegation". */
    public final String camelName =
        CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.LOWER_CAMEL, name());
  }

  /** Shuttle that simplifies operands, then the node itself. */
  private class RewriteShuttle extends Shuttle {
    @Override protected Formula visit(Formula.Not not) {
      return rewrite(super.visit(not));
    }

    @Override protected Formula visit(Formula.Binary binary) {
      return rewrite(super.visit(binary));
    }
  }
}

// End Simplifier.java
