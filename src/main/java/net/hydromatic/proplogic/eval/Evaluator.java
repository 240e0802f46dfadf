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
import static net.hydromatic.proplogic.ast.FormulaBuilder.prop;

import net.hydromatic.proplogic.ast.Formula;
import net.hydromatic.proplogic.ast.Op;
import net.hydromatic.proplogic.ast.Shuttle;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluates formulas.
 *
 * <p>Evaluation replaces each bound atom with its value, then folds
 * connectives whose operands are constant. If the interpretation binds every
 * atom in the formula, the result is a {@link Formula.Constant}; otherwise
 * it is a residual formula over the unbound atoms.
 */
public class Evaluator extends Shuttle {
  private final Interpretation interpretation;

  private Evaluator(Interpretation interpretation) {
    this.interpretation = requireNonNull(interpretation);
  }

  /** Evaluates a formula, returning a constant or a residual formula. */
  public static Formula evaluate(Formula formula,
      Interpretation interpretation) {
    return formula.accept(new Evaluator(interpretation));
  }

  /**
   * Evaluates a formula to a boolean.
   *
   * @throws UnboundAtomException if the formula has atoms that are not bound
   *     by the interpretation and whose value affects the result
   */
  public static boolean booleanValue(Formula formula,
      Interpretation interpretation) {
    final Formula result = evaluate(formula, interpretation);
    if (result.op != Op.CONSTANT) {
      throw new UnboundAtomException(result.atoms(), result);
    }
    return ((Formula.Constant) result).value;
  }

  /** Returns whether an interpretation binds every atom in a formula. */
  public static boolean isTotal(Formula formula,
      Interpretation interpretation) {
    return interpretation.covers(formula);
  }

  @Override protected Formula visit(Formula.Atom atom) {
    final Boolean value = interpretation.get(atom.name);
    return value == null ? atom : prop.constant(value);
  }

  @Override protected Formula visit(Formula.Not not) {
    final Formula operand = not.operand.accept(this);
    if (operand.op == Op.CONSTANT) {
      return ((Formula.Constant) operand).negate();
    }
    return not.copy(operand);
  }

  @Override protected Formula visit(Formula.Binary binary) {
    final Formula left = binary.left.accept(this);
    // If the left operand decides the result, skip the right operand.
    if (left.op == Op.CONSTANT) {
      final boolean value = ((Formula.Constant) left).value;
      switch (binary.op) {
        case AND:
          if (!value) {
            return left;
          }
          break;
        case OR:
          if (value) {
            return left;
          }
          break;
        case IMPLIES:
          if (!value) {
            return prop.trueLiteral();
          }
          break;
        default:
          break;
      }
    }
    final Formula right = binary.right.accept(this);
    final Formula folded = fold(binary.op, left, right);
    return folded != null ? folded : binary.copy(left, right);
  }

  /**
   * Folds a binary connective one or both of whose operands is a constant.
   * Returns null if neither operand is a constant.
   */
  public static @Nullable Formula fold(Op op, Formula left, Formula right) {
    if (left.op == Op.CONSTANT) {
      final boolean l = ((Formula.Constant) left).value;
      switch (op) {
        case AND:
          return l ? right : left;
        case OR:
          return l ? left : right;
        case IMPLIES:
          return l ? right : prop.trueLiteral();
        case IFF:
          return l ? right : negate(right);
        case XOR:
          return l ? negate(right) : right;
        default:
          throw new AssertionError("unexpected " + op);
      }
    }
    if (right.op == Op.CONSTANT) {
      final boolean r = ((Formula.Constant) right).value;
      switch (op) {
        case AND:
          return r ? left : right;
        case OR:
          return r ? right : left;
        case IMPLIES:
          return r ? right : negate(left);
        case IFF:
          return r ? left : negate(left);
        case XOR:
          return r ? negate(left) : left;
        default:
          throw new AssertionError("unexpected " + op);
      }
    }
    return null;
  }

  /**
   * Returns the negation of a formula. Negates constants, and removes the
   * negation from a negated formula rather than adding a second one.
   */
  public static Formula negate(Formula formula) {
    switch (formula.op) {
      case CONSTANT:
        return ((Formula.Constant) formula).negate();
      case NOT:
        return ((Formula.Not) formula).operand;
      default:
        return prop.not(formula);
    }
  }
}

// End Evaluator.java
