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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Map;
import java.util.Objects;

/**
 * Formula of propositional logic.
 *
 * <p>A formula is an immutable tree. Its leaves are {@link Constant constants}
 * and {@link Atom atoms}; its interior nodes are {@link Not negations} and
 * {@link Binary binary connectives}. The {@link #op} field says which kind of
 * node this is, and code that needs to handle each kind switches on it.
 *
 * <p>Two formulas are equal if they have the same structure. Use {@link
 * FormulaBuilder#prop} to create formulas.
 */
public abstract class Formula {
  public final Op op;
  private final int hash;
  private final int size;
  private final int depth;

  Formula(Op op, int hash, int size, int depth) {
    this.op = requireNonNull(op);
    this.hash = hash;
    this.size = size;
    this.depth = depth;
  }

  @Override
  public final int hashCode() {
    return hash;
  }

  /**
   * Converts this formula to a string, using ASCII symbols and as few
   * parentheses as possible.
   *
   * <p>The result can be read back by {@code FormulaParser}, and yields an
   * equal formula.
   */
  @Override
  public final String toString() {
    return unparse(SymbolTable.ASCII);
  }

  /** Converts this formula to a string, using the given symbols. */
  public final String unparse(SymbolTable symbolTable) {
    return unparse(new FormulaWriter(symbolTable), 0, 0).toString();
  }

  abstract FormulaWriter unparse(FormulaWriter w, int left, int right);

  /**
   * Accepts a shuttle, calling the {@link Shuttle#visit} method appropriate to
   * the type of this node, and returning the result.
   */
  public abstract Formula accept(Shuttle shuttle);

  /**
   * Accepts a visitor, calling the {@link Visitor#visit} method appropriate to
   * the type of this node.
   */
  public abstract void accept(Visitor visitor);

  /** Returns the immediate sub-formulas; empty for constants and atoms. */
  public abstract ImmutableList<Formula> operands();

  /** Returns the number of nodes in this formula. */
  public int size() {
    return size;
  }

  /** Returns the depth of this formula; 1 for constants and atoms. */
  public int depth() {
    return depth;
  }

  public boolean isAtom() {
    return op == Op.ATOM;
  }

  public boolean isConstant() {
    return op == Op.CONSTANT;
  }

  /** Returns whether this formula is the constant with a given value. */
  public boolean isConstant(boolean value) {
    return op == Op.CONSTANT && ((Constant) this).value == value;
  }

  /** Returns whether this formula is an atom or the negation of an atom. */
  public boolean isLiteral() {
    return op == Op.ATOM
        || op == Op.NOT && ((Not) this).operand.op == Op.ATOM;
  }

  /**
   * Returns the names of the atoms in this formula, each once, in the order
   * that they first occur in a pre-order traversal.
   */
  public ImmutableSet<String> atoms() {
    final ImmutableSet.Builder<String> names = ImmutableSet.builder();
    accept(
        new Visitor() {
          @Override
          protected void visit(Atom atom) {
            names.add(atom.name);
          }
        });
    return names.build();
  }

  /** Returns the names of the atoms in this formula, sorted. */
  public ImmutableSortedSet<String> sortedAtoms() {
    return ImmutableSortedSet.copyOf(atoms());
  }

  /**
   * Returns every node of this formula, in pre-order.
   *
   * <p>The first element is this formula. There is one element per position
   * in the tree; if the same sub-formula occurs in two positions, it occurs
   * twice in the list.
   */
  public ImmutableList<Formula> subformulas() {
    final ImmutableList.Builder<Formula> list = ImmutableList.builder();
    collect(this, list);
    return list.build();
  }

  private static void collect(
      Formula formula, ImmutableList.Builder<Formula> list) {
    list.add(formula);
    for (Formula operand : formula.operands()) {
      collect(operand, list);
    }
  }

  /** Returns whether a formula occurs within this formula (or is equal). */
  public boolean contains(Formula formula) {
    if (formula.size > size || formula.depth > depth) {
      return false;
    }
    if (equals(formula)) {
      return true;
    }
    for (Formula operand : operands()) {
      if (operand.contains(formula)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Replaces atoms by formulas.
   *
   * <p>The replacements are simultaneous. If a replacement formula contains an
   * atom that is also being replaced, that atom is not replaced again. Atoms
   * that are not in the map are unchanged.
   */
  public Formula substitute(Map<String, ? extends Formula> map) {
    if (map.isEmpty()) {
      return this;
    }
    final ImmutableMap<String, Formula> substitutions =
        ImmutableMap.copyOf(map);
    return accept(
        new Shuttle() {
          @Override
          protected Formula visit(Atom atom) {
            final Formula formula = substitutions.get(atom.name);
            return formula != null ? formula : atom;
          }
        });
  }

  /** Boolean constant. */
  public static final class Constant extends Formula {
    static final Constant TRUE = new Constant(true);
    static final Constant FALSE = new Constant(false);

    public final boolean value;

    private Constant(boolean value) {
      super(Op.CONSTANT, Boolean.hashCode(value), 1, 1);
      this.value = value;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Constant && this.value == ((Constant) o).value;
    }

    @Override
    FormulaWriter unparse(FormulaWriter w, int left, int right) {
      return w.constant(value);
    }

    @Override
    public Formula accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public ImmutableList<Formula> operands() {
      return ImmutableList.of();
    }

    /** Returns the negation of this constant. */
    public Constant negate() {
      return value ? FALSE : TRUE;
    }
  }

  /** Propositional variable, identified by its name. */
  public static final class Atom extends Formula {
    public final String name;

    Atom(String name) {
      super(Op.ATOM, name.hashCode(), 1, 1);
      this.name = name;
      checkArgument(isValidName(name), "invalid atom name %s", name);
    }

    /**
     * Returns whether a string is a valid atom name.
     *
     * <p>A name is valid if it is non-empty, starts with a letter or
     * underscore, and continues with letters, digits and underscores. The
     * words "true" and "false" are reserved for constants.
     */
    public static boolean isValidName(String name) {
      if (name.isEmpty() || name.equals("true") || name.equals("false")) {
        return false;
      }
      for (int i = 0; i < name.length(); i++) {
        final char c = name.charAt(i);
        if (i == 0 ? !isNameStart(c) : !isNamePart(c)) {
          return false;
        }
      }
      return true;
    }

    /** Returns whether a character can begin an atom name. */
    public static boolean isNameStart(char c) {
      return Character.isLetter(c) || c == '_';
    }

    /** Returns whether a character can continue an atom name. */
    public static boolean isNamePart(char c) {
      return Character.isLetterOrDigit(c) || c == '_';
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Atom && this.name.equals(((Atom) o).name);
    }

    @Override
    FormulaWriter unparse(FormulaWriter w, int left, int right) {
      return w.id(name);
    }

    @Override
    public Formula accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public ImmutableList<Formula> operands() {
      return ImmutableList.of();
    }
  }

  /** Negation of a formula. */
  public static final class Not extends Formula {
    public final Formula operand;

    Not(Formula operand) {
      super(
          Op.NOT,
          Objects.hash(Op.NOT, operand),
          operand.size + 1,
          operand.depth + 1);
      this.operand = operand;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Not
              && hashCode() == o.hashCode()
              && this.operand.equals(((Not) o).operand);
    }

    @Override
    FormulaWriter unparse(FormulaWriter w, int left, int right) {
      return w.prefix(left, op, operand, right);
    }

    @Override
    public Formula accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public ImmutableList<Formula> operands() {
      return ImmutableList.of(operand);
    }

    /**
     * Returns a copy of this negation with a given operand, or this negation
     * if the operand is the same.
     */
    public Not copy(Formula operand) {
      return operand == this.operand ? this : new Not(operand);
    }
  }

  /**
   * Application of a binary connective ({@link Op#AND}, {@link Op#OR}, {@link
   * Op#IMPLIES}, {@link Op#IFF}, {@link Op#XOR}) to two formulas.
   */
  public static final class Binary extends Formula {
    public final Formula left;
    public final Formula right;

    Binary(Op op, Formula left, Formula right) {
      super(
          op,
          Objects.hash(op, left, right),
          left.size + right.size + 1,
          Math.max(left.depth, right.depth) + 1);
      checkArgument(op.isBinary(), "not a binary connective: %s", op);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Binary
              && hashCode() == o.hashCode()
              && this.op == ((Binary) o).op
              && this.left.equals(((Binary) o).left)
              && this.right.equals(((Binary) o).right);
    }

    @Override
    FormulaWriter unparse(FormulaWriter w, int left, int right) {
      return w.infix(left, this.left, op, this.right, right);
    }

    @Override
    public Formula accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public ImmutableList<Formula> operands() {
      return ImmutableList.of(left, right);
    }

    /**
     * Returns a copy of this formula with given operands, or this formula if
     * the operands are the same.
     */
    public Binary copy(Formula left, Formula right) {
      return left == this.left && right == this.right
          ? this
          : new Binary(op, left, right);
    }
  }
}

// End Formula.java
