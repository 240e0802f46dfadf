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
package net.hydromatic.proplogic.parse;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.proplogic.ast.Formula;
import net.hydromatic.proplogic.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Concrete syntax of formulas.
 *
 * <p>Says which tokens denote each connective and each constant. A token is
 * either a word, such as "and", which has the same form as an atom name, or a
 * symbol, such as "&amp;&amp;", which contains no letters, digits,
 * underscores, whitespace or parentheses. A word token is reserved, and
 * cannot be used as an atom name.
 *
 * <p>Syntax objects are immutable; the {@code with} methods return new
 * objects.
 */
public class Syntax {
  /**
   * The default syntax.
   *
   * <p>It reads what {@link net.hydromatic.proplogic.ast.SymbolTable#ASCII} and
   * {@link net.hydromatic.proplogic.ast.SymbolTable#UNICODE} write, plus some
   * common alternatives such as "!" for negation and "=&gt;" for implication.
   */
  public static final Syntax DEFAULT =
      new Syntax(ImmutableMap.of(), ImmutableMap.of())
          .withSymbol(Op.NOT, "~")
          .withSymbol(Op.NOT, "!")
          .withSymbol(Op.NOT, "¬")
          .withSymbol(Op.AND, "&")
          .withSymbol(Op.AND, "&&")
          .withSymbol(Op.AND, "∧")
          .withSymbol(Op.OR, "|")
          .withSymbol(Op.OR, "||")
          .withSymbol(Op.OR, "∨")
          .withSymbol(Op.IMPLIES, "->")
          .withSymbol(Op.IMPLIES, "=>")
          .withSymbol(Op.IMPLIES, ">>")
          .withSymbol(Op.IMPLIES, "→")
          .withSymbol(Op.IFF, "<->")
          .withSymbol(Op.IFF, "<=>")
          .withSymbol(Op.IFF, "↔")
          .withSymbol(Op.XOR, "^")
          .withSymbol(Op.XOR, "⊕")
          .withLiteral(true, "true")
          .withLiteral(true, "⊤")
          .withLiteral(false, "false")
          .withLiteral(false, "⊥");

  /** Syntax in which connectives are written as the words "not", "and",
   * "or", "implies", "iff" and "xor". */
  public static final Syntax WORDS =
      new Syntax(ImmutableMap.of(), ImmutableMap.of())
          .withSymbol(Op.NOT, "not")
          .withSymbol(Op.AND, "and")
          .withSymbol(Op.OR, "or")
          .withSymbol(Op.IMPLIES, "implies")
          .withSymbol(Op.IFF, "iff")
          .withSymbol(Op.XOR, "xor")
          .withLiteral(true, "true")
          .withLiteral(false, "false");

  private final ImmutableMap<String, Op> connectives;
  private final ImmutableMap<String, Boolean> literals;

  /** Symbol tokens, longest first, so that the lexer finds the longest
   * match. */
  final ImmutableList<String> symbolsLongestFirst;

  private Syntax(
      ImmutableMap<String, Op> connectives,
      ImmutableMap<String, Boolean> literals) {
    this.connectives = requireNonNull(connectives);
    this.literals = requireNonNull(literals);
    final Comparator<String> longestFirst =
        Comparator.comparingInt(String::length)
            .reversed()
            .thenComparing(Comparator.naturalOrder());
    this.symbolsLongestFirst =
        ImmutableSortedSet.orderedBy(longestFirst)
            .addAll(connectives.keySet())
            .addAll(literals.keySet())
            .build()
            .stream()
            .filter(token -> !isWord(token))
            .collect(ImmutableList.toImmutableList());
  }

  /** Returns the tokens that denote a connective. */
  public ImmutableList<String> tokens(Op op) {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    connectives.forEach(
        (token, op2) -> {
          if (op2 == op) {
            b.add(token);
          }
        });
    return b.build();
  }

  /** Returns the tokens that denote a constant. */
  public ImmutableList<String> literalTokens(boolean value) {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    literals.forEach(
        (token, value2) -> {
          if (value2 == value) {
            b.add(token);
          }
        });
    return b.build();
  }

  /** Returns the connective denoted by a token, or null. */
  public @Nullable Op connective(String token) {
    return connectives.get(token);
  }

  /** Returns the value of the constant denoted by a token, or null. */
  public @Nullable Boolean literal(String token) {
    return literals.get(token);
  }

  /** Returns whether a token is reserved, that is, denotes a connective or
   * a constant. */
  public boolean isReserved(String token) {
    return connectives.containsKey(token) || literals.containsKey(token);
  }

  /**
   * Returns a syntax that is the same as this but in which a token also
   * denotes a connective.
   *
   * @throws IllegalArgumentException if the token is not valid, or already
   *     denotes a different connective or a constant
   */
  public Syntax withSymbol(Op op, String token) {
    checkArgument(op.isConnective(), "not a connective: %s", op);
    checkToken(token);
    final Op previous = connectives.get(token);
    if (previous == op) {
      return this;
    }
    checkArgument(!isReserved(token), "token '%s' is already used", token);
    final Map<String, Op> map = new LinkedHashMap<>(connectives);
    map.put(token, op);
    return new Syntax(ImmutableMap.copyOf(map), literals);
  }

  /**
   * Returns a syntax that is the same as this but in which a token also
   * denotes a constant.
   */
  public Syntax withLiteral(boolean value, String token) {
    checkToken(token);
    final Boolean previous = literals.get(token);
    if (previous != null && previous == value) {
      return this;
    }
    checkArgument(!isReserved(token), "token '%s' is already used", token);
    final Map<String, Boolean> map = new LinkedHashMap<>(literals);
    map.put(token, value);
    return new Syntax(connectives, ImmutableMap.copyOf(map));
  }

  /** Returns a syntax that is the same as this but in which a token has no
   * meaning. */
  public Syntax withoutSymbol(String token) {
    if (!isReserved(token)) {
      return this;
    }
    final Map<String, Op> map = new LinkedHashMap<>(connectives);
    map.remove(token);
    final Map<String, Boolean> map2 = new LinkedHashMap<>(literals);
    map2.remove(token);
    return new Syntax(ImmutableMap.copyOf(map), ImmutableMap.copyOf(map2));
  }

  private static void checkToken(String token) {
    checkArgument(!token.isEmpty(), "empty token");
    if (isWord(token)) {
      for (int i = 1; i < token.length(); i++) {
        checkArgument(Formula.Atom.isNamePart(token.charAt(i)),
            "invalid token '%s'", token);
      }
    } else {
      for (int i = 0; i < token.length(); i++) {
        final char c = token.charAt(i);
        checkArgument(!Formula.Atom.isNamePart(c)
                && !Character.isWhitespace(c)
                && c != '('
                && c != ')',
            "invalid token '%s'", token);
      }
    }
  }

  /** Returns whether a token is a word (as opposed to a symbol). */
  static boolean isWord(String token) {
    return Formula.Atom.isNameStart(token.charAt(0));
  }
}

// End Syntax.java
