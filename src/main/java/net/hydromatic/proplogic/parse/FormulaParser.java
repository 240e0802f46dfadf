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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.proplogic.ast.FormulaBuilder.prop;

import java.util.List;
import net.hydromatic.proplogic.ast.Formula;
import net.hydromatic.proplogic.ast.Op;
import net.hydromatic.proplogic.parse.Lexer.Kind;
import net.hydromatic.proplogic.parse.Lexer.Token;

/**
 * Parser of formulas.
 *
 * <p>The grammar, from loosest to tightest binding, is as follows:
 *
 * <pre>{@code
 * formula     ::= disjunction ( ( IFF | XOR ) disjunction )*
 *               | disjunction IMPLIES formula
 * disjunction ::= conjunction ( OR conjunction )*
 * conjunction ::= unary ( AND unary )*
 * unary       ::= NOT unary | primary
 * primary     ::= atom | constant | "(" formula ")"
 * }</pre>
 *
 * <p>IMPLIES, IFF and XOR have the same precedence. IMPLIES is
 * right-associative, so "a -&gt; b -&gt; c" means "a -&gt; (b -&gt; c)"; IFF
 * and XOR are left-associative. In a chain that mixes them, "a &lt;-&gt; b
 * -&gt; c" means "(a &lt;-&gt; b) -&gt; c" and "a -&gt; b &lt;-&gt; c" means
 * "a -&gt; (b &lt;-&gt; c)".
 *
 * <p>The tokens that denote each connective and constant are given by a
 * {@link Syntax}.
 *
 * <p>Parsing either succeeds or throws {@link PropParseException}; it never
 * returns part of a formula. Parentheses, negations and implications may
 * nest at most {@link #MAX_DEPTH} deep.
 */
public class FormulaParser {
  /** Maximum nesting depth of "(", "~" and the right operand of "-&gt;". */
  public static final int MAX_DEPTH = 500;

  private final Syntax syntax;

  /** Creates a FormulaParser. */
  public FormulaParser(Syntax syntax) {
    this.syntax = requireNonNull(syntax);
  }

  /** Parses a formula using the default syntax. */
  public static Formula parse(String text) {
    return new FormulaParser(Syntax.DEFAULT).parseFormula(text);
  }

  /**
   * Parses a formula.
   *
   * @throws PropParseException if the text is not a valid formula
   */
  public Formula parseFormula(String text) {
    final List<Token> tokens = new Lexer(syntax, text).tokenize();
    return new State(tokens).parseAll();
  }

  /** Parser state: a list of tokens and the index of the next token. */
  private static class State {
    private final List<Token> tokens;
    private int i = 0;
    private int depth = 0;

    State(List<Token> tokens) {
      this.tokens = tokens;
    }

    private Token peek() {
      return tokens.get(i);
    }

    private Token next() {
      final Token token = tokens.get(i);
      if (token.kind != Kind.EOF) {
        ++i;
      }
      return token;
    }

    Formula parseAll() {
      final Token first = peek();
      if (first.kind == Kind.EOF) {
        throw new PropParseException("empty formula", first.pos);
      }
      final Formula formula = parseFormula();
      final Token token = peek();
      switch (token.kind) {
        case EOF:
          return formula;
        case RPAREN:
          throw new PropParseException("unbalanced parentheses: ')' has no "
              + "matching '('", token.pos);
        default:
          throw new PropParseException("unexpected " + token.describe()
              + " after end of formula", token.pos);
      }
    }

    /** Notes that parsing has gone one level deeper, at a given token. */
    private void push(Token token) {
      if (++depth > MAX_DEPTH) {
        throw new PropParseException("formula is nested more than "
            + MAX_DEPTH + " deep", token.pos);
      }
    }

    private Formula parseFormula() {
      Formula left = parseDisjunction();
      for (;;) {
        final Token token = peek();
        if (token.is(Op.IMPLIES)) {
          next();
          push(token);
          final Formula right = parseFormula();
          --depth;
          return prop.implies(left, right);
        } else if (token.is(Op.IFF) || token.is(Op.XOR)) {
          next();
          left = prop.binary(token.op, left, parseDisjunction());
        } else {
          return left;
        }
      }
    }

    private Formula parseDisjunction() {
      Formula left = parseConjunction();
      while (peek().is(Op.OR)) {
        next();
        left = prop.or(left, parseConjunction());
      }
      return left;
    }

    private Formula parseConjunction() {
      Formula left = parseUnary();
      while (peek().is(Op.AND)) {
        next();
        left = prop.and(left, parseUnary());
      }
      return left;
    }

    private Formula parseUnary() {
      final Token token = peek();
      if (token.is(Op.NOT)) {
        next();
        push(token);
        final Formula operand = parseUnary();
        --depth;
        return prop.not(operand);
      }
      return parsePrimary();
    }

    private Formula parsePrimary() {
      final Token token = next();
      switch (token.kind) {
        case ATOM:
          return prop.atom(token.text);
        case CONSTANT:
          return prop.constant(token.value);
        case LPAREN:
          push(token);
          final Formula formula = parseFormula();
          final Token close = next();
          if (close.kind == Kind.RPAREN) {
            --depth;
            return formula;
          }
          if (close.kind == Kind.EOF) {
            throw new PropParseException("unbalanced parentheses: '(' is "
                + "not closed", token.pos);
          }
          throw new PropParseException("expected ')' but found "
              + close.describe(), close.pos);
        case EOF:
          throw new PropParseException("missing operand at end of input",
              token.pos);
        default:
          throw new PropParseException("missing operand before "
              + token.describe(), token.pos);
      }
    }
  }
}

// End FormulaParser.java
