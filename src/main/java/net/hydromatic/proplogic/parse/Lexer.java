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

import com.google.common.collect.ImmutableList;
import net.hydromatic.proplogic.ast.Formula;
import net.hydromatic.proplogic.ast.Op;
import net.hydromatic.proplogic.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Splits the text of a formula into tokens. */
class Lexer {
  private final Syntax syntax;
  private final String text;
  private int i = 0;

  Lexer(Syntax syntax, String text) {
    this.syntax = requireNonNull(syntax);
    this.text = requireNonNull(text);
  }

  /**
   * Reads all tokens. The last token is always of kind {@link Kind#EOF}.
   *
   * @throws PropParseException if the text contains a character that does
   *     not begin a token
   */
  ImmutableList<Token> tokenize() {
    final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    for (;;) {
      final Token token = next();
      tokens.add(token);
      if (token.kind == Kind.EOF) {
        return tokens.build();
      }
    }
  }

  private Token next() {
    while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
      ++i;
    }
    final int start = i;
    if (i >= text.length()) {
      return new Token(Kind.EOF, "", null, false, pos(start, start));
    }
    final char c = text.charAt(i);
    if (c == '(' || c == ')') {
      ++i;
      return new Token(c == '(' ? Kind.LPAREN : Kind.RPAREN,
          String.valueOf(c), null, false, pos(start, i));
    }
    if (Formula.Atom.isNameStart(c)) {
      while (i < text.length() && Formula.Atom.isNamePart(text.charAt(i))) {
        ++i;
      }
      return word(text.substring(start, i), pos(start, i));
    }
    for (String symbol : syntax.symbolsLongestFirst) {
      if (text.startsWith(symbol, i)) {
        i += symbol.length();
        return word(symbol, pos(start, i));
      }
    }
    throw new PropParseException("unknown character '" + c + "'",
        pos(start, start + 1));
  }

  /** Creates a token for a word or symbol. */
  private Token word(String s, Pos pos) {
    final Op op = syntax.connective(s);
    if (op != null) {
      return new Token(Kind.CONNECTIVE, s, op, false, pos);
    }
    final Boolean value = syntax.literal(s);
    if (value != null) {
      return new Token(Kind.CONSTANT, s, null, value, pos);
    }
    if (!Formula.Atom.isValidName(s)) {
      throw new PropParseException("reserved word '" + s
          + "' cannot be used as an atom", pos);
    }
    return new Token(Kind.ATOM, s, null, false, pos);
  }

  private Pos pos(int start, int end) {
    return Pos.of(text, start, end);
  }

  /** Kind of token. */
  enum Kind {
    ATOM,
    CONSTANT,
    CONNECTIVE,
    LPAREN,
    RPAREN,
    EOF
  }

  /** Token. */
  static class Token {
    final Kind kind;
    final String text;
    /** The connective, if kind is {@link Kind#CONNECTIVE}. */
    final @Nullable Op op;
    /** The value, if kind is {@link Kind#CONSTANT}. */
    final boolean value;
    final Pos pos;

    Token(Kind kind, String text, @Nullable Op op, boolean value, Pos pos) {
      this.kind = requireNonNull(kind);
      this.text = requireNonNull(text);
      this.op = op;
      this.value = value;
      this.pos = requireNonNull(pos);
    }

    boolean is(Op op) {
      return kind == Kind.CONNECTIVE && this.op == op;
    }

    /** Describes this token in an error message. */
    String describe() {
      return kind == Kind.EOF ? "end of input" : "'" + text + "'";
    }

    @Override public String toString() {
      return kind + "(" + text + ")";
    }
  }
}

// End Lexer.java
