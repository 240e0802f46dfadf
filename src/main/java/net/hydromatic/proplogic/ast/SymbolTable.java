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

import com.google.common.collect.ImmutableMap;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Symbols with which to display formulas.
 *
 * <p>A symbol table maps each connective to the string that displays it,
 * gives the names of the two constants, and may give display names for atoms.
 * It affects only how formulas are written; it has no effect on parsing or
 * evaluation.
 *
 * <p>Symbol tables are immutable. Start from {@link #ASCII} or {@link #UNICODE}
 * and call the {@code with} methods to derive others.
 */
public class SymbolTable {
  /** Symbols that can be read back by the default parser syntax. */
  public static final SymbolTable ASCII =
      new SymbolTable(
          ImmutableMap.<Op, String>builder()
              .put(Op.NOT, "~")
              .put(Op.AND, "&")
              .put(Op.OR, "|")
              .put(Op.IMPLIES, "->")
              .put(Op.IFF, "<->")
              .put(Op.XOR, "^")
              .build(),
          "true",
          "false",
          ImmutableMap.of());

  /** Symbols of mathematical notation. */
  public static final SymbolTable UNICODE =
      new SymbolTable(
          ImmutableMap.<Op, String>builder()
              .put(Op.NOT, "¬")
              .put(Op.AND, "∧")
              .put(Op.OR, "∨")
              .put(Op.IMPLIES, "→")
              .put(Op.IFF, "↔")
              .put(Op.XOR, "⊕")
              .build(),
          "⊤",
          "⊥",
          ImmutableMap.of());

  private final ImmutableMap<Op, String> symbols;
  private final String trueName;
  private final String falseName;
  private final ImmutableMap<String, String> atomNames;

  private SymbolTable(
      ImmutableMap<Op, String> symbols,
      String trueName,
      String falseName,
      ImmutableMap<String, String> atomNames) {
    this.symbols = requireNonNull(symbols);
    this.trueName = requireNonNull(trueName);
    this.falseName = requireNonNull(falseName);
    this.atomNames = requireNonNull(atomNames);
    for (Op op : Op.CONNECTIVES) {
      checkArgument(symbols.containsKey(op), "no symbol for %s", op);
    }
  }

  /** Returns the symbol of a connective. */
  public String symbol(Op op) {
    checkArgument(op.isConnective(), "not a connective: %s", op);
    return symbols.get(op);
  }

  /** Returns the symbols of all connectives. */
  public ImmutableMap<Op, String> symbols() {
    return symbols;
  }

  /** Returns the name of a constant. */
  public String constantName(boolean value) {
    return value ? trueName : falseName;
  }

  /** Returns the display name of an atom; by default, the atom's name. */
  public String atomName(String name) {
    final String displayName = atomNames.get(name);
    return displayName != null ? displayName : name;
  }

  /** Returns a symbol table that is the same as this but with a different
   * symbol for a connective. */
  public SymbolTable withSymbol(Op op, String symbol) {
    return withSymbols(ImmutableMap.of(op, symbol));
  }

  /**
   * Returns a symbol table that is the same as this but with different
   * symbols for some connectives. Connectives that are not in the map keep
   * their current symbol.
   */
  public SymbolTable withSymbols(Map<Op, String> symbols) {
    final Map<Op, String> map = new EnumMap<>(this.symbols);
    symbols.forEach(
        (op, symbol) -> {
          checkArgument(op.isConnective(), "not a connective: %s", op);
          map.put(op, requireNonNull(symbol));
        });
    return new SymbolTable(
        ImmutableMap.copyOf(map), trueName, falseName, atomNames);
  }

  /** Returns a symbol table that is the same as this but with different
   * names for the constants. */
  public SymbolTable withConstantNames(String trueName, String falseName) {
    return new SymbolTable(symbols, trueName, falseName, atomNames);
  }

  /** Returns a symbol table that is the same as this but which displays an
   * atom with a different name. */
  public SymbolTable withAtomName(String name, String displayName) {
    final Map<String, String> map = new LinkedHashMap<>(atomNames);
    map.put(requireNonNull(name), requireNonNull(displayName));
    return new SymbolTable(
        symbols, trueName, falseName, ImmutableMap.copyOf(map));
  }
}

// End SymbolTable.java
