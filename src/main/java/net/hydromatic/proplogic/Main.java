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
package net.hydromatic.proplogic;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import net.hydromatic.proplogic.ast.Formula;
import net.hydromatic.proplogic.ast.InvalidAtomNameException;
import net.hydromatic.proplogic.ast.Law;
import net.hydromatic.proplogic.ast.SymbolTable;
import net.hydromatic.proplogic.compile.NormalForms;
import net.hydromatic.proplogic.compile.Simplifier;
import net.hydromatic.proplogic.compile.Tracer;
import net.hydromatic.proplogic.compile.Tracers;
import net.hydromatic.proplogic.eval.Evaluator;
import net.hydromatic.proplogic.eval.Interpretation;
import net.hydromatic.proplogic.eval.Prop;
import net.hydromatic.proplogic.eval.Semantics;
import net.hydromatic.proplogic.eval.TruthTable;
import net.hydromatic.proplogic.parse.FormulaParser;
import net.hydromatic.proplogic.parse.PropParseException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Command shell for propositional formulas.
 *
 * <p>Reads one command per line. Each command is a word followed by its
 * arguments, for example {@code simplify P & (P | Q)} or
 * {@code eval P -> Q; P=true, Q=false}. Type {@code help} for a list of
 * commands.
 */
public class Main {
  private static final ImmutableMap<String, String> COMMANDS =
      ImmutableMap.<String, String>builder()
          .put("parse f", "parses and prints a formula")
          .put("atoms f", "lists the atoms of a formula")
          .put("subformulas f", "lists the subformulas of a formula")
          .put("eval f; P=true, Q=false", "evaluates a formula")
          .put("simplify f", "simplifies a formula")
          .put("nnf f", "converts to negation normal form")
          .put("cnf f", "converts to conjunctive normal form")
          .put("dnf f", "converts to disjunctive normal form")
          .put("table f", "prints the truth table of a formula")
          .put("tautology f", "whether a formula is always true")
          .put("contradiction f", "whether a formula is always false")
          .put("satisfiable f", "whether a formula is sometimes true")
          .put("falsifiable f", "whether a formula is sometimes false")
          .put("equivalent f; g", "whether two formulas are equivalent")
          .put("solve f", "finds an interpretation that satisfies f")
          .put("models f", "lists all interpretations that satisfy f")
          .put("substitute f; P = g", "replaces atoms with formulas")
          .put("laws", "lists the laws of propositional logic")
          .put("set name value", "sets a property")
          .put("help", "prints this message")
          .build();

  private final BufferedReader in;
  private final PrintWriter out;
  private final boolean echo;
  final Map<Prop, Object> propMap;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final List<String> argList = ImmutableList.copyOf(args);
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    final Main main = new Main(argList, System.in, System.out, propMap);
    try {
      main.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
    }
  }

  /** Creates a Main. */
  public Main(List<String> args, InputStream in, PrintStream out,
      Map<Prop, Object> propMap) {
    this(args, new InputStreamReader(in), new OutputStreamWriter(out),
        propMap);
  }

  /** Creates a Main. */
  public Main(List<String> argList, Reader in, Writer out,
      Map<Prop, Object> propMap) {
    this.in = buffer(in);
    this.out = buffer(out);
    this.echo = argList.contains("--echo");
    this.propMap = requireNonNull(propMap);
  }

  private static PrintWriter buffer(Writer out) {
    if (out instanceof PrintWriter) {
      return (PrintWriter) out;
    } else {
      if (!(out instanceof BufferedWriter)) {
        out = new BufferedWriter(out);
      }
      return new PrintWriter(out);
    }
  }

  private static BufferedReader buffer(Reader in) {
    if (in instanceof BufferedReader) {
      return (BufferedReader) in;
    } else {
      return new BufferedReader(in);
    }
  }

  /** Reads and executes commands until the end of input. */
  public void run() {
    try {
      for (;;) {
        final String line = in.readLine();
        if (line == null) {
          break;
        }
        if (echo) {
          out.println(line);
        }
        command(line.trim());
      }
    } catch (IOException e) {
      throw new RuntimeException(e);
    } finally {
      out.flush();
    }
  }

  /** Executes a command, printing any error. */
  void command(String line) {
    if (line.isEmpty() || line.startsWith("#")) {
      return;
    }
    try {
      execute(line);
    } catch (PropParseException e) {
      out.println(e.describeTo(new StringBuilder("Error: ")));
    } catch (RuntimeException e) {
      out.println("Error: " + e.getMessage());
    }
  }

  private void execute(String line) {
    final int space = indexOfSpace(line);
    final String command = space < 0 ? line : line.substring(0, space);
    final String rest = space < 0 ? "" : line.substring(space + 1).trim();
    switch (command) {
      case "parse":
        print(parse(rest));
        return;

      case "atoms":
        final Set<String> atoms = parse(rest).atoms();
        out.println(atoms.isEmpty() ? "(none)" : String.join(", ", atoms));
        return;

      case "subformulas":
        for (Formula f : parse(rest).subformulas()) {
          print(f);
        }
        return;

      case "eval":
        final List<String> evalArgs = split(rest, 2, command);
        final Interpretation interpretation =
            parseInterpretation(evalArgs.get(1));
        print(Evaluator.evaluate(parse(evalArgs.get(0)), interpretation));
        return;

      case "simplify":
        print(Simplifier.simplify(parse(rest), tracer()));
        return;

      case "nnf":
        print(NormalForms.toNnf(parse(rest), tracer()));
        return;

      case "cnf":
        print(NormalForms.toCnf(parse(rest), tracer()));
        return;

      case "dnf":
        print(NormalForms.toDnf(parse(rest), tracer()));
        return;

      case "table":
        final TruthTable table = TruthTable.of(checkAtoms(parse(rest)));
        out.print(table.describeTo(new StringBuilder(), symbolTable()));
        return;

      case "tautology":
        out.println(Semantics.isTautology(checkAtoms(parse(rest))));
        return;

      case "contradiction":
        out.println(Semantics.isContradiction(checkAtoms(parse(rest))));
        return;

      case "satisfiable":
        out.println(Semantics.isSatisfiable(checkAtoms(parse(rest))));
        return;

      case "falsifiable":
        out.println(Semantics.isFalsifiable(checkAtoms(parse(rest))));
        return;

      case "equivalent":
        final List<String> equivalentArgs = split(rest, 2, command);
        final Formula formula0 = parse(equivalentArgs.get(0));
        final Formula formula1 = parse(equivalentArgs.get(1));
        checkAtoms(formula0, formula1);
        out.println(Semantics.isEquivalent(formula0, formula1));
        return;

      case "solve":
        final Interpretation model =
            Semantics.solve(checkAtoms(parse(rest)));
        out.println(model == null ? "unsatisfiable" : describe(model));
        return;

      case "models":
        final List<Interpretation> models =
            Semantics.satisfyingInterpretations(checkAtoms(parse(rest)));
        if (models.isEmpty()) {
          out.println("unsatisfiable");
        }
        for (Interpretation m : models) {
          out.println(describe(m));
        }
        return;

      case "substitute":
        final List<String> substituteArgs = split(rest, -1, command);
        final Formula target = parse(substituteArgs.get(0));
        final Map<String, Formula> map = new LinkedHashMap<>();
        for (String arg : substituteArgs.subList(1, substituteArgs.size())) {
          final int eq = arg.indexOf('=');
          if (eq < 0) {
            throw new IllegalArgumentException(
                "invalid substitution '" + arg + "'");
          }
          final String atom = arg.substring(0, eq).trim();
          if (!Formula.Atom.isValidName(atom)) {
            throw new InvalidAtomNameException(atom);
          }
          map.put(atom, parse(arg.substring(eq + 1)));
        }
        print(target.substitute(map));
        return;

      case "laws":
        for (Law law : Law.values()) {
          out.println(law.name().toLowerCase(Locale.ROOT) + ": "
              + law.formula.unparse(symbolTable()));
        }
        return;

      case "set":
        final int space2 = indexOfSpace(rest);
        final String name = space2 < 0 ? rest : rest.substring(0, space2);
        final String value =
            space2 < 0 ? null : rest.substring(space2 + 1).trim();
        Prop.lookup(name).setLenient(propMap, value);
        return;

      case "help":
        COMMANDS.forEach((usage, description) ->
            out.println(String.format("%-26s%s", usage, description)));
        return;

      default:
        throw new IllegalArgumentException(
            "unknown command '" + command + "'; type 'help' for a list");
    }
  }

  private static int indexOfSpace(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (Character.isWhitespace(s.charAt(i))) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Splits the arguments of a command at semicolons. If {@code count} is not
   * negative, requires exactly that many arguments; otherwise requires at
   * least one.
   */
  private static List<String> split(String rest, int count, String command) {
    final List<String> args = new ArrayList<>();
    for (String arg : rest.split(";", -1)) {
      args.add(arg.trim());
    }
    if (count >= 0 && args.size() != count) {
      throw new IllegalArgumentException("command '" + command
          + "' requires " + count + " arguments separated by ';'");
    }
    return args;
  }

  private static Formula parse(String text) {
    return FormulaParser.parse(text);
  }

  /** Parses an interpretation such as "P=true, Q=false". */
  private static Interpretation parseInterpretation(String text) {
    final Interpretation.Builder builder = Interpretation.builder();
    if (text.isEmpty()) {
      return builder.build();
    }
    for (String binding : text.split(",")) {
      final int eq = binding.indexOf('=');
      final String value =
          eq < 0 ? "" : binding.substring(eq + 1).trim();
      if (!value.equals("true") && !value.equals("false")) {
        throw new IllegalArgumentException(
            "invalid assignment '" + binding.trim() + "'");
      }
      builder.put(binding.substring(0, eq).trim(), Boolean.parseBoolean(value));
    }
    return builder.build();
  }

  private static String describe(Interpretation interpretation) {
    if (interpretation.size() == 0) {
      return "(empty)";
    }
    final List<String> bindings = new ArrayList<>();
    interpretation.asMap().forEach((name, value) ->
        bindings.add(name + "=" + value));
    return String.join(", ", bindings);
  }

  private void print(Formula formula) {
    out.println(formula.unparse(symbolTable()));
  }

  private SymbolTable symbolTable() {
    return Prop.OUTPUT.enumValue(propMap, Prop.Output.class).symbolTable;
  }

  private Tracer tracer() {
    return Prop.TRACE.booleanValue(propMap)
        ? Tracers.printing(out, symbolTable())
        : Tracers.empty();
  }

  /**
   * Checks that the formulas, between them, have no more atoms than allowed
   * by the {@link Prop#MAX_ATOMS} property. Returns the first formula.
   */
  private Formula checkAtoms(Formula formula, Formula... formulas) {
    final @Nullable Integer maxAtoms =
        Prop.MAX_ATOMS.optionalIntValue(propMap);
    if (maxAtoms != null) {
      final Set<String> atoms = new TreeSet<>(formula.atoms());
      for (Formula f : formulas) {
        atoms.addAll(f.atoms());
      }
      if (atoms.size() > maxAtoms) {
        throw new IllegalStateException("formula has " + atoms.size()
            + " atoms, more than maxAtoms (" + maxAtoms + ")");
      }
    }
    return formula;
  }
}

// End Main.java
