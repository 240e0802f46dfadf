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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.proplogic.ast.Formula;
import net.hydromatic.proplogic.ast.InvalidAtomNameException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Assignment of truth values to atoms.
 *
 * <p>An interpretation may be partial. Looking up an atom that has no value
 * returns null; the atom is said to be unbound.
 */
public class Interpretation {
  private static final Interpretation EMPTY =
      new Interpretation(ImmutableMap.of());

  private final ImmutableMap<String, Boolean> map;

  private Interpretation(ImmutableMap<String, Boolean> map) {
    this.map = requireNonNull(map);
  }

  /** Returns an interpretation in which no atom is bound. */
  public static Interpretation empty() {
    return EMPTY;
  }

  /**
   * Creates an interpretation from a map.
   *
   * @throws InvalidAtomNameException if a key is not a valid atom name
   */
  public static Interpretation of(Map<String, Boolean> map) {
    map.keySet().forEach(Interpretation::checkName);
    return map.isEmpty() ? EMPTY : new Interpretation(ImmutableMap.copyOf(map));
  }

  /** Creates an interpretation that binds one atom. */
  public static Interpretation of(String name, boolean value) {
    return builder().put(name, value).build();
  }

  /** Creates an interpretation that binds two atoms. */
  public static Interpretation of(String name0, boolean value0,
      String name1, boolean value1) {
    return builder().put(name0, value0).put(name1, value1).build();
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  private static void checkName(String name) {
    if (!Formula.Atom.isValidName(name)) {
      throw new InvalidAtomNameException(name);
    }
  }

  /** Returns the value of an atom, or null if the atom is unbound. */
  public @Nullable Boolean get(String name) {
    return map.get(name);
  }

  /** Returns whether an atom has a value. */
  public boolean isBound(String name) {
    return map.containsKey(name);
  }

  /** Returns the names of the bound atoms, in the order they were added. */
  public ImmutableSet<String> names() {
    return map.keySet();
  }

  /** Returns the number of bound atoms. */
  public int size() {
    return map.size();
  }

  /** Returns the bindings as a map. */
  public ImmutableMap<String, Boolean> asMap() {
    return map;
  }

  /**
   * Returns an interpretation that is the same as this but with an atom bound
   * to a value. If the atom was already bound, its value is replaced.
   */
  public Interpretation with(String name, boolean value) {
    final Boolean previous = map.get(name);
    if (previous != null && previous == value) {
      return this;
    }
    final Map<String, Boolean> map2 = new LinkedHashMap<>(map);
    map2.put(name, value);
    return of(map2);
  }

  /** Returns whether every atom in a formula is bound. */
  public boolean covers(Formula formula) {
    return map.keySet().containsAll(formula.atoms());
  }

  @Override public int hashCode() {
    return map.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Interpretation
        && map.equals(((Interpretation) o).map);
  }

  @Override public String toString() {
    return map.toString();
  }

  /** Builder for {@link Interpretation}. */
  public static class Builder {
    private final Map<String, Boolean> map = new LinkedHashMap<>();

    private Builder() {}

    /** Binds an atom to a value. */
    public Builder put(String name, boolean value) {
      checkName(name);
      map.put(name, value);
      return this;
    }

    /** Binds several atoms. */
    public Builder putAll(Map<String, Boolean> map) {
      map.forEach(this::put);
      return this;
    }

    public Interpretation build() {
      return of(map);
    }
  }
}

// End Interpretation.java
