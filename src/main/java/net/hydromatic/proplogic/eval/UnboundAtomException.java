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

import com.google.common.collect.ImmutableSet;
import net.hydromatic.proplogic.ast.Formula;

/**
 * Thrown when a caller asks for the truth value of a formula but the
 * interpretation does not bind all of the formula's atoms.
 */
public class UnboundAtomException extends RuntimeException {
  private final ImmutableSet<String> atoms;
  private final Formula residual;

  UnboundAtomException(ImmutableSet<String> atoms, Formula residual) {
    super("unbound atom" + (atoms.size() == 1 ? " " : "s ")
        + String.join(", ", atoms));
    this.atoms = requireNonNull(atoms);
    this.residual = requireNonNull(residual);
  }

  /** Returns the names of the atoms that are unbound. */
  public ImmutableSet<String> atoms() {
    return atoms;
  }

  /** Returns the formula that remained after evaluation. */
  public Formula residual() {
    return residual;
  }
}

// End UnboundAtomException.java
