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

/**
 * Visits and transforms formulas.
 *
 * <p>The default implementation of each method rebuilds a node from the
 * transformed operands, and returns the original node if none of its operands
 * changed. Override the methods for the kinds of node you wish to transform.
 */
public class Shuttle {
  protected Formula visit(Formula.Constant constant) {
    return constant;
  }

  protected Formula visit(Formula.Atom atom) {
    return atom;
  }

  protected Formula visit(Formula.Not not) {
    return not.copy(not.operand.accept(this));
  }

  protected Formula visit(Formula.Binary binary) {
    return binary.copy(binary.left.accept(this), binary.right.accept(this));
  }
}

// End Shuttle.java
