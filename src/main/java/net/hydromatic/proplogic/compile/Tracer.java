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
package net.hydromatic.proplogic.compile;

import net.hydromatic.proplogic.ast.Formula;

/**
 * Called at various points during the transformation of a formula.
 *
 * @see Tracers
 */
public interface Tracer {
  /** Called at the end of each pass of the simplifier. */
  void onPass(int pass, Formula formula);

  /** Called when the simplifier rewrites a formula using a rule. */
  void onRewrite(Simplifier.Rule rule, Formula before, Formula after);

  /** Called when a step of normal form conversion has finished. */
  void onStep(NormalForms.Step step, Formula formula);
}

// End Tracer.java
