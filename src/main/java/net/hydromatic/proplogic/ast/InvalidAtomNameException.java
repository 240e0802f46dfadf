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

/** Thrown when an atom is created with a name that is not valid. */
public class InvalidAtomNameException extends IllegalArgumentException {
  private final String name;

  /** Creates an InvalidAtomNameException. */
  public InvalidAtomNameException(String name) {
    super("invalid atom name '" + name + "'");
    this.name = name;
  }

  /** Returns the name that was rejected. */
  public String name() {
    return name;
  }
}

// End InvalidAtomNameException.java
