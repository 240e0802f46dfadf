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

import java.util.Objects;

/**
 * Position of a region of text, such as a token or the place where a parse
 * error occurred.
 *
 * <p>Offsets are 0-based character offsets into the text; the end offset is
 * exclusive. Lines and columns are 1-based.
 */
public class Pos {
  public final int startOffset;
  public final int endOffset;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;

  /** Creates a Pos. */
  public Pos(int startOffset, int endOffset, int startLine, int startColumn,
      int endLine, int endColumn) {
    this.startOffset = startOffset;
    this.endOffset = endOffset;
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  /** Creates a Pos from two offsets into a piece of text. */
  public static Pos of(String text, int startOffset, int endOffset) {
    checkArgument(startOffset >= 0 && startOffset <= endOffset
            && endOffset <= text.length(),
        "invalid range [%s, %s) in text of length %s", startOffset, endOffset,
        text.length());
    final int[] start = lineCol(text, startOffset);
    final int[] end = lineCol(text, endOffset);
    return new Pos(startOffset, endOffset, start[0], start[1], end[0],
        end[1]);
  }

  @Override public int hashCode() {
    return Objects.hash(startOffset, endOffset);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
        && this.startOffset == ((Pos) o).startOffset
        && this.endOffset == ((Pos) o).endOffset
        && this.startLine == ((Pos) o).startLine
        && this.startColumn == ((Pos) o).startColumn
        && this.endLine == ((Pos) o).endLine
        && this.endColumn == ((Pos) o).endColumn;
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /**
   * Appends a description of this position, such as "1.5" or "1.5-1.7", to a
   * builder.
   */
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(startLine)
        .append('.')
        .append(startColumn);
    if (endColumn > startColumn + 1 || endLine != startLine) {
      buf.append('-')
          .append(endLine)
          .append('.')
          .append(endColumn - 1);
    }
    return buf;
  }

  /** Returns the 1-based line and column of an offset. */
  private static int[] lineCol(String s, int offset) {
    int line = 1;
    int lineStart = 0;
    for (int i = 0; i < offset; i++) {
      if (s.charAt(i) == '\n') {
        ++line;
        lineStart = i + 1;
      }
    }
    return new int[] {line, offset - lineStart + 1};
  }
}

// End Pos.java
