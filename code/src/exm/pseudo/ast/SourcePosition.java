/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exm.pseudo.ast;

/**
 * Simple immutable class to record line/column of a node's leading token.
 * Both are 1-based.
 */
public class SourcePosition {
  public final int line;
  public final int column;

  public SourcePosition(int line, int column) {
    super();
    this.line = line;
    this.column = column;
  }

  @Override
  public int hashCode() {
    return 31 * line + column;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof SourcePosition)) {
      return false;
    }
    SourcePosition other = (SourcePosition)obj;
    return line == other.line && column == other.column;
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
