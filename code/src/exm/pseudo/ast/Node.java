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

import com.google.common.base.Preconditions;

/**
 * Base of the closed set of syntax tree nodes.
 *
 * Nodes are immutable and own their children exclusively.  Equality is
 * structural: two nodes are equal if they have the same kind and equal
 * children, regardless of where in the source they came from, so the same
 * program written with Spanish or English keywords yields equal trees.
 */
public abstract class Node {

  private final SourcePosition position;

  protected Node(SourcePosition position) {
    this.position = Preconditions.checkNotNull(position);
  }

  /**
   * @return position of the first token of this construct
   */
  public SourcePosition getPosition() {
    return position;
  }

  public int getLine() {
    return position.line;
  }

  public abstract <R> R accept(AstVisitor<R> visitor);

  @Override
  public String toString() {
    return TreePrinter.print(this);
  }
}
