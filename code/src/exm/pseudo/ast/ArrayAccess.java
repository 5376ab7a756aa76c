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

import java.util.List;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * One bracketed index suffix applied to a base expression.
 *
 * Each bracket pair becomes its own node, applied left to right, so
 * {@code m[i][j]} is {@code ArrayAccess(ArrayAccess(m, [i]), [j])}.
 * Comma-separated indices inside a single pair, as in {@code m[i, j]},
 * share one node: {@code ArrayAccess(m, [i, j])}.
 */
public class ArrayAccess extends Expression implements LValue {

  private final Expression base;
  private final ImmutableList<Expression> indices;

  public ArrayAccess(SourcePosition position, Expression base,
                     List<Expression> indices) {
    super(position);
    Preconditions.checkArgument(!indices.isEmpty(), "no indices");
    this.base = Preconditions.checkNotNull(base);
    this.indices = ImmutableList.copyOf(indices);
  }

  public Expression getBase() {
    return base;
  }

  public ImmutableList<Expression> getIndices() {
    return indices;
  }

  /**
   * @return number of dimensions indexed through this node and any nested
   *        accesses in its base
   */
  public int totalDepth() {
    int depth = indices.size();
    if (base instanceof ArrayAccess) {
      depth += ((ArrayAccess)base).totalDepth();
    }
    return depth;
  }

  /**
   * @return the named variable at the bottom of the chain, or null if
   *        the base is not a variable (e.g. a call result)
   */
  @Override
  public Identifier rootVariable() {
    if (base instanceof LValue) {
      return ((LValue)base).rootVariable();
    }
    return null;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitArrayAccess(this);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(base, indices);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ArrayAccess)) {
      return false;
    }
    ArrayAccess other = (ArrayAccess)obj;
    return base.equals(other.base) && indices.equals(other.indices);
  }
}
