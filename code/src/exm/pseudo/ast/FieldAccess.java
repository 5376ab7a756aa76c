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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * Named field of a base expression, as in {@code A.length}.  Field
 * suffixes chain with index suffixes left to right, so {@code A[i].x} is
 * {@code FieldAccess(ArrayAccess(A, [i]), x)}.
 */
public class FieldAccess extends Expression implements LValue {

  private final Expression base;
  private final Identifier field;

  public FieldAccess(SourcePosition position, Expression base,
                     Identifier field) {
    super(position);
    this.base = Preconditions.checkNotNull(base);
    this.field = Preconditions.checkNotNull(field);
  }

  public Expression getBase() {
    return base;
  }

  public Identifier getField() {
    return field;
  }

  @Override
  public Identifier rootVariable() {
    if (base instanceof LValue) {
      return ((LValue)base).rootVariable();
    }
    return null;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitFieldAccess(this);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(base, field);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof FieldAccess)) {
      return false;
    }
    FieldAccess other = (FieldAccess)obj;
    return base.equals(other.base) && field.equals(other.field);
  }
}
