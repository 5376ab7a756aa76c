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
 * Declaration of one or more variables sharing a type and an optional
 * initializer, e.g. {@code ENTERO a, b = 0}.
 */
public class VarDecl extends Statement {

  private final TypeSpec type;
  private final ImmutableList<Identifier> names;
  private final Expression initializer;

  public VarDecl(SourcePosition position, TypeSpec type,
                 List<Identifier> names, Expression initializer) {
    super(position);
    Preconditions.checkArgument(!names.isEmpty(), "no names declared");
    this.type = Preconditions.checkNotNull(type);
    this.names = ImmutableList.copyOf(names);
    this.initializer = initializer;
  }

  public TypeSpec getType() {
    return type;
  }

  public ImmutableList<Identifier> getNames() {
    return names;
  }

  /**
   * @return shared initial value, or null if none
   */
  public Expression getInitializer() {
    return initializer;
  }

  public boolean hasInitializer() {
    return initializer != null;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitVarDecl(this);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(type, names, initializer);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof VarDecl)) {
      return false;
    }
    VarDecl other = (VarDecl)obj;
    return type.equals(other.type) && names.equals(other.names) &&
           Objects.equal(initializer, other.initializer);
  }
}
