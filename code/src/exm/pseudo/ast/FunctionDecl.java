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
 * Function or procedure definition.  Recursive calls to it show up as
 * {@link CallExpr}s in the body whose callee has the same name.
 */
public class FunctionDecl extends Statement {

  private final Identifier name;
  private final ImmutableList<Identifier> params;
  private final ImmutableList<Statement> body;

  public FunctionDecl(SourcePosition position, Identifier name,
                      List<Identifier> params, List<Statement> body) {
    super(position);
    this.name = Preconditions.checkNotNull(name);
    this.params = ImmutableList.copyOf(params);
    this.body = ImmutableList.copyOf(body);
  }

  public Identifier getName() {
    return name;
  }

  public ImmutableList<Identifier> getParams() {
    return params;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitFunctionDecl(this);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, params, body);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof FunctionDecl)) {
      return false;
    }
    FunctionDecl other = (FunctionDecl)obj;
    return name.equals(other.name) && params.equals(other.params) &&
           body.equals(other.body);
  }
}
