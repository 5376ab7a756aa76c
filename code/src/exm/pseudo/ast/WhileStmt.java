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

public class WhileStmt extends Statement {

  private final Expression condition;
  private final ImmutableList<Statement> body;

  public WhileStmt(SourcePosition position, Expression condition,
                   List<Statement> body) {
    super(position);
    this.condition = Preconditions.checkNotNull(condition);
    this.body = ImmutableList.copyOf(body);
  }

  public Expression getCondition() {
    return condition;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitWhile(this);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(condition, body);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof WhileStmt)) {
      return false;
    }
    WhileStmt other = (WhileStmt)obj;
    return condition.equals(other.condition) && body.equals(other.body);
  }
}
