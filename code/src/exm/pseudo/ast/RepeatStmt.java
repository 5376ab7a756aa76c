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
 * REPEAT body UNTIL condition: body runs at least once, and the loop
 * exits when the condition becomes true.
 */
public class RepeatStmt extends Statement {

  private final ImmutableList<Statement> body;
  private final Expression condition;

  public RepeatStmt(SourcePosition position, List<Statement> body,
                    Expression condition) {
    super(position);
    this.body = ImmutableList.copyOf(body);
    this.condition = Preconditions.checkNotNull(condition);
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  public Expression getCondition() {
    return condition;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitRepeat(this);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(body, condition);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof RepeatStmt)) {
      return false;
    }
    RepeatStmt other = (RepeatStmt)obj;
    return body.equals(other.body) && condition.equals(other.condition);
  }
}
