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

public class IfStmt extends Statement {

  private final Expression condition;
  private final ImmutableList<Statement> thenBranch;
  /** null if there was no ELSE */
  private final ImmutableList<Statement> elseBranch;

  public IfStmt(SourcePosition position, Expression condition,
          List<Statement> thenBranch, List<Statement> elseBranch) {
    super(position);
    this.condition = Preconditions.checkNotNull(condition);
    this.thenBranch = ImmutableList.copyOf(thenBranch);
    this.elseBranch = elseBranch == null ? null :
                                     ImmutableList.copyOf(elseBranch);
  }

  public Expression getCondition() {
    return condition;
  }

  public ImmutableList<Statement> getThenBranch() {
    return thenBranch;
  }

  /**
   * @return else statements, or null if there was no ELSE.  An ELSE with
   *        no statements gives an empty list.
   */
  public ImmutableList<Statement> getElseBranch() {
    return elseBranch;
  }

  public boolean hasElse() {
    return elseBranch != null;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitIf(this);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(condition, thenBranch, elseBranch);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof IfStmt)) {
      return false;
    }
    IfStmt other = (IfStmt)obj;
    return condition.equals(other.condition) &&
           thenBranch.equals(other.thenBranch) &&
           Objects.equal(elseBranch, other.elseBranch);
  }
}
