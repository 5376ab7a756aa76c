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
 * Counted loop.  The bounds and step are kept as arbitrary expressions,
 * so loops over symbolic ranges like 1 .. n - 1 can be analyzed.
 */
public class ForStmt extends Statement {

  private final Identifier loopVar;
  private final Expression from;
  private final Expression to;
  private final Expression step;
  private final ImmutableList<Statement> body;

  public ForStmt(SourcePosition position, Identifier loopVar,
                 Expression from, Expression to, Expression step,
                 List<Statement> body) {
    super(position);
    this.loopVar = Preconditions.checkNotNull(loopVar);
    this.from = Preconditions.checkNotNull(from);
    this.to = Preconditions.checkNotNull(to);
    this.step = step;
    this.body = ImmutableList.copyOf(body);
  }

  public Identifier getLoopVar() {
    return loopVar;
  }

  public Expression getFrom() {
    return from;
  }

  public Expression getTo() {
    return to;
  }

  /**
   * @return explicit step, or null if omitted
   */
  public Expression getStep() {
    return step;
  }

  public boolean hasStep() {
    return step != null;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitFor(this);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(loopVar, from, to, step, body);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ForStmt)) {
      return false;
    }
    ForStmt other = (ForStmt)obj;
    return loopVar.equals(other.loopVar) && from.equals(other.from) &&
           to.equals(other.to) && Objects.equal(step, other.step) &&
           body.equals(other.body);
  }
}
