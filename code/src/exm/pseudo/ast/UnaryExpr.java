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

public class UnaryExpr extends Expression {

  private final UnaryOperator op;
  private final Expression operand;

  public UnaryExpr(SourcePosition position, UnaryOperator op,
                   Expression operand) {
    super(position);
    this.op = Preconditions.checkNotNull(op);
    this.operand = Preconditions.checkNotNull(operand);
  }

  public UnaryOperator getOp() {
    return op;
  }

  public Expression getOperand() {
    return operand;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitUnary(this);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(op, operand);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof UnaryExpr)) {
      return false;
    }
    UnaryExpr other = (UnaryExpr)obj;
    return op == other.op && operand.equals(other.operand);
  }
}
