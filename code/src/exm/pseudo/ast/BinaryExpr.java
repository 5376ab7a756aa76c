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

public class BinaryExpr extends Expression {

  private final BinaryOperator op;
  private final Expression left;
  private final Expression right;

  /**
   * @param position position of the left operand's first token
   */
  public BinaryExpr(SourcePosition position, BinaryOperator op,
                    Expression left, Expression right) {
    super(position);
    this.op = Preconditions.checkNotNull(op);
    this.left = Preconditions.checkNotNull(left);
    this.right = Preconditions.checkNotNull(right);
  }

  public BinaryOperator getOp() {
    return op;
  }

  public Expression getLeft() {
    return left;
  }

  public Expression getRight() {
    return right;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitBinary(this);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(op, left, right);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof BinaryExpr)) {
      return false;
    }
    BinaryExpr other = (BinaryExpr)obj;
    return op == other.op && left.equals(other.left) &&
           right.equals(other.right);
  }
}
