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

public class ReturnStmt extends Statement {

  /** null for a bare RETURN */
  private final Expression value;

  public ReturnStmt(SourcePosition position, Expression value) {
    super(position);
    this.value = value;
  }

  public Expression getValue() {
    return value;
  }

  public boolean hasValue() {
    return value != null;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitReturn(this);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(value) + 5;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof ReturnStmt &&
           Objects.equal(value, ((ReturnStmt)obj).value);
  }
}
