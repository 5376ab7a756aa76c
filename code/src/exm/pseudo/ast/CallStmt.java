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

import com.google.common.base.Preconditions;

/**
 * A call made for its effect, with or without the CALL keyword.
 */
public class CallStmt extends Statement {

  private final CallExpr call;

  public CallStmt(SourcePosition position, CallExpr call) {
    super(position);
    this.call = Preconditions.checkNotNull(call);
  }

  public CallExpr getCall() {
    return call;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitCallStmt(this);
  }

  @Override
  public int hashCode() {
    return call.hashCode() + 3;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof CallStmt && call.equals(((CallStmt)obj).call);
  }
}
