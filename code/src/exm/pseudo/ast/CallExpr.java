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
 * Call site: callee(args).  Written with or without a leading CALL.
 */
public class CallExpr extends Expression {

  private final Identifier callee;
  private final ImmutableList<Expression> args;

  public CallExpr(SourcePosition position, Identifier callee,
                  List<Expression> args) {
    super(position);
    this.callee = Preconditions.checkNotNull(callee);
    this.args = ImmutableList.copyOf(args);
  }

  public Identifier getCallee() {
    return callee;
  }

  public ImmutableList<Expression> getArgs() {
    return args;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitCall(this);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(callee, args);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof CallExpr)) {
      return false;
    }
    CallExpr other = (CallExpr)obj;
    return callee.equals(other.callee) && args.equals(other.args);
  }
}
