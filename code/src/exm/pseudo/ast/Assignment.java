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

/**
 * target = value, or target <- value
 */
public class Assignment extends Statement {

  private final LValue target;
  private final Expression value;

  public Assignment(SourcePosition position, LValue target,
                    Expression value) {
    super(position);
    this.target = Preconditions.checkNotNull(target);
    this.value = Preconditions.checkNotNull(value);
  }

  public LValue getTarget() {
    return target;
  }

  public Expression getValue() {
    return value;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitAssignment(this);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(target, value);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Assignment)) {
      return false;
    }
    Assignment other = (Assignment)obj;
    return target.equals(other.target) && value.equals(other.value);
  }
}
