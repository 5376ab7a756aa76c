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

public class Identifier extends Expression implements LValue {

  private final String name;

  public Identifier(SourcePosition position, String name) {
    super(position);
    this.name = Preconditions.checkNotNull(name);
  }

  public String getName() {
    return name;
  }

  @Override
  public Identifier rootVariable() {
    return this;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitIdentifier(this);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Identifier &&
           name.equals(((Identifier)obj).name);
  }
}
