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

import com.google.common.collect.ImmutableList;

/**
 * BEGIN ... END, INICIO ... FIN or { ... }
 */
public class Block extends Statement {

  private final ImmutableList<Statement> statements;

  public Block(SourcePosition position, List<Statement> statements) {
    super(position);
    this.statements = ImmutableList.copyOf(statements);
  }

  public ImmutableList<Statement> getStatements() {
    return statements;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitBlock(this);
  }

  @Override
  public int hashCode() {
    return statements.hashCode() + 7;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Block &&
           statements.equals(((Block)obj).statements);
  }
}
