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
 * Root of a parsed source text.  Statements are in source order.
 */
public class Program extends Node {

  private final ImmutableList<Statement> statements;

  public Program(SourcePosition position, List<Statement> statements) {
    super(position);
    this.statements = ImmutableList.copyOf(statements);
  }

  public ImmutableList<Statement> getStatements() {
    return statements;
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitProgram(this);
  }

  @Override
  public int hashCode() {
    return statements.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Program &&
           statements.equals(((Program)obj).statements);
  }
}
