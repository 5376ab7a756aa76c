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
 * Constant value.  The Java type of the value depends on the kind:
 * Long for INTEGER, Double for REAL, String for STRING and Boolean for
 * BOOLEAN.
 */
public class Literal extends Expression {

  public static enum LiteralKind {
    INTEGER,
    REAL,
    STRING,
    BOOLEAN;
  }

  private final LiteralKind kind;
  private final Object value;

  private Literal(SourcePosition position, LiteralKind kind, Object value) {
    super(position);
    this.kind = kind;
    this.value = Preconditions.checkNotNull(value);
  }

  public static Literal ofInteger(SourcePosition position, long value) {
    return new Literal(position, LiteralKind.INTEGER, value);
  }

  public static Literal ofReal(SourcePosition position, double value) {
    return new Literal(position, LiteralKind.REAL, value);
  }

  public static Literal ofString(SourcePosition position, String value) {
    return new Literal(position, LiteralKind.STRING, value);
  }

  public static Literal ofBoolean(SourcePosition position, boolean value) {
    return new Literal(position, LiteralKind.BOOLEAN, value);
  }

  public LiteralKind getKind() {
    return kind;
  }

  public Object getValue() {
    return value;
  }

  public long getIntegerValue() {
    checkKind(LiteralKind.INTEGER);
    return (Long)value;
  }

  public double getRealValue() {
    checkKind(LiteralKind.REAL);
    return (Double)value;
  }

  public String getStringValue() {
    checkKind(LiteralKind.STRING);
    return (String)value;
  }

  public boolean getBooleanValue() {
    checkKind(LiteralKind.BOOLEAN);
    return (Boolean)value;
  }

  private void checkKind(LiteralKind expected) {
    Preconditions.checkState(kind == expected,
        "Literal is %s, not %s", kind, expected);
  }

  @Override
  public <R> R accept(AstVisitor<R> visitor) {
    return visitor.visitLiteral(this);
  }

  @Override
  public int hashCode() {
    return kind.hashCode() * 31 + value.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Literal)) {
      return false;
    }
    Literal other = (Literal)obj;
    return kind == other.kind && value.equals(other.value);
  }
}
