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
 * Declared type: an element type plus zero or more array dimension sizes.
 * Sizes are arbitrary expressions so symbolic bounds like n survive.
 */
public class TypeSpec {

  private final PrimitiveType primitive;
  private final ImmutableList<Expression> dimensions;

  public TypeSpec(PrimitiveType primitive, List<Expression> dimensions) {
    this.primitive = Preconditions.checkNotNull(primitive);
    this.dimensions = ImmutableList.copyOf(dimensions);
  }

  public static TypeSpec scalar(PrimitiveType primitive) {
    return new TypeSpec(primitive, ImmutableList.<Expression>of());
  }

  public PrimitiveType getPrimitive() {
    return primitive;
  }

  public ImmutableList<Expression> getDimensions() {
    return dimensions;
  }

  public boolean isArray() {
    return !dimensions.isEmpty();
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(primitive, dimensions);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof TypeSpec)) {
      return false;
    }
    TypeSpec other = (TypeSpec)obj;
    return primitive == other.primitive &&
           dimensions.equals(other.dimensions);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(primitive.toString());
    for (int i = 0; i < dimensions.size(); i++) {
      sb.append("[]");
    }
    return sb.toString();
  }
}
