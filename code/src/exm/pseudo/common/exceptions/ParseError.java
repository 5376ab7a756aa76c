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

package exm.pseudo.common.exceptions;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import exm.pseudo.lexer.TokenKind;

/**
 * Terminal failure of a parse call.  Carries the 1-based position of the
 * offending source text and, where the parser knows it, the set of token
 * kinds that would have been accepted there.
 */
public abstract class ParseError extends UserException {

  private final Set<TokenKind> expectedKinds;
  private final String detail;

  protected ParseError(int line, int column, String message,
                       Collection<TokenKind> expectedKinds) {
    super(line, column, message);
    this.detail = message;
    if (expectedKinds == null || expectedKinds.isEmpty()) {
      this.expectedKinds = Collections.emptySet();
    } else {
      this.expectedKinds = Collections.unmodifiableSet(
                                        EnumSet.copyOf(expectedKinds));
    }
  }

  /**
   * @return message without the position prefix
   */
  public String getDetail() {
    return detail;
  }

  /**
   * @return token kinds accepted at the error position, empty if unknown
   */
  public Set<TokenKind> getExpectedKinds() {
    return expectedKinds;
  }

  private static final long serialVersionUID = 1L;
}
