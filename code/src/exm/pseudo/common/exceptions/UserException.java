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

/**
 * Represents an error caused by user input
 * Thus, this should contain good error message information
 * */
public class UserException
extends Exception
{
  private final int line;
  private final int column;

  /**
   * @param line 1-based line, or 0 if unknown
   * @param column 1-based column, or 0 if unknown
   */
  public UserException(int line, int column, String message) {
    super(formatLocation(line, column) + message);
    this.line = line;
    this.column = column;
  }

  public UserException(String message) {
    this(0, 0, message);
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  private static String formatLocation(int line, int column) {
    if (line <= 0) {
      return "";
    }
    return line + ":" + (column > 0 ? column + ":" : "") + " ";
  }

  private static final long serialVersionUID = 1L;
}
