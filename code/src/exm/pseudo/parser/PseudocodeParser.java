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

package exm.pseudo.parser;

import java.util.List;

import com.google.common.base.Preconditions;

import exm.pseudo.ast.Program;
import exm.pseudo.common.Settings;
import exm.pseudo.common.exceptions.InvalidOptionException;
import exm.pseudo.common.exceptions.LexicalError;
import exm.pseudo.common.exceptions.ParseError;
import exm.pseudo.lexer.Lexer;
import exm.pseudo.lexer.LexerOptions;
import exm.pseudo.lexer.Token;

/**
 * Entry point of the front end: source text in, syntax tree out.
 *
 * Holds only immutable configuration, so one instance can be shared
 * between threads; each call builds its own lexer and parser.
 */
public class PseudocodeParser {

  private final LexerOptions options;

  public PseudocodeParser() {
    this(LexerOptions.defaults());
  }

  public PseudocodeParser(LexerOptions options) {
    this.options = Preconditions.checkNotNull(options);
  }

  public PseudocodeParser(Settings settings) throws InvalidOptionException {
    this(settings.lexerOptions());
  }

  /**
   * Parse with the default configuration
   */
  public static Program parseSource(String source) throws ParseError {
    return new PseudocodeParser().parse(source);
  }

  public List<Token> tokenize(String source) throws LexicalError {
    Preconditions.checkNotNull(source, "source must not be null");
    return new Lexer(source, options).tokenize();
  }

  /**
   * @return the whole program; never a partial tree
   * @throws ParseError at the first lexical or syntax error
   */
  public Program parse(String source) throws ParseError {
    return new Parser(tokenize(source)).parseProgram();
  }
}
