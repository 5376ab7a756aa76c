/**
 * The parser package turns the lexer's token stream into a syntax tree.
 * PseudocodeParser is the entry point for callers.
 */
package exm.pseudo.parser;
