/**
 * This package contains the syntax tree produced by the parser: one class
 * per statement and expression kind, the visitor interface that analyzers
 * implement, and helpers for walking and printing trees.
 */
package exm.pseudo.ast;
