/**
 * This package contains the syntax tree representation handed over by the
 * contract parser front end, and the node kinds used to discriminate it.
 */
package jabuti.ast;
