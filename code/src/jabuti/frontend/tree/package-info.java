/**
 * Helper classes that read the parts of syntax tree nodes by name, so that
 * child positions are only known here.
 */
package jabuti.frontend.tree;
