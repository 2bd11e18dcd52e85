/**
 * The canonical contract model produced by the frontend.  All classes here
 * are immutable values.
 */
package jabuti.common.lang;
