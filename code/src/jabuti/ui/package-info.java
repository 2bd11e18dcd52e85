/**
 * Entry point used by compiler drivers to run the canonicalization stage.
 */
package jabuti.ui;
