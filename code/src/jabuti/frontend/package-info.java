/**
 * The frontend package contains the classes that take the contract syntax
 * tree, analyze it (clause and term extraction, message-condition type
 * inference, symbol naming) and build the canonical contract model.
 */
package jabuti.frontend;
