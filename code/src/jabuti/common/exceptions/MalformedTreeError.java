package jabuti.common.exceptions;

import jabuti.ast.ContractAST;
import jabuti.ast.NodeKind;

/**
 * A node lacks a child that the grammar guarantees in a fixed position.
 * Raised instead of producing an identifier from missing text.
 */
public class MalformedTreeError extends CanonicalizerRuntimeError {

  private final NodeKind nodeKind;

  public MalformedTreeError(ContractAST tree, String message) {
    super("Malformed " + tree.kind() + " node at " + tree.position()
          + ": " + message);
    this.nodeKind = tree.kind();
  }

  public NodeKind getNodeKind() {
    return nodeKind;
  }

  private static final long serialVersionUID = 1L;
}
