package jabuti.frontend;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import jabuti.ast.ContractAST;
import jabuti.ast.NodeKind;
import jabuti.common.Logging;

/**
 * Helper functions to augment log messages with contextual information about
 * the current node.
 *
 */
public class LogHelper {
  static final Logger logger = Logging.getJabutiLogger();

  /**
   * @param tokenType token type from syntax tree
   * @return descriptive string containing node kind, or token number if
   *        unknown token type
   */
  public static String tokName(int tokenType) {
    NodeKind kind = NodeKind.fromTokenType(tokenType);
    if (kind == NodeKind.UNKNOWN) {
      return "Invalid token number (" + tokenType + ")";
    } else {
      return kind.name();
    }
  }

  public static void debug(ContractAST tree, String msg) {
    log(0, Level.DEBUG, tree.position() + ": ", msg);
  }

  /**
   * Trace a node being visited, with its kind and position
   */
  public static void traceNode(int indent, ContractAST tree) {
    if (logger.isTraceEnabled()) {
      log(indent, Level.TRACE, tree.position() + " ",
          tokName(tree.getType()));
    }
  }

  public static void log(int indent, Level level, String location, String msg) {
    StringBuilder sb = new StringBuilder(256);
    sb.append(location);
    for (int i = 0; i < indent; i++)
      sb.append(' ');
    sb.append(msg);
    logger.log(level, sb.toString());
  }
}
