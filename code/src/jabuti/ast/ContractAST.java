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
package jabuti.ast;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.antlr.runtime.Token;
import org.antlr.runtime.tree.CommonTree;

import jabuti.common.exceptions.MalformedTreeError;

/**
 * A custom tree class for the contract syntax tree.  Nodes keep every
 * token of the source, so that production nodes have their punctuation
 * and keywords as children.
 */
public class ContractAST extends CommonTree {

  public ContractAST(Token t) {
    super(t);
  }

  public NodeKind kind() {
    return NodeKind.fromTokenType(getType());
  }

  /**
   * Shorter alternative to getChildCount()
   */
  public int childCount() {
    return getChildCount();
  }

  /**
   * alternative to getChild so we can avoid having the cast to
   * ContractAST everywhere
   */
  public ContractAST child(int i) {
    return (ContractAST)super.getChild(i);
  }

  /**
   * Child in a position the grammar guarantees
   * @throws MalformedTreeError if the slot is empty
   */
  public ContractAST requiredChild(int i, String what) {
    if (i >= childCount()) {
      throw new MalformedTreeError(this, "missing " + what + " (child " + i
                    + " of " + childCount() + ")");
    }
    return child(i);
  }

  @SuppressWarnings({ "unchecked", "rawtypes" })
  public List<ContractAST> children() {
    if (children == null) {
      return Collections.emptyList();
    }
    return (List)(this.children);
  }

  public List<ContractAST> children(int start) {
    // Return empty list if nothing in range
    if (childCount() <= start) {
      return Collections.emptyList();
    }
    return children().subList(start, children.size());
  }

  /**
   * @return direct children of the given kind, in source order
   */
  public List<ContractAST> children(NodeKind kind) {
    List<ContractAST> result = new ArrayList<ContractAST>();
    for (ContractAST child: children()) {
      if (child.kind() == kind) {
        result.add(child);
      }
    }
    return result;
  }

  /**
   * @return first direct child of the given kind, null if none
   */
  public ContractAST firstChild(NodeKind kind) {
    for (ContractAST child: children()) {
      if (child.kind() == kind) {
        return child;
      }
    }
    return null;
  }

  /**
   * Source text covered by this node: the token text for a leaf, otherwise
   * the concatenated text of all leaves below it.
   */
  public String text() {
    if (childCount() == 0) {
      String t = getText();
      return t == null ? "" : t;
    }
    StringBuilder sb = new StringBuilder();
    appendLeafText(sb);
    return sb.toString();
  }

  private void appendLeafText(StringBuilder sb) {
    if (childCount() == 0) {
      String t = getText();
      if (t != null) {
        sb.append(t);
      }
      return;
    }
    for (ContractAST child: children()) {
      child.appendLeafText(sb);
    }
  }

  /**
   * @return line:column of the node's token, for error messages
   */
  public String position() {
    return getLine() + ":" + getCharPositionInLine();
  }

  public String printTree() {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    writer.println("printTree:");
    printTree(writer, 0);
    return sw.toString();
  }

  private void printTree(PrintWriter writer, int indent) {
    indent(writer, indent);
    if (kind().isProduction()) {
      writer.println(kind());
    } else {
      writer.println(this.getText());
    }
    for (int i = 0; i < this.getChildCount(); i++)
      this.child(i).printTree(writer, indent+2);
  }

  public static void indent(PrintWriter writer, int indent)
  {
    for (int i = 0; i < indent; i++)
      writer.print(' ');
  }

}
