package jabuti.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import jabuti.frontend.tree.Literals;

/**
 * Builds contract syntax trees in the shape the parser front end produces,
 * keeping keywords and punctuation as children.
 */
public class Trees {

  private static final ContractTreeAdaptor adaptor = new ContractTreeAdaptor();

  public static ContractAST leaf(NodeKind kind, String text) {
    return adaptor.create(kind, text);
  }

  public static ContractAST node(NodeKind kind, ContractAST... children) {
    return node(kind, Arrays.asList(children));
  }

  public static ContractAST node(NodeKind kind, List<ContractAST> children) {
    ContractAST tree = adaptor.create(kind, kind.name());
    for (ContractAST child: children) {
      tree.addChild(child);
    }
    return tree;
  }

  public static ContractAST kw(String text) {
    return leaf(NodeKind.KEYWORD, text);
  }

  public static ContractAST sym(String text) {
    return leaf(NodeKind.SYMBOL, text);
  }

  public static ContractAST name(String text) {
    return node(NodeKind.VARIABLE_NAME, leaf(NodeKind.ID, text));
  }

  /**
   * Operand node of the kind the parser would produce for the text
   */
  public static ContractAST operand(String text) {
    if (Literals.isNumeric(text)) {
      return node(NodeKind.NUMBER, leaf(NodeKind.LITERAL, text));
    } else if (Literals.isQuoted(text)) {
      return node(NodeKind.STRING, leaf(NodeKind.LITERAL, text));
    } else {
      return name(text);
    }
  }

  public static ContractAST contract(String contractName,
                                     ContractAST... sections) {
    List<ContractAST> children = new ArrayList<ContractAST>();
    children.add(kw("contract"));
    children.add(name(contractName));
    children.add(sym("{"));
    children.addAll(Arrays.asList(sections));
    children.add(sym("}"));
    return node(NodeKind.CONTRACT, children);
  }

  public static ContractAST dates(String beginDate, String dueDate) {
    return node(NodeKind.DATES, kw("dates"), sym("{"),
        node(NodeKind.BEGIN_DATE, kw("beginDate"), sym("="),
             leaf(NodeKind.DATETIME, beginDate)),
        node(NodeKind.DUE_DATE, kw("dueDate"), sym("="),
             leaf(NodeKind.DATETIME, dueDate)),
        sym("}"));
  }

  public static ContractAST parties(String application, String process) {
    return node(NodeKind.PARTIES, kw("parties"), sym("{"),
        node(NodeKind.APPLICATION, kw("application"), sym("="),
             leaf(NodeKind.LITERAL, application)),
        node(NodeKind.PROCESS, kw("process"), sym("="),
             leaf(NodeKind.LITERAL, process)),
        sym("}"));
  }

  public static ContractAST clauses(ContractAST... clauses) {
    List<ContractAST> children = new ArrayList<ContractAST>();
    children.add(kw("clauses"));
    children.add(sym("{"));
    children.addAll(Arrays.asList(clauses));
    children.add(sym("}"));
    return node(NodeKind.CLAUSES, children);
  }

  public static ContractAST rolePlayer(String party) {
    return node(NodeKind.ROLE_PLAYER, kw("rolePlayer"), sym("="),
                leaf(NodeKind.ID, party));
  }

  public static ContractAST clause(String kind, String clauseName,
                                   String party, ContractAST... body) {
    List<ContractAST> children = new ArrayList<ContractAST>();
    children.add(kw(kind));
    children.add(name(clauseName));
    children.add(sym("{"));
    children.add(rolePlayer(party));
    children.addAll(Arrays.asList(body));
    children.add(sym("}"));
    return node(NodeKind.CLAUSE, children);
  }

  /**
   * Terms block with one term per operation
   */
  public static ContractAST terms(ContractAST... operations) {
    List<ContractAST> children = new ArrayList<ContractAST>();
    children.add(kw("terms"));
    children.add(sym("{"));
    for (ContractAST op: operations) {
      children.add(node(NodeKind.TERM_OR_WHEN, node(NodeKind.TERM, op)));
    }
    children.add(sym("}"));
    return node(NodeKind.TERMS, children);
  }

  public static ContractAST timeout(String value) {
    return node(NodeKind.TIMEOUT, kw("timeout"), sym("="), operand(value));
  }

  public static ContractAST presenceCheck(String argument) {
    return node(NodeKind.MESSAGE_CONTENT, kw("messageContent"), sym("("),
                operand(argument), sym(")"));
  }

  public static ContractAST comparison(String left, String comparator,
                                       String right) {
    return node(NodeKind.MESSAGE_CONTENT, kw("messageContent"), sym("("),
                operand(left), leaf(NodeKind.COMPARATOR, comparator),
                operand(right), sym(")"));
  }

  public static ContractAST onBreach(String message) {
    return node(NodeKind.ON_BREACH, kw("onBreach"), sym("("), kw("log"),
                sym("("), leaf(NodeKind.LITERAL, message), sym(")"),
                sym(")"));
  }
}
