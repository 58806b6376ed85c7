package com.logprog;

import com.logprog.ast.*;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Converts program syntax trees back to program text.
 *
 * <p>Output uses two spaces of indentation per nesting level, single spaces around
 * binary operators and {@code \n} line endings. String literals are written without
 * escaping their content, so a literal holding a quote produces text that will not
 * parse again.</p>
 *
 * <p>An instance keeps its buffers between calls and is not thread-safe; use one
 * instance per thread.</p>
 */
public class Unparser {
    private static final int INDENT_WIDTH = 2;

    private static final Map<Operator, String> BINARY_TOKENS = new EnumMap<>(Operator.class);
    static {
        BINARY_TOKENS.put(Operator.LT, " < ");
        BINARY_TOKENS.put(Operator.GT, " > ");
        BINARY_TOKENS.put(Operator.LE, " <= ");
        BINARY_TOKENS.put(Operator.GE, " >= ");
        BINARY_TOKENS.put(Operator.EQ, " == ");
        BINARY_TOKENS.put(Operator.NE, " != ");
        BINARY_TOKENS.put(Operator.SHL, " << ");
        BINARY_TOKENS.put(Operator.SHR, " >> ");
        BINARY_TOKENS.put(Operator.AND, " & ");
        BINARY_TOKENS.put(Operator.OR, " | ");
        BINARY_TOKENS.put(Operator.XOR, " ^ ");
        BINARY_TOKENS.put(Operator.NOT, " ~ ");
        BINARY_TOKENS.put(Operator.PLUS, " + ");
        BINARY_TOKENS.put(Operator.MINUS, " - ");
        BINARY_TOKENS.put(Operator.MUL, " * ");
        BINARY_TOKENS.put(Operator.DIV, " / ");
        BINARY_TOKENS.put(Operator.POW, " ** ");
        BINARY_TOKENS.put(Operator.ASSIGN, " = ");
        BINARY_TOKENS.put(Operator.ADD_ASSIGN, " += ");
    }

    private final Printer printer = new Printer();

    private int pos = 0;
    private final StringBuilder output = new StringBuilder();
    private final StringBuilder line = new StringBuilder();

    /**
     * Unparses the syntax tree rooted at {@code root}, returning the program text as a single string.
     *
     * A trailing line that was never terminated is returned as is, without indentation
     * or line ending, so an expression root yields just its text. A {@link StatementList}
     * root terminates every statement it holds.
     *
     * @throws MalformedTreeException if a node, or a name or pattern a node needs, is missing
     */
    public String unparse(Node root) {
        reset();
        unparse(root, "root");
        return output.toString() + line;
    }

    private void reset() {
        pos = 0;
        output.setLength(0);
        line.setLength(0);
    }

    // ========================================================================
    // Emitter
    // ========================================================================

    private void indent() {
        pos += INDENT_WIDTH;
    }

    private void outdent() {
        pos -= INDENT_WIDTH;
    }

    private void emit(String s) {
        line.append(s);
    }

    private void newline() {
        output.append(" ".repeat(pos)).append(line).append('\n');
        line.setLength(0);
    }

    // ========================================================================
    // Dispatch
    // ========================================================================

    private void unparse(Node n, String parent) {
        if (n == null) {
            throw new MalformedTreeException(parent, "unparser found undefined node under " + parent);
        }
        n.accept(printer);
    }

    private static String required(String value, Node node, String field) {
        if (value == null) {
            throw new MalformedTreeException(node.type(), node.type() + " has no " + field);
        }
        return value;
    }

    /**
     * Writes {@code opening}, then each child one level deeper, then the closing brace.
     * A child that leaves its line open (anything but a statement list) is terminated
     * before the next one starts, so the brace always sits on its own line.
     */
    private void block(String opening, List<Node> children, String parent) {
        emit(opening);
        newline();
        indent();
        if (children != null) {
            for (Node child : children) {
                unparse(child, parent);
                if (line.length() > 0) {
                    newline();
                }
            }
        }
        outdent();
        emit("}");
    }

    /**
     * Token written between the operands of a binary expression. Operators that cannot
     * appear in binary position yield an empty token.
     */
    static String binaryToken(Operator op) {
        if (op == null) {
            return "";
        }
        return BINARY_TOKENS.getOrDefault(op, "");
    }

    private static String keyword(MetricKind kind) {
        if (kind == null) {
            return "";
        }
        switch (kind) {
            case COUNTER:
                return "counter ";
            case GAUGE:
                return "gauge ";
            case TIMER:
                return "timer ";
            default:
                return "";
        }
    }

    private class Printer implements NodeVisitor<Void> {

        @Override
        public Void visit(StatementList node) {
            if (node.children() != null) {
                for (Node child : node.children()) {
                    unparse(child, node.type());
                    newline();
                }
            }
            return null;
        }

        @Override
        public Void visit(ExpressionList node) {
            List<Node> children = node.children();
            if (children != null && !children.isEmpty()) {
                unparse(children.get(0), node.type());
                for (Node child : children.subList(1, children.size())) {
                    emit(", ");
                    unparse(child, node.type());
                }
            }
            return null;
        }

        @Override
        public Void visit(Conditional node) {
            if (node.cond() != null) {
                unparse(node.cond(), node.type());
            }
            block(" {", node.children(), node.type());
            return null;
        }

        @Override
        public Void visit(Regex node) {
            emit("/" + required(node.pattern(), node, "pattern").replace("/", "\\/") + "/");
            return null;
        }

        @Override
        public Void visit(BinaryExpr node) {
            unparse(node.lhs(), node.type());
            emit(binaryToken(node.op()));
            unparse(node.rhs(), node.type());
            return null;
        }

        @Override
        public Void visit(UnaryExpr node) {
            if (node.op() == Operator.INC) {
                unparse(node.operand(), node.type());
                emit("++");
            } else if (node.op() == Operator.NOT) {
                emit(" ~");
                unparse(node.operand(), node.type());
            }
            return null;
        }

        @Override
        public Void visit(StringLiteral node) {
            emit("\"" + required(node.text(), node, "text") + "\"");
            return null;
        }

        @Override
        public Void visit(Identifier node) {
            emit(required(node.name(), node, "name"));
            return null;
        }

        @Override
        public Void visit(CaptureRef node) {
            emit("$" + required(node.name(), node, "name"));
            return null;
        }

        @Override
        public Void visit(Builtin node) {
            emit(required(node.name(), node, "name") + "(");
            if (node.args() != null) {
                unparse(node.args(), node.type());
            }
            emit(")");
            return null;
        }

        @Override
        public Void visit(IndexedExpr node) {
            unparse(node.lhs(), node.type());
            emit("[");
            unparse(node.index(), node.type());
            emit("]");
            return null;
        }

        @Override
        public Void visit(Declaration node) {
            String name = required(node.name(), node, "name");
            List<String> keys = node.keys() == null ? List.of() : node.keys();
            for (String key : keys) {
                required(key, node, "key");
            }
            emit(keyword(node.kind()));
            emit(name);
            if (!keys.isEmpty()) {
                emit(" by " + String.join(", ", keys));
            }
            return null;
        }

        @Override
        public Void visit(NumericExpr node) {
            emit(Long.toString(node.value()));
            return null;
        }

        @Override
        public Void visit(FunctionDef node) {
            block("def " + required(node.name(), node, "name") + " {", node.children(), node.type());
            return null;
        }

        @Override
        public Void visit(Decorator node) {
            block("@" + required(node.name(), node, "name") + " {", node.children(), node.type());
            return null;
        }

        @Override
        public Void visit(Next node) {
            emit("next");
            return null;
        }
    }
}
