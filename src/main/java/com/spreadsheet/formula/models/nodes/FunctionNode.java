package com.spreadsheet.formula.models.nodes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named function call, e.g. {@code SUM(c1:c3, 10)}.
 */
public class FunctionNode extends FormulaNode {
    private final String name;
    private final List<FormulaNode> arguments;

    public FunctionNode(String name, List<FormulaNode> arguments) {
        this.name = name;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public String getName() {
        return name;
    }
    public List<FormulaNode> getArguments() {
        return arguments;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FUNCTION;
    }

    @Override
    public List<FormulaNode> getChildren() {
        return arguments;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(arguments.get(i));
        }
        return sb.append(')').toString();
    }
}
