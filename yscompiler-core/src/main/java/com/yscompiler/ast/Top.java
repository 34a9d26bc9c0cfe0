package com.yscompiler.ast;

import java.util.List;

/**
 * Root of a constructed program: the ordered top-level forms.
 */
public record Top(List<Node> forms) {
    public Top {
        forms = List.copyOf(forms);
    }

    public Top(Node... forms) {
        this(List.of(forms));
    }

    public String type() {
        return "Top";
    }
}
