package com.crustylang.compiler.ast.decl;

import com.crustylang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 属性（{@code #[derive(Debug, Clone)]}）。参数保存为原始文本，原样透传。
 */
public final class Attribute {
    private final SourceLocation location;
    private final String name;
    private final List<String> args;

    public Attribute(SourceLocation location, String name, List<String> args) {
        this.location = location;
        this.name = name;
        this.args = Collections.unmodifiableList(new ArrayList<String>(args));
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }

    public List<String> getArgs() {
        return args;
    }

    public boolean hasArgs() {
        return !args.isEmpty();
    }

    /** 方括号内的文本，如 {@code derive(Debug, Clone)} */
    public String toSourceString() {
        if (args.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name).append("(");
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(args.get(i));
        }
        return sb.append(")").toString();
    }
}
