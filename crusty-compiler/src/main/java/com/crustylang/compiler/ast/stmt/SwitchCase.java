package com.crustylang.compiler.ast.stmt;

import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * switch 分支：{@code case v1, v2: body}
 */
public final class SwitchCase {
    private final SourceLocation location;
    private final List<Expression> values;
    private final Block body;

    public SwitchCase(SourceLocation location, List<Expression> values, Block body) {
        this.location = location;
        this.values = Collections.unmodifiableList(new ArrayList<Expression>(values));
        this.body = body;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public List<Expression> getValues() {
        return values;
    }

    public Block getBody() {
        return body;
    }
}
