package com.crustylang.compiler.ast.decl;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.Visibility;
import com.crustylang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 宏定义（{@code #define __NAME__(a, b) body}）。宏体是同一行剩余的 Token，不解析。
 */
public final class MacroDefinition extends Item {
    private final String name;
    private final List<String> params;
    private final boolean functionLike;
    private final List<Token> body;

    public MacroDefinition(SourceLocation location, String name, List<String> params,
                           boolean functionLike, List<Token> body) {
        super(location, null, Visibility.PUBLIC);
        this.name = name;
        this.params = Collections.unmodifiableList(new ArrayList<String>(params));
        this.functionLike = functionLike;
        this.body = Collections.unmodifiableList(new ArrayList<Token>(body));
    }

    @Override
    public String getName() {
        return name;
    }

    public List<String> getParams() {
        return params;
    }

    /** 名字后是否紧跟参数列表（即使为空） */
    public boolean isFunctionLike() {
        return functionLike;
    }

    public List<Token> getBody() {
        return body;
    }

    public boolean isParam(String identifier) {
        return params.contains(identifier);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMacroDefinition(this, context);
    }
}
