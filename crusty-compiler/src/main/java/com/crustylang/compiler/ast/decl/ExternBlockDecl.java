package com.crustylang.compiler.ast.decl;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.Visibility;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 外部函数块（{@code extern "C" { ... }}），签名原样透传
 */
public final class ExternBlockDecl extends Item {
    private final String abi;
    private final List<FunctionDecl> functions;

    public ExternBlockDecl(SourceLocation location, List<Attribute> attributes,
                           String abi, List<FunctionDecl> functions) {
        super(location, attributes, Visibility.PUBLIC);
        this.abi = abi;
        this.functions = Collections.unmodifiableList(new ArrayList<FunctionDecl>(functions));
    }

    @Override
    public String getName() {
        return "extern \"" + abi + "\"";
    }

    public String getAbi() {
        return abi;
    }

    public List<FunctionDecl> getFunctions() {
        return functions;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExternBlockDecl(this, context);
    }
}
