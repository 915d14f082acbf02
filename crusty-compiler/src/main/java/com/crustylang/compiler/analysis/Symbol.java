package com.crustylang.compiler.analysis;

import com.crustylang.compiler.ast.AstNode;
import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.Visibility;
import com.crustylang.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 符号表中的符号
 */
public final class Symbol {
    private final String name;
    private final SymbolKind kind;
    private final TypeRef type;             // 变量类型 / 函数返回类型，推断失败时为 null
    private final boolean mutable;          // true = var
    private final SourceLocation location;  // 声明位置
    private final AstNode declaration;      // 声明的 AST 节点
    private final Visibility visibility;

    // 函数参数类型（不含接收者）
    private List<TypeRef> parameterTypes = Collections.emptyList();

    public Symbol(String name, SymbolKind kind, TypeRef type, boolean mutable,
                  SourceLocation location, AstNode declaration, Visibility visibility) {
        this.name = name;
        this.kind = kind;
        this.type = type;
        this.mutable = mutable;
        this.location = location;
        this.declaration = declaration;
        this.visibility = visibility != null ? visibility : Visibility.PUBLIC;
    }

    public String getName() { return name; }
    public SymbolKind getKind() { return kind; }
    public TypeRef getType() { return type; }
    public boolean isMutable() { return mutable; }
    public SourceLocation getLocation() { return location; }
    public AstNode getDeclaration() { return declaration; }
    public Visibility getVisibility() { return visibility; }

    public List<TypeRef> getParameterTypes() { return parameterTypes; }

    public void setParameterTypes(List<TypeRef> parameterTypes) {
        this.parameterTypes = Collections.unmodifiableList(new ArrayList<TypeRef>(parameterTypes));
    }

    /** 是否为可调用的函数符号 */
    public boolean isCallable() {
        return kind == SymbolKind.FUNCTION || kind == SymbolKind.NESTED_FUNCTION
                || kind == SymbolKind.EXTERN_FUNCTION;
    }

    /** 是否为函数内的局部绑定（可被嵌套函数捕获） */
    public boolean isLocal() {
        return kind == SymbolKind.VARIABLE || kind == SymbolKind.PARAMETER;
    }
}
