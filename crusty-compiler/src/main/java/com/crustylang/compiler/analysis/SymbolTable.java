package com.crustylang.compiler.analysis;

import com.crustylang.compiler.ast.AstNode;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * 符号表：全局作用域与 AST 节点到作用域的映射
 */
public final class SymbolTable {
    private final Scope globalScope;
    private final Map<AstNode, Scope> nodeToScope = new IdentityHashMap<AstNode, Scope>();

    public SymbolTable() {
        this.globalScope = new Scope(Scope.ScopeType.GLOBAL, null, null);
    }

    public Scope getGlobalScope() { return globalScope; }

    /** 记录 AST 节点到作用域的映射 */
    public void mapNodeToScope(AstNode node, Scope scope) {
        nodeToScope.put(node, scope);
    }

    /** 节点打开的作用域（函数、代码块） */
    public Scope getScope(AstNode node) {
        return nodeToScope.get(node);
    }

    /** 在全局作用域查找 */
    public Symbol resolveGlobal(String name) {
        return globalScope.resolveLocal(name);
    }
}
