package com.crustylang.compiler.analysis;

import com.crustylang.compiler.ast.AstNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 作用域
 */
public final class Scope {

    public enum ScopeType {
        GLOBAL,             // 顶层
        FUNCTION,           // 函数体
        NESTED_FUNCTION,    // 嵌套函数体
        LOOP,               // while/loop/for 循环体
        BLOCK               // if/switch/普通代码块
    }

    private final ScopeType type;
    private final Scope parent;
    private final AstNode node;
    private final Map<String, Symbol> symbols = new LinkedHashMap<String, Symbol>();

    // 循环标签（LOOP 作用域）
    private String label;

    public Scope(ScopeType type, Scope parent, AstNode node) {
        this.type = type;
        this.parent = parent;
        this.node = node;
    }

    public ScopeType getType() { return type; }
    public Scope getParent() { return parent; }
    public AstNode getNode() { return node; }
    public Map<String, Symbol> getSymbols() { return symbols; }

    public String getLabel() { return label; }
    public void setLabel(String label) { this.label = label; }

    /** 注册符号到当前作用域 */
    public void define(Symbol symbol) {
        symbols.put(symbol.getName(), symbol);
    }

    /** 从当前作用域向上查找 */
    public Symbol resolve(String name) {
        Scope scope = this;
        while (scope != null) {
            Symbol s = scope.symbols.get(name);
            if (s != null) return s;
            scope = scope.parent;
        }
        return null;
    }

    /** 仅查找当前作用域 */
    public Symbol resolveLocal(String name) {
        return symbols.get(name);
    }

    /** 符号定义在哪个作用域（未找到返回 null） */
    public Scope findDefiningScope(String name) {
        Scope scope = this;
        while (scope != null) {
            if (scope.symbols.containsKey(name)) return scope;
            scope = scope.parent;
        }
        return null;
    }

    /** 是否为函数边界（函数体或嵌套函数体） */
    public boolean isFunctionBoundary() {
        return type == ScopeType.FUNCTION || type == ScopeType.NESTED_FUNCTION;
    }

    /** 最近的函数边界作用域 */
    public Scope getEnclosingFunction() {
        Scope scope = this;
        while (scope != null && !scope.isFunctionBoundary()) {
            scope = scope.parent;
        }
        return scope;
    }
}
