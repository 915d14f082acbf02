package com.crustylang.compiler.ast.type;

import com.crustylang.compiler.ast.AstNode;
import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 类型引用基类。
 *
 * <p>类型是结构化的值对象：{@code equals}/{@code hashCode} 只比较结构，不比较源码位置。
 * {@link #getComponents()} 与 {@link #withComponents(List)} 让解析、兼容性判断等算法
 * 可以用显式栈遍历任意深度的类型，而不依赖递归。</p>
 */
public abstract class TypeRef extends AstNode {
    // 语义分析后填充：展开别名后的类型
    protected TypeRef resolvedType;

    protected TypeRef(SourceLocation location) {
        super(location);
    }

    public TypeRef getResolvedType() {
        return resolvedType;
    }

    public void setResolvedType(TypeRef type) {
        this.resolvedType = type;
    }

    /** 直接子类型（按固定顺序） */
    public List<TypeRef> getComponents() {
        return Collections.emptyList();
    }

    /**
     * 用新的子类型重建同种类型节点。
     *
     * @param components 与 {@link #getComponents()} 同序、同数量的子类型
     */
    public TypeRef withComponents(List<TypeRef> components) {
        return this;
    }

    /** 同种类型节点的非结构属性是否相等（可变性、数组长度、名字等） */
    public abstract boolean shallowEquals(TypeRef other);

    /** 非结构属性的哈希 */
    protected abstract int shallowHash();

    /** Crusty 源码形式，用于诊断与格式化 */
    public abstract String toDisplayString();

    /** 接受轻量 TypeRefVisitor 进行类型引用分派 */
    public abstract <R> R accept(TypeRefVisitor<R> visitor);

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTypeRef(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeRef)) return false;
        return TypeEquality.structurallyEqual(this, (TypeRef) o);
    }

    @Override
    public int hashCode() {
        return TypeEquality.structuralHash(this);
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
