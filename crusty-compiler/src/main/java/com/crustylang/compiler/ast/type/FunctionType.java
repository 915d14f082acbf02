package com.crustylang.compiler.ast.type;

import com.crustylang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数类型。源码中没有直接写法，由函数声明推导，用于符号表。
 *
 * <p>组成部分顺序：参数类型在前，返回类型在最后。</p>
 */
public final class FunctionType extends TypeRef {
    private final List<TypeRef> paramTypes;
    private final TypeRef returnType;

    public FunctionType(SourceLocation location, List<TypeRef> paramTypes, TypeRef returnType) {
        super(location);
        this.paramTypes = Collections.unmodifiableList(new ArrayList<TypeRef>(paramTypes));
        this.returnType = returnType;
    }

    public List<TypeRef> getParamTypes() {
        return paramTypes;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    @Override
    public List<TypeRef> getComponents() {
        List<TypeRef> all = new ArrayList<TypeRef>(paramTypes);
        all.add(returnType);
        return all;
    }

    @Override
    public TypeRef withComponents(List<TypeRef> components) {
        int n = components.size() - 1;
        return new FunctionType(location, components.subList(0, n), components.get(n));
    }

    @Override
    public boolean shallowEquals(TypeRef other) {
        return paramTypes.size() == ((FunctionType) other).paramTypes.size();
    }

    @Override
    protected int shallowHash() {
        return paramTypes.size();
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder("fn(");
        for (int i = 0; i < paramTypes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(paramTypes.get(i).toDisplayString());
        }
        return sb.append(") -> ").append(returnType.toDisplayString()).toString();
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }
}
