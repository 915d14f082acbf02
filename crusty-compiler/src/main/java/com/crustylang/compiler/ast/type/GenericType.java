package com.crustylang.compiler.ast.type;

import com.crustylang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 泛型类型（如 {@code Vec<int>}、{@code Map<K, V>}）
 *
 * <p>基础类型作为第一个组成部分，其后依次为类型实参。</p>
 */
public final class GenericType extends TypeRef {
    private final TypeRef base;
    private final List<TypeRef> typeArgs;

    public GenericType(SourceLocation location, TypeRef base, List<TypeRef> typeArgs) {
        super(location);
        this.base = base;
        this.typeArgs = Collections.unmodifiableList(new ArrayList<TypeRef>(typeArgs));
    }

    public TypeRef getBase() {
        return base;
    }

    public List<TypeRef> getTypeArgs() {
        return typeArgs;
    }

    @Override
    public List<TypeRef> getComponents() {
        List<TypeRef> all = new ArrayList<TypeRef>(typeArgs.size() + 1);
        all.add(base);
        all.addAll(typeArgs);
        return all;
    }

    @Override
    public TypeRef withComponents(List<TypeRef> components) {
        return new GenericType(location, components.get(0), components.subList(1, components.size()));
    }

    @Override
    public boolean shallowEquals(TypeRef other) {
        return typeArgs.size() == ((GenericType) other).typeArgs.size();
    }

    @Override
    protected int shallowHash() {
        return typeArgs.size();
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder(base.toDisplayString()).append("<");
        for (int i = 0; i < typeArgs.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(typeArgs.get(i).toDisplayString());
        }
        return sb.append(">").toString();
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitGeneric(this);
    }
}
