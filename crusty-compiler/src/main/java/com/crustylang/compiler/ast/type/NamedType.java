package com.crustylang.compiler.ast.type;

import com.crustylang.compiler.ast.SourceLocation;

/**
 * 命名类型：typedef 别名或具体的 struct/enum 名
 */
public final class NamedType extends TypeRef {
    private final String name;

    public NamedType(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public NamedType(String name) {
        this(null, name);
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean shallowEquals(TypeRef other) {
        return name.equals(((NamedType) other).name);
    }

    @Override
    protected int shallowHash() {
        return name.hashCode();
    }

    @Override
    public String toDisplayString() {
        return name;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitNamed(this);
    }
}
