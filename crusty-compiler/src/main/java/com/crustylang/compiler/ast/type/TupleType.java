package com.crustylang.compiler.ast.type;

import com.crustylang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 元组类型（{@code (A, B)}，{@code ()} 为空元组）
 */
public final class TupleType extends TypeRef {
    private final List<TypeRef> elements;

    public TupleType(SourceLocation location, List<TypeRef> elements) {
        super(location);
        this.elements = Collections.unmodifiableList(new ArrayList<TypeRef>(elements));
    }

    public List<TypeRef> getElements() {
        return elements;
    }

    @Override
    public List<TypeRef> getComponents() {
        return elements;
    }

    @Override
    public TypeRef withComponents(List<TypeRef> components) {
        return new TupleType(location, components);
    }

    @Override
    public boolean shallowEquals(TypeRef other) {
        return true;
    }

    @Override
    protected int shallowHash() {
        return 0;
    }

    @Override
    public String toDisplayString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(elements.get(i).toDisplayString());
        }
        if (elements.size() == 1) sb.append(",");
        return sb.append(")").toString();
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitTuple(this);
    }
}
