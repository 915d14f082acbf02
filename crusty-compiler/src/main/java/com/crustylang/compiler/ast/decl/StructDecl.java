package com.crustylang.compiler.ast.decl;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.Visibility;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 结构体声明（字段 + 方法）
 */
public final class StructDecl extends Item {
    private final String name;
    private final List<FieldDecl> fields;
    private final List<FunctionDecl> methods;

    public StructDecl(SourceLocation location, List<Attribute> attributes, Visibility visibility,
                      String name, List<FieldDecl> fields, List<FunctionDecl> methods) {
        super(location, attributes, visibility);
        this.name = name;
        this.fields = Collections.unmodifiableList(new ArrayList<FieldDecl>(fields));
        this.methods = Collections.unmodifiableList(new ArrayList<FunctionDecl>(methods));
    }

    @Override
    public String getName() {
        return name;
    }

    public List<FieldDecl> getFields() {
        return fields;
    }

    public List<FunctionDecl> getMethods() {
        return methods;
    }

    public FieldDecl findField(String fieldName) {
        for (FieldDecl field : fields) {
            if (field.getName().equals(fieldName)) {
                return field;
            }
        }
        return null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructDecl(this, context);
    }
}
