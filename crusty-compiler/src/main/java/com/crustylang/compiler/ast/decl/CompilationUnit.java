package com.crustylang.compiler.ast.decl;

import com.crustylang.compiler.ast.AstNode;
import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 编译单元（一个源文件）
 */
public final class CompilationUnit extends AstNode {
    private final String unitName;
    private final List<Item> items;

    public CompilationUnit(SourceLocation location, String unitName, List<Item> items) {
        super(location);
        this.unitName = unitName;
        this.items = Collections.unmodifiableList(new ArrayList<Item>(items));
    }

    public String getUnitName() {
        return unitName;
    }

    public List<Item> getItems() {
        return items;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCompilationUnit(this, context);
    }
}
