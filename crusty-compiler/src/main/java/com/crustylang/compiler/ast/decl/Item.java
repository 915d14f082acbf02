package com.crustylang.compiler.ast.decl;

import com.crustylang.compiler.ast.AstNode;
import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.Visibility;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 顶层条目基类
 */
public abstract class Item extends AstNode {
    protected final List<Attribute> attributes;
    protected final Visibility visibility;

    protected Item(SourceLocation location, List<Attribute> attributes, Visibility visibility) {
        super(location);
        this.attributes = attributes != null
                ? Collections.unmodifiableList(new ArrayList<Attribute>(attributes))
                : Collections.<Attribute>emptyList();
        this.visibility = visibility != null ? visibility : Visibility.PUBLIC;
    }

    public List<Attribute> getAttributes() {
        return attributes;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public boolean isPublic() {
        return visibility == Visibility.PUBLIC;
    }

    /** 条目名（诊断与符号表使用） */
    public abstract String getName();
}
