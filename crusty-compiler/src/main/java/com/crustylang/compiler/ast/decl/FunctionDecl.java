package com.crustylang.compiler.ast.decl;

import com.crustylang.compiler.analysis.CaptureInfo;
import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.Visibility;
import com.crustylang.compiler.ast.stmt.Block;
import com.crustylang.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数声明。
 *
 * <p>同一个节点用于顶层函数、结构体方法、extern 签名（无函数体）和嵌套函数。
 * 嵌套函数的捕获信息由语义分析填充，代码生成读取。</p>
 */
public final class FunctionDecl extends Item {
    private final String name;
    private final List<Parameter> params;
    private final TypeRef returnType;
    private final Block body;       // extern 签名为 null
    private final boolean nested;

    private CaptureInfo captureInfo;

    public FunctionDecl(SourceLocation location, List<Attribute> attributes, Visibility visibility,
                        String name, List<Parameter> params, TypeRef returnType,
                        Block body, boolean nested) {
        super(location, attributes, visibility);
        this.name = name;
        this.params = Collections.unmodifiableList(new ArrayList<Parameter>(params));
        this.returnType = returnType;
        this.body = body;
        this.nested = nested;
    }

    @Override
    public String getName() {
        return name;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    public Block getBody() {
        return body;
    }

    public boolean hasBody() {
        return body != null;
    }

    public boolean isNested() {
        return nested;
    }

    /** 源码中写了 static */
    public boolean isStatic() {
        return visibility == Visibility.PRIVATE;
    }

    /** 第一个参数是否为接收者 */
    public boolean hasReceiver() {
        return !params.isEmpty() && params.get(0).isReceiver();
    }

    public CaptureInfo getCaptureInfo() {
        return captureInfo;
    }

    public void setCaptureInfo(CaptureInfo captureInfo) {
        this.captureInfo = captureInfo;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDecl(this, context);
    }
}
