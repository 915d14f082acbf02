package com.crustylang.compiler.compiler;

import com.crustylang.compiler.ast.AstNode;
import com.crustylang.compiler.ast.AstScanner;
import com.crustylang.compiler.ast.decl.*;
import com.crustylang.compiler.ast.expr.*;
import com.crustylang.compiler.ast.stmt.*;
import com.crustylang.compiler.ast.type.TypeRef;

/**
 * 语法树的缩进文本转储（--emit ast）。类型显示分析后的解析结果。
 */
public class AstDumper extends AstScanner<StringBuilder> {

    private int depth;

    public String dump(AstNode root) {
        StringBuilder sb = new StringBuilder();
        depth = 0;
        scan(root, sb);
        return sb.toString();
    }

    @Override
    public void scan(AstNode node, StringBuilder sb) {
        if (node == null) {
            return;
        }
        for (int i = 0; i < depth; i++) {
            sb.append("  ");
        }
        sb.append(node.getClass().getSimpleName());
        String detail = describe(node);
        if (!detail.isEmpty()) {
            sb.append(' ').append(detail);
        }
        sb.append(" @").append(node.getLocation().getLine()).append(':').append(node.getLocation().getColumn());
        sb.append('\n');
        depth++;
        try {
            super.scan(node, sb);
        } finally {
            depth--;
        }
    }

    private static String describe(AstNode node) {
        if (node instanceof Item) {
            Item item = (Item) node;
            String name = item.getName() != null ? item.getName() : "";
            if (node instanceof TypedefDecl) {
                return name + " = " + type(((TypedefDecl) node).getTarget());
            }
            if (node instanceof ImplBlockDecl) {
                return type(((ImplBlockDecl) node).getTargetType());
            }
            if (node instanceof FunctionDecl) {
                return name + " -> " + type(((FunctionDecl) node).getReturnType());
            }
            return name;
        }
        if (node instanceof Parameter) {
            Parameter param = (Parameter) node;
            if (param.isReceiver()) {
                return param.getSelfKind().toSourceString();
            }
            return param.getName() + ": " + type(param.getType());
        }
        if (node instanceof FieldDecl) {
            return ((FieldDecl) node).getName() + ": " + type(((FieldDecl) node).getType());
        }
        if (node instanceof LetStmt) {
            LetStmt let = (LetStmt) node;
            String text = let.getKind().name().toLowerCase() + " " + let.getName();
            return let.hasType() ? text + ": " + type(let.getType()) : text;
        }
        if (node instanceof LoopStatement && ((LoopStatement) node).hasLabel()) {
            return "." + ((LoopStatement) node).getLabel();
        }
        if (node instanceof Identifier) {
            return ((Identifier) node).getName();
        }
        if (node instanceof Literal) {
            return ((Literal) node).getText();
        }
        if (node instanceof BinaryExpr) {
            return ((BinaryExpr) node).getOperator().toSourceString();
        }
        if (node instanceof UnaryExpr) {
            return ((UnaryExpr) node).getOperator().toSourceString().trim();
        }
        if (node instanceof AssignExpr) {
            return ((AssignExpr) node).getOperator().toSourceString();
        }
        if (node instanceof FieldAccessExpr) {
            return "." + ((FieldAccessExpr) node).getField();
        }
        if (node instanceof MethodCallExpr) {
            return "." + ((MethodCallExpr) node).getMethodName() + "()";
        }
        if (node instanceof CastExpr) {
            return type(((CastExpr) node).getTargetType());
        }
        if (node instanceof SizeofExpr) {
            return type(((SizeofExpr) node).getType());
        }
        if (node instanceof MacroCallExpr) {
            return ((MacroCallExpr) node).getName();
        }
        if (node instanceof TypeScopedCallExpr) {
            TypeScopedCallExpr call = (TypeScopedCallExpr) node;
            return type(call.getType()) + "." + call.getMethodName();
        }
        return "";
    }

    private static String type(TypeRef type) {
        if (type == null) {
            return "?";
        }
        TypeRef resolved = type.getResolvedType();
        String text = type.toDisplayString();
        if (resolved != null && !resolved.equals(type)) {
            text += " (" + resolved.toDisplayString() + ")";
        }
        return text;
    }
}
