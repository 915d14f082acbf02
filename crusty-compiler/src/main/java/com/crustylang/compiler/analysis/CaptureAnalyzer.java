package com.crustylang.compiler.analysis;

import com.crustylang.compiler.ast.AstNode;
import com.crustylang.compiler.ast.AstScanner;
import com.crustylang.compiler.ast.decl.FunctionDecl;
import com.crustylang.compiler.ast.decl.Parameter;
import com.crustylang.compiler.ast.expr.*;
import com.crustylang.compiler.ast.stmt.*;

import java.util.*;

/**
 * 嵌套函数的捕获分析。
 *
 * <p>扫描嵌套函数体，收集其中引用、赋值、按值传入调用的外层名字；
 * 函数体内自己声明的名字（参数、局部变量、for-in 变量）按块作用域排除。</p>
 *
 * <p>分类规则：被赋值（含复合赋值、{@code ++x}、{@code &var x}、{@code *x = ...}）为 MUTABLE；
 * 否则按值传入调用且外层函数在嵌套函数声明之后不再读取为 MOVE；其余为 READ_ONLY。</p>
 */
public final class CaptureAnalyzer {

    private CaptureAnalyzer() {}

    /**
     * 嵌套函数体中外层名字的使用情况
     */
    public static final class Usage {
        private final Set<String> referenced = new LinkedHashSet<String>();
        private final Set<String> assigned = new HashSet<String>();
        private final Set<String> moved = new HashSet<String>();

        /** 引用到的外层名字（按首次出现排序） */
        public Set<String> getReferenced() { return referenced; }
        public boolean isAssigned(String name) { return assigned.contains(name); }
        public boolean isMoved(String name) { return moved.contains(name); }
    }

    /**
     * 扫描嵌套函数体
     */
    public static Usage scan(FunctionDecl nested) {
        UsageScanner scanner = new UsageScanner();
        scanner.pushScope();
        for (Parameter param : nested.getParams()) {
            scanner.bind(param.getName());
        }
        scanner.scan(nested.getBody(), null);
        scanner.popScope();
        return scanner.usage;
    }

    /**
     * 单个名字的捕获方式，MUTABLE 优先于 MOVE
     *
     * @param readAfter 外层函数在嵌套函数声明之后是否还读取该名字
     */
    public static CaptureMode classify(String name, Usage usage, boolean readAfter) {
        if (usage.isAssigned(name)) {
            return CaptureMode.MUTABLE;
        }
        if (usage.isMoved(name) && !readAfter) {
            return CaptureMode.MOVE;
        }
        return CaptureMode.READ_ONLY;
    }

    /**
     * 节点中（跳过 {@code skip} 子树）是否引用了名字
     */
    public static boolean isReferenced(final String name, List<? extends AstNode> nodes, final AstNode skip) {
        final boolean[] found = new boolean[1];
        AstScanner<Void> scanner = new AstScanner<Void>() {
            @Override
            public void scan(AstNode node, Void ctx) {
                if (node == skip || found[0]) return;
                super.scan(node, ctx);
            }

            @Override
            public Void visitIdentifier(Identifier node, Void ctx) {
                if (node.getName().equals(name)) {
                    found[0] = true;
                }
                return null;
            }
        };
        for (AstNode node : nodes) {
            scanner.scan(node, null);
            if (found[0]) return true;
        }
        return false;
    }

    /**
     * 同层语句中是否声明了名字（let 或嵌套函数）。
     * 只看语句列表本身，嵌套块与循环体内的声明在嵌套函数处不可见。
     */
    public static boolean isDeclared(String name, List<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            if (node instanceof LetStmt && ((LetStmt) node).getName().equals(name)) {
                return true;
            }
            if (node instanceof NestedFunctionStmt
                    && ((NestedFunctionStmt) node).getFunction().getName().equals(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 赋值目标的根变量名：{@code a.b[i] = ...} 与 {@code *p = ...} 的根分别是 a 和 p
     */
    static String rootName(Expression target) {
        Expression current = target;
        while (true) {
            if (current instanceof Identifier) {
                return ((Identifier) current).getName();
            } else if (current instanceof FieldAccessExpr) {
                current = ((FieldAccessExpr) current).getTarget();
            } else if (current instanceof IndexExpr) {
                current = ((IndexExpr) current).getTarget();
            } else if (current instanceof ParenExpr) {
                current = ((ParenExpr) current).getInner();
            } else if (current instanceof UnaryExpr
                    && ((UnaryExpr) current).getOperator() == UnaryExpr.UnaryOp.DEREF) {
                current = ((UnaryExpr) current).getOperand();
            } else {
                return null;
            }
        }
    }

    // ============ 扫描器 ============

    private static final class UsageScanner extends AstScanner<Void> {
        final Usage usage = new Usage();
        private final Deque<Set<String>> bound = new ArrayDeque<Set<String>>();

        void pushScope() {
            bound.push(new HashSet<String>());
        }

        void popScope() {
            bound.pop();
        }

        void bind(String name) {
            bound.peek().add(name);
        }

        private boolean isBound(String name) {
            for (Set<String> names : bound) {
                if (names.contains(name)) return true;
            }
            return false;
        }

        private void markAssigned(Expression target) {
            String root = rootName(target);
            if (root != null && !isBound(root)) {
                usage.assigned.add(root);
            }
        }

        private void markMovedArgs(List<Expression> args) {
            for (Expression arg : args) {
                Expression inner = arg;
                while (inner instanceof ParenExpr) {
                    inner = ((ParenExpr) inner).getInner();
                }
                if (inner instanceof Identifier) {
                    String name = ((Identifier) inner).getName();
                    if (!isBound(name)) {
                        usage.moved.add(name);
                    }
                }
            }
        }

        @Override
        public Void visitBlock(Block node, Void ctx) {
            pushScope();
            super.visitBlock(node, ctx);
            popScope();
            return null;
        }

        @Override
        public Void visitLetStmt(LetStmt node, Void ctx) {
            super.visitLetStmt(node, ctx);
            bind(node.getName());
            return null;
        }

        @Override
        public Void visitForStmt(ForStmt node, Void ctx) {
            pushScope();
            super.visitForStmt(node, ctx);
            popScope();
            return null;
        }

        @Override
        public Void visitForInStmt(ForInStmt node, Void ctx) {
            scan(node.getIterable(), ctx);
            pushScope();
            bind(node.getVariable());
            scan(node.getBody(), ctx);
            popScope();
            return null;
        }

        @Override
        public Void visitNestedFunctionStmt(NestedFunctionStmt node, Void ctx) {
            FunctionDecl fn = node.getFunction();
            bind(fn.getName());
            pushScope();
            for (Parameter param : fn.getParams()) {
                bind(param.getName());
            }
            scan(fn.getBody(), ctx);
            popScope();
            return null;
        }

        @Override
        public Void visitIdentifier(Identifier node, Void ctx) {
            if (!isBound(node.getName())) {
                usage.referenced.add(node.getName());
            }
            return null;
        }

        @Override
        public Void visitAssignExpr(AssignExpr node, Void ctx) {
            markAssigned(node.getTarget());
            return super.visitAssignExpr(node, ctx);
        }

        @Override
        public Void visitUnaryExpr(UnaryExpr node, Void ctx) {
            if (node.getOperator().isMutating()) {
                markAssigned(node.getOperand());
            }
            return super.visitUnaryExpr(node, ctx);
        }

        @Override
        public Void visitCallExpr(CallExpr node, Void ctx) {
            markMovedArgs(node.getArgs());
            return super.visitCallExpr(node, ctx);
        }

        @Override
        public Void visitMethodCallExpr(MethodCallExpr node, Void ctx) {
            markMovedArgs(node.getArgs());
            return super.visitMethodCallExpr(node, ctx);
        }

        @Override
        public Void visitTypeScopedCallExpr(TypeScopedCallExpr node, Void ctx) {
            markMovedArgs(node.getArgs());
            return super.visitTypeScopedCallExpr(node, ctx);
        }
    }
}
