package com.crustylang.compiler.ast;

import com.crustylang.compiler.ast.decl.*;
import com.crustylang.compiler.ast.expr.*;
import com.crustylang.compiler.ast.stmt.*;

import java.util.List;

/**
 * 只读遍历基类：默认访问所有子节点，返回 null。
 * 子类覆盖关心的 visit 方法，需要继续深入时调用 super。
 *
 * <p>类型引用不在遍历范围内。</p>
 */
public abstract class AstScanner<C> implements AstVisitor<Void, C> {

    // ==================== 辅助方法 ====================

    public void scan(AstNode node, C ctx) {
        if (node != null) {
            node.accept(this, ctx);
        }
    }

    public void scanAll(List<? extends AstNode> nodes, C ctx) {
        if (nodes == null) return;
        for (AstNode node : nodes) {
            scan(node, ctx);
        }
    }

    // ============ 声明 ============

    @Override
    public Void visitCompilationUnit(CompilationUnit node, C ctx) {
        scanAll(node.getItems(), ctx);
        return null;
    }

    @Override
    public Void visitFunctionDecl(FunctionDecl node, C ctx) {
        scanAll(node.getParams(), ctx);
        scan(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitStructDecl(StructDecl node, C ctx) {
        scanAll(node.getFields(), ctx);
        scanAll(node.getMethods(), ctx);
        return null;
    }

    @Override
    public Void visitImplBlockDecl(ImplBlockDecl node, C ctx) {
        scanAll(node.getMethods(), ctx);
        return null;
    }

    @Override
    public Void visitExternBlockDecl(ExternBlockDecl node, C ctx) {
        scanAll(node.getFunctions(), ctx);
        return null;
    }

    @Override
    public Void visitConstDecl(ConstDecl node, C ctx) {
        scan(node.getValue(), ctx);
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitBlock(Block node, C ctx) {
        scanAll(node.getStatements(), ctx);
        return null;
    }

    @Override
    public Void visitLetStmt(LetStmt node, C ctx) {
        scan(node.getInitializer(), ctx);
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, C ctx) {
        scan(node.getExpression(), ctx);
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, C ctx) {
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, C ctx) {
        scan(node.getCondition(), ctx);
        scan(node.getThenBranch(), ctx);
        scan(node.getElseBranch(), ctx);
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, C ctx) {
        scan(node.getCondition(), ctx);
        scan(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitLoopStmt(LoopStmt node, C ctx) {
        scan(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, C ctx) {
        scan(node.getInitializer(), ctx);
        scan(node.getCondition(), ctx);
        scan(node.getUpdate(), ctx);
        scan(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitForInStmt(ForInStmt node, C ctx) {
        scan(node.getIterable(), ctx);
        scan(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitSwitchStmt(SwitchStmt node, C ctx) {
        scan(node.getSubject(), ctx);
        for (SwitchCase c : node.getCases()) {
            scanAll(c.getValues(), ctx);
            scan(c.getBody(), ctx);
        }
        scan(node.getDefaultBranch(), ctx);
        return null;
    }

    @Override
    public Void visitNestedFunctionStmt(NestedFunctionStmt node, C ctx) {
        scan(node.getFunction(), ctx);
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitBinaryExpr(BinaryExpr node, C ctx) {
        scan(node.getLeft(), ctx);
        scan(node.getRight(), ctx);
        return null;
    }

    @Override
    public Void visitAssignExpr(AssignExpr node, C ctx) {
        scan(node.getTarget(), ctx);
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, C ctx) {
        scan(node.getOperand(), ctx);
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, C ctx) {
        scan(node.getCallee(), ctx);
        scanAll(node.getArgs(), ctx);
        return null;
    }

    @Override
    public Void visitMethodCallExpr(MethodCallExpr node, C ctx) {
        scan(node.getReceiver(), ctx);
        scanAll(node.getArgs(), ctx);
        return null;
    }

    @Override
    public Void visitFieldAccessExpr(FieldAccessExpr node, C ctx) {
        scan(node.getTarget(), ctx);
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, C ctx) {
        scan(node.getTarget(), ctx);
        scan(node.getIndex(), ctx);
        return null;
    }

    @Override
    public Void visitCastExpr(CastExpr node, C ctx) {
        scan(node.getOperand(), ctx);
        return null;
    }

    @Override
    public Void visitConditionalExpr(ConditionalExpr node, C ctx) {
        scan(node.getCondition(), ctx);
        scan(node.getThenExpr(), ctx);
        scan(node.getElseExpr(), ctx);
        return null;
    }

    @Override
    public Void visitStructInitExpr(StructInitExpr node, C ctx) {
        for (StructInitExpr.FieldInit field : node.getFields()) {
            scan(field.getValue(), ctx);
        }
        return null;
    }

    @Override
    public Void visitArrayLiteralExpr(ArrayLiteralExpr node, C ctx) {
        scanAll(node.getElements(), ctx);
        return null;
    }

    @Override
    public Void visitArrayRepeatExpr(ArrayRepeatExpr node, C ctx) {
        scan(node.getValue(), ctx);
        scan(node.getCount(), ctx);
        return null;
    }

    @Override
    public Void visitTupleLiteralExpr(TupleLiteralExpr node, C ctx) {
        scanAll(node.getElements(), ctx);
        return null;
    }

    @Override
    public Void visitRangeExpr(RangeExpr node, C ctx) {
        scan(node.getStart(), ctx);
        scan(node.getEnd(), ctx);
        return null;
    }

    @Override
    public Void visitMacroCallExpr(MacroCallExpr node, C ctx) {
        scanAll(node.getArgs(), ctx);
        return null;
    }

    @Override
    public Void visitErrorPropagationExpr(ErrorPropagationExpr node, C ctx) {
        scan(node.getOperand(), ctx);
        return null;
    }

    @Override
    public Void visitTypeScopedCallExpr(TypeScopedCallExpr node, C ctx) {
        scanAll(node.getArgs(), ctx);
        return null;
    }

    @Override
    public Void visitCommaExpr(CommaExpr node, C ctx) {
        scanAll(node.getExpressions(), ctx);
        return null;
    }

    @Override
    public Void visitParenExpr(ParenExpr node, C ctx) {
        scan(node.getInner(), ctx);
        return null;
    }
}
