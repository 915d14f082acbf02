package com.crustylang.compiler.ast;

import com.crustylang.compiler.ast.decl.*;
import com.crustylang.compiler.ast.expr.*;
import com.crustylang.compiler.ast.stmt.*;
import com.crustylang.compiler.ast.type.TypeRef;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    default R visitCompilationUnit(CompilationUnit node, C ctx) { return null; }

    default R visitFunctionDecl(FunctionDecl node, C ctx) { return null; }

    default R visitParameter(Parameter node, C ctx) { return null; }

    default R visitStructDecl(StructDecl node, C ctx) { return null; }

    default R visitFieldDecl(FieldDecl node, C ctx) { return null; }

    default R visitEnumDecl(EnumDecl node, C ctx) { return null; }

    default R visitTypedefDecl(TypedefDecl node, C ctx) { return null; }

    default R visitImplBlockDecl(ImplBlockDecl node, C ctx) { return null; }

    default R visitExternBlockDecl(ExternBlockDecl node, C ctx) { return null; }

    default R visitConstDecl(ConstDecl node, C ctx) { return null; }

    default R visitMacroDefinition(MacroDefinition node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitBlock(Block node, C ctx) { return null; }

    default R visitLetStmt(LetStmt node, C ctx) { return null; }

    default R visitExpressionStmt(ExpressionStmt node, C ctx) { return null; }

    default R visitReturnStmt(ReturnStmt node, C ctx) { return null; }

    default R visitIfStmt(IfStmt node, C ctx) { return null; }

    default R visitWhileStmt(WhileStmt node, C ctx) { return null; }

    default R visitLoopStmt(LoopStmt node, C ctx) { return null; }

    default R visitForStmt(ForStmt node, C ctx) { return null; }

    default R visitForInStmt(ForInStmt node, C ctx) { return null; }

    default R visitSwitchStmt(SwitchStmt node, C ctx) { return null; }

    default R visitBreakStmt(BreakStmt node, C ctx) { return null; }

    default R visitContinueStmt(ContinueStmt node, C ctx) { return null; }

    default R visitNestedFunctionStmt(NestedFunctionStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitLiteral(Literal node, C ctx) { return null; }

    default R visitIdentifier(Identifier node, C ctx) { return null; }

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitAssignExpr(AssignExpr node, C ctx) { return null; }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return null; }

    default R visitCallExpr(CallExpr node, C ctx) { return null; }

    default R visitMethodCallExpr(MethodCallExpr node, C ctx) { return null; }

    default R visitFieldAccessExpr(FieldAccessExpr node, C ctx) { return null; }

    default R visitIndexExpr(IndexExpr node, C ctx) { return null; }

    default R visitCastExpr(CastExpr node, C ctx) { return null; }

    default R visitSizeofExpr(SizeofExpr node, C ctx) { return null; }

    default R visitConditionalExpr(ConditionalExpr node, C ctx) { return null; }

    default R visitStructInitExpr(StructInitExpr node, C ctx) { return null; }

    default R visitArrayLiteralExpr(ArrayLiteralExpr node, C ctx) { return null; }

    default R visitArrayRepeatExpr(ArrayRepeatExpr node, C ctx) { return null; }

    default R visitTupleLiteralExpr(TupleLiteralExpr node, C ctx) { return null; }

    default R visitRangeExpr(RangeExpr node, C ctx) { return null; }

    default R visitMacroCallExpr(MacroCallExpr node, C ctx) { return null; }

    default R visitErrorPropagationExpr(ErrorPropagationExpr node, C ctx) { return null; }

    default R visitTypeScopedCallExpr(TypeScopedCallExpr node, C ctx) { return null; }

    default R visitCommaExpr(CommaExpr node, C ctx) { return null; }

    default R visitParenExpr(ParenExpr node, C ctx) { return null; }

    // ============ 类型 ============

    default R visitTypeRef(TypeRef node, C ctx) { return null; }
}
