package com.crustylang.compiler.formatter;

import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.Visibility;
import com.crustylang.compiler.ast.decl.*;
import com.crustylang.compiler.ast.expr.*;
import com.crustylang.compiler.ast.stmt.*;
import com.crustylang.compiler.ast.type.*;
import com.crustylang.compiler.lexer.Token;

import java.util.List;
import java.util.function.BiConsumer;

/**
 * Crusty AST 代码格式化器
 *
 * <p>遍历 AST，按统一格式规则输出 Crusty 源码。输出可被解析器重新解析，
 * 且再次格式化的结果不变。</p>
 */
public class CrustyFormatter implements AstVisitor<Void, FormatterContext> {

    private final CrustyTypePrinter typePrinter = new CrustyTypePrinter();

    /**
     * 格式化编译单元
     */
    public String format(CompilationUnit unit, FormatConfig config) {
        FormatterContext ctx = new FormatterContext(config);
        visitCompilationUnit(unit, ctx);
        return ctx.getOutput();
    }

    /**
     * 使用默认配置格式化
     */
    public String format(CompilationUnit unit) {
        return format(unit, new FormatConfig());
    }

    /**
     * 单个表达式的源码文本
     */
    public String formatExpression(Expression expr) {
        FormatterContext ctx = new FormatterContext(new FormatConfig());
        formatExpression(expr, ctx);
        return ctx.getOutput();
    }

    /**
     * 类型的源码文本
     */
    public String formatType(TypeRef type) {
        return type.accept(typePrinter);
    }

    // ============ 声明 ============

    @Override
    public Void visitCompilationUnit(CompilationUnit node, FormatterContext ctx) {
        List<Item> items = node.getItems();
        for (int i = 0; i < items.size(); i++) {
            items.get(i).accept(this, ctx);
            ctx.newLine();
            // 顶层条目之间空一行
            if (i < items.size() - 1) {
                ctx.newLine();
            }
        }
        return null;
    }

    @Override
    public Void visitFunctionDecl(FunctionDecl node, FormatterContext ctx) {
        formatAttributes(node.getAttributes(), ctx);
        formatVisibility(node.getVisibility(), ctx);
        formatSignature(node, ctx);
        if (node.hasBody()) {
            ctx.append(" ");
            formatBlock(node.getBody(), ctx);
        } else {
            ctx.append(";");
        }
        return null;
    }

    @Override
    public Void visitParameter(Parameter node, FormatterContext ctx) {
        if (node.isReceiver()) {
            ctx.append(node.getSelfKind().toSourceString());
            return null;
        }
        formatTypeRef(node.getType(), ctx);
        ctx.append(" ");
        ctx.append(node.getName());
        return null;
    }

    @Override
    public Void visitStructDecl(StructDecl node, FormatterContext ctx) {
        formatAttributes(node.getAttributes(), ctx);
        formatVisibility(node.getVisibility(), ctx);
        ctx.append("struct ");
        ctx.append(node.getName());
        ctx.append(" {");
        if (node.getFields().isEmpty() && node.getMethods().isEmpty()) {
            ctx.append("}");
            return null;
        }
        ctx.newLine();
        ctx.indent();
        for (FieldDecl field : node.getFields()) {
            visitFieldDecl(field, ctx);
            ctx.newLine();
        }
        if (!node.getFields().isEmpty() && !node.getMethods().isEmpty()) {
            ctx.newLine();
        }
        formatMethods(node.getMethods(), ctx);
        ctx.dedent();
        ctx.append("}");
        return null;
    }

    @Override
    public Void visitFieldDecl(FieldDecl node, FormatterContext ctx) {
        formatTypeRef(node.getType(), ctx);
        ctx.append(" ");
        ctx.append(node.getName());
        ctx.append(";");
        return null;
    }

    @Override
    public Void visitEnumDecl(EnumDecl node, FormatterContext ctx) {
        formatAttributes(node.getAttributes(), ctx);
        formatVisibility(node.getVisibility(), ctx);
        ctx.append("enum ");
        ctx.append(node.getName());
        ctx.append(" {");
        if (node.getVariants().isEmpty()) {
            ctx.append("}");
            return null;
        }
        ctx.newLine();
        ctx.indent();
        for (EnumVariant variant : node.getVariants()) {
            ctx.append(variant.getName());
            if (variant.hasExplicitValue()) {
                ctx.append(" = ");
                ctx.append(String.valueOf(variant.getExplicitValue()));
            }
            ctx.append(",");
            ctx.newLine();
        }
        ctx.dedent();
        ctx.append("}");
        return null;
    }

    @Override
    public Void visitTypedefDecl(TypedefDecl node, FormatterContext ctx) {
        formatAttributes(node.getAttributes(), ctx);
        formatVisibility(node.getVisibility(), ctx);
        ctx.append("typedef ");
        formatTypeRef(node.getTarget(), ctx);
        ctx.append(" ");
        ctx.append(node.getName());
        ctx.append(";");
        return null;
    }

    @Override
    public Void visitImplBlockDecl(ImplBlockDecl node, FormatterContext ctx) {
        formatAttributes(node.getAttributes(), ctx);
        ctx.append("typedef struct {");
        if (!node.getMethods().isEmpty()) {
            ctx.newLine();
            ctx.indent();
            formatMethods(node.getMethods(), ctx);
            ctx.dedent();
        }
        ctx.append("} @");
        formatTypeRef(node.getTargetType(), ctx);
        if (node.getBlockName() != null) {
            ctx.append(".");
            ctx.append(node.getBlockName());
        }
        ctx.append(";");
        return null;
    }

    @Override
    public Void visitExternBlockDecl(ExternBlockDecl node, FormatterContext ctx) {
        formatAttributes(node.getAttributes(), ctx);
        ctx.append("extern \"");
        ctx.append(CrustyStringUtils.escapeString(node.getAbi()));
        ctx.append("\" {");
        if (node.getFunctions().isEmpty()) {
            ctx.append("}");
            return null;
        }
        ctx.newLine();
        ctx.indent();
        for (FunctionDecl fn : node.getFunctions()) {
            formatSignature(fn, ctx);
            ctx.append(";");
            ctx.newLine();
        }
        ctx.dedent();
        ctx.append("}");
        return null;
    }

    @Override
    public Void visitConstDecl(ConstDecl node, FormatterContext ctx) {
        formatAttributes(node.getAttributes(), ctx);
        formatVisibility(node.getVisibility(), ctx);
        ctx.append("const ");
        formatTypeRef(node.getType(), ctx);
        ctx.append(" ");
        ctx.append(node.getName());
        ctx.append(" = ");
        formatExpression(node.getValue(), ctx);
        ctx.append(";");
        return null;
    }

    @Override
    public Void visitMacroDefinition(MacroDefinition node, FormatterContext ctx) {
        // 宏体必须与 #define 同行
        ctx.append("#define ");
        ctx.append(node.getName());
        if (node.isFunctionLike()) {
            ctx.append("(");
            formatJoined(node.getParams(), ctx, ", ", (param, c) -> c.append(param));
            ctx.append(")");
        }
        for (Token token : node.getBody()) {
            ctx.append(" ");
            ctx.append(token.getLexeme());
        }
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitBlock(Block node, FormatterContext ctx) {
        formatBlock(node, ctx);
        return null;
    }

    @Override
    public Void visitLetStmt(LetStmt node, FormatterContext ctx) {
        formatDeclaration(node, ctx);
        ctx.append(";");
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, FormatterContext ctx) {
        formatExpression(node.getExpression(), ctx);
        ctx.append(";");
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, FormatterContext ctx) {
        ctx.append("return");
        if (node.hasValue()) {
            ctx.append(" ");
            formatExpression(node.getValue(), ctx);
        }
        ctx.append(";");
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, FormatterContext ctx) {
        ctx.append("if (");
        formatExpression(node.getCondition(), ctx);
        ctx.append(") ");
        formatBlock(node.getThenBranch(), ctx);

        if (node.hasElse()) {
            ctx.append(" else ");
            Statement elseBranch = node.getElseBranch();
            if (elseBranch instanceof Block) {
                formatBlock((Block) elseBranch, ctx);
            } else if (elseBranch instanceof IfStmt) {
                visitIfStmt((IfStmt) elseBranch, ctx);
            } else {
                ctx.append("{");
                ctx.newLine();
                ctx.indent();
                elseBranch.accept(this, ctx);
                ctx.newLine();
                ctx.dedent();
                ctx.append("}");
            }
        }
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, FormatterContext ctx) {
        formatLabel(node, ctx);
        ctx.append("while (");
        formatExpression(node.getCondition(), ctx);
        ctx.append(") ");
        formatBlock(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitLoopStmt(LoopStmt node, FormatterContext ctx) {
        formatLabel(node, ctx);
        ctx.append("loop ");
        formatBlock(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, FormatterContext ctx) {
        formatLabel(node, ctx);
        ctx.append("for (");
        Statement init = node.getInitializer();
        if (init instanceof LetStmt) {
            formatDeclaration((LetStmt) init, ctx);
        } else if (init instanceof ExpressionStmt) {
            formatExpression(((ExpressionStmt) init).getExpression(), ctx);
        }
        ctx.append(";");
        if (node.getCondition() != null) {
            ctx.append(" ");
            formatExpression(node.getCondition(), ctx);
        }
        ctx.append(";");
        if (node.getUpdate() != null) {
            ctx.append(" ");
            formatExpression(node.getUpdate(), ctx);
        }
        ctx.append(") ");
        formatBlock(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitForInStmt(ForInStmt node, FormatterContext ctx) {
        formatLabel(node, ctx);
        ctx.append("for (");
        ctx.append(node.getVariable());
        ctx.append(" in ");
        formatExpression(node.getIterable(), ctx);
        ctx.append(") ");
        formatBlock(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitSwitchStmt(SwitchStmt node, FormatterContext ctx) {
        ctx.append("switch (");
        formatExpression(node.getSubject(), ctx);
        ctx.append(") {");
        ctx.newLine();
        ctx.indent();
        // case 体一律加花括号，解析时单个代码块即为 case 体本身
        for (SwitchCase switchCase : node.getCases()) {
            ctx.append("case ");
            formatExpressionList(switchCase.getValues(), ctx);
            ctx.append(": ");
            formatBlock(switchCase.getBody(), ctx);
            ctx.newLine();
        }
        if (node.hasDefault()) {
            ctx.append("default: ");
            formatBlock(node.getDefaultBranch(), ctx);
            ctx.newLine();
        }
        ctx.dedent();
        ctx.append("}");
        return null;
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, FormatterContext ctx) {
        ctx.append("break");
        if (node.hasLabel()) {
            ctx.append(" .");
            ctx.append(node.getLabel());
        }
        ctx.append(";");
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, FormatterContext ctx) {
        ctx.append("continue");
        if (node.hasLabel()) {
            ctx.append(" .");
            ctx.append(node.getLabel());
        }
        ctx.append(";");
        return null;
    }

    @Override
    public Void visitNestedFunctionStmt(NestedFunctionStmt node, FormatterContext ctx) {
        FunctionDecl fn = node.getFunction();
        formatVisibility(fn.getVisibility(), ctx);
        formatSignature(fn, ctx);
        ctx.append(" ");
        formatBlock(fn.getBody(), ctx);
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitLiteral(Literal node, FormatterContext ctx) {
        // 保留源码写法（进制、转义、后缀）
        ctx.append(node.getText());
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier node, FormatterContext ctx) {
        ctx.append(node.getName());
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, FormatterContext ctx) {
        formatExpression(node.getLeft(), ctx);
        ctx.append(" ");
        ctx.append(node.getOperator().toSourceString());
        ctx.append(" ");
        formatExpression(node.getRight(), ctx);
        return null;
    }

    @Override
    public Void visitAssignExpr(AssignExpr node, FormatterContext ctx) {
        formatExpression(node.getTarget(), ctx);
        ctx.append(" ");
        ctx.append(node.getOperator().toSourceString());
        ctx.append(" ");
        formatExpression(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, FormatterContext ctx) {
        String op = node.getOperator().toSourceString();
        String operand = formatExpression(node.getOperand());
        ctx.append(op);
        // 避免 - -x 粘成 --x、& &var x 粘成 && var x
        if (!operand.isEmpty() && !op.endsWith(" ") && op.charAt(op.length() - 1) == operand.charAt(0)) {
            ctx.append(" ");
        }
        ctx.append(operand);
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, FormatterContext ctx) {
        formatExpression(node.getCallee(), ctx);
        ctx.append("(");
        formatExpressionList(node.getArgs(), ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitMethodCallExpr(MethodCallExpr node, FormatterContext ctx) {
        formatMemberTarget(node.getReceiver(), ctx);
        ctx.append(node.getMethodName());
        ctx.append("(");
        formatExpressionList(node.getArgs(), ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitFieldAccessExpr(FieldAccessExpr node, FormatterContext ctx) {
        formatMemberTarget(node.getTarget(), ctx);
        ctx.append(node.getField());
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, FormatterContext ctx) {
        formatExpression(node.getTarget(), ctx);
        ctx.append("[");
        formatExpression(node.getIndex(), ctx);
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitCastExpr(CastExpr node, FormatterContext ctx) {
        ctx.append("(");
        formatTypeRef(node.getTargetType(), ctx);
        ctx.append(")");
        formatExpression(node.getOperand(), ctx);
        return null;
    }

    @Override
    public Void visitSizeofExpr(SizeofExpr node, FormatterContext ctx) {
        ctx.append("sizeof(");
        formatTypeRef(node.getType(), ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitConditionalExpr(ConditionalExpr node, FormatterContext ctx) {
        formatExpression(node.getCondition(), ctx);
        ctx.append(" ? ");
        formatExpression(node.getThenExpr(), ctx);
        ctx.append(" : ");
        formatExpression(node.getElseExpr(), ctx);
        return null;
    }

    @Override
    public Void visitStructInitExpr(StructInitExpr node, FormatterContext ctx) {
        // 只有单个名字能写在初始化器前；其余类型由声明处重新推回
        if (node.getType() instanceof NamedType) {
            ctx.append(((NamedType) node.getType()).getName());
            ctx.append(" ");
        }
        ctx.append("{ ");
        formatJoined(node.getFields(), ctx, ", ", (field, c) -> {
            c.append(".");
            c.append(field.getName());
            c.append(" = ");
            formatExpression(field.getValue(), c);
        });
        ctx.append(" }");
        return null;
    }

    @Override
    public Void visitArrayLiteralExpr(ArrayLiteralExpr node, FormatterContext ctx) {
        ctx.append("[");
        formatExpressionList(node.getElements(), ctx);
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitArrayRepeatExpr(ArrayRepeatExpr node, FormatterContext ctx) {
        ctx.append("[");
        formatExpression(node.getValue(), ctx);
        ctx.append("; ");
        formatExpression(node.getCount(), ctx);
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitTupleLiteralExpr(TupleLiteralExpr node, FormatterContext ctx) {
        ctx.append("(");
        formatExpressionList(node.getElements(), ctx);
        if (node.getElements().size() == 1) {
            ctx.append(",");
        }
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitRangeExpr(RangeExpr node, FormatterContext ctx) {
        formatExpression(node.getStart(), ctx);
        ctx.append(node.isInclusive() ? "..=" : "..");
        formatExpression(node.getEnd(), ctx);
        return null;
    }

    @Override
    public Void visitMacroCallExpr(MacroCallExpr node, FormatterContext ctx) {
        ctx.append(node.getName());
        ctx.append(node.getDelimiter().getOpen());
        formatExpressionList(node.getArgs(), ctx);
        ctx.append(node.getDelimiter().getClose());
        return null;
    }

    @Override
    public Void visitErrorPropagationExpr(ErrorPropagationExpr node, FormatterContext ctx) {
        formatExpression(node.getOperand(), ctx);
        ctx.append("?");
        return null;
    }

    @Override
    public Void visitTypeScopedCallExpr(TypeScopedCallExpr node, FormatterContext ctx) {
        ctx.append("@");
        formatTypeRef(node.getType(), ctx);
        if (node.hasTypeArgs()) {
            ctx.append("(");
            formatJoined(node.getTypeArgs(), ctx, ", ", this::formatTypeRef);
            ctx.append(")");
        }
        ctx.append(".");
        ctx.append(node.getMethodName());
        ctx.append("(");
        formatExpressionList(node.getArgs(), ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitCommaExpr(CommaExpr node, FormatterContext ctx) {
        formatExpressionList(node.getExpressions(), ctx);
        return null;
    }

    @Override
    public Void visitParenExpr(ParenExpr node, FormatterContext ctx) {
        ctx.append("(");
        formatExpression(node.getInner(), ctx);
        ctx.append(")");
        return null;
    }

    // ============ 辅助方法 ============

    private void formatExpression(Expression expr, FormatterContext ctx) {
        if (expr != null) {
            expr.accept(this, ctx);
        }
    }

    private void formatExpressionList(List<Expression> exprs, FormatterContext ctx) {
        if (exprs == null) return;
        formatJoined(exprs, ctx, ", ", this::formatExpression);
    }

    private void formatTypeRef(TypeRef type, FormatterContext ctx) {
        if (type != null) {
            ctx.append(type.accept(typePrinter));
        }
    }

    private void formatBlock(Block block, FormatterContext ctx) {
        ctx.append("{");
        if (block.getStatements().isEmpty()) {
            ctx.append("}");
            return;
        }
        ctx.newLine();
        ctx.indent();
        for (Statement stmt : block.getStatements()) {
            stmt.accept(this, ctx);
            ctx.newLine();
        }
        ctx.dedent();
        ctx.append("}");
    }

    /**
     * p->f 在 AST 中是 (*p).f，没有括号的解引用按 -> 输出
     */
    private void formatMemberTarget(Expression target, FormatterContext ctx) {
        if (target instanceof UnaryExpr && ((UnaryExpr) target).getOperator() == UnaryExpr.UnaryOp.DEREF) {
            formatExpression(((UnaryExpr) target).getOperand(), ctx);
            ctx.append("->");
            return;
        }
        formatExpression(target, ctx);
        ctx.append(".");
    }

    /**
     * let / var / const 声明，不含结尾的 ';'
     */
    private void formatDeclaration(LetStmt let, FormatterContext ctx) {
        switch (let.getKind()) {
            case VAR:
                ctx.append("var ");
                break;
            case CONST:
                ctx.append("const ");
                break;
            default:
                ctx.append("let ");
                break;
        }
        ctx.append(let.getName());
        if (let.hasType()) {
            ctx.append(": ");
            formatTypeRef(let.getType(), ctx);
        }
        if (let.hasInitializer()) {
            ctx.append(" = ");
            formatExpression(let.getInitializer(), ctx);
        }
    }

    private void formatSignature(FunctionDecl fn, FormatterContext ctx) {
        formatTypeRef(fn.getReturnType(), ctx);
        ctx.append(" ");
        ctx.append(fn.getName());
        ctx.append("(");
        formatJoined(fn.getParams(), ctx, ", ", this::visitParameter);
        ctx.append(")");
    }

    private void formatMethods(List<FunctionDecl> methods, FormatterContext ctx) {
        for (int i = 0; i < methods.size(); i++) {
            visitFunctionDecl(methods.get(i), ctx);
            ctx.newLine();
            if (i < methods.size() - 1) {
                ctx.newLine();
            }
        }
    }

    private void formatAttributes(List<Attribute> attributes, FormatterContext ctx) {
        if (attributes == null || attributes.isEmpty()) return;
        for (Attribute attribute : attributes) {
            ctx.append("#[");
            ctx.append(attribute.toSourceString());
            ctx.append("]");
            ctx.newLine();
        }
    }

    private void formatVisibility(Visibility visibility, FormatterContext ctx) {
        if (visibility == Visibility.PRIVATE) {
            ctx.append("static ");
        }
    }

    private void formatLabel(LoopStatement loop, FormatterContext ctx) {
        if (loop.hasLabel()) {
            ctx.append(".");
            ctx.append(loop.getLabel());
            ctx.append(": ");
        }
    }

    private <T> void formatJoined(List<T> items, FormatterContext ctx, String separator,
                                  BiConsumer<T, FormatterContext> formatter) {
        for (int i = 0; i < items.size(); i++) {
            formatter.accept(items.get(i), ctx);
            if (i < items.size() - 1) {
                ctx.append(separator);
            }
        }
    }

    /**
     * 类型的 Crusty 写法。后缀（[N]、[]、?）作用于指针或引用时需要括号。
     */
    private static final class CrustyTypePrinter implements TypeRefVisitor<String> {

        @Override
        public String visitPrimitive(PrimitiveType type) {
            return type.getKind().getSourceName();
        }

        @Override
        public String visitNamed(NamedType type) {
            return type.getName();
        }

        @Override
        public String visitPointer(PointerType type) {
            return (type.isMutable() ? "*var " : "*") + type.getInner().accept(this);
        }

        @Override
        public String visitReference(ReferenceType type) {
            String inner = type.getInner().accept(this);
            String prefix = type.isMutable() ? "&var " : "&";
            if (!type.isMutable() && inner.startsWith("&")) {
                prefix = "& ";
            }
            return prefix + inner;
        }

        @Override
        public String visitArray(ArrayType type) {
            return suffixOperand(type.getElement()) + "[" + type.getSize() + "]";
        }

        @Override
        public String visitSlice(SliceType type) {
            return suffixOperand(type.getElement()) + "[]";
        }

        @Override
        public String visitTuple(TupleType type) {
            List<TypeRef> elements = type.getElements();
            if (elements.size() == 1) {
                return "(" + elements.get(0).accept(this) + ",)";
            }
            return "(" + join(elements) + ")";
        }

        @Override
        public String visitGeneric(GenericType type) {
            return type.getBase().accept(this) + "<" + join(type.getTypeArgs()) + ">";
        }

        @Override
        public String visitFunction(FunctionType type) {
            throw new IllegalArgumentException("Function types have no Crusty source form: "
                    + type.toDisplayString());
        }

        @Override
        public String visitFallible(FallibleType type) {
            return suffixOperand(type.getInner()) + "?";
        }

        @Override
        public String visitAuto(AutoType type) {
            return "auto";
        }

        private String suffixOperand(TypeRef type) {
            String text = type.accept(this);
            if (type instanceof PointerType || type instanceof ReferenceType) {
                return "(" + text + ")";
            }
            return text;
        }

        private String join(List<TypeRef> types) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < types.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(types.get(i).accept(this));
            }
            return sb.toString();
        }
    }
}
