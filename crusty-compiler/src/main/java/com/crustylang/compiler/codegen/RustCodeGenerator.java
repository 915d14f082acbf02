package com.crustylang.compiler.codegen;

import com.crustylang.compiler.analysis.AnalysisResult;
import com.crustylang.compiler.analysis.CaptureInfo;
import com.crustylang.compiler.analysis.ClosureKind;
import com.crustylang.compiler.analysis.Symbol;
import com.crustylang.compiler.analysis.SymbolKind;
import com.crustylang.compiler.ast.AstScanner;
import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.Visibility;
import com.crustylang.compiler.ast.decl.*;
import com.crustylang.compiler.ast.expr.*;
import com.crustylang.compiler.ast.stmt.*;
import com.crustylang.compiler.ast.type.*;
import com.crustylang.compiler.formatter.CrustyStringUtils;
import com.crustylang.compiler.formatter.FormatConfig;
import com.crustylang.compiler.formatter.FormatterContext;
import com.crustylang.compiler.lexer.Token;
import com.crustylang.compiler.lexer.TokenType;

import java.util.List;

/**
 * Rust 代码生成器
 *
 * <p>遍历已通过语义分析的 AST，按固定映射表输出 Rust 源码。声明与语句直接写入
 * {@link FormatterContext}，表达式先拼成字符串，按 Rust 优先级决定是否加括号。</p>
 *
 * <p>输出是确定的：同一输入总是得到逐字节相同的文本。没有映射规则的结构抛出
 * {@link InternalCodegenError}。</p>
 */
public class RustCodeGenerator implements AstVisitor<Void, FormatterContext> {

    private final AnalysisResult analysis;
    private final FormatConfig config;
    private final ExpressionEmitter expressions = new ExpressionEmitter();
    private final RustTypeEmitter types = RustTypeEmitter.INSTANCE;
    private ImplBlockMerger merger;

    public RustCodeGenerator(AnalysisResult analysis) {
        this(analysis, new FormatConfig());
    }

    public RustCodeGenerator(AnalysisResult analysis, FormatConfig config) {
        this.analysis = analysis;
        this.config = config;
    }

    /**
     * 生成整个编译单元
     */
    public String generate(CompilationUnit unit) {
        FormatterContext ctx = new FormatterContext(config);
        visitCompilationUnit(unit, ctx);
        return ctx.getOutput();
    }

    /**
     * 生成单个表达式（不含结尾分号）
     */
    public String generateExpression(Expression expr) {
        return expressions.emit(expr, HostSyntax.PREC_LOWEST);
    }

    // ============ 辅助方法 ============

    private String type(TypeRef type) {
        return types.emitResolved(type);
    }

    private static boolean isVoid(TypeRef type) {
        TypeRef resolved = type.getResolvedType() != null ? type.getResolvedType() : type;
        return resolved instanceof PrimitiveType && ((PrimitiveType) resolved).isVoid();
    }

    private static String visibility(Visibility visibility) {
        return visibility == Visibility.PRIVATE ? "" : "pub ";
    }

    private static String label(String label) {
        return label != null ? "'" + label + ": " : "";
    }

    private void emitAttributes(List<Attribute> attributes, FormatterContext ctx) {
        for (Attribute attribute : attributes) {
            ctx.line("#[" + attribute.toSourceString() + "]");
        }
    }

    private boolean isEnumName(String name) {
        if (analysis == null) return false;
        Symbol symbol = analysis.getEnvironment().lookupSymbol(name);
        return symbol != null && symbol.getKind() == SymbolKind.ENUM;
    }

    private String parameters(List<Parameter> params) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) sb.append(", ");
            Parameter param = params.get(i);
            switch (param.getSelfKind()) {
                case VALUE:
                    sb.append("self");
                    break;
                case REF:
                    sb.append("&self");
                    break;
                case REF_MUT:
                    sb.append("&mut self");
                    break;
                default:
                    sb.append(param.getName()).append(": ").append(type(param.getType()));
            }
        }
        return sb.toString();
    }

    private String signature(FunctionDecl fn) {
        StringBuilder sb = new StringBuilder("fn ").append(fn.getName())
                .append("(").append(parameters(fn.getParams())).append(")");
        if (fn.getReturnType() != null && !isVoid(fn.getReturnType())) {
            sb.append(" -> ").append(type(fn.getReturnType()));
        }
        return sb.toString();
    }

    /** 以 " {" 开头输出块内语句并收尾 */
    private void emitBlockBody(List<Statement> statements, FormatterContext ctx) {
        ctx.append(" {");
        ctx.newLine();
        ctx.indent();
        emitStatements(statements, ctx);
        ctx.dedent();
        ctx.append("}");
    }

    private void emitStatements(List<Statement> statements, FormatterContext ctx) {
        for (Statement statement : statements) {
            statement.accept(this, ctx);
        }
    }

    /**
     * 表达式语句。{@code ++x} 直接写成 {@code x += 1;}，逗号表达式拆成多条语句。
     */
    private void emitExpressionStatement(Expression expr, FormatterContext ctx) {
        if (expr instanceof CommaExpr) {
            for (Expression part : ((CommaExpr) expr).getExpressions()) {
                emitExpressionStatement(part, ctx);
            }
            return;
        }
        if (expr instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) expr;
            if (unary.getOperator() == UnaryExpr.UnaryOp.PRE_INC
                    || unary.getOperator() == UnaryExpr.UnaryOp.PRE_DEC) {
                ctx.line(incrementStatement(unary));
                return;
            }
        }
        ctx.line(expressions.emit(expr, HostSyntax.PREC_LOWEST) + ";");
    }

    private String incrementStatement(UnaryExpr unary) {
        String op = unary.getOperator() == UnaryExpr.UnaryOp.PRE_INC ? " += 1;" : " -= 1;";
        return expressions.emit(unary.getOperand(), HostSyntax.PREC_ASSIGN + 1) + op;
    }

    private String condition(Expression condition) {
        return expressions.emit(condition, HostSyntax.PREC_ASSIGN);
    }

    // ============ 声明 ============

    @Override
    public Void visitCompilationUnit(CompilationUnit node, FormatterContext ctx) {
        merger = ImplBlockMerger.merge(node.getItems(), analysis);
        for (Item item : node.getItems()) {
            if (analysis != null && analysis.isExcluded(item)) continue;
            if (merger.isAbsorbed(item)) continue;
            ctx.blankLine();
            item.accept(this, ctx);
        }
        return null;
    }

    @Override
    public Void visitFunctionDecl(FunctionDecl node, FormatterContext ctx) {
        emitAttributes(node.getAttributes(), ctx);
        ctx.append(visibility(node.getVisibility()));
        ctx.append(signature(node));
        if (!node.hasBody()) {
            ctx.line(";");
            return null;
        }
        emitBlockBody(node.getBody().getStatements(), ctx);
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitStructDecl(StructDecl node, FormatterContext ctx) {
        emitAttributes(node.getAttributes(), ctx);
        String fieldVisibility = visibility(node.getVisibility());
        ctx.append(fieldVisibility + "struct " + node.getName());
        if (node.getFields().isEmpty()) {
            ctx.line(" {}");
        } else {
            ctx.line(" {");
            ctx.indent();
            for (FieldDecl field : node.getFields()) {
                ctx.line(fieldVisibility + field.getName() + ": " + type(field.getType()) + ",");
            }
            ctx.dedent();
            ctx.line("}");
        }
        emitMergedImpl(node, ctx);
        return null;
    }

    @Override
    public Void visitEnumDecl(EnumDecl node, FormatterContext ctx) {
        emitAttributes(node.getAttributes(), ctx);
        ctx.append(visibility(node.getVisibility()) + "enum " + node.getName());
        if (node.getVariants().isEmpty()) {
            ctx.line(" {}");
            return null;
        }
        ctx.line(" {");
        ctx.indent();
        for (EnumVariant variant : node.getVariants()) {
            if (variant.hasExplicitValue()) {
                ctx.line(variant.getName() + " = " + variant.getExplicitValue() + ",");
            } else {
                ctx.line(variant.getName() + ",");
            }
        }
        ctx.dedent();
        ctx.line("}");
        return null;
    }

    @Override
    public Void visitTypedefDecl(TypedefDecl node, FormatterContext ctx) {
        emitAttributes(node.getAttributes(), ctx);
        TypeRef target = node.getTarget();
        if (target.getResolvedType() == null && analysis != null) {
            target.setResolvedType(analysis.getEnvironment().resolveType(target));
        }
        ctx.line(visibility(node.getVisibility()) + "type " + node.getName() + " = " + type(target) + ";");
        return null;
    }

    @Override
    public Void visitImplBlockDecl(ImplBlockDecl node, FormatterContext ctx) {
        emitAttributes(node.getAttributes(), ctx);
        emitMergedImpl(node, ctx);
        return null;
    }

    private void emitMergedImpl(Item anchor, FormatterContext ctx) {
        ImplBlockMerger.MergedImpl merged = merger != null ? merger.getMergedAt(anchor) : null;
        if (merged == null) return;
        if (anchor instanceof StructDecl) {
            ctx.blankLine();
        }
        ctx.line("impl " + types.emit(merged.getTargetType()) + " {");
        ctx.indent();
        List<FunctionDecl> methods = merged.getMethods();
        for (int i = 0; i < methods.size(); i++) {
            if (i > 0) ctx.blankLine();
            methods.get(i).accept(this, ctx);
        }
        ctx.dedent();
        ctx.line("}");
    }

    @Override
    public Void visitExternBlockDecl(ExternBlockDecl node, FormatterContext ctx) {
        emitAttributes(node.getAttributes(), ctx);
        ctx.line("extern \"" + CrustyStringUtils.escapeString(node.getAbi()) + "\" {");
        ctx.indent();
        for (FunctionDecl fn : node.getFunctions()) {
            ctx.line(visibility(fn.getVisibility()) + signature(fn) + ";");
        }
        ctx.dedent();
        ctx.line("}");
        return null;
    }

    @Override
    public Void visitConstDecl(ConstDecl node, FormatterContext ctx) {
        emitAttributes(node.getAttributes(), ctx);
        ctx.line(visibility(node.getVisibility()) + "const " + node.getName() + ": " + type(node.getType())
                + " = " + expressions.emit(node.getValue(), HostSyntax.PREC_LOWEST) + ";");
        return null;
    }

    /**
     * {@code #define __NAME__(a, b) body} → {@code macro_rules! name { ($a:expr, $b:expr) => { body }; }}
     */
    @Override
    public Void visitMacroDefinition(MacroDefinition node, FormatterContext ctx) {
        ctx.line("macro_rules! " + HostSyntax.macroName(node.getName()) + " {");
        ctx.indent();

        StringBuilder pattern = new StringBuilder("(");
        List<String> params = node.getParams();
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) pattern.append(", ");
            pattern.append('$').append(params.get(i)).append(":expr");
        }
        pattern.append(") => {");
        ctx.line(pattern.toString());

        ctx.indent();
        StringBuilder body = new StringBuilder();
        for (Token token : node.getBody()) {
            if (body.length() > 0) body.append(' ');
            body.append(macroToken(node, token));
        }
        if (body.length() > 0) {
            ctx.line(body.toString());
        }
        ctx.dedent();

        ctx.line("};");
        ctx.dedent();
        ctx.line("}");
        return null;
    }

    private static String macroToken(MacroDefinition macro, Token token) {
        if (token.getType() == TokenType.IDENTIFIER) {
            String name = token.getLexeme();
            if (macro.isParam(name)) {
                return "$" + name;
            }
            if (CrustyStringUtils.isMacroName(name)) {
                return HostSyntax.macroName(name) + "!";
            }
        }
        return token.getLexeme();
    }

    // ============ 语句 ============

    @Override
    public Void visitBlock(Block node, FormatterContext ctx) {
        ctx.append("{");
        ctx.newLine();
        ctx.indent();
        emitStatements(node.getStatements(), ctx);
        ctx.dedent();
        ctx.line("}");
        return null;
    }

    @Override
    public Void visitLetStmt(LetStmt node, FormatterContext ctx) {
        StringBuilder sb = new StringBuilder();
        if (node.isConst()) {
            if (!node.hasType() || node.getType() instanceof AutoType) {
                throw new InternalCodegenError("Constant '" + node.getName() + "' has no type", node.getLocation());
            }
            sb.append("const ").append(node.getName()).append(": ").append(type(node.getType()));
        } else {
            sb.append(node.isMutable() ? "let mut " : "let ").append(node.getName());
            if (node.hasType() && !(node.getType() instanceof AutoType)) {
                sb.append(": ").append(type(node.getType()));
            }
        }
        if (node.hasInitializer()) {
            sb.append(" = ").append(expressions.emit(node.getInitializer(), HostSyntax.PREC_LOWEST));
        }
        ctx.line(sb.append(";").toString());
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, FormatterContext ctx) {
        emitExpressionStatement(node.getExpression(), ctx);
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, FormatterContext ctx) {
        if (node.hasValue()) {
            ctx.line("return " + expressions.emit(node.getValue(), HostSyntax.PREC_LOWEST) + ";");
        } else {
            ctx.line("return;");
        }
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, FormatterContext ctx) {
        emitIfChain(node, ctx);
        ctx.newLine();
        return null;
    }

    private void emitIfChain(IfStmt node, FormatterContext ctx) {
        ctx.append("if " + condition(node.getCondition()));
        emitBlockBody(node.getThenBranch().getStatements(), ctx);
        Statement elseBranch = node.getElseBranch();
        if (elseBranch == null) return;
        ctx.append(" else ");
        if (elseBranch instanceof IfStmt) {
            emitIfChain((IfStmt) elseBranch, ctx);
        } else if (elseBranch instanceof Block) {
            ctx.append("{");
            ctx.newLine();
            ctx.indent();
            emitStatements(((Block) elseBranch).getStatements(), ctx);
            ctx.dedent();
            ctx.append("}");
        } else {
            throw new InternalCodegenError("Unsupported else branch " + elseBranch.getClass().getSimpleName(),
                    elseBranch.getLocation());
        }
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, FormatterContext ctx) {
        ctx.append(label(node.getLabel()) + "while " + condition(node.getCondition()));
        emitBlockBody(node.getBody().getStatements(), ctx);
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitLoopStmt(LoopStmt node, FormatterContext ctx) {
        ctx.append(label(node.getLabel()) + "loop");
        emitBlockBody(node.getBody().getStatements(), ctx);
        ctx.newLine();
        return null;
    }

    /**
     * C 风格 for：外层块放初始化语句，内层 loop 先判断条件。
     * 循环体中有指向本循环的 continue 时，更新语句放到下一轮开头，保证 continue 后仍会执行。
     */
    @Override
    public Void visitForStmt(ForStmt node, FormatterContext ctx) {
        ctx.line("{");
        ctx.indent();
        if (node.getInitializer() != null) {
            node.getInitializer().accept(this, ctx);
        }

        boolean updateFirst = node.getUpdate() != null && ContinueFinder.targets(node);
        if (updateFirst) {
            ctx.line("let mut __first = true;");
        }
        ctx.line(label(node.getLabel()) + "loop {");
        ctx.indent();
        if (updateFirst) {
            ctx.line("if !__first {");
            ctx.indent();
            emitExpressionStatement(node.getUpdate(), ctx);
            ctx.dedent();
            ctx.line("}");
            ctx.line("__first = false;");
        }
        if (node.getCondition() != null) {
            ctx.line("if " + expressions.emitNegated(node.getCondition()) + " {");
            ctx.indent();
            ctx.line("break;");
            ctx.dedent();
            ctx.line("}");
        }
        emitStatements(node.getBody().getStatements(), ctx);
        if (node.getUpdate() != null && !updateFirst) {
            emitExpressionStatement(node.getUpdate(), ctx);
        }
        ctx.dedent();
        ctx.line("}");
        ctx.dedent();
        ctx.line("}");
        return null;
    }

    @Override
    public Void visitForInStmt(ForInStmt node, FormatterContext ctx) {
        ctx.append(label(node.getLabel()) + "for " + node.getVariable() + " in "
                + condition(node.getIterable()));
        emitBlockBody(node.getBody().getStatements(), ctx);
        ctx.newLine();
        return null;
    }

    /**
     * switch → match。没有 default 时补一个空的通配分支。
     */
    @Override
    public Void visitSwitchStmt(SwitchStmt node, FormatterContext ctx) {
        ctx.line("match " + condition(node.getSubject()) + " {");
        ctx.indent();
        for (SwitchCase switchCase : node.getCases()) {
            StringBuilder pattern = new StringBuilder();
            for (Expression value : switchCase.getValues()) {
                if (pattern.length() > 0) pattern.append(" | ");
                pattern.append(expressions.emit(value, HostSyntax.PREC_OR + 1));
            }
            emitMatchArm(pattern.toString(), switchCase.getBody(), ctx);
        }
        if (node.hasDefault()) {
            emitMatchArm("_", node.getDefaultBranch(), ctx);
        } else {
            ctx.line("_ => {}");
        }
        ctx.dedent();
        ctx.line("}");
        return null;
    }

    private void emitMatchArm(String pattern, Block body, FormatterContext ctx) {
        if (body.isEmpty()) {
            ctx.line(pattern + " => {}");
            return;
        }
        ctx.append(pattern + " =>");
        emitBlockBody(body.getStatements(), ctx);
        ctx.newLine();
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, FormatterContext ctx) {
        ctx.line(node.hasLabel() ? "break '" + node.getLabel() + ";" : "break;");
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, FormatterContext ctx) {
        ctx.line(node.hasLabel() ? "continue '" + node.getLabel() + ";" : "continue;");
        return null;
    }

    /**
     * 嵌套函数 → 闭包。Fn 为 {@code let f = |..|}，FnMut 为 {@code let mut f = |..|}，
     * FnOnce 为 {@code let f = move |..|}。
     */
    @Override
    public Void visitNestedFunctionStmt(NestedFunctionStmt node, FormatterContext ctx) {
        FunctionDecl fn = node.getFunction();
        CaptureInfo captures = fn.getCaptureInfo() != null ? fn.getCaptureInfo() : CaptureInfo.empty();
        ClosureKind kind = captures.getClosureKind();

        StringBuilder sb = new StringBuilder("let ");
        if (kind == ClosureKind.FN_MUT) sb.append("mut ");
        sb.append(fn.getName()).append(" = ");
        if (kind == ClosureKind.FN_ONCE) sb.append("move ");
        sb.append("|").append(parameters(fn.getParams())).append("|");
        if (fn.getReturnType() != null && !isVoid(fn.getReturnType())) {
            sb.append(" -> ").append(type(fn.getReturnType()));
        }
        ctx.append(sb.toString());
        emitBlockBody(fn.getBody().getStatements(), ctx);
        ctx.line(";");
        return null;
    }

    // ============ 表达式 ============

    /**
     * 表达式到 Rust 文本。{@link #emit} 在子表达式优先级低于要求时加括号。
     */
    private final class ExpressionEmitter implements AstVisitor<String, Void> {

        String emit(Expression expr, int minPrecedence) {
            String text = expr.accept(this, null);
            if (text == null) {
                throw new InternalCodegenError("No host mapping for " + expr.getClass().getSimpleName(),
                        expr.getLocation());
            }
            return precedence(expr) < minPrecedence ? "(" + text + ")" : text;
        }

        /** {@code !(cond)}，单个操作数不加括号 */
        String emitNegated(Expression condition) {
            Expression inner = condition;
            while (inner instanceof ParenExpr) {
                inner = ((ParenExpr) inner).getInner();
            }
            return "!" + emit(inner, HostSyntax.PREC_UNARY);
        }

        private int precedence(Expression expr) {
            if (expr instanceof BinaryExpr) {
                return HostSyntax.precedenceOf(((BinaryExpr) expr).getOperator());
            }
            if (expr instanceof AssignExpr) {
                return HostSyntax.PREC_ASSIGN;
            }
            if (expr instanceof RangeExpr) {
                return HostSyntax.PREC_RANGE;
            }
            if (expr instanceof UnaryExpr) {
                UnaryExpr.UnaryOp op = ((UnaryExpr) expr).getOperator();
                return op == UnaryExpr.UnaryOp.PRE_INC || op == UnaryExpr.UnaryOp.PRE_DEC
                        ? HostSyntax.PREC_BLOCK : HostSyntax.PREC_UNARY;
            }
            if (expr instanceof ConditionalExpr || expr instanceof CommaExpr) {
                return HostSyntax.PREC_BLOCK;
            }
            if (expr instanceof CallExpr || expr instanceof MethodCallExpr || expr instanceof FieldAccessExpr
                    || expr instanceof IndexExpr || expr instanceof ErrorPropagationExpr) {
                return HostSyntax.PREC_POSTFIX;
            }
            return HostSyntax.PREC_PRIMARY;
        }

        private String arguments(List<Expression> args) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(emit(args.get(i), HostSyntax.PREC_LOWEST));
            }
            return sb.toString();
        }

        @Override
        public String visitLiteral(Literal node, Void ctx) {
            switch (node.getKind()) {
                case INT:
                case FLOAT:
                case BOOLEAN:
                    return node.getText();
                case STRING:
                    return "\"" + CrustyStringUtils.escapeString((String) node.getValue()) + "\"";
                case CHAR:
                    return "'" + CrustyStringUtils.escapeChar((Character) node.getValue()) + "'";
                case NULL:
                    return "Option::None";
                default:
                    return null;
            }
        }

        @Override
        public String visitIdentifier(Identifier node, Void ctx) {
            return node.getName();
        }

        @Override
        public String visitBinaryExpr(BinaryExpr node, Void ctx) {
            BinaryExpr.BinaryOp op = node.getOperator();
            int prec = HostSyntax.precedenceOf(op);
            int leftMin = HostSyntax.isNonAssociative(op) ? prec + 1 : prec;
            return emit(node.getLeft(), leftMin) + " " + HostSyntax.binaryOperator(op) + " "
                    + emit(node.getRight(), prec + 1);
        }

        @Override
        public String visitAssignExpr(AssignExpr node, Void ctx) {
            return emit(node.getTarget(), HostSyntax.PREC_ASSIGN + 1) + " "
                    + HostSyntax.assignOperator(node.getOperator()) + " "
                    + emit(node.getValue(), HostSyntax.PREC_ASSIGN);
        }

        @Override
        public String visitUnaryExpr(UnaryExpr node, Void ctx) {
            String operand = emit(node.getOperand(), HostSyntax.PREC_UNARY);
            switch (node.getOperator()) {
                case NEG:
                    return "-" + operand;
                case NOT:
                case BIT_NOT:
                    return "!" + operand;
                case REF:
                    return "&" + operand;
                case REF_MUT:
                    return "&mut " + operand;
                case DEREF:
                    return "*" + operand;
                case PRE_INC:
                    return increment(node.getOperand(), "+=");
                case PRE_DEC:
                    return increment(node.getOperand(), "-=");
                default:
                    return null;
            }
        }

        // ++x 作为值：先自增再取值
        private String increment(Expression target, String op) {
            if (target instanceof Identifier) {
                String name = ((Identifier) target).getName();
                return "{ " + name + " " + op + " 1; " + name + " }";
            }
            return "{ let __tmp = &mut " + emit(target, HostSyntax.PREC_UNARY) + "; *__tmp " + op
                    + " 1; *__tmp }";
        }

        @Override
        public String visitCallExpr(CallExpr node, Void ctx) {
            return emit(node.getCallee(), HostSyntax.PREC_POSTFIX) + "(" + arguments(node.getArgs()) + ")";
        }

        @Override
        public String visitMethodCallExpr(MethodCallExpr node, Void ctx) {
            return emit(node.getReceiver(), HostSyntax.PREC_POSTFIX) + "." + node.getMethodName()
                    + "(" + arguments(node.getArgs()) + ")";
        }

        @Override
        public String visitFieldAccessExpr(FieldAccessExpr node, Void ctx) {
            if (node.getTarget() instanceof Identifier) {
                String name = ((Identifier) node.getTarget()).getName();
                if (isEnumName(name)) {
                    return name + "::" + node.getField();
                }
            }
            return emit(node.getTarget(), HostSyntax.PREC_POSTFIX) + "." + node.getField();
        }

        @Override
        public String visitIndexExpr(IndexExpr node, Void ctx) {
            return emit(node.getTarget(), HostSyntax.PREC_POSTFIX) + "["
                    + emit(node.getIndex(), HostSyntax.PREC_LOWEST) + "]";
        }

        @Override
        public String visitCastExpr(CastExpr node, Void ctx) {
            return "(" + emit(node.getOperand(), HostSyntax.PREC_CAST) + " as " + type(node.getTargetType()) + ")";
        }

        @Override
        public String visitSizeofExpr(SizeofExpr node, Void ctx) {
            return "std::mem::size_of::<" + type(node.getType()) + ">()";
        }

        @Override
        public String visitConditionalExpr(ConditionalExpr node, Void ctx) {
            return "if " + emit(node.getCondition(), HostSyntax.PREC_ASSIGN)
                    + " { " + emit(node.getThenExpr(), HostSyntax.PREC_LOWEST)
                    + " } else { " + emit(node.getElseExpr(), HostSyntax.PREC_LOWEST) + " }";
        }

        @Override
        public String visitStructInitExpr(StructInitExpr node, Void ctx) {
            if (!node.hasType()) {
                throw new InternalCodegenError("Struct initializer without a type", node.getLocation());
            }
            List<StructInitExpr.FieldInit> fields = node.getFields();
            if (fields.isEmpty()) {
                return types.emitPath(node.getType()) + " {}";
            }
            StringBuilder sb = new StringBuilder(types.emitPath(node.getType())).append(" { ");
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) sb.append(", ");
                StructInitExpr.FieldInit field = fields.get(i);
                sb.append(field.getName()).append(": ").append(emit(field.getValue(), HostSyntax.PREC_LOWEST));
            }
            return sb.append(" }").toString();
        }

        @Override
        public String visitArrayLiteralExpr(ArrayLiteralExpr node, Void ctx) {
            return "[" + arguments(node.getElements()) + "]";
        }

        @Override
        public String visitArrayRepeatExpr(ArrayRepeatExpr node, Void ctx) {
            return "[" + emit(node.getValue(), HostSyntax.PREC_LOWEST) + "; "
                    + emit(node.getCount(), HostSyntax.PREC_LOWEST) + "]";
        }

        @Override
        public String visitTupleLiteralExpr(TupleLiteralExpr node, Void ctx) {
            if (node.getElements().size() == 1) {
                return "(" + emit(node.getElements().get(0), HostSyntax.PREC_LOWEST) + ",)";
            }
            return "(" + arguments(node.getElements()) + ")";
        }

        @Override
        public String visitRangeExpr(RangeExpr node, Void ctx) {
            StringBuilder sb = new StringBuilder();
            if (node.getStart() != null) {
                sb.append(emit(node.getStart(), HostSyntax.PREC_RANGE + 1));
            }
            sb.append(node.isInclusive() ? "..=" : "..");
            if (node.getEnd() != null) {
                sb.append(emit(node.getEnd(), HostSyntax.PREC_RANGE + 1));
            }
            return sb.toString();
        }

        @Override
        public String visitMacroCallExpr(MacroCallExpr node, Void ctx) {
            MacroCallExpr.Delimiter delimiter = node.getDelimiter();
            return HostSyntax.macroName(node.getName()) + "!" + delimiter.getOpen()
                    + arguments(node.getArgs()) + delimiter.getClose();
        }

        @Override
        public String visitErrorPropagationExpr(ErrorPropagationExpr node, Void ctx) {
            return emit(node.getOperand(), HostSyntax.PREC_POSTFIX) + "?";
        }

        @Override
        public String visitTypeScopedCallExpr(TypeScopedCallExpr node, Void ctx) {
            StringBuilder sb = new StringBuilder(types.emitPath(node.getType()));
            if (node.hasTypeArgs()) {
                sb.append("::<");
                List<TypeRef> typeArgs = node.getTypeArgs();
                for (int i = 0; i < typeArgs.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(type(typeArgs.get(i)));
                }
                sb.append(">");
            }
            return sb.append("::").append(node.getMethodName())
                    .append("(").append(arguments(node.getArgs())).append(")").toString();
        }

        @Override
        public String visitCommaExpr(CommaExpr node, Void ctx) {
            StringBuilder sb = new StringBuilder("{ ");
            List<Expression> parts = node.getExpressions();
            for (int i = 0; i < parts.size(); i++) {
                sb.append(emit(parts.get(i), HostSyntax.PREC_LOWEST));
                sb.append(i < parts.size() - 1 ? "; " : " }");
            }
            return sb.toString();
        }

        @Override
        public String visitParenExpr(ParenExpr node, Void ctx) {
            return "(" + emit(node.getInner(), HostSyntax.PREC_LOWEST) + ")";
        }
    }

    /**
     * 查找指向给定 for 循环的 continue：同层未带标签的，或带本循环标签的。
     * 嵌套函数体不计入。
     */
    private static final class ContinueFinder extends AstScanner<Integer> {
        private final String label;
        private boolean found;

        private ContinueFinder(String label) {
            this.label = label;
        }

        static boolean targets(ForStmt loop) {
            ContinueFinder finder = new ContinueFinder(loop.getLabel());
            finder.scan(loop.getBody(), 0);
            return finder.found;
        }

        @Override
        public Void visitContinueStmt(ContinueStmt node, Integer depth) {
            if (node.hasLabel() ? node.getLabel().equals(label) : depth == 0) {
                found = true;
            }
            return null;
        }

        @Override
        public Void visitWhileStmt(WhileStmt node, Integer depth) {
            return super.visitWhileStmt(node, depth + 1);
        }

        @Override
        public Void visitLoopStmt(LoopStmt node, Integer depth) {
            return super.visitLoopStmt(node, depth + 1);
        }

        @Override
        public Void visitForStmt(ForStmt node, Integer depth) {
            return super.visitForStmt(node, depth + 1);
        }

        @Override
        public Void visitForInStmt(ForInStmt node, Integer depth) {
            return super.visitForInStmt(node, depth + 1);
        }

        @Override
        public Void visitNestedFunctionStmt(NestedFunctionStmt node, Integer depth) {
            return null;
        }
    }
}
