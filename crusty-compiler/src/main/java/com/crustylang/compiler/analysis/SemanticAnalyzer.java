package com.crustylang.compiler.analysis;

import com.crustylang.compiler.analysis.types.TypeCompatibility;
import com.crustylang.compiler.ast.AstNode;
import com.crustylang.compiler.ast.AstVisitor;
import com.crustylang.compiler.ast.SourceLocation;
import com.crustylang.compiler.ast.decl.*;
import com.crustylang.compiler.ast.expr.*;
import com.crustylang.compiler.ast.stmt.*;
import com.crustylang.compiler.ast.type.*;
import com.crustylang.compiler.formatter.CrustyStringUtils;

import java.util.*;

/**
 * 语义分析器：构建类型环境与符号表，校验类型引用，分类嵌套函数捕获，收集语义错误。
 *
 * <p>分析分三步：先收集所有类型名（typedef 名先登记为待定，允许前向引用），
 * 再按源码顺序登记 typedef（登记前做环检测），冻结类型环境后逐条目检查。
 * 表达式 visit 返回推断出的已解析类型，无法推断时返回 null（视为与任何类型兼容）。</p>
 *
 * <p>错误累积，不中断分析。每个分析器实例只分析一个编译单元。</p>
 */
public final class SemanticAnalyzer implements AstVisitor<TypeRef, Void> {

    // 目标语言中无需声明即可使用的值
    private static final Set<String> HOST_VALUES = new HashSet<String>(Arrays.asList(
            "Some", "None", "Ok", "Err"));

    private final TypeEnvironment env = new TypeEnvironment();
    private final SymbolTable symbolTable = new SymbolTable();
    private final List<SemanticError> errors = new ArrayList<SemanticError>();
    private final Set<Item> excludedItems = Collections.newSetFromMap(new IdentityHashMap<Item, Boolean>());
    private final Map<String, StructDecl> structs = new HashMap<String, StructDecl>();
    private final Set<String> enums = new HashSet<String>();

    private Scope currentScope = symbolTable.getGlobalScope();
    private Item currentItem;
    private TypeRef selfType;
    private final Deque<FunctionContext> functions = new ArrayDeque<FunctionContext>();
    private final Deque<StatementCursor> cursors = new ArrayDeque<StatementCursor>();
    // 当前嵌套函数体内已按捕获违规报告过的名字，不再报告为未定义
    private final Set<String> reportedCaptureViolations = new HashSet<String>();

    private boolean used;

    /** 分析入口 */
    public AnalysisResult analyze(CompilationUnit unit) {
        if (used) {
            throw new IllegalStateException("SemanticAnalyzer instances analyze a single unit");
        }
        used = true;
        unit.accept(this, null);
        return new AnalysisResult(env, symbolTable, errors, excludedItems);
    }

    // ============ 辅助方法 ============

    private void error(SemanticError.ErrorKind kind, String message, AstNode node) {
        errors.add(new SemanticError(kind, message, node != null ? node.getLocation() : null));
    }

    private void error(SemanticError.ErrorKind kind, String message, SourceLocation location) {
        errors.add(new SemanticError(kind, message, location));
    }

    /**
     * 校验并解析类型引用，结果挂到节点上。含未定义名字时报告 UNDEFINED_TYPE，
     * 当前条目被排除出代码生成，返回 null。
     */
    private TypeRef checkType(TypeRef type) {
        if (type == null) return null;
        String undefined = env.findUndefinedName(type);
        if (undefined != null) {
            error(SemanticError.ErrorKind.UNDEFINED_TYPE, "Undefined type '" + undefined + "'", type);
            if (currentItem != null) {
                excludedItems.add(currentItem);
            }
            return null;
        }
        TypeRef resolved = env.resolveType(type);
        type.setResolvedType(resolved);
        return resolved;
    }

    private static boolean isVoid(TypeRef type) {
        return type instanceof PrimitiveType && ((PrimitiveType) type).isVoid();
    }

    private static PrimitiveKind primitiveKind(TypeRef type) {
        return type instanceof PrimitiveType ? ((PrimitiveType) type).getKind() : null;
    }

    /** 未加后缀的数字字面量（可带负号、括号），可赋给任意同类数值类型 */
    private static Literal.LiteralKind untypedNumericLiteral(Expression expr) {
        Expression current = expr;
        while (true) {
            if (current instanceof ParenExpr) {
                current = ((ParenExpr) current).getInner();
            } else if (current instanceof UnaryExpr
                    && ((UnaryExpr) current).getOperator() == UnaryExpr.UnaryOp.NEG) {
                current = ((UnaryExpr) current).getOperand();
            } else {
                break;
            }
        }
        if (current instanceof Literal) {
            Literal.LiteralKind kind = ((Literal) current).getKind();
            if (kind == Literal.LiteralKind.INT || kind == Literal.LiteralKind.FLOAT) {
                return kind;
            }
        }
        return null;
    }

    /**
     * 表达式能否赋给目标类型（都已解析）
     */
    private boolean isAssignable(TypeRef target, Expression expr, TypeRef exprType) {
        if (target == null || exprType == null) return true;
        if (target instanceof FallibleType) {
            TypeRef inner = ((FallibleType) target).getInner();
            return isAssignable(inner, expr, exprType) || TypeCompatibility.isCompatible(target, exprType);
        }
        Literal.LiteralKind literal = untypedNumericLiteral(expr);
        PrimitiveKind targetKind = primitiveKind(target);
        if (literal != null && targetKind != null) {
            if (literal == Literal.LiteralKind.INT) {
                return targetKind.isNumeric();
            }
            return targetKind.isFloatingPoint();
        }
        return TypeCompatibility.isCompatible(target, exprType);
    }

    private void checkAssignable(TypeRef target, Expression expr, TypeRef exprType, String context) {
        if (!isAssignable(target, expr, exprType)) {
            error(SemanticError.ErrorKind.TYPE_MISMATCH, "Type mismatch in " + context + ": expected '"
                    + target.toDisplayString() + "' but found '" + exprType.toDisplayString() + "'", expr);
        }
    }

    private void defineLocal(Symbol symbol, AstNode node) {
        if (currentScope.resolveLocal(symbol.getName()) != null) {
            error(SemanticError.ErrorKind.DUPLICATE_DEFINITION,
                    "'" + symbol.getName() + "' is already defined in this scope", node);
            return;
        }
        currentScope.define(symbol);
    }

    private Scope enterScope(Scope.ScopeType type, AstNode node) {
        Scope scope = new Scope(type, currentScope, node);
        symbolTable.mapNodeToScope(node, scope);
        currentScope = scope;
        return scope;
    }

    private void exitScope() {
        currentScope = currentScope.getParent();
    }

    private static List<TypeRef> parameterTypes(FunctionDecl fn) {
        List<TypeRef> types = new ArrayList<TypeRef>();
        for (Parameter p : fn.getParams()) {
            if (!p.isReceiver()) {
                types.add(p.getType());
            }
        }
        return types;
    }

    /**
     * 函数上下文（返回类型、是否为嵌套函数）
     */
    private static final class FunctionContext {
        final TypeRef returnType;   // 已解析；未知为 null
        final boolean nested;

        FunctionContext(TypeRef returnType, boolean nested) {
            this.returnType = returnType;
            this.nested = nested;
        }
    }

    /**
     * 语句游标：当前所在的语句列表与下标，或所在的循环。用于判断"声明之后"的读取。
     */
    private static final class StatementCursor {
        final List<Statement> statements;
        final Statement loop;
        final boolean functionBoundary;
        int index;

        StatementCursor(List<Statement> statements, Statement loop, boolean functionBoundary) {
            this.statements = statements;
            this.loop = loop;
            this.functionBoundary = functionBoundary;
        }
    }

    /**
     * 当前语句之后（直到外层函数边界）还会执行的节点。所在循环整体计入。
     */
    private List<AstNode> nodesAfterCurrentStatement() {
        List<AstNode> nodes = new ArrayList<AstNode>();
        for (StatementCursor cursor : cursors) {
            if (cursor.functionBoundary) break;
            if (cursor.statements != null) {
                nodes.addAll(cursor.statements.subList(cursor.index + 1, cursor.statements.size()));
            }
            if (cursor.loop != null) {
                nodes.add(cursor.loop);
            }
        }
        return nodes;
    }

    // ============ 声明 visitor ============

    @Override
    public TypeRef visitCompilationUnit(CompilationUnit node, Void ctx) {
        collectTypeNames(node.getItems());
        registerTypedefs(node.getItems());
        env.freeze();
        registerGlobalSymbols(node.getItems());

        for (Item item : node.getItems()) {
            currentItem = item;
            item.accept(this, ctx);
            currentItem = null;
        }
        return null;
    }

    /**
     * 第一步：struct / enum 登记为具体类型，typedef 名登记为待定
     */
    private void collectTypeNames(List<Item> items) {
        Set<String> typedefNames = new HashSet<String>();
        for (Item item : items) {
            if (item instanceof StructDecl || item instanceof EnumDecl) {
                String name = item.getName();
                if (env.getEntry(name) != null || typedefNames.contains(name)) {
                    error(SemanticError.ErrorKind.DUPLICATE_DEFINITION,
                            "Type '" + name + "' is already defined", item);
                    excludedItems.add(item);
                    continue;
                }
                env.registerConcrete(name);
                SymbolKind kind = item instanceof StructDecl ? SymbolKind.STRUCT : SymbolKind.ENUM;
                env.defineSymbol(new Symbol(name, kind, new NamedType(item.getLocation(), name), false,
                        item.getLocation(), item, item.getVisibility()));
                if (item instanceof StructDecl) {
                    structs.put(name, (StructDecl) item);
                } else {
                    enums.add(name);
                }
            } else if (item instanceof TypedefDecl) {
                typedefNames.add(item.getName());
                if (env.getEntry(item.getName()) == null) {
                    env.declarePending(item.getName());
                }
            }
        }
    }

    /**
     * 第二步：按源码顺序登记 typedef。环检测先于重复检测。
     */
    private void registerTypedefs(List<Item> items) {
        for (Item item : items) {
            if (!(item instanceof TypedefDecl)) continue;
            TypedefDecl typedef = (TypedefDecl) item;
            String name = typedef.getName();
            TypeRef target = typedef.getTarget();

            Set<String> visited = new HashSet<String>();
            visited.add(name);
            if (env.hasCircularReference(target, visited)) {
                error(SemanticError.ErrorKind.CIRCULAR_TYPE_ALIAS,
                        "Type alias '" + name + "' refers to itself through '" + target.toDisplayString() + "'",
                        typedef);
                excludedItems.add(typedef);
                continue;
            }
            if (env.getEntry(name) != null) {
                error(SemanticError.ErrorKind.DUPLICATE_DEFINITION, "Type '" + name + "' is already defined",
                        typedef);
                excludedItems.add(typedef);
                continue;
            }
            String undefined = env.findUndefinedName(target);
            if (undefined != null) {
                error(SemanticError.ErrorKind.UNDEFINED_TYPE, "Undefined type '" + undefined + "'", target);
                excludedItems.add(typedef);
                continue;
            }
            env.registerAlias(name, target);
            env.defineSymbol(new Symbol(name, SymbolKind.TYPE_ALIAS, target, false,
                    typedef.getLocation(), typedef, typedef.getVisibility()));
        }
    }

    /**
     * 第三步：函数、extern 签名、常量、宏登记到全局作用域
     */
    private void registerGlobalSymbols(List<Item> items) {
        Scope global = symbolTable.getGlobalScope();
        for (Item item : items) {
            if (item instanceof FunctionDecl) {
                FunctionDecl fn = (FunctionDecl) item;
                defineGlobal(global, functionSymbol(fn, SymbolKind.FUNCTION), fn);
            } else if (item instanceof ExternBlockDecl) {
                for (FunctionDecl fn : ((ExternBlockDecl) item).getFunctions()) {
                    defineGlobal(global, functionSymbol(fn, SymbolKind.EXTERN_FUNCTION), fn);
                }
            } else if (item instanceof ConstDecl) {
                ConstDecl constant = (ConstDecl) item;
                defineGlobal(global, new Symbol(constant.getName(), SymbolKind.CONSTANT,
                        env.resolveType(constant.getType()), false, constant.getLocation(), constant,
                        constant.getVisibility()), constant);
            } else if (item instanceof MacroDefinition) {
                MacroDefinition macro = (MacroDefinition) item;
                if (!CrustyStringUtils.isMacroName(macro.getName())) {
                    error(SemanticError.ErrorKind.INVALID_OPERATION,
                            "Macro '" + macro.getName() + "' must be named in the __name__ form", macro);
                }
                defineGlobal(global, new Symbol(macro.getName(), SymbolKind.MACRO, null, false,
                        macro.getLocation(), macro, macro.getVisibility()), macro);
            }
        }
    }

    private Symbol functionSymbol(FunctionDecl fn, SymbolKind kind) {
        Symbol symbol = new Symbol(fn.getName(), kind, env.resolveType(fn.getReturnType()), false,
                fn.getLocation(), fn, fn.getVisibility());
        List<TypeRef> resolved = new ArrayList<TypeRef>();
        for (TypeRef type : parameterTypes(fn)) {
            resolved.add(env.resolveType(type));
        }
        symbol.setParameterTypes(resolved);
        return symbol;
    }

    private void defineGlobal(Scope global, Symbol symbol, AstNode node) {
        if (global.resolveLocal(symbol.getName()) != null) {
            error(SemanticError.ErrorKind.DUPLICATE_DEFINITION,
                    "'" + symbol.getName() + "' is already defined", node);
            return;
        }
        global.define(symbol);
    }

    @Override
    public TypeRef visitFunctionDecl(FunctionDecl node, Void ctx) {
        TypeRef returnType = checkType(node.getReturnType());
        for (Parameter param : node.getParams()) {
            checkType(param.getType());
        }
        if (!node.hasBody()) {
            return null;
        }

        enterScope(Scope.ScopeType.FUNCTION, node);
        defineParameters(node);
        functions.push(new FunctionContext(returnType, false));
        cursors.push(new StatementCursor(null, null, true));
        node.getBody().accept(this, ctx);
        cursors.pop();
        functions.pop();
        exitScope();
        return null;
    }

    private void defineParameters(FunctionDecl fn) {
        for (Parameter param : fn.getParams()) {
            if (param.isReceiver()) {
                if (selfType == null) {
                    error(SemanticError.ErrorKind.INVALID_OPERATION,
                            "'self' is only allowed in methods", param);
                    continue;
                }
                boolean mutable = param.getSelfKind() == Parameter.SelfKind.REF_MUT;
                defineLocal(new Symbol("self", SymbolKind.PARAMETER, selfType, mutable,
                        param.getLocation(), param, null), param);
            } else {
                defineLocal(new Symbol(param.getName(), SymbolKind.PARAMETER, param.getType() != null
                        ? param.getType().getResolvedType() : null, false, param.getLocation(), param, null), param);
            }
        }
    }

    @Override
    public TypeRef visitStructDecl(StructDecl node, Void ctx) {
        Set<String> fieldNames = new HashSet<String>();
        for (FieldDecl field : node.getFields()) {
            if (!fieldNames.add(field.getName())) {
                error(SemanticError.ErrorKind.DUPLICATE_DEFINITION,
                        "Field '" + field.getName() + "' is already defined in struct '" + node.getName() + "'",
                        field);
            }
            checkType(field.getType());
        }
        visitMethods(node.getMethods(), new NamedType(node.getLocation(), node.getName()));
        return null;
    }

    private void visitMethods(List<FunctionDecl> methods, TypeRef owner) {
        TypeRef previousSelf = selfType;
        selfType = owner;
        Set<String> names = new HashSet<String>();
        for (FunctionDecl method : methods) {
            if (!names.add(method.getName())) {
                error(SemanticError.ErrorKind.DUPLICATE_DEFINITION,
                        "Method '" + method.getName() + "' is already defined", method);
            }
            method.accept(this, null);
        }
        selfType = previousSelf;
    }

    @Override
    public TypeRef visitEnumDecl(EnumDecl node, Void ctx) {
        Set<String> names = new HashSet<String>();
        for (EnumVariant variant : node.getVariants()) {
            if (!names.add(variant.getName())) {
                error(SemanticError.ErrorKind.DUPLICATE_DEFINITION,
                        "Variant '" + variant.getName() + "' is already defined in enum '" + node.getName() + "'",
                        variant.getLocation());
            }
        }
        return null;
    }

    @Override
    public TypeRef visitTypedefDecl(TypedefDecl node, Void ctx) {
        if (!excludedItems.contains(node)) {
            checkType(node.getTarget());
        }
        return null;
    }

    @Override
    public TypeRef visitImplBlockDecl(ImplBlockDecl node, Void ctx) {
        TypeRef target = checkType(node.getTargetType());
        visitMethods(node.getMethods(), target != null ? target : node.getTargetType());
        return null;
    }

    @Override
    public TypeRef visitExternBlockDecl(ExternBlockDecl node, Void ctx) {
        for (FunctionDecl fn : node.getFunctions()) {
            fn.accept(this, ctx);
        }
        return null;
    }

    @Override
    public TypeRef visitConstDecl(ConstDecl node, Void ctx) {
        TypeRef type = checkType(node.getType());
        TypeRef valueType = node.getValue().accept(this, ctx);
        checkAssignable(type, node.getValue(), valueType, "constant '" + node.getName() + "'");
        return null;
    }

    @Override
    public TypeRef visitMacroDefinition(MacroDefinition node, Void ctx) {
        Set<String> params = new HashSet<String>();
        for (String param : node.getParams()) {
            if (!params.add(param)) {
                error(SemanticError.ErrorKind.DUPLICATE_DEFINITION,
                        "Macro parameter '" + param + "' is already defined", node);
            }
        }
        return null;
    }

    // ============ 语句 visitor ============

    @Override
    public TypeRef visitBlock(Block node, Void ctx) {
        enterScope(Scope.ScopeType.BLOCK, node);
        visitStatements(node.getStatements());
        exitScope();
        return null;
    }

    private void visitStatements(List<Statement> statements) {
        StatementCursor cursor = new StatementCursor(statements, null, false);
        cursors.push(cursor);
        for (int i = 0; i < statements.size(); i++) {
            cursor.index = i;
            statements.get(i).accept(this, null);
        }
        cursors.pop();
    }

    @Override
    public TypeRef visitLetStmt(LetStmt node, Void ctx) {
        TypeRef declared = null;
        boolean inferred = !node.hasType() || node.getType() instanceof AutoType;
        if (node.hasType()) {
            declared = checkType(node.getType());
        }

        TypeRef initType = null;
        if (node.hasInitializer()) {
            initType = node.getInitializer().accept(this, ctx);
            if (!inferred) {
                checkAssignable(declared, node.getInitializer(), initType, "declaration of '" + node.getName() + "'");
            }
        } else if (inferred) {
            error(SemanticError.ErrorKind.TYPE_MISMATCH,
                    "Cannot infer the type of '" + node.getName() + "' without an initializer", node);
        }

        TypeRef type = inferred ? initType : declared;
        defineLocal(new Symbol(node.getName(), SymbolKind.VARIABLE, type, node.isMutable(),
                node.getLocation(), node, null), node);
        return null;
    }

    @Override
    public TypeRef visitExpressionStmt(ExpressionStmt node, Void ctx) {
        node.getExpression().accept(this, ctx);
        return null;
    }

    @Override
    public TypeRef visitReturnStmt(ReturnStmt node, Void ctx) {
        FunctionContext function = functions.peek();
        if (function == null) {
            error(SemanticError.ErrorKind.INVALID_OPERATION, "'return' outside of function", node);
            return null;
        }
        TypeRef expected = function.returnType;
        if (node.getValue() == null) {
            if (expected != null && !isVoid(expected)) {
                error(SemanticError.ErrorKind.TYPE_MISMATCH,
                        "Missing return value, expected '" + expected.toDisplayString() + "'", node);
            }
            return null;
        }
        TypeRef valueType = node.getValue().accept(this, ctx);
        if (expected != null && isVoid(expected)) {
            error(SemanticError.ErrorKind.TYPE_MISMATCH, "Void function cannot return a value", node.getValue());
        } else {
            checkAssignable(expected, node.getValue(), valueType, "return value");
        }
        return null;
    }

    private void checkCondition(Expression condition) {
        TypeRef type = condition.accept(this, null);
        if (type != null && primitiveKind(type) != PrimitiveKind.BOOL) {
            error(SemanticError.ErrorKind.TYPE_MISMATCH,
                    "Condition must be 'bool' but found '" + type.toDisplayString() + "'", condition);
        }
    }

    @Override
    public TypeRef visitIfStmt(IfStmt node, Void ctx) {
        checkCondition(node.getCondition());
        node.getThenBranch().accept(this, ctx);
        if (node.getElseBranch() != null) {
            node.getElseBranch().accept(this, ctx);
        }
        return null;
    }

    private void visitLoopBody(LoopStatement loop, Block body) {
        Scope scope = enterScope(Scope.ScopeType.LOOP, loop);
        scope.setLabel(loop.getLabel());
        cursors.push(new StatementCursor(null, loop, false));
        body.accept(this, null);
        cursors.pop();
        exitScope();
    }

    private void checkLabelUnique(LoopStatement loop) {
        if (!loop.hasLabel()) return;
        Scope scope = currentScope;
        while (scope != null && !scope.isFunctionBoundary()) {
            if (scope.getType() == Scope.ScopeType.LOOP && loop.getLabel().equals(scope.getLabel())) {
                error(SemanticError.ErrorKind.DUPLICATE_DEFINITION,
                        "Label '" + loop.getLabel() + "' is already used by an enclosing loop", loop);
                return;
            }
            scope = scope.getParent();
        }
    }

    @Override
    public TypeRef visitWhileStmt(WhileStmt node, Void ctx) {
        checkLabelUnique(node);
        checkCondition(node.getCondition());
        visitLoopBody(node, node.getBody());
        return null;
    }

    @Override
    public TypeRef visitLoopStmt(LoopStmt node, Void ctx) {
        checkLabelUnique(node);
        visitLoopBody(node, node.getBody());
        return null;
    }

    @Override
    public TypeRef visitForStmt(ForStmt node, Void ctx) {
        checkLabelUnique(node);
        // 初始化语句的作用域包住整个循环
        currentScope = new Scope(Scope.ScopeType.BLOCK, currentScope, node.getInitializer());
        if (node.getInitializer() != null) {
            node.getInitializer().accept(this, ctx);
        }
        if (node.getCondition() != null) {
            checkCondition(node.getCondition());
        }
        if (node.getUpdate() != null) {
            node.getUpdate().accept(this, ctx);
        }
        visitLoopBody(node, node.getBody());
        exitScope();
        return null;
    }

    @Override
    public TypeRef visitForInStmt(ForInStmt node, Void ctx) {
        checkLabelUnique(node);
        TypeRef iterableType = node.getIterable().accept(this, ctx);
        TypeRef elementType = null;
        if (iterableType instanceof ArrayType) {
            elementType = ((ArrayType) iterableType).getElement();
        } else if (iterableType instanceof SliceType) {
            elementType = ((SliceType) iterableType).getElement();
        }

        Scope scope = enterScope(Scope.ScopeType.LOOP, node);
        scope.setLabel(node.getLabel());
        currentScope.define(new Symbol(node.getVariable(), SymbolKind.VARIABLE, elementType, false,
                node.getLocation(), node, null));
        cursors.push(new StatementCursor(null, node, false));
        node.getBody().accept(this, ctx);
        cursors.pop();
        exitScope();
        return null;
    }

    @Override
    public TypeRef visitSwitchStmt(SwitchStmt node, Void ctx) {
        TypeRef subjectType = node.getSubject().accept(this, ctx);
        for (SwitchCase switchCase : node.getCases()) {
            for (Expression value : switchCase.getValues()) {
                TypeRef valueType = value.accept(this, ctx);
                if (!isAssignable(subjectType, value, valueType)) {
                    error(SemanticError.ErrorKind.TYPE_MISMATCH, "Case value type '"
                            + valueType.toDisplayString() + "' does not match switch subject type '"
                            + subjectType.toDisplayString() + "'", value);
                }
            }
            switchCase.getBody().accept(this, ctx);
        }
        if (node.getDefaultBranch() != null) {
            node.getDefaultBranch().accept(this, ctx);
        }
        return null;
    }

    @Override
    public TypeRef visitBreakStmt(BreakStmt node, Void ctx) {
        checkJump("break", node.getLabel(), node);
        return null;
    }

    @Override
    public TypeRef visitContinueStmt(ContinueStmt node, Void ctx) {
        checkJump("continue", node.getLabel(), node);
        return null;
    }

    /**
     * break / continue 必须在循环内，带标签时标签必须属于外层循环（不跨越函数边界）
     */
    private void checkJump(String keyword, String label, AstNode node) {
        boolean inLoop = false;
        Scope scope = currentScope;
        while (scope != null && !scope.isFunctionBoundary()) {
            if (scope.getType() == Scope.ScopeType.LOOP) {
                inLoop = true;
                if (label == null || label.equals(scope.getLabel())) {
                    return;
                }
            }
            scope = scope.getParent();
        }
        if (!inLoop) {
            error(SemanticError.ErrorKind.INVALID_OPERATION, "'" + keyword + "' outside of loop", node);
        } else {
            error(SemanticError.ErrorKind.INVALID_OPERATION, "Undefined loop label '" + label + "'", node);
        }
    }

    /**
     * 嵌套函数：检查可见性与嵌套层数，分类捕获，然后在外层作用域之下分析函数体
     */
    @Override
    public TypeRef visitNestedFunctionStmt(NestedFunctionStmt node, Void ctx) {
        FunctionDecl fn = node.getFunction();
        FunctionContext enclosing = functions.peek();

        if (fn.isStatic()) {
            error(SemanticError.ErrorKind.VISIBILITY_ERROR,
                    "Nested function '" + fn.getName() + "' cannot be declared static", fn);
        }
        if (enclosing != null && enclosing.nested) {
            error(SemanticError.ErrorKind.CAPTURE_VIOLATION,
                    "Nested function '" + fn.getName() + "' cannot be declared inside another nested function", fn);
        }
        for (Parameter param : fn.getParams()) {
            if (param.isReceiver()) {
                error(SemanticError.ErrorKind.INVALID_OPERATION,
                        "Nested function '" + fn.getName() + "' cannot take 'self'", param);
            }
        }

        Set<String> suppressedBefore = new HashSet<String>(reportedCaptureViolations);
        fn.setCaptureInfo(classifyCaptures(node, fn));

        TypeRef returnType = checkType(fn.getReturnType());
        List<TypeRef> paramTypes = new ArrayList<TypeRef>();
        for (Parameter param : fn.getParams()) {
            paramTypes.add(checkType(param.getType()));
        }

        enterScope(Scope.ScopeType.NESTED_FUNCTION, fn);
        for (Parameter param : fn.getParams()) {
            if (!param.isReceiver()) {
                defineLocal(new Symbol(param.getName(), SymbolKind.PARAMETER,
                        param.getType().getResolvedType(), false, param.getLocation(), param, null), param);
            }
        }
        functions.push(new FunctionContext(returnType, true));
        cursors.push(new StatementCursor(null, null, true));
        fn.getBody().accept(this, ctx);
        cursors.pop();
        functions.pop();
        exitScope();
        reportedCaptureViolations.retainAll(suppressedBefore);

        Symbol symbol = new Symbol(fn.getName(), SymbolKind.NESTED_FUNCTION, returnType, false,
                fn.getLocation(), fn, fn.getVisibility());
        symbol.setParameterTypes(paramTypes);
        defineLocal(symbol, fn);
        return null;
    }

    private CaptureInfo classifyCaptures(NestedFunctionStmt stmt, FunctionDecl fn) {
        CaptureAnalyzer.Usage usage = CaptureAnalyzer.scan(fn);
        List<AstNode> later = nodesAfterCurrentStatement();
        Map<String, CaptureMode> captures = new LinkedHashMap<String, CaptureMode>();

        for (String name : usage.getReferenced()) {
            Symbol symbol = currentScope.resolve(name);
            if (symbol == null) {
                if (CaptureAnalyzer.isDeclared(name, later)) {
                    error(SemanticError.ErrorKind.CAPTURE_VIOLATION, "Nested function '" + fn.getName()
                            + "' captures '" + name + "' before it is declared", fn);
                    reportedCaptureViolations.add(name);
                }
                continue;
            }
            if (!symbol.isLocal()) {
                continue;
            }
            boolean readAfter = CaptureAnalyzer.isReferenced(name, later, stmt);
            captures.put(name, CaptureAnalyzer.classify(name, usage, readAfter));
        }
        return new CaptureInfo(captures);
    }

    // ============ 表达式 visitor ============

    @Override
    public TypeRef visitLiteral(Literal node, Void ctx) {
        switch (node.getKind()) {
            case INT: return new PrimitiveType(PrimitiveKind.INT);
            case FLOAT: return new PrimitiveType(PrimitiveKind.FLOAT);
            case BOOLEAN: return new PrimitiveType(PrimitiveKind.BOOL);
            case CHAR: return new PrimitiveType(PrimitiveKind.CHAR);
            default: return null;
        }
    }

    @Override
    public TypeRef visitIdentifier(Identifier node, Void ctx) {
        String name = node.getName();
        Symbol symbol = currentScope.resolve(name);
        if (symbol != null) {
            return symbol.getType();
        }
        if (HOST_VALUES.contains(name) || env.isKnownType(name) || reportedCaptureViolations.contains(name)) {
            return null;
        }
        error(SemanticError.ErrorKind.UNDEFINED_VARIABLE, "Undefined variable '" + name + "'", node);
        return null;
    }

    @Override
    public TypeRef visitBinaryExpr(BinaryExpr node, Void ctx) {
        TypeRef left = node.getLeft().accept(this, ctx);
        TypeRef right = node.getRight().accept(this, ctx);
        BinaryExpr.BinaryOp op = node.getOperator();

        if (op.isLogical() || op.isComparison()) {
            return new PrimitiveType(PrimitiveKind.BOOL);
        }
        if (op == BinaryExpr.BinaryOp.SHL || op == BinaryExpr.BinaryOp.SHR) {
            return left;
        }
        // 一侧是未加后缀的数字字面量时取另一侧的类型
        if (untypedNumericLiteral(node.getLeft()) != null && right != null) {
            return right;
        }
        if (untypedNumericLiteral(node.getRight()) != null) {
            return left;
        }
        if (left instanceof PrimitiveType && right instanceof PrimitiveType
                && !TypeCompatibility.isCompatible(left, right)) {
            error(SemanticError.ErrorKind.TYPE_MISMATCH, "Operator '" + op.toSourceString()
                    + "' cannot combine '" + left.toDisplayString() + "' and '" + right.toDisplayString() + "'", node);
            return null;
        }
        return left != null ? left : right;
    }

    @Override
    public TypeRef visitAssignExpr(AssignExpr node, Void ctx) {
        TypeRef targetType = node.getTarget().accept(this, ctx);
        TypeRef valueType = node.getValue().accept(this, ctx);
        checkMutable(node.getTarget(), "assign to");
        if (!node.isCompound()) {
            checkAssignable(targetType, node.getValue(), valueType, "assignment");
        }
        return targetType;
    }

    /**
     * 赋值目标（或 ++x / &var x 的操作数）的根变量必须可变。经过解引用的目标不检查。
     */
    private void checkMutable(Expression target, String action) {
        Expression current = target;
        while (true) {
            if (current instanceof FieldAccessExpr) {
                current = ((FieldAccessExpr) current).getTarget();
            } else if (current instanceof IndexExpr) {
                current = ((IndexExpr) current).getTarget();
            } else if (current instanceof ParenExpr) {
                current = ((ParenExpr) current).getInner();
            } else {
                break;
            }
        }
        if (current instanceof Identifier) {
            Symbol symbol = currentScope.resolve(((Identifier) current).getName());
            if (symbol != null && !symbol.isMutable()) {
                error(SemanticError.ErrorKind.INVALID_OPERATION,
                        "Cannot " + action + " immutable '" + symbol.getName() + "'", target);
            }
        } else if (!(current instanceof UnaryExpr
                && ((UnaryExpr) current).getOperator() == UnaryExpr.UnaryOp.DEREF)) {
            error(SemanticError.ErrorKind.INVALID_OPERATION, "Invalid assignment target", target);
        }
    }

    @Override
    public TypeRef visitUnaryExpr(UnaryExpr node, Void ctx) {
        TypeRef operand = node.getOperand().accept(this, ctx);
        switch (node.getOperator()) {
            case NOT:
            case NEG:
            case BIT_NOT:
                return operand;
            case PRE_INC:
            case PRE_DEC:
                checkMutable(node.getOperand(), "modify");
                return operand;
            case REF:
                return operand != null ? new ReferenceType(node.getLocation(), operand, false) : null;
            case REF_MUT:
                checkMutable(node.getOperand(), "mutably borrow");
                return operand != null ? new ReferenceType(node.getLocation(), operand, true) : null;
            case DEREF:
                if (operand instanceof PointerType) {
                    return ((PointerType) operand).getInner();
                }
                if (operand instanceof ReferenceType) {
                    return ((ReferenceType) operand).getInner();
                }
                if (operand instanceof PrimitiveType) {
                    error(SemanticError.ErrorKind.INVALID_OPERATION,
                            "Cannot dereference '" + operand.toDisplayString() + "'", node);
                }
                return null;
            default:
                return null;
        }
    }

    @Override
    public TypeRef visitCallExpr(CallExpr node, Void ctx) {
        List<TypeRef> argTypes = new ArrayList<TypeRef>();
        for (Expression arg : node.getArgs()) {
            argTypes.add(arg.accept(this, ctx));
        }

        if (!(node.getCallee() instanceof Identifier)) {
            node.getCallee().accept(this, ctx);
            return null;
        }
        String name = ((Identifier) node.getCallee()).getName();
        Symbol symbol = currentScope.resolve(name);
        if (symbol == null) {
            node.getCallee().accept(this, ctx);
            return null;
        }
        if (!symbol.isCallable()) {
            return null;
        }

        List<TypeRef> params = symbol.getParameterTypes();
        if (params.size() != node.getArgs().size()) {
            error(SemanticError.ErrorKind.TYPE_MISMATCH, "Function '" + name + "' expects " + params.size()
                    + " argument(s) but got " + node.getArgs().size(), node);
        } else {
            for (int i = 0; i < params.size(); i++) {
                checkAssignable(params.get(i), node.getArgs().get(i), argTypes.get(i),
                        "argument " + (i + 1) + " of '" + name + "'");
            }
        }
        return symbol.getType();
    }

    @Override
    public TypeRef visitMethodCallExpr(MethodCallExpr node, Void ctx) {
        node.getReceiver().accept(this, ctx);
        for (Expression arg : node.getArgs()) {
            arg.accept(this, ctx);
        }
        return null;
    }

    @Override
    public TypeRef visitFieldAccessExpr(FieldAccessExpr node, Void ctx) {
        // 枚举成员 Color.Red
        if (node.getTarget() instanceof Identifier) {
            String name = ((Identifier) node.getTarget()).getName();
            if (enums.contains(name) && currentScope.resolve(name) == null) {
                return new NamedType(node.getTarget().getLocation(), name);
            }
        }

        TypeRef target = node.getTarget().accept(this, ctx);
        if (target instanceof ReferenceType) {
            target = ((ReferenceType) target).getInner();
        }
        if (target instanceof TupleType) {
            List<TypeRef> elements = ((TupleType) target).getElements();
            try {
                int index = Integer.parseInt(node.getField());
                if (index < elements.size()) {
                    return elements.get(index);
                }
            } catch (NumberFormatException e) {
                // 具名字段落到下面的报错
            }
            error(SemanticError.ErrorKind.INVALID_OPERATION,
                    "Tuple '" + target.toDisplayString() + "' has no field '" + node.getField() + "'", node);
            return null;
        }
        if (target instanceof NamedType) {
            StructDecl struct = structs.get(((NamedType) target).getName());
            if (struct != null) {
                FieldDecl field = struct.findField(node.getField());
                if (field == null) {
                    error(SemanticError.ErrorKind.INVALID_OPERATION,
                            "Struct '" + struct.getName() + "' has no field '" + node.getField() + "'", node);
                    return null;
                }
                return env.resolveType(field.getType());
            }
        }
        return null;
    }

    @Override
    public TypeRef visitIndexExpr(IndexExpr node, Void ctx) {
        TypeRef target = node.getTarget().accept(this, ctx);
        node.getIndex().accept(this, ctx);
        if (node.getIndex() instanceof RangeExpr) {
            return null;
        }
        if (target instanceof ArrayType) {
            return ((ArrayType) target).getElement();
        }
        if (target instanceof SliceType) {
            return ((SliceType) target).getElement();
        }
        return null;
    }

    @Override
    public TypeRef visitCastExpr(CastExpr node, Void ctx) {
        node.getOperand().accept(this, ctx);
        return checkType(node.getTargetType());
    }

    @Override
    public TypeRef visitSizeofExpr(SizeofExpr node, Void ctx) {
        checkType(node.getType());
        return new NamedType(node.getLocation(), "usize");
    }

    @Override
    public TypeRef visitConditionalExpr(ConditionalExpr node, Void ctx) {
        checkCondition(node.getCondition());
        TypeRef thenType = node.getThenExpr().accept(this, ctx);
        TypeRef elseType = node.getElseExpr().accept(this, ctx);
        if (thenType != null && elseType != null
                && untypedNumericLiteral(node.getThenExpr()) == null
                && untypedNumericLiteral(node.getElseExpr()) == null
                && !TypeCompatibility.isCompatible(thenType, elseType)) {
            error(SemanticError.ErrorKind.TYPE_MISMATCH, "Conditional branches have different types '"
                    + thenType.toDisplayString() + "' and '" + elseType.toDisplayString() + "'", node);
            return null;
        }
        return untypedNumericLiteral(node.getThenExpr()) != null && elseType != null ? elseType : thenType;
    }

    @Override
    public TypeRef visitStructInitExpr(StructInitExpr node, Void ctx) {
        TypeRef type = null;
        if (!node.hasType()) {
            error(SemanticError.ErrorKind.TYPE_MISMATCH,
                    "Cannot infer the struct type of an initializer without a declared type", node);
        } else {
            type = checkType(node.getType());
        }

        StructDecl struct = type instanceof NamedType ? structs.get(((NamedType) type).getName()) : null;
        Set<String> seen = new HashSet<String>();
        for (StructInitExpr.FieldInit init : node.getFields()) {
            TypeRef valueType = init.getValue().accept(this, ctx);
            if (!seen.add(init.getName())) {
                error(SemanticError.ErrorKind.DUPLICATE_DEFINITION,
                        "Field '" + init.getName() + "' is initialized twice", init.getValue());
            }
            if (struct == null) continue;
            FieldDecl field = struct.findField(init.getName());
            if (field == null) {
                error(SemanticError.ErrorKind.INVALID_OPERATION,
                        "Struct '" + struct.getName() + "' has no field '" + init.getName() + "'", init.getValue());
            } else {
                checkAssignable(env.resolveType(field.getType()), init.getValue(), valueType,
                        "field '" + init.getName() + "'");
            }
        }
        return type;
    }

    @Override
    public TypeRef visitArrayLiteralExpr(ArrayLiteralExpr node, Void ctx) {
        TypeRef element = null;
        for (Expression e : node.getElements()) {
            TypeRef type = e.accept(this, ctx);
            if (element == null && untypedNumericLiteral(e) == null) {
                element = type;
            }
        }
        return element != null ? new ArrayType(node.getLocation(), element, node.getElements().size()) : null;
    }

    @Override
    public TypeRef visitArrayRepeatExpr(ArrayRepeatExpr node, Void ctx) {
        node.getValue().accept(this, ctx);
        node.getCount().accept(this, ctx);
        return null;
    }

    @Override
    public TypeRef visitTupleLiteralExpr(TupleLiteralExpr node, Void ctx) {
        List<TypeRef> elements = new ArrayList<TypeRef>();
        boolean complete = true;
        for (Expression e : node.getElements()) {
            TypeRef type = e.accept(this, ctx);
            if (type == null || untypedNumericLiteral(e) != null) {
                complete = false;
            }
            elements.add(type);
        }
        return complete ? new TupleType(node.getLocation(), elements) : null;
    }

    @Override
    public TypeRef visitRangeExpr(RangeExpr node, Void ctx) {
        if (node.getStart() != null) node.getStart().accept(this, ctx);
        if (node.getEnd() != null) node.getEnd().accept(this, ctx);
        return null;
    }

    @Override
    public TypeRef visitMacroCallExpr(MacroCallExpr node, Void ctx) {
        for (Expression arg : node.getArgs()) {
            arg.accept(this, ctx);
        }
        return null;
    }

    @Override
    public TypeRef visitErrorPropagationExpr(ErrorPropagationExpr node, Void ctx) {
        TypeRef operand = node.getOperand().accept(this, ctx);
        FunctionContext function = functions.peek();
        if (function != null && function.returnType instanceof PrimitiveType) {
            error(SemanticError.ErrorKind.INVALID_OPERATION,
                    "Error propagation '?' requires a fallible return type", node);
        }
        return operand instanceof FallibleType ? ((FallibleType) operand).getInner() : null;
    }

    @Override
    public TypeRef visitTypeScopedCallExpr(TypeScopedCallExpr node, Void ctx) {
        checkType(node.getType());
        for (TypeRef typeArg : node.getTypeArgs()) {
            checkType(typeArg);
        }
        for (Expression arg : node.getArgs()) {
            arg.accept(this, ctx);
        }
        return null;
    }

    @Override
    public TypeRef visitCommaExpr(CommaExpr node, Void ctx) {
        TypeRef last = null;
        for (Expression e : node.getExpressions()) {
            last = e.accept(this, ctx);
        }
        return last;
    }

    @Override
    public TypeRef visitParenExpr(ParenExpr node, Void ctx) {
        return node.getInner().accept(this, ctx);
    }
}
