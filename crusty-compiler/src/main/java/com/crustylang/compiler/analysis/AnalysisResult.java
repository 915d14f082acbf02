package com.crustylang.compiler.analysis;

import com.crustylang.compiler.ast.decl.Item;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 语义分析结果
 */
public final class AnalysisResult {
    private final TypeEnvironment environment;
    private final SymbolTable symbolTable;
    private final List<SemanticError> errors;
    private final Set<Item> excludedItems;

    public AnalysisResult(TypeEnvironment environment, SymbolTable symbolTable,
                          List<SemanticError> errors, Set<Item> excludedItems) {
        this.environment = environment;
        this.symbolTable = symbolTable;
        this.errors = Collections.unmodifiableList(errors);
        this.excludedItems = Collections.unmodifiableSet(excludedItems);
    }

    public TypeEnvironment getEnvironment() { return environment; }
    public SymbolTable getSymbolTable() { return symbolTable; }
    public List<SemanticError> getErrors() { return errors; }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /** 自身类型无法解析、不参与代码生成的条目 */
    public boolean isExcluded(Item item) {
        return excludedItems.contains(item);
    }

    /** 是否存在指定类型的错误 */
    public boolean hasError(SemanticError.ErrorKind kind) {
        for (SemanticError error : errors) {
            if (error.getKind() == kind) return true;
        }
        return false;
    }
}
