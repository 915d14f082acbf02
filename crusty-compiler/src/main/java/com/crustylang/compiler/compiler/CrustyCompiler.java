package com.crustylang.compiler.compiler;

import com.crustylang.compiler.analysis.AnalysisResult;
import com.crustylang.compiler.analysis.SemanticAnalyzer;
import com.crustylang.compiler.analysis.SemanticError;
import com.crustylang.compiler.ast.decl.CompilationUnit;
import com.crustylang.compiler.codegen.RustCodeGenerator;
import com.crustylang.compiler.formatter.CrustyFormatter;
import com.crustylang.compiler.lexer.Lexer;
import com.crustylang.compiler.parser.ParseException;
import com.crustylang.compiler.parser.Parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 编译器门面：词法 → 语法 → 语义 → 生成。
 *
 * <p>任一阶段出错时只返回诊断，不返回部分输出。代码生成阶段的
 * {@link com.crustylang.compiler.codegen.InternalCodegenError} 属于编译器缺陷，直接抛出。</p>
 *
 * <p>每次调用使用独立的分析器与类型环境，实例可在多个线程间共享。</p>
 */
public class CrustyCompiler {

    /**
     * 将一个编译单元转译为 Rust
     *
     * @param source   源码
     * @param unitName 单元名（用于诊断位置）
     */
    public CompilationResult compile(String source, String unitName) {
        return compile(source, new CompilerOptions().setUnitName(unitName));
    }

    public CompilationResult compile(String source, CompilerOptions options) {
        CompilationUnit unit;
        try {
            unit = parse(source, options);
        } catch (ParseException e) {
            return CompilationResult.failure(Collections.singletonList(Diagnostic.fromParseException(e)));
        }

        // 格式化只依赖语法
        if (options.getEmitMode() == CompilerOptions.EmitMode.CRUSTY) {
            return CompilationResult.success(new CrustyFormatter().format(unit, options.getFormatConfig()));
        }

        AnalysisResult analysis = new SemanticAnalyzer().analyze(unit);
        if (analysis.hasErrors()) {
            List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
            for (SemanticError error : analysis.getErrors()) {
                diagnostics.add(Diagnostic.fromSemanticError(error));
            }
            return CompilationResult.failure(diagnostics);
        }

        if (options.getEmitMode() == CompilerOptions.EmitMode.AST) {
            return CompilationResult.success(new AstDumper().dump(unit));
        }
        return CompilationResult.success(new RustCodeGenerator(analysis, options.getFormatConfig()).generate(unit));
    }

    /**
     * 只做词法与语法分析
     *
     * @throws ParseException 第一个语法或词法错误
     */
    public CompilationUnit parse(String source, CompilerOptions options) {
        Lexer lexer = new Lexer(source, options.getUnitName(), options.getErrStream());
        return new Parser(lexer, options.getUnitName()).parse();
    }
}
