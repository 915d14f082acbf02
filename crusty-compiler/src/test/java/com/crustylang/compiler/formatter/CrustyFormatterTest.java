package com.crustylang.compiler.formatter;

import com.crustylang.compiler.ast.decl.CompilationUnit;
import com.crustylang.compiler.compiler.AstDumper;
import com.crustylang.compiler.lexer.Lexer;
import com.crustylang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CrustyFormatter 测试：输出可重新解析，且格式化结果是不动点
 */
class CrustyFormatterTest {

    private static final String PROGRAM = ""
            + "#[derive(Debug)]\n"
            + "struct Point { int x; int y; }\n"
            + "typedef Point Pos;\n"
            + "typedef struct { int sum(&self) { return self.x + self.y; } } @Point.math;\n"
            + "enum Color { Red, Green = 5, Blue }\n"
            + "const int LIMIT = 10;\n"
            + "extern \"C\" { int abs(int x); }\n"
            + "#define __TWICE__(v) v + v\n"
            + "static int helper(int a, int b) { return a * (b - 1); }\n"
            + "int? parse(int x) { return x; }\n"
            + "int? run(*var Point p) {\n"
            + "  var int total = 0;\n"
            + "  auto n = parse(3)?;\n"
            + "  for (var int i = 0; i < LIMIT; ++i) { if (i == 2) { continue; } total += i; }\n"
            + "  for (j in 0..=n) { total = total + j; }\n"
            + "  .outer: while (total > 0) { loop { break .outer; } }\n"
            + "  switch (total) { case 1, 2: total = 0; break; default: total = -1; }\n"
            + "  p->x = (int)3.5 * 2;\n"
            + "  int bump(int k) { return k + total; }\n"
            + "  Point q = Point { .x = 1, .y = 2 };\n"
            + "  __println__(\"{}\", q.x);\n"
            + "  Vec<int> items = @Vec(int).new();\n"
            + "  int m = total > 0 ? bump(1) : sizeof(Point);\n"
            + "  return m;\n"
            + "}\n";

    private CompilationUnit parse(String source) {
        return new Parser(new Lexer(source, "<test>"), "<test>").parse();
    }

    private String format(String source) {
        return new CrustyFormatter().format(parse(source));
    }

    /** 去掉位置信息的语法树转储 */
    private String structure(String source) {
        return new AstDumper().dump(parse(source)).replaceAll(" @\\d+:\\d+", "");
    }

    @Nested
    @DisplayName("往返")
    class RoundTripTests {

        @Test
        @DisplayName("格式化结果可重新解析且为不动点")
        void testFixpoint() {
            String once = format(PROGRAM);
            String twice = format(once);
            assertEquals(once, twice);
        }

        @Test
        @DisplayName("重新解析得到结构相同的语法树")
        void testStructurePreserved() {
            assertEquals(structure(PROGRAM), structure(format(PROGRAM)));
        }

        @Test
        @DisplayName("空源文件")
        void testEmpty() {
            assertEquals("", format(""));
        }
    }

    @Nested
    @DisplayName("输出形式")
    class LayoutTests {

        @Test
        @DisplayName("声明统一为 let 形式，语句缩进四个空格")
        void testCanonicalLet() {
            assertEquals("int f(int x) {\n    let y: int = x;\n    return y;\n}\n",
                    format("int f(int x) { int y = x; return y; }"));
        }

        @Test
        @DisplayName("顶层条目之间空一行")
        void testBlankLineBetweenItems() {
            String output = format("const int A = 1; const int B = 2;");
            assertEquals("const int A = 1;\n\nconst int B = 2;\n", output);
        }

        @Test
        @DisplayName("使用制表符缩进")
        void testTabs() {
            CompilationUnit unit = parse("int f(int x) { return x; }");
            String output = new CrustyFormatter().format(unit, new FormatConfig(4, false));
            assertEquals("int f(int x) {\n\treturn x;\n}\n", output);
        }

        @Test
        @DisplayName("负缩进宽度被拒绝")
        void testNegativeIndent() {
            assertThrows(IllegalArgumentException.class, () -> new FormatConfig(-1, true));
        }
    }
}
