package com.crustylang.compiler.codegen;

import com.crustylang.compiler.analysis.AnalysisResult;
import com.crustylang.compiler.analysis.SemanticAnalyzer;
import com.crustylang.compiler.ast.decl.CompilationUnit;
import com.crustylang.compiler.ast.expr.Expression;
import com.crustylang.compiler.lexer.Lexer;
import com.crustylang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Rust 代码生成测试
 */
class RustCodeGeneratorTest {

    private String generate(String source) {
        CompilationUnit unit = new Parser(new Lexer(source, "<test>"), "<test>").parse();
        AnalysisResult result = new SemanticAnalyzer().analyze(unit);
        assertFalse(result.hasErrors(), "不应有语义错误: " + result.getErrors());
        return new RustCodeGenerator(result).generate(unit);
    }

    /** 只取函数体内的 Rust 代码进行比对 */
    private void assertBody(String source, String expectedBody) {
        String output = generate(source);
        assertTrue(output.contains(expectedBody), "期望包含:\n" + expectedBody + "\n实际:\n" + output);
    }

    private static int occurrences(String text, String needle) {
        int count = 0;
        int index = text.indexOf(needle);
        while (index >= 0) {
            count++;
            index = text.indexOf(needle, index + needle.length());
        }
        return count;
    }

    @Nested
    @DisplayName("函数与类型映射")
    class FunctionTests {

        @Test
        @DisplayName("别名链解析到底层类型")
        void testTypedefChain() {
            String output = generate("typedef int A; typedef A B; int f(B x) { return x; }");
            assertEquals("pub type A = i32;\n\npub type B = i32;\n\npub fn f(x: i32) -> i32 {\n    return x;\n}\n",
                    output);
        }

        @Test
        @DisplayName("static 函数不加 pub，void 返回省略")
        void testVisibilityAndVoid() {
            assertEquals("fn helper() -> i32 {\n    return 1;\n}\n",
                    generate("static int helper(void) { return 1; }"));
            assertEquals("pub fn noop() {\n}\n", generate("void noop(void) { }"));
        }

        @Test
        @DisplayName("可失败返回类型")
        void testFallible() {
            String output = generate("int? parse(int x) { return x; }");
            assertTrue(output.startsWith("pub fn parse(x: i32) -> Result<i32, Box<dyn std::error::Error>> {"),
                    output);
        }

        @Test
        @DisplayName("基本类型与指针")
        void testPrimitiveMapping() {
            assertBody("void f(float a, i64 b, bool c, char d) { }", "pub fn f(a: f64, b: i64, c: bool, d: char) {");
            assertBody("void f(void) { *int p = NULL; }", "    let p: *const i32 = Option::None;\n");
            assertBody("void f(void) { var int x = 0; &var int r = &var x; }", "let r: &mut i32 = &mut x;");
        }

        @Test
        @DisplayName("sizeof 映射到 size_of")
        void testSizeof() {
            assertEquals("pub fn f() -> usize {\n    return std::mem::size_of::<i32>();\n}\n",
                    generate("usize f(void) { return sizeof(int); }"));
        }
    }

    @Nested
    @DisplayName("结构体、枚举与 impl 合并")
    class ItemTests {

        @Test
        @DisplayName("结构体与字段可见性")
        void testStruct() {
            assertEquals("pub struct Point {\n    pub x: i32,\n    pub y: i32,\n}\n",
                    generate("struct Point { int x; int y; }"));
            assertEquals("struct Empty {}\n", generate("static struct Empty { }"));
        }

        @Test
        @DisplayName("同一目标类型的方法块合并为一个 impl")
        void testImplMerge() {
            String output = generate(
                    "struct Rect { int w; int h; }\n"
                            + "typedef struct { int area(&self) { return self.w * self.h; } } @Rect.geometry;\n"
                            + "typedef Rect Box2;\n"
                            + "typedef struct { void grow(&var self) { self.w = self.w + 1; } } @Box2.mutators;\n");
            assertEquals(1, occurrences(output, "impl Rect {"), output);
            String expectedImpl = "impl Rect {\n"
                    + "    pub fn area(&self) -> i32 {\n"
                    + "        return self.w * self.h;\n"
                    + "    }\n"
                    + "\n"
                    + "    pub fn grow(&mut self) {\n"
                    + "        self.w = self.w + 1;\n"
                    + "    }\n"
                    + "}\n";
            assertTrue(output.contains(expectedImpl), output);
            assertTrue(output.indexOf("pub struct Rect") < output.indexOf("impl Rect"));
            assertTrue(output.indexOf("impl Rect") < output.indexOf("pub type Box2 = Rect;"));
        }

        @Test
        @DisplayName("枚举值与 :: 访问")
        void testEnum() {
            String output = generate("enum Color { Red, Green = 5 } Color pick(void) { return Color.Green; }");
            assertTrue(output.startsWith("pub enum Color {\n    Red,\n    Green = 5,\n}\n"), output);
            assertTrue(output.contains("return Color::Green;"), output);
        }

        @Test
        @DisplayName("extern 块与常量")
        void testExternAndConst() {
            assertEquals("extern \"C\" {\n    pub fn abs(x: i32) -> i32;\n}\n",
                    generate("extern \"C\" { int abs(int x); }"));
            assertEquals("pub const LIMIT: i32 = 10;\n", generate("const int LIMIT = 10;"));
        }

        @Test
        @DisplayName("#define 转为 macro_rules")
        void testMacroDefinition() {
            assertEquals("macro_rules! square {\n    ($x:expr) => {\n        $x * $x\n    };\n}\n",
                    generate("#define __SQUARE__(x) x * x\n"));
        }

        @Test
        @DisplayName("结构体初始化")
        void testStructInit() {
            assertBody("struct P { int x; int y; } P origin(void) { return P { .x = 0, .y = 1 }; }",
                    "return P { x: 0, y: 1 };");
        }
    }

    @Nested
    @DisplayName("嵌套函数转闭包")
    class ClosureTests {

        @Test
        @DisplayName("只读捕获生成 Fn 闭包")
        void testReadOnly() {
            assertBody("int f(void) { int outer = 1; int get() { return outer; } return get(); }",
                    "    let get = || -> i32 {\n        return outer;\n    };\n    return get();\n");
        }

        @Test
        @DisplayName("可变捕获生成 let mut")
        void testMutable() {
            assertBody("void f(void) { var int count = 0; void bump() { count = count + 1; } bump(); }",
                    "    let mut count: i32 = 0;\n    let mut bump = || {\n        count = count + 1;\n    };\n");
        }

        @Test
        @DisplayName("移动捕获生成 move 闭包")
        void testMove() {
            String output = generate("void consume(String s) { }\n"
                    + "void f(String name) { void take() { consume(name); } take(); }");
            assertTrue(output.contains("let take = move || {"), output);
        }
    }

    @Nested
    @DisplayName("控制流")
    class ControlFlowTests {

        @Test
        @DisplayName("C 风格 for 降级为 loop")
        void testForLoop() {
            assertBody("void g(int x) { }\nvoid f(void) { for (var int i = 0; i < 3; ++i) { g(i); } }",
                    "    {\n"
                            + "        let mut i: i32 = 0;\n"
                            + "        loop {\n"
                            + "            if !(i < 3) {\n"
                            + "                break;\n"
                            + "            }\n"
                            + "            g(i);\n"
                            + "            i += 1;\n"
                            + "        }\n"
                            + "    }\n");
        }

        @Test
        @DisplayName("带 continue 的 for 在下一轮开头执行更新")
        void testForWithContinue() {
            String output = generate("void g(int x) { }\n"
                    + "void f(void) { for (var int i = 0; i < 3; ++i) { if (i == 1) { continue; } g(i); } }");
            assertTrue(output.contains("        let mut __first = true;\n"
                    + "        loop {\n"
                    + "            if !__first {\n"
                    + "                i += 1;\n"
                    + "            }\n"
                    + "            __first = false;\n"), output);
            assertTrue(output.contains("continue;"), output);
            assertFalse(output.contains("            i += 1;\n        }"), output);
        }

        @Test
        @DisplayName("switch 转为 match")
        void testSwitch() {
            assertBody("void g(int x) { }\n"
                            + "void f(int x) { switch (x) { case 1, 2: g(x); break; case 3: default: g(0); } }",
                    "    match x {\n"
                            + "        1 | 2 => {\n"
                            + "            g(x);\n"
                            + "        }\n"
                            + "        3 => {}\n"
                            + "        _ => {\n"
                            + "            g(0);\n"
                            + "        }\n"
                            + "    }\n");
        }

        @Test
        @DisplayName("没有 default 时补空通配分支")
        void testSwitchWithoutDefault() {
            assertBody("void g(int x) { }\nvoid f(int x) { switch (x) { case 1: g(x); break; } }",
                    "        _ => {}\n    }\n");
        }

        @Test
        @DisplayName("带标签的循环")
        void testLabels() {
            assertBody("void f(void) { .outer: while (true) { loop { break .outer; } } }",
                    "    'outer: while true {\n        loop {\n            break 'outer;\n        }\n    }\n");
        }

        @Test
        @DisplayName("for-in 范围")
        void testForIn() {
            assertBody("void g(int x) { }\nvoid f(void) { for (i in 0..=10) { g(i); } }",
                    "for i in 0..=10 {");
        }
    }

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("类型转换与三元表达式")
        void testCastAndTernary() {
            assertBody("int f(float y) { return (int)y * 2; }", "return (y as i32) * 2;");
            assertBody("int f(bool c) { return c ? 1 : 2; }", "return if c { 1 } else { 2 };");
            assertBody("int f(bool c) { return (c ? 1 : 2) + 3; }", "return (if c { 1 } else { 2 }) + 3;");
        }

        @Test
        @DisplayName("括号保留")
        void testParentheses() {
            assertBody("int f(int a, int b) { return a - (b - 1); }", "return a - (b - 1);");
        }

        @Test
        @DisplayName("自增作为值与语句")
        void testIncrement() {
            String output = generate("int f(void) { var int x = 0; ++x; int y = ++x; return y; }");
            assertTrue(output.contains("    x += 1;\n"), output);
            assertTrue(output.contains("let y: i32 = { x += 1; x };"), output);
        }

        @Test
        @DisplayName("宏调用与类型限定调用")
        void testMacroAndScopedCalls() {
            assertBody("void f(void) { __println__(\"hi {}\", 1); }", "    println!(\"hi {}\", 1);\n");
            assertBody("Vec<int> f(void) { return @Vec(int).new(); }", "return Vec::<i32>::new();");
            assertBody("Vec<int> f(void) { return @Vec.new(); }", "return Vec::new();");
        }

        @Test
        @DisplayName("错误传播直接透传")
        void testErrorPropagation() {
            assertBody("int? g(void) { return 1; }\nint? f(void) { int v = g()?; return v; }",
                    "let v: i32 = g()?;");
        }

        @Test
        @DisplayName("没有映射规则时抛出内部错误")
        void testInternalError() {
            Expression expr = new Parser(new Lexer("{ .x = 1 }", "<test>"), "<test>").parseStandaloneExpression();
            assertThrows(InternalCodegenError.class, () -> new RustCodeGenerator(null).generateExpression(expr));
        }
    }

    @Test
    @DisplayName("相同输入生成相同输出")
    void testDeterministic() {
        String source = "struct S { int a; }\n"
                + "typedef struct { int get(&self) { return self.a; } } @S.accessors;\n"
                + "int main(void) { int x = 1; int read() { return x; } return read(); }\n";
        assertEquals(generate(source), generate(source));
    }
}
