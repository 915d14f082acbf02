package com.crustylang.compiler.analysis;

import com.crustylang.compiler.ast.type.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TypeEnvironment 测试：别名解析、兼容性、成环检测、读写阶段
 */
class TypeEnvironmentTest {

    private static final TypeRef INT = new PrimitiveType(PrimitiveKind.INT);
    private static final TypeRef I32 = new PrimitiveType(PrimitiveKind.I32);
    private static final TypeRef I64 = new PrimitiveType(PrimitiveKind.I64);
    private static final TypeRef FLOAT = new PrimitiveType(PrimitiveKind.FLOAT);
    private static final TypeRef BOOL = new PrimitiveType(PrimitiveKind.BOOL);

    private static TypeRef named(String name) {
        return new NamedType(name);
    }

    private static TypeRef ptr(TypeRef inner, boolean mutable) {
        return new PointerType(null, inner, mutable);
    }

    private static TypeRef ref(TypeRef inner, boolean mutable) {
        return new ReferenceType(null, inner, mutable);
    }

    private static TypeRef generic(String base, TypeRef... args) {
        return new GenericType(null, named(base), Arrays.asList(args));
    }

    /** Meters -> int，Distance -> Meters，IntPtr -> *Meters，Grid -> Vec<Distance> */
    private TypeEnvironment sampleEnvironment() {
        TypeEnvironment env = new TypeEnvironment();
        assertTrue(env.registerAlias("Meters", INT));
        assertTrue(env.registerAlias("Distance", named("Meters")));
        assertTrue(env.registerAlias("IntPtr", ptr(named("Meters"), false)));
        assertTrue(env.registerAlias("Grid", generic("Vec", named("Distance"))));
        env.registerConcrete("Point");
        env.freeze();
        return env;
    }

    /** 覆盖各种结构的类型样本 */
    private List<TypeRef> sampleTypes() {
        List<TypeRef> types = new ArrayList<TypeRef>();
        types.add(INT);
        types.add(I32);
        types.add(I64);
        types.add(FLOAT);
        types.add(BOOL);
        types.add(new AutoType());
        types.add(named("Meters"));
        types.add(named("Distance"));
        types.add(named("IntPtr"));
        types.add(named("Grid"));
        types.add(named("Point"));
        types.add(ptr(INT, false));
        types.add(ptr(INT, true));
        types.add(ref(named("Distance"), false));
        types.add(ref(INT, true));
        types.add(new ArrayType(null, named("Meters"), 4));
        types.add(new ArrayType(null, INT, 5));
        types.add(new SliceType(null, named("Distance")));
        types.add(new TupleType(null, Arrays.asList(named("Meters"), BOOL)));
        types.add(new TupleType(null, Arrays.asList(INT, BOOL)));
        types.add(new FallibleType(null, named("Distance")));
        types.add(generic("Vec", INT));
        types.add(generic("Vec", I64));
        types.add(generic("Option", named("IntPtr")));
        types.add(new FunctionType(null, Collections.singletonList(named("Meters")), BOOL));
        return types;
    }

    @Nested
    @DisplayName("resolveType")
    class ResolveTests {

        @Test
        @DisplayName("别名链传递：A -> B -> C 与 C 解析结果相同")
        void testTransitivity() {
            TypeEnvironment env = new TypeEnvironment();
            assertTrue(env.registerAlias("C", I64));
            assertTrue(env.registerAlias("B", named("C")));
            assertTrue(env.registerAlias("A", named("B")));
            assertEquals(env.resolveType(named("C")), env.resolveType(named("A")));
            assertEquals(I64, env.resolveType(named("A")));
        }

        @Test
        @DisplayName("幂等：resolve(resolve(T)) == resolve(T)")
        void testIdempotence() {
            TypeEnvironment env = sampleEnvironment();
            for (TypeRef type : sampleTypes()) {
                TypeRef once = env.resolveType(type);
                assertEquals(once, env.resolveType(once), "not idempotent for " + type);
            }
        }

        @Test
        @DisplayName("复合类型内部的别名也被展开")
        void testStructuralResolution() {
            TypeEnvironment env = sampleEnvironment();
            assertEquals(ptr(INT, false), env.resolveType(named("IntPtr")));
            assertEquals(generic("Vec", INT), env.resolveType(named("Grid")));
            assertEquals(new FallibleType(null, INT), env.resolveType(new FallibleType(null, named("Distance"))));
            assertEquals(new TupleType(null, Arrays.asList(INT, BOOL)),
                    env.resolveType(new TupleType(null, Arrays.asList(named("Meters"), BOOL))));
        }

        @Test
        @DisplayName("具体类型、原始类型与未知名字原样返回")
        void testUnchanged() {
            TypeEnvironment env = sampleEnvironment();
            assertEquals(named("Point"), env.resolveType(named("Point")));
            assertEquals(BOOL, env.resolveType(BOOL));
            assertEquals(named("Missing"), env.resolveType(named("Missing")));
            assertNull(env.resolveType(null));
        }

        @Test
        @DisplayName("一万层别名链不会耗尽调用栈")
        void testDeepChain() {
            int depth = 10000;
            TypeEnvironment env = new TypeEnvironment();
            for (int i = 0; i < depth; i++) {
                env.declarePending("T" + (i + 1));
                assertTrue(env.registerAlias("T" + i, named("T" + (i + 1))));
            }
            assertTrue(env.registerAlias("T" + depth, I64));
            env.freeze();

            assertEquals(I64, env.resolveType(named("T0")));
            assertFalse(env.hasCircularReference(named("T0"), new HashSet<String>()));
            assertTrue(env.isCompatible(named("T0"), named("T" + (depth / 2))));
        }

        @Test
        @DisplayName("深层嵌套的复合类型")
        void testDeepNesting() {
            TypeRef type = named("Meters");
            TypeRef expected = INT;
            for (int i = 0; i < 5000; i++) {
                type = ptr(type, i % 2 == 0);
                expected = ptr(expected, i % 2 == 0);
            }
            assertEquals(expected, sampleEnvironment().resolveType(type));
        }
    }

    @Nested
    @DisplayName("isCompatible")
    class CompatibilityTests {

        @Test
        @DisplayName("对称性")
        void testSymmetry() {
            TypeEnvironment env = sampleEnvironment();
            List<TypeRef> types = sampleTypes();
            for (TypeRef a : types) {
                for (TypeRef b : types) {
                    assertEquals(env.isCompatible(a, b), env.isCompatible(b, a),
                            "asymmetric for " + a + " / " + b);
                }
            }
        }

        @Test
        @DisplayName("别名与目标类型兼容")
        void testAliasCompatibility() {
            TypeEnvironment env = sampleEnvironment();
            assertTrue(env.isCompatible(named("Distance"), INT));
            assertTrue(env.isCompatible(named("Distance"), I32));
            assertTrue(env.isCompatible(named("Grid"), generic("Vec", named("Meters"))));
            assertFalse(env.isCompatible(named("Distance"), I64));
            assertFalse(env.isCompatible(named("Distance"), named("Point")));
        }

        @Test
        @DisplayName("指针与引用要求可变性一致")
        void testMutability() {
            TypeEnvironment env = sampleEnvironment();
            assertTrue(env.isCompatible(named("IntPtr"), ptr(INT, false)));
            assertFalse(env.isCompatible(named("IntPtr"), ptr(INT, true)));
            assertFalse(env.isCompatible(ref(INT, false), ref(INT, true)));
            assertFalse(env.isCompatible(ptr(INT, false), ref(INT, false)));
        }

        @Test
        @DisplayName("数组长度与泛型实参")
        void testStructure() {
            TypeEnvironment env = sampleEnvironment();
            assertTrue(env.isCompatible(new ArrayType(null, named("Meters"), 4), new ArrayType(null, INT, 4)));
            assertFalse(env.isCompatible(new ArrayType(null, INT, 4), new ArrayType(null, INT, 5)));
            assertFalse(env.isCompatible(generic("Vec", INT), generic("Option", INT)));
        }

        @Test
        @DisplayName("auto 与任何类型兼容")
        void testAuto() {
            TypeEnvironment env = sampleEnvironment();
            assertTrue(env.isCompatible(new AutoType(), named("Grid")));
            assertTrue(env.isCompatible(ptr(new AutoType(), false), ptr(BOOL, false)));
        }
    }

    @Nested
    @DisplayName("成环检测")
    class CycleTests {

        @Test
        @DisplayName("直接自引用 A -> A 被拒绝")
        void testDirectCycle() {
            TypeEnvironment env = new TypeEnvironment();
            env.declarePending("A");
            assertFalse(env.registerAlias("A", named("A")));
            assertNull(env.getEntry("A"));
        }

        @Test
        @DisplayName("间接成环 A -> B -> A 被拒绝")
        void testIndirectCycle() {
            TypeEnvironment env = new TypeEnvironment();
            env.declarePending("B");
            assertTrue(env.registerAlias("A", named("B")));
            assertFalse(env.registerAlias("B", named("A")));
            assertFalse(env.isAlias("B"));
        }

        @Test
        @DisplayName("多步成环与复合类型中的成环")
        void testMultiStepCycle() {
            TypeEnvironment env = new TypeEnvironment();
            env.declarePending("D");
            assertTrue(env.registerAlias("A", named("D")));
            assertTrue(env.registerAlias("B", named("A")));
            assertTrue(env.registerAlias("C", ptr(named("B"), false)));
            assertFalse(env.registerAlias("D", generic("Vec", named("C"))));
        }

        @Test
        @DisplayName("同一别名出现在互不相交的链上不算环")
        void testSharedAliasIsNotCycle() {
            TypeEnvironment env = new TypeEnvironment();
            assertTrue(env.registerAlias("Base", INT));
            assertTrue(env.registerAlias("Left", named("Base")));
            assertTrue(env.registerAlias("Right", named("Base")));
            assertTrue(env.registerAlias("Pair", new TupleType(null, Arrays.asList(named("Left"), named("Right"),
                    named("Base")))));
            assertEquals(new TupleType(null, Arrays.asList(INT, INT, INT)), env.resolveType(named("Pair")));
        }

        @Test
        @DisplayName("hasCircularReference 调用后恢复 visited")
        void testVisitedRestored() {
            TypeEnvironment env = sampleEnvironment();
            Set<String> visited = new HashSet<String>(Collections.singleton("X"));
            assertFalse(env.hasCircularReference(named("Grid"), visited));
            assertEquals(Collections.singleton("X"), visited);

            Set<String> onPath = new HashSet<String>(Collections.singleton("Meters"));
            assertTrue(env.hasCircularReference(named("Distance"), onPath));
            assertEquals(Collections.singleton("Meters"), onPath);
        }
    }

    @Nested
    @DisplayName("写阶段与查询")
    class PhaseTests {

        @Test
        @DisplayName("freeze 之后写入抛出 IllegalStateException")
        void testFrozen() {
            TypeEnvironment env = sampleEnvironment();
            assertTrue(env.isFrozen());
            assertThrows(IllegalStateException.class, () -> env.registerAlias("New", INT));
            assertThrows(IllegalStateException.class, () -> env.registerConcrete("New"));
            assertThrows(IllegalStateException.class, () -> env.declarePending("New"));
        }

        @Test
        @DisplayName("重复登记抛出 IllegalArgumentException")
        void testDuplicate() {
            TypeEnvironment env = new TypeEnvironment();
            env.registerConcrete("Point");
            assertThrows(IllegalArgumentException.class, () -> env.registerAlias("Point", INT));
            assertThrows(IllegalArgumentException.class, () -> env.registerConcrete("Point"));
        }

        @Test
        @DisplayName("已知类型：登记、待登记与内置类型")
        void testKnownTypes() {
            TypeEnvironment env = new TypeEnvironment();
            env.declarePending("Later");
            env.registerConcrete("Point");
            assertTrue(env.isKnownType("Later"));
            assertTrue(env.isKnownType("Point"));
            assertTrue(env.isKnownType("Vec"));
            assertTrue(TypeEnvironment.isHostType("String"));
            assertFalse(env.isKnownType("Nope"));
            assertEquals("Nope", env.findUndefinedName(generic("Vec", ptr(named("Nope"), false))));
            assertNull(env.findUndefinedName(generic("Vec", named("Point"))));
        }

        @Test
        @DisplayName("namedReferences 按出现顺序")
        void testNamedReferences() {
            TypeRef type = new TupleType(null, Arrays.asList(named("A"), generic("Vec", named("B")), INT));
            assertEquals(Arrays.asList("A", "Vec", "B"), TypeEnvironment.namedReferences(type));
        }

        @Test
        @DisplayName("每个环境独立，互不泄漏别名")
        void testIndependentEnvironments() {
            TypeEnvironment first = new TypeEnvironment();
            first.registerAlias("Meters", INT);
            TypeEnvironment second = new TypeEnvironment();
            assertFalse(second.isKnownType("Meters"));
            assertEquals(named("Meters"), second.resolveType(named("Meters")));
        }
    }
}
