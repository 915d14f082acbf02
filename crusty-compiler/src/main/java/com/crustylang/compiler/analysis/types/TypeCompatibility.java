package com.crustylang.compiler.analysis.types;

import com.crustylang.compiler.ast.type.*;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 已解析类型之间的结构兼容性判断。
 *
 * <p>调用方负责先展开别名。判断对两个参数对称；任意深度的类型都用显式栈比较。</p>
 */
public final class TypeCompatibility {

    private TypeCompatibility() {}

    /**
     * 判断两个已解析类型是否兼容
     */
    public static boolean isCompatible(TypeRef first, TypeRef second) {
        if (first == null || second == null) return true;

        Deque<TypeRef[]> work = new ArrayDeque<TypeRef[]>();
        work.push(new TypeRef[]{first, second});
        while (!work.isEmpty()) {
            TypeRef[] pair = work.pop();
            TypeRef a = pair[0];
            TypeRef b = pair[1];

            // auto 与任何类型兼容
            if (a instanceof AutoType || b instanceof AutoType) continue;

            if (a instanceof PrimitiveType && b instanceof PrimitiveType) {
                if (!primitivesCompatible(((PrimitiveType) a).getKind(), ((PrimitiveType) b).getKind())) {
                    return false;
                }
                continue;
            }

            if (a.getClass() != b.getClass() || !a.shallowEquals(b)) {
                return false;
            }

            List<TypeRef> left = a.getComponents();
            List<TypeRef> right = b.getComponents();
            if (left.size() != right.size()) {
                return false;
            }
            for (int i = left.size() - 1; i >= 0; i--) {
                work.push(new TypeRef[]{left.get(i), right.get(i)});
            }
        }
        return true;
    }

    /**
     * 原始类型兼容：种类相同，或 int 与 i32、float 与 f64 互为同义
     */
    public static boolean primitivesCompatible(PrimitiveKind a, PrimitiveKind b) {
        return canonical(a) == canonical(b);
    }

    private static PrimitiveKind canonical(PrimitiveKind kind) {
        switch (kind) {
            case INT: return PrimitiveKind.I32;
            case FLOAT: return PrimitiveKind.F64;
            default: return kind;
        }
    }
}
