package com.crustylang.compiler.ast.type;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 类型结构相等与哈希（显式栈实现，深层嵌套类型不会耗尽调用栈）
 */
final class TypeEquality {

    private TypeEquality() {}

    static boolean structurallyEqual(TypeRef a, TypeRef b) {
        Deque<TypeRef> left = new ArrayDeque<TypeRef>();
        Deque<TypeRef> right = new ArrayDeque<TypeRef>();
        left.push(a);
        right.push(b);
        while (!left.isEmpty()) {
            TypeRef x = left.pop();
            TypeRef y = right.pop();
            if (x == y) continue;
            if (x.getClass() != y.getClass() || !x.shallowEquals(y)) {
                return false;
            }
            List<TypeRef> xs = x.getComponents();
            List<TypeRef> ys = y.getComponents();
            if (xs.size() != ys.size()) {
                return false;
            }
            for (int i = 0; i < xs.size(); i++) {
                left.push(xs.get(i));
                right.push(ys.get(i));
            }
        }
        return true;
    }

    static int structuralHash(TypeRef type) {
        int hash = 1;
        Deque<TypeRef> stack = new ArrayDeque<TypeRef>();
        stack.push(type);
        while (!stack.isEmpty()) {
            TypeRef t = stack.pop();
            hash = 31 * hash + t.getClass().hashCode();
            hash = 31 * hash + t.shallowHash();
            List<TypeRef> components = t.getComponents();
            hash = 31 * hash + components.size();
            for (int i = components.size() - 1; i >= 0; i--) {
                stack.push(components.get(i));
            }
        }
        return hash;
    }
}
