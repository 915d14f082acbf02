package com.crustylang.compiler.analysis;

import com.crustylang.compiler.analysis.types.TypeCompatibility;
import com.crustylang.compiler.ast.type.NamedType;
import com.crustylang.compiler.ast.type.TypeRef;

import java.util.*;

/**
 * 单个编译单元的类型环境：别名表 + 类型级符号表。
 *
 * <p>生命周期分两段：写阶段登记 typedef / struct / enum，{@link #freeze()} 之后只读。
 * 冻结后任何写操作抛出 {@link IllegalStateException}。</p>
 *
 * <p>别名表中不存在能解析回自身的条目：{@link #registerAlias} 登记前先做环检测，
 * 成环的别名被拒绝。解析、兼容性判断与环检测都用显式栈，别名链深度不受调用栈限制。</p>
 */
public final class TypeEnvironment {

    /**
     * 别名表条目
     */
    public static final class AliasEntry {

        public enum Kind {
            ALIAS,      // typedef，指向目标类型
            CONCRETE    // struct / enum
        }

        private final Kind kind;
        private final TypeRef target;

        private AliasEntry(Kind kind, TypeRef target) {
            this.kind = kind;
            this.target = target;
        }

        static AliasEntry alias(TypeRef target) {
            return new AliasEntry(Kind.ALIAS, target);
        }

        static AliasEntry concrete() {
            return new AliasEntry(Kind.CONCRETE, null);
        }

        public Kind getKind() { return kind; }

        /** CONCRETE 条目返回 null */
        public TypeRef getTarget() { return target; }

        public boolean isAlias() { return kind == Kind.ALIAS; }
    }

    // 目标语言标准库中可直接使用的类型名
    private static final Set<String> HOST_TYPES = new HashSet<String>(Arrays.asList(
            "String", "str", "Vec", "Option", "Result", "Box", "HashMap", "HashSet",
            "BTreeMap", "BTreeSet", "VecDeque", "Rc", "Arc", "RefCell", "Cell", "Self",
            "usize", "isize", "u8", "i8", "u16", "i16", "u128", "i128"));

    private final Map<String, AliasEntry> aliases = new LinkedHashMap<String, AliasEntry>();
    private final Map<String, Symbol> symbols = new LinkedHashMap<String, Symbol>();
    // 已声明但尚未登记的 typedef 名（允许前向引用）
    private final Set<String> pending = new HashSet<String>();
    private boolean frozen;

    // ============ 写阶段 ============

    /**
     * 预先声明一个 typedef 名字，使其在登记前即可被引用
     */
    public void declarePending(String name) {
        checkWritable();
        pending.add(name);
    }

    /**
     * 登记别名。会与已有别名成环时拒绝登记并返回 false。
     *
     * @throws IllegalArgumentException 名字已登记
     */
    public boolean registerAlias(String name, TypeRef target) {
        checkWritable();
        if (aliases.containsKey(name)) {
            throw new IllegalArgumentException("Type '" + name + "' is already registered");
        }
        Set<String> visited = new HashSet<String>();
        visited.add(name);
        if (hasCircularReference(target, visited)) {
            return false;
        }
        aliases.put(name, AliasEntry.alias(target));
        pending.remove(name);
        return true;
    }

    /**
     * 登记具体类型（struct / enum）
     *
     * @throws IllegalArgumentException 名字已登记
     */
    public void registerConcrete(String name) {
        checkWritable();
        if (aliases.containsKey(name)) {
            throw new IllegalArgumentException("Type '" + name + "' is already registered");
        }
        aliases.put(name, AliasEntry.concrete());
    }

    /**
     * 登记类型级符号
     */
    public void defineSymbol(Symbol symbol) {
        checkWritable();
        symbols.put(symbol.getName(), symbol);
    }

    /**
     * 结束写阶段
     */
    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    private void checkWritable() {
        if (frozen) {
            throw new IllegalStateException("TypeEnvironment is frozen");
        }
    }

    // ============ 查询 ============

    public AliasEntry getEntry(String name) {
        return aliases.get(name);
    }

    public Symbol lookupSymbol(String name) {
        return symbols.get(name);
    }

    /** 名字是否为已登记、待登记或目标语言内置的类型 */
    public boolean isKnownType(String name) {
        return aliases.containsKey(name) || pending.contains(name) || HOST_TYPES.contains(name);
    }

    /** 是否为目标语言内置类型名 */
    public static boolean isHostType(String name) {
        return HOST_TYPES.contains(name);
    }

    public boolean isAlias(String name) {
        AliasEntry entry = aliases.get(name);
        return entry != null && entry.isAlias();
    }

    /** 已登记的类型名（登记顺序） */
    public Set<String> getTypeNames() {
        return Collections.unmodifiableSet(aliases.keySet());
    }

    /**
     * 展开类型中的所有别名，原始类型与 auto 原样返回。幂等。
     * 未知名字保持不变（由调用方报告 UNDEFINED_TYPE）。
     */
    public TypeRef resolveType(TypeRef type) {
        if (type == null) return null;

        Deque<ResolveFrame> work = new ArrayDeque<ResolveFrame>();
        Deque<TypeRef> results = new ArrayDeque<TypeRef>();
        work.push(new ResolveFrame(type, false));

        while (!work.isEmpty()) {
            ResolveFrame frame = work.pop();
            if (frame.expanded) {
                // 子类型已全部解析，按原顺序取回
                int count = frame.type.getComponents().size();
                TypeRef[] resolved = new TypeRef[count];
                for (int i = count - 1; i >= 0; i--) {
                    resolved[i] = results.pop();
                }
                results.push(frame.type.withComponents(Arrays.asList(resolved)));
                continue;
            }

            TypeRef current = followAliases(frame.type);
            List<TypeRef> components = current.getComponents();
            if (components.isEmpty()) {
                results.push(current);
                continue;
            }
            work.push(new ResolveFrame(current, true));
            for (int i = components.size() - 1; i >= 0; i--) {
                work.push(new ResolveFrame(components.get(i), false));
            }
        }
        return results.pop();
    }

    /**
     * 沿别名链走到第一个非别名类型
     */
    private TypeRef followAliases(TypeRef type) {
        TypeRef current = type;
        Set<String> seen = null;
        while (current instanceof NamedType) {
            String name = ((NamedType) current).getName();
            AliasEntry entry = aliases.get(name);
            if (entry == null || !entry.isAlias()) {
                break;
            }
            if (seen == null) seen = new HashSet<String>();
            if (!seen.add(name)) {
                // 登记时已拒绝成环别名
                throw new IllegalStateException("Circular alias '" + name + "' in type environment");
            }
            current = entry.getTarget();
        }
        return current;
    }

    private static final class ResolveFrame {
        final TypeRef type;
        final boolean expanded;

        ResolveFrame(TypeRef type, boolean expanded) {
            this.type = type;
            this.expanded = expanded;
        }
    }

    /**
     * 解析两侧后做结构兼容性比较。对称。
     */
    public boolean isCompatible(TypeRef first, TypeRef second) {
        if (first == null || second == null) return true;
        return TypeCompatibility.isCompatible(resolveType(first), resolveType(second));
    }

    /**
     * 从 {@code type} 出发沿别名引用做深度优先遍历，遇到当前路径上已有的名字即成环。
     *
     * <p>{@code visited} 是当前路径集合：进入别名前加入，离开后移除，
     * 所以同一别名出现在互不相交的链上不算环。调用结束后 {@code visited} 恢复原状。</p>
     */
    public boolean hasCircularReference(TypeRef type, Set<String> visited) {
        if (type == null) return false;

        Set<String> finished = new HashSet<String>();
        Deque<CycleFrame> stack = new ArrayDeque<CycleFrame>();
        stack.push(new CycleFrame(null, namedReferences(type)));
        try {
            while (!stack.isEmpty()) {
                CycleFrame top = stack.peek();
                if (!top.hasNext()) {
                    stack.pop();
                    if (top.alias != null) {
                        visited.remove(top.alias);
                        finished.add(top.alias);
                    }
                    continue;
                }
                String name = top.next();
                if (visited.contains(name)) {
                    return true;
                }
                if (finished.contains(name)) {
                    continue;
                }
                AliasEntry entry = aliases.get(name);
                if (entry != null && entry.isAlias()) {
                    visited.add(name);
                    stack.push(new CycleFrame(name, namedReferences(entry.getTarget())));
                }
            }
            return false;
        } finally {
            // 提前返回时把路径上剩余的名字移出
            while (!stack.isEmpty()) {
                CycleFrame frame = stack.pop();
                if (frame.alias != null) {
                    visited.remove(frame.alias);
                }
            }
        }
    }

    private static final class CycleFrame {
        final String alias;
        final List<String> references;
        int index;

        CycleFrame(String alias, List<String> references) {
            this.alias = alias;
            this.references = references;
        }

        boolean hasNext() {
            return index < references.size();
        }

        String next() {
            return references.get(index++);
        }
    }

    /**
     * 类型中出现的所有命名类型（含嵌套），按出现顺序
     */
    public static List<String> namedReferences(TypeRef type) {
        List<String> names = new ArrayList<String>();
        if (type == null) return names;
        Deque<TypeRef> work = new ArrayDeque<TypeRef>();
        work.push(type);
        while (!work.isEmpty()) {
            TypeRef current = work.pop();
            if (current instanceof NamedType) {
                names.add(((NamedType) current).getName());
            }
            List<TypeRef> components = current.getComponents();
            for (int i = components.size() - 1; i >= 0; i--) {
                work.push(components.get(i));
            }
        }
        return names;
    }

    /**
     * 类型中第一个未定义的名字，全部已知时返回 null
     */
    public String findUndefinedName(TypeRef type) {
        for (String name : namedReferences(type)) {
            if (!isKnownType(name)) {
                return name;
            }
        }
        return null;
    }
}
