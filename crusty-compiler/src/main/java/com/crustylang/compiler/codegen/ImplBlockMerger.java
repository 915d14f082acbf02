package com.crustylang.compiler.codegen;

import com.crustylang.compiler.analysis.AnalysisResult;
import com.crustylang.compiler.ast.decl.FunctionDecl;
import com.crustylang.compiler.ast.decl.ImplBlockDecl;
import com.crustylang.compiler.ast.decl.Item;
import com.crustylang.compiler.ast.decl.StructDecl;
import com.crustylang.compiler.ast.type.NamedType;
import com.crustylang.compiler.ast.type.TypeRef;

import java.util.*;

/**
 * 合并同一目标类型（别名展开后）的所有方法组。
 *
 * <p>结构体自身的方法算作该类型的第一个方法组。合并后的 impl 在第一个方法组的位置输出，
 * 后续方法组的位置不再输出任何内容。方法顺序按出现顺序。</p>
 */
public final class ImplBlockMerger {

    /**
     * 合并结果：锚点条目 → 合并后的 impl
     */
    public static final class MergedImpl {
        private final TypeRef targetType;
        private final List<FunctionDecl> methods = new ArrayList<FunctionDecl>();

        MergedImpl(TypeRef targetType) {
            this.targetType = targetType;
        }

        public TypeRef getTargetType() { return targetType; }
        public List<FunctionDecl> getMethods() { return methods; }
    }

    private final Map<Item, MergedImpl> anchors = new IdentityHashMap<Item, MergedImpl>();
    private final Set<Item> absorbed = Collections.newSetFromMap(new IdentityHashMap<Item, Boolean>());

    public static ImplBlockMerger merge(List<Item> items, AnalysisResult analysis) {
        ImplBlockMerger merger = new ImplBlockMerger();
        Map<TypeRef, MergedImpl> byTarget = new LinkedHashMap<TypeRef, MergedImpl>();

        for (Item item : items) {
            if (analysis != null && analysis.isExcluded(item)) continue;

            TypeRef target;
            List<FunctionDecl> methods;
            if (item instanceof StructDecl) {
                StructDecl struct = (StructDecl) item;
                if (struct.getMethods().isEmpty()) continue;
                target = new NamedType(struct.getLocation(), struct.getName());
                methods = struct.getMethods();
            } else if (item instanceof ImplBlockDecl) {
                ImplBlockDecl impl = (ImplBlockDecl) item;
                target = resolvedTarget(impl, analysis);
                methods = impl.getMethods();
            } else {
                continue;
            }

            MergedImpl merged = byTarget.get(target);
            if (merged == null) {
                merged = new MergedImpl(target);
                byTarget.put(target, merged);
                merger.anchors.put(item, merged);
            } else {
                merger.absorbed.add(item);
            }
            merged.methods.addAll(methods);
        }
        return merger;
    }

    private static TypeRef resolvedTarget(ImplBlockDecl impl, AnalysisResult analysis) {
        TypeRef declared = impl.getTargetType();
        if (declared.getResolvedType() != null) {
            return declared.getResolvedType();
        }
        return analysis != null ? analysis.getEnvironment().resolveType(declared) : declared;
    }

    /** 在该条目位置输出的合并 impl，没有则返回 null */
    public MergedImpl getMergedAt(Item item) {
        return anchors.get(item);
    }

    /** 该方法组是否已并入更早的方法组 */
    public boolean isAbsorbed(Item item) {
        return absorbed.contains(item);
    }
}
