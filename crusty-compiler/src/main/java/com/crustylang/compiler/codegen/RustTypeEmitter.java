package com.crustylang.compiler.codegen;

import com.crustylang.compiler.ast.type.*;

import java.util.List;

/**
 * 类型引用到 Rust 类型文本。调用方传入已解析的类型时输出即为别名展开后的形式。
 */
public final class RustTypeEmitter implements TypeRefVisitor<String> {

    public static final RustTypeEmitter INSTANCE = new RustTypeEmitter();

    private RustTypeEmitter() {}

    /** 优先输出分析阶段挂上的已解析类型 */
    public String emitResolved(TypeRef type) {
        TypeRef resolved = type.getResolvedType();
        return (resolved != null ? resolved : type).accept(this);
    }

    public String emit(TypeRef type) {
        return type.accept(this);
    }

    /**
     * 表达式位置的类型路径，泛型参数使用 turbofish：{@code Vec::<i32>}
     */
    public String emitPath(TypeRef type) {
        TypeRef resolved = type.getResolvedType() != null ? type.getResolvedType() : type;
        if (resolved instanceof GenericType) {
            GenericType generic = (GenericType) resolved;
            return generic.getBase().accept(this) + "::<" + join(generic.getTypeArgs()) + ">";
        }
        return resolved.accept(this);
    }

    private String join(List<TypeRef> types) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < types.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(types.get(i).accept(this));
        }
        return sb.toString();
    }

    @Override
    public String visitPrimitive(PrimitiveType type) {
        return HostSyntax.primitive(type.getKind());
    }

    @Override
    public String visitNamed(NamedType type) {
        return type.getName();
    }

    @Override
    public String visitPointer(PointerType type) {
        return (type.isMutable() ? "*mut " : "*const ") + type.getInner().accept(this);
    }

    @Override
    public String visitReference(ReferenceType type) {
        return (type.isMutable() ? "&mut " : "&") + type.getInner().accept(this);
    }

    @Override
    public String visitArray(ArrayType type) {
        return "[" + type.getElement().accept(this) + "; " + type.getSize() + "]";
    }

    @Override
    public String visitSlice(SliceType type) {
        return "[" + type.getElement().accept(this) + "]";
    }

    @Override
    public String visitTuple(TupleType type) {
        List<TypeRef> elements = type.getElements();
        if (elements.size() == 1) {
            return "(" + elements.get(0).accept(this) + ",)";
        }
        return "(" + join(elements) + ")";
    }

    @Override
    public String visitGeneric(GenericType type) {
        return type.getBase().accept(this) + "<" + join(type.getTypeArgs()) + ">";
    }

    @Override
    public String visitFunction(FunctionType type) {
        StringBuilder sb = new StringBuilder("fn(").append(join(type.getParamTypes())).append(")");
        TypeRef ret = type.getReturnType();
        if (ret != null && !(ret instanceof PrimitiveType && ((PrimitiveType) ret).isVoid())) {
            sb.append(" -> ").append(ret.accept(this));
        }
        return sb.toString();
    }

    @Override
    public String visitFallible(FallibleType type) {
        return "Result<" + type.getInner().accept(this) + ", " + HostSyntax.FALLIBLE_ERROR + ">";
    }

    @Override
    public String visitAuto(AutoType type) {
        return "_";
    }
}
