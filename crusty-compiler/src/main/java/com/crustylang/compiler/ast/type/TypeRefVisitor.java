package com.crustylang.compiler.ast.type;

/**
 * TypeRef 轻量访问者接口，用于替代 instanceof 分派。
 */
public interface TypeRefVisitor<R> {
    R visitPrimitive(PrimitiveType type);
    R visitNamed(NamedType type);
    R visitPointer(PointerType type);
    R visitReference(ReferenceType type);
    R visitArray(ArrayType type);
    R visitSlice(SliceType type);
    R visitTuple(TupleType type);
    R visitGeneric(GenericType type);
    R visitFunction(FunctionType type);
    R visitFallible(FallibleType type);
    R visitAuto(AutoType type);
}
