package com.crustylang.compiler.ast.decl;

import com.crustylang.compiler.ast.SourceLocation;

/**
 * 枚举成员。value 为自增后的判别值，explicitValue 只在源码写了 {@code = N} 时存在。
 */
public final class EnumVariant {
    private final SourceLocation location;
    private final String name;
    private final Long explicitValue;
    private final long value;

    public EnumVariant(SourceLocation location, String name, Long explicitValue, long value) {
        this.location = location;
        this.name = name;
        this.explicitValue = explicitValue;
        this.value = value;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }

    public Long getExplicitValue() {
        return explicitValue;
    }

    public boolean hasExplicitValue() {
        return explicitValue != null;
    }

    public long getValue() {
        return value;
    }
}
