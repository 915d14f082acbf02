package com.crustylang.compiler.ast;

/**
 * 顶层项可见性。
 *
 * <p>Crusty 默认公开，{@code static} 表示私有。</p>
 */
public enum Visibility {
    PUBLIC,
    PRIVATE
}
