package com.crustylang.compiler.analysis;

/**
 * 由捕获方式推导出的闭包种类
 */
public enum ClosureKind {
    FN("Fn"),
    FN_MUT("FnMut"),
    FN_ONCE("FnOnce");

    private final String hostName;

    ClosureKind(String hostName) {
        this.hostName = hostName;
    }

    /** 目标语言中的 trait 名 */
    public String getHostName() {
        return hostName;
    }
}
