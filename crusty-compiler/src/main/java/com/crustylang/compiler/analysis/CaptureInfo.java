package com.crustylang.compiler.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 嵌套函数的捕获信息：外层变量名到捕获方式（按首次出现排序）
 */
public final class CaptureInfo {
    private final Map<String, CaptureMode> captures;

    public CaptureInfo(Map<String, CaptureMode> captures) {
        this.captures = Collections.unmodifiableMap(new LinkedHashMap<String, CaptureMode>(captures));
    }

    public static CaptureInfo empty() {
        return new CaptureInfo(Collections.<String, CaptureMode>emptyMap());
    }

    public Map<String, CaptureMode> getCaptures() {
        return captures;
    }

    public CaptureMode getMode(String name) {
        return captures.get(name);
    }

    public boolean isEmpty() {
        return captures.isEmpty();
    }

    public boolean hasMutable() {
        return captures.containsValue(CaptureMode.MUTABLE);
    }

    public boolean hasMove() {
        return captures.containsValue(CaptureMode.MOVE);
    }

    /** 任一 MOVE → FnOnce；否则任一 MUTABLE → FnMut；否则 Fn */
    public ClosureKind getClosureKind() {
        if (hasMove()) {
            return ClosureKind.FN_ONCE;
        }
        if (hasMutable()) {
            return ClosureKind.FN_MUT;
        }
        return ClosureKind.FN;
    }

    @Override
    public String toString() {
        return captures + " -> " + getClosureKind().getHostName();
    }
}
