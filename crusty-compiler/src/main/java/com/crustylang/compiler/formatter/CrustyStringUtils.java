package com.crustylang.compiler.formatter;

import java.util.Locale;

/**
 * 字符串与字符字面量的转义/反转义工具（Crusty 源码与生成的 Rust 源码共用同一组转义）
 */
public final class CrustyStringUtils {

    private CrustyStringUtils() {}

    /**
     * 反转义：给定反斜杠后面的字符（如 'n'），返回对应的实际字符（如 '\n'）。
     *
     * @return 反转义后的字符，未识别的转义返回 -1
     */
    public static int unescapeChar(char c) {
        switch (c) {
            case 'n':  return '\n';
            case 'r':  return '\r';
            case 't':  return '\t';
            case '0':  return '\0';
            case '\\': return '\\';
            case '\'': return '\'';
            case '"':  return '"';
            default:   return -1;
        }
    }

    /** 转义字符串内容（用于双引号包裹的字符串） */
    public static String escapeString(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                case '\0': sb.append("\\0"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    /** 转义单个字符（用于单引号包裹的字符字面量） */
    public static String escapeChar(char c) {
        switch (c) {
            case '\\': return "\\\\";
            case '\'': return "\\'";
            case '\n': return "\\n";
            case '\r': return "\\r";
            case '\t': return "\\t";
            case '\0': return "\\0";
            default: return String.valueOf(c);
        }
    }

    /** 去掉宏名两端的双下划线并转为小写：{@code __PRINTLN__ -> println} */
    public static String macroBaseName(String name) {
        String base = name;
        if (base.startsWith("__")) {
            base = base.substring(2);
        }
        if (base.endsWith("__") && base.length() >= 2) {
            base = base.substring(0, base.length() - 2);
        }
        return base.toLowerCase(Locale.ROOT);
    }

    /** 是否符合 {@code __name__} 宏命名约定 */
    public static boolean isMacroName(String name) {
        return name.length() > 4 && name.startsWith("__") && name.endsWith("__");
    }
}
