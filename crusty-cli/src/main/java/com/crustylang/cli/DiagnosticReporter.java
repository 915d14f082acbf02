package com.crustylang.cli;

import com.crustylang.compiler.compiler.Diagnostic;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.io.PrintWriter;
import java.util.List;

/**
 * 诊断输出：文本写到错误流，JSON 写到标准输出
 */
public class DiagnosticReporter {

    public enum Format {
        TEXT, JSON
    }

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    private final Format format;
    private final PrintWriter out;
    private final PrintWriter err;

    public DiagnosticReporter(Format format, PrintWriter out, PrintWriter err) {
        this.format = format;
        this.out = out;
        this.err = err;
    }

    /**
     * 解析 --diagnostics 取值，未知取值返回 null
     */
    public static Format parseFormat(String value) {
        if (value == null) return Format.TEXT;
        switch (value.toLowerCase()) {
            case "text": return Format.TEXT;
            case "json": return Format.JSON;
            default: return null;
        }
    }

    public void report(String file, List<Diagnostic> diagnostics) {
        if (format == Format.JSON) {
            out.println(gson.toJson(toJson(file, diagnostics)));
            out.flush();
            return;
        }
        for (Diagnostic diagnostic : diagnostics) {
            err.println(file + ":" + diagnostic.getLine() + ":" + diagnostic.getColumn()
                    + ": error[" + diagnostic.getKind() + "]: " + diagnostic.getMessage());
        }
        err.println("错误: " + file + " 共 " + diagnostics.size() + " 个错误");
        err.flush();
    }

    /**
     * 代码生成阶段的内部错误（编译器缺陷），总是以文本输出
     */
    public void reportInternalError(String file, String message) {
        err.println("内部错误: " + file + " - " + message);
        err.flush();
    }

    public void warn(String message) {
        err.println("警告: " + message);
        err.flush();
    }

    /**
     * {@code {"file": ..., "success": false, "diagnostics": [{stage, kind, message, line, column}]}}
     */
    public JsonObject toJson(String file, List<Diagnostic> diagnostics) {
        JsonObject root = new JsonObject();
        root.addProperty("file", file);
        root.addProperty("success", diagnostics.isEmpty());
        JsonArray array = new JsonArray();
        for (Diagnostic diagnostic : diagnostics) {
            JsonObject diag = new JsonObject();
            diag.addProperty("stage", diagnostic.getStage().name().toLowerCase());
            diag.addProperty("kind", diagnostic.getKind());
            diag.addProperty("message", diagnostic.getMessage());
            diag.addProperty("line", diagnostic.getLine());
            diag.addProperty("column", diagnostic.getColumn());
            array.add(diag);
        }
        root.add("diagnostics", array);
        return root;
    }
}
