package com.crustylang.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.*;

/**
 * 增量构建缓存（JSON）
 *
 * <p>记录每个源文件的内容哈希和生成的输出文件，用于判断文件是否需要重新转译。
 * 路径均相对于源码目录/输出目录，以 '/' 分隔。</p>
 */
public class BuildCache {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    /** 单个源文件的缓存条目 */
    static final class Entry {
        String hash;
        String output;

        Entry() {
        }

        Entry(String hash, String output) {
            this.hash = hash;
            this.output = output;
        }
    }

    /** 源文件相对路径 -> 缓存条目 */
    private Map<String, Entry> files = new TreeMap<String, Entry>();

    /**
     * 检查文件是否有变化
     */
    public boolean isChanged(String sourcePath, String currentHash) {
        Entry cached = files.get(sourcePath);
        return cached == null || !cached.hash.equals(currentHash);
    }

    public void update(String sourcePath, String hash, String outputPath) {
        files.put(sourcePath, new Entry(hash, outputPath));
    }

    /** 上次生成的输出文件，没有记录返回 null */
    public String getOutput(String sourcePath) {
        Entry cached = files.get(sourcePath);
        return cached != null ? cached.output : null;
    }

    public Set<String> getAllSourcePaths() {
        return new TreeSet<String>(files.keySet());
    }

    /**
     * 移除缓存条目（源文件已删除或转译失败时调用）
     */
    public void remove(String sourcePath) {
        files.remove(sourcePath);
    }

    public void save(Path cacheFile) throws IOException {
        Files.createDirectories(cacheFile.getParent());
        Writer writer = Files.newBufferedWriter(cacheFile, StandardCharsets.UTF_8);
        try {
            GSON.toJson(this, writer);
        } finally {
            writer.close();
        }
    }

    /**
     * 从文件加载缓存，文件不存在时返回空缓存
     *
     * @throws JsonParseException 缓存内容不是合法的缓存 JSON
     */
    public static BuildCache load(Path cacheFile) throws IOException {
        if (!Files.exists(cacheFile)) {
            return new BuildCache();
        }
        Reader reader = Files.newBufferedReader(cacheFile, StandardCharsets.UTF_8);
        try {
            BuildCache cache = GSON.fromJson(reader, BuildCache.class);
            if (cache == null) {
                return new BuildCache();
            }
            if (cache.files == null) {
                cache.files = new TreeMap<String, Entry>();
            }
            for (Map.Entry<String, Entry> entry : cache.files.entrySet()) {
                if (entry.getValue() == null || entry.getValue().hash == null) {
                    throw new JsonParseException("Cache entry without hash: " + entry.getKey());
                }
            }
            return cache;
        } finally {
            reader.close();
        }
    }

    /**
     * 计算内容的 SHA-256 哈希
     */
    public static String computeHash(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
