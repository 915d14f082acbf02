package com.crustylang.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BuildCache 测试")
class BuildCacheTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("哈希变化才视为已修改")
    void testIsChanged() {
        BuildCache cache = new BuildCache();
        String hash = BuildCache.computeHash("int a;");
        assertThat(cache.isChanged("a.crst", hash)).isTrue();

        cache.update("a.crst", hash, "a.rs");
        assertThat(cache.isChanged("a.crst", hash)).isFalse();
        assertThat(cache.isChanged("a.crst", BuildCache.computeHash("int b;"))).isTrue();
        assertThat(cache.getOutput("a.crst")).isEqualTo("a.rs");
    }

    @Test
    @DisplayName("保存后重新加载")
    void testSaveAndLoad() throws IOException {
        Path file = tempDir.resolve(".crusty-cache").resolve("build-cache.json");
        BuildCache cache = new BuildCache();
        cache.update("b.crst", "h2", "b.rs");
        cache.update("a.crst", "h1", "a.rs");
        cache.save(file);

        BuildCache loaded = BuildCache.load(file);
        assertThat(loaded.getAllSourcePaths()).containsExactly("a.crst", "b.crst");
        assertThat(loaded.isChanged("a.crst", "h1")).isFalse();
        assertThat(loaded.getOutput("b.crst")).isEqualTo("b.rs");
    }

    @Test
    @DisplayName("缓存文件不存在时返回空缓存")
    void testLoadMissing() throws IOException {
        assertThat(BuildCache.load(tempDir.resolve("none.json")).getAllSourcePaths()).isEmpty();
    }

    @Test
    @DisplayName("SHA-256 十六进制摘要")
    void testComputeHash() {
        assertThat(BuildCache.computeHash(""))
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
        assertThat(BuildCache.computeHash("x")).hasSize(64);
    }
}
