package com.crustylang.cli;

import com.crustylang.compiler.codegen.InternalCodegenError;
import com.crustylang.compiler.compiler.CompilationResult;
import com.crustylang.compiler.compiler.CompilerOptions;
import com.crustylang.compiler.compiler.CrustyCompiler;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 增量构建器
 *
 * <p>通过缓存文件哈希值，只重新转译有变化的源文件。各单元互不共享可变状态，
 * 在线程池中并行转译；输出文件与诊断按文件路径顺序写出。</p>
 */
public class IncrementalBuilder {
    static final String CACHE_DIR = ".crusty-cache";
    static final String CACHE_FILE = "build-cache.json";
    static final String SOURCE_EXTENSION = ".crst";
    static final String OUTPUT_EXTENSION = ".rs";

    private final CrustyCompiler compiler = new CrustyCompiler();
    private final PrintWriter out;
    private final DiagnosticReporter reporter;
    private final boolean verbose;

    /**
     * 构建统计
     */
    public static final class BuildSummary {
        private final int compiled;
        private final int skipped;
        private final List<String> failed;

        BuildSummary(int compiled, int skipped, List<String> failed) {
            this.compiled = compiled;
            this.skipped = skipped;
            this.failed = Collections.unmodifiableList(failed);
        }

        public int getCompiled() { return compiled; }
        public int getSkipped() { return skipped; }
        public List<String> getFailed() { return failed; }

        public boolean isSuccess() {
            return failed.isEmpty();
        }
    }

    /** 单个文件的转译结果 */
    private static final class UnitResult {
        final CompilationResult result;
        final String internalError;

        UnitResult(CompilationResult result, String internalError) {
            this.result = result;
            this.internalError = internalError;
        }
    }

    public IncrementalBuilder(PrintWriter out, PrintWriter err, boolean verbose) {
        this.out = out;
        this.reporter = new DiagnosticReporter(DiagnosticReporter.Format.TEXT, out, err);
        this.verbose = verbose;
    }

    /**
     * 构建目录（增量）
     *
     * @param sourceDir 源码目录
     * @param outputDir 输出目录
     * @param threads   转译线程数
     */
    public BuildSummary build(Path sourceDir, Path outputDir, int threads) throws IOException {
        if (!Files.isDirectory(sourceDir)) {
            throw new IOException("源码目录不存在: " + sourceDir.toAbsolutePath());
        }
        Files.createDirectories(outputDir);

        Path cacheFile = outputDir.resolve(CACHE_DIR).resolve(CACHE_FILE);
        BuildCache cache = loadCache(cacheFile);

        List<Path> sourceFiles = scanSourceFiles(sourceDir);
        Set<String> currentSources = new HashSet<String>();
        Map<String, String> hashes = new LinkedHashMap<String, String>();
        Map<String, Future<UnitResult>> pending = new LinkedHashMap<String, Future<UnitResult>>();
        int skipped = 0;

        ExecutorService pool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "crustyc-build");
            t.setDaemon(true);
            return t;
        });
        try {
            for (Path file : sourceFiles) {
                String relative = relativize(sourceDir, file);
                currentSources.add(relative);
                String source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
                String hash = BuildCache.computeHash(source);

                String previousOutput = cache.getOutput(relative);
                if (!cache.isChanged(relative, hash) && previousOutput != null
                        && Files.exists(outputDir.resolve(previousOutput))) {
                    skipped++;
                    if (verbose) {
                        out.println("  未变化: " + relative);
                    }
                    continue;
                }
                hashes.put(relative, hash);
                pending.put(relative, pool.submit(() -> compileUnit(source, relative)));
            }

            int compiled = 0;
            List<String> failed = new ArrayList<String>();
            for (Map.Entry<String, Future<UnitResult>> entry : pending.entrySet()) {
                String relative = entry.getKey();
                UnitResult unit = await(entry.getValue());
                if (unit.internalError != null) {
                    reporter.reportInternalError(relative, unit.internalError);
                    discardOutput(cache, relative, outputDir);
                    failed.add(relative);
                } else if (!unit.result.isSuccess()) {
                    reporter.report(relative, unit.result.getDiagnostics());
                    discardOutput(cache, relative, outputDir);
                    failed.add(relative);
                } else {
                    String outputName = toOutputName(relative);
                    Path target = outputDir.resolve(outputName);
                    Files.createDirectories(target.getParent());
                    Files.write(target, unit.result.getOutput().getBytes(StandardCharsets.UTF_8));
                    cache.update(relative, hashes.get(relative), outputName);
                    compiled++;
                    if (verbose) {
                        out.println("  转译: " + relative + " -> " + outputName);
                    }
                }
            }

            removeDeletedSources(cache, currentSources, outputDir);
            cache.save(cacheFile);

            out.println("构建完成: " + compiled + " 个文件已转译, " + skipped + " 个文件未变化"
                    + (failed.isEmpty() ? "" : ", " + failed.size() + " 个文件失败"));
            out.flush();
            return new BuildSummary(compiled, skipped, failed);
        } finally {
            pool.shutdownNow();
        }
    }

    private UnitResult compileUnit(String source, String unitName) {
        try {
            CompilerOptions options = new CompilerOptions().setUnitName(unitName);
            return new UnitResult(compiler.compile(source, options), null);
        } catch (InternalCodegenError e) {
            return new UnitResult(null, e.getMessage());
        }
    }

    private static UnitResult await(Future<UnitResult> future) throws IOException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("构建被中断", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException(cause);
        }
    }

    private BuildCache loadCache(Path cacheFile) throws IOException {
        try {
            return BuildCache.load(cacheFile);
        } catch (JsonParseException e) {
            reporter.warn("构建缓存已损坏，将全部重新转译 - " + e.getMessage());
            return new BuildCache();
        }
    }

    /**
     * 转译失败的文件不保留上次成功的输出
     */
    private static void discardOutput(BuildCache cache, String relative, Path outputDir) throws IOException {
        String previous = cache.getOutput(relative);
        if (previous != null) {
            Files.deleteIfExists(outputDir.resolve(previous));
        }
        cache.remove(relative);
    }

    /**
     * 清理已删除源文件的缓存和旧输出
     */
    private void removeDeletedSources(BuildCache cache, Set<String> currentSources, Path outputDir)
            throws IOException {
        for (String cachedPath : cache.getAllSourcePaths()) {
            if (currentSources.contains(cachedPath)) {
                continue;
            }
            String output = cache.getOutput(cachedPath);
            if (output != null) {
                Files.deleteIfExists(outputDir.resolve(output));
            }
            cache.remove(cachedPath);
            if (verbose) {
                out.println("  已删除: " + cachedPath);
            }
        }
    }

    /**
     * 递归扫描源文件，按路径排序
     */
    static List<Path> scanSourceFiles(Path dir) throws IOException {
        Stream<Path> stream = Files.walk(dir);
        try {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(SOURCE_EXTENSION))
                    .sorted()
                    .collect(Collectors.toList());
        } finally {
            stream.close();
        }
    }

    static String toOutputName(String relativeSource) {
        return relativeSource.substring(0, relativeSource.length() - SOURCE_EXTENSION.length()) + OUTPUT_EXTENSION;
    }

    private static String relativize(Path base, Path file) {
        return base.relativize(file).toString().replace('\\', '/');
    }
}
