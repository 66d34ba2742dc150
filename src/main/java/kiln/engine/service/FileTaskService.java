package kiln.engine.service;

import kiln.engine.core.PoolCoordinator;
import kiln.engine.exception.ParallelMapException;
import kiln.engine.handler.AnalyzeCodeHandler;
import kiln.engine.handler.AnalyzeCodeHandler.CodeAnalysis;
import kiln.engine.handler.CompressFileHandler;
import kiln.engine.handler.CompressFileHandler.CompressionResult;
import kiln.engine.handler.HashFileHandler;
import kiln.engine.handler.HashFileHandler.FileHash;
import kiln.engine.handler.SearchInFileHandler;
import kiln.engine.handler.SearchInFileHandler.FileSearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Blocking helpers that fan a list of files out over the pool, one task per
 * file. Results are in input order. The first failing file aborts the call
 * with {@link ParallelMapException}.
 */
public class FileTaskService {

    private static final Logger log = LoggerFactory.getLogger(FileTaskService.class);

    private final PoolCoordinator pool;

    public FileTaskService(PoolCoordinator pool) {
        this.pool = pool;
    }

    public List<FileHash> hashFiles(List<String> paths) {
        log.debug("Hashing {} file(s)", paths.size());
        return await(pool.parallelMap(paths, HashFileHandler.TYPE, path -> path, FileHash.class));
    }

    public List<CompressionResult> compressFiles(List<String> paths, String outputDir) {
        return compressFiles(paths, outputDir, CompressFileHandler.DEFAULT_LEVEL);
    }

    public List<CompressionResult> compressFiles(List<String> paths, String outputDir, int level) {
        if (level < 0 || level > 9) {
            throw new IllegalArgumentException("compression level must be between 0 and 9, got " + level);
        }
        log.debug("Compressing {} file(s) into {} at level {}", paths.size(), outputDir, level);
        return await(pool.parallelMap(paths, CompressFileHandler.TYPE,
                path -> new CompressFileHandler.Request(path, outputDir, level),
                CompressionResult.class));
    }

    public List<CodeAnalysis> analyzeCodeFiles(List<String> paths) {
        log.debug("Analyzing {} file(s)", paths.size());
        return await(pool.parallelMap(paths, AnalyzeCodeHandler.TYPE, path -> path, CodeAnalysis.class));
    }

    public List<FileSearchResult> searchInFiles(List<String> paths, String pattern, boolean caseSensitive) {
        log.debug("Searching {} file(s) for /{}/", paths.size(), pattern);
        SearchInFileHandler.Options options = new SearchInFileHandler.Options(caseSensitive);
        return await(pool.parallelMap(paths, SearchInFileHandler.TYPE,
                path -> new SearchInFileHandler.Request(path, pattern, options),
                FileSearchResult.class));
    }

    private static <R> List<R> await(CompletableFuture<List<R>> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
