package eu.virtualparadox.knowledge.application.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One Lucene index: directory, analyzer, writer and near-real-time searcher manager.
 * <p>Each store owns its own index, so a broken graph index cannot take the vector index down.</p>
 * <p>
 * All changes go through {@link #update(Update)}, one batch at a time, so a commit never
 * publishes half of another job's batch.
 * </p>
 */
@Slf4j
public class LuceneIndex implements Closeable {

    private final String name;
    private final Directory directory;
    private final Analyzer analyzer;
    private final IndexWriter writer;
    private final SearcherManager searcherManager;
    private final ReentrantLock writeLock = new ReentrantLock();

    /**
     * A batch of changes applied to the writer.
     */
    @FunctionalInterface
    public interface Update {
        void apply(IndexWriter writer) throws IOException;
    }

    private LuceneIndex(final String name, final Directory directory) throws IOException {
        this.name = name;
        this.directory = directory;
        this.analyzer = new StandardAnalyzer();
        final IndexWriterConfig cfg = new IndexWriterConfig(analyzer)
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        this.writer = new IndexWriter(directory, cfg);
        this.searcherManager = new SearcherManager(writer, null);
    }

    /**
     * Opens (or creates) an on-disk index.
     */
    public static LuceneIndex open(final String name, final Path path) throws IOException {
        Files.createDirectories(path);
        log.info("Opening Lucene index '{}' at {}", name, path);
        return new LuceneIndex(name, FSDirectory.open(path));
    }

    /**
     * Heap-only index, for tests.
     */
    public static LuceneIndex inMemory(final String name) throws IOException {
        return new LuceneIndex(name, new ByteBuffersDirectory());
    }

    public String name() {
        return name;
    }

    public SearcherManager searcherManager() {
        return searcherManager;
    }

    /**
     * Applies a batch, commits it and makes it visible to new searches. Batches of different
     * callers never interleave.
     * <p>
     * A batch that fails halfway is not rolled back. Its applied part stays buffered in the
     * writer and the next commit publishes it, so callers must be able to repeat the batch.
     * </p>
     */
    public void update(final Update update) throws IOException {
        writeLock.lock();
        try {
            update.apply(writer);
            writer.commit();
            searcherManager.maybeRefreshBlocking();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void close() {
        try { searcherManager.close(); } catch (Exception e) {
            log.error("Unable to close SearcherManager of index {}", name, e);
        }

        try { writer.close(); } catch (Exception e) {
            log.error("Unable to close IndexWriter of index {}", name, e);
        }

        try { analyzer.close(); } catch (Exception e) {
            log.error("Unable to close Analyzer of index {}", name, e);
        }

        try { directory.close(); } catch (Exception e) {
            log.error("Unable to close Directory of index {}", name, e);
        }
    }
}
