package eu.virtualparadox.knowledge.job;

import eu.virtualparadox.knowledge.catalog.EJobState;
import eu.virtualparadox.knowledge.catalog.repo.ChunkRepository;
import eu.virtualparadox.knowledge.catalog.repo.JobRepository;
import eu.virtualparadox.knowledge.catalog.repo.TaskRepository;
import eu.virtualparadox.knowledge.catalog.service.DocumentStore;
import eu.virtualparadox.knowledge.catalog.service.StoredChunk;
import eu.virtualparadox.knowledge.ingest.concept.ConceptModelClient;
import eu.virtualparadox.knowledge.ingest.concept.ConceptModelResult;
import eu.virtualparadox.knowledge.ingest.error.StoreException;
import eu.virtualparadox.knowledge.ingest.model.Chunk;
import eu.virtualparadox.knowledge.ingest.model.IngestionOptions;
import eu.virtualparadox.knowledge.ingest.source.TranscriptionClient;
import eu.virtualparadox.knowledge.ingest.source.TranscriptionStatus;
import eu.virtualparadox.knowledge.queue.ETaskStatus;
import eu.virtualparadox.knowledge.queue.TaskDispatcher;
import eu.virtualparadox.knowledge.queue.TaskQueue;
import eu.virtualparadox.knowledge.rag.graph.GraphStore;
import eu.virtualparadox.knowledge.rag.graph.GraphVocabulary;
import eu.virtualparadox.knowledge.rag.graph.LuceneGraphStore;
import eu.virtualparadox.knowledge.rag.graph.Triple;
import eu.virtualparadox.knowledge.rag.index.LuceneVectorStore;
import eu.virtualparadox.knowledge.rag.index.VectorHit;
import eu.virtualparadox.knowledge.rag.index.VectorRecord;
import eu.virtualparadox.knowledge.rag.index.VectorStore;
import eu.virtualparadox.knowledge.util.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives whole jobs through the queue, the coordinator and the real stores.
 * External services are replaced by in-process fakes.
 */
@SpringBootTest(properties = {
        "knowledge.ingestion.concepts.enabled=true",
        "knowledge.ingestion.concepts.base-url=http://localhost:9/v1",
        "knowledge.ingestion.chunking.token-budget=24",
        "knowledge.ingestion.chunking.overlap-tokens=4",
        "knowledge.ingestion.poll.base-delay=1s",
        "knowledge.ingestion.poll.factor=2.0",
        "knowledge.ingestion.poll.max-delay=4s",
        "knowledge.ingestion.poll.jitter=0",
        "knowledge.ingestion.poll.max-wait=20s",
        "knowledge.ingestion.source-retry.max-attempts=1",
        "knowledge.ingestion.write-retry.max-attempts=2",
        "knowledge.ingestion.write-retry.initial-backoff=5ms",
        "knowledge.ingestion.pipeline.stage-retry.initial-backoff=5ms",
        "knowledge.ingestion.queue.max-attempts=3",
        "knowledge.ingestion.queue.retry-backoff=1s"
})
class IngestionFlowTest {

    private static final Instant START = Instant.parse("2026-05-01T08:00:00Z");
    private static final String VIDEO = "https://youtu.be/abc123";

    private static final String ARTICLE = """
            Lucene stores every chunk vector in a dedicated index. The index is searched with cosine similarity \
            and returns the closest chunks first.

            Concepts extracted from each chunk are kept as triples. The graph index answers which chunks mention \
            a concept and how concepts relate.

            Jobs move through a fixed set of states. Every transition is recorded in the catalog so a restarted \
            worker can resume where the previous one stopped.

            Re-indexing replays the stored chunks into the indexes. Nothing is fetched or embedded again during \
            a replay.
            """;

    @TestConfiguration
    static class FakeServices {

        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock(START);
        }

        @Bean
        @Primary
        FakeTranscriptionClient fakeTranscriptionClient() {
            return new FakeTranscriptionClient();
        }

        @Bean
        @Primary
        FakeConceptModelClient fakeConceptModelClient() {
            return new FakeConceptModelClient();
        }

        @Bean
        @Primary
        SwitchableVectorStore switchableVectorStore(final LuceneVectorStore delegate) {
            return new SwitchableVectorStore(delegate);
        }

        @Bean
        @Primary
        SwitchableGraphStore switchableGraphStore(final LuceneGraphStore delegate) {
            return new SwitchableGraphStore(delegate);
        }
    }

    @Autowired
    private IngestionService service;

    @Autowired
    private JobCoordinator coordinator;

    @Autowired
    private TaskDispatcher dispatcher;

    @Autowired
    private PollSchedule pollSchedule;

    @Autowired
    private DocumentStore documentStore;

    @Autowired
    private MutableClock clock;

    @Autowired
    private FakeTranscriptionClient transcription;

    @Autowired
    private FakeConceptModelClient conceptModel;

    @Autowired
    private SwitchableVectorStore vectorStore;

    @Autowired
    private SwitchableGraphStore graphStore;

    @Autowired
    private TaskQueue taskQueue;

    @Autowired
    private TaskRepository taskRepository;

    @Autowired
    private ChunkRepository chunkRepository;

    @Autowired
    private JobRepository jobRepository;

    @TempDir
    Path tempDir;

    @BeforeEach
    void reset() {
        clock.set(START);
        transcription.reset();
        conceptModel.reset();
        vectorStore.failing.set(false);
        vectorStore.onUpsert = () -> { };
        graphStore.failing.set(false);
        graphStore.writes.clear();
    }

    @AfterEach
    void cleanUp() {
        taskRepository.deleteAll();
        chunkRepository.deleteAll();
        jobRepository.deleteAll();
    }

    // ---------- Submission ----------

    @Test
    @DisplayName("Submitting the same source and key twice returns the running job")
    void submitIsIdempotentWhileActive() throws IOException {
        final String file = writeFile("article.txt", ARTICLE);

        final String first = service.submit(file, "k1", null);
        assertEquals(first, service.submit("  " + file + "  ", "k1", null));
        assertNotEquals(first, service.submit(file, "k2", null));
        assertEquals(EJobState.SUBMITTED, state(first));

        settle(first);
        assertEquals(EJobState.INDEXED, state(first));

        final String second = service.submit(file, "k1", null);
        assertNotEquals(first, second, "a finished job frees its source and key");
    }

    @Test
    @DisplayName("A blank source reference is rejected")
    void blankSourceRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.submit("  ", null, null));
        assertThrows(IllegalArgumentException.class, () -> service.submit(null, null, null));
    }

    // ---------- Direct sources ----------

    @Test
    @DisplayName("A local file goes through every stage and lands in all three stores")
    void fileSourceIsIndexed() throws IOException {
        final String jobId = service.submit(writeFile("article.txt", ARTICLE), null, IngestionOptions.defaults());

        settle(jobId);

        final JobView job = service.getJob(jobId).orElseThrow();
        assertEquals(EJobState.INDEXED, job.state());
        assertNull(job.reason());
        assertEquals(1, job.attemptCount());
        assertTrue(job.chunkCount() >= 2, "expected several chunks, got " + job.chunkCount());
        assertTrue(job.conceptCount() > 0);
        assertNotNull(job.embeddingModelVersion());
        assertEquals(3, job.provenance().size());

        final List<Chunk> chunks = service.listChunks(jobId);
        assertEquals(job.chunkCount(), chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            assertEquals(i, chunks.get(i).sequenceIndex());
            assertEquals(Chunk.buildId(jobId, i), chunks.get(i).id());
        }
        assertTrue(documentStore.listChunks(jobId).stream().allMatch(StoredChunk::indexed));

        assertEquals(chunks.size(), vectorStore.countByJobId(jobId));
        assertEquals(job.conceptCount(), service.listConcepts(jobId).size());
        assertEquals(chunks.size(), conceptModel.calls.get());

        final List<Triple> triples = graphStore.listTriples(jobId);
        final String sourceNode = GraphVocabulary.sourceNode(jobId);
        assertTrue(triples.contains(new Triple(sourceNode, GraphVocabulary.RDF_TYPE, GraphVocabulary.KN_SOURCE)));
        assertTrue(triples.contains(new Triple(sourceNode, GraphVocabulary.KN_SOURCE_TYPE, "file")));
        for (final Chunk chunk : chunks) {
            final String chunkNode = GraphVocabulary.chunkNode(chunk.id());
            assertTrue(triples.contains(new Triple(chunkNode, GraphVocabulary.KN_DERIVED_FROM, sourceNode)));
            assertTrue(triples.contains(new Triple(chunkNode, GraphVocabulary.KN_VECTOR_ID,
                    VectorRecord.vectorId(chunk.id(), job.embeddingModelVersion()))));
        }
        assertTrue(triples.stream().anyMatch(t -> t.predicate().equals(GraphVocabulary.KN_MENTIONED_IN)));
    }

    @Test
    @DisplayName("skipConcepts leaves the concept model untouched and never writes the graph")
    void skipConceptsOption() throws IOException {
        final String jobId = service.submit(writeFile("article.md", ARTICLE), null,
                new IngestionOptions(true, null, null, null));

        settle(jobId);

        final JobView job = service.getJob(jobId).orElseThrow();
        assertEquals(EJobState.INDEXED, job.state());
        assertEquals(0, job.conceptCount());
        assertTrue(service.listConcepts(jobId).isEmpty());
        assertTrue(graphStore.listTriples(jobId).isEmpty());
        assertEquals(List.of(), graphStore.writes, "no graph write may be attempted");
        assertEquals(0, conceptModel.calls.get());
        assertEquals(job.chunkCount(), vectorStore.countByJobId(jobId));
    }

    @Test
    @DisplayName("A source nobody can read fails with unsupported_source")
    void unsupportedSourceFails() {
        final String jobId = service.submit("ftp://example.org/notes.txt", null, null);

        settle(jobId);

        final JobView job = service.getJob(jobId).orElseThrow();
        assertEquals(EJobState.FAILED, job.state());
        assertEquals("unsupported_source", job.reason());
        assertNotNull(job.error());
    }

    @Test
    @DisplayName("A missing file fails with source_unavailable")
    void missingFileFails() {
        final String jobId = service.submit(tempDir.resolve("nope.txt").toString(), null, null);

        settle(jobId);

        assertEquals("source_unavailable", service.getJob(jobId).orElseThrow().reason());
    }

    @Test
    @DisplayName("Content that normalizes to nothing fails with empty_content")
    void emptyContentFails() throws IOException {
        final String jobId = service.submit(writeFile("blank.txt", "\u200B \n\n \u00A0 "), null, null);

        settle(jobId);

        final JobView job = service.getJob(jobId).orElseThrow();
        assertEquals(EJobState.FAILED, job.state());
        assertEquals("empty_content", job.reason());
        assertTrue(service.listChunks(jobId).isEmpty());
    }

    @Test
    @DisplayName("Per-job chunk settings that contradict each other fail with invalid_options")
    void invalidOptionsFail() throws IOException {
        final String jobId = service.submit(writeFile("article.txt", ARTICLE), null,
                new IngestionOptions(false, 10, 10, null));

        settle(jobId);

        assertEquals("invalid_options", service.getJob(jobId).orElseThrow().reason());
    }

    @Test
    @DisplayName("An unknown embedding model version fails with unsupported_embedding_model")
    void unknownEmbeddingModelFails() throws IOException {
        final String jobId = service.submit(writeFile("article.txt", ARTICLE), null,
                new IngestionOptions(false, null, null, "no-such-model"));

        settle(jobId);

        assertEquals("unsupported_embedding_model", service.getJob(jobId).orElseThrow().reason());
        assertEquals(0, vectorStore.countByJobId(jobId));
    }

    // ---------- Transcribed sources ----------

    @Test
    @DisplayName("A video is transcribed externally, polled until ready and then indexed")
    void transcribedSourceIsPolledUntilReady() {
        transcription.pendingPolls = 2;
        transcription.text = ARTICLE;

        final String jobId = service.submit(VIDEO, null, null);
        dispatcher.runDueTasks();

        JobView job = service.getJob(jobId).orElseThrow();
        assertEquals(EJobState.EXTERNAL_PENDING, job.state());
        assertEquals("ext-1", job.externalJobId());
        assertEquals(List.of("https://www.youtube.com/watch?v=abc123"), transcription.submitted);

        settle(jobId);

        job = service.getJob(jobId).orElseThrow();
        assertEquals(EJobState.INDEXED, job.state());
        assertEquals(3, job.pollCount());
        assertEquals(job.chunkCount(), vectorStore.countByJobId(jobId));
    }

    @Test
    @DisplayName("A transcription that never finishes times out within the poll budget")
    void transcriptionTimesOut() {
        transcription.pendingPolls = Integer.MAX_VALUE;

        final String jobId = service.submit(VIDEO, null, null);
        settle(jobId);

        final JobView job = service.getJob(jobId).orElseThrow();
        assertEquals(EJobState.FAILED, job.state());
        assertEquals("external_job_timeout", job.reason());
        assertTrue(job.pollCount() >= 1);
        assertTrue(job.pollCount() <= pollSchedule.maxPolls(),
                job.pollCount() + " polls exceed the bound " + pollSchedule.maxPolls());
        assertFalse(clock.instant().isBefore(START.plus(Duration.ofSeconds(20))));
    }

    @Test
    @DisplayName("A transcription reported as failed fails the job with external_job_failed")
    void transcriptionFailureFailsJob() {
        transcription.pendingPolls = 1;
        transcription.failure = "audio track missing";

        final String jobId = service.submit(VIDEO, null, null);
        settle(jobId);

        final JobView job = service.getJob(jobId).orElseThrow();
        assertEquals(EJobState.FAILED, job.state());
        assertEquals("external_job_failed", job.reason());
        assertTrue(job.error().contains("audio track missing"));
    }

    // ---------- Cancellation ----------

    @Test
    @DisplayName("Cancelling a job that has not started ends it at once")
    void cancelBeforeStart() throws IOException {
        final String file = writeFile("article.txt", ARTICLE);
        final String jobId = service.submit(file, null, null);

        final JobView cancelled = service.cancel(jobId).orElseThrow();
        assertEquals(EJobState.CANCELLED, cancelled.state());

        dispatcher.runDueTasks();

        assertEquals(EJobState.CANCELLED, state(jobId));
        assertTrue(service.listChunks(jobId).isEmpty());
        assertNotEquals(jobId, service.submit(file, null, null));
    }

    @Test
    @DisplayName("Cancelling while waiting for the transcription stops further polls")
    void cancelWhileWaitingForTranscription() {
        transcription.pendingPolls = Integer.MAX_VALUE;
        final String jobId = service.submit(VIDEO, null, null);
        dispatcher.runDueTasks();
        assertEquals(EJobState.EXTERNAL_PENDING, state(jobId));

        service.cancel(jobId);
        settle(jobId);

        assertEquals(EJobState.CANCELLED, state(jobId));
        assertEquals(0, transcription.polls.get());
    }

    @Test
    @DisplayName("A cancellation requested during processing stops the job before anything is written")
    void cancelDuringProcessing() throws IOException {
        final String jobId = service.submit(writeFile("article.txt", ARTICLE), null, null);
        final AtomicBoolean requested = new AtomicBoolean();
        conceptModel.onExtract = text -> {
            if (requested.compareAndSet(false, true)) {
                final JobView view = service.cancel(jobId).orElseThrow();
                assertTrue(view.cancelRequested());
            }
        };

        settle(jobId);

        final JobView job = service.getJob(jobId).orElseThrow();
        assertEquals(EJobState.CANCELLED, job.state());
        assertTrue(requested.get());
        assertTrue(service.listChunks(jobId).isEmpty());
        assertEquals(0, vectorStore.countByJobId(jobId));
        assertTrue(graphStore.listTriples(jobId).isEmpty());
    }

    @Test
    @DisplayName("Cancelling a finished job changes nothing")
    void cancelAfterFinishIsNoop() throws IOException {
        final String jobId = service.submit(writeFile("article.txt", ARTICLE), null, null);
        settle(jobId);

        final JobView view = service.cancel(jobId).orElseThrow();

        assertEquals(EJobState.INDEXED, view.state());
        assertFalse(view.cancelRequested());
        assertTrue(service.cancel("unknown-job").isEmpty());
    }

    // ---------- Write failures and re-indexing ----------

    @Test
    @DisplayName("A vector write failure fails the job but keeps the staged chunks for a re-index")
    void vectorFailureThenReindex() throws IOException {
        vectorStore.failing.set(true);
        final String jobId = service.submit(writeFile("article.txt", ARTICLE), null, null);

        settle(jobId);

        JobView job = service.getJob(jobId).orElseThrow();
        assertEquals(EJobState.FAILED, job.state());
        assertEquals("write_vectors_failed", job.reason());
        assertFalse(service.listChunks(jobId).isEmpty());
        assertTrue(documentStore.listChunks(jobId).stream().noneMatch(StoredChunk::indexed));
        assertEquals(0, vectorStore.countByJobId(jobId));
        assertTrue(graphStore.listTriples(jobId).isEmpty());

        vectorStore.failing.set(false);
        final int conceptCalls = conceptModel.calls.get();
        assertEquals(EJobState.WRITING, service.reindex(jobId).state());
        settle(jobId);

        job = service.getJob(jobId).orElseThrow();
        assertEquals(EJobState.INDEXED, job.state());
        assertNull(job.reason());
        assertEquals(1, job.reindexCount());
        assertEquals(job.chunkCount(), vectorStore.countByJobId(jobId));
        assertFalse(graphStore.listTriples(jobId).isEmpty());
        assertEquals(conceptCalls, conceptModel.calls.get(), "a re-index must not call the model again");
    }

    @Test
    @DisplayName("A graph write failure degrades the job; a re-index repairs it")
    void graphFailureDegradesThenReindex() throws IOException {
        graphStore.failing.set(true);
        final String jobId = service.submit(writeFile("article.txt", ARTICLE), null, null);

        settle(jobId);

        JobView job = service.getJob(jobId).orElseThrow();
        assertEquals(EJobState.INDEXED_DEGRADED, job.state());
        assertEquals("write_graph_failed", job.reason());
        assertEquals(job.chunkCount(), vectorStore.countByJobId(jobId));
        assertTrue(documentStore.listChunks(jobId).stream().allMatch(StoredChunk::indexed));

        graphStore.failing.set(false);
        service.reindex(jobId);
        settle(jobId);

        job = service.getJob(jobId).orElseThrow();
        assertEquals(EJobState.INDEXED, job.state());
        assertFalse(graphStore.listTriples(jobId).isEmpty());
        assertEquals(job.chunkCount(), vectorStore.countByJobId(jobId), "replay must not duplicate vectors");
    }

    @Test
    @DisplayName("Re-index refuses unknown, running, cancelled and early-failed jobs")
    void reindexGuards() throws IOException {
        assertThrows(IllegalArgumentException.class, () -> service.reindex("unknown-job"));

        final String file = writeFile("article.txt", ARTICLE);
        final String running = service.submit(file, null, null);
        assertThrows(IllegalStateException.class, () -> service.reindex(running));
        service.cancel(running);
        assertThrows(IllegalStateException.class, () -> service.reindex(running));

        final String empty = service.submit(writeFile("blank.txt", " "), null, null);
        settle(empty);
        assertThrows(IllegalStateException.class, () -> service.reindex(empty));
    }

    @Test
    @DisplayName("Re-index is refused while another job for the same source is running")
    void reindexRefusedWhileSourceBusy() throws IOException {
        final String file = writeFile("article.txt", ARTICLE);
        final String finished = service.submit(file, null, null);
        settle(finished);

        final String running = service.submit(file, null, null);
        assertNotEquals(finished, running);

        assertThrows(IllegalStateException.class, () -> service.reindex(finished));
        assertEquals(EJobState.INDEXED, state(finished));
    }

    // ---------- Redelivery ----------

    @Test
    @DisplayName("A write running past the visibility timeout keeps its task and is not delivered twice")
    void longWriteKeepsItsClaim() throws IOException {
        final List<Integer> redelivered = new CopyOnWriteArrayList<>();
        vectorStore.onUpsert = () -> {
            vectorStore.onUpsert = () -> { };
            clock.advance(Duration.ofMinutes(31));
            dispatcher.renewClaims();
            taskQueue.claimDue(10).forEach(task -> redelivered.add(task.attempt()));
        };
        final String jobId = service.submit(writeFile("article.txt", ARTICLE), null, null);

        settle(jobId);

        assertEquals(List.of(), redelivered);
        final JobView job = service.getJob(jobId).orElseThrow();
        assertEquals(EJobState.INDEXED, job.state());
        assertEquals(1, job.attemptCount());
        assertEquals(job.chunkCount(), vectorStore.countByJobId(jobId));
        assertEquals(0, taskRepository.countByStatus(ETaskStatus.CLAIMED));
    }

    @Test
    @DisplayName("A process task redelivered after its worker died resumes the write from staged chunks")
    void deadWriterIsResumed() throws IOException {
        vectorStore.onUpsert = () -> {
            vectorStore.onUpsert = () -> { };
            throw new WorkerDied();
        };
        final String jobId = service.submit(writeFile("article.txt", ARTICLE), null, null);

        assertThrows(WorkerDied.class, () -> dispatcher.runDueTasks());
        assertEquals(EJobState.WRITING, state(jobId));
        assertEquals(1, taskRepository.countByStatus(ETaskStatus.CLAIMED));
        final int conceptCalls = conceptModel.calls.get();

        clock.advance(Duration.ofMinutes(31));
        settle(jobId);

        final JobView job = service.getJob(jobId).orElseThrow();
        assertEquals(EJobState.INDEXED, job.state());
        assertEquals(1, job.attemptCount());
        assertEquals(job.chunkCount(), vectorStore.countByJobId(jobId));
        assertEquals(conceptCalls, conceptModel.calls.get(), "a resumed write must not recompute");
    }

    // ---------- Purge ----------

    @Test
    @DisplayName("Purging a finished job removes its artifacts everywhere and blocks re-indexing")
    void purgeRemovesArtifacts() throws IOException {
        final String jobId = service.submit(writeFile("article.txt", ARTICLE), null, null);
        settle(jobId);
        assertTrue(vectorStore.countByJobId(jobId) > 0);

        final JobView purged = service.purgeArtifacts(jobId);

        assertTrue(purged.artifactsPurged());
        assertEquals(EJobState.INDEXED, purged.state());
        assertEquals(0, vectorStore.countByJobId(jobId));
        assertTrue(graphStore.listTriples(jobId).isEmpty());
        assertTrue(service.listChunks(jobId).isEmpty());
        assertThrows(IllegalStateException.class, () -> service.reindex(jobId));
    }

    @Test
    @DisplayName("Purging a running job is refused")
    void purgeRunningRefused() throws IOException {
        final String jobId = service.submit(writeFile("article.txt", ARTICLE), null, null);

        assertThrows(IllegalStateException.class, () -> service.purgeArtifacts(jobId));
        assertThrows(IllegalArgumentException.class, () -> service.purgeArtifacts("unknown-job"));
    }

    // ---------- Abandoned work ----------

    @Test
    @DisplayName("A job whose last task was abandoned fails with internal_error")
    void abandonedJobFails() throws IOException {
        final String jobId = service.submit(writeFile("article.txt", ARTICLE), null, null);

        coordinator.abandon(jobId);

        final JobView job = service.getJob(jobId).orElseThrow();
        assertEquals(EJobState.FAILED, job.state());
        assertEquals("internal_error", job.reason());
    }

    // ---------- Helpers ----------

    private String writeFile(final String name, final String content) throws IOException {
        final Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file.toAbsolutePath().toString();
    }

    private EJobState state(final String jobId) {
        return service.getJob(jobId).orElseThrow().state();
    }

    /**
     * Runs due tasks and moves the clock forward one second at a time until the job is finished.
     */
    private void settle(final String jobId) {
        for (int step = 0; step < 120; step++) {
            dispatcher.runDueTasks();
            if (state(jobId).isTerminal()) {
                return;
            }
            clock.advance(Duration.ofSeconds(1));
        }
        fail("Job " + jobId + " did not finish, last state " + state(jobId));
    }

    static final class FakeTranscriptionClient implements TranscriptionClient {

        private final List<String> submitted = new CopyOnWriteArrayList<>();
        private final AtomicInteger polls = new AtomicInteger();
        private volatile int pendingPolls;
        private volatile String text;
        private volatile String failure;

        void reset() {
            submitted.clear();
            polls.set(0);
            pendingPolls = 0;
            text = "";
            failure = null;
        }

        @Override
        public String submitJob(final String sourceRef) {
            submitted.add(sourceRef);
            return "ext-" + submitted.size();
        }

        @Override
        public TranscriptionStatus poll(final String externalJobId) {
            if (polls.incrementAndGet() <= pendingPolls) {
                return TranscriptionStatus.pending();
            }
            if (failure != null) {
                return TranscriptionStatus.failed(failure);
            }
            return TranscriptionStatus.ready(text);
        }
    }

    static final class FakeConceptModelClient implements ConceptModelClient {

        private final AtomicInteger calls = new AtomicInteger();
        private volatile Consumer<String> onExtract = text -> { };

        void reset() {
            calls.set(0);
            onExtract = text -> { };
        }

        @Override
        public ConceptModelResult extract(final String text) {
            calls.incrementAndGet();
            onExtract.accept(text);
            return new ConceptModelResult(
                    List.of("Lucene", "Vector index"),
                    List.of(new ConceptModelResult.Relationship("Vector index", "used_in", "Lucene", 0.95)));
        }
    }

    static final class SwitchableVectorStore implements VectorStore {

        private final VectorStore delegate;
        private final AtomicBoolean failing = new AtomicBoolean();
        private volatile Runnable onUpsert = () -> { };

        SwitchableVectorStore(final VectorStore delegate) {
            this.delegate = delegate;
        }

        private void check() {
            if (failing.get()) {
                throw new StoreException("vector index offline", null);
            }
        }

        @Override
        public void upsert(final String chunkId, final float[] vector, final Map<String, String> metadata) {
            check();
            delegate.upsert(chunkId, vector, metadata);
        }

        @Override
        public void upsertAll(final List<VectorRecord> records) {
            check();
            onUpsert.run();
            delegate.upsertAll(records);
        }

        @Override
        public List<VectorHit> query(final float[] vector, final int topK, final Map<String, String> filters) {
            return delegate.query(vector, topK, filters);
        }

        @Override
        public void deleteByJobId(final String jobId) {
            delegate.deleteByJobId(jobId);
        }

        @Override
        public int countByJobId(final String jobId) {
            return delegate.countByJobId(jobId);
        }
    }

    static final class SwitchableGraphStore implements GraphStore {

        private final GraphStore delegate;
        private final AtomicBoolean failing = new AtomicBoolean();
        private final List<String> writes = new CopyOnWriteArrayList<>();

        SwitchableGraphStore(final GraphStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public void putTriples(final String jobId, final List<Triple> triples) {
            writes.add(jobId);
            if (failing.get()) {
                throw new StoreException("graph index offline", null);
            }
            delegate.putTriples(jobId, triples);
        }

        @Override
        public List<Triple> listTriples(final String jobId) {
            return delegate.listTriples(jobId);
        }

        @Override
        public void deleteByJobId(final String jobId) {
            delegate.deleteByJobId(jobId);
        }
    }

    /**
     * Escapes the dispatcher like a killed thread would, leaving the task claimed.
     */
    static final class WorkerDied extends Error {
    }
}
