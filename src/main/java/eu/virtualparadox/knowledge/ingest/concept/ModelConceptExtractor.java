package eu.virtualparadox.knowledge.ingest.concept;

import eu.virtualparadox.knowledge.ingest.error.EFailureReason;
import eu.virtualparadox.knowledge.ingest.error.PermanentIngestionException;
import eu.virtualparadox.knowledge.ingest.model.Chunk;
import eu.virtualparadox.knowledge.ingest.model.Concept;
import eu.virtualparadox.knowledge.ingest.model.RelationTriple;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Concept extractor backed by a {@link ConceptModelClient}.
 * <p>
 * Chunks are sent to the model concurrently on the given executor and the results are
 * reassembled in chunk order. Per chunk the answer is trimmed to {@link ConceptLimits}:
 * relations need the minimum confidence, their predicates are normalized through
 * {@link ERelationType}, and their endpoints always become entity concepts of the same chunk.
 * </p>
 */
@Slf4j
public class ModelConceptExtractor implements ConceptExtractor {

    private static final int MAX_LABEL_LENGTH = 200;

    private final ConceptModelClient client;
    private final Executor executor;
    private final ConceptLimits limits;

    public ModelConceptExtractor(final ConceptModelClient client,
                                 final Executor executor,
                                 final ConceptLimits limits) {
        this.client = client;
        this.executor = executor;
        this.limits = limits;
    }

    @Override
    public List<Concept> process(final List<Chunk> chunks) {
        final List<CompletableFuture<List<Concept>>> futures = new ArrayList<>(chunks.size());
        for (final Chunk chunk : chunks) {
            futures.add(CompletableFuture.supplyAsync(() -> extract(chunk), executor));
        }

        final List<Concept> result = new ArrayList<>();
        RuntimeException failure = null;
        for (final CompletableFuture<List<Concept>> future : futures) {
            try {
                result.addAll(future.join());
            } catch (final CompletionException e) {
                if (failure == null) {
                    failure = unwrap(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }

        log.debug("Extracted {} concepts from {} chunks", result.size(), chunks.size());
        return result;
    }

    @Override
    public List<Concept> extract(final Chunk chunk) {
        final ConceptModelResult answer = client.extract(chunk.text());

        // relations first: their endpoints are mandatory entities
        final Map<String, String> endpoints = new LinkedHashMap<>();
        final List<RelationTriple> triples = new ArrayList<>();
        for (final ConceptModelResult.Relationship rel : answer.relationships()) {
            if (triples.size() >= limits.maxRelations()) {
                break;
            }
            final String subject = cleanLabel(rel.sourceConcept());
            final String object = cleanLabel(rel.targetConcept());
            if (subject.isEmpty() || object.isEmpty() || key(subject).equals(key(object))) {
                continue;
            }
            if (rel.confidenceOrDefault() < limits.minConfidence()) {
                continue;
            }
            endpoints.putIfAbsent(key(subject), subject);
            endpoints.putIfAbsent(key(object), object);
            triples.add(new RelationTriple(
                    endpoints.get(key(subject)),
                    ERelationType.fromPredicate(rel.relationType()).predicate(),
                    endpoints.get(key(object))));
        }

        final Map<String, String> entities = selectEntities(answer.concepts(), endpoints);

        final List<Concept> concepts = new ArrayList<>(entities.size() + triples.size());
        int ordinal = 0;
        for (final String label : entities.values()) {
            concepts.add(Concept.entity(chunk.id(), ordinal++, label));
        }
        for (final RelationTriple triple : triples) {
            concepts.add(Concept.relation(chunk.id(), ordinal++, new RelationTriple(
                    entities.get(key(triple.subject())),
                    triple.predicate(),
                    entities.get(key(triple.object())))));
        }
        return concepts;
    }

    /**
     * Model concepts in ranked order, capped so that all relation endpoints still fit.
     * Keys are case-insensitive; the first spelling wins.
     */
    private Map<String, String> selectEntities(final List<String> proposed, final Map<String, String> endpoints) {
        final Map<String, String> ordered = new LinkedHashMap<>();
        for (final String raw : proposed) {
            final String label = cleanLabel(raw);
            if (!label.isEmpty()) {
                ordered.putIfAbsent(key(label), label);
            }
        }
        endpoints.forEach(ordered::putIfAbsent);

        int freeSlots = Math.max(0, limits.maxEntities() - endpoints.size());
        final Map<String, String> selected = new LinkedHashMap<>();
        for (final Map.Entry<String, String> entry : ordered.entrySet()) {
            if (endpoints.containsKey(entry.getKey())) {
                selected.put(entry.getKey(), entry.getValue());
            } else if (freeSlots > 0) {
                selected.put(entry.getKey(), entry.getValue());
                freeSlots--;
            }
        }
        return selected;
    }

    private static String cleanLabel(final String raw) {
        if (raw == null) {
            return "";
        }
        final String label = raw.strip().replaceAll("\\s+", " ");
        return label.length() <= MAX_LABEL_LENGTH ? label : label.substring(0, MAX_LABEL_LENGTH);
    }

    private static String key(final String label) {
        return label.toLowerCase(Locale.ROOT);
    }

    private static RuntimeException unwrap(final CompletionException e) {
        final Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new PermanentIngestionException(EFailureReason.PROCESSING_FAILED,
                "Concept extraction failed: " + cause, cause);
    }
}
