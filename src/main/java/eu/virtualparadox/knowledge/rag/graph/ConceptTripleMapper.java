package eu.virtualparadox.knowledge.rag.graph;

import eu.virtualparadox.knowledge.catalog.service.StoredChunk;
import eu.virtualparadox.knowledge.ingest.model.Chunk;
import eu.virtualparadox.knowledge.ingest.model.Concept;
import eu.virtualparadox.knowledge.ingest.model.EConceptKind;
import eu.virtualparadox.knowledge.ingest.model.RelationTriple;
import eu.virtualparadox.knowledge.rag.index.VectorRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static eu.virtualparadox.knowledge.rag.graph.GraphVocabulary.*;

/**
 * Renders a job's chunks and concepts as graph triples.
 * <p>
 * The source node comes first, then every chunk with the concepts found in it. A chunk node
 * carries its position and vector id and points to the source it was derived from. Each entity
 * yields its type, its label and the chunk it was found in. Each relation yields one triple
 * between the two entity nodes. Duplicates collapse, first occurrence wins the position.
 * </p>
 */
@Component
public class ConceptTripleMapper {

    public List<Triple> toTriples(final GraphSource source, final List<StoredChunk> chunks) {
        final String jobId = source.jobId();
        final String sourceNode = sourceNode(jobId);

        final Set<Triple> triples = new LinkedHashSet<>();
        triples.add(new Triple(sourceNode, RDF_TYPE, KN_SOURCE));
        triples.add(new Triple(sourceNode, KN_SOURCE_URL, source.sourceRef()));
        triples.add(new Triple(sourceNode, KN_SOURCE_TYPE, source.sourceType()));
        triples.add(new Triple(sourceNode, KN_JOB_ID, jobId));

        for (final StoredChunk stored : chunks) {
            final Chunk chunk = stored.chunk();
            final String node = chunkNode(chunk.id());
            triples.add(new Triple(node, RDF_TYPE, KN_CHUNK));
            triples.add(new Triple(node, KN_CHUNK_INDEX, Integer.toString(chunk.sequenceIndex())));
            if (stored.embedding() != null) {
                triples.add(new Triple(node, KN_VECTOR_ID,
                        VectorRecord.vectorId(chunk.id(), stored.embedding().modelVersion())));
            }
            triples.add(new Triple(node, KN_DERIVED_FROM, sourceNode));

            for (final Concept concept : stored.concepts()) {
                addConcept(triples, jobId, concept);
            }
        }
        return new ArrayList<>(triples);
    }

    private static void addConcept(final Set<Triple> triples, final String jobId, final Concept concept) {
        if (concept.kind() == EConceptKind.ENTITY) {
            final String node = conceptNode(jobId, concept.label());
            triples.add(new Triple(node, RDF_TYPE, KN_CONCEPT));
            triples.add(new Triple(node, RDFS_LABEL, concept.label()));
            triples.add(new Triple(node, KN_MENTIONED_IN, chunkNode(concept.chunkId())));
        } else if (concept.triple() != null) {
            final RelationTriple relation = concept.triple();
            triples.add(new Triple(
                    conceptNode(jobId, relation.subject()),
                    predicate(relation.predicate()),
                    conceptNode(jobId, relation.object())));
        }
    }
}
