package eu.virtualparadox.knowledge.ingest.source;

import eu.virtualparadox.knowledge.ingest.error.EFailureReason;
import eu.virtualparadox.knowledge.ingest.error.PermanentIngestionException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Picks the {@link ContentSource} for a reference. Sources are asked in {@code @Order} order.
 */
@Service
@RequiredArgsConstructor
public class ContentSourceResolver {

    private final List<ContentSource> sources;

    /**
     * @throws PermanentIngestionException with {@code unsupported_source} if no source accepts the reference
     */
    public ContentSource resolve(final String sourceRef) {
        if (sourceRef == null || sourceRef.isBlank()) {
            throw new PermanentIngestionException(EFailureReason.UNSUPPORTED_SOURCE, "Source reference is blank");
        }
        final String ref = sourceRef.strip();
        for (final ContentSource source : sources) {
            if (source.supports(ref)) {
                return source;
            }
        }
        throw new PermanentIngestionException(EFailureReason.UNSUPPORTED_SOURCE, "No source can handle " + ref);
    }
}
