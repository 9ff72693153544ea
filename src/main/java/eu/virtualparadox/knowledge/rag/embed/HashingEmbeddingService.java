package eu.virtualparadox.knowledge.rag.embed;

import eu.virtualparadox.knowledge.application.config.IngestionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CPU-only deterministic embedding based on feature hashing.
 * <p>
 * Every lower-cased word is hashed with SHA-256; the digest picks a bucket and a sign, and the
 * bucket counts are L2-normalized. Texts sharing vocabulary end up close to each other, which is
 * enough for development and tests without any model files.
 * </p>
 */
@Service
@Slf4j
public class HashingEmbeddingService implements EmbeddingService {

    public static final String VERSION_PREFIX = "hashing-";

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+");

    private final int dimension;

    @Autowired
    public HashingEmbeddingService(final IngestionProperties properties) {
        this(properties.getEmbedding().getHashingDimension());
    }

    public HashingEmbeddingService(final int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
        log.info("Hashing embedding model ready, dimension {}", dimension);
    }

    @Override
    public String modelVersion() {
        return VERSION_PREFIX + dimension;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public List<float[]> embed(final List<String> texts) {
        final MessageDigest digest = sha256();
        final List<float[]> out = new ArrayList<>(texts.size());
        for (final String text : texts) {
            out.add(embedOne(text, digest));
        }
        return out;
    }

    private float[] embedOne(final String text, final MessageDigest digest) {
        final float[] vec = new float[dimension];
        final Matcher matcher = WORD.matcher(text == null ? "" : text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            final byte[] hash = digest.digest(matcher.group().getBytes(StandardCharsets.UTF_8));
            final int bucket = Math.floorMod(
                    ((hash[0] & 0xFF) << 24) | ((hash[1] & 0xFF) << 16) | ((hash[2] & 0xFF) << 8) | (hash[3] & 0xFF),
                    dimension);
            vec[bucket] += (hash[4] & 1) == 0 ? 1f : -1f;
        }
        if (VectorMath.isZero(vec)) {
            // no words, or all of them cancelled out; vector indexes reject zero vectors
            vec[Math.floorMod(text == null ? 0 : text.hashCode(), dimension)] = 1f;
        }
        VectorMath.normalize(vec);
        return vec;
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
