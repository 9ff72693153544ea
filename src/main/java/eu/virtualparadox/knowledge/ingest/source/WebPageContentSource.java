package eu.virtualparadox.knowledge.ingest.source;

import eu.virtualparadox.knowledge.ingest.error.EFailureReason;
import eu.virtualparadox.knowledge.ingest.error.PermanentIngestionException;
import eu.virtualparadox.knowledge.ingest.error.TransientIngestionException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.UnsupportedMimeTypeException;
import org.jsoup.nodes.Document;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.regex.Pattern;

/**
 * Web articles fetched and parsed with jsoup.
 * <p>
 * Video and social platforms are not articles: they are either transcribed or unsupported.
 * </p>
 */
@Slf4j
@Component
@Order(30)
public class WebPageContentSource implements ContentSource {

    private static final Pattern WEB_ARTICLE = Pattern.compile(
            "https?://(?!(?:www\\.)?(?:youtube\\.com|youtu\\.be|twitter\\.com|x\\.com|tiktok\\.com))[\\w.-]+.*",
            Pattern.CASE_INSENSITIVE);

    private final int timeoutMs;
    private final String userAgent;

    public WebPageContentSource(@Value("${knowledge.ingestion.web.timeout-ms:30000}") final int timeoutMs,
                                @Value("${knowledge.ingestion.web.user-agent:knowledge-index/0.1}") final String userAgent) {
        this.timeoutMs = timeoutMs;
        this.userAgent = userAgent;
    }

    @Override
    public String name() {
        return "web";
    }

    @Override
    public boolean supports(final String sourceRef) {
        return WEB_ARTICLE.matcher(sourceRef).matches();
    }

    @Override
    public SourceContent fetch(final String sourceRef) {
        log.info("Fetching {}", sourceRef);
        final Document document;
        try {
            document = Jsoup.connect(sourceRef)
                    .userAgent(userAgent)
                    .timeout(timeoutMs)
                    .followRedirects(true)
                    .get();
        } catch (final HttpStatusException e) {
            throw classify(e.getStatusCode(), sourceRef, e);
        } catch (final UnsupportedMimeTypeException e) {
            throw new PermanentIngestionException(EFailureReason.UNSUPPORTED_SOURCE,
                    "Unsupported content type " + e.getMimeType() + " at " + sourceRef, e);
        } catch (final IllegalArgumentException e) {
            throw new PermanentIngestionException(EFailureReason.UNSUPPORTED_SOURCE, "Malformed URL " + sourceRef, e);
        } catch (final IOException e) {
            throw new TransientIngestionException(EFailureReason.SOURCE_UNAVAILABLE,
                    "Failed to fetch " + sourceRef + ": " + e.getMessage(), e);
        }
        return HtmlText.extract(document);
    }

    /**
     * 429 and 5xx are worth retrying, any other status means the page is not there for us.
     */
    static RuntimeException classify(final int status, final String sourceRef, final Exception cause) {
        final String message = "Fetching " + sourceRef + " returned HTTP " + status;
        if (status == 429 || status >= 500) {
            return new TransientIngestionException(EFailureReason.SOURCE_UNAVAILABLE, message, cause);
        }
        return new PermanentIngestionException(EFailureReason.SOURCE_UNAVAILABLE, message, cause);
    }
}
