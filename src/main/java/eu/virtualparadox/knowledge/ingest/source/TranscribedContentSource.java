package eu.virtualparadox.knowledge.ingest.source;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Videos and audio files, whose text comes from an external transcription job.
 */
@Component
@Order(10)
public class TranscribedContentSource implements ContentSource {

    private static final List<Pattern> YOUTUBE = List.of(
            Pattern.compile("(?:https?://)?(?:www\\.)?youtube\\.com/watch\\?v=[\\w-]+.*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:https?://)?(?:www\\.)?youtu\\.be/[\\w-]+.*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:https?://)?(?:www\\.)?youtube\\.com/shorts/[\\w-]+.*", Pattern.CASE_INSENSITIVE));

    private static final Pattern VIDEO_ID =
            Pattern.compile("(?:youtube\\.com/watch\\?v=|youtu\\.be/|youtube\\.com/shorts/)([\\w-]+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern MEDIA_FILE =
            Pattern.compile("https?://\\S+\\.(?:mp3|mp4|m4a|wav|webm|ogg|flac|mov)(?:\\?\\S*)?");

    @Override
    public String name() {
        return "transcribed";
    }

    @Override
    public boolean supports(final String sourceRef) {
        for (final Pattern pattern : YOUTUBE) {
            if (pattern.matcher(sourceRef).matches()) {
                return true;
            }
        }
        return MEDIA_FILE.matcher(sourceRef.toLowerCase(Locale.ROOT)).matches();
    }

    @Override
    public boolean requiresTranscription() {
        return true;
    }

    @Override
    public SourceContent fetch(final String sourceRef) {
        throw new IllegalStateException(sourceRef + " has no direct text, it must be transcribed");
    }

    /**
     * YouTube links of any form become the canonical watch URL; other media URLs pass unchanged.
     */
    @Override
    public String transcriptionRef(final String sourceRef) {
        final Matcher matcher = VIDEO_ID.matcher(sourceRef);
        if (matcher.find()) {
            return "https://www.youtube.com/watch?v=" + matcher.group(1);
        }
        return sourceRef;
    }
}
