package eu.virtualparadox.knowledge.ingest.source;

import eu.virtualparadox.knowledge.ingest.error.EFailureReason;
import eu.virtualparadox.knowledge.ingest.error.PermanentIngestionException;
import eu.virtualparadox.knowledge.ingest.error.TransientIngestionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.jsoup.Jsoup;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Local files given as {@code file:} URIs or absolute paths.
 * <p>
 * PDFs are read page by page with Apache PDFBox and every page starts a section. HTML files go
 * through the same extraction as web pages. Anything else is read as UTF-8 text; in Markdown,
 * heading lines start sections.
 * </p>
 */
@Slf4j
@Component
@Order(20)
public class FileContentSource implements ContentSource {

    private static final String FILE_SCHEME = "file:";

    @Override
    public String name() {
        return "file";
    }

    @Override
    public boolean supports(final String sourceRef) {
        if (sourceRef.regionMatches(true, 0, FILE_SCHEME, 0, FILE_SCHEME.length())) {
            return true;
        }
        try {
            return Path.of(sourceRef).isAbsolute();
        } catch (final InvalidPathException e) {
            return false;
        }
    }

    @Override
    public SourceContent fetch(final String sourceRef) {
        final Path path = toPath(sourceRef);
        if (!Files.isRegularFile(path)) {
            throw new PermanentIngestionException(EFailureReason.SOURCE_UNAVAILABLE, "File not found: " + path);
        }

        final String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        log.info("Reading {}", path);
        if (fileName.endsWith(".pdf")) {
            return readPdf(path);
        }
        if (fileName.endsWith(".html") || fileName.endsWith(".htm")) {
            return readHtml(path);
        }
        final String text = readUtf8(path);
        if (fileName.endsWith(".md") || fileName.endsWith(".markdown")) {
            return new SourceContent(text, markdownSections(text));
        }
        return SourceContent.plain(text);
    }

    private Path toPath(final String sourceRef) {
        try {
            if (sourceRef.regionMatches(true, 0, FILE_SCHEME, 0, FILE_SCHEME.length())) {
                return Path.of(URI.create(sourceRef));
            }
            return Path.of(sourceRef);
        } catch (final IllegalArgumentException e) {
            throw new PermanentIngestionException(EFailureReason.UNSUPPORTED_SOURCE, "Not a valid file reference: " + sourceRef, e);
        }
    }

    /**
     * One section per page; page text is NFC-normalized like every other source.
     */
    private SourceContent readPdf(final Path path) {
        try (PDDocument pdf = PDDocument.load(path.toFile())) {
            final int pageCount = pdf.getNumberOfPages();
            final PDFTextStripper stripper = new PDFTextStripper();

            final StringBuilder text = new StringBuilder(100_000);
            final List<Integer> pageStarts = new ArrayList<>(pageCount);
            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                pageStarts.add(text.length());
                text.append(Normalizer.normalize(stripper.getText(pdf), Normalizer.Form.NFC));
            }
            return new SourceContent(text.toString(), pageStarts);
        } catch (final IOException e) {
            throw new PermanentIngestionException(EFailureReason.SOURCE_UNAVAILABLE, "Unreadable PDF " + path + ": " + e.getMessage(), e);
        }
    }

    private SourceContent readHtml(final Path path) {
        try {
            return HtmlText.extract(Jsoup.parse(path.toFile(), StandardCharsets.UTF_8.name()));
        } catch (final IOException e) {
            throw new TransientIngestionException(EFailureReason.SOURCE_UNAVAILABLE, "Failed to read " + path, e);
        }
    }

    private String readUtf8(final Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (final CharacterCodingException e) {
            throw new PermanentIngestionException(EFailureReason.SOURCE_UNAVAILABLE, "File is not UTF-8 text: " + path, e);
        } catch (final IOException e) {
            throw new TransientIngestionException(EFailureReason.SOURCE_UNAVAILABLE, "Failed to read " + path, e);
        }
    }

    static List<Integer> markdownSections(final String text) {
        final List<Integer> starts = new ArrayList<>();
        int lineStart = 0;
        while (lineStart < text.length()) {
            if (text.charAt(lineStart) == '#') {
                starts.add(lineStart);
            }
            final int newline = text.indexOf('\n', lineStart);
            if (newline < 0) {
                break;
            }
            lineStart = newline + 1;
        }
        return starts;
    }
}
