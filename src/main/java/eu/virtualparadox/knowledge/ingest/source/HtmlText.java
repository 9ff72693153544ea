package eu.virtualparadox.knowledge.ingest.source;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns an HTML page into paragraph text. Every block element becomes one paragraph and every
 * heading starts a new section.
 */
final class HtmlText {

    private static final String BLOCKS = "h1, h2, h3, h4, h5, h6, p, li, pre, blockquote, td, th, dt, dd, figcaption";
    private static final String NOISE = "script, style, noscript, template, nav, header, footer, aside, form";
    private static final String PARAGRAPH_SEPARATOR = "\n\n";

    private HtmlText() {
    }

    static SourceContent extract(final Document document) {
        final Element body = document.body();
        if (body == null) {
            return SourceContent.plain("");
        }
        body.select(NOISE).remove();

        final StringBuilder text = new StringBuilder();
        final List<Integer> sections = new ArrayList<>();
        for (final Element block : body.select(BLOCKS)) {
            // nested blocks are covered by their outermost ancestor
            if (block.parents().is(BLOCKS)) {
                continue;
            }
            final String blockText = block.text().strip();
            if (blockText.isEmpty()) {
                continue;
            }
            if (!text.isEmpty()) {
                text.append(PARAGRAPH_SEPARATOR);
            }
            if (block.normalName().matches("h[1-6]")) {
                sections.add(text.length());
            }
            text.append(blockText);
        }

        if (text.isEmpty()) {
            return SourceContent.plain(body.text());
        }
        return new SourceContent(text.toString(), sections);
    }
}
