package eu.virtualparadox.knowledge.ingest.chunker;

/**
 * Smallest piece the chunker packs: one sentence, including the whitespace that follows it.
 * Consecutive units tile the text without gaps.
 *
 * @param start           inclusive start offset
 * @param end             exclusive end offset (start of the next unit)
 * @param tokenCount      tokens inside the unit
 * @param startsParagraph whether a paragraph or section boundary lies directly before the unit
 */
record TextUnit(int start, int end, int tokenCount, boolean startsParagraph) {
}
