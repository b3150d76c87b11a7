package com.govchat.policyscanner.processing;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Splits long text into windows of at most {@code maxChunkSize} characters.
 *
 * A window that does not reach the end of the text is cut at the last
 * paragraph break ({@code \n\n}) in its second half, failing that at the last
 * sentence end ({@code ". "}, {@code "! "}, {@code "? "}), failing that at the
 * window edge. The next window starts {@code overlapSize} characters before
 * the cut. Chunks are trimmed and empty ones are dropped.
 *
 * {@link #chunks(String)} is lazy and can be iterated any number of times.
 */
public class TextChunker {

    private static final String[] SENTENCE_BREAKS = {". ", "! ", "? "};

    private final int maxChunkSize;
    private final int overlapSize;

    public TextChunker(int maxChunkSize, int overlapSize) {
        if (maxChunkSize < 2) {
            throw new IllegalArgumentException("maxChunkSize must be at least 2, got " + maxChunkSize);
        }
        if (overlapSize < 0 || overlapSize > maxChunkSize / 2) {
            throw new IllegalArgumentException(
                    "overlapSize must be between 0 and maxChunkSize/2 (" + maxChunkSize / 2 + "), got " + overlapSize);
        }
        this.maxChunkSize = maxChunkSize;
        this.overlapSize = overlapSize;
    }

    public Iterable<String> chunks(String text) {
        if (text.length() <= maxChunkSize) {
            return List.of(text);
        }
        return () -> new ChunkIterator(text);
    }

    public List<String> chunk(String text) {
        List<String> result = new ArrayList<>();
        chunks(text).forEach(result::add);
        return result;
    }

    public int getMaxChunkSize() {
        return maxChunkSize;
    }

    public int getOverlapSize() {
        return overlapSize;
    }

    private final class ChunkIterator implements Iterator<String> {

        private final String text;
        private int start;
        private String next;

        private ChunkIterator(String text) {
            this.text = text;
            this.next = advance();
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public String next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            String current = next;
            next = advance();
            return current;
        }

        private String advance() {
            int length = text.length();
            while (start < length) {
                int end = start + maxChunkSize;
                if (end < length) {
                    end = findBreak(start, end);
                } else {
                    end = length;
                }

                String chunk = text.substring(start, end).strip();
                start = end < length ? end - overlapSize : end;
                if (!chunk.isEmpty()) {
                    return chunk;
                }
            }
            return null;
        }

        private int findBreak(int windowStart, int windowEnd) {
            int midpoint = windowStart + maxChunkSize / 2;

            int paragraphBreak = text.lastIndexOf("\n\n", windowEnd - 2);
            if (paragraphBreak > midpoint) {
                return paragraphBreak + 2;
            }

            int sentenceBreak = -1;
            for (String marker : SENTENCE_BREAKS) {
                sentenceBreak = Math.max(sentenceBreak, text.lastIndexOf(marker, windowEnd - 2));
            }
            if (sentenceBreak > midpoint) {
                return sentenceBreak + 2;
            }
            return windowEnd;
        }
    }
}
