package com.govchat.policyscanner.processing;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class TextChunkerTest {

    @Test
    void chunk_ShortText_IsSingleChunk() {
        TextChunker chunker = new TextChunker(100, 10);

        assertEquals(List.of("Korte tekst."), chunker.chunk("Korte tekst."));
    }

    @Test
    void chunk_SentenceText_CutsAtSentenceEnds() {
        // Given
        String text = IntStream.rangeClosed(1, 40)
                .mapToObj(i -> "Zin nummer " + i + ". ")
                .reduce("", String::concat);
        TextChunker chunker = new TextChunker(100, 20);

        // When
        List<String> chunks = chunker.chunk(text);

        // Then
        assertTrue(chunks.size() > 1);
        for (String chunk : chunks) {
            assertFalse(chunk.isEmpty());
            assertTrue(chunk.length() <= 100, "chunk too long: " + chunk.length());
            assertTrue(chunk.endsWith("."), "chunk not cut at a sentence end: " + chunk);
        }
        for (int i = 1; i <= 40; i++) {
            String sentence = "Zin nummer " + i + ".";
            assertTrue(chunks.stream().anyMatch(c -> c.contains(sentence)), "lost: " + sentence);
        }
    }

    @Test
    void chunk_PrefersParagraphBreak() {
        // Given
        String text = "A".repeat(60) + "\n\n" + "B".repeat(60) + ". " + "C".repeat(100);
        TextChunker chunker = new TextChunker(100, 0);

        // When
        List<String> chunks = chunker.chunk(text);

        // Then
        assertEquals(List.of("A".repeat(60), "B".repeat(60) + ".", "C".repeat(100)), chunks);
    }

    @Test
    void chunk_NoBreaks_CutsAtWindowEdgeWithOverlap() {
        // Given
        String text = "x".repeat(250);
        TextChunker chunker = new TextChunker(100, 10);

        // When
        List<String> chunks = chunker.chunk(text);

        // Then
        assertEquals(3, chunks.size());
        assertEquals(100, chunks.get(0).length());
        assertEquals(100, chunks.get(1).length());
        assertEquals(70, chunks.get(2).length());
    }

    @Test
    void chunks_CanBeIteratedTwice() {
        // Given
        TextChunker chunker = new TextChunker(50, 5);
        Iterable<String> chunks = chunker.chunks("woord ".repeat(40));

        // When
        List<String> first = new ArrayList<>();
        chunks.forEach(first::add);
        List<String> second = new ArrayList<>();
        chunks.forEach(second::add);

        // Then
        assertFalse(first.isEmpty());
        assertEquals(first, second);
    }

    @Test
    void constructor_RejectsInvalidSizes() {
        assertThrows(IllegalArgumentException.class, () -> new TextChunker(1, 0));
        assertThrows(IllegalArgumentException.class, () -> new TextChunker(100, 51));
        assertThrows(IllegalArgumentException.class, () -> new TextChunker(100, -1));
        assertDoesNotThrow(() -> new TextChunker(100, 50));
    }
}
