package io.repo.vectors.query;

import io.repo.vectors.ChunkType;
import io.repo.vectors.CodeChunk;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResultFormatterTest {

    private static final CodeChunk METHOD = CodeChunk.of(
        "public User find(String id) {\n    return users.get(id);\n}\n",
        "src/UserRegistry.java", 12, 14, ChunkType.FUNCTION, "java",
        Map.of(CodeChunk.META_NAME, "find", CodeChunk.META_PARENT, "UserRegistry"));

    private static final CodeChunk MODULE = CodeChunk.of(
        "import os", "setup.py", 1, 1, ChunkType.MODULE, "python", Map.of());

    @Test
    void testNoResults() {
        assertEquals(ResultFormatter.NO_RESULTS, ResultFormatter.format(List.of()));
    }

    @Test
    void testBlocksSeparatedByBlankLine() {
        String text = ResultFormatter.format(List.of(
            new RankedResult(1, METHOD, 0.9f),
            new RankedResult(2, MODULE, 0.4f)));

        assertEquals("""
            Document 1: (Type: function) (Symbol: UserRegistry.find) (Path: src/UserRegistry.java:12-14)
            public User find(String id) {
                return users.get(id);
            }

            Document 2: (Type: module) (Path: setup.py:1-1)
            import os""", text);
    }

    @Test
    void testHeaderIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertTrue(ResultFormatter.header(new RankedResult(1, METHOD, 0.9f)).contains("(Type: function)"));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void testHeaderWithoutSymbol() {
        assertEquals("Document 3: (Type: module) (Path: setup.py:1-1)",
            ResultFormatter.header(new RankedResult(3, MODULE, 0.1f)));
    }
}
