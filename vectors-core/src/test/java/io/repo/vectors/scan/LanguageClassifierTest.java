package io.repo.vectors.scan;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LanguageClassifierTest {

    @Test
    void testKnownExtensions() {
        assertEquals("python", LanguageClassifier.classify("src/app.py"));
        assertEquals("java", LanguageClassifier.classify("src/main/java/App.java"));
        assertEquals("markdown", LanguageClassifier.classify("docs/README.md"));
        assertEquals("yaml", LanguageClassifier.classify("config.yml"));
    }

    @Test
    void testCaseAndSeparators() {
        assertEquals("python", LanguageClassifier.classify("SRC\\TOOLS\\Build.PY"));
        assertEquals("dockerfile", LanguageClassifier.classify("deploy/Dockerfile"));
    }

    @Test
    void testFallbackToText() {
        assertEquals(LanguageClassifier.UNKNOWN, LanguageClassifier.classify("LICENSE"));
        assertEquals(LanguageClassifier.UNKNOWN, LanguageClassifier.classify("archive.xyz"));
        assertEquals(LanguageClassifier.UNKNOWN, LanguageClassifier.classify("trailing."));
        assertEquals(LanguageClassifier.UNKNOWN, LanguageClassifier.classify(""));
        assertEquals(LanguageClassifier.UNKNOWN, LanguageClassifier.classify(null));
    }

    @Test
    void testExtension() {
        assertEquals("py", LanguageClassifier.extension("a/b/c.Py"));
        assertEquals("", LanguageClassifier.extension("Makefile"));
        assertEquals("gz", LanguageClassifier.extension("dist.tar.gz"));
    }
}
