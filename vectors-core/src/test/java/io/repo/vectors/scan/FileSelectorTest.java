package io.repo.vectors.scan;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileSelectorTest {

    @TempDir
    Path root;

    @BeforeEach
    void setUp() throws IOException {
        write("src/main.py", "print('hello')\n");
        write("src/util/strings.py", "def shout(s):\n    return s.upper()\n");
        write("README.md", "# Project\n");
        write("node_modules/lib/index.js", "module.exports = {};\n");
        write("target/classes/App.class", "compiled");
        Files.createDirectories(root.resolve(".git"));
        write(".git/HEAD", "ref: refs/heads/main\n");
    }

    private void write(String relativePath, String content) throws IOException {
        Path path = root.resolve(relativePath);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content);
    }

    private List<SourceFile> select(SelectorConfig config, SkipListener listener) throws IOException {
        try (Stream<SourceFile> files = new FileSelector(config).select(root, listener)) {
            return files.toList();
        }
    }

    @Test
    void testSelectsInLexicalOrderAndSkipsExcluded() throws IOException {
        List<SourceFile> files = select(SelectorConfig.defaults(), SkipListener.NONE);

        assertEquals(List.of("README.md", "src/main.py", "src/util/strings.py"),
            files.stream().map(SourceFile::relativePath).toList());
        assertEquals("python", files.get(1).language());
        assertEquals("print('hello')\n", files.get(1).content());
    }

    @Test
    void testBinaryFileSkippedWithWarning() throws IOException {
        Files.write(root.resolve("logo.png"), new byte[]{(byte) 0x89, 'P', 'N', 'G', 0, 0, 0, 13});
        Files.write(root.resolve("latin1.txt"), new byte[]{'c', 'a', 'f', (byte) 0xE9});
        List<String> skipped = new ArrayList<>();

        List<SourceFile> files = select(SelectorConfig.defaults(), (path, reason) -> skipped.add(path));

        assertEquals(List.of("latin1.txt", "logo.png"), skipped);
        assertTrue(files.stream().noneMatch(f -> f.relativePath().equals("logo.png")));
    }

    @Test
    void testSizeLimit() throws IOException {
        write("big.py", "x = 1\n".repeat(100));

        List<SourceFile> files = select(SelectorConfig.defaults().withMaxFileSizeBytes(100), SkipListener.NONE);

        assertTrue(files.stream().noneMatch(f -> f.relativePath().equals("big.py")));
        assertTrue(files.stream().anyMatch(f -> f.relativePath().equals("src/main.py")));
    }

    @Test
    void testIncludeExtensions() throws IOException {
        List<SourceFile> files = select(SelectorConfig.defaults().withIncludeExtensions(Set.of(".PY")),
            SkipListener.NONE);

        assertEquals(2, files.size());
        assertTrue(files.stream().allMatch(f -> f.relativePath().endsWith(".py")));
    }

    @Test
    void testCustomExclusions() throws IOException {
        List<SourceFile> files = select(SelectorConfig.defaults().withExcludeNameFragments(Set.of("util/")),
            SkipListener.NONE);

        assertTrue(files.stream().anyMatch(f -> f.relativePath().equals("node_modules/lib/index.js")));
        assertTrue(files.stream().noneMatch(f -> f.relativePath().startsWith("src/util/")));
    }

    @Test
    void testIsExcludedIgnoresCase() {
        FileSelector selector = new FileSelector();

        assertTrue(selector.isExcluded("Build/output.txt"));
        assertFalse(selector.isExcluded("src/builder.py"));
    }

    @Test
    void testMissingRootFails() {
        assertThrows(IOException.class, () -> new FileSelector().select(root.resolve("missing")));
    }
}
