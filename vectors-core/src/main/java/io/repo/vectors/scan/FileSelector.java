package io.repo.vectors.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Walks a repository and yields the files worth chunking.
 *
 * <p>Paths are filtered up front (exclusions, extension, size) and visited in
 * lexical order of their relative path; contents are read lazily as the
 * stream is consumed. Binary or non-UTF-8 files are reported to the
 * {@link SkipListener} and left out.</p>
 */
public class FileSelector {

    private static final Logger log = LoggerFactory.getLogger(FileSelector.class);

    private final SelectorConfig config;

    public FileSelector() {
        this(SelectorConfig.defaults());
    }

    public FileSelector(SelectorConfig config) {
        this.config = config;
    }

    /**
     * Selects files below {@code root}.
     */
    public Stream<SourceFile> select(Path root) throws IOException {
        return select(root, SkipListener.NONE);
    }

    /**
     * Selects files below {@code root}, reporting unreadable files to {@code listener}.
     *
     * @throws IOException if the root cannot be walked
     */
    public Stream<SourceFile> select(Path root, SkipListener listener) throws IOException {
        Path base = root.toAbsolutePath().normalize();
        List<Path> candidates;

        try (Stream<Path> paths = Files.walk(base)) {
            candidates = paths
                .filter(Files::isRegularFile)
                .filter(p -> !isExcluded(relativize(base, p)))
                .filter(p -> hasIncludedExtension(relativize(base, p)))
                .sorted((a, b) -> relativize(base, a).compareTo(relativize(base, b)))
                .collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        log.debug("Selected {} candidate files under {}", candidates.size(), base);

        return candidates.stream()
            .map(p -> read(base, p, listener))
            .filter(Objects::nonNull);
    }

    /**
     * Checks whether a relative path contains an excluded fragment.
     */
    public boolean isExcluded(String relativePath) {
        String path = relativePath.toLowerCase(Locale.ROOT);
        return config.excludeNameFragments().stream().anyMatch(path::contains);
    }

    private boolean hasIncludedExtension(String relativePath) {
        return config.includeExtensions().isEmpty()
            || config.includeExtensions().contains(LanguageClassifier.extension(relativePath));
    }

    private SourceFile read(Path base, Path path, SkipListener listener) {
        String relativePath = relativize(base, path);
        try {
            long size = Files.size(path);
            if (size > config.maxFileSizeBytes()) {
                log.debug("Skipping {}: {} bytes exceeds limit", relativePath, size);
                return null;
            }

            byte[] bytes = Files.readAllBytes(path);
            String content = decode(bytes);
            if (content == null) {
                log.warn("Skipping {}: not readable as UTF-8 text", relativePath);
                listener.skipped(relativePath, "not readable as text");
                return null;
            }

            return new SourceFile(relativePath, path, content, size, LanguageClassifier.classify(relativePath));
        } catch (IOException e) {
            log.warn("Skipping {}: {}", relativePath, e.getMessage());
            listener.skipped(relativePath, "read failed: " + e.getMessage());
            return null;
        }
    }

    private static String decode(byte[] bytes) {
        for (byte b : bytes) {
            if (b == 0) {
                return null;
            }
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    private static String relativize(Path base, Path path) {
        return base.relativize(path).toString().replace('\\', '/');
    }
}
