package io.repo.vectors.scan;

import java.nio.file.Path;

/**
 * A selected file, decoded as text.
 *
 * @param relativePath path relative to the repository root, '/' separated
 * @param path         absolute path on disk
 * @param content      decoded UTF-8 content
 * @param sizeBytes    file size on disk
 * @param language     language tag from {@link LanguageClassifier}
 */
public record SourceFile(String relativePath, Path path, String content, long sizeBytes, String language) {
}
