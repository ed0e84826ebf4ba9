package io.repo.vectors.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.*;
import com.github.javaparser.ast.nodeTypes.NodeWithJavadoc;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
import io.repo.vectors.ChunkType;
import io.repo.vectors.CodeChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts Java chunks from the JavaParser AST.
 *
 * <p>Produces one CLASS chunk per top-level type and one FUNCTION chunk per
 * method or constructor. A type that does not fit in the maximum chunk size
 * contributes its declaration header, its methods being chunked on their own;
 * the rest of its body (fields, initializers, methods below the minimum size)
 * is emitted as size-bounded CLASS chunks named after the type.</p>
 */
public class JavaStructuralChunker implements StructuralChunker {

    private static final Logger log = LoggerFactory.getLogger(JavaStructuralChunker.class);

    private final ParserConfiguration parserConfiguration;

    public JavaStructuralChunker() {
        this.parserConfiguration = new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
    }

    @Override
    public List<CodeChunk> chunk(String filePath, String content, ChunkerConfig config) {
        List<CodeChunk> chunks = new ArrayList<>();

        // JavaParser instances are not thread-safe, files are chunked concurrently
        ParseResult<CompilationUnit> parseResult = new JavaParser(parserConfiguration).parse(content);

        if (!parseResult.isSuccessful()) {
            log.debug("Failed to parse {}: {} problems", filePath, parseResult.getProblems().size());
            return chunks;
        }

        CompilationUnit cu = parseResult.getResult().orElse(null);
        if (cu == null) return chunks;

        String[] lines = PatternChunker.splitLines(content);
        ChunkExtractor extractor = new ChunkExtractor(chunks, filePath, lines, config);
        cu.accept(extractor, null);
        extractor.addBodyChunks();
        chunks.sort(Comparator.comparingInt(CodeChunk::startLine));

        log.debug("Extracted {} chunks from {}", chunks.size(), filePath);
        return chunks;
    }

    /**
     * AST visitor that extracts code chunks.
     */
    private static class ChunkExtractor extends VoidVisitorAdapter<Void> {

        private final List<CodeChunk> chunks;
        private final String filePath;
        private final String[] lines;
        private final ChunkerConfig config;
        private final List<BodySpan> oversized = new ArrayList<>();
        private String currentType = null;

        ChunkExtractor(List<CodeChunk> chunks, String filePath, String[] lines, ChunkerConfig config) {
            this.chunks = chunks;
            this.filePath = filePath;
            this.lines = lines;
            this.config = config;
        }

        @Override
        public void visit(ClassOrInterfaceDeclaration node, Void arg) {
            visitType(node, () -> super.visit(node, arg));
        }

        @Override
        public void visit(EnumDeclaration node, Void arg) {
            visitType(node, () -> super.visit(node, arg));
        }

        @Override
        public void visit(RecordDeclaration node, Void arg) {
            visitType(node, () -> super.visit(node, arg));
        }

        @Override
        public void visit(MethodDeclaration node, Void arg) {
            addFunction(node, node.getNameAsString(), signature(node.getNameAsString(), node.getParameters()));
            // Method bodies are not descended into: local and anonymous classes stay inside the method chunk
        }

        @Override
        public void visit(ConstructorDeclaration node, Void arg) {
            addFunction(node, node.getNameAsString(), signature(node.getNameAsString(), node.getParameters()));
        }

        private void visitType(TypeDeclaration<?> node, Runnable children) {
            String previousType = currentType;
            currentType = currentType == null ? node.getNameAsString() : currentType + "." + node.getNameAsString();

            if (node.isTopLevelType()) {
                addType(node);
            }

            children.run();
            currentType = previousType;
        }

        private void addType(TypeDeclaration<?> node) {
            int lineStart = begin(node);
            int lineEnd = end(node, lineStart);

            String code = extractLines(lineStart, lineEnd);
            if (code.length() > config.maxChunkSize()) {
                int typeEnd = lineEnd;
                // Header only: from the declaration up to its first member
                lineEnd = node.getMembers().stream()
                    .map(member -> member.getComment().map(JavaStructuralChunker::beginLine).orElse(begin(member)))
                    .min(Integer::compare)
                    .map(first -> Math.max(lineStart, first - 1))
                    .orElse(lineStart);
                code = extractLines(lineStart, lineEnd);
                oversized.add(new BodySpan(node.getNameAsString(), kind(node), lineEnd + 1, typeEnd));
            }

            Map<String, String> metadata = metadata(node.getNameAsString(), node);
            metadata.put("kind", kind(node));
            chunks.add(CodeChunk.of(code, filePath, lineStart, lineEnd, ChunkType.CLASS, "java", metadata));
        }

        private void addFunction(CallableDeclaration<?> node, String name, String signature) {
            int lineStart = begin(node);
            int lineEnd = end(node, lineStart);

            // Include annotations
            if (!node.getAnnotations().isEmpty()) {
                int annotationStart = node.getAnnotations().get(0)
                    .getBegin().map(p -> p.line).orElse(lineStart);
                lineStart = Math.min(lineStart, annotationStart);
            }

            String code = extractLines(lineStart, lineEnd);
            if (code.length() < config.minChunkSize()) {
                return;
            }

            Map<String, String> metadata = metadata(name, node);
            metadata.put("signature", signature);
            if (currentType != null) {
                metadata.put(CodeChunk.META_PARENT, currentType);
            }
            chunks.add(CodeChunk.of(code, filePath, lineStart, lineEnd, ChunkType.FUNCTION, "java", metadata));
        }

        /**
         * Chunks the body lines of oversized types that no other chunk covers.
         */
        void addBodyChunks() {
            for (BodySpan span : oversized) {
                boolean[] covered = new boolean[lines.length + 2];
                for (CodeChunk chunk : chunks) {
                    for (int line = chunk.startLine(); line <= Math.min(chunk.endLine(), lines.length); line++) {
                        covered[line] = true;
                    }
                }

                int runStart = -1;
                int runChars = 0;
                for (int line = span.from(); line <= span.to(); line++) {
                    if (covered[line]) {
                        addBodyChunk(span, runStart, line - 1);
                        runStart = -1;
                        continue;
                    }
                    int length = lines[line - 1].length();
                    if (runStart != -1 && runChars + 1 + length > config.maxChunkSize()) {
                        addBodyChunk(span, runStart, line - 1);
                        runStart = -1;
                    }
                    if (runStart == -1) {
                        runStart = line;
                        runChars = length;
                    } else {
                        runChars += 1 + length;
                    }
                }
                addBodyChunk(span, runStart, span.to());
            }
        }

        private void addBodyChunk(BodySpan span, int start, int end) {
            if (start == -1) {
                return;
            }
            while (start <= end && lines[start - 1].isBlank()) start++;
            while (end >= start && lines[end - 1].isBlank()) end--;
            if (start > end) {
                return;
            }

            String code = extractLines(start, end);
            if (code.strip().length() < config.minChunkSize()) {
                return;
            }

            Map<String, String> metadata = new HashMap<>();
            metadata.put(CodeChunk.META_NAME, span.name());
            metadata.put(CodeChunk.META_EXTRACTION, CodeChunk.EXTRACTION_STRUCTURAL);
            metadata.put("kind", span.kind());
            chunks.add(CodeChunk.of(code, filePath, start, end, ChunkType.CLASS, "java", metadata));
        }

        private Map<String, String> metadata(String name, BodyDeclaration<?> node) {
            Map<String, String> metadata = new HashMap<>();
            metadata.put(CodeChunk.META_NAME, name);
            metadata.put(CodeChunk.META_EXTRACTION, CodeChunk.EXTRACTION_STRUCTURAL);
            if (node instanceof NodeWithJavadoc<?> documented) {
                documented.getJavadoc()
                    .map(javadoc -> javadoc.getDescription().toText().trim())
                    .filter(doc -> !doc.isEmpty())
                    .ifPresent(doc -> metadata.put(CodeChunk.META_DOC, doc));
            }
            return metadata;
        }

        private String signature(String name, List<Parameter> parameters) {
            StringBuilder sb = new StringBuilder();
            sb.append(name).append("(");

            parameters.forEach(p -> {
                if (sb.charAt(sb.length() - 1) != '(') {
                    sb.append(", ");
                }
                sb.append(p.getType().asString());
            });

            sb.append(")");
            return sb.toString();
        }

        private String kind(TypeDeclaration<?> node) {
            if (node instanceof ClassOrInterfaceDeclaration c) return c.isInterface() ? "interface" : "class";
            if (node instanceof EnumDeclaration) return "enum";
            if (node instanceof RecordDeclaration) return "record";
            return "type";
        }

        private int begin(Node node) {
            return beginLine(node);
        }

        private int end(Node node, int lineStart) {
            return Math.max(lineStart, Math.min(node.getEnd().map(p -> p.line).orElse(lineStart), lines.length));
        }

        private String extractLines(int start, int end) {
            StringBuilder sb = new StringBuilder();
            for (int i = start - 1; i < Math.min(end, lines.length); i++) {
                if (i >= 0) {
                    if (i > start - 1) sb.append("\n");
                    sb.append(lines[i]);
                }
            }
            return sb.toString();
        }
    }

    private record BodySpan(String name, String kind, int from, int to) {}

    private static int beginLine(Node node) {
        return node.getBegin().map(p -> p.line).orElse(1);
    }
}
