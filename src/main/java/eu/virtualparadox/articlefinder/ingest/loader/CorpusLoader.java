package eu.virtualparadox.articlefinder.ingest.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.articlefinder.error.IndexCorruptException;
import eu.virtualparadox.articlefinder.ingest.model.Chunk;
import eu.virtualparadox.articlefinder.ingest.model.Corpus;
import eu.virtualparadox.articlefinder.ingest.model.Role;
import eu.virtualparadox.articlefinder.ingest.normalizer.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads the chunk JSONL file produced by ingestion into an immutable {@link Corpus}.
 * <p>
 * Chunk ids are assigned from the order of non-blank lines. Loading is all-or-nothing: the first
 * invalid record aborts the load with an {@link IndexCorruptException} naming its line.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CorpusLoader {

    private final ObjectMapper objectMapper;
    private final TextNormalizer textNormalizer;

    /**
     * @param path JSONL file, one chunk object per line
     * @return the loaded corpus
     * @throws IndexCorruptException if the file is unreadable or contains an invalid record
     */
    public Corpus load(final Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new IndexCorruptException("Corpus file not found: " + path);
        }

        final List<Chunk> chunks = new ArrayList<>();
        try (final BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                chunks.add(toChunk(parse(line, lineNo), chunks.size(), lineNo));
            }
        } catch (final IOException e) {
            throw new IndexCorruptException("Unable to read corpus file " + path, e);
        }

        log.info("Loaded {} chunks from {}", chunks.size(), path);
        return Corpus.of(chunks);
    }

    private ChunkRecord parse(final String line, final int lineNo) {
        try {
            return objectMapper.readValue(line, ChunkRecord.class);
        } catch (final JsonProcessingException e) {
            throw new IndexCorruptException("Malformed chunk record at line " + lineNo, e);
        }
    }

    private Chunk toChunk(final ChunkRecord rec, final int id, final int lineNo) {
        if (StringUtils.isBlank(rec.docId())) {
            throw corrupt(lineNo, "missing doc_id");
        }
        if (rec.text() == null) {
            throw corrupt(lineNo, "missing text");
        }
        if (rec.roles() == null || rec.roles().isEmpty()) {
            throw corrupt(lineNo, "chunk has no roles");
        }

        final Set<Role> roles;
        try {
            roles = Role.setOf(rec.roles());
        } catch (final IllegalArgumentException e) {
            throw new IndexCorruptException("Invalid chunk record at line " + lineNo + ": blank role tag", e);
        }

        final int pageStart = rec.pageStart() == null ? 1 : rec.pageStart();
        final int pageEnd = rec.pageEnd() == null ? pageStart : rec.pageEnd();
        if (pageStart > pageEnd) {
            throw corrupt(lineNo, "page_start " + pageStart + " > page_end " + pageEnd);
        }

        final String normText = rec.normText() != null ? rec.normText() : textNormalizer.normalize(rec.text());

        return new Chunk(id, rec.docId(), rec.articleNo(), pageStart, pageEnd, rec.text(), normText, roles);
    }

    private IndexCorruptException corrupt(final int lineNo, final String reason) {
        return new IndexCorruptException("Invalid chunk record at line " + lineNo + ": " + reason);
    }
}
