package eu.virtualparadox.articlefinder.ingest.loader;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One line of the chunk JSONL file written by the ingestion pipeline.
 * All fields are nullable here; {@link CorpusLoader} validates them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChunkRecord(
        @JsonProperty("doc_id") String docId,
        @JsonProperty("article_no") String articleNo,
        @JsonProperty("page_start") Integer pageStart,
        @JsonProperty("page_end") Integer pageEnd,
        @JsonProperty("text") String text,
        @JsonProperty("norm_text") String normText,
        @JsonProperty("roles")
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        List<String> roles) {
}
