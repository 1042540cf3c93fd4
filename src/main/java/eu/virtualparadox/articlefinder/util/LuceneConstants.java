package eu.virtualparadox.articlefinder.util;

public class LuceneConstants {
    public static final String FIELD_CHUNK_ID = "chunkId";
    public static final String FIELD_NORM_TEXT = "normText";
    public static final String FIELD_VECTOR = "vector";

    private LuceneConstants() {
        // prevent instantiation
    }
}
