package eu.virtualparadox.articlefinder.rag.retriever.service;

import eu.virtualparadox.articlefinder.ingest.model.Role;
import eu.virtualparadox.articlefinder.rag.retriever.model.SearchResult;

import java.util.List;
import java.util.Set;

public interface RetrieverService {

    /**
     * @param query raw user query
     * @param roles caller roles, already expanded; must not be empty
     * @param k     maximum number of results, {@code > 0}
     * @return results visible to {@code roles}, best first
     * @throws eu.virtualparadox.articlefinder.error.InvalidRequestException    for empty roles or {@code k <= 0}
     * @throws eu.virtualparadox.articlefinder.error.RetrievalTimeoutException  if the capabilities do not answer in time
     * @throws eu.virtualparadox.articlefinder.error.IndexCorruptException      if the index cannot serve the query
     */
    List<SearchResult> search(final String query, final Set<Role> roles, final int k);

}
