package eu.virtualparadox.articlefinder.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Pool running the blocking capability calls (lexical scoring, embedding, vector search) of queries.
 */
public class CapabilityExecutor extends ThreadPoolTaskExecutor {
}
