package org.prism.application.port;

import java.io.IOException;
import org.prism.domain.transcript.DiscussionSet;

/**
 * Port writing the combined result of an aggregation run.
 *
 * @since 0.1.0
 * @see org.prism.infrastructure.persistence.DiscussionJsonAdapter
 */
public interface DiscussionPersistencePort extends AutoCloseable {
  /**
   * Persists the discussion set.
   *
   * @param discussions records to write; must not be {@code null}
   * @throws IOException if the destination rejects the write
   */
  void persist(DiscussionSet discussions) throws IOException;

  /**
   * Releases the destination.
   *
   * @throws IOException if closing fails
   */
  @Override
  default void close() throws IOException {}
}
