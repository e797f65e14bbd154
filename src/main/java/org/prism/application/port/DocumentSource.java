package org.prism.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * <strong>What:</strong> Port that enumerates and reads source documents.
 * <p><strong>Role:</strong> Driven port for the convert and aggregate use cases; the filesystem adapter reads each
 * document fully in one scoped operation.</p>
 *
 * @since 0.1.0
 */
public interface DocumentSource {
  /**
   * Lists regular files in {@code directory} whose extension matches {@code extension}, ignoring case.
   *
   * @param directory directory to enumerate (not recursive)
   * @param extension extension without the leading dot, e.g. {@code rtf}
   * @return matching files sorted by file name
   * @throws IOException if the directory cannot be listed
   */
  List<Path> list(Path directory, String extension) throws IOException;

  /**
   * Reads a whole document into memory.
   *
   * @param document file to read
   * @return document text
   * @throws IOException if the file cannot be read
   */
  String read(Path document) throws IOException;
}
