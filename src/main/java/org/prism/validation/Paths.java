package org.prism.validation;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for PRISM CLI flows.
 * <p><strong>Role:</strong> Run before any document is read so that a bad input or an accidental overwrite is
 * reported up front.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Confirm inputs exist and are readable.</li>
 *   <li>Refuse to replace existing outputs unless {@code --allow-overwrite} was given.</li>
 *   <li>Create output directories on demand.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that {@code path} is a readable regular file.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate file
   * @return absolute normalized path
   * @throws IllegalArgumentException if the file is missing, not regular, or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " is not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates that {@code path} is a readable directory.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate directory
   * @return absolute normalized path
   * @throws IllegalArgumentException if the directory is missing or unreadable
   */
  public static Path requireReadableDirectory(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException(name + " is not a directory: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates an output file location.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate output file
   * @param allowOverwrite whether an existing file may be replaced
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is a directory, exists without {@code allowOverwrite}, or its
   *         nearest existing ancestor is not a writable directory
   */
  public static Path validateOutputFile(String name, Path path, boolean allowOverwrite) {
    Path normalized = normalize(name, path);
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException(name + " is a directory: " + normalized);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
      if (!allowOverwrite) {
        throw new IllegalArgumentException(
            name + " " + normalized + " already exists; re-run with --allow-overwrite to replace it");
      }
      if (!Files.isWritable(normalized)) {
        throw new IllegalArgumentException(name + " is not writable: " + normalized);
      }
      return normalized;
    }
    Path ancestor = nearestExistingAncestor(normalized.getParent());
    if (!Files.isDirectory(ancestor) || !Files.isWritable(ancestor)) {
      throw new IllegalArgumentException(name + " cannot be created under " + ancestor);
    }
    return normalized;
  }

  /**
   * Validates a writable output directory, optionally creating it.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate directory
   * @param createIfMissing whether to create the directory (and parents) when absent
   * @param allowReuse when {@code false}, existing non-empty directories are rejected
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is not a writable directory, is non-empty without
   *         {@code allowReuse}, or cannot be created
   */
  public static Path validateWritableDir(String name, Path path, boolean createIfMissing, boolean allowReuse) {
    Path normalized = normalize(name, path);
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!createIfMissing) {
          throw new IllegalArgumentException(name + " does not exist: " + normalized);
        }
        Files.createDirectories(normalized);
      }
      if (!Files.isDirectory(normalized)) {
        throw new IllegalArgumentException(name + " is not a directory: " + normalized);
      }
      if (!Files.isWritable(normalized)) {
        throw new IllegalArgumentException(name + " is not writable: " + normalized);
      }
      if (!allowReuse) {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(normalized)) {
          if (entries.iterator().hasNext()) {
            throw new IllegalArgumentException(
                name + " " + normalized + " is not empty; re-run with --allow-overwrite to reuse");
          }
        }
      }
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to prepare " + name + " " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(name + " must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }

  private static Path nearestExistingAncestor(Path start) {
    Path current = start;
    while (current != null && !Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + start);
    }
    return current;
  }
}
