package ca.gc.cra.induform.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for InduForm command outputs.
 * <p><strong>Why:</strong> Reports, rulesets and starter projects must land in a writable location and must
 * not silently replace an operator's existing file.
 * <p><strong>Role:</strong> Support utilities executed by the CLI before exporters open output streams.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Normalize user-provided paths.</li>
 *   <li>Reject directories, symlinked targets and unapproved overwrites.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} so a symlink is never followed to its target.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates an output file location, creating missing parent directories.
   *
   * @param path candidate output file; must not be {@code null}
   * @param allowOverwrite when {@code false}, an existing file is rejected
   * @return absolute normalized path of the output file
   * @throws IllegalArgumentException if the path is a directory, a symlink, an unapproved overwrite, or its
   *     parent cannot be created or written
   */
  public static Path validateOutputFile(Path path, boolean allowOverwrite) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    if (containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }

    Path normalized = path.toAbsolutePath().normalize();
    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (Files.isSymbolicLink(normalized)) {
          throw new IllegalArgumentException("output path must not be a symbolic link: " + normalized);
        }
        if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
          throw new IllegalArgumentException("output path is a directory: " + normalized);
        }
        if (!allowOverwrite) {
          throw new IllegalArgumentException(
              "file " + normalized + " already exists; re-run with --force to overwrite");
        }
        if (!Files.isWritable(normalized)) {
          throw new IllegalArgumentException("file is not writable: " + normalized);
        }
        return normalized;
      }

      Path parent = normalized.getParent();
      if (parent == null) {
        throw new IllegalArgumentException("path has no parent to validate: " + normalized);
      }
      if (!Files.exists(parent, LinkOption.NOFOLLOW_LINKS)) {
        Files.createDirectories(parent);
      }
      if (!Files.isDirectory(parent)) {
        throw new IllegalArgumentException("parent is not a directory: " + parent);
      }
      if (!Files.isWritable(parent)) {
        throw new IllegalArgumentException("parent directory is not writable: " + parent);
      }
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate output file " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
