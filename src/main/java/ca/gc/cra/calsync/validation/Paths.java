package ca.gc.cra.calsync.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for the calendar store file.
 * <p><strong>Role:</strong> Invoked by configuration before the JSON store is opened.</p>
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
   * Validates the location of a data file that is read and rewritten in place.
   *
   * <p>An existing file must be a readable regular file. A missing file is accepted when its parent directory
   * exists, or can be created when {@code createParent} is set.</p>
   *
   * @param path candidate file
   * @param createParent whether to create missing parent directories
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is unusable
   */
  public static Path validateDataFile(Path path, boolean createParent) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("path must not contain control characters");
      }
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (Files.exists(normalized)) {
      if (!Files.isRegularFile(normalized)) {
        throw new IllegalArgumentException("path is not a regular file: " + normalized);
      }
      if (!Files.isReadable(normalized)) {
        throw new IllegalArgumentException("file is not readable: " + normalized);
      }
      return normalized;
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException("path has no parent directory: " + normalized);
    }
    if (!Files.exists(parent, LinkOption.NOFOLLOW_LINKS)) {
      if (!createParent) {
        throw new IllegalArgumentException("parent directory does not exist: " + parent);
      }
      try {
        Files.createDirectories(parent);
      } catch (IOException ex) {
        throw new IllegalArgumentException("unable to create directory " + parent + ": " + ex.getMessage(), ex);
      }
    }
    if (!Files.isDirectory(parent)) {
      throw new IllegalArgumentException("parent is not a directory: " + parent);
    }
    return normalized;
  }
}
