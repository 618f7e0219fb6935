package ca.gc.cra.calsync.domain.calendar;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Reads and writes the {@code SOURCE_ID: <identity>} line that marks an event as tracked.
 * <p><strong>Why:</strong> Destination stores only offer free-text notes, so the identity of the source event rides
 * along inside them and is the sole state carried between runs.</p>
 * <p><strong>Role:</strong> Domain codec shared by the reconciler (read) and the mutation applier (write).</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * <p>The tag may sit on any line of the notes. Writing replaces only that line; every other character of the notes,
 * line terminators included, is kept as is.</p>
 *
 * @since 0.1.0
 */
public final class SourceTag {
  /** Literal prefix of the tag line. */
  public static final String PREFIX = "SOURCE_ID: ";
  private static final Pattern IDENTITY = Pattern.compile("[0-9A-Fa-f]{32,128}");

  private SourceTag() {}

  /**
   * Formats the tag line for {@code identity} without a line terminator.
   *
   * @param identity hex identity
   * @return tag line
   * @throws IllegalArgumentException if {@code identity} is not a hex string
   */
  public static String line(String identity) {
    Objects.requireNonNull(identity, "identity");
    if (!IDENTITY.matcher(identity).matches()) {
      throw new IllegalArgumentException("identity must be 32-128 hex characters: " + identity);
    }
    return PREFIX + identity;
  }

  /**
   * Extracts the identity carried by the first valid tag line of {@code notes}.
   *
   * @param notes notes text; may be {@code null}
   * @return lower-case identity, or empty when the notes carry no valid tag
   */
  public static Optional<String> extract(String notes) {
    TagLine tag = locate(notes);
    return tag == null ? Optional.empty() : Optional.of(tag.identity());
  }

  /**
   * Writes the tag for {@code identity} into {@code notes}.
   *
   * <p>An existing tag line is replaced in place. Otherwise the tag becomes the first line and the previous notes
   * follow on the next line.</p>
   *
   * @param notes existing notes; may be {@code null}
   * @param identity hex identity to record
   * @return notes carrying exactly one tag line for {@code identity}
   */
  public static String apply(String notes, String identity) {
    String tagLine = line(identity);
    if (notes == null || notes.isEmpty()) {
      return tagLine;
    }
    TagLine existing = locate(notes);
    if (existing == null) {
      return tagLine + "\n" + notes;
    }
    return notes.substring(0, existing.start()) + tagLine + notes.substring(existing.end());
  }

  /**
   * Removes the tag line and its line terminator, returning the user-authored remainder.
   *
   * @param notes notes text; may be {@code null}
   * @return notes without the tag line; empty when nothing else remains
   */
  public static String strip(String notes) {
    if (notes == null) {
      return "";
    }
    TagLine existing = locate(notes);
    if (existing == null) {
      return notes;
    }
    int after = existing.end();
    if (after < notes.length() && notes.charAt(after) == '\r') {
      after++;
    }
    if (after < notes.length() && notes.charAt(after) == '\n') {
      after++;
    }
    return notes.substring(0, existing.start()) + notes.substring(after);
  }

  /**
   * Finds the first tag line; {@code end} excludes any trailing carriage return or newline.
   */
  private static TagLine locate(String notes) {
    if (notes == null || notes.isEmpty()) {
      return null;
    }
    int lineStart = 0;
    while (lineStart <= notes.length()) {
      int newline = notes.indexOf('\n', lineStart);
      int lineEnd = newline < 0 ? notes.length() : newline;
      int contentEnd = lineEnd;
      if (contentEnd > lineStart && notes.charAt(contentEnd - 1) == '\r') {
        contentEnd--;
      }
      String line = notes.substring(lineStart, contentEnd);
      if (line.startsWith(PREFIX)) {
        String candidate = line.substring(PREFIX.length()).strip();
        if (IDENTITY.matcher(candidate).matches()) {
          return new TagLine(lineStart, contentEnd, candidate.toLowerCase(Locale.ROOT));
        }
      }
      if (newline < 0) {
        break;
      }
      lineStart = newline + 1;
    }
    return null;
  }

  private record TagLine(int start, int end, String identity) {}
}
