package ca.gc.cra.calsync.infrastructure.store.json;

import ca.gc.cra.calsync.application.port.CalendarStore;
import ca.gc.cra.calsync.application.port.CalendarStoreException;
import ca.gc.cra.calsync.domain.calendar.CalendarEvent;
import ca.gc.cra.calsync.domain.calendar.CalendarHandle;
import ca.gc.cra.calsync.domain.calendar.EventFields;
import ca.gc.cra.calsync.domain.calendar.EventRef;
import ca.gc.cra.calsync.infrastructure.store.memory.InMemoryCalendarStore;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CalendarStore} backed by a single JSON document on disk.
 * <p><strong>Why:</strong> Gives the sync engine a real, inspectable backend that scheduled jobs and tests can share.</p>
 * <p><strong>Role:</strong> Adapter for the calendar store port.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load the document lazily and cache it for the rest of the run.</li>
 *   <li>Rewrite the whole document after each mutation through a temp file and an atomic move.</li>
 *   <li>Drop the cache on {@link #forceRefresh()} so the next call re-reads the file.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one run per file at a time.</p>
 * <p><strong>Performance:</strong> Each mutation rewrites the file; sized for personal calendars.</p>
 *
 * @since 0.1.0
 */
public final class JsonCalendarStore implements CalendarStore {
  private static final Logger log = LoggerFactory.getLogger(JsonCalendarStore.class);

  private final Path file;
  private final JsonCalendarCodec codec = new JsonCalendarCodec();
  private InMemoryCalendarStore cache;

  /**
   * Creates a store over {@code file}. Nothing is read until the first call.
   *
   * @param file JSON document; a missing file reads as a store without calendars
   */
  public JsonCalendarStore(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  /**
   * Location of the backing document.
   *
   * @return file path
   */
  public Path file() {
    return file;
  }

  @Override
  public Set<String> listCalendars() throws CalendarStoreException {
    return model().listCalendars();
  }

  @Override
  public CalendarHandle findCalendar(String name) throws CalendarStoreException {
    return model().findCalendar(name);
  }

  @Override
  public List<CalendarEvent> queryEvents(CalendarHandle calendar, Instant start, Instant end)
      throws CalendarStoreException {
    return model().queryEvents(calendar, start, end);
  }

  @Override
  public EventRef createEvent(CalendarHandle calendar, EventFields fields) throws CalendarStoreException {
    EventRef ref = model().createEvent(calendar, fields);
    persist();
    return ref;
  }

  @Override
  public void updateEvent(EventRef ref, EventFields fields) throws CalendarStoreException {
    model().updateEvent(ref, fields);
    persist();
  }

  @Override
  public void deleteEvent(EventRef ref) throws CalendarStoreException {
    model().deleteEvent(ref);
    persist();
  }

  @Override
  public void forceRefresh() {
    log.debug("Dropping cached calendar document {}", file);
    cache = null;
  }

  private InMemoryCalendarStore model() throws CalendarStoreException {
    if (cache == null) {
      cache = InMemoryCalendarStore.fromSnapshot(load(), () -> UUID.randomUUID().toString());
    }
    return cache;
  }

  private Map<String, List<CalendarEvent>> load() throws CalendarStoreException {
    if (!Files.exists(file)) {
      log.info("Calendar store {} does not exist; starting without calendars", file);
      return Map.of();
    }
    try (InputStream in = Files.newInputStream(file)) {
      Map<String, List<CalendarEvent>> calendars = codec.read(in);
      log.debug("Loaded {} calendars from {}", calendars.size(), file);
      return calendars;
    } catch (IOException ex) {
      throw new CalendarStoreException("Unable to read calendar store " + file + ": " + ex.getMessage(), ex);
    } catch (IllegalArgumentException ex) {
      throw new CalendarStoreException("Invalid calendar store " + file + ": " + ex.getMessage(), ex);
    }
  }

  private void persist() throws CalendarStoreException {
    Path parent = file.toAbsolutePath().getParent();
    Path tmp = null;
    try {
      Files.createDirectories(parent);
      tmp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
      try (OutputStream out = Files.newOutputStream(tmp)) {
        codec.write(out, cache.snapshot());
      }
      move(tmp, file);
    } catch (IOException ex) {
      // The cached model is now ahead of the file; re-read on next access.
      cache = null;
      deleteQuietly(tmp);
      throw new CalendarStoreException("Unable to write calendar store " + file + ": " + ex.getMessage(), ex);
    }
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move not supported for {}; replacing in place", target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path tmp) {
    if (tmp == null) {
      return;
    }
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException ex) {
      log.warn("Unable to remove temporary file {}", tmp, ex);
    }
  }
}
