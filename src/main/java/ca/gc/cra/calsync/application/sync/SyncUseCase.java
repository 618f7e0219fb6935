package ca.gc.cra.calsync.application.sync;

import ca.gc.cra.calsync.application.port.CalendarStore;
import ca.gc.cra.calsync.application.port.CalendarStoreException;
import ca.gc.cra.calsync.application.port.ClockPort;
import ca.gc.cra.calsync.application.port.CurrentAccountPort;
import ca.gc.cra.calsync.application.port.MetricsPort;
import ca.gc.cra.calsync.domain.calendar.CalendarEvent;
import ca.gc.cra.calsync.domain.calendar.CalendarHandle;
import ca.gc.cra.calsync.domain.sync.FilterResult;
import ca.gc.cra.calsync.domain.sync.MutationReport;
import ca.gc.cra.calsync.domain.sync.ReconciliationPlan;
import ca.gc.cra.calsync.domain.sync.SyncCandidate;
import ca.gc.cra.calsync.domain.sync.SyncMode;
import ca.gc.cra.calsync.domain.sync.SyncRequest;
import ca.gc.cra.calsync.domain.sync.SyncSummary;
import ca.gc.cra.calsync.domain.sync.SyncWindow;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one synchronization: fetch, filter, identify, reconcile, apply, report.
 * <p><strong>Why:</strong> Gives the CLI a single entry point that behaves the same for list, dry-run and sync
 * modes.</p>
 * <p><strong>Role:</strong> Application use case wired by {@code CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Fail before any mutation when the source or destination cannot be resolved.</li>
 *   <li>Never touch the destination in list mode, and never mutate it on a dry run.</li>
 *   <li>Return a summary even when individual mutations failed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; the caller serialises runs per destination calendar.</p>
 * <p><strong>Observability:</strong> Sets MDC key {@code calendar} to the source name for the duration of the run and
 * records {@code sync.events.*} and {@code sync.run.latencyMillis}.</p>
 *
 * @since 0.1.0
 */
public final class SyncUseCase {
  private static final Logger log = LoggerFactory.getLogger(SyncUseCase.class);
  private static final String MDC_CALENDAR = "calendar";

  private final CalendarStore store;
  private final CurrentAccountPort account;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates the use case.
   *
   * @param store calendar store holding both calendars
   * @param account current account lookup for declined detection
   * @param metrics metrics sink
   * @param clock clock used for run latency
   */
  public SyncUseCase(CalendarStore store, CurrentAccountPort account, MetricsPort metrics, ClockPort clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.account = Objects.requireNonNull(account, "account");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Executes {@code request}.
   *
   * @param request run inputs
   * @return run summary
   * @throws ca.gc.cra.calsync.application.port.CalendarNotFoundException if the source or destination calendar is
   *     missing
   * @throws CalendarStoreException if the store cannot be read
   */
  public SyncSummary run(SyncRequest request) throws CalendarStoreException {
    Objects.requireNonNull(request, "request");
    String previousCalendar = MDC.get(MDC_CALENDAR);
    long startedAt = clock.nowMillis();
    try {
      MDC.put(MDC_CALENDAR, request.sourceCalendar());
      log.info("Sync of '{}' started in {} mode", request.sourceCalendar(), request.mode());
      SyncSummary summary = execute(request);
      log.info("Sync of '{}' completed: {} fetched, {} excluded, {} created, {} updated, {} deleted, {} failed",
          request.sourceCalendar(), summary.fetched(), summary.excluded(), summary.created(),
          summary.updated(), summary.deleted(), summary.failed());
      return summary;
    } finally {
      metrics.observe("sync.run.latencyMillis", Math.max(0L, clock.nowMillis() - startedAt));
      if (previousCalendar == null) {
        MDC.remove(MDC_CALENDAR);
      } else {
        MDC.put(MDC_CALENDAR, previousCalendar);
      }
    }
  }

  private SyncSummary execute(SyncRequest request) throws CalendarStoreException {
    EventSource source = new EventSource(store);
    SyncWindow window = request.window();
    if (request.forceRefresh()) {
      source.forceRefresh();
    }

    List<CalendarEvent> fetched = source.queryEvents(request.sourceCalendar(), window);
    metrics.observe("sync.events.fetched", fetched.size());

    DeclinedDetector declined = new DeclinedDetector(account);
    FilterResult filtered = new FilterPipeline(request.filters(), declined).apply(fetched);
    metrics.observe("sync.events.excluded", filtered.excluded());

    List<SyncCandidate> candidates = new ArrayList<>(filtered.kept().size());
    for (CalendarEvent event : filtered.kept()) {
      candidates.add(SyncCandidate.of(event, declined.isDeclined(event)));
    }

    SyncMode mode = request.mode();
    if (mode == SyncMode.LIST) {
      return new SyncSummary(mode, request.sourceCalendar(), request.destinationCalendar(), window,
          fetched.size(), filtered, candidates, ReconciliationPlan.empty(), MutationReport.empty());
    }

    String destinationName = request.destinationCalendar().orElseThrow();
    CalendarHandle destination = store.findCalendar(destinationName);
    List<CalendarEvent> existing = store.queryEvents(destination, window.start(), window.end());
    ReconciliationPlan plan = new Reconciler().reconcile(candidates, existing, request.forceRecreate());

    MutationReport report;
    if (mode == SyncMode.DRY_RUN) {
      log.info("Dry run: {} creates, {} updates, {} deletes planned for '{}'",
          plan.creates().size(), plan.updates().size(), plan.deletes().size(), destinationName);
      report = MutationReport.empty();
    } else if (plan.hasMutations()) {
      report = new MutationApplier(store, metrics).apply(destination, plan);
    } else {
      report = MutationReport.empty();
    }
    return new SyncSummary(mode, request.sourceCalendar(), request.destinationCalendar(), window,
        fetched.size(), filtered, candidates, plan, report);
  }
}
