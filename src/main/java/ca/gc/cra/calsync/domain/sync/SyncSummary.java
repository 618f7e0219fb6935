package ca.gc.cra.calsync.domain.sync;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Final report of one run, produced even when individual mutations failed.
 * <p><strong>Role:</strong> Returned by the sync use case and rendered by the CLI for the scheduling layer to
 * capture.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param mode mode the run executed in
 * @param sourceCalendar source calendar name
 * @param destinationCalendar destination calendar name; empty in list mode
 * @param window queried window
 * @param fetched number of source events returned by the store
 * @param filter filter pipeline outcome
 * @param candidates candidates after identity derivation, in source order
 * @param plan reconciliation plan; empty in list mode
 * @param report applied mutations; empty in list and dry-run modes
 * @since 0.1.0
 */
public record SyncSummary(
    SyncMode mode,
    String sourceCalendar,
    Optional<String> destinationCalendar,
    SyncWindow window,
    int fetched,
    FilterResult filter,
    List<SyncCandidate> candidates,
    ReconciliationPlan plan,
    MutationReport report) {

  /**
   * Validates fields.
   */
  public SyncSummary {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(sourceCalendar, "sourceCalendar");
    destinationCalendar = Objects.requireNonNullElse(destinationCalendar, Optional.<String>empty());
    Objects.requireNonNull(window, "window");
    Objects.requireNonNull(filter, "filter");
    candidates = List.copyOf(candidates);
    plan = Objects.requireNonNullElse(plan, ReconciliationPlan.empty());
    report = Objects.requireNonNullElse(report, MutationReport.empty());
  }

  /**
   * Number of source events removed by filters.
   *
   * @return excluded count
   */
  public int excluded() {
    return filter.excluded();
  }

  /**
   * Events created, or planned creates on a dry run.
   *
   * @return create count
   */
  public int created() {
    return mode == SyncMode.DRY_RUN ? plan.creates().size() : report.created();
  }

  /**
   * Events updated, or planned updates on a dry run.
   *
   * @return update count
   */
  public int updated() {
    return mode == SyncMode.DRY_RUN ? plan.updates().size() : report.updated();
  }

  /**
   * Tracked events already in step with their candidate.
   *
   * @return unchanged count
   */
  public int unchanged() {
    return plan.unchanged().size();
  }

  /**
   * Events deleted, or planned deletes on a dry run.
   *
   * @return delete count
   */
  public int deleted() {
    return mode == SyncMode.DRY_RUN ? plan.deletes().size() : report.deleted();
  }

  /**
   * Failed mutations.
   *
   * @return failure count
   */
  public int failed() {
    return report.failed();
  }

  /**
   * Per-item failure diagnostics.
   *
   * @return failures in the order they occurred
   */
  public List<MutationFailure> failures() {
    return report.failures();
  }
}
