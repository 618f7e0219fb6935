package ca.gc.cra.calsync.domain.sync;

import java.util.List;

/**
 * Aggregate result of applying a reconciliation plan.
 *
 * @param created events created
 * @param updated events updated
 * @param deleted events deleted
 * @param failures one entry per failed mutation
 * @since 0.1.0
 */
public record MutationReport(int created, int updated, int deleted, List<MutationFailure> failures) {
  /**
   * Defensively copies failures.
   */
  public MutationReport {
    failures = List.copyOf(failures);
  }

  /**
   * Report of a run that applied nothing.
   *
   * @return empty report
   */
  public static MutationReport empty() {
    return new MutationReport(0, 0, 0, List.of());
  }

  /**
   * Number of failed mutations.
   *
   * @return failure count
   */
  public int failed() {
    return failures.size();
  }
}
