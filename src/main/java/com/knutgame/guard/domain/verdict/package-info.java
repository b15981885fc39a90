/**
 * <strong>Purpose:</strong> Outcomes of session validation and the threshold relaxations that produced them.
 * <p><strong>Pipeline role:</strong> Returned to the session-submission endpoint, which maps them to accept or reject.
 * <p><strong>Concurrency:</strong> Immutable records and enums.
 * <p><strong>Observability:</strong> {@link com.knutgame.guard.domain.verdict.RejectionReason#code()} values are used
 * verbatim as metric suffixes and log fields.
 *
 * @since 0.1.0
 */
package com.knutgame.guard.domain.verdict;
