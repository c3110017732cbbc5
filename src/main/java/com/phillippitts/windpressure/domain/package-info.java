/**
 * Domain model of the wind-pressure correction runs.
 *
 * <p>All types are immutable: enums for the closed classifications (geometry index, terrain
 * category, decrement, measurement mode, wind region) and records for the values that flow
 * through a run.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.windpressure.domain.CorrectionRequest} - caller input of one run</li>
 *   <li>{@link com.phillippitts.windpressure.domain.CorrectionContext} - read-only parameters
 *       shared by every task of the run</li>
 *   <li>{@link com.phillippitts.windpressure.domain.MeasurementRow} - one pressure measurement
 *       with its X/Y/Z location</li>
 *   <li>{@link com.phillippitts.windpressure.domain.CorrectionOutcome} - per-file results,
 *       elapsed time and status text of a finished run</li>
 * </ul>
 */
package com.phillippitts.windpressure.domain;
