/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.windpressure.exception.WindPressureException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.windpressure.exception.CorrectionValidationException} - Thrown
 *       synchronously when a request is rejected; carries a reason code</li>
 *   <li>{@link com.phillippitts.windpressure.exception.RecordParseException} - Thrown when a row
 *       or field of a record file is not numeric</li>
 *   <li>{@link com.phillippitts.windpressure.exception.AggregationMismatchException} - Thrown when
 *       peak files have unequal row counts</li>
 *   <li>{@link com.phillippitts.windpressure.exception.RecordIoException} - Thrown when a record
 *       file cannot be read or written</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and support exception chaining. Parse, mismatch and I/O errors
 * raised inside a task are converted into a failed file outcome by the dispatcher and never
 * cross task boundaries.
 *
 * @see com.phillippitts.windpressure.exception.WindPressureException
 */
package com.phillippitts.windpressure.exception;
