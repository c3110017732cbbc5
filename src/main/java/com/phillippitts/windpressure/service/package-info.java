/**
 * Service layer of the correction pipelines.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.formula} - Pure correction formulas</li>
 *   <li>{@code service.codec} - Record file reading and atomic writing</li>
 *   <li>{@code service.pulsation} - Per-file pulsation correction</li>
 *   <li>{@code service.peak} - Normalize and min/max aggregation stages</li>
 *   <li>{@code service.dispatch} - Fan-out/fan-in over the correction executor</li>
 *   <li>{@code service.validation} - Request validation</li>
 *   <li>{@code service.orchestration} - Entry point tying the above together</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Services are stateless Spring beans ({@code @Component}, {@code @Service})</li>
 *   <li>Services throw domain exceptions from {@code com.phillippitts.windpressure.exception}</li>
 *   <li>Services use constructor injection</li>
 * </ul>
 */
package com.phillippitts.windpressure.service;
