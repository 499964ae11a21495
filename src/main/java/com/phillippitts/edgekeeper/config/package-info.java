/**
 * Spring wiring for the edge runtime.
 *
 * <p>Services are plain classes constructed here from the typed properties in
 * {@code config.properties}; none of them is component-scanned except
 * {@link com.phillippitts.edgekeeper.service.metrics.RuntimeMetrics}.
 */
package com.phillippitts.edgekeeper.config;
