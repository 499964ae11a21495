/**
 * Value types shared by the supervisor, health and telemetry services.
 *
 * @since 1.0
 */
package com.phillippitts.edgekeeper.domain;
