/**
 * Import of legacy one-file-per-payload buffers into the SQLite telemetry buffer.
 */
package com.phillippitts.edgekeeper.service.migration;
