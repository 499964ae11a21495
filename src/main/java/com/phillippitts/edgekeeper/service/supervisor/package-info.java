/**
 * Worker process supervision.
 *
 * <p><b>Worker lifecycle:</b>
 * <pre>
 * STOPPED ──start──▶ RUNNING ◀──resume── PAUSED
 *    │                 │  └────pause───────▲   (non-essential only)
 *    │ spawn error     │ death / zombie
 *    ▼                 ▼
 *  FAILED ◀─ceiling── RESTARTING ──respawn──▶ RUNNING
 * </pre>
 *
 * <p>{@link com.phillippitts.edgekeeper.service.supervisor.WorkerSupervisor} owns the table and the
 * watchdog thread; {@link com.phillippitts.edgekeeper.service.supervisor.ProcessFactory} and
 * {@link com.phillippitts.edgekeeper.service.supervisor.ProcessSignaller} are the OS seams.
 */
package com.phillippitts.edgekeeper.service.supervisor;
