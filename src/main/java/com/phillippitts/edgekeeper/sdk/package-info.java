/**
 * Worker-side helper for heartbeat markers and the stop signal file.
 */
package com.phillippitts.edgekeeper.sdk;
