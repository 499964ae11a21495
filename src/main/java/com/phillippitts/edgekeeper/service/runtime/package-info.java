/**
 * Runtime glue: lifecycle, overheat protection and heartbeat events.
 */
package com.phillippitts.edgekeeper.service.runtime;
