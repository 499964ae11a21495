/**
 * Host health sampling, overheat detection and the actuator health indicator.
 */
package com.phillippitts.edgekeeper.service.health;
