/**
 * Clock adapters backing {@link ca.gc.cra.warden.application.port.ClockPort}.
 */
package ca.gc.cra.warden.infrastructure.time;
