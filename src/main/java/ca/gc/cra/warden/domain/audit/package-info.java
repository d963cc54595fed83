/**
 * Audit log vocabulary: action kinds and read-only audit records.
 */
package ca.gc.cra.warden.domain.audit;
