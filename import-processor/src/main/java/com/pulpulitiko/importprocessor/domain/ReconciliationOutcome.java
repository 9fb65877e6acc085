package com.pulpulitiko.importprocessor.domain;

/**
 * Result of reconciling one row.
 *
 * @param assignmentId         the current assignment after the action; {@code null} when it failed
 * @param archivedAssignmentId the assignment closed by {@link ReconciliationAction#ARCHIVED_AND_CREATED}
 * @param message              failure detail, {@code null} otherwise
 */
public record ReconciliationOutcome(int row,
                                    AssignmentKey key,
                                    ReconciliationAction action,
                                    String assignmentId,
                                    String archivedAssignmentId,
                                    String message) {

    public static ReconciliationOutcome of(int row, AssignmentKey key, ReconciliationAction action, String assignmentId) {
        return new ReconciliationOutcome(row, key, action, assignmentId, null, null);
    }

    public static ReconciliationOutcome archived(int row, AssignmentKey key, String assignmentId, String archivedId) {
        return new ReconciliationOutcome(row, key, ReconciliationAction.ARCHIVED_AND_CREATED, assignmentId, archivedId, null);
    }

    public static ReconciliationOutcome failed(int row, AssignmentKey key, String message) {
        return new ReconciliationOutcome(row, key, ReconciliationAction.FAILED, null, null, message);
    }

    public boolean isFailed() {
        return action == ReconciliationAction.FAILED;
    }
}
