package io.notify4j.core;

import java.util.List;

/**
 * Event types emitted by business modules and by the scheduler itself.
 */
public final class EventTypes {

    public static final String INVENTORY_LOW_STOCK = "inventory.low_stock";
    public static final String MAINTENANCE_DUE_SOON = "maintenance.due_soon";
    public static final String MAINTENANCE_OVERDUE = "maintenance.overdue";
    public static final String INVENTORY_STOCKOUT = "inventory.stockout";
    public static final String MAINTENANCE_TASK_ASSIGNED = "maintenance.task_assigned";
    public static final String DOCUMENTS_EXPIRING = "documents.expiring";
    public static final String DOCUMENTS_EXPIRED = "documents.expired";
    public static final String PO_SUBMITTED = "po.submitted";
    public static final String PO_APPROVED = "po.approved";
    public static final String JOBS_CREATED = "jobs.created";
    public static final String JOBS_ASSIGNMENT_CHANGED = "jobs.assignment_changed";
    public static final String JOBS_REMINDER_DUE = "jobs.reminder_due";
    public static final String JOBS_OVERDUE = "jobs.overdue";

    public static final List<String> ALL = List.of(
            INVENTORY_LOW_STOCK,
            INVENTORY_STOCKOUT,
            MAINTENANCE_DUE_SOON,
            MAINTENANCE_OVERDUE,
            MAINTENANCE_TASK_ASSIGNED,
            DOCUMENTS_EXPIRING,
            DOCUMENTS_EXPIRED,
            PO_SUBMITTED,
            PO_APPROVED,
            JOBS_CREATED,
            JOBS_ASSIGNMENT_CHANGED,
            JOBS_REMINDER_DUE,
            JOBS_OVERDUE
    );

    private EventTypes() {
    }
}
