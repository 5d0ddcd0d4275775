package com.speedwatch.isa.model;

/**
 * Enforcement lifecycle states.
 *
 * <pre>
 * NEW -> NOTICE_SENT -> FOLLOW_UP_DUE -> COMPLIANT | ESCALATED
 * </pre>
 *
 * NEW, NOTICE_SENT and FOLLOW_UP_DUE are open; at most one open alert exists per entity.
 */
public enum AlertStatus {
    NEW("New Case", "Send Notice"),
    NOTICE_SENT("Notice Sent", "Mark Follow-Up Due"),
    FOLLOW_UP_DUE("Follow-Up Due", "Confirm Installation or Escalate"),
    COMPLIANT("Compliant", null),
    ESCALATED("Escalated", null);

    private final String label;
    private final String nextAction;

    AlertStatus(String label, String nextAction) {
        this.label = label;
        this.nextAction = nextAction;
    }

    public String getLabel() {
        return label;
    }

    public String getNextAction() {
        return nextAction;
    }

    public boolean isOpen() {
        return this == NEW || this == NOTICE_SENT || this == FOLLOW_UP_DUE;
    }

    public boolean isTerminal() {
        return !isOpen();
    }
}
