package me.golemcore.coder.domain.model;

/**
 * Answer given to an approval request. {@link #ALWAYS} approves the call and
 * every later call of the same tool for the rest of the session.
 */
public enum ApprovalVerdict {
    YES, NO, ALWAYS;

    public boolean isApproved() {
        return this != NO;
    }
}
