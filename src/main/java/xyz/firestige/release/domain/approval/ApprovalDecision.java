package xyz.firestige.release.domain.approval;

public enum ApprovalDecision {
    PENDING,
    APPROVED,
    REJECTED
}
