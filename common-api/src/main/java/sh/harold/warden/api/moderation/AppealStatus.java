package sh.harold.warden.api.moderation;

public enum AppealStatus {
    PENDING,
    APPROVED,
    DENIED
}
