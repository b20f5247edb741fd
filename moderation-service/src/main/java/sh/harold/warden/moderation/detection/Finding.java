package sh.harold.warden.moderation.detection;

import sh.harold.warden.api.moderation.ViolationType;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One rule breach reported by the detector.
 */
public record Finding(ViolationType type, int severity, String detail) {

    public Finding {
        Objects.requireNonNull(type, "type");
        detail = detail == null ? "" : detail;
    }

    static Finding of(ViolationType type, String detail) {
        return new Finding(type, type.getSeverity(), detail);
    }

    /**
     * Highest severity wins; among equals the earliest finding in the list wins.
     */
    public static Optional<Finding> mostSevere(List<Finding> findings) {
        Finding selected = null;
        for (Finding finding : findings) {
            if (selected == null || finding.severity() > selected.severity()) {
                selected = finding;
            }
        }
        return Optional.ofNullable(selected);
    }
}
