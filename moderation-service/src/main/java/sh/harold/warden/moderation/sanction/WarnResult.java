package sh.harold.warden.moderation.sanction;

import sh.harold.warden.api.moderation.EscalationOutcome;
import sh.harold.warden.api.moderation.WarningRecord;

public record WarnResult(WarningRecord warning, int warningCount, EscalationOutcome escalation) {
}
