package sh.harold.warden.moderation.sanction;

import sh.harold.warden.api.moderation.ViolationRecord;

import java.util.List;

/**
 * Read-only summary of a member's violation standing.
 *
 * @param active        violations inside the retention window, oldest first
 * @param totalRecorded every record still stored, including expired ones not yet pruned
 */
public record ViolationReport(long guildId, long userId, List<ViolationRecord> active, int totalRecorded, int tier) {

    public ViolationReport {
        active = List.copyOf(active);
    }
}
