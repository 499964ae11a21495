package com.phillippitts.edgekeeper.service.migration;

/**
 * Outcome of one legacy buffer import.
 *
 * @param migrated files imported into the buffer and deleted
 * @param failed files moved to quarantine (or left in place if even that failed)
 */
public record MigrationReport(int migrated, int failed) {

    @Override
    public String toString() {
        return migrated + " files migrated, " + failed + " failures";
    }
}
