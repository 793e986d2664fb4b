package com.agentstrike.audit;

/**
 * Result of replaying an audit log.
 *
 * @param firstBadIndex zero-based line position of the first record that fails, or -1 when valid
 */
public record ChainVerification(boolean valid, int recordCount, int firstBadIndex, String reason) {

    public static ChainVerification ok(int recordCount) {
        return new ChainVerification(true, recordCount, -1, "");
    }

    public static ChainVerification broken(int recordCount, int index, String reason) {
        return new ChainVerification(false, recordCount, index, reason);
    }
}
