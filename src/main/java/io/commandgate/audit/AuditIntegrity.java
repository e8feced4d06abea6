package io.commandgate.audit;

public record AuditIntegrity(
        boolean ok,
        int totalRows,
        int checkedRows,
        int brokenLine,
        String reason,
        String lastHash
) {
    static AuditIntegrity intact(int rows, String lastHash) {
        return new AuditIntegrity(true, rows, rows, 0, "", lastHash);
    }
}
