package io.commandgate.policy;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * System-wide policy switches. Blanket restrictions ({@code safeMode}, {@code deniedKinds},
 * {@code allowedKinds}) apply to standard initiators only; the privileged lists scope what an
 * elevated initiator may do.
 */
public record SystemFlags(
        boolean safeMode,
        Set<String> deniedKinds,
        Set<String> allowedKinds,
        Set<String> approvalRequiredKinds,
        boolean requireApprovalForWrites,
        Set<String> privilegedKinds,
        Set<String> privilegedDeniedKinds
) {
    public static final String ANY_KIND = "*";
    public static final List<String> BLOCKED_KINDS = List.of(
            "delete_all", "wipe", "shutdown_system", "dangerous", "remove_database", "reset_system"
    );

    public SystemFlags {
        deniedKinds = normalize(deniedKinds, BLOCKED_KINDS);
        allowedKinds = normalize(allowedKinds, List.of());
        approvalRequiredKinds = normalize(approvalRequiredKinds, List.of());
        privilegedKinds = normalize(privilegedKinds, List.of());
        privilegedDeniedKinds = normalize(privilegedDeniedKinds, List.of());
    }

    public static SystemFlags defaults() {
        return new SystemFlags(false, Set.of(), Set.of(), Set.of(), true, Set.of(), Set.of());
    }

    public SystemFlags withSafeMode(boolean enabled) {
        return new SystemFlags(enabled, deniedKinds, allowedKinds, approvalRequiredKinds, requireApprovalForWrites,
                privilegedKinds, privilegedDeniedKinds);
    }

    static boolean matches(Set<String> kinds, String kind) {
        return kinds.contains(ANY_KIND) || kinds.contains(normalizeKind(kind));
    }

    static String normalizeKind(String kind) {
        return kind == null ? "" : kind.trim().toLowerCase(Locale.ROOT);
    }

    private static Set<String> normalize(Set<String> raw, List<String> always) {
        Set<String> out = new LinkedHashSet<>(always);
        if (raw != null) {
            for (String kind : raw) {
                String value = normalizeKind(kind);
                if (!value.isEmpty()) {
                    out.add(value);
                }
            }
        }
        return Set.copyOf(out);
    }
}
