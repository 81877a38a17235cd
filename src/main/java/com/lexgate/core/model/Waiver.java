package com.lexgate.core.model;

import java.time.Instant;

/**
 * A scoped, optionally time-bound exception for one task function.
 *
 * @param scope   {@code *} for the whole tree, otherwise a path or glob
 * @param expiry  null when the waiver never expires
 * @param context change context the waiver was granted for, or {@code *}
 */
public record Waiver(String tfId, String scope, Instant expiry, String rationale, String context) {

    public Waiver {
        scope = scope == null || scope.isBlank() ? ChangeContext.ANY : scope.trim();
        context = context == null || context.isBlank() ? ChangeContext.ANY : context.trim();
        rationale = rationale == null ? "" : rationale;
    }

    public boolean isRepoWide() {
        return ChangeContext.ANY.equals(scope);
    }

    public boolean covers(String file) {
        return isRepoWide() || scope.equals(file) || PathGlob.matches(scope, file);
    }

    public boolean isExpired(Instant now) {
        return expiry != null && !expiry.isAfter(now);
    }

    /**
     * Active iff unexpired at {@code now}, granted for this context (or any), and scoped to the
     * whole tree or to at least one changed file.
     */
    public boolean isActiveFor(ChangeContext change, Instant now) {
        if (isExpired(now)) {
            return false;
        }
        if (!ChangeContext.ANY.equals(context) && !context.equals(change.id())) {
            return false;
        }
        return isRepoWide() || change.changedFiles().stream().anyMatch(this::covers);
    }

    public Waiver withRationale(String text) {
        return new Waiver(tfId, scope, expiry, text, context);
    }

    /** Renders the single-line form read back by the waiver document parser. */
    public String toLine() {
        var sb = new StringBuilder("tf_id: ").append(tfId);
        if (!isRepoWide()) {
            sb.append(" scope: ").append(scope);
        }
        if (expiry != null) {
            sb.append(" expires: ").append(expiry);
        }
        if (ChangeContext.ANY.equals(context)) {
            sb.append(" context: *");
        }
        if (!rationale.isBlank()) {
            sb.append(" reason: ").append(rationale.replaceAll("\\s*\\R\\s*", " ").trim());
        }
        return sb.toString();
    }
}
