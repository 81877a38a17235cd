package com.lexgate.core.waiver;

import com.lexgate.core.model.ChangeContext;
import com.lexgate.core.model.PathGlob;
import com.lexgate.core.model.Waiver;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads waiver documents: Markdown files in which each line of the form
 * <pre>
 * tf_id: BEX-001 scope: src/main/java/Foo.java expires: 2026-12-31 reason: vendor API
 * </pre>
 * declares a waiver. Other prose lines are rationale for the waiver above them. A line that
 * starts with a waiver key but cannot be read produces a warning.
 */
public final class WaiverDocumentParser {

    private static final Pattern TF_ID = Pattern.compile("[A-Z]+-\\d{3}");
    private static final Pattern KEY = Pattern.compile("\\b(tf_id|scope|expires|context|reason)\\s*:");
    private static final Pattern LEADING_KEY = Pattern.compile("^(tf_id|scope|expires|context|reason)\\s*:");

    private WaiverDocumentParser() {}

    /**
     * @param contextId context the document belongs to; waivers without a
     *                  {@code context} field are granted for it
     * @param source    document name used in warnings
     */
    public static WaiverDocument parse(String contextId, String text, String source) {
        var waivers = new ArrayList<Waiver>();
        var warnings = new ArrayList<String>();

        String[] lines = text.split("\\R", -1);
        for (int n = 0; n < lines.length; n++) {
            String line = stripBullet(lines[n].strip());
            String where = source + ":" + (n + 1);
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            Matcher leading = LEADING_KEY.matcher(line);
            if (leading.find()) {
                if (!"tf_id".equals(leading.group(1))) {
                    warnings.add(where + ": '" + leading.group(1) + "' given without a tf_id on the same line");
                    continue;
                }
                readWaiver(line, contextId, where, waivers, warnings);
            } else if (line.toLowerCase(Locale.ROOT).contains("tf_id")) {
                warnings.add(where + ": mentions tf_id but is not a waiver line");
            } else if (!waivers.isEmpty()) {
                Waiver last = waivers.remove(waivers.size() - 1);
                String rationale = last.rationale().isEmpty() ? line : last.rationale() + " " + line;
                waivers.add(last.withRationale(rationale));
            }
        }
        return new WaiverDocument(waivers, warnings);
    }

    private static void readWaiver(String line, String contextId, String where,
                                   List<Waiver> waivers, List<String> warnings) {
        Map<String, String> fields = fields(line);
        String tfId = fields.getOrDefault("tf_id", "");
        if (!TF_ID.matcher(tfId).matches()) {
            warnings.add(where + ": invalid tf_id '" + tfId + "'");
            return;
        }
        String scope = fields.get("scope");
        if (scope != null && !scope.isEmpty() && !ChangeContext.ANY.equals(scope)) {
            var problem = PathGlob.problem(scope);
            if (problem.isPresent()) {
                warnings.add(where + ": invalid scope glob '" + scope + "' for " + tfId + ": " + problem.get());
                return;
            }
        }
        Instant expiry = null;
        String expires = fields.get("expires");
        if (expires != null && !expires.isEmpty()) {
            expiry = parseExpiry(expires);
            if (expiry == null) {
                warnings.add(where + ": unparseable expiry '" + expires + "' for " + tfId);
                return;
            }
        }
        String context = fields.getOrDefault("context", contextId);
        waivers.add(new Waiver(tfId, scope, expiry, fields.getOrDefault("reason", ""),
                ChangeContext.ANY.equals(context) ? ChangeContext.ANY : context));
    }

    /** Splits a waiver line into key/value pairs; {@code reason} runs to the end of the line. */
    private static Map<String, String> fields(String line) {
        var fields = new LinkedHashMap<String, String>();
        Matcher m = KEY.matcher(line);
        String key = null;
        int valueStart = 0;
        while (m.find()) {
            if (key != null) {
                fields.put(key, line.substring(valueStart, m.start()).trim());
            }
            key = m.group(1);
            valueStart = m.end();
            if ("reason".equals(key)) {
                break;
            }
        }
        if (key != null) {
            fields.put(key, line.substring(valueStart).trim());
        }
        return fields;
    }

    /**
     * Accepts an instant ({@code 2026-12-31T12:00:00Z}), an offset date-time, or a date.
     * A bare date expires at the end of that day, UTC.
     *
     * @return the expiry, or null when {@code value} is none of those
     */
    public static Instant parseExpiry(String value) {
        try {
            if (!value.contains("T")) {
                return LocalDate.parse(value).plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return value.endsWith("Z") ? Instant.parse(value) : OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static boolean isTfId(String value) {
        return value != null && TF_ID.matcher(value).matches();
    }

    private static String stripBullet(String line) {
        if (line.startsWith("- ") || line.startsWith("* ")) {
            return line.substring(2).strip();
        }
        return line;
    }
}
