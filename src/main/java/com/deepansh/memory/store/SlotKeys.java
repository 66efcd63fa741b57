package com.deepansh.memory.store;

import com.deepansh.memory.model.MemoryRecord;

import java.util.Locale;

/**
 * A slot is "one fact about one thing": (owner, subject, predicate).
 * Records without a predicate are unslotted and occupy a slot of their own,
 * keyed by their id, so they never collide with anything.
 */
public final class SlotKeys {

    private static final char SEP = '|';

    private SlotKeys() {}

    public static String normalizeSubject(String subject) {
        if (subject == null) return "";
        return subject.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    public static String normalizePredicate(String predicate) {
        if (predicate == null) return null;
        String p = predicate.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
        return p.isEmpty() ? null : p;
    }

    public static boolean isSlotted(String predicate) {
        return normalizePredicate(predicate) != null;
    }

    /** Shared slot key, or null for unslotted (subject, null) pairs. */
    public static String slotKey(String ownerId, String subject, String predicate) {
        String p = normalizePredicate(predicate);
        if (p == null) return null;
        return join(ownerId, normalizeSubject(subject), p);
    }

    /** Key the record occupies while ACTIVE. Requires an id for unslotted records. */
    public static String slotKeyOf(MemoryRecord record) {
        String shared = slotKey(record.getOwnerId(), record.getSubjectName(), record.getPredicate());
        if (shared != null) return shared;
        return join(record.getOwnerId(), normalizeSubject(record.getSubjectName()), "#" + record.getId());
    }

    /** Each part is length-prefixed, so a separator inside an owner id or subject cannot shift the boundaries. */
    private static String join(String... parts) {
        StringBuilder key = new StringBuilder();
        for (String part : parts) {
            if (key.length() > 0) key.append(SEP);
            key.append(part.length()).append(':').append(part);
        }
        return key.toString();
    }

    /** True when the two subjects name the same entity, directly or through the record's aliases. */
    public static boolean sameSubject(MemoryRecord record, String subject) {
        String wanted = normalizeSubject(subject);
        if (normalizeSubject(record.getSubjectName()).equals(wanted)) return true;
        if (record.getAliases() == null) return false;
        return record.getAliases().stream().map(SlotKeys::normalizeSubject).anyMatch(wanted::equals);
    }

    public static boolean sameSubject(MemoryRecord a, MemoryRecord b) {
        if (sameSubject(a, b.getSubjectName())) return true;
        return b.getAliases() != null && b.getAliases().stream().anyMatch(alias -> sameSubject(a, alias));
    }
}
