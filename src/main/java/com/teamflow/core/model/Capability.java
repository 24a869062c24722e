package com.teamflow.core.model;

import java.io.Serializable;
import java.util.Collection;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A normalized capability tag (e.g. language "java", framework "spring", domain "security").
 * <p>
 * Names are trimmed and lower-cased on construction, so two tags built from
 * "Java " and "java" are equal. Matching between an agent and an issue is done
 * on {@link #name()}; the {@link #kind()} decides which requirement bucket the
 * tag counts against.
 *
 * @param kind dimension of the tag
 * @param name normalized tag name
 */
public record Capability(CapabilityKind kind, String name) implements Serializable {

    public Capability {
        Objects.requireNonNull(kind, "kind");
        name = normalize(name);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Capability name must not be blank");
        }
    }

    public static Capability of(String name) {
        return new Capability(CapabilityKind.GENERAL, name);
    }

    public static Capability language(String name) {
        return new Capability(CapabilityKind.LANGUAGE, name);
    }

    public static Capability framework(String name) {
        return new Capability(CapabilityKind.FRAMEWORK, name);
    }

    public static Capability domain(String name) {
        return new Capability(CapabilityKind.DOMAIN, name);
    }

    /**
     * Parses an agent-side tag such as {@code "lang:java"}, {@code "framework:react"},
     * {@code "domain:payments"} or a bare {@code "jwt"}.
     */
    public static Capability parse(String tag) {
        Objects.requireNonNull(tag, "tag");
        int colon = tag.indexOf(':');
        if (colon < 0) {
            return of(tag);
        }
        String prefix = normalize(tag.substring(0, colon));
        String value = tag.substring(colon + 1);
        return switch (prefix) {
            case "lang", "language" -> language(value);
            case "framework", "fw" -> framework(value);
            case "domain" -> domain(value);
            default -> of(value);
        };
    }

    /** Parses every non-blank tag; a null list yields an empty set. */
    public static Set<Capability> parseAll(Collection<String> tags) {
        if (tags == null) {
            return Set.of();
        }
        return tags.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(Capability::parse)
                .collect(Collectors.toUnmodifiableSet());
    }

    static String normalize(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return kind == CapabilityKind.GENERAL ? name : kind.name().toLowerCase(Locale.ROOT) + ":" + name;
    }
}
