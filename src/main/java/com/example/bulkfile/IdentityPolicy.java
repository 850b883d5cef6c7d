package com.example.bulkfile;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Configurable rules for turning an item tag into a directory group, and what to fall back to
 * when the directory has nothing to offer.
 */
public record IdentityPolicy(
        Optional<String> domain,
        String fallbackGroup,
        String defaultIdentity,
        Map<String, String> tagAliases
) {
    public static final String DEFAULT_FALLBACK_GROUP = "AllEmployees";
    public static final String DEFAULT_IDENTITY = "Everyone";

    public IdentityPolicy {
        domain = domain == null ? Optional.empty() : domain.filter(value -> !value.isBlank());
        fallbackGroup = fallbackGroup == null || fallbackGroup.isBlank() ? DEFAULT_FALLBACK_GROUP : fallbackGroup;
        defaultIdentity = defaultIdentity == null || defaultIdentity.isBlank() ? DEFAULT_IDENTITY : defaultIdentity;
        Map<String, String> aliases = new LinkedHashMap<>();
        if (tagAliases != null) {
            tagAliases.forEach((tag, group) -> {
                if (tag != null && group != null && !group.isBlank()) {
                    aliases.put(normalize(tag), group);
                }
            });
        }
        tagAliases = Map.copyOf(aliases);
    }

    public static IdentityPolicy defaults() {
        return new IdentityPolicy(Optional.empty(), DEFAULT_FALLBACK_GROUP, DEFAULT_IDENTITY, Map.of());
    }

    /**
     * Maps an item tag to the directory group whose members may own the item.
     * Returns an empty string for tags that normalise to nothing.
     */
    public String groupFor(String tag) {
        String normalized = normalize(tag);
        if (normalized.isEmpty()) {
            return "";
        }
        return tagAliases.getOrDefault(normalized, normalized);
    }

    /**
     * Group keys a cache has to warm for the given tags, including the fallback group.
     */
    public Set<String> groupKeysFor(Collection<String> tags) {
        Set<String> keys = new LinkedHashSet<>();
        for (String tag : tags) {
            String group = groupFor(tag);
            if (!group.isEmpty()) {
                keys.add(group);
            }
        }
        keys.addAll(tagAliases.values());
        keys.add(fallbackGroup);
        return keys;
    }

    /**
     * Lower-cases and strips everything but letters and digits, so "Human Resources",
     * "human_resources" and "HUMAN-RESOURCES" all land on one key.
     */
    static String normalize(String tag) {
        if (tag == null) {
            return "";
        }
        StringBuilder builder = new StringBuilder(tag.length());
        for (int i = 0; i < tag.length(); i++) {
            char c = tag.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                builder.append(Character.toLowerCase(c));
            }
        }
        return builder.toString();
    }
}
