package com.example.bulkfile;

import com.example.bulkfile.directory.DirectoryCache;
import com.example.bulkfile.model.Identity;
import com.example.bulkfile.model.IdentitySource;
import com.example.bulkfile.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Picks an owner for each item from cached directory data only; a cache miss falls back to the
 * policy's group and then to its default identity, never to a live directory query.
 */
public final class IdentityAssigner {
    private static final Logger LOGGER = LoggerFactory.getLogger(IdentityAssigner.class);

    private final DirectoryCache cache;
    private final IdentityPolicy policy;

    public IdentityAssigner(DirectoryCache cache, IdentityPolicy policy) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public Identity assign(WorkItem item) {
        String group = policy.groupFor(item.tag());
        if (!group.isEmpty()) {
            Optional<String> member = cache.resolveRandomMember(group);
            if (member.isPresent()) {
                return new Identity(qualify(member.get()), IdentitySource.DIRECTORY);
            }
        }
        Optional<String> fallback = cache.resolveRandomMember(policy.fallbackGroup());
        if (fallback.isPresent()) {
            LOGGER.debug("No directory members for tag '{}'; using fallback group {}", item.tag(), policy.fallbackGroup());
            return new Identity(qualify(fallback.get()), IdentitySource.FALLBACK_GROUP);
        }
        LOGGER.debug("No directory data for tag '{}'; using default identity", item.tag());
        return new Identity(policy.defaultIdentity(), IdentitySource.DEFAULT);
    }

    private String qualify(String member) {
        if (member.indexOf('\\') >= 0 || member.indexOf('@') >= 0) {
            return member;
        }
        Optional<String> domain = cache.currentDomain().or(policy::domain);
        return domain.map(value -> value + "\\" + member).orElse(member);
    }
}
