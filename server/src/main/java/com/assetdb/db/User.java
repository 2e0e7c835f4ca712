package com.assetdb.db;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;

/**
 * Represents a row in the 'users' table. The flags and access group assignments are stored in
 * the row's {@code data} JSONB document.
 *
 * @param name The unique login name
 * @param active Whether the user may log in
 * @param admin The {@code isAdmin} flag
 * @param manager The {@code isManager} flag
 * @param service The {@code isService} flag (API keys of integrations)
 * @param guest The {@code isGuest} flag
 * @param accessGroups Access group names per project name
 * @param defaultAccessGroups Access groups applied when no project is given
 */
public record User(
        String name,
        boolean active,
        boolean admin,
        boolean manager,
        boolean service,
        boolean guest,
        Map<String, List<String>> accessGroups,
        List<String> defaultAccessGroups
) {
    public User {
        accessGroups = accessGroups == null ? ImmutableMap.of() : ImmutableMap.copyOf(accessGroups);
        defaultAccessGroups = defaultAccessGroups == null
                ? ImmutableList.of()
                : ImmutableList.copyOf(defaultAccessGroups);
    }
}
