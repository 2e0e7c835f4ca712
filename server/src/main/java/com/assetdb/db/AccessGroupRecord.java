package com.assetdb.db;

/**
 * Represents a row of an 'access_groups' table. Global groups live in {@code public} and use the
 * project name {@code "_"}; project overrides live in the project's schema.
 *
 * @param name The access group name
 * @param projectName The owning project, or {@code "_"} for a global group
 * @param data The permissions document as stored (JSON text)
 */
public record AccessGroupRecord(String name, String projectName, String data) {

    /** Project name of global access groups. */
    public static final String GLOBAL = "_";

    public boolean isGlobal() {
        return GLOBAL.equals(projectName);
    }
}
