/**
 * JDBC helpers for the tables the access engine reads.
 *
 * <p>Each table has a Java record class (e.g. {@code User}, {@code AccessGroupRecord}) and a
 * helper class with a plural name (e.g. {@code Users}, {@code AccessGroups}) providing static
 * methods that take an open {@link java.sql.Connection} and return {@code StatusOr<T>}.
 * {@code Hierarchy} queries the per-project folder tree.
 *
 * <p>Project tables live in a schema named {@code project_<name>}; project names are validated
 * before being written into query text, all other values are bound as parameters.
 */
package com.assetdb.db;
