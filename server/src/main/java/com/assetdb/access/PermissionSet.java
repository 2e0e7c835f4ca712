package com.assetdb.access;

import com.google.common.base.MoreObjects;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * The permissions of one access group on one project, or the combination of several groups.
 *
 * <p>A permission set carries five folder dimensions, one per {@link AccessType}, two attribute
 * whitelists and an endpoint whitelist. Instances are immutable; combining produces a new set
 * (see {@link PermissionCombiner}).
 *
 * @param create folders the user may create entities in
 * @param read folders the user may read
 * @param update folders the user may update
 * @param delete folders the user may delete from
 * @param publish folders the user may publish versions into
 * @param attribRead attribute names the user may read
 * @param attribWrite attribute names the user may write
 * @param endpoints REST endpoint names the user may call
 */
public record PermissionSet(
    AccessScope<FolderAccessGrant> create,
    AccessScope<FolderAccessGrant> read,
    AccessScope<FolderAccessGrant> update,
    AccessScope<FolderAccessGrant> delete,
    AccessScope<FolderAccessGrant> publish,
    AccessScope<String> attribRead,
    AccessScope<String> attribWrite,
    AccessScope<String> endpoints) {

  private static final PermissionSet UNRESTRICTED =
      new PermissionSet(
          AccessScope.unrestricted(),
          AccessScope.unrestricted(),
          AccessScope.unrestricted(),
          AccessScope.unrestricted(),
          AccessScope.unrestricted(),
          AccessScope.unrestricted(),
          AccessScope.unrestricted(),
          AccessScope.unrestricted());

  public PermissionSet {
    Objects.requireNonNull(create, "create");
    Objects.requireNonNull(read, "read");
    Objects.requireNonNull(update, "update");
    Objects.requireNonNull(delete, "delete");
    Objects.requireNonNull(publish, "publish");
    Objects.requireNonNull(attribRead, "attribRead");
    Objects.requireNonNull(attribWrite, "attribWrite");
    Objects.requireNonNull(endpoints, "endpoints");
  }

  /** The permission set that restricts nothing. */
  @Nonnull
  public static PermissionSet unrestricted() {
    return UNRESTRICTED;
  }

  @Nonnull
  public static Builder builder() {
    return new Builder(UNRESTRICTED);
  }

  /** Returns the folder dimension for the given access type. */
  @Nonnull
  public AccessScope<FolderAccessGrant> folderAccess(@Nonnull AccessType accessType) {
    return switch (accessType) {
      case CREATE -> create;
      case READ -> read;
      case UPDATE -> update;
      case DELETE -> delete;
      case PUBLISH -> publish;
    };
  }

  public boolean canReadAttribute(String attributeName) {
    return attribRead.permits(attributeName);
  }

  public boolean canWriteAttribute(String attributeName) {
    return attribWrite.permits(attributeName);
  }

  public boolean canAccessEndpoint(String endpointName) {
    return endpoints.permits(endpointName);
  }

  /**
   * Unions this set with another, dimension by dimension. An unrestricted dimension on either
   * side yields an unrestricted dimension.
   */
  @Nonnull
  public PermissionSet union(@Nonnull PermissionSet other) {
    return new PermissionSet(
        create.union(other.create),
        read.union(other.read),
        update.union(other.update),
        delete.union(other.delete),
        publish.union(other.publish),
        attribRead.union(other.attribRead),
        attribWrite.union(other.attribWrite),
        endpoints.union(other.endpoints));
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("create", create)
        .add("read", read)
        .add("update", update)
        .add("delete", delete)
        .add("publish", publish)
        .add("attribRead", attribRead)
        .add("attribWrite", attribWrite)
        .add("endpoints", endpoints)
        .toString();
  }

  /** Builder starting from an existing set; unset dimensions keep their current value. */
  public static final class Builder {
    private AccessScope<FolderAccessGrant> create;
    private AccessScope<FolderAccessGrant> read;
    private AccessScope<FolderAccessGrant> update;
    private AccessScope<FolderAccessGrant> delete;
    private AccessScope<FolderAccessGrant> publish;
    private AccessScope<String> attribRead;
    private AccessScope<String> attribWrite;
    private AccessScope<String> endpoints;

    private Builder(PermissionSet base) {
      this.create = base.create;
      this.read = base.read;
      this.update = base.update;
      this.delete = base.delete;
      this.publish = base.publish;
      this.attribRead = base.attribRead;
      this.attribWrite = base.attribWrite;
      this.endpoints = base.endpoints;
    }

    public Builder folderAccess(AccessType accessType, AccessScope<FolderAccessGrant> scope) {
      switch (accessType) {
        case CREATE -> create = scope;
        case READ -> read = scope;
        case UPDATE -> update = scope;
        case DELETE -> delete = scope;
        case PUBLISH -> publish = scope;
      }
      return this;
    }

    public Builder attribRead(AccessScope<String> scope) {
      this.attribRead = scope;
      return this;
    }

    public Builder attribWrite(AccessScope<String> scope) {
      this.attribWrite = scope;
      return this;
    }

    public Builder endpoints(AccessScope<String> scope) {
      this.endpoints = scope;
      return this;
    }

    public PermissionSet build() {
      return new PermissionSet(
          create, read, update, delete, publish, attribRead, attribWrite, endpoints);
    }
  }
}
