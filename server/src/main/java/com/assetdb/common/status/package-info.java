/**
 * Error handling for the access engine.
 *
 * <p>Access decisions never throw for expected outcomes. A resolution either yields a value or a
 * {@link com.assetdb.common.status.Status} whose {@link com.assetdb.common.status.StatusCode}
 * tells the request handler what to answer:
 *
 * <ul>
 *   <li>{@code PERMISSION_DENIED} - the user has no access; answer 403, do not retry</li>
 *   <li>{@code UNAVAILABLE} - the database could not be reached in time; answer 503</li>
 *   <li>{@code FAILED_PRECONDITION} - stored access group data is malformed</li>
 *   <li>{@code CANCELLED} - the owning request was cancelled mid-query</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 * StatusOr&lt;FolderAccess&gt; accessOr = request.resolveAccess("demo", AccessType.READ);
 * if (accessOr.isNotOk()) {
 *     Status error = accessOr.getStatus();
 *     ctx.status(error.getHttpCode());
 *     return;
 * }
 * AccessTrie trie = AccessTrie.build(accessOr.getValue());
 * </pre>
 */
package com.assetdb.common.status;
