/**
 * Per-group error tables.
 *
 * <p>Each subpackage contributes one {@link com.questrail.mcumgr.error.GroupErrorTable}
 * through {@code META-INF/services}. The request/response core never refers to
 * these classes directly; adding a group means adding a table and a service
 * entry, nothing else.</p>
 */
package com.questrail.mcumgr.group;
