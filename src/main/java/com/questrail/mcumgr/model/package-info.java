/**
 * SMP protocol model
 * =============================================================================
 *
 * <p>Value types shared by every layer: the 9-byte {@link
 * com.questrail.mcumgr.model.McuMgrHeader}, the version / operation / group
 * enumerations, the transport {@link com.questrail.mcumgr.model.McuMgrScheme}
 * and the decoded {@link com.questrail.mcumgr.model.McuMgrResponse}.</p>
 *
 * <p>Nothing here performs I/O or CBOR encoding. Byte-level mechanics live in
 * {@code com.questrail.mcumgr.codec}.</p>
 */
package com.questrail.mcumgr.model;
