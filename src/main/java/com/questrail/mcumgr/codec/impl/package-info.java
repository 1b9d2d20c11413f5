/**
 * Default codec implementations.
 *
 * <p>Not part of the stable surface; construct through the interfaces in
 * {@code com.questrail.mcumgr.codec}.</p>
 */
package com.questrail.mcumgr.codec.impl;
