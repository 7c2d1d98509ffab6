/**
 * Protobuf wire-format implementation of the WireCalc codec ports.
 *
 * <p>Field numbering is confined to {@code WireSchema}; nothing outside this
 * package depends on it.</p>
 */
package com.questrail.wirecalc.protocol.codec.impl;
