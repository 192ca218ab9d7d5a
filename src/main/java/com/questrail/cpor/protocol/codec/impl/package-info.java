/**
 * Jackson CBOR implementations of the codec ports.
 *
 * <p>Nothing outside this package refers to Jackson types.</p>
 */
package com.questrail.cpor.protocol.codec.impl;
