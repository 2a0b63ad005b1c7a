/**
 * Byte-level transport ports used by operators that talk to networked
 * instruments. Framework types stay inside the adapter packages below this
 * one.
 */
package com.questrail.instrument.transport;
