/**
 * Radar Link Transport Ports
 * =============================================================================
 *
 * <p>Framework-agnostic boundary between a concrete networking implementation
 * (Netty TCP, a simulator, a test double) and the session wiring.</p>
 *
 * <p>Everything above the transport adapter sees only:</p>
 * <ul>
 *   <li>raw byte chunks as {@code byte[]}</li>
 *   <li>connection lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations of these ports:
 * <ul>
 *   <li>perform I/O only and never interpret messages</li>
 *   <li>never frame or decode</li>
 *   <li>never emit session events directly</li>
 *   <li>never reconnect, retry or schedule</li>
 * </ul>
 */
package com.questrail.radarlink.protocol.icd.transport;
