/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.tunemerge.exception.TuneMergeException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.tunemerge.exception.CapabilityNotSupportedException} - Thrown when
 *       a caller asks a source for an operation it does not implement (or the source is not
 *       registered)</li>
 *   <li>{@link com.phillippitts.tunemerge.exception.SourceException} - Thrown by sources when a
 *       call against their catalog fails</li>
 * </ul>
 *
 * <p>Source implementations build their faults with
 * {@link com.phillippitts.tunemerge.exception.SourceExceptionBuilder}, which tags the source and
 * appends status, operation and request details to the message.
 *
 * <p>All exceptions are unchecked, support chaining via {@code cause}, and carry the source key
 * they relate to.
 *
 * @see com.phillippitts.tunemerge.exception.TuneMergeException
 * @since 1.0
 */
package com.phillippitts.tunemerge.exception;
