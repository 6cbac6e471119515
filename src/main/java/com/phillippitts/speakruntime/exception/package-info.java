/**
 * Runtime exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.speakruntime.exception.SpeakRuntimeException} - Base exception
 *       for all runtime errors</li>
 *   <li>{@link com.phillippitts.speakruntime.exception.ResourceException} - Base for registry
 *       failures, carries the resource id:
 *     <ul>
 *       <li>{@code ResourceAlreadyRegisteredException}, {@code ResourceNotFoundException}</li>
 *       <li>{@code DependencyNotMetException} (lists the missing ids),
 *           {@code CircularDependencyException}</li>
 *       <li>{@code InvalidResourceStateException} (carries the actual state)</li>
 *       <li>{@code ResourceInitializationException}, {@code ResourceActivationException},
 *           {@code ResourceDisposalException} (wrap the hook's cause)</li>
 *       <li>{@code DisposalDepthExceededException} (lists the unresolved ids)</li>
 *     </ul>
 *   </li>
 *   <li>{@link com.phillippitts.speakruntime.exception.SnapshotStoreException} - Persistence
 *       boundary failures</li>
 * </ul>
 *
 * <p>Synchronous registry operations throw these directly. Asynchronous operations complete
 * their {@link java.util.concurrent.CompletableFuture} exceptionally with them. Nothing is
 * retried automatically.
 *
 * @since 1.0
 */
package com.phillippitts.speakruntime.exception;
