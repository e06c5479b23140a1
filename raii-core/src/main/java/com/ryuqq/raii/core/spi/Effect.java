package com.ryuqq.raii.core.spi;

/**
 * A host-effect computation producing a value of type {@code A}.
 *
 * <p>Java has no higher-kinded types, so every host effect type is tagged with a
 * <em>witness</em> type {@code F} that the adapter owns. A computation of the host
 * {@code Task<A>} is then seen by the core as {@code Effect<Task.Witness, A>}, and the
 * capability interfaces in this package ({@link Applicative}, {@link Monad},
 * {@link MonadError}, {@link Nondeterminism}) only accept computations carrying the same
 * witness.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Exactly one concrete class per witness: adapters narrow an {@code Effect<F, A>}
 *       back to their own type with a cast</li>
 *   <li>The core never inspects a computation; it only hands it back to the capability
 *       that created it</li>
 * </ul>
 *
 * @param <F> witness type of the host effect
 * @param <A> result type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Effect<F, A> {
}
