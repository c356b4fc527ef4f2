/**
 * Datatracker client: the {@link io.ietfdata.client.Datatracker} facade, the
 * {@link io.ietfdata.client.ResourceClient} that performs single fetches, and the lazy
 * {@link io.ietfdata.client.PaginatedSequence} that follows {@code next} cursors.
 */
package io.ietfdata.client;
