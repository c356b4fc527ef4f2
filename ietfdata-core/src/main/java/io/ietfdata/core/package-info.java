/**
 * Library-neutral core of the Datatracker client.
 *
 * <p>This module has no third-party dependencies. It contains only:
 * <ul>
 *   <li>Typed resource references ({@link io.ietfdata.core.ResourceUri} and one subclass per kind)</li>
 *   <li>Immutable entity records grouped by resource family</li>
 *   <li>API constants, URL building and timestamp helpers</li>
 *   <li>The {@link io.ietfdata.core.DatatrackerException} hierarchy</li>
 * </ul>
 *
 * <p>HTTP and JSON bindings live in other modules.
 */
package io.ietfdata.core;
