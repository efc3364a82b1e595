/**
 * PageKeys source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.pagekeys.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.pagekeys.identifier.IdentifierNormalizer} defines what a canonical identifier is.</li>
 *   <li>{@code io.pagekeys.runtime.PageService} serves reads and writes with rolling content migration.</li>
 *   <li>{@code io.pagekeys.sweep.ShadowingScanJob} finds pages stored under legacy keys.</li>
 * </ul>
 */
package io.pagekeys;
