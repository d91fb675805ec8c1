/**
 * Interactive console around the sighting inference engine.
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.whalewatch.cli.WhaleWatchCli}: main entry point</li>
 * <li>{@link com.whalewatch.cli.InteractiveSession}: question flow with
 * retry loops</li>
 * <li>{@link com.whalewatch.cli.CliConfig}: environment-driven
 * settings</li>
 * <li>{@link com.whalewatch.cli.ReportWriter}: JSON session report</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.whalewatch.cli;
