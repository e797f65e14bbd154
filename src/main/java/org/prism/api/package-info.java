/**
 * Command-line entry points: the {@code prism} dispatcher and the convert, aggregate and validate-labels
 * subcommands, with their argument parsing and exit codes.
 */
package org.prism.api;
