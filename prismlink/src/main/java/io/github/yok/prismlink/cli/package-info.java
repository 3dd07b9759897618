/**
 * Command-line parsing and dispatch.
 */
package io.github.yok.prismlink.cli;
