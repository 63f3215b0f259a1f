/**
 * Small helpers shared by the CLI and the copy workflow (error reporting, log masking).
 */
package io.github.yok.ssmmigrator.util;
