/**
 * Event wire formatters. The XML stream and HEC formatters are independent and share no formatting code;
 * callers pick one statically.
 */
package ca.gc.cra.ingest.infrastructure.format;
