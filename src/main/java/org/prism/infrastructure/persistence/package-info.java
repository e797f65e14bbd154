/**
 * Persistence adapters for transcripts and discussion sets: NDJSON, script text, per-document JSONL files and the
 * combined JSON array. JSON is produced with Jackson's streaming {@code JsonGenerator}.
 *
 * @since 0.1.0
 */
package org.prism.infrastructure.persistence;
