/**
 * Persistence layer for users and lab report documents. SQLite-backed in
 * production, in-memory in TEST mode.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   DocumentService / AuthService
 *        │
 *        ▼
 *   DatabaseService    ← interface (PROD ↔ TEST swap via Guice)
 *    ┌───┴───┐
 *    │       │
 *  SqlDB   InMemoryDB
 * </pre>
 *
 * <h2>Database Schema</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ users                                                             │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ username (PK)    │ Login name                                     │
 * │ password_hash    │ BCrypt hash                                    │
 * │ created_at       │ Epoch millis                                   │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ lab_reports                                                       │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK)         │ UUID                                           │
 * │ number           │ e.g. "L1"                                      │
 * │ statement        │ Problem statement                              │
 * │ authors          │ Free-form author list                          │
 * │ created_by       │ FK → users.username                            │
 * │ created_at       │ Epoch millis                                   │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ questions                                                         │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK)         │ UUID                                           │
 * │ lab_report_id    │ FK → lab_reports.id                            │
 * │ number           │ e.g. "Q1"                                      │
 * │ statement        │ Question text                                  │
 * │ created_at       │ Epoch millis, ordering key                     │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ subtopics                                                         │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK)         │ UUID                                           │
 * │ question_id      │ FK → questions.id                              │
 * │ title            │ Required                                       │
 * │ procedures       │ '' when absent                                 │
 * │ explanation      │ '' when absent                                 │
 * │ citations        │ '' when absent                                 │
 * │ image_url        │ '' when absent                                 │
 * │ figure_description│ '' when absent                                │
 * │ created_at       │ Epoch millis, ordering key                     │
 * └──────────────────┴────────────────────────────────────────────────┘
 * </pre>
 *
 * Foreign keys carry no {@code ON DELETE CASCADE}. Deleting a report or a
 * question removes the dependent rows explicitly inside one transaction,
 * children first.
 *
 * <h2>Ordering</h2>
 * Questions and subtopics are returned {@code ORDER BY created_at, rowid}.
 * Two children created within the same millisecond keep their insertion
 * order.
 *
 * <h2>SQL File Inventory</h2>
 * All statements are externalized to {@code sql/*.sql} and loaded via
 * {@link de.bsommerfeld.labreport.db.SqlLoader}. Names follow
 * {@code <verb>-<entity>[-<scope>]}, e.g. {@code select-questions-for-report}
 * or {@code delete-subtopics-for-report}. The two {@code check-*-ancestry}
 * statements join up the hierarchy and return a row only when the addressed
 * chain exists.
 */
package de.bsommerfeld.labreport.db;
