/**
 * In-memory artifact download.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.synthesis.adapter.inmemory.fetch;
